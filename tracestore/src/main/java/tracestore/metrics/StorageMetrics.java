/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.metrics;

/**
 * Storage components increment these counters around writes that change the shape of the store,
 * such as installing index templates or creating indices. A typical implementation reports to a
 * telemetry system.
 *
 * <h3>Key Relationships</h3>
 *
 * <p>Every attempt ends in exactly one insert or one error. Attempts minus inserts minus errors
 * is the number of writes in flight. Alert when errors grow while inserts do not.
 */
public interface StorageMetrics {

  /**
   * Those who wish to partition metrics by operation can call this method to include the operation
   * in the backend metric key.
   *
   * <p>For example, when {@code metrics.forOperation("index_create")} is called, attempts would
   * report to a key like "index_create.attempts".
   *
   * @param operation ex "index_create"
   */
  StorageMetrics forOperation(String operation);

  /** Increments the count of writes issued to the store. */
  void incrementAttempts();

  /** Increments the count of writes the store acknowledged. */
  void incrementInserts();

  /** Increments the count of writes that failed for any reason. */
  void incrementErrors();

  StorageMetrics NOOP_METRICS = new StorageMetrics() {

    @Override public StorageMetrics forOperation(String operation) {
      return this;
    }

    @Override public void incrementAttempts() {
    }

    @Override public void incrementInserts() {
    }

    @Override public void incrementErrors() {
    }

    @Override public String toString() {
      return "NoOpStorageMetrics";
    }
  };
}
