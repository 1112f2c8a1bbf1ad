/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.metrics;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public final class InMemoryStorageMetrics implements StorageMetrics {

  final ConcurrentHashMap<String, AtomicInteger> metrics;
  final String attempts, inserts, errors;

  public InMemoryStorageMetrics() {
    this(new ConcurrentHashMap<>(), null);
  }

  InMemoryStorageMetrics(ConcurrentHashMap<String, AtomicInteger> metrics, String operation) {
    this.metrics = metrics;
    this.attempts = scope("attempts", operation);
    this.inserts = scope("inserts", operation);
    this.errors = scope("errors", operation);
  }

  @Override public InMemoryStorageMetrics forOperation(String operation) {
    if (operation == null) throw new NullPointerException("operation == null");
    return new InMemoryStorageMetrics(metrics, operation);
  }

  @Override public void incrementAttempts() {
    increment(attempts);
  }

  public int attempts() {
    return get(attempts);
  }

  @Override public void incrementInserts() {
    increment(inserts);
  }

  public int inserts() {
    return get(inserts);
  }

  @Override public void incrementErrors() {
    increment(errors);
  }

  public int errors() {
    return get(errors);
  }

  public void clear() {
    metrics.clear();
  }

  int get(String key) {
    AtomicInteger atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  void increment(String key) {
    metrics.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }

  static String scope(String key, String operation) {
    return operation == null ? key : operation + "." + key;
  }

  @Override public String toString() {
    return "InMemoryStorageMetrics{" + metrics + "}";
  }
}
