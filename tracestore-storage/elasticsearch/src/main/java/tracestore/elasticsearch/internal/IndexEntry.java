/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import com.google.auto.value.AutoValue;

/**
 * One document to index, along with the writer that serializes it. Serialization is deferred
 * until the request body is written.
 */
@AutoValue
public abstract class IndexEntry<T> {
  public static <T> IndexEntry<T> create(String index, String typeName, T input,
    BulkIndexWriter<T> writer) {
    return new AutoValue_IndexEntry<>(index, typeName, input, writer);
  }

  public abstract String index();

  /** Discriminates span documents from service documents, ex "span" or "service" */
  public abstract String typeName();

  public abstract T input();

  public abstract BulkIndexWriter<T> writer();

  IndexEntry() {
  }
}
