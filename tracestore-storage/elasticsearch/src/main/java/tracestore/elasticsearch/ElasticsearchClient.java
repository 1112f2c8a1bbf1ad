/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.io.Closeable;
import java.util.List;
import tracestore.elasticsearch.internal.IndexEntry;
import zipkin2.Call;

import static java.util.Collections.singletonList;

/**
 * The operations the write path needs from Elasticsearch. Connection management, retries and
 * serialization over the wire belong to the implementation.
 *
 * <p>Each method prepares a {@link Call} without performing I/O. Nothing is sent until the call
 * is executed or enqueued.
 */
public interface ElasticsearchClient extends Closeable {

  /** Installs or overwrites the legacy index template of the given name. */
  Call<Void> putTemplate(String name, String body);

  /** Creates the index. An index that already exists is not an error. */
  Call<Void> createIndex(String index);

  /** Indexes all entries in one bulk request. Any entry failing fails the call. */
  Call<Void> bulk(List<IndexEntry<?>> entries);

  default Call<Void> index(IndexEntry<?> entry) {
    return bulk(singletonList(entry));
  }

  /** Releases connections. Calls in flight may fail afterwards. */
  @Override void close();
}
