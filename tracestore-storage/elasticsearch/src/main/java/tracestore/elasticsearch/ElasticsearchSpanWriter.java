/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import tracestore.elasticsearch.internal.BulkIndexWriter;
import tracestore.elasticsearch.internal.IndexEntry;
import tracestore.elasticsearch.internal.SpanDocument;
import tracestore.elasticsearch.internal.SpanDocumentConverter;
import tracestore.internal.WriteCache;
import tracestore.metrics.StorageMetrics;
import tracestore.storage.SpanWriter;
import zipkin2.Call;
import zipkin2.Callback;
import zipkin2.Span;
import zipkin2.internal.Nullable;

/**
 * Writes spans into the index chosen by the {@link IndexNameResolver}, along with the service and
 * operation names of each span when the mode has a service index.
 *
 * <p>The returned call reflects the span documents only, sent in one bulk request. Service
 * metadata is written on the side: its failures are logged and never fail the call, so a caller
 * can't tell a lost metadata write from a successful one.
 *
 * <p>When {@code indexCache} is present and names are dated, each index seen for the first time is
 * created before the bulk request. An index is only remembered once its create succeeds, so the
 * next span for an index that wasn't created retries.
 */
final class ElasticsearchSpanWriter implements SpanWriter {
  static final String TYPE_SPAN = "span";
  static final String INDEX_CREATE = "index_create";

  final ElasticsearchClient client;
  final IndexNameResolver indexNameResolver;
  final SpanDocumentConverter converter;
  final ServiceIndexWriter serviceIndexWriter;
  @Nullable final WriteCache<String> indexCache;
  final StorageMetrics indexCreateMetrics;
  final Logger logger;

  ElasticsearchSpanWriter(ElasticsearchClient client, IndexNameResolver indexNameResolver,
    SpanDocumentConverter converter, ServiceIndexWriter serviceIndexWriter,
    @Nullable WriteCache<String> indexCache, StorageMetrics metrics) {
    this(client, indexNameResolver, converter, serviceIndexWriter, indexCache, metrics,
      Logger.getLogger(ElasticsearchSpanWriter.class.getName()));
  }

  ElasticsearchSpanWriter(ElasticsearchClient client, IndexNameResolver indexNameResolver,
    SpanDocumentConverter converter, ServiceIndexWriter serviceIndexWriter,
    @Nullable WriteCache<String> indexCache, StorageMetrics metrics, Logger logger) {
    this.client = client;
    this.indexNameResolver = indexNameResolver;
    this.converter = converter;
    this.serviceIndexWriter = serviceIndexWriter;
    // aliases and archive indices are managed outside this process
    this.indexCache = indexNameResolver.mode() == IndexingMode.DATED ? indexCache : null;
    this.indexCreateMetrics = metrics.forOperation(INDEX_CREATE);
    this.logger = logger;
  }

  @Override public Call<Void> accept(List<Span> spans) {
    if (spans.isEmpty()) return Call.create(null);

    List<IndexEntry<?>> entries = new ArrayList<>(spans.size());
    Set<String> indicesToCreate = new LinkedHashSet<>();
    for (Span span : spans) {
      IndexNames indexNames = indexNameResolver.resolve(indexTimestamp(span));
      SpanDocument document = converter.convert(span);
      if (indexNames.hasServiceIndex()) {
        maybeCreateIndex(indicesToCreate, indexNames.serviceIndex());
        writeService(indexNames.serviceIndex(), document);
      }
      maybeCreateIndex(indicesToCreate, indexNames.spanIndex());
      entries.add(IndexEntry.create(indexNames.spanIndex(), TYPE_SPAN, document,
        BulkIndexWriter.SPAN));
    }

    Call<Void> result = client.bulk(entries);

    // chain backwards so that indices are created in the order seen, then the bulk request runs
    List<String> indices = new ArrayList<>(indicesToCreate);
    for (int i = indices.size() - 1; i >= 0; i--) {
      Call<Void> next = result;
      result = new CreateIndexCall(this, indices.get(i), client.createIndex(indices.get(i)))
        .flatMap(v -> next.clone());
    }
    return result;
  }

  // Only marked once created, so a canceled, dropped or failed call leaves the index to retry.
  // Concurrent writers may both create the same index, which succeeds as it already exists.
  void maybeCreateIndex(Set<String> indicesToCreate, String index) {
    if (indexCache == null || indexCache.contains(index)) return;
    indicesToCreate.add(index);
  }

  void writeService(String serviceIndex, SpanDocument document) {
    try {
      serviceIndexWriter.write(serviceIndex, document);
    } catch (RuntimeException e) {
      Call.propagateIfFatal(e);
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "failed to write service metadata to " + serviceIndex, e);
      }
    }
  }

  /** Returns the epoch milliseconds that decide which dated index a span belongs to. */
  static long indexTimestamp(Span span) {
    if (span.timestampAsLong() != 0L) return span.timestampAsLong() / 1000L;
    // Any annotation is better than the current time when choosing the index.
    if (!span.annotations().isEmpty()) return span.annotations().get(0).timestamp() / 1000L;
    return System.currentTimeMillis();
  }

  void onCreateIndex(String index) {
    indexCreateMetrics.incrementInserts();
    indexCache.mark(index);
  }

  void onCreateIndexError(String index, Throwable error) {
    indexCreateMetrics.incrementErrors();
    logger.log(Level.WARNING, "failed to create index " + index + ": " + error.getMessage());
  }

  @Override public void close() {
    client.close();
  }

  @Override public String toString() {
    return "ElasticsearchSpanWriter{" + indexNameResolver + "}";
  }

  /** Counts a create-index request, remembering the index on success and logging failure. */
  static final class CreateIndexCall extends Call.Base<Void> {
    final ElasticsearchSpanWriter writer;
    final String index;
    final Call<Void> delegate;

    CreateIndexCall(ElasticsearchSpanWriter writer, String index, Call<Void> delegate) {
      this.writer = writer;
      this.index = index;
      this.delegate = delegate;
    }

    @Override protected Void doExecute() throws IOException {
      writer.indexCreateMetrics.incrementAttempts();
      try {
        delegate.execute();
      } catch (IOException | RuntimeException | Error e) {
        Call.propagateIfFatal(e);
        writer.onCreateIndexError(index, e);
        throw e;
      }
      writer.onCreateIndex(index);
      return null;
    }

    @Override protected void doEnqueue(Callback<Void> callback) {
      writer.indexCreateMetrics.incrementAttempts();
      delegate.enqueue(new Callback<Void>() {
        @Override public void onSuccess(Void value) {
          writer.onCreateIndex(index);
          callback.onSuccess(value);
        }

        @Override public void onError(Throwable t) {
          writer.onCreateIndexError(index, t);
          callback.onError(t);
        }
      });
    }

    @Override protected void doCancel() {
      delegate.cancel();
    }

    @Override public CreateIndexCall clone() {
      return new CreateIndexCall(writer, index, delegate.clone());
    }

    @Override public String toString() {
      return "CreateIndexCall{" + index + "}";
    }
  }
}
