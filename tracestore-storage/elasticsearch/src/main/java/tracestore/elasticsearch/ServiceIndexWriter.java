/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import tracestore.elasticsearch.internal.BulkIndexWriter;
import tracestore.elasticsearch.internal.IndexEntry;
import tracestore.elasticsearch.internal.SpanDocument;
import tracestore.internal.WriteCache;
import zipkin2.Call;
import zipkin2.Callback;

/**
 * Records which service and operation names exist, so they can be listed without scanning spans.
 * The same pair is written at most once per index within the cache TTL.
 *
 * <p>Writes are best-effort. The cache is marked whether or not the write succeeds, bounding the
 * load a struggling cluster sees from retries. A lost write is repaired by the next span with the
 * same names once the entry expires.
 */
final class ServiceIndexWriter {
  static final String TYPE_SERVICE = "service";

  final ElasticsearchClient client;
  final WriteCache<List<String>> cache;
  final Logger logger;

  ServiceIndexWriter(ElasticsearchClient client, WriteCache<List<String>> cache) {
    this(client, cache, Logger.getLogger(ServiceIndexWriter.class.getName()));
  }

  ServiceIndexWriter(ElasticsearchClient client, WriteCache<List<String>> cache,
    Logger logger) {
    this.client = client;
    this.cache = cache;
    this.logger = logger;
  }

  /** Writes the service and operation of the document to the index, unless recently written. */
  void write(String index, SpanDocument document) {
    List<String> key = fingerprint(index, document);
    if (cache.contains(key)) return;
    try {
      Call<Void> call = client.index(
        IndexEntry.create(index, TYPE_SERVICE, document, BulkIndexWriter.SERVICE));
      call.enqueue(new LogOnError(logger, index, document));
    } catch (RuntimeException e) {
      Call.propagateIfFatal(e);
      logFailure(logger, index, document, e);
    } finally {
      cache.mark(key);
    }
  }

  /** Keys on the names themselves: a hash collision must never suppress a write. */
  static List<String> fingerprint(String index, SpanDocument document) {
    return Arrays.asList(index, document.serviceName(), document.operationName());
  }

  static void logFailure(Logger logger, String index, SpanDocument document, Throwable t) {
    if (!logger.isLoggable(Level.FINE)) return;
    logger.log(Level.FINE, "failed to write service " + document.serviceName()
      + " operation " + document.operationName() + " to " + index, t);
  }

  static final class LogOnError implements Callback<Void> {
    final Logger logger;
    final String index;
    final SpanDocument document;

    LogOnError(Logger logger, String index, SpanDocument document) {
      this.logger = logger;
      this.index = index;
      this.document = document;
    }

    @Override public void onSuccess(Void value) {
    }

    @Override public void onError(Throwable t) {
      logFailure(logger, index, document, t);
    }

    @Override public String toString() {
      return "LogOnError{index=" + index + "}";
    }
  }

  @Override public String toString() {
    return "ServiceIndexWriter{" + cache + "}";
  }
}
