/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.client.endpoint.EndpointGroup;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import tracestore.elasticsearch.internal.SpanDocumentConverter;
import tracestore.internal.WriteCache;
import tracestore.metrics.StorageMetrics;
import tracestore.storage.SpanWriter;

/**
 * Configures writes of spans into Elasticsearch. Settings are fixed once built: each {@link
 * #spanWriter()} shares the same client, index naming and templates.
 */
@AutoValue
public abstract class ElasticsearchStorage implements Closeable {
  static final long DEFAULT_SERVICE_CACHE_TTL = TimeUnit.HOURS.toMillis(12);
  static final long DEFAULT_INDEX_CACHE_TTL = TimeUnit.HOURS.toMillis(48);
  static final int SERVICE_CACHE_SIZE = 100_000, INDEX_CACHE_SIZE = 5;

  /**
   * This defers creation of an {@link WebClient}. This is needed because routinely, I/O occurs in
   * constructors and this can delay or cause startup to crash. For example, an underlying {@link
   * EndpointGroup} could be delayed due to DNS, implicit api calls or health checks.
   */
  public interface LazyHttpClient extends Supplier<WebClient>, Closeable {
    /**
     * Lazily creates an instance of the http client configured to the correct elasticsearch host or
     * cluster. The same value should always be returned.
     */
    @Override WebClient get();

    @Override default void close() {
    }

    /** This should return the initial endpoints in a single-string without resolving them. */
    @Override String toString();
  }

  /** The lazy http client supplier will be closed on {@link #close()} */
  public static Builder newBuilder(LazyHttpClient lazyHttpClient) {
    return new AutoValue_ElasticsearchStorage.Builder()
      .lazyHttpClient(lazyHttpClient)
      .index("")
      .spanIndexDateLayout(IndexNameResolver.DEFAULT_DATE_LAYOUT)
      .serviceIndexDateLayout(IndexNameResolver.DEFAULT_DATE_LAYOUT)
      .allTagsAsFields(false)
      .tagKeysAsFields(Collections.emptyList())
      .tagDotReplacement("@")
      .archive(false)
      .useReadWriteAliases(false)
      .serviceCacheTtl(DEFAULT_SERVICE_CACHE_TTL)
      .indexCacheTtl(DEFAULT_INDEX_CACHE_TTL)
      .indexShards(5)
      .indexReplicas(1)
      .ensureTemplates(true)
      .ensureIndices(false)
      .legacyDocumentTypes(false)
      .metrics(StorageMetrics.NOOP_METRICS);
  }

  @AutoValue.Builder
  public abstract static class Builder {

    /**
     * The prefix of all index and template names. Defaults to empty. A hyphen is appended unless
     * present, ex. "prod" results in indices like "prod-tracestore-span-2019-05-03".
     */
    public abstract Builder index(String index);

    /**
     * The {@link java.text.SimpleDateFormat} pattern of dated span indices, formatted in UTC.
     * Defaults to "yyyy-MM-dd". The pattern is not checked for sense: "yyyy-MM-DD" uses the day
     * of the year.
     */
    public abstract Builder spanIndexDateLayout(String spanIndexDateLayout);

    /** Like {@link #spanIndexDateLayout(String)}, but for service indices. */
    public abstract Builder serviceIndexDateLayout(String serviceIndexDateLayout);

    /** True writes all span and process tags as fields, searchable by name. Defaults to false. */
    public abstract Builder allTagsAsFields(boolean allTagsAsFields);

    /** Tag keys to write as fields, when not {@link #allTagsAsFields(boolean)}. */
    public abstract Builder tagKeysAsFields(List<String> tagKeysAsFields);

    /** Replaces dots in tag keys written as fields. Defaults to "@". */
    public abstract Builder tagDotReplacement(String tagDotReplacement);

    /** True writes to the archive index and skips service metadata. Defaults to false. */
    public abstract Builder archive(boolean archive);

    /**
     * True writes to fixed aliases, leaving rollover of the indices behind them to an external
     * process. Defaults to false.
     */
    public abstract Builder useReadWriteAliases(boolean useReadWriteAliases);

    /**
     * How long in milliseconds a service and operation pair is not rewritten to the same index.
     * Defaults to 12 hours. Values of zero or less select the default.
     */
    public abstract Builder serviceCacheTtl(long serviceCacheTtl);

    /**
     * How long in milliseconds an index is considered created, when {@link
     * #ensureIndices(boolean)}. Defaults to 48 hours. Values of zero or less select the default.
     */
    public abstract Builder indexCacheTtl(long indexCacheTtl);

    /** The number of shards of new indices. Defaults to 5. */
    public abstract Builder indexShards(int indexShards);

    /** The number of replica copies of each shard. Defaults to 1. */
    public abstract Builder indexReplicas(int indexReplicas);

    /** False disables automatic index template installation. */
    public abstract Builder ensureTemplates(boolean ensureTemplates);

    /**
     * True creates each dated index before its first write, instead of relying on automatic
     * index creation. Ignored for aliases and the archive. Defaults to false.
     */
    public abstract Builder ensureIndices(boolean ensureIndices);

    /** True writes the document type, needed before Elasticsearch 7. Defaults to false. */
    public abstract Builder legacyDocumentTypes(boolean legacyDocumentTypes);

    public abstract Builder metrics(StorageMetrics metrics);

    public final ElasticsearchStorage build() {
      // each TTL is defaulted independently
      if (serviceCacheTtl() <= 0L) serviceCacheTtl(DEFAULT_SERVICE_CACHE_TTL);
      if (indexCacheTtl() <= 0L) indexCacheTtl(DEFAULT_INDEX_CACHE_TTL);
      return autoBuild();
    }

    abstract Builder lazyHttpClient(LazyHttpClient lazyHttpClient);

    abstract long serviceCacheTtl();

    abstract long indexCacheTtl();

    abstract ElasticsearchStorage autoBuild();

    Builder() {
    }
  }

  abstract LazyHttpClient lazyHttpClient();

  public abstract String index();

  public abstract String spanIndexDateLayout();

  public abstract String serviceIndexDateLayout();

  public abstract boolean allTagsAsFields();

  public abstract List<String> tagKeysAsFields();

  public abstract String tagDotReplacement();

  public abstract boolean archive();

  public abstract boolean useReadWriteAliases();

  public abstract long serviceCacheTtl();

  public abstract long indexCacheTtl();

  public abstract int indexShards();

  public abstract int indexReplicas();

  public abstract boolean ensureTemplates();

  public abstract boolean ensureIndices();

  public abstract boolean legacyDocumentTypes();

  public abstract StorageMetrics metrics();

  /**
   * Returns a new writer, after installing the index templates when {@link #ensureTemplates()}.
   * Writers share the client: closing one closes this storage.
   */
  public SpanWriter spanWriter() {
    ensureIndexTemplates();
    WriteCache<List<String>> serviceCache = WriteCache.newBuilder()
      .ttl(serviceCacheTtl(), TimeUnit.MILLISECONDS)
      .maximumSize(SERVICE_CACHE_SIZE)
      .build();
    WriteCache<String> indexCache = null;
    if (ensureIndices()) {
      indexCache = WriteCache.newBuilder()
        .ttl(indexCacheTtl(), TimeUnit.MILLISECONDS)
        .maximumSize(INDEX_CACHE_SIZE)
        .build();
    }
    return new ElasticsearchSpanWriter(client(), indexNameResolver(), converter(),
      new ServiceIndexWriter(client(), serviceCache), indexCache, metrics());
  }

  public TemplateBootstrapper templateBootstrapper() {
    return new TemplateBootstrapper(client(), metrics());
  }

  @Memoized public IndexNameResolver indexNameResolver() {
    return IndexNameResolver.create(IndexingMode.of(archive(), useReadWriteAliases()), index(),
      spanIndexDateLayout(), serviceIndexDateLayout());
  }

  @Memoized public IndexTemplates indexTemplates() {
    return IndexTemplates.create(index(), indexShards(), indexReplicas(), legacyDocumentTypes());
  }

  @Memoized SpanDocumentConverter converter() {
    return new SpanDocumentConverter(allTagsAsFields(), tagKeysAsFields(), tagDotReplacement());
  }

  @Memoized ElasticsearchClient client() {
    return new HttpElasticsearchClient(lazyHttpClient(), legacyDocumentTypes());
  }

  volatile boolean ensuredTemplates;

  // synchronized since we don't want overlapping calls to apply the index templates
  void ensureIndexTemplates() {
    if (ensuredTemplates) return;
    if (!ensureTemplates()) {
      ensuredTemplates = true;
      return;
    }
    synchronized (this) {
      if (ensuredTemplates) return;
      IndexTemplates templates = indexTemplates();
      try {
        templateBootstrapper().createTemplates(templates.span(), templates.service(), index());
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      ensuredTemplates = true;
    }
  }

  @Override public final String toString() {
    return "ElasticsearchStorage{initialEndpoints=" + lazyHttpClient()
      + ", index=" + index() + "}";
  }

  @Override public void close() {
    lazyHttpClient().close();
  }

  ElasticsearchStorage() {
  }
}
