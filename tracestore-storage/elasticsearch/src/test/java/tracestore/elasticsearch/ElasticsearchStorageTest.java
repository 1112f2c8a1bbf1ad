/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.testing.junit5.server.mock.MockWebServerExtension;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import tracestore.metrics.InMemoryStorageMetrics;
import tracestore.storage.SpanWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tracestore.elasticsearch.TestObjects.CLIENT_SPAN;

class ElasticsearchStorageTest {
  static final AggregatedHttpResponse SUCCESS_RESPONSE = AggregatedHttpResponse.of(HttpStatus.OK);
  static final AggregatedHttpResponse BULK_SUCCESS = AggregatedHttpResponse.of(HttpStatus.OK,
    MediaType.JSON_UTF_8, "{\"took\":1,\"errors\":false,\"items\":[]}");

  @RegisterExtension static MockWebServerExtension server = new MockWebServerExtension();

  ElasticsearchStorage storage = ElasticsearchStorage.newBuilder(
    () -> WebClient.of(server.httpUri())).build();

  @AfterEach void tearDown() {
    storage.close();
  }

  @Test void defaults() {
    assertThat(storage.index()).isEmpty();
    assertThat(storage.spanIndexDateLayout()).isEqualTo("yyyy-MM-dd");
    assertThat(storage.serviceIndexDateLayout()).isEqualTo("yyyy-MM-dd");
    assertThat(storage.allTagsAsFields()).isFalse();
    assertThat(storage.tagKeysAsFields()).isEmpty();
    assertThat(storage.tagDotReplacement()).isEqualTo("@");
    assertThat(storage.archive()).isFalse();
    assertThat(storage.useReadWriteAliases()).isFalse();
    assertThat(storage.serviceCacheTtl()).isEqualTo(TimeUnit.HOURS.toMillis(12));
    assertThat(storage.indexCacheTtl()).isEqualTo(TimeUnit.HOURS.toMillis(48));
    assertThat(storage.indexShards()).isEqualTo(5);
    assertThat(storage.indexReplicas()).isEqualTo(1);
    assertThat(storage.ensureTemplates()).isTrue();
    assertThat(storage.ensureIndices()).isFalse();
    assertThat(storage.legacyDocumentTypes()).isFalse();
    assertThat(storage.indexNameResolver().mode()).isEqualTo(IndexingMode.DATED);
  }

  @Test void ttlDefaultsAreIndependent() {
    storage = ElasticsearchStorage.newBuilder(() -> WebClient.of(server.httpUri()))
      .serviceCacheTtl(0L)
      .indexCacheTtl(1000L)
      .build();

    assertThat(storage.serviceCacheTtl()).isEqualTo(TimeUnit.HOURS.toMillis(12));
    assertThat(storage.indexCacheTtl()).isEqualTo(1000L);

    storage = ElasticsearchStorage.newBuilder(() -> WebClient.of(server.httpUri()))
      .serviceCacheTtl(1000L)
      .indexCacheTtl(-1L)
      .build();

    assertThat(storage.serviceCacheTtl()).isEqualTo(1000L);
    assertThat(storage.indexCacheTtl()).isEqualTo(TimeUnit.HOURS.toMillis(48));
  }

  @Test void indexingMode() {
    storage = ElasticsearchStorage.newBuilder(() -> WebClient.of(server.httpUri()))
      .archive(true)
      .useReadWriteAliases(true)
      .index("prod")
      .build();

    assertThat(storage.indexNameResolver().mode()).isEqualTo(IndexingMode.ARCHIVE_ALIAS);
    assertThat(storage.indexNameResolver().resolve(0L).spanIndex())
      .isEqualTo("prod-tracestore-span-archive-write");
  }

  @Test void spanWriter_installsTemplatesOnce() throws Exception {
    server.enqueue(SUCCESS_RESPONSE);
    server.enqueue(SUCCESS_RESPONSE);

    storage.spanWriter();
    storage.spanWriter();

    AggregatedHttpRequest span = server.takeRequest().request();
    assertThat(span.path()).isEqualTo("/_template/tracestore-span");
    assertThat(span.contentUtf8()).isEqualTo(storage.indexTemplates().span());
    AggregatedHttpRequest service = server.takeRequest().request();
    assertThat(service.path()).isEqualTo("/_template/tracestore-service");
    assertThat(service.contentUtf8()).isEqualTo(storage.indexTemplates().service());
    assertThat(server.takeRequest(100, TimeUnit.MILLISECONDS)).isNull();
  }

  @Test void spanWriter_templateFailureIsRetried() throws Exception {
    server.enqueue(AggregatedHttpResponse.of(HttpStatus.FORBIDDEN, MediaType.JSON_UTF_8,
      "{\"error\":{\"reason\":\"action [indices:admin/template/put] is unauthorized\"}}"));

    assertThatThrownBy(storage::spanWriter)
      .isInstanceOf(RuntimeException.class)
      .hasMessage("action [indices:admin/template/put] is unauthorized");
    assertThat(server.takeRequest().request().path()).isEqualTo("/_template/tracestore-span");

    server.enqueue(SUCCESS_RESPONSE);
    server.enqueue(SUCCESS_RESPONSE);
    storage.spanWriter();

    assertThat(server.takeRequest().request().path()).isEqualTo("/_template/tracestore-span");
    assertThat(server.takeRequest().request().path()).isEqualTo("/_template/tracestore-service");
  }

  @Test void spanWriter_ensureTemplatesFalse() {
    AtomicBoolean created = new AtomicBoolean();
    storage = ElasticsearchStorage.newBuilder(() -> {
      created.set(true);
      return WebClient.of(server.httpUri());
    }).ensureTemplates(false).build();

    storage.spanWriter();

    assertThat(created).isFalse();
  }

  @Test void templateMetrics() {
    InMemoryStorageMetrics metrics = new InMemoryStorageMetrics();
    storage = ElasticsearchStorage.newBuilder(() -> WebClient.of(server.httpUri()))
      .metrics(metrics)
      .build();
    server.enqueue(SUCCESS_RESPONSE);
    server.enqueue(SUCCESS_RESPONSE);

    storage.spanWriter();

    assertThat(metrics.forOperation("index_create").inserts()).isEqualTo(2);
  }

  @Test void writeSpan() throws Exception {
    server.enqueue(SUCCESS_RESPONSE);
    server.enqueue(SUCCESS_RESPONSE);
    SpanWriter writer = storage.spanWriter();
    server.takeRequest();
    server.takeRequest();

    server.enqueue(BULK_SUCCESS); // service
    server.enqueue(BULK_SUCCESS); // span
    writer.writeSpan(CLIENT_SPAN).execute();

    List<String> bodies = new ArrayList<>();
    bodies.add(server.takeRequest().request().contentUtf8());
    bodies.add(server.takeRequest().request().contentUtf8());
    assertThat(bodies).anySatisfy(body -> assertThat(body)
      .startsWith("{\"index\":{\"_index\":\"tracestore-span-2019-05-03\""));
    assertThat(bodies).anySatisfy(body -> assertThat(body)
      .startsWith("{\"index\":{\"_index\":\"tracestore-service-2019-05-03\""));
  }

  @Test void writeSpan_ensureIndices() throws Exception {
    storage = ElasticsearchStorage.newBuilder(() -> WebClient.of(server.httpUri()))
      .ensureTemplates(false)
      .ensureIndices(true)
      .archive(true)
      .build();
    server.enqueue(BULK_SUCCESS);

    // the archive index is managed externally, so is never created
    storage.spanWriter().writeSpan(CLIENT_SPAN).execute();

    assertThat(server.takeRequest().request().path()).isEqualTo("/_bulk");
  }

  @Test void templateBootstrapper() throws Exception {
    server.enqueue(SUCCESS_RESPONSE);
    server.enqueue(SUCCESS_RESPONSE);

    storage.templateBootstrapper().createTemplates("{}", "{}", "svc");

    assertThat(server.takeRequest().request().path()).isEqualTo("/_template/svc-tracestore-span");
    assertThat(server.takeRequest().request().path())
      .isEqualTo("/_template/svc-tracestore-service");
  }

  @Test void close_closesLazyHttpClient() {
    AtomicBoolean closed = new AtomicBoolean();
    storage = ElasticsearchStorage.newBuilder(new ElasticsearchStorage.LazyHttpClient() {
      @Override public WebClient get() {
        return WebClient.of(server.httpUri());
      }

      @Override public void close() {
        closed.set(true);
      }

      @Override public String toString() {
        return server.httpUri().toString();
      }
    }).build();

    storage.close();

    assertThat(closed).isTrue();
  }
}
