/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tracestore.elasticsearch.internal.IndexEntry;
import tracestore.internal.WriteCache;
import tracestore.metrics.InMemoryStorageMetrics;
import zipkin2.Call;
import zipkin2.Span;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tracestore.elasticsearch.IndexingMode.ARCHIVE_DATED;
import static tracestore.elasticsearch.IndexingMode.DATED;
import static tracestore.elasticsearch.IndexingMode.ROLLOVER_ALIAS;
import static tracestore.elasticsearch.TestObjects.CLIENT_SPAN;
import static tracestore.elasticsearch.TestObjects.CONVERTER;
import static tracestore.elasticsearch.TestObjects.MAY_3_2019;
import static tracestore.elasticsearch.TestObjects.failedCall;

@ExtendWith(MockitoExtension.class)
class ElasticsearchSpanWriterTest {
  static final String SPAN_INDEX = "tracestore-span-2019-05-03";
  static final String SERVICE_INDEX = "tracestore-service-2019-05-03";

  @Mock ElasticsearchClient client;
  @Mock Logger logger;
  @Captor ArgumentCaptor<List<IndexEntry<?>>> entries;
  @Captor ArgumentCaptor<IndexEntry<?>> entry;

  InMemoryStorageMetrics metrics = new InMemoryStorageMetrics();
  List<String> executed = new ArrayList<>();

  ElasticsearchSpanWriter newWriter(IndexingMode mode, boolean ensureIndices) {
    WriteCache<List<String>> serviceCache =
      WriteCache.newBuilder().ttl(12, TimeUnit.HOURS).maximumSize(100).build();
    WriteCache<String> indexCache = !ensureIndices ? null
      : WriteCache.newBuilder().ttl(48, TimeUnit.HOURS).maximumSize(5).build();
    return new ElasticsearchSpanWriter(client,
      IndexNameResolver.create(mode, "", "yyyy-MM-dd", "yyyy-MM-dd"), CONVERTER,
      new ServiceIndexWriter(client, serviceCache, logger), indexCache, metrics, logger);
  }

  /** Returns a successful call which records when it executes */
  Call<Void> recording(String name) {
    return Call.<Void>create(null).map(v -> {
      executed.add(name);
      return v;
    });
  }

  @Test void writesSpanToDatedIndex() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    newWriter(DATED, false).writeSpan(CLIENT_SPAN).execute();

    verify(client).bulk(entries.capture());
    assertThat(entries.getValue()).singleElement().satisfies(entry -> {
      assertThat(entry.index()).isEqualTo(SPAN_INDEX);
      assertThat(entry.typeName()).isEqualTo("span");
    });
  }

  @Test void writesServiceToDatedIndex() {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    newWriter(DATED, false).writeSpan(CLIENT_SPAN);

    verify(client).index(entry.capture());
    assertThat(entry.getValue().index()).isEqualTo(SERVICE_INDEX);
    assertThat(entry.getValue().typeName()).isEqualTo("service");
  }

  @Test void succeedsWhenServiceWriteAlwaysFails() throws IOException {
    when(client.index(any())).thenAnswer(i -> failedCall(new IOException("unreachable")));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, false);
    for (String name : asList("get", "post", "put")) {
      assertThat(writer.writeSpan(CLIENT_SPAN.toBuilder().name(name).build()).execute())
        .isNull();
    }
    verify(client, times(3)).index(any());
  }

  @Test void succeedsWhenServiceWriteThrows() throws IOException {
    when(client.index(any())).thenThrow(new IllegalStateException("closed"));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    assertThat(newWriter(DATED, false).writeSpan(CLIENT_SPAN).execute()).isNull();
  }

  @Test void propagatesSpanWriteFailure() {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> failedCall(new IOException("unreachable")));

    assertThatThrownBy(() -> newWriter(DATED, false).writeSpan(CLIENT_SPAN).execute())
      .isInstanceOf(IOException.class)
      .hasMessage("unreachable");
  }

  @Test void emptyList() throws IOException {
    assertThat(newWriter(DATED, true).accept(Collections.emptyList()).execute()).isNull();

    verifyNoInteractions(client);
  }

  @Test void batchIsOneBulkRequest() {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    Span nextDay = CLIENT_SPAN.toBuilder().timestamp((MAY_3_2019 + 86400000L) * 1000L).build();
    newWriter(DATED, false).accept(asList(CLIENT_SPAN, nextDay));

    verify(client).bulk(entries.capture());
    assertThat(entries.getValue()).extracting(IndexEntry::index)
      .containsExactly(SPAN_INDEX, "tracestore-span-2019-05-04");
  }

  @Test void archiveSkipsServiceIndex() {
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    newWriter(ARCHIVE_DATED, false).writeSpan(CLIENT_SPAN);

    verify(client, never()).index(any());
    verify(client).bulk(entries.capture());
    assertThat(entries.getValue()).extracting(IndexEntry::index)
      .containsExactly("tracestore-span-archive");
  }

  @Test void rolloverAliasWritesService() {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    newWriter(ROLLOVER_ALIAS, false).writeSpan(CLIENT_SPAN);

    verify(client).index(entry.capture());
    assertThat(entry.getValue().index()).isEqualTo("tracestore-service-write");
  }

  @Test void indexTimestamp() {
    assertThat(ElasticsearchSpanWriter.indexTimestamp(CLIENT_SPAN)).isEqualTo(MAY_3_2019 + 1L);

    Span noTimestamp = CLIENT_SPAN.toBuilder().timestamp(0L).build();
    assertThat(ElasticsearchSpanWriter.indexTimestamp(noTimestamp)).isEqualTo(MAY_3_2019 + 2L);

    Span nothing = noTimestamp.toBuilder().clearAnnotations().build();
    long now = System.currentTimeMillis();
    assertThat(ElasticsearchSpanWriter.indexTimestamp(nothing)).isBetween(now, now + 60000L);
  }

  @Test void ensureIndices_createsBeforeBulk() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString()))
      .thenAnswer(i -> recording("create " + i.getArgument(0)));
    when(client.bulk(any())).thenAnswer(i -> recording("bulk"));

    newWriter(DATED, true).writeSpan(CLIENT_SPAN).execute();

    assertThat(executed).containsExactly(
      "create " + SERVICE_INDEX, "create " + SPAN_INDEX, "bulk");
    assertThat(metrics.forOperation("index_create").attempts()).isEqualTo(2);
    assertThat(metrics.forOperation("index_create").inserts()).isEqualTo(2);
  }

  @Test void ensureIndices_onlyOncePerIndex() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, true);
    writer.writeSpan(CLIENT_SPAN).execute();
    writer.writeSpan(CLIENT_SPAN.toBuilder().name("post").build()).execute();

    verify(client).createIndex(SERVICE_INDEX);
    verify(client).createIndex(SPAN_INDEX);
  }

  @Test void ensureIndices_failureIsRetried() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(SERVICE_INDEX)).thenAnswer(i -> Call.create(null));
    when(client.createIndex(SPAN_INDEX))
      .thenAnswer(i -> failedCall(new IllegalStateException("cluster_block_exception")))
      .thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, true);
    assertThatThrownBy(() -> writer.writeSpan(CLIENT_SPAN).execute())
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("cluster_block_exception");
    writer.writeSpan(CLIENT_SPAN).execute();

    // the service index was created by the first write, so only the span index is retried
    verify(client).createIndex(SERVICE_INDEX);
    verify(client, times(2)).createIndex(SPAN_INDEX);
    assertThat(metrics.forOperation("index_create").attempts()).isEqualTo(3);
    assertThat(metrics.forOperation("index_create").errors()).isEqualTo(1);
    assertThat(metrics.forOperation("index_create").inserts()).isEqualTo(2);
  }

  @Test void ensureIndices_bulkFailureKeepsCreatedIndices() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any()))
      .thenAnswer(i -> failedCall(new IOException("unreachable")))
      .thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, true);
    assertThatThrownBy(() -> writer.writeSpan(CLIENT_SPAN).execute())
      .isInstanceOf(IOException.class);
    writer.writeSpan(CLIENT_SPAN).execute();

    verify(client).createIndex(SERVICE_INDEX);
    verify(client).createIndex(SPAN_INDEX);
  }

  @Test void ensureIndices_canceledIsRetried() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, true);
    Call<Void> canceled = writer.writeSpan(CLIENT_SPAN);
    canceled.cancel();
    assertThatThrownBy(canceled::execute).isInstanceOf(IOException.class);

    writer.writeSpan(CLIENT_SPAN.toBuilder().name("post").build()).execute();

    verify(client, times(2)).createIndex(SERVICE_INDEX);
    verify(client, times(2)).createIndex(SPAN_INDEX);
    assertThat(metrics.forOperation("index_create").attempts()).isEqualTo(2);
  }

  @Test void ensureIndices_droppedCallIsRetried() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    ElasticsearchSpanWriter writer = newWriter(DATED, true);
    writer.writeSpan(CLIENT_SPAN); // never executed
    writer.writeSpan(CLIENT_SPAN).execute();
    writer.writeSpan(CLIENT_SPAN).execute();

    verify(client, times(2)).createIndex(SPAN_INDEX);
  }

  @Test void ensureIndices_ignoredForAliases() throws IOException {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.bulk(any())).thenAnswer(i -> Call.create(null));

    newWriter(ROLLOVER_ALIAS, true).writeSpan(CLIENT_SPAN).execute();

    verify(client, never()).createIndex(anyString());
  }

  @Test void cancelBeforeExecute() {
    when(client.index(any())).thenAnswer(i -> Call.create(null));
    when(client.createIndex(anyString()))
      .thenAnswer(i -> recording("create " + i.getArgument(0)));
    when(client.bulk(any())).thenAnswer(i -> recording("bulk"));

    Call<Void> call = newWriter(DATED, true).writeSpan(CLIENT_SPAN);
    call.cancel();

    assertThatThrownBy(call::execute)
      .isInstanceOf(IOException.class)
      .hasMessage("Canceled");
    assertThat(executed).isEmpty();
  }

  /** The service metadata write isn't tied to the span write, so canceling doesn't affect it. */
  @Test void cancelDoesntAffectServiceWrite() {
    when(client.index(any())).thenAnswer(i -> recording("service"));
    when(client.bulk(any())).thenAnswer(i -> recording("bulk"));

    Call<Void> call = newWriter(DATED, false).writeSpan(CLIENT_SPAN);
    call.cancel();

    assertThat(executed).containsExactly("service");
  }

  @Test void close() {
    newWriter(DATED, false).close();

    verify(client).close();
  }
}
