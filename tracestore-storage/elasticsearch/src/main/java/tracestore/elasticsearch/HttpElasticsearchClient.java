/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.RequestHeaders;
import java.util.List;
import tracestore.elasticsearch.ElasticsearchStorage.LazyHttpClient;
import tracestore.elasticsearch.internal.BulkCallBuilder;
import tracestore.elasticsearch.internal.IndexEntry;
import tracestore.elasticsearch.internal.client.HttpCall;
import zipkin2.Call;

/** Speaks the Elasticsearch REST API through a lazily created Armeria client. */
final class HttpElasticsearchClient implements ElasticsearchClient {
  static final HttpCall.BodyConverter<Void> NULL = (parser, contentString) -> null;

  final LazyHttpClient lazyHttpClient;
  final boolean legacyDocumentTypes;
  volatile HttpCall.Factory http; // lazy as creating the client can perform I/O

  HttpElasticsearchClient(LazyHttpClient lazyHttpClient, boolean legacyDocumentTypes) {
    this.lazyHttpClient = lazyHttpClient;
    this.legacyDocumentTypes = legacyDocumentTypes;
  }

  HttpCall.Factory http() {
    HttpCall.Factory result = http;
    if (result != null) return result;
    synchronized (this) {
      if (http == null) http = new HttpCall.Factory(lazyHttpClient.get());
      return http;
    }
  }

  @Override public Call<Void> putTemplate(String name, String body) {
    if (name == null) throw new NullPointerException("name == null");
    if (body == null) throw new NullPointerException("body == null");
    // include_type_name is not sent, as it is rejected by Elasticsearch 8
    AggregatedHttpRequest request = AggregatedHttpRequest.of(
      RequestHeaders.of(HttpMethod.PUT, "/_template/" + name,
        HttpHeaderNames.CONTENT_TYPE, MediaType.JSON_UTF_8),
      HttpData.ofUtf8(body));
    return http().newCall(request, NULL, "put-template");
  }

  @Override public Call<Void> createIndex(String index) {
    if (index == null) throw new NullPointerException("index == null");
    AggregatedHttpRequest request = AggregatedHttpRequest.of(HttpMethod.PUT, "/" + index);
    return http().newCall(request, NULL, "create-index").handleError((error, callback) -> {
      if (isAlreadyExists(error)) {
        callback.onSuccess(null);
      } else {
        callback.onError(error);
      }
    });
  }

  // The reason reads like "index [tracestore-span-2020-01-01/uuid] already exists"
  static boolean isAlreadyExists(Throwable error) {
    String message = error.getMessage();
    return message != null
      && (message.contains("resource_already_exists_exception")
      || message.contains("already exists"));
  }

  @Override public Call<Void> bulk(List<IndexEntry<?>> entries) {
    if (entries.isEmpty()) return Call.create(null);
    BulkCallBuilder builder = new BulkCallBuilder(http(), legacyDocumentTypes, "index-bulk");
    for (IndexEntry<?> entry : entries) builder.index(entry);
    return builder.build();
  }

  @Override public void close() {
    lazyHttpClient.close();
  }

  @Override public String toString() {
    return "HttpElasticsearchClient{initialEndpoints=" + lazyHttpClient + "}";
  }
}
