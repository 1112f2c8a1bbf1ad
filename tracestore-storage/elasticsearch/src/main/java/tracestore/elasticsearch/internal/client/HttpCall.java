/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal.client;

import com.fasterxml.jackson.core.JsonParser;
import com.linecorp.armeria.client.UnprocessedRequestException;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.HttpStatusClass;
import com.linecorp.armeria.common.util.Exceptions;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import zipkin2.Call;
import zipkin2.Callback;

import static tracestore.elasticsearch.internal.JsonSerializers.JSON_FACTORY;
import static tracestore.elasticsearch.internal.JsonSerializers.OBJECT_MAPPER;
import static tracestore.elasticsearch.internal.JsonSerializers.maybeRootCauseReason;

/** A single HTTP request to Elasticsearch, whose JSON response is converted on success. */
public final class HttpCall<V> extends Call.Base<V> {

  /** Converts a successful, non-empty response. The raw body is for error messages. */
  public interface BodyConverter<V> {
    V convert(JsonParser parser, Supplier<String> contentString) throws IOException;
  }

  public static class Factory {
    final WebClient httpClient;

    public Factory(WebClient httpClient) {
      this.httpClient = httpClient;
    }

    public <V> HttpCall<V> newCall(
      AggregatedHttpRequest request, BodyConverter<V> bodyConverter, String name) {
      return new HttpCall<>(httpClient, request, bodyConverter, name);
    }
  }

  final WebClient httpClient;
  final AggregatedHttpRequest request;
  final BodyConverter<V> bodyConverter;
  final String name;

  volatile CompletableFuture<AggregatedHttpResponse> responseFuture;

  HttpCall(WebClient httpClient, AggregatedHttpRequest request, BodyConverter<V> bodyConverter,
    String name) {
    this.httpClient = httpClient;
    this.request = request;
    this.bodyConverter = bodyConverter;
    this.name = name;
  }

  @Override protected V doExecute() throws IOException {
    final AggregatedHttpResponse response;
    try {
      response = sendRequest().join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      propagateIfFatal(cause);
      if (cause instanceof IOException) throw (IOException) cause;
      Exceptions.throwUnsafely(cause);
      return null; // Unreachable
    }
    return parseResponse(response, bodyConverter);
  }

  @Override protected void doEnqueue(Callback<V> callback) {
    sendRequest().handle((response, t) -> {
      if (t != null) {
        callback.onError(Exceptions.peel(t));
      } else {
        try {
          V value = parseResponse(response, bodyConverter);
          callback.onSuccess(value);
        } catch (Throwable t1) {
          propagateIfFatal(t1);
          callback.onError(t1);
        }
      }
      return null;
    });
  }

  @Override protected void doCancel() {
    CompletableFuture<AggregatedHttpResponse> responseFuture = this.responseFuture;
    if (responseFuture != null) responseFuture.cancel(false);
  }

  @Override public HttpCall<V> clone() {
    return new HttpCall<>(httpClient, request, bodyConverter, name);
  }

  @Override public String toString() {
    return "HttpCall(" + name + " " + request.method() + " " + request.path() + ")";
  }

  CompletableFuture<AggregatedHttpResponse> sendRequest() {
    CompletableFuture<AggregatedHttpResponse> responseFuture =
      httpClient.execute(request.toHttpRequest()).aggregate().exceptionally(t -> {
        Throwable peeled = Exceptions.peel(t);
        if (peeled instanceof UnprocessedRequestException) {
          Throwable cause = peeled.getCause() != null ? peeled.getCause() : peeled;
          // The request never left, usually due to configuration or infrastructure. The Armeria
          // stack trace won't help debugging that, so keep the message only.
          String message = cause.getMessage();
          if (message == null) message = cause.getClass().getSimpleName();
          throw new RejectedExecutionException(message, cause);
        }
        Exceptions.throwUnsafely(peeled);
        return null;
      });
    this.responseFuture = responseFuture;
    return responseFuture;
  }

  V parseResponse(AggregatedHttpResponse response, BodyConverter<V> bodyConverter)
    throws IOException {
    HttpStatus status = response.status();
    if (status.code() == 404) throw new FileNotFoundException(request.path());
    HttpData content = response.content();
    if (!status.codeClass().equals(HttpStatusClass.SUCCESS)) throw failure(status, content);
    if (content.isEmpty()) return null;

    try (InputStream stream = content.toInputStream();
         JsonParser parser = JSON_FACTORY.createParser(stream)) {
      return bodyConverter.convert(parser, content::toStringUtf8);
    }
  }

  /** Prefers the reason in an Elasticsearch error body, then the raw body, then the status. */
  RuntimeException failure(HttpStatus status, HttpData content) {
    String message = null;
    if (!content.isEmpty()) {
      try {
        message = maybeRootCauseReason(OBJECT_MAPPER.readTree(content.toStringUtf8()));
      } catch (IOException | RuntimeException notJson) {
        message = null;
      }
    }
    if (status.code() == 429) {
      return new RejectedExecutionException(message != null ? message
        : content.isEmpty() ? status.toString() : content.toStringUtf8());
    }
    if (message != null) return new RuntimeException(message);
    return new RuntimeException("response for " + request.path() + " failed: "
      + (content.isEmpty() ? status.toString() : content.toStringUtf8()));
  }
}
