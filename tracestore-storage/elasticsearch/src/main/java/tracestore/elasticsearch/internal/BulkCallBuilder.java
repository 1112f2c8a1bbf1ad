/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.RequestHeaders;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import tracestore.elasticsearch.internal.client.HttpCall;
import tracestore.elasticsearch.internal.client.HttpCall.BodyConverter;

import static tracestore.elasticsearch.internal.JsonSerializers.OBJECT_MAPPER;
import static tracestore.elasticsearch.internal.JsonSerializers.maybeRootCauseReason;

// See https://www.elastic.co/guide/en/elasticsearch/reference/current/docs-bulk.html
public final class BulkCallBuilder {
  // Bulk requests return errors even when the http status is success, so the body is checked.
  static final BodyConverter<Void> CHECK_FOR_ERRORS = new BodyConverter<Void>() {
    @Override public Void convert(JsonParser parser, Supplier<String> contentString) {
      RuntimeException toThrow = null;
      try {
        JsonNode root = OBJECT_MAPPER.readTree(parser);
        // only throw when we know it is an error
        if (!root.at("/errors").booleanValue() && !root.at("/error").isObject()) return null;

        String message = maybeRootCauseReason(root);
        if (message == null) message = contentString.get();
        Number status = root.findPath("status").numberValue();
        if (status != null && status.intValue() == 429) {
          toThrow = new RejectedExecutionException(message);
        } else {
          toThrow = new RuntimeException(message);
        }
      } catch (RuntimeException | IOException possiblyParseException) {
        // unparseable success responses are not errors
      }
      if (toThrow != null) throw toThrow;
      return null;
    }

    @Override public String toString() {
      return "CheckForErrors";
    }
  };

  final HttpCall.Factory http;
  final boolean shouldAddType;
  final String tag;

  // Mutated for each call to index
  final List<IndexEntry<?>> entries = new ArrayList<>();

  /**
   * @param shouldAddType true writes the document type as {@code _type}, needed before
   * Elasticsearch 7
   * @param tag names the call in logs, ex "index-span"
   */
  public BulkCallBuilder(HttpCall.Factory http, boolean shouldAddType, String tag) {
    this.http = http;
    this.shouldAddType = shouldAddType;
    this.tag = tag;
  }

  public BulkCallBuilder index(IndexEntry<?> entry) {
    if (entry == null) throw new NullPointerException("entry == null");
    entries.add(entry);
    return this;
  }

  /** Creates a bulk request of all entries added so far. */
  public HttpCall<Void> build() {
    if (entries.isEmpty()) throw new IllegalStateException("no entries to index");
    ByteBuf payload = Unpooled.buffer(entries.size() * 800);
    try {
      for (IndexEntry<?> entry : entries) {
        write(payload, entry, shouldAddType);
      }
      AggregatedHttpRequest request = AggregatedHttpRequest.of(
        RequestHeaders.of(
          HttpMethod.POST, "/_bulk", HttpHeaderNames.CONTENT_TYPE, MediaType.JSON_UTF_8),
        HttpData.wrap(ByteBufUtil.getBytes(payload)));
      return http.newCall(request, CHECK_FOR_ERRORS, tag);
    } finally {
      payload.release();
    }
  }

  // Each entry is two lines: the action metadata, then the document itself.
  static <T> void write(ByteBuf payload, IndexEntry<T> entry, boolean shouldAddType) {
    // Fuzzily assume a general small span is 600 bytes to reduce resizing while building up the
    // JSON.
    ByteBuf document = Unpooled.buffer(600);
    try {
      String id = entry.writer().writeDocument(entry.input(), new ByteBufOutputStream(document));
      writeIndexMetadata(new ByteBufOutputStream(payload), entry, id, shouldAddType);
      payload.writeByte('\n').writeBytes(document).writeByte('\n');
    } finally {
      document.release();
    }
  }

  static void writeIndexMetadata(ByteBufOutputStream sink, IndexEntry<?> entry, String id,
    boolean shouldAddType) {
    try (JsonGenerator writer = JsonSerializers.jsonGenerator(sink)) {
      writer.writeStartObject();
      writer.writeObjectFieldStart("index");
      writer.writeStringField("_index", entry.index());
      if (shouldAddType) writer.writeStringField("_type", entry.typeName());
      writer.writeStringField("_id", id);
      writer.writeEndObject();
      writer.writeEndObject();
    } catch (IOException e) {
      throw new AssertionError(e); // No I/O writing to a Buffer.
    }
  }
}
