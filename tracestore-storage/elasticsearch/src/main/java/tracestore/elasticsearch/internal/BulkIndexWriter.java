/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import com.fasterxml.jackson.core.JsonGenerator;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.buffer.ByteBufUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import tracestore.elasticsearch.internal.SpanDocument.KeyValue;
import tracestore.elasticsearch.internal.SpanDocument.Log;
import tracestore.elasticsearch.internal.SpanDocument.Process;

public abstract class BulkIndexWriter<T> {

  /**
   * Write a complete json document according to index strategy and returns the ID field.
   */
  public abstract String writeDocument(T input, ByteBufOutputStream sink);

  public static final BulkIndexWriter<SpanDocument> SPAN = new BulkIndexWriter<SpanDocument>() {
    @Override public String writeDocument(SpanDocument input, ByteBufOutputStream sink) {
      return writeSpan(input, sink);
    }

    @Override public String toString() {
      return "SpanWriter";
    }
  };

  /** Writes only the service and operation name of the span, for lookup by service. */
  public static final BulkIndexWriter<SpanDocument> SERVICE =
    new BulkIndexWriter<SpanDocument>() {
      @Override public String writeDocument(SpanDocument input, ByteBufOutputStream sink) {
        try (JsonGenerator writer = JsonSerializers.jsonGenerator(sink)) {
          writer.writeStartObject();
          writer.writeStringField("serviceName", input.serviceName());
          writer.writeStringField("operationName", input.operationName());
          writer.writeEndObject();
        } catch (IOException e) {
          throw new AssertionError("Couldn't close generator for a memory stream.", e);
        }
        // Id is used to dedupe server side, as the same pair is written once per index.
        return serviceOperationId(input.serviceName(), input.operationName());
      }

      @Override public String toString() {
        return "ServiceWriter";
      }
    };

  static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L, FNV_PRIME = 0x100000001b3L;

  /** Returns a stable hex id for the service and operation pair, using 64-bit FNV-1a. */
  public static String serviceOperationId(String serviceName, String operationName) {
    long hash = FNV_OFFSET_BASIS;
    hash = fnv1a(hash, serviceName.getBytes(StandardCharsets.UTF_8));
    hash = fnv1a(hash, new byte[] {'|'});
    hash = fnv1a(hash, operationName.getBytes(StandardCharsets.UTF_8));
    return Long.toHexString(hash);
  }

  static long fnv1a(long hash, byte[] bytes) {
    for (byte b : bytes) {
      hash ^= (b & 0xff);
      hash *= FNV_PRIME;
    }
    return hash;
  }

  /**
   * Writes the span document. {@code startTimeMillis} is added beside the microsecond start time
   * so that tools like Kibana can range query it as a date.
   *
   * <p>The ID is the trace ID followed by a content hash, so a retried write of the same span
   * overwrites instead of duplicating.
   */
  static String writeSpan(SpanDocument span, ByteBufOutputStream sink) {
    int startIndex = sink.buffer().writerIndex();
    try (JsonGenerator writer = JsonSerializers.jsonGenerator(sink)) {
      writer.writeStartObject();
      writer.writeStringField("traceID", span.traceId());
      writer.writeStringField("spanID", span.spanId());
      writer.writeNumberField("flags", span.flags());
      writer.writeStringField("operationName", span.operationName());
      writer.writeArrayFieldStart("references");
      if (span.parentId() != null) {
        writer.writeStartObject();
        writer.writeStringField("refType", "CHILD_OF");
        writer.writeStringField("traceID", span.traceId());
        writer.writeStringField("spanID", span.parentId());
        writer.writeEndObject();
      }
      writer.writeEndArray();
      writer.writeNumberField("startTime", span.startTime());
      writer.writeNumberField("startTimeMillis", span.startTimeMillis());
      writer.writeNumberField("duration", span.duration());
      writeTags(span.tags(), span.tag(), writer);
      writer.writeArrayFieldStart("logs");
      for (Log log : span.logs()) write(log, writer);
      writer.writeEndArray();
      writer.writeFieldName("process");
      write(span.process(), writer);
      writer.writeEndObject();
    } catch (IOException e) {
      throw new AssertionError(e); // No I/O writing to a Buffer.
    }

    // get a slice representing the document we just wrote so that we can make a content hash
    ByteBuf slice = sink.buffer().slice(startIndex, sink.buffer().writerIndex() - startIndex);

    return span.traceId() + '-' + md5(slice);
  }

  static void write(Process process, JsonGenerator writer) throws IOException {
    writer.writeStartObject();
    writer.writeStringField("serviceName", process.serviceName());
    writeTags(process.tags(), process.tag(), writer);
    writer.writeEndObject();
  }

  static void write(Log log, JsonGenerator writer) throws IOException {
    writer.writeStartObject();
    writer.writeNumberField("timestamp", log.timestamp());
    writer.writeArrayFieldStart("fields");
    for (KeyValue field : log.fields()) write(field, writer);
    writer.writeEndArray();
    writer.writeEndObject();
  }

  static void writeTags(List<KeyValue> tags, Map<String, String> fields, JsonGenerator writer)
    throws IOException {
    writer.writeArrayFieldStart("tags");
    for (KeyValue tag : tags) write(tag, writer);
    writer.writeEndArray();
    if (!fields.isEmpty()) {
      writer.writeObjectFieldStart("tag");
      for (Map.Entry<String, String> field : fields.entrySet()) {
        writer.writeStringField(field.getKey(), field.getValue());
      }
      writer.writeEndObject();
    }
  }

  static void write(KeyValue keyValue, JsonGenerator writer) throws IOException {
    writer.writeStartObject();
    writer.writeStringField("key", keyValue.key());
    writer.writeStringField("type", keyValue.type());
    writer.writeStringField("value", keyValue.value());
    writer.writeEndObject();
  }

  static String md5(ByteBuf buf) {
    final MessageDigest messageDigest;
    try {
      messageDigest = MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError();
    }
    messageDigest.update(buf.nioBuffer());
    return ByteBufUtil.hexDump(messageDigest.digest());
  }
}
