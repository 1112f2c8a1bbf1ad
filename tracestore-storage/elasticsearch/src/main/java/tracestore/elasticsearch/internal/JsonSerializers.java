/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import zipkin2.internal.Nullable;

/** JSON serialization utilities shared by requests and response parsing. */
public final class JsonSerializers {
  public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  public static final JsonFactory JSON_FACTORY = new JsonFactory();

  public static JsonGenerator jsonGenerator(OutputStream stream) {
    try {
      return JSON_FACTORY.createGenerator(stream);
    } catch (IOException e) {
      throw new AssertionError("Could not create JSON generator for a memory stream.", e);
    }
  }

  /**
   * Elasticsearch errors nest the interesting part under a root cause. This returns the first
   * reason found, preferring the root cause, or null if there is none.
   */
  @Nullable public static String maybeRootCauseReason(JsonNode root) {
    String reason = root.findPath("root_cause").findPath("reason").textValue();
    if (reason != null) return reason;
    return root.findPath("reason").textValue();
  }

  JsonSerializers() {
  }
}
