/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import com.google.auto.value.AutoValue;

import static tracestore.elasticsearch.IndexNameResolver.SERVICE_INDEX;
import static tracestore.elasticsearch.IndexNameResolver.SPAN_INDEX;
import static tracestore.elasticsearch.IndexNameResolver.normalizePrefix;

/** The default legacy index templates for span and service indices. */
@AutoValue
public abstract class IndexTemplates {
  /** Maximum character length constraint of most names, IP literals and IDs. */
  static final int SHORT_STRING_LENGTH = 256;

  /** Lookups are exact match only (keyword). Norms are for scoring, which isn't used. */
  static final String KEYWORD = "{ \"type\": \"keyword\", \"norms\": false }";

  /**
   * @param indexPrefix the same prefix given to the index names, so the patterns match them
   * @param legacyDocumentTypes true wraps mappings in the document type, needed before
   * Elasticsearch 7
   */
  static IndexTemplates create(String indexPrefix, int indexShards, int indexReplicas,
    boolean legacyDocumentTypes) {
    String prefix = normalizePrefix(indexPrefix);
    String span = beginTemplate(prefix + SPAN_INDEX, indexShards, indexReplicas)
      + "  \"mappings\": {\n"
      + maybeWrap(ElasticsearchSpanWriter.TYPE_SPAN, legacyDocumentTypes, ""
      + "    \"dynamic_templates\": [\n"
      + "      {\n"
      + "        \"span_tags_map\": {\n"
      + "          \"mapping\": " + keyword() + ",\n"
      + "          \"path_match\": \"tag.*\"\n"
      + "        }\n"
      + "      },\n"
      + "      {\n"
      + "        \"process_tags_map\": {\n"
      + "          \"mapping\": " + keyword() + ",\n"
      + "          \"path_match\": \"process.tag.*\"\n"
      + "        }\n"
      + "      }\n"
      + "    ],\n"
      + "    \"properties\": {\n"
      + "      \"traceID\": " + KEYWORD + ",\n"
      + "      \"spanID\": " + KEYWORD + ",\n"
      + "      \"operationName\": " + KEYWORD + ",\n"
      + "      \"flags\": { \"type\": \"integer\" },\n"
      + "      \"startTime\": { \"type\": \"long\" },\n"
      + "      \"startTimeMillis\": { \"type\": \"date\", \"format\": \"epoch_millis\" },\n"
      + "      \"duration\": { \"type\": \"long\" },\n"
      + "      \"references\": {\n"
      + "        \"type\": \"nested\",\n"
      + "        \"dynamic\": false,\n"
      + "        \"properties\": {\n"
      + "          \"refType\": " + KEYWORD + ",\n"
      + "          \"traceID\": " + KEYWORD + ",\n"
      + "          \"spanID\": " + KEYWORD + "\n"
      + "        }\n"
      + "      },\n"
      + "      \"process\": {\n"
      + "        \"properties\": {\n"
      + "          \"serviceName\": " + KEYWORD + ",\n"
      + "          \"tag\": { \"type\": \"object\" },\n"
      + "          \"tags\": " + nestedKeyValue("          ") + "\n"
      + "        }\n"
      + "      },\n"
      + "      \"tag\": { \"type\": \"object\" },\n"
      + "      \"tags\": " + nestedKeyValue("      ") + ",\n"
      + "      \"logs\": {\n"
      + "        \"type\": \"nested\",\n"
      + "        \"dynamic\": false,\n"
      + "        \"properties\": {\n"
      + "          \"timestamp\": { \"type\": \"long\" },\n"
      + "          \"fields\": " + nestedKeyValue("          ") + "\n"
      + "        }\n"
      + "      }\n"
      + "    }\n")
      + "  }\n"
      + "}";

    String service = beginTemplate(prefix + SERVICE_INDEX, indexShards, indexReplicas)
      + "  \"mappings\": {\n"
      + maybeWrap(ServiceIndexWriter.TYPE_SERVICE, legacyDocumentTypes, ""
      + "    \"properties\": {\n"
      + "      \"serviceName\": " + KEYWORD + ",\n"
      + "      \"operationName\": " + KEYWORD + "\n"
      + "    }\n")
      + "  }\n"
      + "}";
    return new AutoValue_IndexTemplates(span, service);
  }

  /** The span index template, matching {@code <prefix>tracestore-span-*} */
  public abstract String span();

  /** The service index template, matching {@code <prefix>tracestore-service-*} */
  public abstract String service();

  static String beginTemplate(String indexPrefix, int indexShards, int indexReplicas) {
    return "{\n"
      + "  \"index_patterns\": \"" + indexPrefix + "*\",\n"
      + "  \"settings\": {\n"
      + "    \"index.number_of_shards\": " + indexShards + ",\n"
      + "    \"index.number_of_replicas\": " + indexReplicas + ",\n"
      + "    \"index.mapping.nested_fields.limit\": 50,\n"
      + "    \"index.requests.cache.enable\": true\n"
      + "  },\n";
  }

  static String keyword() {
    return "{ \"type\": \"keyword\", \"ignore_above\": " + SHORT_STRING_LENGTH + " }";
  }

  static String nestedKeyValue(String indent) {
    return "{\n"
      + indent + "  \"type\": \"nested\",\n"
      + indent + "  \"dynamic\": false,\n"
      + indent + "  \"properties\": {\n"
      + indent + "    \"key\": " + KEYWORD + ",\n"
      + indent + "    \"value\": " + KEYWORD + ",\n"
      + indent + "    \"type\": " + KEYWORD + "\n"
      + indent + "  }\n"
      + indent + "}";
  }

  /** The document type only wraps mappings before Elasticsearch 7 */
  static String maybeWrap(String type, boolean legacyDocumentTypes, String json) {
    if (!legacyDocumentTypes) return json;
    return "    \"" + type + "\": {\n" + json + "    }\n";
  }

  IndexTemplates() {
  }
}
