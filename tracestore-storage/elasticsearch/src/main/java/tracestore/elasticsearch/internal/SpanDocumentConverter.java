/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import tracestore.elasticsearch.internal.SpanDocument.KeyValue;
import tracestore.elasticsearch.internal.SpanDocument.Log;
import tracestore.elasticsearch.internal.SpanDocument.Process;
import zipkin2.Annotation;
import zipkin2.Endpoint;
import zipkin2.Span;

import static tracestore.elasticsearch.internal.SpanDocument.TYPE_INT64;
import static tracestore.elasticsearch.internal.SpanDocument.TYPE_STRING;

/**
 * Converts a span into its storage shape. This is stateless after construction and safe to share.
 *
 * <p>Besides the span's own tags, a few tags are derived from span fields that have no dedicated
 * place in the document: the kind becomes {@code span.kind} and the remote endpoint becomes
 * {@code peer.*}. The local endpoint becomes the {@link Process process}.
 *
 * <p>A tag is written as a field in {@link SpanDocument#tag()} when all tags are fields, or when
 * its key is one of the configured field keys. Dots in field keys are replaced, as Elasticsearch
 * would otherwise interpret them as object paths.
 */
public final class SpanDocumentConverter {
  static final int FLAG_SAMPLED = 1, FLAG_DEBUG = 2;

  final boolean allTagsAsFields;
  final Set<String> tagKeysAsFields;
  final String tagDotReplacement;

  public SpanDocumentConverter(boolean allTagsAsFields, List<String> tagKeysAsFields,
    String tagDotReplacement) {
    if (tagKeysAsFields == null) throw new NullPointerException("tagKeysAsFields == null");
    if (tagDotReplacement == null) throw new NullPointerException("tagDotReplacement == null");
    this.allTagsAsFields = allTagsAsFields;
    this.tagKeysAsFields = new LinkedHashSet<>(tagKeysAsFields);
    this.tagDotReplacement = tagDotReplacement;
  }

  public SpanDocument convert(Span span) {
    TagSplitter spanTags = new TagSplitter();
    for (Map.Entry<String, String> tag : span.tags().entrySet()) {
      spanTags.add(tag.getKey(), TYPE_STRING, tag.getValue());
    }
    if (span.kind() != null) {
      spanTags.add("span.kind", TYPE_STRING, span.kind().name().toLowerCase(Locale.ROOT));
    }
    Endpoint remote = span.remoteEndpoint();
    if (remote != null) {
      if (remote.serviceName() != null) {
        spanTags.add("peer.service", TYPE_STRING, remote.serviceName());
      }
      if (remote.ipv4() != null) spanTags.add("peer.ipv4", TYPE_STRING, remote.ipv4());
      if (remote.ipv6() != null) spanTags.add("peer.ipv6", TYPE_STRING, remote.ipv6());
      if (remote.portAsInt() != 0) {
        spanTags.add("peer.port", TYPE_INT64, String.valueOf(remote.portAsInt()));
      }
    }

    int flags = FLAG_SAMPLED;
    if (Boolean.TRUE.equals(span.debug())) flags |= FLAG_DEBUG;

    String operationName = span.name();
    return SpanDocument.newBuilder()
      .traceId(span.traceId())
      .spanId(span.id())
      .parentId(span.parentId())
      .flags(flags)
      .operationName(operationName != null ? operationName : "")
      .startTime(span.timestampAsLong())
      .duration(span.durationAsLong())
      .tags(spanTags.tags())
      .tag(spanTags.fields())
      .logs(logs(span.annotations()))
      .process(process(span.localEndpoint()))
      .build();
  }

  Process process(Endpoint local) {
    if (local == null) return Process.create("", Collections.emptyList(), Collections.emptyMap());
    TagSplitter processTags = new TagSplitter();
    if (local.ipv4() != null) processTags.add("ip", TYPE_STRING, local.ipv4());
    if (local.ipv6() != null) processTags.add("ip6", TYPE_STRING, local.ipv6());
    if (local.portAsInt() != 0) {
      processTags.add("port", TYPE_INT64, String.valueOf(local.portAsInt()));
    }
    String serviceName = local.serviceName();
    return Process.create(serviceName != null ? serviceName : "", processTags.tags(),
      processTags.fields());
  }

  static List<Log> logs(List<Annotation> annotations) {
    if (annotations.isEmpty()) return Collections.emptyList();
    List<Log> result = new ArrayList<>(annotations.size());
    for (Annotation a : annotations) {
      result.add(Log.create(a.timestamp(),
        Collections.singletonList(KeyValue.create("event", TYPE_STRING, a.value()))));
    }
    return Collections.unmodifiableList(result);
  }

  boolean isField(String key) {
    return allTagsAsFields || tagKeysAsFields.contains(key);
  }

  /** Mutable type used for each conversion to split tags between the list and field forms. */
  final class TagSplitter {
    List<KeyValue> tags;
    Map<String, String> fields;

    void add(String key, String type, String value) {
      if (isField(key)) {
        if (fields == null) fields = new LinkedHashMap<>();
        fields.put(key.replace(".", tagDotReplacement), value);
      } else {
        if (tags == null) tags = new ArrayList<>();
        tags.add(KeyValue.create(key, type, value));
      }
    }

    List<KeyValue> tags() {
      return tags == null ? Collections.emptyList() : Collections.unmodifiableList(tags);
    }

    Map<String, String> fields() {
      return fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(fields);
    }
  }

  @Override public String toString() {
    return "SpanDocumentConverter{allTagsAsFields=" + allTagsAsFields
      + ", tagKeysAsFields=" + tagKeysAsFields
      + ", tagDotReplacement=" + tagDotReplacement + "}";
  }
}
