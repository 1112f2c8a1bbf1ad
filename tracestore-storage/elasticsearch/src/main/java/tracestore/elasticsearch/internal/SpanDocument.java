/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch.internal;

import com.google.auto.value.AutoValue;
import java.util.List;
import java.util.Map;
import zipkin2.internal.Nullable;

/**
 * The storage shape of a span. Tags are either kept as a nested list of {@link KeyValue} or, when
 * configured, flattened into a map whose keys are searchable as plain fields.
 *
 * @see SpanDocumentConverter
 */
@AutoValue
public abstract class SpanDocument {
  public static final String TYPE_STRING = "string";
  public static final String TYPE_INT64 = "int64";

  public static Builder newBuilder() {
    return new AutoValue_SpanDocument.Builder();
  }

  public abstract String traceId();

  public abstract String spanId();

  @Nullable public abstract String parentId();

  /** Bit field: 1 is sampled, 2 is debug */
  public abstract int flags();

  /** Empty when the span had no name */
  public abstract String operationName();

  /** Epoch microseconds, or zero if unknown */
  public abstract long startTime();

  /** Microseconds, or zero if unknown */
  public abstract long duration();

  public abstract List<KeyValue> tags();

  /** Tags flattened into fields. Keys have had dots replaced. */
  public abstract Map<String, String> tag();

  public abstract List<Log> logs();

  public abstract Process process();

  public final long startTimeMillis() {
    return startTime() / 1000L;
  }

  /** Shortcut to the service name of the {@link #process()} */
  public final String serviceName() {
    return process().serviceName();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder traceId(String traceId);

    public abstract Builder spanId(String spanId);

    public abstract Builder parentId(@Nullable String parentId);

    public abstract Builder flags(int flags);

    public abstract Builder operationName(String operationName);

    public abstract Builder startTime(long startTime);

    public abstract Builder duration(long duration);

    public abstract Builder tags(List<KeyValue> tags);

    public abstract Builder tag(Map<String, String> tag);

    public abstract Builder logs(List<Log> logs);

    public abstract Builder process(Process process);

    public abstract SpanDocument build();

    Builder() {
    }
  }

  @AutoValue
  public abstract static class KeyValue {
    public static KeyValue create(String key, String type, String value) {
      return new AutoValue_SpanDocument_KeyValue(key, type, value);
    }

    public abstract String key();

    public abstract String type();

    public abstract String value();

    KeyValue() {
    }
  }

  /** An event during the span, derived from an annotation. */
  @AutoValue
  public abstract static class Log {
    public static Log create(long timestamp, List<KeyValue> fields) {
      return new AutoValue_SpanDocument_Log(timestamp, fields);
    }

    /** Epoch microseconds */
    public abstract long timestamp();

    public abstract List<KeyValue> fields();

    Log() {
    }
  }

  /** The service which recorded the span, and tags describing where it ran. */
  @AutoValue
  public abstract static class Process {
    public static Process create(String serviceName, List<KeyValue> tags,
      Map<String, String> tag) {
      return new AutoValue_SpanDocument_Process(serviceName, tags, tag);
    }

    /** Empty when the span had no local service name */
    public abstract String serviceName();

    public abstract List<KeyValue> tags();

    public abstract Map<String, String> tag();

    Process() {
    }
  }

  SpanDocument() {
  }
}
