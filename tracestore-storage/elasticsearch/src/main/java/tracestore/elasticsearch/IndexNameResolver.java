/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

/**
 * Decides which indices a span and its service metadata are written to, given the span's start
 * time. The policy is chosen once, from the {@link IndexingMode}, and each mode keeps its
 * parameters as fields so it can be inspected without writing anything.
 *
 * <p><h3>Index names</h3>
 * Using an empty index prefix, names look like the following:
 *
 * <ul>
 *   <li>{@link IndexingMode#DATED}: tracestore-span-2019-05-03 tracestore-service-2019-05-03</li>
 *   <li>{@link IndexingMode#ROLLOVER_ALIAS}: tracestore-span-write tracestore-service-write</li>
 *   <li>{@link IndexingMode#ARCHIVE_DATED}: tracestore-span-archive</li>
 *   <li>{@link IndexingMode#ARCHIVE_ALIAS}: tracestore-span-archive-write</li>
 * </ul>
 *
 * <p>A non-empty prefix is separated by a hyphen, ex. "prod" results in "prod-tracestore-span-…".
 *
 * <p><h3>Date layouts</h3>
 * Dated names format the start time in UTC with a {@link SimpleDateFormat} pattern. The pattern
 * is used as given: a pattern like "yyyy-MM-DD" (day of year) silently produces odd names rather
 * than an error. Only pattern letters {@link SimpleDateFormat} does not know fail, when the
 * resolver is created.
 */
public abstract class IndexNameResolver {
  static final String SEPARATOR = "-";
  static final String SPAN_INDEX = "tracestore-span-", SERVICE_INDEX = "tracestore-service-";
  static final String WRITE_ALIAS_SUFFIX = "write";
  static final String ARCHIVE_INDEX_SUFFIX = "archive";
  static final String ARCHIVE_WRITE_ALIAS_SUFFIX = "archive-write";
  static final String DEFAULT_DATE_LAYOUT = "yyyy-MM-dd";

  static final TimeZone UTC = TimeZone.getTimeZone("UTC");

  public static IndexNameResolver create(IndexingMode mode, String indexPrefix,
    String spanDateLayout, String serviceDateLayout) {
    if (mode == null) throw new NullPointerException("mode == null");
    String prefix = normalizePrefix(indexPrefix);
    String spanIndexPrefix = prefix + SPAN_INDEX, serviceIndexPrefix = prefix + SERVICE_INDEX;
    switch (mode) {
      case DATED:
        return new Dated(spanIndexPrefix, serviceIndexPrefix, spanDateLayout, serviceDateLayout);
      case ROLLOVER_ALIAS:
        return new Fixed(mode, spanIndexPrefix + WRITE_ALIAS_SUFFIX,
          serviceIndexPrefix + WRITE_ALIAS_SUFFIX);
      case ARCHIVE_DATED:
        return new Fixed(mode, spanIndexPrefix + ARCHIVE_INDEX_SUFFIX, "");
      case ARCHIVE_ALIAS:
        return new Fixed(mode, spanIndexPrefix + ARCHIVE_WRITE_ALIAS_SUFFIX, "");
      default:
        throw new AssertionError("unknown mode " + mode);
    }
  }

  /** Appends the separator to a non-empty prefix, unless it already ends with one. */
  public static String normalizePrefix(String indexPrefix) {
    if (indexPrefix == null || indexPrefix.isEmpty()) return "";
    return indexPrefix.endsWith(SEPARATOR) ? indexPrefix : indexPrefix + SEPARATOR;
  }

  public abstract IndexingMode mode();

  /** Returns the indices for a span starting at the given epoch milliseconds. Never fails. */
  public abstract IndexNames resolve(long timestampMillis);

  /** Formats the start time of each span into the index name. */
  static final class Dated extends IndexNameResolver {
    final String spanIndexPrefix, serviceIndexPrefix;
    final String spanDateLayout, serviceDateLayout;
    // SimpleDateFormat isn't thread-safe
    final ThreadLocal<SimpleDateFormat> spanDateFormat, serviceDateFormat;

    Dated(String spanIndexPrefix, String serviceIndexPrefix, String spanDateLayout,
      String serviceDateLayout) {
      this.spanIndexPrefix = spanIndexPrefix;
      this.serviceIndexPrefix = serviceIndexPrefix;
      this.spanDateLayout = spanDateLayout != null ? spanDateLayout : DEFAULT_DATE_LAYOUT;
      this.serviceDateLayout = serviceDateLayout != null ? serviceDateLayout : DEFAULT_DATE_LAYOUT;
      this.spanDateFormat = utcDateFormat(this.spanDateLayout);
      this.serviceDateFormat = utcDateFormat(this.serviceDateLayout);
    }

    @Override public IndexingMode mode() {
      return IndexingMode.DATED;
    }

    @Override public IndexNames resolve(long timestampMillis) {
      Date date = new Date(timestampMillis);
      return IndexNames.create(
        spanIndexPrefix + spanDateFormat.get().format(date),
        serviceIndexPrefix + serviceDateFormat.get().format(date));
    }

    @Override public String toString() {
      return "Dated{spanIndex=" + spanIndexPrefix + spanDateLayout
        + ", serviceIndex=" + serviceIndexPrefix + serviceDateLayout + "}";
    }
  }

  /** Ignores the start time, as the store maps the names to physical indices. */
  static final class Fixed extends IndexNameResolver {
    final IndexingMode mode;
    final IndexNames indexNames;

    Fixed(IndexingMode mode, String spanIndex, String serviceIndex) {
      this.mode = mode;
      this.indexNames = IndexNames.create(spanIndex, serviceIndex);
    }

    @Override public IndexingMode mode() {
      return mode;
    }

    @Override public IndexNames resolve(long timestampMillis) {
      return indexNames;
    }

    @Override public String toString() {
      return "Fixed{mode=" + mode + ", spanIndex=" + indexNames.spanIndex()
        + ", serviceIndex=" + indexNames.serviceIndex() + "}";
    }
  }

  static ThreadLocal<SimpleDateFormat> utcDateFormat(String layout) {
    new SimpleDateFormat(layout); // fail early on unknown pattern letters, not on the write path
    return ThreadLocal.withInitial(() -> {
      SimpleDateFormat result = new SimpleDateFormat(layout);
      result.setTimeZone(UTC);
      return result;
    });
  }

  IndexNameResolver() {
  }
}
