/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import com.google.auto.value.AutoValue;

/** Where a span and its service metadata are written. */
@AutoValue
public abstract class IndexNames {
  static IndexNames create(String spanIndex, String serviceIndex) {
    if (spanIndex.isEmpty()) throw new IllegalArgumentException("spanIndex is empty");
    return new AutoValue_IndexNames(spanIndex, serviceIndex);
  }

  public abstract String spanIndex();

  /** Empty when service metadata should not be written, as is the case for the archive. */
  public abstract String serviceIndex();

  public final boolean hasServiceIndex() {
    return !serviceIndex().isEmpty();
  }

  IndexNames() {
  }
}
