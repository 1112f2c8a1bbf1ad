/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import java.io.Closeable;
import java.util.List;
import zipkin2.Call;
import zipkin2.Span;
import zipkin2.storage.SpanConsumer;

import static java.util.Collections.singletonList;

/**
 * Writes spans into storage, along with any denormalized data derived from them, such as the
 * service and operation names used for lookup.
 *
 * <p>Only the primary span write is reflected in the returned {@link Call}. Derived writes are
 * best-effort: their failures are never reported through this type.
 *
 * <p>Implementations are safe for concurrent use by many producers. {@link #close()} must only
 * be called once all calls returned by this writer have completed.
 */
public interface SpanWriter extends SpanConsumer, Closeable {

  /** Writes a single span. Equivalent to {@code accept(singletonList(span))}. */
  default Call<Void> writeSpan(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return accept(singletonList(span));
  }

  /** {@inheritDoc} */
  @Override Call<Void> accept(List<Span> spans);

  /** Releases the underlying store client. */
  @Override void close();
}
