/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Remembers keys which were recently written downstream, so that redundant writes can be skipped.
 *
 * <p>Entries expire {@link Builder#ttl(long, TimeUnit) ttl} after they were last {@linkplain
 * #mark(Object) marked}. Expiry is checked lazily on access: there is no sweeper thread. Once
 * {@link Builder#maximumSize(int) maximumSize} entries are held, the least recently used entry is
 * evicted regardless of its expiry.
 *
 * <p>A miss does not imply the key was never marked: it may have been evicted or expired. Callers
 * must treat a miss as permission to write again, never as proof nothing was written.
 */
public final class WriteCache<K> {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    long ttl = 0L;
    TimeUnit ttlUnit = TimeUnit.MILLISECONDS;
    int maximumSize = 0;

    /** A {@linkplain #mark(Object) marked} key is contained until this duration expires. */
    public Builder ttl(long ttl, TimeUnit ttlUnit) {
      if (ttlUnit == null) throw new NullPointerException("ttlUnit == null");
      this.ttl = ttl;
      this.ttlUnit = ttlUnit;
      return this;
    }

    /** Bounds the entries held, as keys can be accidentally unlimited cardinality. */
    public Builder maximumSize(int maximumSize) {
      this.maximumSize = maximumSize;
      return this;
    }

    public <K> WriteCache<K> build() {
      if (ttl <= 0L) throw new IllegalArgumentException("ttl <= 0");
      if (maximumSize <= 0) throw new IllegalArgumentException("maximumSize <= 0");
      return new WriteCache<K>(new Ticker(), ttlUnit.toNanos(ttl), maximumSize);
    }

    Builder() {
    }
  }

  final Ticker ticker;
  final long ttlNanos;
  final int maximumSize;
  // guarded by itself; values are expiration in ticker nanos
  final LinkedHashMap<K, Long> entries;

  WriteCache(Ticker ticker, long ttlNanos, int maximumSize) {
    this.ticker = ticker;
    this.ttlNanos = ttlNanos;
    this.maximumSize = maximumSize;
    this.entries = new LinkedHashMap<K, Long>(16, 0.75f, true) {
      @Override protected boolean removeEldestEntry(Map.Entry<K, Long> eldest) {
        return size() > WriteCache.this.maximumSize;
      }
    };
  }

  /** Returns true if the key was marked and has neither expired nor been evicted. */
  public boolean contains(K key) {
    if (key == null) throw new NullPointerException("key == null");
    synchronized (entries) {
      return isLive(key, ticker.nanoTime());
    }
  }

  /** Marks the key as written, resetting its expiration if it was already present. */
  public void mark(K key) {
    if (key == null) throw new NullPointerException("key == null");
    synchronized (entries) {
      entries.put(key, ticker.nanoTime() + ttlNanos);
    }
  }

  /**
   * Marks the key unless it is already live. Returns true when this call marked it, which is the
   * signal to perform the write.
   */
  public boolean markIfAbsent(K key) {
    if (key == null) throw new NullPointerException("key == null");
    synchronized (entries) {
      long now = ticker.nanoTime();
      if (isLive(key, now)) return false;
      entries.put(key, now + ttlNanos);
      return true;
    }
  }

  /** Forgets the key, for example when the write it guarded failed. */
  public void invalidate(K key) {
    synchronized (entries) {
      entries.remove(key);
    }
  }

  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
  }

  int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  // expects the lock to be held
  boolean isLive(K key, long now) {
    Long expiration = entries.get(key); // moves the key to most recently used
    if (expiration == null) return false;
    if (expiration - now <= 0L) { // overflow-safe comparison
      entries.remove(key);
      return false;
    }
    return true;
  }

  @Override public String toString() {
    return "WriteCache{ttlNanos=" + ttlNanos + ", maximumSize=" + maximumSize + "}";
  }

  static class Ticker { // not final for tests
    long nanoTime() {
      return System.nanoTime();
    }
  }
}
