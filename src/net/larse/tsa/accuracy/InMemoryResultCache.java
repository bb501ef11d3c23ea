/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.accuracy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * {@link ResultCache} on a Caffeine cache. Each entry expires after the ttl it was put with,
 * measured on the injected clock, and the cache holds at most {@code maximumSize} entries.
 * Maintenance runs on the calling thread.
 */
public class InMemoryResultCache<V> implements ResultCache<V> {
  public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

  private static final class Entry<V> {
    final V value;
    final long ttlNanos;

    Entry(V value, Duration ttl) {
      this.value = value;
      this.ttlNanos = ttl.toNanos();
    }
  }

  private static final class PerEntryTtl<V> implements Expiry<String, Entry<V>> {
    @Override
    public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterUpdate(String key, Entry<V> entry, long currentTime,
        long currentDuration) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterRead(String key, Entry<V> entry, long currentTime,
        long currentDuration) {
      return currentDuration;
    }
  }

  private final Cache<String, Entry<V>> entries;

  public InMemoryResultCache() {
    this(Clock.systemUTC());
  }

  public InMemoryResultCache(Clock clock) {
    this(clock, DEFAULT_MAXIMUM_SIZE);
  }

  public InMemoryResultCache(Clock clock, long maximumSize) {
    Preconditions.checkNotNull(clock, "clock");
    Preconditions.checkArgument(maximumSize > 0, "maximumSize must be positive");
    this.entries = Caffeine.newBuilder()
        .ticker(() -> ChronoUnit.NANOS.between(Instant.EPOCH, clock.instant()))
        .executor(Runnable::run)
        .expireAfter(new PerEntryTtl<V>())
        .maximumSize(maximumSize)
        .build();
  }

  @Override
  public V get(String key) {
    Entry<V> entry = entries.getIfPresent(key);
    return entry == null ? null : entry.value;
  }

  @Override
  public void put(String key, V value, Duration ttl) {
    Preconditions.checkNotNull(value, "value");
    Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    entries.put(key, new Entry<>(value, ttl));
  }

  @Override
  public void invalidate(String key) {
    entries.invalidate(key);
  }

  /** Live entries after expired and surplus ones have been evicted. */
  public long size() {
    entries.cleanUp();
    return entries.estimatedSize();
  }
}
