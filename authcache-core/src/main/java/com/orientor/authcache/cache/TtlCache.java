/*
 * Copyright 2026 The Orientor Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.orientor.authcache.cache;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.flogger.FluentLogger;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A concurrent in-memory cache in which every entry carries its own
 * time-to-live, bounded by the default time-to-live of the cache.
 *
 * <p>Storage, size-based eviction and the outer expiry bound are delegated to
 * a Guava {@link Cache}. The per-entry expiry is measured against the same
 * {@link Ticker} and is enforced on read: an expired entry is never returned,
 * and is removed the first time a reader notices it. {@link #cleanUp()}
 * purges the rest, and is normally driven by a {@link CacheSweeper}.
 *
 * <p>A failure inside the cache is logged and degrades to a miss; it never
 * reaches the caller.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TtlCache<K, V> implements Sweepable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final Duration defaultTtl;
  private final Ticker ticker;
  private final Cache<K, CacheEntry<V>> entries;

  // reads that Guava counted as hits but that had outlived their own ttl
  private final AtomicLong expiredOnRead = new AtomicLong();
  // entries removed because their own ttl had passed
  private final AtomicLong purged = new AtomicLong();

  public TtlCache(String name, Duration defaultTtl, int maximumSize) {
    this(name, defaultTtl, maximumSize, Ticker.systemTicker());
  }

  public TtlCache(String name, Duration defaultTtl, int maximumSize, Ticker ticker) {
    Preconditions.checkArgument(!defaultTtl.isNegative() && !defaultTtl.isZero(),
        "the default ttl of cache %s must be positive", name);
    Preconditions.checkArgument(maximumSize > 0,
        "the maximum size of cache %s must be positive", name);
    this.name = Preconditions.checkNotNull(name);
    this.defaultTtl = defaultTtl;
    this.ticker = Preconditions.checkNotNull(ticker);
    this.entries = CacheBuilder.newBuilder()
        .maximumSize(maximumSize)
        .expireAfterWrite(defaultTtl.toNanos(), TimeUnit.NANOSECONDS)
        .ticker(ticker)
        .recordStats()
        .build();
  }

  /**
   * Looks up {@code key}.
   *
   * @return the live value, or absent if there is none or it has expired
   */
  public Optional<V> get(K key) {
    Preconditions.checkNotNull(key);
    try {
      CacheEntry<V> entry = entries.getIfPresent(key);
      if (entry == null) {
        return Optional.absent();
      }
      if (entry.isExpired(ticker.read())) {
        expiredOnRead.incrementAndGet();
        if (entries.asMap().remove(key, entry)) {
          purged.incrementAndGet();
        }
        return Optional.absent();
      }
      return Optional.of(entry.getValue());
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("lookup in cache %s failed, treating it as a miss", name);
      return Optional.absent();
    }
  }

  /**
   * Returns the live entry for {@code key} without touching the hit and miss
   * counters.
   */
  public Optional<CacheEntry<V>> peekEntry(K key) {
    Preconditions.checkNotNull(key);
    CacheEntry<V> entry = entries.asMap().get(key);
    if (entry == null || entry.isExpired(ticker.read())) {
      return Optional.absent();
    }
    return Optional.of(entry);
  }

  /**
   * Stores {@code value} for the default time-to-live.
   */
  public void put(K key, V value) {
    put(key, value, defaultTtl);
  }

  /**
   * Stores {@code value} until {@code ttl} has elapsed. A {@code ttl} longer
   * than the default is cut to the default. A non-positive {@code ttl} stores
   * nothing and drops any value already held for {@code key}.
   */
  public void put(K key, V value, Duration ttl) {
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(value);
    Preconditions.checkNotNull(ttl);
    try {
      if (ttl.isNegative() || ttl.isZero()) {
        entries.invalidate(key);
        return;
      }
      long now = ticker.read();
      long lifetime = Math.min(ttl.toNanos(), defaultTtl.toNanos());
      entries.put(key, new CacheEntry<>(value, now, now + lifetime));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("write to cache %s failed, entry dropped", name);
    }
  }

  /**
   * Removes {@code key}.
   *
   * @return {@code true} if a value was held for it
   */
  public boolean invalidate(K key) {
    Preconditions.checkNotNull(key);
    return entries.asMap().remove(key) != null;
  }

  public void invalidateAll() {
    entries.invalidateAll();
  }

  /**
   * @return the number of entries held, including expired ones that have not
   *     been purged yet
   */
  public int size() {
    return (int) entries.size();
  }

  @Override
  public int cleanUp() {
    long evictedBefore = entries.stats().evictionCount();
    entries.cleanUp();
    int removed = (int) (entries.stats().evictionCount() - evictedBefore);

    long now = ticker.read();
    Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.asMap().entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().isExpired(now)) {
        it.remove();
        removed++;
        purged.incrementAndGet();
      }
    }
    if (removed > 0) {
      logger.atFine().log("purged %d expired entries from cache %s", removed, name);
    }
    return removed;
  }

  @Override
  public String getName() {
    return name;
  }

  public CacheStatistics statistics() {
    CacheStats stats = entries.stats();
    long stale = expiredOnRead.get();
    return new CacheStatistics(stats.hitCount() - stale, stats.missCount() + stale,
        stats.evictionCount() + purged.get(), entries.size());
  }
}
