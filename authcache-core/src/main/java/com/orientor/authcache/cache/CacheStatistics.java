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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * An immutable snapshot of the counters kept by one cache.
 */
public final class CacheStatistics {
  public static final CacheStatistics EMPTY = new CacheStatistics(0, 0, 0, 0);

  private final long hitCount;
  private final long missCount;
  private final long evictionCount;
  private final long size;

  public CacheStatistics(long hitCount, long missCount, long evictionCount, long size) {
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.evictionCount = evictionCount;
    this.size = size;
  }

  public long getHitCount() {
    return hitCount;
  }

  public long getMissCount() {
    return missCount;
  }

  public long getEvictionCount() {
    return evictionCount;
  }

  public long getSize() {
    return size;
  }

  public long getRequestCount() {
    return hitCount + missCount;
  }

  /**
   * @return the fraction of lookups that were hits, or {@code 1.0} when no
   *     lookup has happened yet
   */
  public double getHitRate() {
    long requests = getRequestCount();
    return requests == 0 ? 1.0 : (double) hitCount / requests;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CacheStatistics)) {
      return false;
    }
    CacheStatistics that = (CacheStatistics) o;
    return hitCount == that.hitCount
        && missCount == that.missCount
        && evictionCount == that.evictionCount
        && size == that.size;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(hitCount, missCount, evictionCount, size);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hits", hitCount)
        .add("misses", missCount)
        .add("evictions", evictionCount)
        .add("size", size)
        .toString();
  }
}
