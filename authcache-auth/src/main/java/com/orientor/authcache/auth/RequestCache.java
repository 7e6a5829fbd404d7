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

package com.orientor.authcache.auth;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.collect.Maps;
import com.orientor.authcache.cache.CacheStatistics;

import java.io.Closeable;
import java.util.Map;

/**
 * A memo that lives for the duration of one request.
 *
 * <p>Not thread-safe: an instance belongs to the thread serving its request
 * and must never be shared. Once {@link #close() closed} it holds nothing
 * and rejects further use. When full, new values are computed but not kept.
 */
public final class RequestCache implements Closeable {
  private final int maximumSize;
  private final Map<String, Object> values;
  private long hits;
  private long misses;
  private boolean closed;

  public RequestCache(int maximumSize) {
    Preconditions.checkArgument(maximumSize > 0, "maximumSize must be positive");
    this.maximumSize = maximumSize;
    this.values = Maps.newHashMapWithExpectedSize(Math.min(maximumSize, 16));
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    checkOpen();
    Object value = values.get(Preconditions.checkNotNull(key));
    if (value == null || !type.isInstance(value)) {
      misses++;
      return Optional.absent();
    }
    hits++;
    return Optional.of(type.cast(value));
  }

  /**
   * @return {@code true} if the value was stored
   */
  public boolean put(String key, Object value) {
    checkOpen();
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(value);
    if (values.size() >= maximumSize && !values.containsKey(key)) {
      return false;
    }
    values.put(key, value);
    return true;
  }

  /**
   * Returns the value held for {@code key}, computing and storing it on the
   * first call.
   */
  public <T> T getOrCompute(String key, Class<T> type, Supplier<T> loader) {
    Optional<T> cached = get(key, type);
    if (cached.isPresent()) {
      return cached.get();
    }
    T value = Preconditions.checkNotNull(loader.get(), "loader returned null for %s", key);
    put(key, value);
    return value;
  }

  public int size() {
    return values.size();
  }

  public boolean isClosed() {
    return closed;
  }

  public CacheStatistics statistics() {
    return new CacheStatistics(hits, misses, 0, values.size());
  }

  @Override
  public void close() {
    values.clear();
    closed = true;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "the request cache has been closed");
  }
}
