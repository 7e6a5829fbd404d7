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
import com.google.common.base.Preconditions;

/**
 * A value stored in a {@link TtlCache} together with the ticker readings at
 * which it was written and at which it stops being served.
 *
 * <p>Entries are immutable. Reading an entry never extends its expiry.
 *
 * @param <V> the type of the cached value
 */
public final class CacheEntry<V> {
  private final V value;
  private final long createdAtNanos;
  private final long expiresAtNanos;

  CacheEntry(V value, long createdAtNanos, long expiresAtNanos) {
    Preconditions.checkArgument(expiresAtNanos > createdAtNanos,
        "an entry must expire after it is created");
    this.value = Preconditions.checkNotNull(value);
    this.createdAtNanos = createdAtNanos;
    this.expiresAtNanos = expiresAtNanos;
  }

  public V getValue() {
    return value;
  }

  public long getCreatedAtNanos() {
    return createdAtNanos;
  }

  public long getExpiresAtNanos() {
    return expiresAtNanos;
  }

  /**
   * @param nowNanos the current ticker reading
   * @return {@code true} once {@code nowNanos} has reached the expiry point
   */
  public boolean isExpired(long nowNanos) {
    return nowNanos - expiresAtNanos >= 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("createdAtNanos", createdAtNanos)
        .add("expiresAtNanos", expiresAtNanos)
        .toString();
  }
}
