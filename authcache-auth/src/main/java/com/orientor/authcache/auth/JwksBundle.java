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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

import java.time.Duration;

/**
 * An immutable snapshot of the signing keys together with the ticker
 * readings at which it was fetched, should be refreshed and expires.
 */
public final class JwksBundle {
  private final ImmutableList<JsonWebKey> keys;
  private final ImmutableSet<String> keyIds;
  private final long fetchedAtNanos;
  private final long refreshAtNanos;
  private final long expiresAtNanos;

  private JwksBundle(ImmutableList<JsonWebKey> keys, long fetchedAtNanos, long refreshAtNanos,
      long expiresAtNanos) {
    this.keys = keys;
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    for (JsonWebKey key : keys) {
      if (key.getKeyId() != null) {
        ids.add(key.getKeyId());
      }
    }
    this.keyIds = ids.build();
    this.fetchedAtNanos = fetchedAtNanos;
    this.refreshAtNanos = refreshAtNanos;
    this.expiresAtNanos = expiresAtNanos;
  }

  /**
   * @param keySet the fetched keys
   * @param nowNanos the ticker reading at fetch time
   * @param ttl how long the keys may be used without a refresh
   * @param refreshFraction the fraction of {@code ttl} after which a
   *     background refresh is due
   */
  static JwksBundle create(JsonWebKeySet keySet, long nowNanos, Duration ttl,
      double refreshFraction) {
    Preconditions.checkArgument(refreshFraction > 0 && refreshFraction < 1);
    long ttlNanos = ttl.toNanos();
    return new JwksBundle(ImmutableList.copyOf(keySet.getJsonWebKeys()), nowNanos,
        nowNanos + (long) (ttlNanos * refreshFraction), nowNanos + ttlNanos);
  }

  public ImmutableList<JsonWebKey> getKeys() {
    return keys;
  }

  public boolean containsKeyId(String keyId) {
    return keyIds.contains(keyId);
  }

  public int size() {
    return keys.size();
  }

  public long getFetchedAtNanos() {
    return fetchedAtNanos;
  }

  public long getRefreshAtNanos() {
    return refreshAtNanos;
  }

  public long getExpiresAtNanos() {
    return expiresAtNanos;
  }

  boolean needsRefresh(long nowNanos) {
    return nowNanos - refreshAtNanos >= 0;
  }

  boolean isExpired(long nowNanos) {
    return nowNanos - expiresAtNanos >= 0;
  }

  /**
   * @return {@code true} while the bundle is unexpired or within
   *     {@code graceNanos} of its expiry
   */
  boolean isUsable(long nowNanos, long graceNanos) {
    return nowNanos - (expiresAtNanos + graceNanos) < 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("keyIds", keyIds)
        .add("fetchedAtNanos", fetchedAtNanos)
        .add("expiresAtNanos", expiresAtNanos)
        .toString();
  }
}
