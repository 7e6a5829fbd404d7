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

package com.orientor.authcache.session;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Striped;
import com.orientor.authcache.auth.UnauthenticatedException;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.cache.CacheEntry;
import com.orientor.authcache.cache.CacheStatistics;
import com.orientor.authcache.cache.Sweepable;
import com.orientor.authcache.cache.TtlCache;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.IntegrityException;
import com.orientor.authcache.crypto.KeyContext;
import com.orientor.authcache.crypto.SecureKeyGenerator;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

import javax.annotation.Nullable;

/**
 * Caches the materialized sessions of users, encrypted.
 *
 * <p>A session is fresh for the configured time-to-live after it was last
 * confirmed against the database. A fresh session is served without any
 * locking. Past that point the next reader reconciles it through
 * {@link SmartDatabaseSync} while holding the lock of the subject's stripe,
 * so concurrent readers of one subject trigger one database round trip and
 * readers of other subjects are not held up. If the database cannot be
 * reached, the last confirmed session keeps being served until the hard
 * ceiling has passed since its confirmation; after that readers fail.
 */
public final class UserSessionCache implements Sweepable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int LOCK_STRIPES = 64;

  private static final class SessionEntry {
    final byte[] ciphertext;
    final long freshUntilNanos;

    SessionEntry(byte[] ciphertext, long freshUntilNanos) {
      this.ciphertext = ciphertext;
      this.freshUntilNanos = freshUntilNanos;
    }
  }

  private final SmartDatabaseSync databaseSync;
  private final SessionRecordCodec codec;
  private final SecureKeyGenerator keyGenerator;
  private final long ttlNanos;
  private final Duration hardCeiling;
  private final Ticker ticker;
  private final TtlCache<String, SessionEntry> entries;
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public UserSessionCache(SmartDatabaseSync databaseSync, CacheCipher cipher,
      SecureKeyGenerator keyGenerator, Duration ttl, Duration hardCeiling, int maximumSize,
      Ticker ticker) {
    Preconditions.checkArgument(hardCeiling.compareTo(ttl) >= 0,
        "the hard ceiling must not be shorter than the time-to-live");
    this.databaseSync = Preconditions.checkNotNull(databaseSync);
    this.codec = new SessionRecordCodec(cipher);
    this.keyGenerator = Preconditions.checkNotNull(keyGenerator);
    this.ttlNanos = ttl.toNanos();
    this.hardCeiling = hardCeiling;
    this.ticker = Preconditions.checkNotNull(ticker);
    this.entries = new TtlCache<>("user-session", hardCeiling, maximumSize, ticker);
  }

  /**
   * Returns the current session of {@code subjectId}.
   *
   * @throws UnauthenticatedException with {@link Reason#USER_NOT_FOUND} if the
   *     user does not exist, or {@link Reason#SESSION_UNAVAILABLE} if the
   *     database is unreachable and no session within the hard ceiling is
   *     held
   * @throws IntegrityException if the cached session was tampered with
   */
  public UserSessionRecord getSession(String subjectId) {
    Preconditions.checkNotNull(subjectId);
    String key = keyGenerator.cacheKey(KeyContext.USER_SESSION, subjectId);

    SessionEntry fresh = freshEntry(key);
    if (fresh != null) {
      hits.incrementAndGet();
      return decode(key, subjectId, fresh);
    }

    Lock lock = locks.get(key);
    lock.lock();
    try {
      fresh = freshEntry(key);
      if (fresh != null) {
        hits.incrementAndGet();
        return decode(key, subjectId, fresh);
      }
      misses.incrementAndGet();
      return synchronize(key, subjectId);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops the session of {@code subjectId} so that the next read reloads it.
   * Every write to a user's profile or roles must call this.
   */
  public void invalidate(String subjectId) {
    String key = keyGenerator.cacheKey(KeyContext.USER_SESSION, subjectId);
    Lock lock = locks.get(key);
    lock.lock();
    try {
      if (entries.invalidate(key)) {
        logger.atFine().log("invalidated the session of %s", subjectId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops every session.
   */
  public void clear() {
    entries.invalidateAll();
    logger.atInfo().log("cleared all cached sessions");
  }

  public int size() {
    return entries.size();
  }

  @Override
  public int cleanUp() {
    return entries.cleanUp();
  }

  @Override
  public String getName() {
    return entries.getName();
  }

  /**
   * @return hits are sessions served fresh, misses are reads that went to
   *     the database
   */
  public CacheStatistics statistics() {
    return new CacheStatistics(hits.get(), misses.get(),
        entries.statistics().getEvictionCount(), entries.size());
  }

  public SmartDatabaseSync getDatabaseSync() {
    return databaseSync;
  }

  @Nullable
  private SessionEntry freshEntry(String key) {
    Optional<CacheEntry<SessionEntry>> entry = entries.peekEntry(key);
    if (entry.isPresent() && ticker.read() - entry.get().getValue().freshUntilNanos < 0) {
      return entry.get().getValue();
    }
    return null;
  }

  private UserSessionRecord synchronize(String key, String subjectId) {
    Optional<CacheEntry<SessionEntry>> held = entries.peekEntry(key);
    UserSessionRecord cached = held.isPresent()
        ? decode(key, subjectId, held.get().getValue())
        : null;

    SmartDatabaseSync.Outcome outcome;
    try {
      outcome = databaseSync.synchronize(subjectId, cached);
    } catch (UserStoreException e) {
      if (cached != null) {
        databaseSync.recordStaleServed();
        logger.atWarning().withCause(e).atMostEvery(30, TimeUnit.SECONDS)
            .log("user store unavailable, serving the last confirmed session of %s", subjectId);
        return cached;
      }
      throw new UnauthenticatedException(Reason.SESSION_UNAVAILABLE,
          "The session of " + subjectId + " cannot be loaded", e);
    } catch (UnauthenticatedException e) {
      entries.invalidate(key);
      throw e;
    }

    if (outcome.isUnchanged()) {
      store(key, held.get().getValue().ciphertext);
      return cached;
    }
    UserSessionRecord record = outcome.getRecord();
    store(key, codec.encode(record));
    return record;
  }

  private void store(String key, byte[] ciphertext) {
    entries.put(key, new SessionEntry(ciphertext, ticker.read() + ttlNanos), hardCeiling);
  }

  private UserSessionRecord decode(String key, String subjectId, SessionEntry entry) {
    try {
      return codec.decode(subjectId, entry.ciphertext);
    } catch (IntegrityException e) {
      entries.invalidate(key);
      throw e;
    }
  }
}
