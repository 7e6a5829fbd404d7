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

import com.google.api.client.util.Clock;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.auth.UnauthenticatedException;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;

import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

/**
 * Reconciles a cached session with the database.
 *
 * <p>When a cached record is at hand only its version is read back. A
 * matching version means the record is still current and nothing else is
 * read; otherwise, or without a cached record, the full profile is loaded
 * and its permissions resolved.
 */
public final class SmartDatabaseSync {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * The result of a synchronization.
   */
  public static final class Outcome {
    private static final Outcome UNCHANGED = new Outcome(null);

    @Nullable private final UserSessionRecord record;

    private Outcome(@Nullable UserSessionRecord record) {
      this.record = record;
    }

    /**
     * @return {@code true} if the cached record is still current
     */
    public boolean isUnchanged() {
      return record == null;
    }

    /**
     * @return the reloaded record
     * @throws IllegalStateException if the cached record was current
     */
    public UserSessionRecord getRecord() {
      Preconditions.checkState(record != null, "the cached record is current");
      return record;
    }
  }

  private final UserStore userStore;
  private final PermissionResolver permissionResolver;
  private final Clock clock;

  private final AtomicLong attempts = new AtomicLong();
  private final AtomicLong versionChecks = new AtomicLong();
  private final AtomicLong restamps = new AtomicLong();
  private final AtomicLong fullReloads = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong staleServed = new AtomicLong();
  private volatile boolean storeReachable = true;

  public SmartDatabaseSync(UserStore userStore, PermissionResolver permissionResolver,
      Clock clock) {
    this.userStore = Preconditions.checkNotNull(userStore);
    this.permissionResolver = Preconditions.checkNotNull(permissionResolver);
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * Brings the session of {@code subjectId} up to date.
   *
   * @param cached the record currently cached, if any
   * @throws UnauthenticatedException with {@link Reason#USER_NOT_FOUND} if
   *     the user no longer exists
   * @throws UserStoreException if the database cannot be read
   */
  public Outcome synchronize(String subjectId, @Nullable UserSessionRecord cached)
      throws UserStoreException {
    Preconditions.checkNotNull(subjectId);
    attempts.incrementAndGet();
    try {
      Outcome outcome = synchronizeWithStore(subjectId, cached);
      storeReachable = true;
      return outcome;
    } catch (UnauthenticatedException e) {
      storeReachable = true;
      throw e;
    } catch (UserStoreException e) {
      errors.incrementAndGet();
      storeReachable = false;
      throw e;
    }
  }

  private Outcome synchronizeWithStore(String subjectId, @Nullable UserSessionRecord cached)
      throws UserStoreException {
    if (cached != null) {
      versionChecks.incrementAndGet();
      Optional<Long> version = userStore.fetchVersion(subjectId);
      if (!version.isPresent()) {
        throw userNotFound(subjectId);
      }
      if (version.get() == cached.getSourceVersion()) {
        restamps.incrementAndGet();
        logger.atFine().log("session of %s unchanged at version %d", subjectId, version.get());
        return Outcome.UNCHANGED;
      }
      logger.atFine().log("session of %s moved from version %d to %d", subjectId,
          cached.getSourceVersion(), version.get());
    }
    return new Outcome(reload(subjectId));
  }

  private UserSessionRecord reload(String subjectId) throws UserStoreException {
    fullReloads.incrementAndGet();
    Optional<UserProfile> profile = userStore.fetchProfile(subjectId);
    if (!profile.isPresent()) {
      throw userNotFound(subjectId);
    }
    UserProfile user = profile.get();
    return UserSessionRecord.fromProfile(user,
        permissionResolver.resolve(user.getRoles(), user.getGrants()),
        clock.currentTimeMillis());
  }

  private static UnauthenticatedException userNotFound(String subjectId) {
    logger.atInfo().log("user %s no longer exists", subjectId);
    return new UnauthenticatedException(Reason.USER_NOT_FOUND, "Unknown user " + subjectId);
  }

  void recordStaleServed() {
    staleServed.incrementAndGet();
  }

  public long getAttemptCount() {
    return attempts.get();
  }

  public long getVersionCheckCount() {
    return versionChecks.get();
  }

  /**
   * @return how many synchronizations found the cached record current
   */
  public long getRestampCount() {
    return restamps.get();
  }

  public long getFullReloadCount() {
    return fullReloads.get();
  }

  public long getErrorCount() {
    return errors.get();
  }

  /**
   * @return {@code false} if the last read of the database failed
   */
  public boolean isStoreReachable() {
    return storeReachable;
  }

  /**
   * @return how often a stale record was served because the database was
   *     unavailable
   */
  public long getStaleServedCount() {
    return staleServed.get();
  }
}
