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

import com.google.api.client.util.BackOff;
import com.google.api.client.util.ExponentialBackOff;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.cache.CacheStatistics;

import org.jose4j.jwk.JsonWebKeySet;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.concurrent.GuardedBy;

/**
 * Holds the signing keys used to verify auth tokens.
 *
 * <p>The cache moves between four states. It starts {@link State#COLD}; the
 * first lookup starts a fetch ({@link State#FETCHING}) that every concurrent
 * caller waits on, so only one request reaches the key endpoint. Once keys
 * are held the cache is {@link State#WARM}, and after the configured fraction
 * of their TTL a refresh runs in the background ({@link State#REFRESHING})
 * while readers keep using the current keys.
 *
 * <p>If refreshing fails, expired keys are still served for a grace period,
 * with a warning. After that, lookups try a blocking fetch and fail with
 * {@link Reason#KEYS_UNAVAILABLE} if it fails too.
 *
 * <p>Fetches run on the cache's own thread. A caller waiting on a fetch can
 * give up, by timeout or interruption, without cancelling it.
 */
public final class JwksCache implements Closeable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final long NEVER = Long.MIN_VALUE;

  /**
   * The lifecycle of the held key set.
   */
  public enum State {
    COLD,
    FETCHING,
    WARM,
    REFRESHING
  }

  private final JwksSupplier jwksSupplier;
  private final Ticker ticker;
  private final Duration ttl;
  private final double refreshFraction;
  private final long graceNanos;
  private final Duration fetchTimeout;
  private final long forcedRefreshMinIntervalNanos;
  private final ScheduledExecutorService executor;

  private final AtomicReference<JwksBundle> current = new AtomicReference<>();
  private final AtomicLong lastForcedRefreshNanos = new AtomicLong(NEVER);

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong refreshes = new AtomicLong();
  private final AtomicLong failedFetches = new AtomicLong();
  private final AtomicLong staleUses = new AtomicLong();
  private final AtomicLong forcedRefreshes = new AtomicLong();

  private final Object lock = new Object();
  @GuardedBy("lock")
  private SettableFuture<JwksBundle> inFlight;
  @GuardedBy("lock")
  private State state = State.COLD;
  @GuardedBy("lock")
  private boolean started;
  @GuardedBy("lock")
  private boolean closed;
  @GuardedBy("lock")
  private ScheduledFuture<?> scheduledFetch;
  @GuardedBy("lock")
  private final ExponentialBackOff retryBackOff;
  @GuardedBy("lock")
  private boolean retryPending;
  @GuardedBy("lock")
  private long retryNotBeforeNanos;

  /**
   * Constructor.
   *
   * @param jwksSupplier fetches the key set.
   * @param ttl is how long fetched keys are used before they are considered expired.
   * @param refreshFraction is the fraction of {@code ttl} after which a refresh starts.
   * @param gracePeriod is how long expired keys are still served while refreshing fails.
   * @param fetchTimeout bounds how long a caller waits on a fetch.
   * @param forcedRefreshMinInterval throttles refreshes caused by unknown key ids.
   * @param ticker measures time.
   */
  public JwksCache(JwksSupplier jwksSupplier, Duration ttl, double refreshFraction,
      Duration gracePeriod, Duration fetchTimeout, Duration forcedRefreshMinInterval,
      Ticker ticker) {
    Preconditions.checkArgument(refreshFraction > 0 && refreshFraction < 1,
        "refreshFraction must lie strictly between 0 and 1");
    this.jwksSupplier = Preconditions.checkNotNull(jwksSupplier);
    this.ttl = Preconditions.checkNotNull(ttl);
    this.refreshFraction = refreshFraction;
    this.graceNanos = gracePeriod.toNanos();
    this.fetchTimeout = Preconditions.checkNotNull(fetchTimeout);
    this.forcedRefreshMinIntervalNanos = forcedRefreshMinInterval.toNanos();
    this.ticker = Preconditions.checkNotNull(ticker);
    this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("authcache-jwks-%d")
        .build());
    this.retryBackOff = new ExponentialBackOff.Builder()
        .setInitialIntervalMillis(1000)
        .setMaxIntervalMillis((int) Math.min(Integer.MAX_VALUE, Math.max(1000,
            gracePeriod.toMillis() / 4)))
        .setMaxElapsedTimeMillis(Integer.MAX_VALUE)
        .build();
  }

  /**
   * Returns usable signing keys, fetching them if none are held.
   *
   * @throws UnauthenticatedException with {@link Reason#KEYS_UNAVAILABLE} if
   *     no usable keys can be obtained in time
   */
  public JwksBundle getKeys() {
    JwksBundle bundle = current.get();
    long now = ticker.read();
    if (bundle != null && !bundle.isExpired(now)) {
      hits.incrementAndGet();
      if (bundle.needsRefresh(now)) {
        startBackgroundFetch();
      }
      return bundle;
    }
    if (bundle != null && bundle.isUsable(now, graceNanos)) {
      staleUses.incrementAndGet();
      logger.atWarning().atMostEvery(1, TimeUnit.MINUTES).log(
          "serving signing keys past their ttl while the key endpoint is unreachable");
      startBackgroundFetch();
      return bundle;
    }
    misses.incrementAndGet();
    return await(startFetch());
  }

  /**
   * Refreshes the keys because a token names a key id the held set lacks.
   * Refreshes for this reason are throttled; while throttled the held keys
   * are returned as they are.
   */
  public JwksBundle refreshForUnknownKey(String keyId) {
    Preconditions.checkNotNull(keyId);
    JwksBundle bundle = current.get();
    if (bundle == null) {
      return getKeys();
    }
    if (bundle.containsKeyId(keyId)) {
      return bundle;
    }
    long now = ticker.read();
    long last = lastForcedRefreshNanos.get();
    if (last != NEVER && now - last < forcedRefreshMinIntervalNanos) {
      logger.atFine().log("not refreshing signing keys for unknown key id %s: throttled", keyId);
      return bundle;
    }
    if (!lastForcedRefreshNanos.compareAndSet(last, now)) {
      // Another caller started the forced refresh; wait on it if it is still running.
      ListenableFuture<JwksBundle> running;
      synchronized (lock) {
        running = inFlight;
      }
      return running == null ? current.get() : await(running);
    }
    forcedRefreshes.incrementAndGet();
    logger.atInfo().log("refreshing signing keys for unknown key id %s", keyId);
    try {
      return await(startFetch());
    } catch (UnauthenticatedException e) {
      // The held keys stay valid; the token simply fails to verify against them.
      logger.atWarning().withCause(e).log("forced refresh of signing keys failed");
      return bundle;
    }
  }

  /**
   * Starts timer driven refreshes and, if no keys are held yet, an initial
   * fetch in the background.
   */
  public void start() {
    synchronized (lock) {
      Preconditions.checkState(!closed, "the jwks cache is closed");
      if (started) {
        logger.atInfo().log("the jwks cache is already started");
        return;
      }
      started = true;
      JwksBundle bundle = current.get();
      if (bundle == null) {
        startFetch();
      } else {
        scheduleLocked(TimeUnit.NANOSECONDS.toMillis(
            Math.max(0, bundle.getRefreshAtNanos() - ticker.read())));
      }
    }
  }

  /**
   * Drops the held keys; the next lookup fetches them again.
   */
  public void invalidate() {
    current.set(null);
    synchronized (lock) {
      if (inFlight == null) {
        state = State.COLD;
      }
    }
    logger.atInfo().log("signing keys invalidated");
  }

  public State getState() {
    synchronized (lock) {
      return state;
    }
  }

  public boolean hasKeys() {
    return current.get() != null;
  }

  /**
   * @return {@code true} if the held keys are past their ttl
   */
  public boolean hasExpiredKeys() {
    JwksBundle bundle = current.get();
    return bundle != null && bundle.isExpired(ticker.read());
  }

  public CacheStatistics statistics() {
    JwksBundle bundle = current.get();
    return new CacheStatistics(hits.get(), misses.get(), 0, bundle == null ? 0 : bundle.size());
  }

  public long getRefreshCount() {
    return refreshes.get();
  }

  public long getFailedFetchCount() {
    return failedFetches.get();
  }

  public long getStaleUseCount() {
    return staleUses.get();
  }

  public long getForcedRefreshCount() {
    return forcedRefreshes.get();
  }

  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      started = false;
      if (scheduledFetch != null) {
        scheduledFetch.cancel(false);
        scheduledFetch = null;
      }
      if (inFlight != null) {
        inFlight.setException(new IllegalStateException("the jwks cache was closed"));
        inFlight = null;
      }
    }
    executor.shutdownNow();
  }

  // Readers only trigger a fetch once the back-off after a failure has passed.
  private void startBackgroundFetch() {
    synchronized (lock) {
      if (inFlight != null) {
        return;
      }
      if (retryPending && ticker.read() - retryNotBeforeNanos < 0) {
        return;
      }
      startFetch();
    }
  }

  private ListenableFuture<JwksBundle> startFetch() {
    synchronized (lock) {
      if (inFlight != null) {
        return inFlight;
      }
      if (closed) {
        return Futures.immediateFailedFuture(
            new IllegalStateException("the jwks cache is closed"));
      }
      final SettableFuture<JwksBundle> future = SettableFuture.create();
      inFlight = future;
      state = current.get() == null ? State.FETCHING : State.REFRESHING;
      try {
        executor.execute(new Runnable() {
          @Override
          public void run() {
            fetch(future);
          }
        });
      } catch (RejectedExecutionException e) {
        inFlight = null;
        state = current.get() == null ? State.COLD : State.WARM;
        future.setException(e);
      }
      return future;
    }
  }

  private void fetch(SettableFuture<JwksBundle> future) {
    JwksBundle bundle;
    try {
      JsonWebKeySet keySet = jwksSupplier.supply();
      bundle = JwksBundle.create(keySet, ticker.read(), ttl, refreshFraction);
    } catch (RuntimeException e) {
      onFetchFailure(future, e);
      return;
    }
    JwksBundle previous = current.getAndSet(bundle);
    if (previous != null) {
      refreshes.incrementAndGet();
    }
    synchronized (lock) {
      if (inFlight == future) {
        inFlight = null;
      }
      state = State.WARM;
      retryPending = false;
      retryBackOff.reset();
      scheduleLocked(TimeUnit.NANOSECONDS.toMillis(bundle.getRefreshAtNanos() - ticker.read()));
    }
    logger.atInfo().log("fetched %d signing keys", bundle.size());
    future.set(bundle);
  }

  private void onFetchFailure(SettableFuture<JwksBundle> future, RuntimeException cause) {
    failedFetches.incrementAndGet();
    long retryMillis;
    synchronized (lock) {
      if (inFlight == future) {
        inFlight = null;
      }
      state = current.get() == null ? State.COLD : State.WARM;
      retryMillis = nextRetryMillisLocked();
      retryPending = true;
      retryNotBeforeNanos = ticker.read() + TimeUnit.MILLISECONDS.toNanos(retryMillis);
      scheduleLocked(retryMillis);
    }
    logger.atWarning().withCause(cause).log(
        "fetching signing keys failed, next attempt in %d ms", retryMillis);
    future.setException(cause);
  }

  @GuardedBy("lock")
  private long nextRetryMillisLocked() {
    try {
      long next = retryBackOff.nextBackOffMillis();
      return next == BackOff.STOP ? retryBackOff.getMaxIntervalMillis() : next;
    } catch (IOException e) {
      logger.atFine().withCause(e).log("back-off failed, using its maximum interval");
      return retryBackOff.getMaxIntervalMillis();
    }
  }

  @GuardedBy("lock")
  private void scheduleLocked(long delayMillis) {
    if (!started || closed) {
      return;
    }
    if (scheduledFetch != null) {
      scheduledFetch.cancel(false);
    }
    scheduledFetch = executor.schedule(new Runnable() {
      @Override
      public void run() {
        startFetch();
      }
    }, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
  }

  private JwksBundle await(ListenableFuture<JwksBundle> future) {
    try {
      return future.get(fetchTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      throw new UnauthenticatedException(Reason.KEYS_UNAVAILABLE,
          "timed out waiting for the signing keys", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UnauthenticatedException(Reason.KEYS_UNAVAILABLE,
          "interrupted while waiting for the signing keys", e);
    } catch (ExecutionException e) {
      throw new UnauthenticatedException(Reason.KEYS_UNAVAILABLE,
          "the signing keys could not be fetched", e.getCause());
    }
  }
}
