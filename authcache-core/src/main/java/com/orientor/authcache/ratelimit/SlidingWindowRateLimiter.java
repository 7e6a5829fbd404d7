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

package com.orientor.authcache.ratelimit;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.cache.Sweepable;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A per-client sliding-window request limiter.
 *
 * <p>Each client has a log of the times its admitted requests arrived. A new
 * request is admitted while fewer than the budget of logged requests fall in
 * the trailing window, so the window moves with every request and there is
 * no boundary at which the budget resets. Denied requests are not logged.
 * Clients are independent; each log is guarded by its own monitor.
 */
public final class SlidingWindowRateLimiter implements Sweepable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final RateLimitPolicy policy;
  private final long windowNanos;
  private final Ticker ticker;
  private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();

  private final AtomicLong allowed = new AtomicLong();
  private final AtomicLong denied = new AtomicLong();

  public SlidingWindowRateLimiter(String name, RateLimitPolicy policy) {
    this(name, policy, Ticker.systemTicker());
  }

  public SlidingWindowRateLimiter(String name, RateLimitPolicy policy, Ticker ticker) {
    this.name = Preconditions.checkNotNull(name);
    this.policy = Preconditions.checkNotNull(policy);
    this.windowNanos = policy.getWindow().toNanos();
    this.ticker = Preconditions.checkNotNull(ticker);
  }

  /**
   * Counts a request from {@code clientId} if its budget allows it.
   *
   * @return {@code true} if the request is admitted
   */
  public boolean allow(String clientId) {
    Preconditions.checkNotNull(clientId);
    while (true) {
      RateWindow window = windowFor(clientId);
      synchronized (window) {
        if (window.isRetired()) {
          continue;
        }
        long now = ticker.read();
        window.evictBefore(now - windowNanos);
        if (window.count() >= policy.getMaxRequests()) {
          denied.incrementAndGet();
          logger.atFine().log("%s: denied a request, budget %s used up", name, policy);
          return false;
        }
        window.record(now);
        allowed.incrementAndGet();
        return true;
      }
    }
  }

  /**
   * @return how long {@code clientId} must wait before a request would be
   *     admitted, zero if it would be admitted now
   */
  public Duration retryAfter(String clientId) {
    Preconditions.checkNotNull(clientId);
    RateWindow window = windows.get(clientId);
    if (window == null) {
      return Duration.ZERO;
    }
    synchronized (window) {
      long now = ticker.read();
      window.evictBefore(now - windowNanos);
      if (window.count() < policy.getMaxRequests()) {
        return Duration.ZERO;
      }
      long waitNanos = window.oldest() + windowNanos - now;
      // Rounded up to whole seconds, the unit of a Retry-After header.
      return Duration.ofSeconds(Math.max(1, TimeUnit.NANOSECONDS.toSeconds(waitNanos
          + TimeUnit.SECONDS.toNanos(1) - 1)));
    }
  }

  /**
   * @return the number of requests {@code clientId} could still make now
   */
  public int remaining(String clientId) {
    Preconditions.checkNotNull(clientId);
    RateWindow window = windows.get(clientId);
    if (window == null) {
      return policy.getMaxRequests();
    }
    synchronized (window) {
      window.evictBefore(ticker.read() - windowNanos);
      return Math.max(0, policy.getMaxRequests() - window.count());
    }
  }

  /**
   * Forgets everything recorded for {@code clientId}.
   */
  public void reset(String clientId) {
    RateWindow window = windows.remove(Preconditions.checkNotNull(clientId));
    if (window != null) {
      synchronized (window) {
        window.retire();
      }
    }
  }

  /**
   * Drops the logs of clients with no request left in their window.
   */
  @Override
  public int cleanUp() {
    long cutoff = ticker.read() - windowNanos;
    int removed = 0;
    for (Map.Entry<String, RateWindow> e : windows.entrySet()) {
      RateWindow window = e.getValue();
      synchronized (window) {
        window.evictBefore(cutoff);
        if (window.isEmpty() && windows.remove(e.getKey(), window)) {
          window.retire();
          removed++;
        }
      }
    }
    return removed;
  }

  @Override
  public String getName() {
    return name;
  }

  public RateLimitPolicy getPolicy() {
    return policy;
  }

  public int trackedClients() {
    return windows.size();
  }

  public long getAllowedCount() {
    return allowed.get();
  }

  public long getDeniedCount() {
    return denied.get();
  }

  private RateWindow windowFor(String clientId) {
    RateWindow window = windows.get(clientId);
    if (window != null) {
      return window;
    }
    RateWindow created = new RateWindow();
    window = windows.putIfAbsent(clientId, created);
    return window == null ? created : window;
  }
}
