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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.cache.Sweepable;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

/**
 * One {@link SlidingWindowRateLimiter} per {@link EndpointClass}.
 *
 * <p>A client's usage of one class never counts against another class.
 * Classes without a configured policy are limited by the
 * {@link EndpointClass#DEFAULT} budget, in a window set of their own.
 */
public final class TieredRateLimiter implements Sweepable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableMap<EndpointClass, SlidingWindowRateLimiter> limiters;

  public TieredRateLimiter(Map<EndpointClass, RateLimitPolicy> policies) {
    this(policies, Ticker.systemTicker());
  }

  public TieredRateLimiter(Map<EndpointClass, RateLimitPolicy> policies, Ticker ticker) {
    Preconditions.checkNotNull(ticker);
    RateLimitPolicy fallback = policies.containsKey(EndpointClass.DEFAULT)
        ? policies.get(EndpointClass.DEFAULT)
        : RateLimitPolicy.DEFAULTS.get(EndpointClass.DEFAULT);
    EnumMap<EndpointClass, SlidingWindowRateLimiter> built = Maps.newEnumMap(EndpointClass.class);
    for (EndpointClass endpointClass : EndpointClass.values()) {
      RateLimitPolicy policy = policies.containsKey(endpointClass)
          ? policies.get(endpointClass)
          : fallback;
      built.put(endpointClass, new SlidingWindowRateLimiter(
          "rate-limit-" + Ascii.toLowerCase(endpointClass.name()), policy, ticker));
    }
    this.limiters = Maps.immutableEnumMap(built);
  }

  /**
   * @return {@code true} if the request is admitted
   */
  public boolean allow(String clientId, @Nullable EndpointClass endpointClass) {
    return limiterFor(endpointClass).allow(clientId);
  }

  /**
   * Counts a request, throwing if the client is over budget.
   *
   * @throws RateLimitExceededException if the request is denied
   */
  public void checkAllowed(String clientId, @Nullable EndpointClass endpointClass) {
    SlidingWindowRateLimiter limiter = limiterFor(endpointClass);
    if (!limiter.allow(clientId)) {
      EndpointClass resolved = endpointClass == null ? EndpointClass.DEFAULT : endpointClass;
      logger.atWarning().atMostEvery(10, TimeUnit.SECONDS)
          .log("rate limit exceeded for %s endpoints", resolved);
      throw new RateLimitExceededException(resolved, limiter.getPolicy().getMaxRequests(),
          limiter.retryAfter(clientId));
    }
  }

  public SlidingWindowRateLimiter limiterFor(@Nullable EndpointClass endpointClass) {
    return limiters.get(endpointClass == null ? EndpointClass.DEFAULT : endpointClass);
  }

  @Override
  public int cleanUp() {
    int removed = 0;
    for (SlidingWindowRateLimiter limiter : limiters.values()) {
      removed += limiter.cleanUp();
    }
    return removed;
  }

  @Override
  public String getName() {
    return "rate-limiter";
  }
}
