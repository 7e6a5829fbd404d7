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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.List;

/**
 * A request budget: at most {@code maxRequests} within any window of length
 * {@code window}.
 */
public final class RateLimitPolicy {
  /**
   * The budgets used when nothing else is configured.
   */
  public static final ImmutableMap<EndpointClass, RateLimitPolicy> DEFAULTS =
      ImmutableMap.<EndpointClass, RateLimitPolicy>builder()
          .put(EndpointClass.AUTH, new RateLimitPolicy(5, Duration.ofMinutes(5)))
          .put(EndpointClass.REFRESH, new RateLimitPolicy(10, Duration.ofMinutes(1)))
          .put(EndpointClass.DEFAULT, new RateLimitPolicy(100, Duration.ofMinutes(1)))
          .put(EndpointClass.PREMIUM, new RateLimitPolicy(1000, Duration.ofMinutes(1)))
          .put(EndpointClass.ADMIN, new RateLimitPolicy(10000, Duration.ofMinutes(1)))
          .build();

  private static final Splitter SLASH = Splitter.on('/').trimResults();

  private final int maxRequests;
  private final Duration window;

  public RateLimitPolicy(int maxRequests, Duration window) {
    Preconditions.checkArgument(maxRequests > 0, "a request budget must be positive");
    Preconditions.checkArgument(!window.isNegative() && !window.isZero(),
        "a rate limit window must be positive");
    this.maxRequests = maxRequests;
    this.window = window;
  }

  /**
   * Parses {@code "<requests>/<window seconds>"}, e.g. {@code "5/300"}.
   *
   * @throws IllegalArgumentException if {@code text} is not in that form
   */
  public static RateLimitPolicy parse(String text) {
    List<String> parts = SLASH.splitToList(text);
    Preconditions.checkArgument(parts.size() == 2,
        "a rate limit must look like <requests>/<seconds>, got '%s'", text);
    try {
      return new RateLimitPolicy(Integer.parseInt(parts.get(0)),
          Duration.ofSeconds(Long.parseLong(parts.get(1))));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("a rate limit must look like <requests>/<seconds>, got '"
          + text + "'", e);
    }
  }

  public int getMaxRequests() {
    return maxRequests;
  }

  public Duration getWindow() {
    return window;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RateLimitPolicy)) {
      return false;
    }
    RateLimitPolicy that = (RateLimitPolicy) o;
    return maxRequests == that.maxRequests && window.equals(that.window);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(maxRequests, window);
  }

  @Override
  public String toString() {
    return maxRequests + "/" + window.getSeconds() + "s";
  }
}
