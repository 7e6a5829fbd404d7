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

import java.time.Duration;

/**
 * Thrown when a client has used up its budget for an endpoint class.
 */
public class RateLimitExceededException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final EndpointClass endpointClass;
  private final int limit;
  private final Duration retryAfter;

  public RateLimitExceededException(EndpointClass endpointClass, int limit, Duration retryAfter) {
    super(String.format("rate limit of %d requests exceeded for %s endpoints", limit,
        endpointClass));
    this.endpointClass = endpointClass;
    this.limit = limit;
    this.retryAfter = retryAfter;
  }

  public EndpointClass getEndpointClass() {
    return endpointClass;
  }

  public int getLimit() {
    return limit;
  }

  /**
   * @return how long until the oldest counted request leaves the window
   */
  public Duration getRetryAfter() {
    return retryAfter;
  }
}
