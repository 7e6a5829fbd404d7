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

import java.util.ArrayDeque;

/**
 * The admitted request times of one client, oldest first.
 *
 * <p>Not thread-safe; {@link SlidingWindowRateLimiter} guards each instance
 * with its monitor. A retired window has been dropped from the limiter and
 * must not record anything more.
 */
final class RateWindow {
  private final ArrayDeque<Long> admitted = new ArrayDeque<>();
  private boolean retired;

  void evictBefore(long cutoffNanos) {
    while (!admitted.isEmpty() && admitted.peekFirst() - cutoffNanos <= 0) {
      admitted.pollFirst();
    }
  }

  void record(long nowNanos) {
    admitted.addLast(nowNanos);
  }

  int count() {
    return admitted.size();
  }

  boolean isEmpty() {
    return admitted.isEmpty();
  }

  /**
   * @return the time of the oldest admitted request still in the window
   */
  long oldest() {
    return admitted.peekFirst();
  }

  void retire() {
    retired = true;
  }

  boolean isRetired() {
    return retired;
  }
}
