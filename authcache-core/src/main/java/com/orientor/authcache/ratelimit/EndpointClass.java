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

import javax.annotation.Nullable;

/**
 * Logical classes of endpoints, each with its own request budget.
 */
public enum EndpointClass {
  /** Login and other credential-exchanging calls. */
  AUTH,
  /** Token refresh. */
  REFRESH,
  /** Any other authenticated call. */
  DEFAULT,
  PREMIUM,
  ADMIN;

  /**
   * Parses a class name case-insensitively, falling back to {@link #DEFAULT}
   * for {@code null} or unknown names.
   */
  public static EndpointClass parse(@Nullable String name) {
    if (name == null) {
      return DEFAULT;
    }
    try {
      return valueOf(Ascii.toUpperCase(name.trim()));
    } catch (IllegalArgumentException e) {
      return DEFAULT;
    }
  }
}
