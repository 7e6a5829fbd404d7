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

import com.google.common.base.Preconditions;

/**
 * Thrown when a request cannot be authenticated. The {@link Reason} tells
 * callers whether the client or the server side is at fault; the message is
 * for logs only and is never sent to the client.
 */
public class UnauthenticatedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Why authentication failed.
   */
  public enum Reason {
    MISSING_TOKEN,
    MALFORMED_TOKEN,
    EXPIRED_TOKEN,
    BAD_SIGNATURE,
    /** The issuer, audience or not-before claim was not acceptable. */
    INVALID_CLAIMS,
    KEYS_UNAVAILABLE,
    USER_NOT_FOUND,
    USER_INACTIVE,
    SESSION_UNAVAILABLE;

    /**
     * @return {@code true} if the failure comes from an unavailable
     *     dependency rather than from the credential
     */
    public boolean isServerSide() {
      return this == KEYS_UNAVAILABLE || this == SESSION_UNAVAILABLE;
    }
  }

  private final Reason reason;

  public UnauthenticatedException(Reason reason, String message) {
    super(message);
    this.reason = Preconditions.checkNotNull(reason);
  }

  public UnauthenticatedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Preconditions.checkNotNull(reason);
  }

  public Reason getReason() {
    return reason;
  }
}
