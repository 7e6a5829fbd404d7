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

package com.orientor.authcache.crypto;

/**
 * The purposes a derived cache key can serve. Keys derived for one context
 * never collide with keys derived for another from the same inputs.
 */
public enum KeyContext {
  TOKEN_VALIDATION("token-validation"),
  NEGATIVE_VALIDATION("negative-validation"),
  USER_SESSION("user-session"),
  REQUEST("request"),
  SESSION_PAYLOAD("session-payload");

  private final String label;

  KeyContext(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
