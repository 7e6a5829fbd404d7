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

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * A 256-bit keyed digest standing in for a credential wherever it has to be
 * used as a lookup key.
 *
 * <p>{@link #toString()} prints only a short prefix, so a fingerprint can be
 * logged without leaking the full key.
 */
public final class TokenFingerprint {
  public static final int SIZE_BYTES = 32;
  private static final int LOGGED_HEX_CHARS = 12;

  private final byte[] digest;
  private final int hashCode;

  TokenFingerprint(byte[] digest) {
    Preconditions.checkArgument(digest.length == SIZE_BYTES,
        "a fingerprint is %s bytes, got %s", SIZE_BYTES, digest.length);
    this.digest = digest.clone();
    this.hashCode = Arrays.hashCode(digest);
  }

  /**
   * @return the full lowercase hex encoding, suitable as a map key
   */
  public String toHex() {
    return BaseEncoding.base16().lowerCase().encode(digest);
  }

  public byte[] toByteArray() {
    return digest.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TokenFingerprint)) {
      return false;
    }
    return MessageDigest.isEqual(digest, ((TokenFingerprint) o).digest);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return toHex().substring(0, LOGGED_HEX_CHARS) + "...";
  }
}
