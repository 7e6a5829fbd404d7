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
import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import javax.annotation.Nullable;

/**
 * Derives cache keys from credentials and identifiers.
 *
 * <p>Every key is an HMAC-SHA256 under a secret salt, over the
 * {@link KeyContext} and the length-prefixed inputs. The full 256 bits are
 * kept. Without a configured salt a random one is drawn per process, so keys
 * do not survive a restart.
 */
public final class SecureKeyGenerator {
  public static final int SALT_BYTES = 32;

  private final HashFunction mac;

  /**
   * Creates a generator keyed with a fresh random salt.
   */
  public SecureKeyGenerator() {
    this(randomSalt());
  }

  public SecureKeyGenerator(byte[] salt) {
    Preconditions.checkArgument(salt.length >= 16, "the key salt must be at least 16 bytes");
    this.mac = Hashing.hmacSha256(salt);
  }

  /**
   * Fingerprints a token for the token validation cache.
   */
  public TokenFingerprint fingerprint(String rawToken, @Nullable String subjectId) {
    return fingerprint(KeyContext.TOKEN_VALIDATION, rawToken, subjectId);
  }

  /**
   * Fingerprints a token for use in {@code context}. The same token and
   * subject give unrelated fingerprints in different contexts.
   */
  public TokenFingerprint fingerprint(KeyContext context, String rawToken,
      @Nullable String subjectId) {
    Preconditions.checkNotNull(context);
    Preconditions.checkNotNull(rawToken);
    Hasher hasher = mac.newHasher();
    putField(hasher, context.getLabel());
    putField(hasher, Strings.nullToEmpty(subjectId));
    putField(hasher, rawToken);
    return new TokenFingerprint(hasher.hash().asBytes());
  }

  /**
   * Derives a printable key for {@code parts} in {@code context}. The result
   * starts with the context label so entries stay recognizable in dumps.
   */
  public String cacheKey(KeyContext context, String... parts) {
    Preconditions.checkNotNull(context);
    Hasher hasher = mac.newHasher();
    putField(hasher, context.getLabel());
    for (String part : parts) {
      putField(hasher, Preconditions.checkNotNull(part));
    }
    return context.getLabel() + ":" + hasher.hash().toString();
  }

  private static void putField(Hasher hasher, String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    hasher.putInt(bytes.length).putBytes(bytes);
  }

  private static byte[] randomSalt() {
    byte[] salt = new byte[SALT_BYTES];
    new SecureRandom().nextBytes(salt);
    return salt;
  }
}
