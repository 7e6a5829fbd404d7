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
import com.google.common.flogger.FluentLogger;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.annotation.Nullable;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated encryption of cached payloads with AES-256-GCM.
 *
 * <p>The output is a format byte, a random 96-bit nonce, and the ciphertext
 * followed by its 128-bit tag. A caller-supplied context string is bound in
 * as associated data, so a payload only decrypts under the context it was
 * sealed with. Any tampering surfaces as an {@link IntegrityException}.
 */
public final class CacheCipher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final int MASTER_KEY_BYTES = 32;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final byte FORMAT_V1 = 1;
  private static final int NONCE_BYTES = 12;
  private static final int TAG_BITS = 128;
  private static final int HEADER_BYTES = 1 + NONCE_BYTES;
  private static final byte[] KEY_LABEL = "authcache-cache-cipher-v1".getBytes(StandardCharsets.UTF_8);
  private static final SecureRandom random = new SecureRandom();

  private final SecretKey key;

  private CacheCipher(SecretKey key) {
    this.key = key;
  }

  /**
   * Creates a cipher whose key is derived from {@code masterKey}.
   */
  public static CacheCipher fromMasterKey(byte[] masterKey) {
    Preconditions.checkArgument(masterKey.length == MASTER_KEY_BYTES,
        "the master key must be %s bytes, got %s", MASTER_KEY_BYTES, masterKey.length);
    byte[] derived = Hashing.hmacSha256(masterKey).hashBytes(KEY_LABEL).asBytes();
    return new CacheCipher(new SecretKeySpec(derived, "AES"));
  }

  /**
   * Creates a cipher from a base64 encoded master key.
   *
   * @throws IllegalArgumentException if the value is not base64 or has the
   *     wrong length
   */
  public static CacheCipher fromBase64MasterKey(String encoded) {
    return fromMasterKey(BaseEncoding.base64().decode(encoded.trim()));
  }

  /**
   * Creates a cipher with a random key. Anything it seals becomes unreadable
   * once the process exits.
   */
  public static CacheCipher withRandomKey() {
    logger.atWarning().log(
        "no cache master key configured, using a random per-process key");
    byte[] masterKey = new byte[MASTER_KEY_BYTES];
    random.nextBytes(masterKey);
    return fromMasterKey(masterKey);
  }

  public byte[] encrypt(byte[] plaintext, String context) {
    Preconditions.checkNotNull(plaintext);
    Preconditions.checkNotNull(context);
    byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));
      byte[] sealed = cipher.doFinal(plaintext);

      byte[] out = new byte[HEADER_BYTES + sealed.length];
      out[0] = FORMAT_V1;
      System.arraycopy(nonce, 0, out, 1, NONCE_BYTES);
      System.arraycopy(sealed, 0, out, HEADER_BYTES, sealed.length);
      return out;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM is not usable in this runtime", e);
    }
  }

  /**
   * Opens a payload sealed by {@link #encrypt} under the same context.
   *
   * @throws IntegrityException if the payload was altered, truncated, or
   *     sealed under another key or context
   */
  public byte[] decrypt(byte[] payload, String context) {
    Preconditions.checkNotNull(payload);
    Preconditions.checkNotNull(context);
    if (payload.length < HEADER_BYTES + TAG_BITS / 8) {
      throw securityEvent("cached payload is truncated", null);
    }
    if (payload[0] != FORMAT_V1) {
      throw securityEvent("cached payload has unknown format " + payload[0], null);
    }
    byte[] nonce = Arrays.copyOfRange(payload, 1, HEADER_BYTES);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));
      return cipher.doFinal(payload, HEADER_BYTES, payload.length - HEADER_BYTES);
    } catch (AEADBadTagException e) {
      throw securityEvent("cached payload failed authentication", e);
    } catch (GeneralSecurityException e) {
      throw securityEvent("cached payload could not be decrypted", e);
    }
  }

  private static IntegrityException securityEvent(String message, @Nullable Throwable cause) {
    logger.atSevere().log("security event: %s", message);
    return cause == null ? new IntegrityException(message) : new IntegrityException(message, cause);
  }
}
