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

package com.orientor.authcache.session;

import com.google.common.base.Preconditions;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.IntegrityException;
import com.orientor.authcache.crypto.KeyContext;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Turns session records into the encrypted form the session cache holds.
 *
 * <p>Each ciphertext is bound to the subject it belongs to, so an entry
 * copied under another subject fails to decrypt.
 */
final class SessionRecordCodec {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final CacheCipher cipher;

  SessionRecordCodec(CacheCipher cipher) {
    this.cipher = Preconditions.checkNotNull(cipher);
  }

  byte[] encode(UserSessionRecord record) {
    byte[] json;
    try {
      json = OBJECT_MAPPER.writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize the session of " + record.getSubjectId(),
          e);
    }
    return cipher.encrypt(json, context(record.getSubjectId()));
  }

  /**
   * @throws IntegrityException if the payload was altered or belongs to
   *     another subject
   */
  UserSessionRecord decode(String subjectId, byte[] payload) {
    byte[] json = cipher.decrypt(payload, context(subjectId));
    UserSessionRecord record;
    try {
      record = OBJECT_MAPPER.readValue(json, UserSessionRecord.class);
    } catch (IOException e) {
      throw new IntegrityException("cached session cannot be read", e);
    }
    if (!subjectId.equals(record.getSubjectId())) {
      throw new IntegrityException("cached session belongs to another subject");
    }
    return record;
  }

  private static String context(String subjectId) {
    return KeyContext.SESSION_PAYLOAD.getLabel() + ":" + subjectId;
  }
}
