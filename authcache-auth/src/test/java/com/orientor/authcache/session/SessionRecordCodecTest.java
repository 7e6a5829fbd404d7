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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.IntegrityException;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.nio.charset.StandardCharsets;

/**
 * Tests for {@link SessionRecordCodec}.
 */
@RunWith(JUnit4.class)
public final class SessionRecordCodecTest {
  private final SessionRecordCodec codec = new SessionRecordCodec(CacheCipher.withRandomKey());

  private final UserSessionRecord record = new UserSessionRecord("user-1", 42L,
      "ada@example.com", null, ImmutableSet.of("student"),
      ImmutableSet.of("courses:read"), true, true, 7L, 1700000000000L);

  @Test
  public void testDecodeRestoresTheRecord() {
    assertThat(codec.decode("user-1", codec.encode(record))).isEqualTo(record);
  }

  @Test
  public void testPayloadDoesNotExposeTheEmail() {
    String payload = new String(codec.encode(record), StandardCharsets.ISO_8859_1);
    assertThat(payload).doesNotContain("ada@example.com");
  }

  @Test(expected = IntegrityException.class)
  public void testPayloadOfAnotherSubjectIsRejected() {
    codec.decode("user-2", codec.encode(record));
  }
}
