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
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.orientor.authcache.auth.TestingTicker;
import com.orientor.authcache.auth.UnauthenticatedException;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link SmartDatabaseSync}.
 */
@RunWith(JUnit4.class)
public final class SmartDatabaseSyncTest {
  private static final String SUBJECT = "user-1";

  private final TestingTicker clock = new TestingTicker();
  private final UserStore userStore = mock(UserStore.class);
  private final SmartDatabaseSync sync = new SmartDatabaseSync(userStore,
      new PermissionResolver(ImmutableSetMultimap.of("student", "courses:read")), clock);

  @Test
  public void testUnchangedVersionSkipsProfileRead() throws Exception {
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(3L));

    SmartDatabaseSync.Outcome outcome = sync.synchronize(SUBJECT, record(3L));

    assertThat(outcome.isUnchanged()).isTrue();
    verify(userStore, never()).fetchProfile(anyString());
    assertThat(sync.getRestampCount()).isEqualTo(1L);
    assertThat(sync.getFullReloadCount()).isEqualTo(0L);
  }

  @Test
  public void testChangedVersionReloadsProfile() throws Exception {
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(4L));
    when(userStore.fetchProfile(SUBJECT)).thenReturn(Optional.of(profile(4L)));

    SmartDatabaseSync.Outcome outcome = sync.synchronize(SUBJECT, record(3L));

    assertThat(outcome.isUnchanged()).isFalse();
    UserSessionRecord reloaded = outcome.getRecord();
    assertThat(reloaded.getSourceVersion()).isEqualTo(4L);
    assertThat(reloaded.getPermissions()).containsExactly("courses:read", "beta:features");
    assertThat(reloaded.getCachedAtMillis()).isEqualTo(TestingTicker.START_MILLIS);
    assertThat(sync.getFullReloadCount()).isEqualTo(1L);
  }

  @Test
  public void testWithoutCachedRecordLoadsProfileDirectly() throws Exception {
    when(userStore.fetchProfile(SUBJECT)).thenReturn(Optional.of(profile(1L)));

    sync.synchronize(SUBJECT, null);

    verify(userStore, never()).fetchVersion(anyString());
    assertThat(sync.getVersionCheckCount()).isEqualTo(0L);
    assertThat(sync.getFullReloadCount()).isEqualTo(1L);
  }

  @Test
  public void testDeletedUser() throws Exception {
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.<Long>absent());

    try {
      sync.synchronize(SUBJECT, record(3L));
      fail();
    } catch (UnauthenticatedException exception) {
      assertThat(exception.getReason()).isEqualTo(Reason.USER_NOT_FOUND);
    }
  }

  @Test
  public void testStoreFailureIsCountedAndPropagated() throws Exception {
    UserStoreException failure = new UserStoreException("database down");
    when(userStore.fetchVersion(SUBJECT)).thenThrow(failure);

    try {
      sync.synchronize(SUBJECT, record(3L));
      fail();
    } catch (UserStoreException exception) {
      assertThat(exception).isSameInstanceAs(failure);
    }
    assertThat(sync.getErrorCount()).isEqualTo(1L);
    assertThat(sync.getAttemptCount()).isEqualTo(1L);
  }

  @Test(expected = IllegalStateException.class)
  public void testUnchangedOutcomeHasNoRecord() throws Exception {
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(3L));
    sync.synchronize(SUBJECT, record(3L)).getRecord();
  }

  static UserProfile profile(long version) {
    return UserProfile.builder()
        .setSubjectId(SUBJECT)
        .setInternalUserId(42L)
        .setEmail("ada@example.com")
        .setDisplayName("Ada")
        .addRoles("student")
        .addGrants("beta:features")
        .setSourceVersion(version)
        .build();
  }

  private static UserSessionRecord record(long version) {
    return new UserSessionRecord(SUBJECT, 42L, "ada@example.com", "Ada",
        ImmutableSet.of("student"), ImmutableSet.of("courses:read"), true, false, version, 0L);
  }
}
