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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSetMultimap;
import com.orientor.authcache.auth.TestingTicker;
import com.orientor.authcache.auth.UnauthenticatedException;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.SecureKeyGenerator;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tests for {@link UserSessionCache}.
 */
@RunWith(JUnit4.class)
public final class UserSessionCacheTest {
  private static final String SUBJECT = "user-1";
  private static final Duration TTL = Duration.ofMinutes(15);
  private static final Duration HARD_CEILING = Duration.ofMinutes(60);

  private final TestingTicker ticker = new TestingTicker();
  private final UserStore userStore = mock(UserStore.class);
  private SmartDatabaseSync sync;
  private UserSessionCache cache;

  @Before
  public void setUp() throws Exception {
    sync = new SmartDatabaseSync(userStore,
        new PermissionResolver(ImmutableSetMultimap.of("student", "courses:read")), ticker);
    cache = new UserSessionCache(sync, CacheCipher.withRandomKey(), new SecureKeyGenerator(),
        TTL, HARD_CEILING, 100, ticker);
    when(userStore.fetchProfile(SUBJECT))
        .thenReturn(Optional.of(SmartDatabaseSyncTest.profile(1L)));
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(1L));
  }

  @Test
  public void testFreshSessionIsServedWithoutDatabaseAccess() throws Exception {
    UserSessionRecord first = cache.getSession(SUBJECT);
    UserSessionRecord second = cache.getSession(SUBJECT);

    assertThat(second).isEqualTo(first);
    assertThat(first.getPermissions()).containsExactly("courses:read", "beta:features");
    verify(userStore, times(1)).fetchProfile(SUBJECT);
    verify(userStore, never()).fetchVersion(anyString());
    assertThat(cache.statistics().getHitCount()).isEqualTo(1L);
    assertThat(cache.statistics().getMissCount()).isEqualTo(1L);
  }

  @Test
  public void testExpiredSessionWithSameVersionIsRestamped() throws Exception {
    cache.getSession(SUBJECT);
    ticker.advance(TTL);

    cache.getSession(SUBJECT);
    verify(userStore, times(1)).fetchVersion(SUBJECT);
    verify(userStore, times(1)).fetchProfile(SUBJECT);

    // Fresh again for another full time-to-live.
    ticker.advance(TTL.minus(Duration.ofSeconds(1)));
    cache.getSession(SUBJECT);
    verify(userStore, times(1)).fetchVersion(SUBJECT);
    assertThat(sync.getRestampCount()).isEqualTo(1L);
  }

  @Test
  public void testExpiredSessionWithNewVersionIsReloaded() throws Exception {
    cache.getSession(SUBJECT);
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(2L));
    when(userStore.fetchProfile(SUBJECT)).thenReturn(Optional.of(UserProfile.builder()
        .setSubjectId(SUBJECT)
        .setInternalUserId(42L)
        .setEmail("ada@example.com")
        .addRoles("student", "mentor")
        .setSourceVersion(2L)
        .build()));
    ticker.advance(TTL);

    UserSessionRecord reloaded = cache.getSession(SUBJECT);

    assertThat(reloaded.getSourceVersion()).isEqualTo(2L);
    assertThat(reloaded.getRoles()).containsExactly("student", "mentor");
    verify(userStore, times(2)).fetchProfile(SUBJECT);
  }

  @Test
  public void testInvalidateForcesReload() throws Exception {
    cache.getSession(SUBJECT);

    cache.invalidate(SUBJECT);
    cache.getSession(SUBJECT);

    verify(userStore, times(2)).fetchProfile(SUBJECT);
    verify(userStore, never()).fetchVersion(anyString());
  }

  @Test
  public void testStaleSessionServedWhileStoreIsDownUntilHardCeiling() throws Exception {
    UserSessionRecord first = cache.getSession(SUBJECT);
    when(userStore.fetchVersion(SUBJECT)).thenThrow(new UserStoreException("down"));
    when(userStore.fetchProfile(SUBJECT)).thenThrow(new UserStoreException("down"));

    ticker.advance(TTL.plus(Duration.ofMinutes(1)));
    assertThat(cache.getSession(SUBJECT)).isEqualTo(first);
    assertThat(sync.getStaleServedCount()).isEqualTo(1L);

    ticker.advance(HARD_CEILING);
    assertRejected(Reason.SESSION_UNAVAILABLE);
  }

  @Test
  public void testStoreDownWithNothingCached() throws Exception {
    when(userStore.fetchProfile(SUBJECT)).thenThrow(new UserStoreException("down"));
    assertRejected(Reason.SESSION_UNAVAILABLE);
  }

  @Test
  public void testDeletedUserIsEvicted() throws Exception {
    cache.getSession(SUBJECT);
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.<Long>absent());
    ticker.advance(TTL);

    assertRejected(Reason.USER_NOT_FOUND);
    assertThat(cache.size()).isEqualTo(0);
  }

  @Test
  public void testConcurrentStaleReadersShareOneVersionCheck() throws Exception {
    cache.getSession(SUBJECT);
    ticker.advance(TTL);
    when(userStore.fetchVersion(SUBJECT)).thenAnswer(new Answer<Optional<Long>>() {
      @Override
      public Optional<Long> answer(InvocationOnMock invocation) throws Throwable {
        Thread.sleep(50);
        return Optional.of(1L);
      }
    });

    final int readers = 8;
    final CyclicBarrier barrier = new CyclicBarrier(readers);
    final List<UserSessionRecord> results = new ArrayList<>();
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < readers; i++) {
      Thread thread = new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            barrier.await();
            UserSessionRecord record = cache.getSession(SUBJECT);
            synchronized (results) {
              results.add(record);
            }
          } catch (Exception e) {
            throw new RuntimeException(e);
          }
        }
      });
      threads.add(thread);
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join(5000);
    }

    assertThat(results).hasSize(readers);
    verify(userStore, times(1)).fetchVersion(SUBJECT);
  }

  @Test
  public void testInvalidateDuringReloadIsNotLost() throws Exception {
    final AtomicLong storeVersion = new AtomicLong(1L);
    final CountDownLatch readerInStore = new CountDownLatch(1);
    final CountDownLatch releaseReader = new CountDownLatch(1);
    when(userStore.fetchProfile(SUBJECT)).thenAnswer(new Answer<Optional<UserProfile>>() {
      @Override
      public Optional<UserProfile> answer(InvocationOnMock invocation) throws Throwable {
        long version = storeVersion.get();
        if (readerInStore.getCount() > 0) {
          readerInStore.countDown();
          releaseReader.await(5, TimeUnit.SECONDS);
        }
        return Optional.of(SmartDatabaseSyncTest.profile(version));
      }
    });
    when(userStore.fetchVersion(SUBJECT)).thenAnswer(new Answer<Optional<Long>>() {
      @Override
      public Optional<Long> answer(InvocationOnMock invocation) {
        return Optional.of(storeVersion.get());
      }
    });

    final AtomicReference<UserSessionRecord> readerResult = new AtomicReference<>();
    Thread reader = new Thread(new Runnable() {
      @Override
      public void run() {
        readerResult.set(cache.getSession(SUBJECT));
      }
    });
    reader.start();
    assertThat(readerInStore.await(5, TimeUnit.SECONDS)).isTrue();

    // the profile changes while the reader still holds version 1
    storeVersion.set(2L);
    Thread writer = new Thread(new Runnable() {
      @Override
      public void run() {
        cache.invalidate(SUBJECT);
      }
    });
    writer.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (writer.getState() != Thread.State.WAITING
        && writer.getState() != Thread.State.TERMINATED
        && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    releaseReader.countDown();
    reader.join(5000);
    writer.join(5000);

    assertThat(readerResult.get().getSourceVersion()).isEqualTo(1L);
    assertThat(cache.getSession(SUBJECT).getSourceVersion()).isEqualTo(2L);
  }

  @Test
  public void testClear() throws Exception {
    cache.getSession(SUBJECT);
    cache.clear();
    assertThat(cache.size()).isEqualTo(0);
  }

  private void assertRejected(Reason reason) {
    try {
      cache.getSession(SUBJECT);
      fail();
    } catch (UnauthenticatedException exception) {
      assertThat(exception.getReason()).isEqualTo(reason);
    }
  }
}
