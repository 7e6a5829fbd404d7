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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.SecureKeyGenerator;
import com.orientor.authcache.ratelimit.EndpointClass;
import com.orientor.authcache.ratelimit.RateLimitExceededException;
import com.orientor.authcache.ratelimit.RateLimitPolicy;
import com.orientor.authcache.ratelimit.TieredRateLimiter;
import com.orientor.authcache.session.PermissionResolver;
import com.orientor.authcache.session.SmartDatabaseSync;
import com.orientor.authcache.session.UserProfile;
import com.orientor.authcache.session.UserSessionCache;
import com.orientor.authcache.session.UserSessionRecord;
import com.orientor.authcache.session.UserStore;

import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;

/**
 * Tests for {@link Authenticator}, wired with real caches around a fake key
 * endpoint and user store.
 */
@RunWith(JUnit4.class)
public final class AuthenticatorTest {
  private static final String SUBJECT = "user-1";
  private static final String CLIENT = "203.0.113.7";

  private static RsaJsonWebKey signingKey;

  private final TestingTicker ticker = new TestingTicker();
  private final JwksSupplier jwksSupplier = mock(JwksSupplier.class);
  private final UserStore userStore = mock(UserStore.class);

  private JwksCache jwksCache;
  private UserSessionCache userSessionCache;
  private TieredRateLimiter rateLimiter;
  private Authenticator authenticator;

  @BeforeClass
  public static void generateKey() {
    signingKey = TestUtils.generateRsaJsonWebKey("key-1");
  }

  @Before
  public void setUp() throws Exception {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(signingKey));
    when(userStore.fetchProfile(SUBJECT)).thenReturn(Optional.of(profile(true)));
    when(userStore.fetchVersion(SUBJECT)).thenReturn(Optional.of(1L));

    jwksCache = new JwksCache(jwksSupplier, Duration.ofHours(2), 0.8, Duration.ofMinutes(15),
        Duration.ofSeconds(5), Duration.ofSeconds(30), ticker);
    SecureKeyGenerator keyGenerator = new SecureKeyGenerator();
    TokenValidationCache tokenValidationCache = new TokenValidationCache(
        new DefaultAuthTokenDecoder(new DefaultAuthTokenVerifier(jwksCache), ticker,
            Optional.<String>absent(), Optional.<String>absent(), "roles", "permissions"),
        keyGenerator, Duration.ofMinutes(5), 100, Duration.ofSeconds(30), ticker, ticker);
    userSessionCache = new UserSessionCache(
        new SmartDatabaseSync(userStore,
            new PermissionResolver(ImmutableSetMultimap.of("student", "courses:read")), ticker),
        CacheCipher.withRandomKey(), keyGenerator, Duration.ofMinutes(15),
        Duration.ofMinutes(60), 100, ticker);
    rateLimiter = new TieredRateLimiter(ImmutableMap.of(
        EndpointClass.AUTH, new RateLimitPolicy(5, Duration.ofMinutes(5))), ticker);
    authenticator = new Authenticator(tokenValidationCache, userSessionCache, rateLimiter,
        keyGenerator);
  }

  @After
  public void tearDown() {
    jwksCache.close();
  }

  @Test
  public void testExpiredTokenIsRejectedWhileSessionStaysCached() throws Exception {
    String token = token(Duration.ofMinutes(5));

    UserSessionRecord session = authenticator.authenticate(token, CLIENT, EndpointClass.DEFAULT);
    assertThat(session.getSubjectId()).isEqualTo(SUBJECT);
    assertThat(session.getPermissions()).contains("courses:read");

    ticker.advance(Duration.ofMinutes(4));
    authenticator.authenticate(token, CLIENT, EndpointClass.DEFAULT);

    ticker.advance(Duration.ofMinutes(2));
    try {
      authenticator.authenticate(token, CLIENT, EndpointClass.DEFAULT);
      fail();
    } catch (UnauthenticatedException e) {
      assertThat(e.getReason()).isEqualTo(Reason.EXPIRED_TOKEN);
    }

    // A new token still finds the session cached.
    authenticator.authenticate(token(Duration.ofMinutes(5)), CLIENT, EndpointClass.DEFAULT);
    verify(userStore, times(1)).fetchProfile(SUBJECT);
    verify(jwksSupplier, times(1)).supply();
  }

  @Test
  public void testMissingToken() {
    assertRejected(null, Reason.MISSING_TOKEN);
    assertRejected("", Reason.MISSING_TOKEN);
  }

  @Test
  public void testRequestsWithoutTokenAreCharged() {
    for (int i = 0; i < 5; i++) {
      try {
        authenticator.authenticate(null, CLIENT, EndpointClass.AUTH);
        fail();
      } catch (UnauthenticatedException e) {
        assertThat(e.getReason()).isEqualTo(Reason.MISSING_TOKEN);
      }
    }
    try {
      authenticator.authenticate("", CLIENT, EndpointClass.AUTH);
      fail();
    } catch (RateLimitExceededException e) {
      assertThat(e.getEndpointClass()).isEqualTo(EndpointClass.AUTH);
    }
    assertThat(rateLimiter.limiterFor(EndpointClass.AUTH).remaining(CLIENT)).isEqualTo(0);
  }

  @Test
  public void testCheckRateLimitChargesWithoutSession() {
    for (int i = 0; i < 5; i++) {
      authenticator.checkRateLimit(CLIENT, EndpointClass.AUTH);
    }
    try {
      authenticator.checkRateLimit(CLIENT, EndpointClass.AUTH);
      fail();
    } catch (RateLimitExceededException e) {
      assertThat(e.getRetryAfter()).isEqualTo(Duration.ofMinutes(5));
    }
    // other clients and classes keep their own budget
    authenticator.checkRateLimit("10.0.0.9", EndpointClass.AUTH);
    authenticator.checkRateLimit(CLIENT, EndpointClass.DEFAULT);
    assertThat(userSessionCache.size()).isEqualTo(0);
  }

  @Test
  public void testForgedToken() {
    RsaJsonWebKey impostor = TestUtils.generateRsaJsonWebKey("key-1");
    String forged = TestUtils.token(SUBJECT, ticker.currentTimeMillis(), Duration.ofMinutes(5))
        .sign(impostor);
    assertRejected(forged, Reason.BAD_SIGNATURE);
  }

  @Test
  public void testInactiveUser() throws Exception {
    when(userStore.fetchProfile(SUBJECT)).thenReturn(Optional.of(profile(false)));
    assertRejected(token(Duration.ofMinutes(5)), Reason.USER_INACTIVE);
  }

  @Test
  public void testRateLimitPerEndpointClass() {
    String token = token(Duration.ofMinutes(5));
    for (int i = 0; i < 5; i++) {
      authenticator.authenticate(token, CLIENT, EndpointClass.AUTH);
    }
    try {
      authenticator.authenticate(token, CLIENT, EndpointClass.AUTH);
      fail();
    } catch (RateLimitExceededException e) {
      assertThat(e.getEndpointClass()).isEqualTo(EndpointClass.AUTH);
      assertThat(e.getLimit()).isEqualTo(5);
      assertThat(e.getRetryAfter()).isEqualTo(Duration.ofMinutes(5));
    }

    // Other classes and other clients have budgets of their own.
    authenticator.authenticate(token, CLIENT, EndpointClass.DEFAULT);
    authenticator.authenticate(token, "198.51.100.1", EndpointClass.AUTH);
  }

  @Test
  public void testRepeatedLookupsInOneRequestRunOnce() {
    String token = token(Duration.ofMinutes(5));
    RequestCache requestCache = new RequestCache(8);

    UserSessionRecord first =
        authenticator.authenticate(token, requestCache, CLIENT, EndpointClass.AUTH);
    UserSessionRecord second =
        authenticator.authenticate(token, requestCache, CLIENT, EndpointClass.AUTH);

    assertThat(second).isSameInstanceAs(first);
    assertThat(rateLimiter.limiterFor(EndpointClass.AUTH).remaining(CLIENT)).isEqualTo(4);
  }

  @Test
  public void testInvalidateUserReloadsSession() throws Exception {
    authenticator.authenticate(token(Duration.ofMinutes(5)), CLIENT, EndpointClass.DEFAULT);

    authenticator.invalidateUser(SUBJECT);
    authenticator.authenticate(token(Duration.ofMinutes(5)), CLIENT, EndpointClass.DEFAULT);

    verify(userStore, times(2)).fetchProfile(SUBJECT);
  }

  private String token(Duration lifetime) {
    return TestUtils.token(SUBJECT, ticker.currentTimeMillis(), lifetime)
        .roles("student")
        .sign(signingKey);
  }

  private void assertRejected(String token, Reason reason) {
    try {
      authenticator.authenticate(token, CLIENT, EndpointClass.DEFAULT);
      fail();
    } catch (UnauthenticatedException e) {
      assertThat(e.getReason()).isEqualTo(reason);
    }
  }

  private static UserProfile profile(boolean active) {
    return UserProfile.builder()
        .setSubjectId(SUBJECT)
        .setInternalUserId(42L)
        .setEmail("ada@example.com")
        .addRoles("student")
        .setActive(active)
        .setSourceVersion(1L)
        .build();
  }
}
