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

import com.google.api.client.http.HttpStatusCodes;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.common.base.Optional;
import com.orientor.authcache.config.AuthCacheConfig;
import com.orientor.authcache.ratelimit.EndpointClass;
import com.orientor.authcache.session.UserProfile;
import com.orientor.authcache.session.UserSessionRecord;
import com.orientor.authcache.session.UserStore;
import com.orientor.authcache.session.UserStoreException;

import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for {@link AuthCacheRuntime}.
 */
@RunWith(JUnit4.class)
public final class AuthCacheRuntimeTest {
  private static final String JWKS_URI = "https://login.example.com/jwks.json";

  private final TestingTicker ticker = new TestingTicker();
  private final UserStore userStore = mock(UserStore.class);
  private final RsaJsonWebKey signingKey = TestUtils.generateRsaJsonWebKey("key-1");
  private final KeyEndpoint keyEndpoint =
      new KeyEndpoint(new JsonWebKeySet(signingKey).toJson());
  private AuthCacheRuntime runtime;

  @Before
  public void setUp() throws Exception {
    when(userStore.fetchProfile("user-1")).thenReturn(Optional.of(UserProfile.builder()
        .setSubjectId("user-1")
        .setInternalUserId(42L)
        .setEmail("ada@example.com")
        .addRoles("student")
        .setSourceVersion(1L)
        .build()));
    AuthCacheConfig config = AuthCacheConfig.builder()
        .setJwksUri(JWKS_URI)
        .addRolePermission("student", "courses:read")
        .setSweepInterval(Duration.ofMinutes(1))
        .build();
    runtime = AuthCacheRuntime.create(config, userStore, keyEndpoint, ticker, ticker);
  }

  @After
  public void tearDown() {
    runtime.close();
  }

  @Test
  public void testAuthenticateAndAuthorize() {
    String token = TestUtils.token("user-1", ticker.currentTimeMillis(), Duration.ofMinutes(5))
        .sign(signingKey);
    RequestCache requestCache = runtime.newRequestCache();

    UserSessionRecord session = runtime.getAuthenticator()
        .authenticate(token, requestCache, "203.0.113.7", EndpointClass.DEFAULT);

    assertThat(session.getInternalUserId()).isEqualTo(42L);
    assertThat(runtime.getAccessController().authorize(session, "courses:read", requestCache))
        .isTrue();
    assertThat(keyEndpoint.calls.get()).isEqualTo(1);
    requestCache.close();
  }

  @Test
  public void testStatisticsCoverEveryCache() {
    assertThat(runtime.statistics().keySet()).containsExactly(
        "jwks", "token-validation", "token-validation-negative", "user-session");
  }

  @Test
  public void testStartFetchesKeysInBackground() throws Exception {
    runtime.start();

    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (runtime.getJwksCache().getState() != JwksCache.State.WARM
        && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(runtime.getJwksCache().getState()).isEqualTo(JwksCache.State.WARM);
    assertThat(keyEndpoint.calls.get()).isEqualTo(1);
  }

  @Test
  public void testHealthBeforeAndAfterFirstRequest() {
    HealthReport before = runtime.health();
    assertThat(before.getComponents().keySet())
        .containsExactly("jwks", "token-validation", "user-session");
    assertThat(before.getComponent("jwks").getStatus()).isEqualTo(HealthReport.Status.DEGRADED);
    assertThat(before.getStatus()).isEqualTo(HealthReport.Status.DEGRADED);

    runtime.getAuthenticator().authenticate(token(Duration.ofHours(1)), "203.0.113.7",
        EndpointClass.DEFAULT);

    assertThat(runtime.health().getStatus()).isEqualTo(HealthReport.Status.HEALTHY);
  }

  @Test
  public void testHealthDegradesWhileUserStoreIsDown() throws Exception {
    String token = token(Duration.ofHours(1));
    runtime.getAuthenticator().authenticate(token, "203.0.113.7", EndpointClass.DEFAULT);

    when(userStore.fetchVersion("user-1")).thenThrow(new UserStoreException("connection refused"));
    ticker.advance(Duration.ofMinutes(16));
    UserSessionRecord stale = runtime.getAuthenticator()
        .authenticate(token, "203.0.113.7", EndpointClass.DEFAULT);

    assertThat(stale.getInternalUserId()).isEqualTo(42L);
    HealthReport.Component sessions = runtime.health().getComponent("user-session");
    assertThat(sessions.getStatus()).isEqualTo(HealthReport.Status.DEGRADED);
    assertThat(sessions.getDetail()).contains("1 stale sessions served");
    assertThat(runtime.health().getComponent("jwks").getStatus())
        .isEqualTo(HealthReport.Status.HEALTHY);
  }

  @Test
  public void testHealthReportsUnreachableKeyEndpoint() throws Exception {
    AuthCacheConfig config = AuthCacheConfig.builder()
        .setJwksUri("https://unreachable.example.com/jwks.json")
        .setJwksFetchTimeout(Duration.ofSeconds(2))
        .build();
    AuthCacheRuntime broken = AuthCacheRuntime.create(config, userStore, keyEndpoint, ticker,
        ticker);
    try {
      broken.getAuthenticator().authenticate(token(Duration.ofHours(1)), "203.0.113.7",
          EndpointClass.DEFAULT);
      fail();
    } catch (UnauthenticatedException e) {
      assertThat(e.getReason()).isEqualTo(UnauthenticatedException.Reason.KEYS_UNAVAILABLE);
    }

    assertThat(broken.health().getComponent("jwks").getStatus())
        .isEqualTo(HealthReport.Status.UNHEALTHY);
    assertThat(broken.health().getStatus()).isEqualTo(HealthReport.Status.UNHEALTHY);
    broken.close();
  }

  @Test
  public void testClearAllDropsEveryCache() throws Exception {
    String token = token(Duration.ofHours(1));
    runtime.getAuthenticator().authenticate(token, "203.0.113.7", EndpointClass.DEFAULT);
    assertThat(runtime.getUserSessionCache().size()).isEqualTo(1);

    runtime.clearAll();

    assertThat(runtime.getUserSessionCache().size()).isEqualTo(0);
    assertThat(runtime.getTokenValidationCache().statistics().getSize()).isEqualTo(0L);
    assertThat(runtime.getJwksCache().hasKeys()).isFalse();

    runtime.getAuthenticator().authenticate(token, "203.0.113.7", EndpointClass.DEFAULT);
    assertThat(keyEndpoint.calls.get()).isEqualTo(2);
    verify(userStore, times(2)).fetchProfile("user-1");
  }

  private String token(Duration lifetime) {
    return TestUtils.token("user-1", ticker.currentTimeMillis(), lifetime).sign(signingKey);
  }

  private static final class KeyEndpoint extends MockHttpTransport {
    final AtomicInteger calls = new AtomicInteger();
    private final String jwks;

    KeyEndpoint(String jwks) {
      this.jwks = jwks;
    }

    @Override
    public LowLevelHttpRequest buildRequest(String method, String url) throws IOException {
      if (!JWKS_URI.equals(url)) {
        throw new IOException("unexpected request to " + url);
      }
      calls.incrementAndGet();
      return new MockLowLevelHttpRequest() {
        @Override
        public LowLevelHttpResponse execute() throws IOException {
          MockLowLevelHttpResponse response = new MockLowLevelHttpResponse();
          response.setStatusCode(HttpStatusCodes.STATUS_CODE_OK);
          response.setContentType(Json.MEDIA_TYPE);
          response.setContent(jwks);
          return response;
        }
      };
    }
  }
}
