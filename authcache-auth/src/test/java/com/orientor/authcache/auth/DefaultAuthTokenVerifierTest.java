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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.orientor.authcache.auth.UnauthenticatedException.Reason;

import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;

/**
 * Tests for {@link DefaultAuthTokenVerifier}.
 */
@RunWith(JUnit4.class)
public class DefaultAuthTokenVerifierTest {
  private RsaJsonWebKey rsaJwk1;
  private RsaJsonWebKey rsaJwk2;

  private final TestingTicker ticker = new TestingTicker();
  private final JwksSupplier jwksSupplier = mock(JwksSupplier.class);
  private final JwksCache jwksCache = new JwksCache(jwksSupplier, Duration.ofHours(1), 0.8,
      Duration.ofMinutes(5), Duration.ofSeconds(5), Duration.ofSeconds(30), ticker);
  private final DefaultAuthTokenVerifier verifier = new DefaultAuthTokenVerifier(jwksCache);

  /**
   * Initialize the JSON web keys before each test.
   */
  @Before
  public void setUp() {
    this.rsaJwk1 = TestUtils.generateRsaJsonWebKey("rsa-jwk-1");
    this.rsaJwk2 = TestUtils.generateRsaJsonWebKey("rsa-jwk-2");
  }

  @After
  public void tearDown() {
    jwksCache.close();
  }

  @Test
  public void testVerifyJwtWithCorrectKeyId() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(rsaJwk1, rsaJwk2));
    assertTrue(verifier.verify(jwt(rsaJwk2)));
  }

  @Test
  public void testVerifyJwtSignedByAnotherKey() {
    RsaJsonWebKey impostor = TestUtils.generateRsaJsonWebKey("rsa-jwk-1");
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(rsaJwk1));
    assertFalse(verifier.verify(jwt(impostor)));
  }

  @Test
  public void testUnknownKeyIdTriggersOneRefresh() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(rsaJwk1))
        .thenReturn(new JsonWebKeySet(rsaJwk1, rsaJwk2));

    assertTrue(verifier.verify(jwt(rsaJwk2)));
    verify(jwksSupplier, times(2)).supply();
  }

  @Test
  public void testKeyIdStillUnknownAfterRefresh() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(rsaJwk1));
    assertFalse(verifier.verify(jwt(rsaJwk2)));
  }

  @Test
  public void testMalformedToken() {
    try {
      verifier.verify("not-a-jwt");
      fail();
    } catch (UnauthenticatedException exception) {
      assertEquals(Reason.MALFORMED_TOKEN, exception.getReason());
    }
  }

  @Test
  public void testSymmetricAlgorithmIsRejected() throws JoseException {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(rsaJwk1));
    JsonWebSignature jws = new JsonWebSignature();
    jws.setPayload("{\"sub\":\"user\"}");
    jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
    jws.setKeyIdHeaderValue("rsa-jwk-1");
    jws.setKey(new HmacKey(new byte[32]));
    String token = jws.getCompactSerialization();

    try {
      assertFalse(verifier.verify(token));
    } catch (UnauthenticatedException exception) {
      assertEquals(Reason.BAD_SIGNATURE, exception.getReason());
    }
  }

  private static String jwt(RsaJsonWebKey rsaJwk) {
    return TestUtils.token("user", TestingTicker.START_MILLIS, Duration.ofMinutes(5))
        .sign(rsaJwk);
  }
}
