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

import com.google.common.base.Preconditions;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.VerificationJwkSelector;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.lang.JoseException;

/**
 * Default implementation of {@link AuthTokenVerifier}. Verifies against the
 * keys held by a {@link JwksCache}, and asks it for a refresh once when a
 * token names a key id it does not hold. Only asymmetric signature
 * algorithms are accepted.
 */
public final class DefaultAuthTokenVerifier implements AuthTokenVerifier {
  private static final AlgorithmConstraints SIGNATURE_ALGORITHMS = new AlgorithmConstraints(
      ConstraintType.PERMIT,
      AlgorithmIdentifiers.RSA_USING_SHA256,
      AlgorithmIdentifiers.RSA_USING_SHA384,
      AlgorithmIdentifiers.RSA_USING_SHA512,
      AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
      AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
      AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
      AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
      AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
      AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

  private final VerificationJwkSelector jwkSelector;
  private final JwksCache jwksCache;

  public DefaultAuthTokenVerifier(JwksCache jwksCache) {
    this.jwkSelector = new VerificationJwkSelector();
    this.jwksCache = Preconditions.checkNotNull(jwksCache);
  }

  @Override
  public boolean verify(String authToken) {
    Preconditions.checkNotNull(authToken);

    JsonWebSignature jws = new JsonWebSignature();
    try {
      jws.setCompactSerialization(authToken);
    } catch (JoseException exception) {
      throw new UnauthenticatedException(Reason.MALFORMED_TOKEN,
          "The auth token is not a compact JWS", exception);
    }
    jws.setAlgorithmConstraints(SIGNATURE_ALGORITHMS);

    JwksBundle bundle = this.jwksCache.getKeys();
    String keyId = jws.getKeyIdHeaderValue();
    if (keyId != null && !bundle.containsKeyId(keyId)) {
      bundle = this.jwksCache.refreshForUnknownKey(keyId);
    }

    try {
      for (JsonWebKey jwk : this.jwkSelector.selectList(jws, bundle.getKeys())) {
        jws.setKey(jwk.getKey());
        if (jws.verifySignature()) {
          return true;
        }
      }
    } catch (JoseException exception) {
      throw new UnauthenticatedException(Reason.BAD_SIGNATURE, "Cannot verify the signature",
          exception);
    }
    return false;
  }
}
