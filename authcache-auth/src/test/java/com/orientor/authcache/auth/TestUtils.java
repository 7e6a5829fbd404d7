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

import com.google.common.collect.ImmutableList;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.X509Util;
import org.jose4j.lang.JoseException;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Date;

/**
 * Testing utilities.
 */
public final class TestUtils {
  private TestUtils() {
    // no instantiation
  }

  /**
   * Generate a {@link RsaJsonWebKey}.
   */
  public static RsaJsonWebKey generateRsaJsonWebKey(String keyId) {
    try {
      RsaJsonWebKey rsaJsonWebKey = RsaJwkGenerator.generateJwk(2048);
      rsaJsonWebKey.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
      rsaJsonWebKey.setKeyId(keyId);
      return rsaJsonWebKey;
    } catch (JoseException exception) {
      throw new RuntimeException("failed to generate RSA Json web key", exception);
    }
  }

  /**
   * Starts an auth token for {@code subject} that is valid from
   * {@code nowMillis} for {@code lifetime}.
   */
  public static TokenBuilder token(String subject, long nowMillis, Duration lifetime) {
    JwtClaims claims = new JwtClaims();
    claims.setSubject(subject);
    claims.setIssuedAt(NumericDate.fromMilliseconds(nowMillis));
    claims.setExpirationTime(NumericDate.fromMilliseconds(nowMillis + lifetime.toMillis()));
    return new TokenBuilder(claims);
  }

  /**
   * Generate a PEM-encoded X509 using the given {@link RsaJsonWebKey}.
   */
  public static String generateX509Cert(RsaJsonWebKey rsaJsonWebKey) {
    try {
      long currentTimeMillis = System.currentTimeMillis();
      Date start = new Date(currentTimeMillis - Duration.ofDays(1).toMillis());
      Date end = new Date(currentTimeMillis + Duration.ofDays(1).toMillis());
      X509v3CertificateBuilder x509v3CertificateBuilder = new X509v3CertificateBuilder(
          new X500Name("cn=example"),
          BigInteger.valueOf(currentTimeMillis),
          start,
          end,
          new X500Name("cn=example"),
          SubjectPublicKeyInfo.getInstance(rsaJsonWebKey.getPublicKey().getEncoded()));
      ContentSigner contentSigner = new JcaContentSignerBuilder("SHA256WithRSA")
          .build(rsaJsonWebKey.getPrivateKey());
      X509CertificateHolder x509CertHolder = x509v3CertificateBuilder.build(contentSigner);
      X509Certificate certificate =
          new JcaX509CertificateConverter().getCertificate(x509CertHolder);
      return String.format("%s%n%s%n%s",
          DefaultJwksSupplier.X509_CERT_PREFIX,
          new X509Util().toPem(certificate),
          DefaultJwksSupplier.X509_CERT_SUFFIX);
    } catch (Exception exception) {
      throw new RuntimeException(exception);
    }
  }

  /**
   * Assembles the claims of a test token and signs it.
   */
  public static final class TokenBuilder {
    private final JwtClaims claims;

    private TokenBuilder(JwtClaims claims) {
      this.claims = claims;
    }

    public TokenBuilder issuer(String issuer) {
      claims.setIssuer(issuer);
      return this;
    }

    public TokenBuilder audience(String... audiences) {
      claims.setAudience(audiences);
      return this;
    }

    public TokenBuilder notBefore(long millis) {
      claims.setNotBefore(NumericDate.fromMilliseconds(millis));
      return this;
    }

    public TokenBuilder roles(String... roles) {
      claims.setStringListClaim("roles", ImmutableList.copyOf(roles));
      return this;
    }

    public TokenBuilder claim(String name, Object value) {
      claims.setClaim(name, value);
      return this;
    }

    public TokenBuilder withoutClaim(String name) {
      claims.unsetClaim(name);
      return this;
    }

    /**
     * Signs the token with the private key of {@code rsaJsonWebKey}, naming
     * its key id in the header.
     */
    public String sign(RsaJsonWebKey rsaJsonWebKey) {
      JsonWebSignature jsonWebSignature = new JsonWebSignature();
      jsonWebSignature.setPayload(claims.toJson());
      jsonWebSignature.setKey(rsaJsonWebKey.getPrivateKey());
      if (rsaJsonWebKey.getKeyId() != null) {
        jsonWebSignature.setKeyIdHeaderValue(rsaJsonWebKey.getKeyId());
      }
      jsonWebSignature.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
      try {
        return jsonWebSignature.getCompactSerialization();
      } catch (JoseException exception) {
        throw new RuntimeException("failed to generate JWT", exception);
      }
    }
  }
}
