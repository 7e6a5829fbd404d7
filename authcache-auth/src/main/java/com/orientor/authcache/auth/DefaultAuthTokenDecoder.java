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

import com.google.api.client.util.Clock;
import com.google.common.base.CharMatcher;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import java.time.Instant;
import java.util.Collection;

/**
 * Default implementation of {@link AuthTokenDecoder}.
 *
 * <p>The token is parsed first, its signature verified next, and its claims
 * checked last: {@code sub} and {@code exp} are required, {@code nbf} is
 * honoured, and the issuer and audience must match when configured. Roles
 * and permissions are read from configurable claims holding either a JSON
 * array or a space or comma separated string.
 */
public class DefaultAuthTokenDecoder implements AuthTokenDecoder {
  private static final Splitter CLAIM_LIST_SPLITTER =
      Splitter.on(CharMatcher.anyOf(", ")).omitEmptyStrings();

  private final AuthTokenVerifier authTokenVerifier;
  private final JwtConsumer jwtConsumer;
  private final Clock clock;
  private final Optional<String> issuer;
  private final Optional<String> audience;
  private final String rolesClaim;
  private final String permissionsClaim;

  /**
   * Constructor.
   *
   * @param authTokenVerifier verifies the signatures of auth tokens.
   * @param clock provides the time.
   * @param issuer is the required {@code iss} claim, if any.
   * @param audience is an audience the token must name, if any.
   * @param rolesClaim names the claim holding the roles.
   * @param permissionsClaim names the claim holding the permissions.
   */
  public DefaultAuthTokenDecoder(AuthTokenVerifier authTokenVerifier, Clock clock,
      Optional<String> issuer, Optional<String> audience, String rolesClaim,
      String permissionsClaim) {
    this.authTokenVerifier = Preconditions.checkNotNull(authTokenVerifier);
    this.clock = Preconditions.checkNotNull(clock);
    this.issuer = Preconditions.checkNotNull(issuer);
    this.audience = Preconditions.checkNotNull(audience);
    this.rolesClaim = Preconditions.checkNotNull(rolesClaim);
    this.permissionsClaim = Preconditions.checkNotNull(permissionsClaim);
    this.jwtConsumer = new JwtConsumerBuilder()
        .setDisableRequireSignature()
        .setSkipAllValidators()
        .setSkipSignatureVerification()
        .build();
  }

  @Override
  public ValidationResult decode(String authToken) {
    Preconditions.checkNotNull(authToken);

    JwtClaims jwtClaims;
    try {
      jwtClaims = this.jwtConsumer.process(authToken).getJwtClaims();
    } catch (InvalidJwtException exception) {
      throw new UnauthenticatedException(Reason.MALFORMED_TOKEN,
          "The auth token cannot be parsed", exception);
    }
    if (!this.authTokenVerifier.verify(authToken)) {
      throw new UnauthenticatedException(Reason.BAD_SIGNATURE,
          "Failed to verify the signature of the auth token");
    }
    try {
      return checkJwtClaims(jwtClaims);
    } catch (MalformedClaimException exception) {
      throw new UnauthenticatedException(Reason.MALFORMED_TOKEN,
          "The auth token has a malformed claim", exception);
    }
  }

  private ValidationResult checkJwtClaims(JwtClaims jwtClaims) throws MalformedClaimException {
    String subject = jwtClaims.getSubject();
    if (subject == null || subject.isEmpty()) {
      throw new UnauthenticatedException(Reason.MALFORMED_TOKEN, "Missing subject field");
    }
    NumericDate expiration = jwtClaims.getExpirationTime();
    if (expiration == null) {
      throw new UnauthenticatedException(Reason.MALFORMED_TOKEN, "Missing expiration field");
    }

    NumericDate currentTime = NumericDate.fromMilliseconds(clock.currentTimeMillis());
    if (!expiration.isAfter(currentTime)) {
      throw new UnauthenticatedException(Reason.EXPIRED_TOKEN,
          "The auth token has already expired");
    }
    NumericDate notBefore = jwtClaims.getNotBefore();
    if (notBefore != null && notBefore.isAfter(currentTime)) {
      throw new UnauthenticatedException(Reason.INVALID_CLAIMS,
          "Current time is earlier than the \"nbf\" time");
    }
    if (issuer.isPresent() && !issuer.get().equals(jwtClaims.getIssuer())) {
      throw new UnauthenticatedException(Reason.INVALID_CLAIMS,
          "Unknown issuer: " + jwtClaims.getIssuer());
    }
    if (audience.isPresent()
        && (!jwtClaims.hasAudience() || !jwtClaims.getAudience().contains(audience.get()))) {
      throw new UnauthenticatedException(Reason.INVALID_CLAIMS, "Audiences not allowed");
    }

    NumericDate issuedAt = jwtClaims.getIssuedAt();
    Instant issued = issuedAt == null
        ? Instant.ofEpochMilli(clock.currentTimeMillis())
        : Instant.ofEpochMilli(issuedAt.getValueInMillis());
    Instant expires = Instant.ofEpochMilli(expiration.getValueInMillis());
    if (issued.isAfter(expires)) {
      issued = expires;
    }
    return new ValidationResult(subject,
        readStringSet(jwtClaims, rolesClaim),
        readStringSet(jwtClaims, permissionsClaim),
        jwtClaims.getIssuer(),
        issued,
        expires);
  }

  private static ImmutableSet<String> readStringSet(JwtClaims jwtClaims, String claimName)
      throws MalformedClaimException {
    Object value = jwtClaims.getClaimValue(claimName);
    if (value == null) {
      return ImmutableSet.of();
    }
    if (value instanceof String) {
      return ImmutableSet.copyOf(CLAIM_LIST_SPLITTER.split((String) value));
    }
    if (value instanceof Collection) {
      ImmutableSet.Builder<String> values = ImmutableSet.builder();
      for (Object item : (Collection<?>) value) {
        if (!(item instanceof String)) {
          throw new MalformedClaimException(
              String.format("The \"%s\" claim must only hold strings", claimName));
        }
        values.add((String) item);
      }
      return values.build();
    }
    throw new MalformedClaimException(
        String.format("The \"%s\" claim must be a string or a list of strings", claimName));
  }
}
