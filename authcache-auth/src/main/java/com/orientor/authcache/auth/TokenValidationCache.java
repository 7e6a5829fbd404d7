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
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.cache.CacheStatistics;
import com.orientor.authcache.cache.Sweepable;
import com.orientor.authcache.cache.TtlCache;
import com.orientor.authcache.crypto.KeyContext;
import com.orientor.authcache.crypto.SecureKeyGenerator;
import com.orientor.authcache.crypto.TokenFingerprint;

import java.time.Duration;
import java.time.Instant;

/**
 * Caches the outcome of validating auth tokens.
 *
 * <p>Entries are keyed by the {@link TokenFingerprint} of the token, never by
 * the token itself, and live for the configured time-to-live or until the
 * token expires, whichever comes first. Only successful validations are
 * cached as results. Tokens that cannot be parsed are remembered for a short
 * while in a separate negative cache so that replaying garbage stays cheap.
 */
public final class TokenValidationCache implements Sweepable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AuthTokenDecoder authTokenDecoder;
  private final SecureKeyGenerator keyGenerator;
  private final Duration ttl;
  private final Duration negativeTtl;
  private final Clock clock;
  private final TtlCache<TokenFingerprint, ValidationResult> results;
  private final TtlCache<TokenFingerprint, Reason> rejections;

  public TokenValidationCache(AuthTokenDecoder authTokenDecoder, SecureKeyGenerator keyGenerator,
      Duration ttl, int maximumSize, Duration negativeTtl, Ticker ticker, Clock clock) {
    this.authTokenDecoder = Preconditions.checkNotNull(authTokenDecoder);
    this.keyGenerator = Preconditions.checkNotNull(keyGenerator);
    this.ttl = Preconditions.checkNotNull(ttl);
    this.negativeTtl = Preconditions.checkNotNull(negativeTtl);
    this.clock = Preconditions.checkNotNull(clock);
    this.results = new TtlCache<>("token-validation", ttl, maximumSize, ticker);
    this.rejections = new TtlCache<>("token-validation-negative", negativeTtl, maximumSize, ticker);
  }

  /**
   * Validates {@code rawToken}, answering from the cache when possible.
   *
   * @throws UnauthenticatedException if the token is not acceptable or the
   *     signing keys are unavailable
   */
  public ValidationResult validate(String rawToken) {
    Preconditions.checkNotNull(rawToken);
    Optional<String> subject = UnverifiedSubject.peek(rawToken);
    TokenFingerprint fingerprint = keyGenerator.fingerprint(rawToken, subject.orNull());

    Optional<ValidationResult> cached = results.get(fingerprint);
    if (cached.isPresent()) {
      ValidationResult result = cached.get();
      if (result.isExpired(now())) {
        results.invalidate(fingerprint);
        throw new UnauthenticatedException(Reason.EXPIRED_TOKEN,
            "The auth token has already expired");
      }
      logger.atFine().log("validation cache hit for %s", fingerprint);
      return result;
    }

    TokenFingerprint rejectionKey = keyGenerator.fingerprint(
        KeyContext.NEGATIVE_VALIDATION, rawToken, subject.orNull());
    Optional<Reason> rejected = rejections.get(rejectionKey);
    if (rejected.isPresent()) {
      throw new UnauthenticatedException(rejected.get(), "The auth token was recently rejected");
    }

    ValidationResult result;
    try {
      result = authTokenDecoder.decode(rawToken);
    } catch (UnauthenticatedException e) {
      if (e.getReason() == Reason.MALFORMED_TOKEN) {
        rejections.put(rejectionKey, e.getReason(), negativeTtl);
      }
      throw e;
    }

    Duration remaining = Duration.between(now(), result.getExpiresAt());
    Duration lifetime = remaining.compareTo(ttl) < 0 ? remaining : ttl;
    results.put(fingerprint, result, lifetime);
    logger.atFine().log("cached validation of %s for %s", fingerprint, lifetime);
    return result;
  }

  /**
   * Drops every cached outcome for {@code rawToken}.
   */
  public void invalidate(String rawToken) {
    Optional<String> subject = UnverifiedSubject.peek(rawToken);
    results.invalidate(keyGenerator.fingerprint(rawToken, subject.orNull()));
    rejections.invalidate(keyGenerator.fingerprint(
        KeyContext.NEGATIVE_VALIDATION, rawToken, subject.orNull()));
  }

  public void invalidateAll() {
    results.invalidateAll();
    rejections.invalidateAll();
  }

  @Override
  public int cleanUp() {
    return results.cleanUp() + rejections.cleanUp();
  }

  @Override
  public String getName() {
    return "token-validation";
  }

  public CacheStatistics statistics() {
    return results.statistics();
  }

  public CacheStatistics negativeStatistics() {
    return rejections.statistics();
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.currentTimeMillis());
  }
}
