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

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.auth.UnauthenticatedException.Reason;
import com.orientor.authcache.crypto.KeyContext;
import com.orientor.authcache.crypto.SecureKeyGenerator;
import com.orientor.authcache.ratelimit.EndpointClass;
import com.orientor.authcache.ratelimit.RateLimitExceededException;
import com.orientor.authcache.ratelimit.TieredRateLimiter;
import com.orientor.authcache.session.UserSessionCache;
import com.orientor.authcache.session.UserSessionRecord;

import javax.annotation.Nullable;

/**
 * Resolves an auth token into the session of the user it was issued to.
 *
 * <p>A token already resolved in the current request is answered from the
 * {@link RequestCache}. Otherwise the client is charged against the budget
 * of the endpoint class, including when it presents no token at all, the
 * token is validated through the
 * {@link TokenValidationCache}, and the session is read from the
 * {@link UserSessionCache}.
 */
public class Authenticator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TokenValidationCache tokenValidationCache;
  private final UserSessionCache userSessionCache;
  private final TieredRateLimiter rateLimiter;
  private final SecureKeyGenerator keyGenerator;

  public Authenticator(TokenValidationCache tokenValidationCache,
      UserSessionCache userSessionCache, TieredRateLimiter rateLimiter,
      SecureKeyGenerator keyGenerator) {
    this.tokenValidationCache = Preconditions.checkNotNull(tokenValidationCache);
    this.userSessionCache = Preconditions.checkNotNull(userSessionCache);
    this.rateLimiter = Preconditions.checkNotNull(rateLimiter);
    this.keyGenerator = Preconditions.checkNotNull(keyGenerator);
  }

  /**
   * Authenticates a request outside of any request cache.
   */
  public UserSessionRecord authenticate(@Nullable String rawToken, String clientId,
      @Nullable EndpointClass endpointClass) {
    RequestCache requestCache = new RequestCache(1);
    try {
      return authenticate(rawToken, requestCache, clientId, endpointClass);
    } finally {
      requestCache.close();
    }
  }

  /**
   * Authenticates a request.
   *
   * @param rawToken the bearer token presented by the client
   * @param requestCache the cache of the current request
   * @param clientId identifies the client for rate limiting
   * @param endpointClass selects the rate limit budget
   * @return the session of the authenticated user
   * @throws UnauthenticatedException if the request cannot be authenticated
   * @throws RateLimitExceededException if the client is over budget
   */
  public UserSessionRecord authenticate(@Nullable String rawToken, RequestCache requestCache,
      String clientId, @Nullable EndpointClass endpointClass) {
    if (Strings.isNullOrEmpty(rawToken)) {
      rateLimiter.checkAllowed(clientId, endpointClass);
      throw new UnauthenticatedException(Reason.MISSING_TOKEN, "No auth token was provided");
    }
    String requestKey = keyGenerator.cacheKey(KeyContext.REQUEST, rawToken);
    Optional<UserSessionRecord> memo = requestCache.get(requestKey, UserSessionRecord.class);
    if (memo.isPresent()) {
      return memo.get();
    }

    rateLimiter.checkAllowed(clientId, endpointClass);

    ValidationResult validation = tokenValidationCache.validate(rawToken);
    UserSessionRecord session = userSessionCache.getSession(validation.getSubjectId());
    if (!session.isActive()) {
      logger.atInfo().log("rejected a token of inactive user %s", session.getSubjectId());
      throw new UnauthenticatedException(Reason.USER_INACTIVE,
          "User " + session.getSubjectId() + " is inactive");
    }
    requestCache.put(requestKey, session);
    return session;
  }

  /**
   * Charges a request that does not need a session, such as a login, against
   * the budget of {@code endpointClass}.
   *
   * @throws RateLimitExceededException if the client is over budget
   */
  public void checkRateLimit(String clientId, @Nullable EndpointClass endpointClass) {
    rateLimiter.checkAllowed(clientId, endpointClass);
  }

  /**
   * Drops the cached session of {@code subjectId}.
   */
  public void invalidateUser(String subjectId) {
    userSessionCache.invalidate(subjectId);
  }
}
