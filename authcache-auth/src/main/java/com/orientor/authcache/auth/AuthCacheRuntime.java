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

import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.util.Clock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.orientor.authcache.cache.CacheStatistics;
import com.orientor.authcache.cache.CacheSweeper;
import com.orientor.authcache.config.AuthCacheConfig;
import com.orientor.authcache.crypto.CacheCipher;
import com.orientor.authcache.crypto.SecureKeyGenerator;
import com.orientor.authcache.ratelimit.TieredRateLimiter;
import com.orientor.authcache.session.PermissionResolver;
import com.orientor.authcache.session.SmartDatabaseSync;
import com.orientor.authcache.session.UserSessionCache;
import com.orientor.authcache.session.UserStore;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires every cache of the process from an {@link AuthCacheConfig} and owns
 * their background work.
 *
 * <p>Call {@link #start()} once at startup and {@link #close()} at shutdown.
 */
public final class AuthCacheRuntime implements Closeable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AuthCacheConfig config;
  private final JwksCache jwksCache;
  private final TokenValidationCache tokenValidationCache;
  private final UserSessionCache userSessionCache;
  private final TieredRateLimiter rateLimiter;
  private final Authenticator authenticator;
  private final AccessController accessController;
  private final CacheSweeper sweeper;

  private AuthCacheRuntime(AuthCacheConfig config, JwksCache jwksCache,
      TokenValidationCache tokenValidationCache, UserSessionCache userSessionCache,
      TieredRateLimiter rateLimiter, Authenticator authenticator, CacheSweeper sweeper) {
    this.config = config;
    this.jwksCache = jwksCache;
    this.tokenValidationCache = tokenValidationCache;
    this.userSessionCache = userSessionCache;
    this.rateLimiter = rateLimiter;
    this.authenticator = authenticator;
    this.accessController = new AccessController();
    this.sweeper = sweeper;
  }

  /**
   * Builds the runtime for production use.
   */
  public static AuthCacheRuntime create(AuthCacheConfig config, UserStore userStore) {
    return create(config, userStore, new NetHttpTransport(), Ticker.systemTicker(),
        Clock.SYSTEM);
  }

  @VisibleForTesting
  static AuthCacheRuntime create(AuthCacheConfig config, UserStore userStore,
      HttpTransport httpTransport, Ticker ticker, Clock clock) {
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(userStore);

    HttpRequestFactory httpRequestFactory = httpTransport.createRequestFactory();
    KeyUriSupplier keyUriSupplier = new DefaultKeyUriSupplier(httpRequestFactory,
        config.getJwksUri(), config.getIssuer(), config.getJwksFetchTimeout());
    JwksSupplier jwksSupplier = new DefaultJwksSupplier(httpRequestFactory, keyUriSupplier,
        config.getJwksFetchTimeout());
    JwksCache jwksCache = new JwksCache(jwksSupplier, config.getJwksTtl(),
        config.getJwksRefreshFraction(), config.getJwksGracePeriod(),
        config.getJwksFetchTimeout(), config.getJwksForcedRefreshMinInterval(), ticker);

    SecureKeyGenerator keyGenerator = new SecureKeyGenerator();
    AuthTokenDecoder decoder = new DefaultAuthTokenDecoder(new DefaultAuthTokenVerifier(jwksCache),
        clock, config.getIssuer(), config.getAudience(), config.getRolesClaim(),
        config.getPermissionsClaim());
    TokenValidationCache tokenValidationCache = new TokenValidationCache(decoder, keyGenerator,
        config.getTokenCacheTtl(), config.getTokenCacheMaxEntries(),
        config.getMalformedTokenNegativeTtl(), ticker, clock);

    Optional<byte[]> masterKey = config.getEncryptionMasterKey();
    CacheCipher cipher = masterKey.isPresent()
        ? CacheCipher.fromMasterKey(masterKey.get())
        : CacheCipher.withRandomKey();
    SmartDatabaseSync databaseSync = new SmartDatabaseSync(userStore,
        new PermissionResolver(config.getRolePermissions()), clock);
    UserSessionCache userSessionCache = new UserSessionCache(databaseSync, cipher, keyGenerator,
        config.getSessionCacheTtl(), config.getSessionHardCeiling(),
        config.getSessionCacheMaxEntries(), ticker);

    TieredRateLimiter rateLimiter = new TieredRateLimiter(config.getRateLimits(), ticker);
    Authenticator authenticator = new Authenticator(tokenValidationCache, userSessionCache,
        rateLimiter, keyGenerator);

    CacheSweeper sweeper = new CacheSweeper(config.getSweepInterval())
        .register(tokenValidationCache)
        .register(userSessionCache)
        .register(rateLimiter);
    return new AuthCacheRuntime(config, jwksCache, tokenValidationCache, userSessionCache,
        rateLimiter, authenticator, sweeper);
  }

  /**
   * Starts the sweep thread and the first key set fetch.
   */
  public void start() {
    sweeper.start();
    jwksCache.start();
    logger.atInfo().log("auth cache started with %s", config);
  }

  public Authenticator getAuthenticator() {
    return authenticator;
  }

  public AccessController getAccessController() {
    return accessController;
  }

  public JwksCache getJwksCache() {
    return jwksCache;
  }

  public TokenValidationCache getTokenValidationCache() {
    return tokenValidationCache;
  }

  public UserSessionCache getUserSessionCache() {
    return userSessionCache;
  }

  public TieredRateLimiter getRateLimiter() {
    return rateLimiter;
  }

  public AuthCacheConfig getConfig() {
    return config;
  }

  /**
   * Creates the cache for a new request. The caller closes it when the
   * request ends.
   */
  public RequestCache newRequestCache() {
    return new RequestCache(config.getRequestCacheMaxEntries());
  }

  /**
   * Drops the cached session of {@code subjectId}. Writers call this after
   * changing a user's profile or roles.
   */
  public void invalidateUser(String subjectId) {
    userSessionCache.invalidate(subjectId);
  }

  /**
   * @return the statistics of every cache, by cache name
   */
  public ImmutableMap<String, CacheStatistics> statistics() {
    return ImmutableMap.of(
        "jwks", jwksCache.statistics(),
        "token-validation", tokenValidationCache.statistics(),
        "token-validation-negative", tokenValidationCache.negativeStatistics(),
        "user-session", userSessionCache.statistics());
  }

  /**
   * Drops every cached token validation, session and signing key. The next
   * requests repopulate the caches from their sources.
   */
  public void clearAll() {
    tokenValidationCache.invalidateAll();
    userSessionCache.clear();
    jwksCache.invalidate();
    logger.atInfo().log("all auth caches cleared");
  }

  /**
   * Reports the health of each cache without contacting the key endpoint or
   * the database.
   */
  public HealthReport health() {
    Map<String, HealthReport.Component> components = new LinkedHashMap<>();
    components.put("jwks", jwksHealth());
    components.put("token-validation",
        describe(tokenValidationCache.statistics(), HealthReport.Status.HEALTHY, "serving"));
    SmartDatabaseSync databaseSync = userSessionCache.getDatabaseSync();
    if (databaseSync.isStoreReachable()) {
      components.put("user-session",
          describe(userSessionCache.statistics(), HealthReport.Status.HEALTHY, "serving"));
    } else {
      components.put("user-session", describe(userSessionCache.statistics(),
          HealthReport.Status.DEGRADED, String.format(
              "user store unreachable, %d stale sessions served",
              databaseSync.getStaleServedCount())));
    }
    return new HealthReport(components);
  }

  private HealthReport.Component jwksHealth() {
    if (!jwksCache.hasKeys()) {
      if (jwksCache.getFailedFetchCount() > 0) {
        return new HealthReport.Component(HealthReport.Status.UNHEALTHY, String.format(
            "no signing keys, %d fetches failed", jwksCache.getFailedFetchCount()));
      }
      return new HealthReport.Component(HealthReport.Status.DEGRADED,
          "no signing keys fetched yet");
    }
    if (jwksCache.hasExpiredKeys()) {
      return new HealthReport.Component(HealthReport.Status.DEGRADED, String.format(
          "serving expired signing keys, %d stale uses", jwksCache.getStaleUseCount()));
    }
    return new HealthReport.Component(HealthReport.Status.HEALTHY, String.format(
        "%s, %d stale uses", jwksCache.getState(), jwksCache.getStaleUseCount()));
  }

  private static HealthReport.Component describe(CacheStatistics statistics,
      HealthReport.Status status, String summary) {
    return new HealthReport.Component(status, String.format("%s, %d entries, hit rate %.2f",
        summary, statistics.getSize(), statistics.getHitRate()));
  }

  @Override
  public void close() {
    sweeper.close();
    jwksCache.close();
    logger.atInfo().log("auth cache stopped");
  }
}
