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

package com.orientor.authcache.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Maps;
import com.google.common.io.BaseEncoding;
import com.orientor.authcache.ratelimit.EndpointClass;
import com.orientor.authcache.ratelimit.RateLimitPolicy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import javax.annotation.Nullable;

/**
 * The tunables of the authentication cache.
 *
 * <p>Instances are immutable and are created by a {@link Builder}, or from a
 * flat map of {@code AUTHCACHE_*} keys with {@link #fromEnvironment(Map)} and
 * {@link #fromProperties(Properties)}.
 */
public final class AuthCacheConfig {
  public static final int DEFAULT_REQUEST_CACHE_MAX_ENTRIES = 64;
  public static final Duration DEFAULT_TOKEN_CACHE_TTL = Duration.ofMinutes(5);
  public static final int DEFAULT_TOKEN_CACHE_MAX_ENTRIES = 10000;
  public static final Duration DEFAULT_MALFORMED_TOKEN_NEGATIVE_TTL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_SESSION_CACHE_TTL = Duration.ofMinutes(15);
  public static final Duration DEFAULT_SESSION_HARD_CEILING = Duration.ofMinutes(60);
  public static final int DEFAULT_SESSION_CACHE_MAX_ENTRIES = 10000;
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_JWKS_TTL = Duration.ofHours(2);
  public static final double DEFAULT_JWKS_REFRESH_FRACTION = 0.8;
  public static final Duration DEFAULT_JWKS_GRACE_PERIOD = Duration.ofMinutes(15);
  public static final Duration DEFAULT_JWKS_FETCH_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_JWKS_FORCED_REFRESH_MIN_INTERVAL = Duration.ofSeconds(30);
  public static final String DEFAULT_ROLES_CLAIM = "roles";
  public static final String DEFAULT_PERMISSIONS_CLAIM = "permissions";

  static final String PREFIX = "AUTHCACHE_";
  static final String REQUEST_CACHE_MAX_ENTRIES = PREFIX + "REQUEST_CACHE_MAX_ENTRIES";
  static final String TOKEN_CACHE_TTL_SECONDS = PREFIX + "TOKEN_CACHE_TTL_SECONDS";
  static final String TOKEN_CACHE_MAX_ENTRIES = PREFIX + "TOKEN_CACHE_MAX_ENTRIES";
  static final String NEGATIVE_TTL_SECONDS = PREFIX + "NEGATIVE_TTL_SECONDS";
  static final String SESSION_CACHE_TTL_SECONDS = PREFIX + "SESSION_CACHE_TTL_SECONDS";
  static final String SESSION_HARD_CEILING_SECONDS = PREFIX + "SESSION_HARD_CEILING_SECONDS";
  static final String SESSION_CACHE_MAX_ENTRIES = PREFIX + "SESSION_CACHE_MAX_ENTRIES";
  static final String SWEEP_INTERVAL_SECONDS = PREFIX + "SWEEP_INTERVAL_SECONDS";
  static final String JWKS_URI = PREFIX + "JWKS_URI";
  static final String ISSUER = PREFIX + "ISSUER";
  static final String AUDIENCE = PREFIX + "AUDIENCE";
  static final String JWKS_TTL_SECONDS = PREFIX + "JWKS_TTL_SECONDS";
  static final String JWKS_REFRESH_FRACTION = PREFIX + "JWKS_REFRESH_FRACTION";
  static final String JWKS_GRACE_SECONDS = PREFIX + "JWKS_GRACE_SECONDS";
  static final String JWKS_FETCH_TIMEOUT_SECONDS = PREFIX + "JWKS_FETCH_TIMEOUT_SECONDS";
  static final String JWKS_FORCED_REFRESH_MIN_INTERVAL_SECONDS =
      PREFIX + "JWKS_FORCED_REFRESH_MIN_INTERVAL_SECONDS";
  static final String RATE_LIMIT_PREFIX = PREFIX + "RATE_LIMIT_";
  static final String ENCRYPTION_KEY = PREFIX + "ENCRYPTION_KEY";
  static final String ROLES_CLAIM = PREFIX + "ROLES_CLAIM";
  static final String PERMISSIONS_CLAIM = PREFIX + "PERMISSIONS_CLAIM";
  static final String ROLE_PERMISSIONS = PREFIX + "ROLE_PERMISSIONS";

  private static final Splitter ROLE_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter PERMISSION_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private final int requestCacheMaxEntries;
  private final Duration tokenCacheTtl;
  private final int tokenCacheMaxEntries;
  private final Duration malformedTokenNegativeTtl;
  private final Duration sessionCacheTtl;
  private final Duration sessionHardCeiling;
  private final int sessionCacheMaxEntries;
  private final Duration sweepInterval;
  private final Optional<String> jwksUri;
  private final Optional<String> issuer;
  private final Optional<String> audience;
  private final Duration jwksTtl;
  private final double jwksRefreshFraction;
  private final Duration jwksGracePeriod;
  private final Duration jwksFetchTimeout;
  private final Duration jwksForcedRefreshMinInterval;
  private final ImmutableMap<EndpointClass, RateLimitPolicy> rateLimits;
  private final Optional<byte[]> encryptionMasterKey;
  private final String rolesClaim;
  private final String permissionsClaim;
  private final ImmutableSetMultimap<String, String> rolePermissions;

  private AuthCacheConfig(Builder b) {
    this.requestCacheMaxEntries = b.requestCacheMaxEntries;
    this.tokenCacheTtl = b.tokenCacheTtl;
    this.tokenCacheMaxEntries = b.tokenCacheMaxEntries;
    this.malformedTokenNegativeTtl = b.malformedTokenNegativeTtl;
    this.sessionCacheTtl = b.sessionCacheTtl;
    this.sessionHardCeiling = b.sessionHardCeiling;
    this.sessionCacheMaxEntries = b.sessionCacheMaxEntries;
    this.sweepInterval = b.sweepInterval;
    this.jwksUri = Optional.fromNullable(Strings.emptyToNull(b.jwksUri));
    this.issuer = Optional.fromNullable(Strings.emptyToNull(b.issuer));
    this.audience = Optional.fromNullable(Strings.emptyToNull(b.audience));
    this.jwksTtl = b.jwksTtl;
    this.jwksRefreshFraction = b.jwksRefreshFraction;
    this.jwksGracePeriod = b.jwksGracePeriod;
    this.jwksFetchTimeout = b.jwksFetchTimeout;
    this.jwksForcedRefreshMinInterval = b.jwksForcedRefreshMinInterval;
    this.rateLimits = Maps.immutableEnumMap(b.rateLimits);
    this.encryptionMasterKey = Optional.fromNullable(b.encryptionMasterKey);
    this.rolesClaim = b.rolesClaim;
    this.permissionsClaim = b.permissionsClaim;
    this.rolePermissions = b.rolePermissions.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a configuration from {@code AUTHCACHE_*} environment variables.
   */
  public static AuthCacheConfig fromEnvironment(Map<String, String> env) {
    return builderFrom(env).build();
  }

  /**
   * Reads a configuration from properties named like the environment
   * variables, e.g. {@code AUTHCACHE_JWKS_URI}.
   */
  public static AuthCacheConfig fromProperties(Properties properties) {
    return builderFrom(Maps.fromProperties(properties)).build();
  }

  /**
   * Seeds a builder from {@code AUTHCACHE_*} keys; keys that are absent keep
   * their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static Builder builderFrom(Map<String, String> values) {
    Builder b = new Builder();
    Source src = new Source(values);
    if (src.has(REQUEST_CACHE_MAX_ENTRIES)) {
      b.setRequestCacheMaxEntries(src.getInt(REQUEST_CACHE_MAX_ENTRIES));
    }
    if (src.has(TOKEN_CACHE_TTL_SECONDS)) {
      b.setTokenCacheTtl(src.getSeconds(TOKEN_CACHE_TTL_SECONDS));
    }
    if (src.has(TOKEN_CACHE_MAX_ENTRIES)) {
      b.setTokenCacheMaxEntries(src.getInt(TOKEN_CACHE_MAX_ENTRIES));
    }
    if (src.has(NEGATIVE_TTL_SECONDS)) {
      b.setMalformedTokenNegativeTtl(src.getSeconds(NEGATIVE_TTL_SECONDS));
    }
    if (src.has(SESSION_CACHE_TTL_SECONDS)) {
      b.setSessionCacheTtl(src.getSeconds(SESSION_CACHE_TTL_SECONDS));
    }
    if (src.has(SESSION_HARD_CEILING_SECONDS)) {
      b.setSessionHardCeiling(src.getSeconds(SESSION_HARD_CEILING_SECONDS));
    }
    if (src.has(SESSION_CACHE_MAX_ENTRIES)) {
      b.setSessionCacheMaxEntries(src.getInt(SESSION_CACHE_MAX_ENTRIES));
    }
    if (src.has(SWEEP_INTERVAL_SECONDS)) {
      b.setSweepInterval(src.getSeconds(SWEEP_INTERVAL_SECONDS));
    }
    b.setJwksUri(src.get(JWKS_URI));
    b.setIssuer(src.get(ISSUER));
    b.setAudience(src.get(AUDIENCE));
    if (src.has(JWKS_TTL_SECONDS)) {
      b.setJwksTtl(src.getSeconds(JWKS_TTL_SECONDS));
    }
    if (src.has(JWKS_REFRESH_FRACTION)) {
      b.setJwksRefreshFraction(src.getDouble(JWKS_REFRESH_FRACTION));
    }
    if (src.has(JWKS_GRACE_SECONDS)) {
      b.setJwksGracePeriod(src.getSeconds(JWKS_GRACE_SECONDS));
    }
    if (src.has(JWKS_FETCH_TIMEOUT_SECONDS)) {
      b.setJwksFetchTimeout(src.getSeconds(JWKS_FETCH_TIMEOUT_SECONDS));
    }
    if (src.has(JWKS_FORCED_REFRESH_MIN_INTERVAL_SECONDS)) {
      b.setJwksForcedRefreshMinInterval(src.getSeconds(JWKS_FORCED_REFRESH_MIN_INTERVAL_SECONDS));
    }
    for (EndpointClass endpointClass : EndpointClass.values()) {
      String key = RATE_LIMIT_PREFIX + endpointClass.name();
      if (src.has(key)) {
        b.setRateLimit(endpointClass, RateLimitPolicy.parse(src.get(key)));
      }
    }
    if (src.has(ENCRYPTION_KEY)) {
      b.setEncryptionMasterKey(src.get(ENCRYPTION_KEY));
    }
    if (src.has(ROLES_CLAIM)) {
      b.setRolesClaim(src.get(ROLES_CLAIM));
    }
    if (src.has(PERMISSIONS_CLAIM)) {
      b.setPermissionsClaim(src.get(PERMISSIONS_CLAIM));
    }
    if (src.has(ROLE_PERMISSIONS)) {
      b.setRolePermissions(parseRolePermissions(src.get(ROLE_PERMISSIONS)));
    }
    return b;
  }

  /**
   * Parses {@code "admin=users:read,users:write;student=courses:read"}.
   */
  static ImmutableSetMultimap<String, String> parseRolePermissions(String value) {
    ImmutableSetMultimap.Builder<String, String> grants = ImmutableSetMultimap.builder();
    for (String role : ROLE_SPLITTER.split(value)) {
      int eq = role.indexOf('=');
      Preconditions.checkArgument(eq > 0,
          "a role grant must look like <role>=<permission>,..., got '%s'", role);
      grants.putAll(role.substring(0, eq).trim(),
          PERMISSION_SPLITTER.split(role.substring(eq + 1)));
    }
    return grants.build();
  }

  public int getRequestCacheMaxEntries() {
    return requestCacheMaxEntries;
  }

  public Duration getTokenCacheTtl() {
    return tokenCacheTtl;
  }

  public int getTokenCacheMaxEntries() {
    return tokenCacheMaxEntries;
  }

  public Duration getMalformedTokenNegativeTtl() {
    return malformedTokenNegativeTtl;
  }

  public Duration getSessionCacheTtl() {
    return sessionCacheTtl;
  }

  public Duration getSessionHardCeiling() {
    return sessionHardCeiling;
  }

  public int getSessionCacheMaxEntries() {
    return sessionCacheMaxEntries;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public Optional<String> getJwksUri() {
    return jwksUri;
  }

  public Optional<String> getIssuer() {
    return issuer;
  }

  public Optional<String> getAudience() {
    return audience;
  }

  public Duration getJwksTtl() {
    return jwksTtl;
  }

  public double getJwksRefreshFraction() {
    return jwksRefreshFraction;
  }

  public Duration getJwksGracePeriod() {
    return jwksGracePeriod;
  }

  public Duration getJwksFetchTimeout() {
    return jwksFetchTimeout;
  }

  public Duration getJwksForcedRefreshMinInterval() {
    return jwksForcedRefreshMinInterval;
  }

  public ImmutableMap<EndpointClass, RateLimitPolicy> getRateLimits() {
    return rateLimits;
  }

  /**
   * @return the 32-byte cache master key, if one is configured
   */
  public Optional<byte[]> getEncryptionMasterKey() {
    return encryptionMasterKey.isPresent()
        ? Optional.of(encryptionMasterKey.get().clone())
        : Optional.<byte[]>absent();
  }

  public String getRolesClaim() {
    return rolesClaim;
  }

  public String getPermissionsClaim() {
    return permissionsClaim;
  }

  public ImmutableSetMultimap<String, String> getRolePermissions() {
    return rolePermissions;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tokenCacheTtl", tokenCacheTtl)
        .add("sessionCacheTtl", sessionCacheTtl)
        .add("sessionHardCeiling", sessionHardCeiling)
        .add("jwksUri", jwksUri.orNull())
        .add("issuer", issuer.orNull())
        .add("audience", audience.orNull())
        .add("jwksTtl", jwksTtl)
        .add("rateLimits", rateLimits)
        .add("encryptionMasterKey", encryptionMasterKey.isPresent() ? "<set>" : "<random>")
        .toString();
  }

  /**
   * Builds {@link AuthCacheConfig} instances. Every setting starts at its
   * {@code DEFAULT_*} value.
   */
  public static final class Builder {
    private int requestCacheMaxEntries = DEFAULT_REQUEST_CACHE_MAX_ENTRIES;
    private Duration tokenCacheTtl = DEFAULT_TOKEN_CACHE_TTL;
    private int tokenCacheMaxEntries = DEFAULT_TOKEN_CACHE_MAX_ENTRIES;
    private Duration malformedTokenNegativeTtl = DEFAULT_MALFORMED_TOKEN_NEGATIVE_TTL;
    private Duration sessionCacheTtl = DEFAULT_SESSION_CACHE_TTL;
    private Duration sessionHardCeiling = DEFAULT_SESSION_HARD_CEILING;
    private int sessionCacheMaxEntries = DEFAULT_SESSION_CACHE_MAX_ENTRIES;
    private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
    private String jwksUri;
    private String issuer;
    private String audience;
    private Duration jwksTtl = DEFAULT_JWKS_TTL;
    private double jwksRefreshFraction = DEFAULT_JWKS_REFRESH_FRACTION;
    private Duration jwksGracePeriod = DEFAULT_JWKS_GRACE_PERIOD;
    private Duration jwksFetchTimeout = DEFAULT_JWKS_FETCH_TIMEOUT;
    private Duration jwksForcedRefreshMinInterval = DEFAULT_JWKS_FORCED_REFRESH_MIN_INTERVAL;
    private final EnumMap<EndpointClass, RateLimitPolicy> rateLimits =
        new EnumMap<>(RateLimitPolicy.DEFAULTS);
    private byte[] encryptionMasterKey;
    private String rolesClaim = DEFAULT_ROLES_CLAIM;
    private String permissionsClaim = DEFAULT_PERMISSIONS_CLAIM;
    private ImmutableSetMultimap.Builder<String, String> rolePermissions =
        ImmutableSetMultimap.builder();

    private Builder() {}

    public Builder setRequestCacheMaxEntries(int requestCacheMaxEntries) {
      this.requestCacheMaxEntries = requestCacheMaxEntries;
      return this;
    }

    public Builder setTokenCacheTtl(Duration tokenCacheTtl) {
      this.tokenCacheTtl = Preconditions.checkNotNull(tokenCacheTtl);
      return this;
    }

    public Builder setTokenCacheMaxEntries(int tokenCacheMaxEntries) {
      this.tokenCacheMaxEntries = tokenCacheMaxEntries;
      return this;
    }

    public Builder setMalformedTokenNegativeTtl(Duration malformedTokenNegativeTtl) {
      this.malformedTokenNegativeTtl = Preconditions.checkNotNull(malformedTokenNegativeTtl);
      return this;
    }

    public Builder setSessionCacheTtl(Duration sessionCacheTtl) {
      this.sessionCacheTtl = Preconditions.checkNotNull(sessionCacheTtl);
      return this;
    }

    public Builder setSessionHardCeiling(Duration sessionHardCeiling) {
      this.sessionHardCeiling = Preconditions.checkNotNull(sessionHardCeiling);
      return this;
    }

    public Builder setSessionCacheMaxEntries(int sessionCacheMaxEntries) {
      this.sessionCacheMaxEntries = sessionCacheMaxEntries;
      return this;
    }

    public Builder setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = Preconditions.checkNotNull(sweepInterval);
      return this;
    }

    public Builder setJwksUri(@Nullable String jwksUri) {
      this.jwksUri = jwksUri;
      return this;
    }

    public Builder setIssuer(@Nullable String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder setAudience(@Nullable String audience) {
      this.audience = audience;
      return this;
    }

    public Builder setJwksTtl(Duration jwksTtl) {
      this.jwksTtl = Preconditions.checkNotNull(jwksTtl);
      return this;
    }

    public Builder setJwksRefreshFraction(double jwksRefreshFraction) {
      this.jwksRefreshFraction = jwksRefreshFraction;
      return this;
    }

    public Builder setJwksGracePeriod(Duration jwksGracePeriod) {
      this.jwksGracePeriod = Preconditions.checkNotNull(jwksGracePeriod);
      return this;
    }

    public Builder setJwksFetchTimeout(Duration jwksFetchTimeout) {
      this.jwksFetchTimeout = Preconditions.checkNotNull(jwksFetchTimeout);
      return this;
    }

    public Builder setJwksForcedRefreshMinInterval(Duration interval) {
      this.jwksForcedRefreshMinInterval = Preconditions.checkNotNull(interval);
      return this;
    }

    public Builder setRateLimit(EndpointClass endpointClass, RateLimitPolicy policy) {
      this.rateLimits.put(Preconditions.checkNotNull(endpointClass),
          Preconditions.checkNotNull(policy));
      return this;
    }

    /**
     * @param base64MasterKey a base64 encoded 32-byte key
     */
    public Builder setEncryptionMasterKey(String base64MasterKey) {
      try {
        this.encryptionMasterKey = BaseEncoding.base64().decode(base64MasterKey.trim());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("the cache encryption key is not valid base64", e);
      }
      return this;
    }

    public Builder setEncryptionMasterKey(byte[] masterKey) {
      this.encryptionMasterKey = masterKey.clone();
      return this;
    }

    public Builder setRolesClaim(String rolesClaim) {
      this.rolesClaim = Preconditions.checkNotNull(rolesClaim);
      return this;
    }

    public Builder setPermissionsClaim(String permissionsClaim) {
      this.permissionsClaim = Preconditions.checkNotNull(permissionsClaim);
      return this;
    }

    public Builder setRolePermissions(ImmutableSetMultimap<String, String> grants) {
      this.rolePermissions = ImmutableSetMultimap.<String, String>builder().putAll(grants);
      return this;
    }

    public Builder addRolePermission(String role, String permission) {
      this.rolePermissions.put(role, permission);
      return this;
    }

    /**
     * @throws IllegalArgumentException if the settings are inconsistent
     */
    public AuthCacheConfig build() {
      Preconditions.checkArgument(requestCacheMaxEntries > 0,
          "requestCacheMaxEntries must be positive");
      Preconditions.checkArgument(tokenCacheMaxEntries > 0, "tokenCacheMaxEntries must be positive");
      Preconditions.checkArgument(sessionCacheMaxEntries > 0,
          "sessionCacheMaxEntries must be positive");
      checkPositive(tokenCacheTtl, "tokenCacheTtl");
      checkPositive(malformedTokenNegativeTtl, "malformedTokenNegativeTtl");
      checkPositive(sessionCacheTtl, "sessionCacheTtl");
      checkPositive(sessionHardCeiling, "sessionHardCeiling");
      checkPositive(sweepInterval, "sweepInterval");
      checkPositive(jwksTtl, "jwksTtl");
      checkPositive(jwksFetchTimeout, "jwksFetchTimeout");
      Preconditions.checkArgument(!jwksGracePeriod.isNegative(),
          "jwksGracePeriod must not be negative");
      Preconditions.checkArgument(!jwksForcedRefreshMinInterval.isNegative(),
          "jwksForcedRefreshMinInterval must not be negative");
      Preconditions.checkArgument(jwksRefreshFraction > 0 && jwksRefreshFraction < 1,
          "jwksRefreshFraction must lie strictly between 0 and 1, got %s", jwksRefreshFraction);
      Preconditions.checkArgument(sessionHardCeiling.compareTo(sessionCacheTtl) >= 0,
          "sessionHardCeiling (%s) must not be shorter than sessionCacheTtl (%s)",
          sessionHardCeiling, sessionCacheTtl);
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(jwksUri) || !Strings.isNullOrEmpty(issuer),
          "either a jwks uri or an issuer must be configured");
      Preconditions.checkArgument(encryptionMasterKey == null || encryptionMasterKey.length == 32,
          "the cache encryption key must be 32 bytes");
      Preconditions.checkArgument(!rolesClaim.isEmpty(), "rolesClaim must not be empty");
      Preconditions.checkArgument(!permissionsClaim.isEmpty(),
          "permissionsClaim must not be empty");
      return new AuthCacheConfig(this);
    }

    private static void checkPositive(Duration d, String name) {
      Preconditions.checkArgument(!d.isNegative() && !d.isZero(), "%s must be positive", name);
    }
  }

  private static final class Source {
    private final Map<String, String> values;

    Source(Map<String, String> values) {
      this.values = values;
    }

    boolean has(String key) {
      return !Strings.isNullOrEmpty(get(key));
    }

    @Nullable
    String get(String key) {
      String value = values.get(key);
      return value == null ? null : value.trim();
    }

    int getInt(String key) {
      try {
        return Integer.parseInt(get(key));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key + " must be an integer", e);
      }
    }

    double getDouble(String key) {
      try {
        return Double.parseDouble(get(key));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key + " must be a number", e);
      }
    }

    Duration getSeconds(String key) {
      try {
        return Duration.ofSeconds(Long.parseLong(get(key)));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key + " must be a whole number of seconds", e);
      }
    }
  }
}
