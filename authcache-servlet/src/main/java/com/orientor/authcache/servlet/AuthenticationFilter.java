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

package com.orientor.authcache.servlet;

import com.google.api.client.util.Clock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.HttpHeaders;
import com.orientor.authcache.auth.Authenticator;
import com.orientor.authcache.auth.RequestCache;
import com.orientor.authcache.auth.UnauthenticatedException;
import com.orientor.authcache.crypto.IntegrityException;
import com.orientor.authcache.ratelimit.EndpointClass;
import com.orientor.authcache.ratelimit.RateLimitExceededException;
import com.orientor.authcache.session.UserSessionRecord;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;
import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Authenticates every request it sees and makes the user's session
 * available to the rest of the chain.
 *
 * <p>Each request gets its own {@link RequestCache}, closed when the chain
 * returns. The rate limit budget is chosen by the longest configured path
 * prefix matching the request URI. Requests under an unauthenticated path
 * prefix, such as a login endpoint, are only charged against that budget
 * and reach the chain without a session. Failures are answered with a
 * generic body: 401 for credential problems, 429 with {@code Retry-After}
 * and the {@code X-RateLimit-*} headers when the client is over budget, and
 * 503 when a dependency is unavailable.
 */
public class AuthenticationFilter implements Filter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String ATTRIBUTE_ROOT = AuthenticationFilter.class.getName();

  /** The request attribute holding the {@link UserSessionRecord}. */
  public static final String SESSION_ATTRIBUTE = ATTRIBUTE_ROOT + ".session";

  /** The request attribute holding the {@link RequestCache}. */
  public static final String REQUEST_CACHE_ATTRIBUTE = ATTRIBUTE_ROOT + ".request_cache";

  /**
   * The init parameter listing path prefixes and their endpoint classes, as
   * in {@code /auth/login=AUTH,/admin=ADMIN}.
   */
  public static final String ENDPOINT_CLASSES_PARAM = "endpointClasses";

  /**
   * The init parameter listing path prefixes that are rate limited but not
   * authenticated, as in {@code /auth/login,/auth/refresh}.
   */
  public static final String UNAUTHENTICATED_PATHS_PARAM = "unauthenticatedPaths";

  @VisibleForTesting
  static final String ACCESS_TOKEN_PARAM_NAME = "access_token";
  private static final String BEARER_TOKEN_PREFIX = "Bearer ";
  private static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
  private static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
  private static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";
  private static final Splitter COMMA = Splitter.on(',').omitEmptyStrings().trimResults();

  private final Authenticator authenticator;
  private final int requestCacheMaxEntries;
  private final Clock clock;
  private ImmutableMap<String, EndpointClass> endpointClasses;
  private ImmutableSet<String> unauthenticatedPaths;

  public AuthenticationFilter(Authenticator authenticator, int requestCacheMaxEntries,
      Map<String, EndpointClass> endpointClasses) {
    this(authenticator, requestCacheMaxEntries, endpointClasses, ImmutableSet.<String>of(),
        Clock.SYSTEM);
  }

  public AuthenticationFilter(Authenticator authenticator, int requestCacheMaxEntries,
      Map<String, EndpointClass> endpointClasses, Iterable<String> unauthenticatedPaths) {
    this(authenticator, requestCacheMaxEntries, endpointClasses, unauthenticatedPaths,
        Clock.SYSTEM);
  }

  @VisibleForTesting
  AuthenticationFilter(Authenticator authenticator, int requestCacheMaxEntries,
      Map<String, EndpointClass> endpointClasses, Iterable<String> unauthenticatedPaths,
      Clock clock) {
    this.authenticator = Preconditions.checkNotNull(authenticator);
    this.requestCacheMaxEntries = requestCacheMaxEntries;
    this.endpointClasses = ImmutableMap.copyOf(endpointClasses);
    this.unauthenticatedPaths = ImmutableSet.copyOf(unauthenticatedPaths);
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Override
  public void init(FilterConfig filterConfig) throws ServletException {
    String configured = filterConfig.getInitParameter(ENDPOINT_CLASSES_PARAM);
    if (!Strings.isNullOrEmpty(configured)) {
      try {
        this.endpointClasses = parseEndpointClasses(configured);
      } catch (IllegalArgumentException e) {
        throw new ServletException("Invalid " + ENDPOINT_CLASSES_PARAM + ": " + configured, e);
      }
      logger.atInfo().log("endpoint classes by path prefix: %s", endpointClasses);
    }
    String open = filterConfig.getInitParameter(UNAUTHENTICATED_PATHS_PARAM);
    if (!Strings.isNullOrEmpty(open)) {
      this.unauthenticatedPaths = ImmutableSet.copyOf(COMMA.split(open));
      logger.atInfo().log("rate limited but unauthenticated paths: %s", unauthenticatedPaths);
    }
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    HttpServletRequest httpRequest = (HttpServletRequest) request;
    HttpServletResponse httpResponse = (HttpServletResponse) response;
    String uri = httpRequest.getRequestURI();
    EndpointClass endpointClass = endpointClassOf(uri);
    String clientId = clientIdOf(httpRequest);

    RequestCache requestCache = new RequestCache(requestCacheMaxEntries);
    try {
      UserSessionRecord session = null;
      try {
        if (isUnauthenticated(uri)) {
          authenticator.checkRateLimit(clientId, endpointClass);
        } else {
          session = authenticator.authenticate(extractAuthToken(httpRequest).orNull(),
              requestCache, clientId, endpointClass);
        }
      } catch (RateLimitExceededException e) {
        rejectOverBudget(httpResponse, e);
        return;
      } catch (UnauthenticatedException e) {
        if (e.getReason().isServerSide()) {
          logger.atWarning().withCause(e).atMostEvery(10, TimeUnit.SECONDS)
              .log("authentication unavailable");
          httpResponse.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE,
              "Service temporarily unavailable");
        } else {
          logger.atFine().log("rejected request to %s: %s", httpRequest.getRequestURI(),
              e.getReason());
          httpResponse.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
          httpResponse.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Authentication required");
        }
        return;
      } catch (IntegrityException e) {
        logger.atSevere().withCause(e).log("cached session failed its integrity check");
        httpResponse.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE,
            "Service temporarily unavailable");
        return;
      }

      if (session != null) {
        httpRequest.setAttribute(SESSION_ATTRIBUTE, session);
      }
      httpRequest.setAttribute(REQUEST_CACHE_ATTRIBUTE, requestCache);
      chain.doFilter(request, response);
    } finally {
      httpRequest.removeAttribute(REQUEST_CACHE_ATTRIBUTE);
      requestCache.close();
    }
  }

  @Override
  public void destroy() {
    // unused
  }

  /**
   * @param req a {@code ServletRequest}
   * @return the session of the authenticated user or {@code null} if the
   *     request did not pass through this filter
   */
  @Nullable
  public static UserSessionRecord getSession(ServletRequest req) {
    return (UserSessionRecord) req.getAttribute(SESSION_ATTRIBUTE);
  }

  /**
   * @param req a {@code ServletRequest}
   * @return the cache of the current request or {@code null} if its not
   *     present
   */
  @Nullable
  public static RequestCache getRequestCache(ServletRequest req) {
    return (RequestCache) req.getAttribute(REQUEST_CACHE_ATTRIBUTE);
  }

  private void rejectOverBudget(HttpServletResponse response, RateLimitExceededException e)
      throws IOException {
    long retryAfter = Math.max(1, e.getRetryAfter().getSeconds());
    long resetAt = TimeUnit.MILLISECONDS.toSeconds(clock.currentTimeMillis()) + retryAfter;
    response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter));
    response.setHeader(RATE_LIMIT_LIMIT_HEADER, Integer.toString(e.getLimit()));
    response.setHeader(RATE_LIMIT_REMAINING_HEADER, "0");
    response.setHeader(RATE_LIMIT_RESET_HEADER, Long.toString(resetAt));
    response.sendError(429, "Too many requests");
  }

  @VisibleForTesting
  boolean isUnauthenticated(@Nullable String uri) {
    if (uri == null) {
      return false;
    }
    for (String prefix : unauthenticatedPaths) {
      if (uri.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  @VisibleForTesting
  EndpointClass endpointClassOf(@Nullable String uri) {
    if (uri == null) {
      return EndpointClass.DEFAULT;
    }
    String best = null;
    for (String prefix : endpointClasses.keySet()) {
      if (uri.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
        best = prefix;
      }
    }
    return best == null ? EndpointClass.DEFAULT : endpointClasses.get(best);
  }

  @VisibleForTesting
  static ImmutableMap<String, EndpointClass> parseEndpointClasses(String value) {
    Map<String, String> entries = Splitter.on(',').omitEmptyStrings().trimResults()
        .withKeyValueSeparator('=')
        .split(value);
    ImmutableMap.Builder<String, EndpointClass> parsed = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      parsed.put(entry.getKey().trim(), EndpointClass.valueOf(entry.getValue().trim()));
    }
    return parsed.build();
  }

  @VisibleForTesting
  static Optional<String> extractAuthToken(HttpServletRequest request) {
    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader != null) {
      // When the authorization header is present, extract the token from the
      // header.
      if (authHeader.startsWith(BEARER_TOKEN_PREFIX)) {
        return Optional.of(authHeader.substring(BEARER_TOKEN_PREFIX.length()).trim());
      }
      return Optional.absent();
    }

    String accessToken = request.getParameter(ACCESS_TOKEN_PARAM_NAME);
    if (accessToken != null) {
      return Optional.of(accessToken);
    }

    return Optional.absent();
  }

  // The first X-Forwarded-For entry is the client as seen by the outermost proxy.
  @VisibleForTesting
  static String clientIdOf(HttpServletRequest request) {
    String forwardedFor = request.getHeader(HttpHeaders.X_FORWARDED_FOR);
    if (!Strings.isNullOrEmpty(forwardedFor)) {
      String first = Splitter.on(',').trimResults().split(forwardedFor).iterator().next();
      if (!first.isEmpty()) {
        return first;
      }
    }
    return Strings.nullToEmpty(request.getRemoteAddr());
  }
}
