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

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Default implementation of {@link KeyUriSupplier}.
 *
 * <p>A configured key set URI is used as is. Otherwise the URI is looked up
 * once through OpenID discovery on the issuer and remembered; a failed lookup
 * is retried on the next call.
 */
public final class DefaultKeyUriSupplier implements KeyUriSupplier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String HTTPS_PROTOCOL_PREFIX = "https://";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final String OPEN_ID_CONFIG_PATH = ".well-known/openid-configuration";

  private final HttpRequestFactory httpRequestFactory;
  private final Optional<String> issuer;
  private final int timeoutMillis;
  private volatile GenericUrl jwksUri;

  /**
   * Constructor.
   *
   * @param httpRequestFactory is the factory used to make HTTP requests.
   * @param jwksUri is the configured key set location, if any.
   * @param issuer is the token issuer, used for discovery when no key set
   *     location is configured.
   * @param timeout bounds the discovery request.
   */
  public DefaultKeyUriSupplier(HttpRequestFactory httpRequestFactory, Optional<String> jwksUri,
      Optional<String> issuer, Duration timeout) {
    Preconditions.checkArgument(jwksUri.isPresent() || issuer.isPresent(),
        "either a jwks uri or an issuer is required");
    this.httpRequestFactory = Preconditions.checkNotNull(httpRequestFactory);
    this.issuer = issuer;
    this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    this.jwksUri = jwksUri.isPresent() ? new GenericUrl(jwksUri.get()) : null;
  }

  @Override
  public GenericUrl supply() {
    GenericUrl known = this.jwksUri;
    if (known != null) {
      return known;
    }
    GenericUrl discovered = retrieveRemoteJwksUri(constructOpenIdUrl(issuer.get()));
    logger.atInfo().log("discovered the jwks uri %s for issuer %s", discovered, issuer.get());
    this.jwksUri = discovered;
    return discovered;
  }

  private GenericUrl retrieveRemoteJwksUri(String openIdUrl) {
    try {
      HttpRequest request = this.httpRequestFactory.buildGetRequest(new GenericUrl(openIdUrl));
      request.setConnectTimeout(timeoutMillis);
      request.setReadTimeout(timeoutMillis);
      HttpResponse httpResponse = request.execute();
      try {
        String json = httpResponse.parseAsString();
        ProviderMetadata metadata = OBJECT_MAPPER.readValue(json, ProviderMetadata.class);
        if (Strings.isNullOrEmpty(metadata.jwksUri)) {
          throw new JwksFetchException("The OpenID provider metadata at " + openIdUrl
              + " has no jwks_uri");
        }
        return new GenericUrl(metadata.jwksUri);
      } finally {
        httpResponse.disconnect();
      }
    } catch (IOException exception) {
      throw new JwksFetchException("Cannot retrieve or parse OpenID provider metadata from "
          + openIdUrl, exception);
    }
  }

  // Construct the OpenID discovery URL based on the issuer.
  static String constructOpenIdUrl(String issuer) {
    String url = issuer;
    if (!URI.create(issuer).isAbsolute()) {
      // Use HTTPS if the protocol scheme is not specified in the URL.
      url = HTTPS_PROTOCOL_PREFIX + issuer;
    }
    if (!url.endsWith("/")) {
      url += "/";
    }
    return url + OPEN_ID_CONFIG_PATH;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class ProviderMetadata {
    @JsonProperty("jwks_uri")
    String jwksUri;
  }
}
