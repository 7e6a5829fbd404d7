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

import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

/**
 * Reads the {@code sub} claim of a JWT without checking anything. The result
 * only ever feeds cache key derivation, never an authorization decision.
 */
final class UnverifiedSubject {
  private static final JwtConsumer JWT_CONSUMER = new JwtConsumerBuilder()
      .setDisableRequireSignature()
      .setSkipAllValidators()
      .setSkipSignatureVerification()
      .build();

  private UnverifiedSubject() {}

  static Optional<String> peek(String rawToken) {
    try {
      return Optional.fromNullable(JWT_CONSUMER.processToClaims(rawToken).getSubject());
    } catch (InvalidJwtException | MalformedClaimException e) {
      return Optional.absent();
    }
  }
}
