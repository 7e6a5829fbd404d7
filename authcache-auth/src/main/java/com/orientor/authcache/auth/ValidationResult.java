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

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.time.Instant;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * The verified claims of an auth token. Never holds the token itself.
 */
public final class ValidationResult {
  private final String subjectId;
  private final ImmutableSet<String> roles;
  private final ImmutableSet<String> permissions;
  private final Optional<String> issuer;
  private final Instant issuedAt;
  private final Instant expiresAt;

  public ValidationResult(String subjectId, Set<String> roles, Set<String> permissions,
      @Nullable String issuer, Instant issuedAt, Instant expiresAt) {
    Preconditions.checkArgument(expiresAt.isAfter(issuedAt) || expiresAt.equals(issuedAt),
        "a token cannot expire before it was issued");
    this.subjectId = Preconditions.checkNotNull(subjectId);
    this.roles = ImmutableSet.copyOf(roles);
    this.permissions = ImmutableSet.copyOf(permissions);
    this.issuer = Optional.fromNullable(issuer);
    this.issuedAt = Preconditions.checkNotNull(issuedAt);
    this.expiresAt = Preconditions.checkNotNull(expiresAt);
  }

  public String getSubjectId() {
    return subjectId;
  }

  public ImmutableSet<String> getRoles() {
    return roles;
  }

  public ImmutableSet<String> getPermissions() {
    return permissions;
  }

  public Optional<String> getIssuer() {
    return issuer;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  /**
   * A result only exists for a token that passed validation, so this is
   * {@code true} until the token expires.
   */
  public boolean isValid(Instant now) {
    return !isExpired(now);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("subjectId", subjectId)
        .add("roles", roles)
        .add("permissions", permissions)
        .add("issuer", issuer.orNull())
        .add("expiresAt", expiresAt)
        .toString();
  }
}
