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

package com.orientor.authcache.session;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

import javax.annotation.Nullable;

/**
 * The materialized session of a user: profile fields plus the effective
 * roles and permissions, as of {@link #getSourceVersion() a version} of the
 * user's database record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserSessionRecord {
  private final String subjectId;
  private final long internalUserId;
  private final String email;
  @Nullable private final String displayName;
  private final ImmutableSet<String> roles;
  private final ImmutableSet<String> permissions;
  private final boolean active;
  private final boolean onboardingCompleted;
  private final long sourceVersion;
  private final long cachedAtMillis;

  @JsonCreator
  public UserSessionRecord(
      @JsonProperty("subjectId") String subjectId,
      @JsonProperty("internalUserId") long internalUserId,
      @JsonProperty("email") String email,
      @JsonProperty("displayName") @Nullable String displayName,
      @JsonProperty("roles") @Nullable Set<String> roles,
      @JsonProperty("permissions") @Nullable Set<String> permissions,
      @JsonProperty("active") boolean active,
      @JsonProperty("onboardingCompleted") boolean onboardingCompleted,
      @JsonProperty("sourceVersion") long sourceVersion,
      @JsonProperty("cachedAtMillis") long cachedAtMillis) {
    this.subjectId = Preconditions.checkNotNull(subjectId, "subjectId");
    this.internalUserId = internalUserId;
    this.email = Preconditions.checkNotNull(email, "email");
    this.displayName = displayName;
    this.roles = roles == null ? ImmutableSet.<String>of() : ImmutableSet.copyOf(roles);
    this.permissions =
        permissions == null ? ImmutableSet.<String>of() : ImmutableSet.copyOf(permissions);
    this.active = active;
    this.onboardingCompleted = onboardingCompleted;
    this.sourceVersion = sourceVersion;
    this.cachedAtMillis = cachedAtMillis;
  }

  /**
   * Materializes {@code profile} with its resolved {@code permissions}.
   */
  public static UserSessionRecord fromProfile(UserProfile profile, Set<String> permissions,
      long cachedAtMillis) {
    return new UserSessionRecord(profile.getSubjectId(), profile.getInternalUserId(),
        profile.getEmail(), profile.getDisplayName(), profile.getRoles(), permissions,
        profile.isActive(), profile.isOnboardingCompleted(), profile.getSourceVersion(),
        cachedAtMillis);
  }

  public String getSubjectId() {
    return subjectId;
  }

  public long getInternalUserId() {
    return internalUserId;
  }

  public String getEmail() {
    return email;
  }

  @Nullable
  public String getDisplayName() {
    return displayName;
  }

  public ImmutableSet<String> getRoles() {
    return roles;
  }

  public ImmutableSet<String> getPermissions() {
    return permissions;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isOnboardingCompleted() {
    return onboardingCompleted;
  }

  public long getSourceVersion() {
    return sourceVersion;
  }

  /**
   * @return when the record was materialized from the database, in
   *     milliseconds since the epoch
   */
  public long getCachedAtMillis() {
    return cachedAtMillis;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UserSessionRecord)) {
      return false;
    }
    UserSessionRecord that = (UserSessionRecord) o;
    return internalUserId == that.internalUserId
        && active == that.active
        && onboardingCompleted == that.onboardingCompleted
        && sourceVersion == that.sourceVersion
        && cachedAtMillis == that.cachedAtMillis
        && subjectId.equals(that.subjectId)
        && email.equals(that.email)
        && Objects.equal(displayName, that.displayName)
        && roles.equals(that.roles)
        && permissions.equals(that.permissions);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(subjectId, internalUserId, email, displayName, roles, permissions,
        active, onboardingCompleted, sourceVersion, cachedAtMillis);
  }

  @Override
  public String toString() {
    // The email is left out so that records can be logged.
    return MoreObjects.toStringHelper(this)
        .add("subjectId", subjectId)
        .add("internalUserId", internalUserId)
        .add("roles", roles)
        .add("permissions", permissions)
        .add("active", active)
        .add("sourceVersion", sourceVersion)
        .toString();
  }
}
