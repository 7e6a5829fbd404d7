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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;

/**
 * A user as the database knows it: identity, profile fields, assigned roles
 * and any permissions granted directly.
 */
public final class UserProfile {
  private final String subjectId;
  private final long internalUserId;
  private final String email;
  @Nullable private final String displayName;
  private final ImmutableSet<String> roles;
  private final ImmutableSet<String> grants;
  private final boolean active;
  private final boolean onboardingCompleted;
  private final long sourceVersion;

  private UserProfile(Builder builder) {
    this.subjectId = Preconditions.checkNotNull(builder.subjectId, "subjectId");
    this.internalUserId = builder.internalUserId;
    this.email = Preconditions.checkNotNull(builder.email, "email");
    this.displayName = builder.displayName;
    this.roles = builder.roles.build();
    this.grants = builder.grants.build();
    this.active = builder.active;
    this.onboardingCompleted = builder.onboardingCompleted;
    this.sourceVersion = builder.sourceVersion;
  }

  public static Builder builder() {
    return new Builder();
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

  /**
   * @return permissions granted to the user on top of those of its roles
   */
  public ImmutableSet<String> getGrants() {
    return grants;
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

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("subjectId", subjectId)
        .add("internalUserId", internalUserId)
        .add("roles", roles)
        .add("active", active)
        .add("sourceVersion", sourceVersion)
        .toString();
  }

  public static final class Builder {
    private String subjectId;
    private long internalUserId;
    private String email;
    private String displayName;
    private final ImmutableSet.Builder<String> roles = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> grants = ImmutableSet.builder();
    private boolean active = true;
    private boolean onboardingCompleted;
    private long sourceVersion;

    private Builder() {}

    public Builder setSubjectId(String subjectId) {
      this.subjectId = subjectId;
      return this;
    }

    public Builder setInternalUserId(long internalUserId) {
      this.internalUserId = internalUserId;
      return this;
    }

    public Builder setEmail(String email) {
      this.email = email;
      return this;
    }

    public Builder setDisplayName(@Nullable String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder addRoles(String... roles) {
      this.roles.add(roles);
      return this;
    }

    public Builder addGrants(String... grants) {
      this.grants.add(grants);
      return this;
    }

    public Builder setActive(boolean active) {
      this.active = active;
      return this;
    }

    public Builder setOnboardingCompleted(boolean onboardingCompleted) {
      this.onboardingCompleted = onboardingCompleted;
      return this;
    }

    public Builder setSourceVersion(long sourceVersion) {
      this.sourceVersion = sourceVersion;
      return this;
    }

    public UserProfile build() {
      return new UserProfile(this);
    }
  }
}
