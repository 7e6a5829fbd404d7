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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;

import java.util.Set;

/**
 * Computes the effective permissions of a user from its roles.
 */
public final class PermissionResolver {
  private final ImmutableSetMultimap<String, String> rolePermissions;

  public PermissionResolver(ImmutableSetMultimap<String, String> rolePermissions) {
    this.rolePermissions = Preconditions.checkNotNull(rolePermissions);
  }

  /**
   * @return the union of the permissions of {@code roles} and of the
   *     directly granted {@code grants}; unknown roles contribute nothing
   */
  public ImmutableSet<String> resolve(Set<String> roles, Set<String> grants) {
    ImmutableSet.Builder<String> permissions = ImmutableSet.builder();
    for (String role : roles) {
      permissions.addAll(rolePermissions.get(role));
    }
    permissions.addAll(grants);
    return permissions.build();
  }
}
