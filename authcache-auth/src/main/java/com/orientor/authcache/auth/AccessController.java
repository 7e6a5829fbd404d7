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
import com.orientor.authcache.session.UserSessionRecord;

/**
 * Role and permission checks against a session.
 *
 * <p>A held permission grants a requested one if the two are equal, if it
 * is {@code *}, or if it ends in {@code :*} and the requested permission
 * starts with what precedes the {@code *}; {@code courses:*} grants
 * {@code courses:read}. Inactive users are granted nothing.
 */
public final class AccessController {
  private static final String WILDCARD = "*";
  private static final String SCOPE_WILDCARD = ":*";

  /**
   * @return {@code true} if {@code session} holds {@code permission}
   */
  public boolean authorize(UserSessionRecord session, String permission) {
    Preconditions.checkNotNull(session);
    Preconditions.checkNotNull(permission);
    if (!session.isActive()) {
      return false;
    }
    if (session.getPermissions().contains(permission)) {
      return true;
    }
    for (String held : session.getPermissions()) {
      if (grants(held, permission)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Like {@link #authorize(UserSessionRecord, String)}, remembering the
   * answer for the rest of the request.
   */
  public boolean authorize(UserSessionRecord session, String permission,
      RequestCache requestCache) {
    String key = "authz:" + session.getSubjectId() + ":" + permission;
    Optional<Boolean> cached = requestCache.get(key, Boolean.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    boolean allowed = authorize(session, permission);
    requestCache.put(key, allowed);
    return allowed;
  }

  /**
   * @throws PermissionDeniedException if {@code session} lacks
   *     {@code permission}
   */
  public void checkPermission(UserSessionRecord session, String permission) {
    if (!authorize(session, permission)) {
      throw new PermissionDeniedException(permission);
    }
  }

  public boolean hasRole(UserSessionRecord session, String role) {
    return session.isActive() && session.getRoles().contains(role);
  }

  public boolean hasAnyRole(UserSessionRecord session, String... roles) {
    for (String role : roles) {
      if (hasRole(session, role)) {
        return true;
      }
    }
    return false;
  }

  private static boolean grants(String held, String requested) {
    if (WILDCARD.equals(held)) {
      return true;
    }
    if (held.endsWith(SCOPE_WILDCARD)) {
      String prefix = held.substring(0, held.length() - 1);
      return requested.startsWith(prefix) && requested.length() > prefix.length();
    }
    return false;
  }
}
