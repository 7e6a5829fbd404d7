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

import com.google.common.base.Optional;

/**
 * Read-only access to the user records of the database.
 */
public interface UserStore {

  /**
   * Returns the version of the user's record, a value that changes whenever
   * the profile or role assignment of the user changes. Expected to be cheap.
   *
   * @return the version, or absent if no such user exists
   * @throws UserStoreException if the store cannot be reached
   */
  Optional<Long> fetchVersion(String subjectId) throws UserStoreException;

  /**
   * Loads the full profile of the user.
   *
   * @return the profile, or absent if no such user exists
   * @throws UserStoreException if the store cannot be reached
   */
  Optional<UserProfile> fetchProfile(String subjectId) throws UserStoreException;
}
