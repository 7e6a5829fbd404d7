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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link PermissionResolver}.
 */
@RunWith(JUnit4.class)
public final class PermissionResolverTest {
  private final PermissionResolver resolver = new PermissionResolver(
      ImmutableSetMultimap.<String, String>builder()
          .putAll("student", "courses:read", "profile:write")
          .putAll("mentor", "courses:read", "sessions:manage")
          .put("admin", "*")
          .build());

  @Test
  public void testUnionOfRolesAndGrants() {
    assertThat(resolver.resolve(ImmutableSet.of("student", "mentor"),
        ImmutableSet.of("beta:features")))
        .containsExactly("courses:read", "profile:write", "sessions:manage", "beta:features");
  }

  @Test
  public void testUnknownRolesContributeNothing() {
    assertThat(resolver.resolve(ImmutableSet.of("ghost"), ImmutableSet.<String>of())).isEmpty();
  }
}
