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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The health of every component of an {@link AuthCacheRuntime}, as reported
 * by {@link AuthCacheRuntime#health()}.
 */
public final class HealthReport {

  /**
   * The health of one component, ordered from best to worst.
   */
  public enum Status {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
  }

  /**
   * The status of one component with a short human readable detail.
   */
  public static final class Component {
    private final Status status;
    private final String detail;

    Component(Status status, String detail) {
      this.status = Preconditions.checkNotNull(status);
      this.detail = Preconditions.checkNotNull(detail);
    }

    public Status getStatus() {
      return status;
    }

    public String getDetail() {
      return detail;
    }

    @Override
    public String toString() {
      return status + ": " + detail;
    }
  }

  private final ImmutableMap<String, Component> components;

  HealthReport(Map<String, Component> components) {
    this.components = ImmutableMap.copyOf(components);
  }

  /**
   * @return the worst status of any component
   */
  public Status getStatus() {
    Status worst = Status.HEALTHY;
    for (Component component : components.values()) {
      if (component.getStatus().compareTo(worst) > 0) {
        worst = component.getStatus();
      }
    }
    return worst;
  }

  public ImmutableMap<String, Component> getComponents() {
    return components;
  }

  public Component getComponent(String name) {
    Component component = components.get(name);
    Preconditions.checkArgument(component != null, "no component named %s", name);
    return component;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("status", getStatus())
        .add("components", components)
        .toString();
  }
}
