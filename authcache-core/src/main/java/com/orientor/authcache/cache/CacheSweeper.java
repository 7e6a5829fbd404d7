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

package com.orientor.authcache.cache;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import javax.annotation.concurrent.GuardedBy;

/**
 * Periodically purges expired state from a set of {@link Sweepable}s on a
 * single daemon thread.
 */
public final class CacheSweeper implements Closeable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Duration interval;
  private final List<Sweepable> targets = new CopyOnWriteArrayList<>();

  @GuardedBy("this")
  private ScheduledExecutorService executor;

  public CacheSweeper(Duration interval) {
    Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(),
        "the sweep interval must be positive");
    this.interval = interval;
  }

  public CacheSweeper register(Sweepable target) {
    targets.add(Preconditions.checkNotNull(target));
    return this;
  }

  public List<Sweepable> getTargets() {
    return ImmutableList.copyOf(targets);
  }

  /**
   * Starts the sweep thread. Calling this on a started sweeper does nothing.
   */
  public synchronized void start() {
    if (executor != null) {
      logger.atInfo().log("%s is already started", this);
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("authcache-sweeper-%d")
        .build());
    long millis = interval.toMillis();
    executor.scheduleWithFixedDelay(new Runnable() {
      @Override
      public void run() {
        sweepNow();
      }
    }, millis, millis, TimeUnit.MILLISECONDS);
    logger.atInfo().log("started sweeping %d targets every %s", targets.size(), interval);
  }

  public synchronized boolean isRunning() {
    return executor != null;
  }

  /**
   * Runs one sweep over every target on the calling thread.
   *
   * @return the number of items removed in total
   */
  public int sweepNow() {
    int total = 0;
    for (Sweepable target : targets) {
      try {
        total += target.cleanUp();
      } catch (RuntimeException e) {
        // A failing target must not stop the schedule for the others.
        logger.atSevere().withCause(e).log("sweep of %s failed", target.getName());
      }
    }
    return total;
  }

  @Override
  public synchronized void close() {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    executor = null;
    logger.atInfo().log("stopped the cache sweeper");
  }
}
