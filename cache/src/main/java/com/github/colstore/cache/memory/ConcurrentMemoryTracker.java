/*
 * Copyright 2026 The Colstore Authors. All Rights Reserved.
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
package com.github.colstore.cache.memory;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;

/**
 * A thread-safe {@link MemoryTracker} that keeps the current and peak consumption, and forwards
 * every update to an optional parent so that trackers can be arranged in a hierarchy.
 */
public final class ConcurrentMemoryTracker implements MemoryTracker {
  private final String id;
  private final @Nullable MemoryTracker parent;
  private final AtomicLong consumption;
  private final AtomicLong peakConsumption;

  /**
   * Creates a root tracker.
   *
   * @param id a name for the consumer, used in diagnostics
   */
  public ConcurrentMemoryTracker(String id) {
    this(id, null);
  }

  /**
   * Creates a tracker whose updates are also applied to {@code parent}.
   *
   * @param id a name for the consumer, used in diagnostics
   * @param parent the tracker to forward updates to, or {@code null}
   */
  public ConcurrentMemoryTracker(String id, @Nullable MemoryTracker parent) {
    this.id = requireNonNull(id);
    this.parent = parent;
    this.consumption = new AtomicLong();
    this.peakConsumption = new AtomicLong();
  }

  @Override
  public void consume(long bytes) {
    long current = consumption.addAndGet(bytes);
    peakConsumption.accumulateAndGet(current, Math::max);
    if (parent != null) {
      parent.consume(bytes);
    }
  }

  @Override
  public void release(long bytes) {
    consume(-bytes);
  }

  @Override
  public long consumption() {
    return consumption.get();
  }

  @Override
  public long peakConsumption() {
    return peakConsumption.get();
  }

  /** Returns the name of the consumer. */
  public String id() {
    return id;
  }

  @Override
  public String toString() {
    return "ConcurrentMemoryTracker{id=" + id
        + ", consumption=" + consumption.get()
        + ", peakConsumption=" + peakConsumption.get() + '}';
  }
}
