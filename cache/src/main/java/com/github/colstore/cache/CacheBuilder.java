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
package com.github.colstore.cache;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.memory.BufferAllocator;
import com.github.colstore.cache.memory.MemoryTracker;
import com.github.colstore.cache.stats.CacheMetrics;
import com.github.colstore.cache.stats.ConcurrentCacheMetrics;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A builder of {@link Cache} instances having any combination of the following features:
 * <ul>
 *   <li>least-recently-used or first-in-first-out eviction when the capacity is exceeded
 *   <li>a configurable number of shards, or a single shard
 *   <li>a custom allocator for the values' memory
 *   <li>approximate reporting of the live charge to a {@link MemoryTracker}
 *   <li>accumulation of cache access statistics
 * </ul>
 * <p>
 * Usage example:
 * <pre>{@code
 *   Cache cache = CacheBuilder.newBuilder()
 *       .capacity(512 * 1024 * 1024)
 *       .evictionPolicy(EvictionPolicy.LRU)
 *       .recordStats()
 *       .build();
 * }</pre>
 * <p>
 * The capacity is required; every other setting has a default. Each setting may be configured at
 * most once.
 */
public final class CacheBuilder {
  static final int UNSET_INT = -1;
  static final EvictionPolicy DEFAULT_EVICTION_POLICY = EvictionPolicy.LRU;
  static final double DEFAULT_APPROXIMATION_RATIO = 0.01;
  static final int MAXIMUM_SHARD_COUNT = 1 << 16;

  long capacity = UNSET_INT;
  int shardCount = UNSET_INT;
  double memoryTrackerApproximationRatio = UNSET_INT;
  boolean singleShard;

  @Nullable EvictionPolicy evictionPolicy;
  @Nullable BufferAllocator allocator;
  @Nullable MemoryTracker memoryTracker;
  @Nullable CacheMetrics metrics;

  private CacheBuilder() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /** Returns the smallest power of two greater than or equal to {@code x}. */
  static int ceilingPowerOfTwo(int x) {
    // From Hacker's Delight, Chapter 3, Harry S. Warren Jr.
    return 1 << -Integer.numberOfLeadingZeros(x - 1);
  }

  /**
   * Constructs a new {@code CacheBuilder} instance with default settings. The capacity must be
   * configured before building.
   *
   * @return a new instance with default settings
   */
  public static CacheBuilder newBuilder() {
    return new CacheBuilder();
  }

  /**
   * Constructs a new {@code CacheBuilder} instance with the settings specified in {@code spec}.
   *
   * @param spec the specification to configure the builder with
   * @return a new instance with the specification's settings
   */
  public static CacheBuilder from(CacheSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Constructs a new {@code CacheBuilder} instance with the settings specified in {@code spec}.
   *
   * @param spec a String in the format specified by {@link CacheSpec}
   * @return a new instance with the specification's settings
   */
  public static CacheBuilder from(String spec) {
    return from(CacheSpec.parse(spec));
  }

  /**
   * Specifies the maximum sum of the charges of the entries the cache may index. The capacity is
   * split evenly across the shards, so a shard evicts once its own share is exceeded even if other
   * shards have room to spare.
   *
   * @param capacity the total capacity, in units of charge
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code capacity} is negative
   * @throws IllegalStateException if the capacity was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder capacity(@NonNegative long capacity) {
    requireState(this.capacity == UNSET_INT, "capacity was already set to %s", this.capacity);
    requireArgument(capacity >= 0, "capacity must not be negative");
    this.capacity = capacity;
    return this;
  }

  long getCapacity() {
    return capacity;
  }

  /**
   * Specifies the order in which entries are evicted. Defaults to {@link EvictionPolicy#LRU}.
   *
   * @param evictionPolicy the eviction policy
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if the eviction policy was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder evictionPolicy(EvictionPolicy evictionPolicy) {
    requireState(this.evictionPolicy == null,
        "eviction policy was already set to %s", this.evictionPolicy);
    this.evictionPolicy = requireNonNull(evictionPolicy);
    return this;
  }

  EvictionPolicy getEvictionPolicy() {
    return (evictionPolicy == null) ? DEFAULT_EVICTION_POLICY : evictionPolicy;
  }

  /**
   * Specifies the number of shards. Defaults to the smallest power of two that is at least the
   * number of available processors.
   *
   * @param shardCount a power of two
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code shardCount} is not a positive power of two
   * @throws IllegalStateException if the shard count was already set or a single shard requested
   */
  @CanIgnoreReturnValue
  public CacheBuilder shardCount(int shardCount) {
    requireState(this.shardCount == UNSET_INT,
        "shard count was already set to %s", this.shardCount);
    requireState(!singleShard, "shard count can not be combined with a single shard");
    requireArgument((shardCount > 0) && (Integer.bitCount(shardCount) == 1)
        && (shardCount <= MAXIMUM_SHARD_COUNT),
        "shard count must be a power of two between 1 and %s: %s", MAXIMUM_SHARD_COUNT, shardCount);
    this.shardCount = shardCount;
    return this;
  }

  /**
   * Specifies that the cache has a single shard, which makes its capacity and eviction order exact
   * at the cost of contention on one lock.
   *
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a single shard was already requested or a shard count set
   */
  @CanIgnoreReturnValue
  public CacheBuilder singleShard() {
    requireState(!singleShard, "single shard was already set");
    requireState(shardCount == UNSET_INT,
        "single shard can not be combined with a shard count of %s", shardCount);
    this.singleShard = true;
    return this;
  }

  int getShardCount() {
    if (singleShard) {
      return 1;
    } else if (shardCount != UNSET_INT) {
      return shardCount;
    }
    int processors = Runtime.getRuntime().availableProcessors();
    return Math.min(ceilingPowerOfTwo(Math.max(processors, 1)), MAXIMUM_SHARD_COUNT);
  }

  /**
   * Specifies how far the charge reported to the memory tracker may lag behind. Each shard defers
   * its changes until their absolute sum exceeds this fraction of its capacity. A ratio of zero
   * reports every change immediately. Defaults to {@code 0.01}.
   *
   * @param ratio a fraction between zero and one
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code ratio} is outside of {@code [0, 1]}
   * @throws IllegalStateException if the ratio was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder memoryTrackerApproximationRatio(double ratio) {
    requireState(memoryTrackerApproximationRatio == UNSET_INT,
        "memory tracker approximation ratio was already set to %s",
        memoryTrackerApproximationRatio);
    requireArgument((ratio >= 0.0) && (ratio <= 1.0),
        "memory tracker approximation ratio must be between 0 and 1: %s", ratio);
    this.memoryTrackerApproximationRatio = ratio;
    return this;
  }

  double getMemoryTrackerApproximationRatio() {
    return (memoryTrackerApproximationRatio == UNSET_INT)
        ? DEFAULT_APPROXIMATION_RATIO
        : memoryTrackerApproximationRatio;
  }

  /**
   * Specifies the allocator that provides the memory of the values. Defaults to
   * {@link BufferAllocator#heap()}.
   *
   * @param allocator the allocator of the values' memory
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if an allocator was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder allocator(BufferAllocator allocator) {
    requireState(this.allocator == null, "allocator was already set to %s", this.allocator);
    this.allocator = requireNonNull(allocator);
    return this;
  }

  BufferAllocator getAllocator() {
    return (allocator == null) ? BufferAllocator.heap() : allocator;
  }

  /**
   * Specifies the tracker that is told of the charge of the live entries. An entry's charge is
   * consumed when it is inserted and released when it is freed.
   *
   * @param memoryTracker the tracker of the live charge
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if a memory tracker was already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder memoryTracker(MemoryTracker memoryTracker) {
    requireState(this.memoryTracker == null,
        "memory tracker was already set to %s", this.memoryTracker);
    this.memoryTracker = requireNonNull(memoryTracker);
    return this;
  }

  MemoryTracker getMemoryTracker() {
    return (memoryTracker == null) ? MemoryTracker.disabled() : memoryTracker;
  }

  /**
   * Enables the accumulation of {@link com.github.colstore.cache.stats.CacheStats} during the
   * operation of the cache. Without this {@link Cache#stats} returns zero for all statistics.
   *
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if metrics were already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder recordStats() {
    return metrics(new ConcurrentCacheMetrics());
  }

  /**
   * Specifies the metrics that the cache reports its activity to. Any exception thrown by the
   * metrics is logged and swallowed.
   *
   * @param metrics the metrics to record to
   * @return this {@code CacheBuilder} instance (for chaining)
   * @throws IllegalStateException if metrics were already set
   */
  @CanIgnoreReturnValue
  public CacheBuilder metrics(CacheMetrics metrics) {
    requireState(this.metrics == null, "metrics were already set to %s", this.metrics);
    this.metrics = CacheMetrics.guardedMetrics(metrics);
    return this;
  }

  boolean isRecordingStats() {
    return (metrics != null);
  }

  CacheMetrics getMetrics() {
    return (metrics == null) ? CacheMetrics.disabledMetrics() : metrics;
  }

  /**
   * Builds a cache with the configured settings.
   *
   * @return a cache having the requested features
   * @throws IllegalStateException if the capacity was not set
   */
  public Cache build() {
    requireState(capacity != UNSET_INT, "capacity must be set");
    return new ShardedCache(this);
  }

  /**
   * Returns a string representation for this CacheBuilder instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (capacity != UNSET_INT) {
      s.append("capacity=").append(capacity).append(", ");
    }
    if (evictionPolicy != null) {
      s.append("evictionPolicy=").append(evictionPolicy).append(", ");
    }
    if (singleShard) {
      s.append("singleShard, ");
    } else if (shardCount != UNSET_INT) {
      s.append("shardCount=").append(shardCount).append(", ");
    }
    if (memoryTrackerApproximationRatio != UNSET_INT) {
      s.append("memoryTrackerApproximationRatio=")
          .append(memoryTrackerApproximationRatio).append(", ");
    }
    if (allocator != null) {
      s.append("allocator, ");
    }
    if (memoryTracker != null) {
      s.append("memoryTracker, ");
    }
    if (metrics != null) {
      s.append("recordStats, ");
    }
    if (s.length() > baseLength) {
      s.deleteCharAt(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
