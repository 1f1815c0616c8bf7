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

import static com.github.colstore.cache.CacheBuilder.UNSET_INT;
import static com.github.colstore.cache.CacheBuilder.requireArgument;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.memory.BufferAllocator;
import com.github.colstore.cache.memory.DirectBufferAllocator;

/**
 * A specification of a {@link CacheBuilder} configuration.
 * <p>
 * {@code CacheSpec} supports parsing configuration off of a string, which makes it especially
 * useful for command-line configuration of a {@code CacheBuilder}.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs, each corresponding to a
 * {@code CacheBuilder} builder method.
 * <ul>
 *   <li>{@code capacity=[size]}: sets {@link CacheBuilder#capacity}.
 *   <li>{@code policy=[lru|fifo]}: sets {@link CacheBuilder#evictionPolicy}.
 *   <li>{@code shards=[integer]}: sets {@link CacheBuilder#shardCount}.
 *   <li>{@code singleShard}: sets {@link CacheBuilder#singleShard}.
 *   <li>{@code memoryTrackerApproximationRatio=[double]}: sets
 *       {@link CacheBuilder#memoryTrackerApproximationRatio}.
 *   <li>{@code allocator=[heap|direct]}: sets {@link CacheBuilder#allocator} to a heap or an
 *       unbounded direct allocator.
 *   <li>{@code recordStats}: sets {@link CacheBuilder#recordStats}.
 * </ul>
 * <p>
 * Sizes are represented as an integer optionally followed by one of "k", "m", or "g", representing
 * kibibytes, mebibytes, or gibibytes respectively.
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated; it is
 * also illegal to use {@code shards} and {@code singleShard} together.
 * <p>
 * A new {@code CacheBuilder} can be instantiated from a {@code CacheSpec} using
 * {@link CacheBuilder#from(CacheSpec)} or {@link CacheBuilder#from(String)}.
 */
public final class CacheSpec {
  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";

  final String specification;

  long capacity = UNSET_INT;
  int shardCount = UNSET_INT;
  double memoryTrackerApproximationRatio = UNSET_INT;
  boolean singleShard;
  boolean recordStats;

  @Nullable EvictionPolicy evictionPolicy;
  @Nullable String allocator;

  private CacheSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Returns a {@link CacheBuilder} configured according to this specification.
   *
   * @return a builder configured to the specification
   */
  CacheBuilder toBuilder() {
    CacheBuilder builder = CacheBuilder.newBuilder();
    if (capacity != UNSET_INT) {
      builder.capacity(capacity);
    }
    if (evictionPolicy != null) {
      builder.evictionPolicy(evictionPolicy);
    }
    if (shardCount != UNSET_INT) {
      builder.shardCount(shardCount);
    }
    if (singleShard) {
      builder.singleShard();
    }
    if (memoryTrackerApproximationRatio != UNSET_INT) {
      builder.memoryTrackerApproximationRatio(memoryTrackerApproximationRatio);
    }
    if (allocator != null) {
      builder.allocator(allocator.equals("direct")
          ? new DirectBufferAllocator()
          : BufferAllocator.heap());
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Creates a CacheSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   */
  @SuppressWarnings("StringSplitter")
  public static CacheSpec parse(String specification) {
    CacheSpec spec = new CacheSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    @SuppressWarnings("StringSplitter")
    String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "capacity":
        capacity(key, value);
        return;
      case "policy":
        evictionPolicy(key, value);
        return;
      case "shards":
        shardCount(key, value);
        return;
      case "singleShard":
        singleShard(value);
        return;
      case "memoryTrackerApproximationRatio":
        memoryTrackerApproximationRatio(key, value);
        return;
      case "allocator":
        allocator(key, value);
        return;
      case "recordStats":
        recordStats(value);
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Configures the capacity. */
  void capacity(String key, @Nullable String value) {
    requireArgument(capacity == UNSET_INT, "capacity was already set to %,d", capacity);
    capacity = parseSize(key, value);
    requireArgument(capacity >= 0, "key %s value must not be negative: %s", key, value);
  }

  /** Configures the eviction policy. */
  void evictionPolicy(String key, @Nullable String value) {
    requireArgument(evictionPolicy == null, "policy was already set to %s", evictionPolicy);
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      evictionPolicy = EvictionPolicy.valueOf(value.toUpperCase(US));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be lru or fifo", key, value), e);
    }
  }

  /** Configures the number of shards. */
  void shardCount(String key, @Nullable String value) {
    requireArgument(shardCount == UNSET_INT, "shards was already set to %,d", shardCount);
    requireArgument(!singleShard, "shards can not be combined with singleShard");
    shardCount = parseInt(key, value);
    requireArgument(shardCount > 0, "key %s value must be positive: %s", key, value);
  }

  /** Configures a single shard. */
  void singleShard(@Nullable String value) {
    requireArgument(value == null, "single shard does not take a value");
    requireArgument(!singleShard, "single shard was already set");
    requireArgument(shardCount == UNSET_INT, "singleShard can not be combined with shards");
    singleShard = true;
  }

  /** Configures the memory tracker approximation ratio. */
  void memoryTrackerApproximationRatio(String key, @Nullable String value) {
    requireArgument(memoryTrackerApproximationRatio == UNSET_INT,
        "%s was already set to %s", key, memoryTrackerApproximationRatio);
    memoryTrackerApproximationRatio = parseDouble(key, value);
    requireArgument(memoryTrackerApproximationRatio >= 0,
        "key %s value must not be negative: %s", key, value);
  }

  /** Configures the allocator. */
  void allocator(String key, @Nullable String value) {
    requireArgument(allocator == null, "allocator was already set to %s", allocator);
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    String kind = value.toLowerCase(US);
    requireArgument(kind.equals("heap") || kind.equals("direct"),
        "key %s value was set to %s, must be heap or direct", key, value);
    allocator = kind;
  }

  /** Configures the cache to record statistics. */
  void recordStats(@Nullable String value) {
    requireArgument(value == null, "record stats does not take a value");
    requireArgument(!recordStats, "record stats was already set");
    recordStats = true;
  }

  /** Returns a parsed int value. */
  static int parseInt(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be an integer", key, value), e);
    }
  }

  /** Returns a parsed long value. */
  static long parseLong(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be a long", key, value), e);
    }
  }

  /** Returns a parsed double value. */
  static double parseDouble(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be a double", key, value), e);
    }
  }

  /** Returns a parsed size, in bytes, that may carry a binary unit suffix. */
  @SuppressWarnings("NullAway")
  static long parseSize(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    char lastChar = Character.toLowerCase(value.charAt(value.length() - 1));
    int shift;
    switch (lastChar) {
      case 'k':
        shift = 10;
        break;
      case 'm':
        shift = 20;
        break;
      case 'g':
        shift = 30;
        break;
      default:
        return parseLong(key, value);
    }
    long size = parseLong(key, value.substring(0, value.length() - 1));
    requireArgument(size <= (Long.MAX_VALUE >> shift),
        "key %s value was set to %s, which overflows a long", key, value);
    return size << shift;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof CacheSpec)) {
      return false;
    }
    CacheSpec spec = (CacheSpec) o;
    return Objects.equals(capacity, spec.capacity)
        && Objects.equals(evictionPolicy, spec.evictionPolicy)
        && Objects.equals(shardCount, spec.shardCount)
        && Objects.equals(singleShard, spec.singleShard)
        && Objects.equals(memoryTrackerApproximationRatio, spec.memoryTrackerApproximationRatio)
        && Objects.equals(allocator, spec.allocator)
        && Objects.equals(recordStats, spec.recordStats);
  }

  @Override
  public int hashCode() {
    return Objects.hash(capacity, evictionPolicy, shardCount, singleShard,
        memoryTrackerApproximationRatio, allocator, recordStats);
  }

  /**
   * Returns a string that can be used to parse an equivalent {@code CacheSpec}. The order and form
   * of this representation is not guaranteed, except that parsing its output will produce a
   * {@code CacheSpec} equal to this instance.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  /**
   * Returns a string representation for this {@code CacheSpec} instance. The form of this
   * representation is not guaranteed.
   */
  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }
}
