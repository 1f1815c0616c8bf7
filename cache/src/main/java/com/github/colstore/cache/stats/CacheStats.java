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
package com.github.colstore.cache.stats;

import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.Cache;
import com.github.colstore.cache.CacheBehavior;
import com.google.errorprone.annotations.Immutable;

/**
 * Statistics about the performance of a {@link Cache}.
 * <p>
 * Cache statistics are incremented according to the following rules:
 * <ul>
 *   <li>Every {@link Cache#lookup} increments {@code lookupCount} and exactly one of
 *       {@code hitCount} or {@code missCount}.
 *   <li>A lookup made with {@link CacheBehavior#EXPECT_IN_CACHE} additionally increments
 *       {@code cachingHitCount} or {@code cachingMissCount}.
 *   <li>Every {@link Cache#insert} increments {@code insertCount}.
 *   <li>When an entry is freed, {@code evictionCount} is incremented and its charge added to
 *       {@code evictionCharge}, whatever the reason it left the cache.
 *   <li>{@code usage} is the sum of the charges that were reported through
 *       {@link CacheMetrics#recordUsage} and is not a cumulative counter.
 * </ul>
 * <p>
 * This is a <em>value-based</em> class; use of identity-sensitive operations on instances of
 * {@code CacheStats} may have unpredictable results and should be avoided.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY_STATS = CacheStats.of(0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L);

  private final long insertCount;
  private final long lookupCount;
  private final long hitCount;
  private final long missCount;
  private final long cachingHitCount;
  private final long cachingMissCount;
  private final long evictionCount;
  private final long evictionCharge;
  private final long usage;

  private CacheStats(long insertCount, long lookupCount, long hitCount, long missCount,
      long cachingHitCount, long cachingMissCount, long evictionCount, long evictionCharge,
      long usage) {
    if ((insertCount < 0) || (lookupCount < 0) || (hitCount < 0) || (missCount < 0)
        || (cachingHitCount < 0) || (cachingMissCount < 0) || (evictionCount < 0)
        || (evictionCharge < 0)) {
      throw new IllegalArgumentException();
    }
    this.insertCount = insertCount;
    this.lookupCount = lookupCount;
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.cachingHitCount = cachingHitCount;
    this.cachingMissCount = cachingMissCount;
    this.evictionCount = evictionCount;
    this.evictionCharge = evictionCharge;
    this.usage = usage;
  }

  /**
   * Returns a {@code CacheStats} representing the specified statistics.
   *
   * @param insertCount the number of inserts
   * @param lookupCount the number of lookups
   * @param hitCount the number of lookups that found an entry
   * @param missCount the number of lookups that did not find an entry
   * @param cachingHitCount the number of hits among lookups expecting to find an entry
   * @param cachingMissCount the number of misses among lookups expecting to find an entry
   * @param evictionCount the number of entries freed
   * @param evictionCharge the sum of the charges of the entries freed
   * @param usage the charge currently reported as held
   * @return a {@code CacheStats} representing the specified statistics
   */
  @SuppressWarnings("TooManyParameters")
  public static CacheStats of(@NonNegative long insertCount, @NonNegative long lookupCount,
      @NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long cachingHitCount, @NonNegative long cachingMissCount,
      @NonNegative long evictionCount, @NonNegative long evictionCharge, long usage) {
    // Many parameters of the same type in a row is a bad thing, but this class is not constructed
    // by end users and is too fine-grained for a builder.
    return new CacheStats(insertCount, lookupCount, hitCount, missCount,
        cachingHitCount, cachingMissCount, evictionCount, evictionCharge, usage);
  }

  /**
   * Returns a statistics instance where no cache events have been recorded.
   *
   * @return an empty statistics instance
   */
  public static CacheStats empty() {
    return EMPTY_STATS;
  }

  /** Returns the number of times an entry was inserted. */
  public @NonNegative long insertCount() {
    return insertCount;
  }

  /** Returns the number of times the cache was searched for a key. */
  public @NonNegative long lookupCount() {
    return lookupCount;
  }

  /** Returns the number of lookups that returned a handle. */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /** Returns the number of lookups that returned nothing. */
  public @NonNegative long missCount() {
    return missCount;
  }

  /**
   * Returns the number of lookups made with {@link CacheBehavior#EXPECT_IN_CACHE} that returned a
   * handle.
   */
  public @NonNegative long cachingHitCount() {
    return cachingHitCount;
  }

  /**
   * Returns the number of lookups made with {@link CacheBehavior#EXPECT_IN_CACHE} that returned
   * nothing.
   */
  public @NonNegative long cachingMissCount() {
    return cachingMissCount;
  }

  /**
   * Returns the ratio of lookups which were hits. This is defined as
   * {@code hitCount / (hitCount + missCount)}, or {@code 1.0} when there were no lookups.
   *
   * @return the ratio of lookups which were hits
   */
  public @NonNegative double hitRate() {
    long requestCount = saturatedAdd(hitCount, missCount);
    return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
  }

  /**
   * Returns the ratio of lookups which were misses. This is defined as
   * {@code missCount / (hitCount + missCount)}, or {@code 0.0} when there were no lookups.
   *
   * @return the ratio of lookups which were misses
   */
  public @NonNegative double missRate() {
    long requestCount = saturatedAdd(hitCount, missCount);
    return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
  }

  /** Returns the number of entries whose memory was released. */
  public @NonNegative long evictionCount() {
    return evictionCount;
  }

  /** Returns the sum of the charges of the entries whose memory was released. */
  public @NonNegative long evictionCharge() {
    return evictionCharge;
  }

  /** Returns the charge that was held by the cache when the snapshot was taken. */
  public long usage() {
    return usage;
  }

  /**
   * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
   * {@code other}. The values are saturated at {@code Long.MAX_VALUE} instead of overflowing.
   *
   * @param other the statistics to add with
   * @return the sum of the statistics
   */
  public CacheStats plus(CacheStats other) {
    return CacheStats.of(
        saturatedAdd(insertCount, other.insertCount),
        saturatedAdd(lookupCount, other.lookupCount),
        saturatedAdd(hitCount, other.hitCount),
        saturatedAdd(missCount, other.missCount),
        saturatedAdd(cachingHitCount, other.cachingHitCount),
        saturatedAdd(cachingMissCount, other.cachingMissCount),
        saturatedAdd(evictionCount, other.evictionCount),
        saturatedAdd(evictionCharge, other.evictionCharge),
        saturatedAdd(usage, other.usage));
  }

  /**
   * Returns the sum of {@code a} and {@code b} unless it would overflow or underflow in which case
   * {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} is returned, respectively.
   */
  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedAdd(long a, long b) {
    long naiveSum = a + b;
    if ((a ^ b) < 0 | (a ^ naiveSum) >= 0) {
      return naiveSum;
    }
    return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(insertCount, lookupCount, hitCount, missCount,
        cachingHitCount, cachingMissCount, evictionCount, evictionCharge, usage);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    CacheStats other = (CacheStats) o;
    return insertCount == other.insertCount
        && lookupCount == other.lookupCount
        && hitCount == other.hitCount
        && missCount == other.missCount
        && cachingHitCount == other.cachingHitCount
        && cachingMissCount == other.cachingMissCount
        && evictionCount == other.evictionCount
        && evictionCharge == other.evictionCharge
        && usage == other.usage;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "insertCount=" + insertCount + ", "
        + "lookupCount=" + lookupCount + ", "
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "cachingHitCount=" + cachingHitCount + ", "
        + "cachingMissCount=" + cachingMissCount + ", "
        + "evictionCount=" + evictionCount + ", "
        + "evictionCharge=" + evictionCharge + ", "
        + "usage=" + usage
        + '}';
  }
}
