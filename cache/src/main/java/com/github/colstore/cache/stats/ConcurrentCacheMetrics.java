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

import java.util.concurrent.atomic.LongAdder;

import com.github.colstore.cache.Cache;
import com.github.colstore.cache.CacheBehavior;
import com.github.colstore.cache.RemovalCause;

/**
 * A thread-safe {@link CacheMetrics} implementation for use by {@link Cache} implementors.
 */
public final class ConcurrentCacheMetrics implements CacheMetrics {
  private final LongAdder insertCount;
  private final LongAdder lookupCount;
  private final LongAdder hitCount;
  private final LongAdder missCount;
  private final LongAdder cachingHitCount;
  private final LongAdder cachingMissCount;
  private final LongAdder evictionCount;
  private final LongAdder evictionCharge;
  private final LongAdder usage;

  /**
   * Constructs an instance with all counts initialized to zero.
   */
  public ConcurrentCacheMetrics() {
    insertCount = new LongAdder();
    lookupCount = new LongAdder();
    hitCount = new LongAdder();
    missCount = new LongAdder();
    cachingHitCount = new LongAdder();
    cachingMissCount = new LongAdder();
    evictionCount = new LongAdder();
    evictionCharge = new LongAdder();
    usage = new LongAdder();
  }

  @Override
  public void recordInsert() {
    insertCount.increment();
  }

  @Override
  public void recordLookup(CacheBehavior behavior) {
    lookupCount.increment();
  }

  @Override
  public void recordHit(CacheBehavior behavior) {
    hitCount.increment();
    if (behavior == CacheBehavior.EXPECT_IN_CACHE) {
      cachingHitCount.increment();
    }
  }

  @Override
  public void recordMiss(CacheBehavior behavior) {
    missCount.increment();
    if (behavior == CacheBehavior.EXPECT_IN_CACHE) {
      cachingMissCount.increment();
    }
  }

  @Override
  public void recordEviction(long charge, RemovalCause cause) {
    evictionCount.increment();
    evictionCharge.add(charge);
  }

  @Override
  public void recordUsage(long delta) {
    usage.add(delta);
  }

  @Override
  public CacheStats snapshot() {
    return CacheStats.of(
        negativeToMaxValue(insertCount.sum()),
        negativeToMaxValue(lookupCount.sum()),
        negativeToMaxValue(hitCount.sum()),
        negativeToMaxValue(missCount.sum()),
        negativeToMaxValue(cachingHitCount.sum()),
        negativeToMaxValue(cachingMissCount.sum()),
        negativeToMaxValue(evictionCount.sum()),
        negativeToMaxValue(evictionCharge.sum()),
        usage.sum());
  }

  /** Returns {@code value}, if non-negative. Otherwise, returns {@link Long#MAX_VALUE}. */
  private static long negativeToMaxValue(long value) {
    return (value >= 0) ? value : Long.MAX_VALUE;
  }

  /**
   * Increments all counters by the values in {@code other}.
   *
   * @param other the metrics to increment from
   */
  public void incrementBy(CacheMetrics other) {
    CacheStats otherStats = other.snapshot();
    insertCount.add(otherStats.insertCount());
    lookupCount.add(otherStats.lookupCount());
    hitCount.add(otherStats.hitCount());
    missCount.add(otherStats.missCount());
    cachingHitCount.add(otherStats.cachingHitCount());
    cachingMissCount.add(otherStats.cachingMissCount());
    evictionCount.add(otherStats.evictionCount());
    evictionCharge.add(otherStats.evictionCharge());
    usage.add(otherStats.usage());
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
