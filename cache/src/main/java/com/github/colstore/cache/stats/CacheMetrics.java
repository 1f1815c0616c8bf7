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

import org.checkerframework.checker.index.qual.NonNegative;

import com.github.colstore.cache.Cache;
import com.github.colstore.cache.CacheBehavior;
import com.github.colstore.cache.RemovalCause;

/**
 * Accumulates metrics during the operation of a {@link Cache} for presentation by
 * {@link Cache#stats}. The cache only ever writes to the metrics; updates arrive from many threads
 * and are treated as best-effort counters.
 */
public interface CacheMetrics {

  /** Records that an entry was inserted. */
  void recordInsert();

  /**
   * Records that a lookup was made.
   *
   * @param behavior whether the caller expected the key to be present
   */
  void recordLookup(CacheBehavior behavior);

  /**
   * Records that a lookup found an entry.
   *
   * @param behavior whether the caller expected the key to be present
   */
  void recordHit(CacheBehavior behavior);

  /**
   * Records that a lookup did not find an entry.
   *
   * @param behavior whether the caller expected the key to be present
   */
  void recordMiss(CacheBehavior behavior);

  /**
   * Records that an entry was freed. This is called once per inserted entry, after it has left
   * the cache and its last handle was released.
   *
   * @param charge the charge of the freed entry
   * @param cause the reason the entry left the cache
   */
  void recordEviction(@NonNegative long charge, RemovalCause cause);

  /**
   * Records a change to the charge held by the cache.
   *
   * @param delta the change, positive when an entry is inserted and negative when one is freed
   */
  void recordUsage(long delta);

  /**
   * Returns a snapshot of the metrics. Note that this may be an inconsistent view, as it may be
   * interleaved with update operations.
   *
   * @return a snapshot of the metrics
   */
  CacheStats snapshot();

  /**
   * Returns metrics that do not record any cache events.
   *
   * @return metrics that do not record anything
   */
  static CacheMetrics disabledMetrics() {
    return DisabledCacheMetrics.INSTANCE;
  }

  /**
   * Returns metrics that suppress and log any exception thrown by the delegate {@code metrics}.
   *
   * @param metrics the metrics to delegate to
   * @return metrics that suppress and log any exception thrown by the delegate
   */
  static CacheMetrics guardedMetrics(CacheMetrics metrics) {
    return (metrics instanceof GuardedCacheMetrics)
        ? metrics
        : new GuardedCacheMetrics(metrics);
  }
}
