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

import com.github.colstore.cache.CacheBehavior;
import com.github.colstore.cache.RemovalCause;

/** A {@link CacheMetrics} implementation that does not record any cache events. */
enum DisabledCacheMetrics implements CacheMetrics {
  INSTANCE;

  @Override
  public void recordInsert() {}

  @Override
  public void recordLookup(CacheBehavior behavior) {}

  @Override
  public void recordHit(CacheBehavior behavior) {}

  @Override
  public void recordMiss(CacheBehavior behavior) {}

  @Override
  public void recordEviction(long charge, RemovalCause cause) {}

  @Override
  public void recordUsage(long delta) {}

  @Override
  public CacheStats snapshot() {
    return CacheStats.empty();
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
