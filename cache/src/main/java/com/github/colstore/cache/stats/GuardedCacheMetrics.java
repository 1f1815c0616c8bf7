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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import com.github.colstore.cache.CacheBehavior;
import com.github.colstore.cache.RemovalCause;

/**
 * A {@link CacheMetrics} implementation that suppresses and logs any exception thrown by the
 * delegate <tt>metrics</tt>.
 */
@SuppressWarnings("PMD.AvoidDuplicateLiterals")
final class GuardedCacheMetrics implements CacheMetrics {
  static final Logger logger = System.getLogger(GuardedCacheMetrics.class.getName());

  final CacheMetrics delegate;

  GuardedCacheMetrics(CacheMetrics delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public void recordInsert() {
    try {
      delegate.recordInsert();
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public void recordLookup(CacheBehavior behavior) {
    try {
      delegate.recordLookup(behavior);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public void recordHit(CacheBehavior behavior) {
    try {
      delegate.recordHit(behavior);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public void recordMiss(CacheBehavior behavior) {
    try {
      delegate.recordMiss(behavior);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public void recordEviction(long charge, RemovalCause cause) {
    try {
      delegate.recordEviction(charge, cause);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public void recordUsage(long delta) {
    try {
      delegate.recordUsage(delta);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
    }
  }

  @Override
  public CacheStats snapshot() {
    try {
      return delegate.snapshot();
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by cache metrics", t);
      return CacheStats.empty();
    }
  }

  @Override
  public String toString() {
    return delegate.toString();
  }
}
