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

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.stats.CacheStats;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A sharded, capacity-bounded cache of byte-blob keys and values. Entries are created in two
 * steps: {@link #allocate} reserves the value's memory and returns a {@link PendingHandle} whose
 * value the caller fills in, and {@link #insert} publishes it. Entries are pinned by
 * {@link Handle}s; an entry that leaves the cache stays readable until its last handle is closed,
 * at which point it is freed and its {@link EvictionCallback} is notified.
 * <p>
 * Implementations of this interface are expected to be thread-safe, and can be safely accessed by
 * multiple concurrent threads.
 */
public interface Cache {

  /** Requests that an entry's charge be the sum of its key and value lengths. */
  long AUTOMATIC_CHARGE = -1L;

  /**
   * Allocates an entry whose charge is the sum of its key and value lengths. The entry is not
   * visible to lookups until it is inserted.
   *
   * @param key the key of the entry, which is copied
   * @param valueLength the length of the value, in bytes
   * @return a handle to fill in the entry's value
   * @throws com.github.colstore.cache.memory.AllocationException if the memory could not be
   *         allocated
   */
  PendingHandle allocate(byte[] key, @NonNegative int valueLength);

  /**
   * Allocates an entry that is not visible to lookups until it is inserted.
   *
   * @param key the key of the entry, which is copied
   * @param valueLength the length of the value, in bytes
   * @param charge the amount of the capacity that the entry occupies, or {@link #AUTOMATIC_CHARGE}
   * @return a handle to fill in the entry's value
   * @throws IllegalArgumentException if the charge is negative and not {@link #AUTOMATIC_CHARGE}
   * @throws com.github.colstore.cache.memory.AllocationException if the memory could not be
   *         allocated
   */
  PendingHandle allocate(byte[] key, @NonNegative int valueLength, long charge);

  /**
   * Publishes an allocated entry, replacing any entry under the same key, and evicts entries as
   * needed to bring the shard back within its capacity. The pending handle is consumed and the
   * returned handle pins the entry, even if it was evicted straight away because its charge alone
   * exceeds the shard's capacity.
   *
   * @param pending the handle returned by {@link #allocate}
   * @param callback notified when the entry is freed, or {@code null}
   * @return a handle pinning the inserted entry
   * @throws IllegalStateException if the pending handle was already inserted or closed
   * @throws IllegalArgumentException if the pending handle was allocated by another cache
   */
  Handle insert(PendingHandle pending, @Nullable EvictionCallback callback);

  /**
   * Returns a handle pinning the entry under the key, or {@code null} if there is none.
   *
   * @param key the key to look up
   * @param behavior how a miss should be accounted for
   * @return a handle pinning the entry, or {@code null} if the key is absent
   */
  @Nullable Handle lookup(byte[] key, CacheBehavior behavior);

  /**
   * Removes the entry under the key, if present. The entry is freed once no handle pins it.
   *
   * @param key the key to remove
   */
  void erase(byte[] key);

  /**
   * Removes the entries rejected by the control's validity function, shard by shard, for as long
   * as its iteration function allows. An exception thrown by either function stops the sweep and
   * is propagated; the entries removed before it are freed as usual.
   *
   * @param control the validity and iteration functions
   * @return the number of entries removed across all shards
   */
  @CanIgnoreReturnValue
  long invalidate(InvalidationControl control);

  /**
   * Returns the capacity that the cache was built with. Each shard holds an equal share of it,
   * rounded up.
   */
  @NonNegative
  long capacity();

  /** Returns the sum of the charges of the entries currently indexed. */
  @NonNegative
  long usage();

  /**
   * Returns the approximate number of entries currently indexed. The value is not an exact count
   * when the cache is modified concurrently.
   */
  @NonNegative
  long estimatedSize();

  /** Returns the eviction policy of the cache. */
  EvictionPolicy policy();

  /**
   * Returns a current snapshot of this cache's cumulative statistics. All statistics are
   * initialized to zero and are monotonically increasing over the lifetime of the cache, except
   * for the usage.
   * <p>
   * Due to the performance penalty of maintaining statistics, some implementations may not record
   * the usage history immediately or at all.
   *
   * @return the current snapshot of the statistics of this cache
   */
  CacheStats stats();
}
