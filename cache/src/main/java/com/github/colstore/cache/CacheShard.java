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

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.memory.MemoryTracker;
import com.google.errorprone.annotations.Var;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * A capacity-bounded partition of a {@link ShardedCache}. A shard indexes its entries by key and
 * keeps them in an {@link EvictionOrder}; all of its state is guarded by a single lock.
 * <p>
 * An indexed entry holds one reference of its own. When an entry leaves the index that reference is
 * dropped under the lock, and if it was the last one the entry is added to a caller supplied list
 * so that it can be freed after the lock is released.
 */
final class CacheShard {
  final ReentrantLock lock;
  final long capacity;

  @GuardedBy("lock")
  final HashMap<ByteBuffer, CacheEntry> table;
  @GuardedBy("lock")
  final EvictionOrder order;
  @GuardedBy("lock")
  long usage;

  final MemoryTracker memoryTracker;
  final long maxDeferredConsumption;
  final AtomicLong deferredConsumption;

  /**
   * Creates an empty shard.
   *
   * @param capacity the maximum sum of the charges of the indexed entries
   * @param policy the eviction policy
   * @param memoryTracker the tracker that is told of the charges of live entries
   * @param approximationRatio the fraction of the capacity that may be withheld from the tracker
   */
  CacheShard(@NonNegative long capacity, EvictionPolicy policy,
      MemoryTracker memoryTracker, double approximationRatio) {
    this.capacity = capacity;
    this.lock = new ReentrantLock();
    this.table = new HashMap<>();
    this.order = EvictionOrder.forPolicy(policy);
    this.memoryTracker = memoryTracker;
    this.maxDeferredConsumption = (long) (capacity * approximationRatio);
    this.deferredConsumption = new AtomicLong();
  }

  /**
   * Returns the entry indexed under the key with an additional reference taken, or {@code null}.
   */
  @Nullable CacheEntry lookup(ByteBuffer key) {
    lock.lock();
    try {
      CacheEntry entry = table.get(key);
      if (entry != null) {
        entry.retain();
        order.onAccess(entry);
      }
      return entry;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indexes the entry, replacing any entry under the same key, and then evicts the least valuable
   * entries until the shard is within its capacity. The inserted entry may be evicted itself if its
   * charge alone exceeds the capacity.
   *
   * @param entry an unindexed entry that holds a reference for the index and one for the caller
   * @param toFree receives the entries whose last reference was dropped
   */
  void insert(CacheEntry entry, List<CacheEntry> toFree) {
    lock.lock();
    try {
      entry.inCache = true;
      order.onInsert(entry);
      usage += entry.charge;

      CacheEntry old = table.put(entry.keyView, entry);
      if (old != null) {
        order.onRemove(old);
        unindex(old, RemovalCause.REPLACED, toFree);
      }
      evict(toFree);
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void evict(List<CacheEntry> toFree) {
    while (usage > capacity) {
      CacheEntry victim = order.evictOne();
      if (victim == null) {
        return;
      }
      table.remove(victim.keyView, victim);
      unindex(victim, RemovalCause.SIZE, toFree);
    }
  }

  /**
   * Removes the entry indexed under the key, if present.
   *
   * @param key the key to remove
   * @param toFree receives the entry if its last reference was dropped
   */
  void erase(ByteBuffer key, List<CacheEntry> toFree) {
    lock.lock();
    try {
      CacheEntry entry = table.remove(key);
      if (entry != null) {
        order.onRemove(entry);
        unindex(entry, RemovalCause.EXPLICIT, toFree);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Walks the entries from the least valuable end and removes those that the control's validity
   * function rejects, for as long as its iteration function allows.
   *
   * @param control the validity and iteration functions
   * @param toFree receives the entries whose last reference was dropped
   * @return the number of entries removed
   */
  long invalidate(InvalidationControl control, List<CacheEntry> toFree) {
    var validity = control.validityFunction();
    var iteration = control.iterationFunction();
    @Var long validCount = 0;
    @Var long invalidCount = 0;

    lock.lock();
    try {
      @Var CacheEntry entry = order.oldest();
      while ((entry != null) && iteration.shouldContinue(validCount, invalidCount)) {
        CacheEntry next = order.next(entry);
        if (validity.isValid(entry.keyView(), entry.valueView())) {
          validCount++;
        } else {
          table.remove(entry.keyView, entry);
          order.onRemove(entry);
          unindex(entry, RemovalCause.INVALIDATED, toFree);
          invalidCount++;
        }
        entry = next;
      }
    } finally {
      lock.unlock();
    }
    return invalidCount;
  }

  /** Drops the index's reference to an entry that was unlinked from the table and the order. */
  @GuardedBy("lock")
  private void unindex(CacheEntry entry, RemovalCause cause, List<CacheEntry> toFree) {
    entry.inCache = false;
    entry.removalCause = cause;
    usage -= entry.charge;
    if (entry.release()) {
      toFree.add(entry);
    }
  }

  /**
   * Reports a change of the live charge to the memory tracker. Changes are accumulated until their
   * absolute sum exceeds the shard's allowance and are then propagated at once.
   */
  void trackMemory(long delta) {
    long deferred = deferredConsumption.addAndGet(delta);
    if ((deferred > maxDeferredConsumption) || (deferred < -maxDeferredConsumption)) {
      long toPropagate = deferredConsumption.getAndSet(0);
      if (toPropagate > 0) {
        memoryTracker.consume(toPropagate);
      } else if (toPropagate < 0) {
        memoryTracker.release(-toPropagate);
      }
    }
  }

  /** Returns the sum of the charges of the indexed entries. */
  long usage() {
    lock.lock();
    try {
      return usage;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of indexed entries. */
  int size() {
    lock.lock();
    try {
      return table.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "capacity=" + capacity + ", "
        + "usage=" + usage() + ", "
        + "size=" + size()
        + '}';
  }
}
