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

import static com.github.colstore.cache.CacheBuilder.requireArgument;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.memory.BufferAllocator;
import com.github.colstore.cache.stats.CacheMetrics;
import com.github.colstore.cache.stats.CacheStats;
import com.google.errorprone.annotations.Var;

/**
 * A {@link Cache} that routes each key to one of a power-of-two number of {@link CacheShard}s by
 * the spread hash of its bytes. Each shard receives an equal share of the capacity, rounded up.
 * <p>
 * This class owns the free path of an entry: when the last reference to an inserted entry is
 * dropped, the charge is released from the memory tracker, the eviction is recorded, the entry's
 * {@link EvictionCallback} is notified and the value's memory is returned to the allocator.
 */
final class ShardedCache implements Cache {
  static final Logger logger = System.getLogger(ShardedCache.class.getName());

  final long capacity;
  final EvictionPolicy policy;
  final BufferAllocator allocator;
  final CacheMetrics metrics;
  final CacheShard[] shards;
  final int mask;

  ShardedCache(CacheBuilder builder) {
    this.capacity = builder.getCapacity();
    this.policy = builder.getEvictionPolicy();
    this.allocator = builder.getAllocator();
    this.metrics = builder.getMetrics();

    int shardCount = builder.getShardCount();
    long shardCapacity = -Math.floorDiv(-capacity, shardCount);
    this.shards = new CacheShard[shardCount];
    for (int i = 0; i < shards.length; i++) {
      shards[i] = new CacheShard(shardCapacity, policy,
          builder.getMemoryTracker(), builder.getMemoryTrackerApproximationRatio());
    }
    this.mask = shardCount - 1;

    logger.log(Level.DEBUG, "Created {0} cache of {1} bytes in {2} shards of {3} bytes",
        policy, capacity, shardCount, shardCapacity);
  }

  /** Applies a supplemental hash function to defend against poor quality hash. */
  static int spread(@Var int x) {
    x ^= x >>> 17;
    x *= 0xed5ad4bb;
    x ^= x >>> 11;
    x *= 0xac4c1b51;
    x ^= x >>> 15;
    return x;
  }

  static int hash(byte[] key) {
    return spread(Arrays.hashCode(key));
  }

  CacheShard shardFor(int hash) {
    return shards[hash & mask];
  }

  @Override
  public PendingHandle allocate(byte[] key, int valueLength) {
    return allocate(key, valueLength, AUTOMATIC_CHARGE);
  }

  @Override
  public PendingHandle allocate(byte[] key, int valueLength, long charge) {
    requireNonNull(key);
    requireArgument(valueLength >= 0, "value length must not be negative: %s", valueLength);
    requireArgument((charge >= 0) || (charge == AUTOMATIC_CHARGE),
        "charge must not be negative: %s", charge);

    byte[] copy = key.clone();
    long actualCharge = (charge == AUTOMATIC_CHARGE)
        ? ((long) copy.length + valueLength)
        : charge;
    ByteBuffer value = allocator.allocate(valueLength);
    return new PendingHandle(this, new CacheEntry(copy, value, actualCharge, hash(copy)));
  }

  @Override
  public Handle insert(PendingHandle pending, @Nullable EvictionCallback callback) {
    requireNonNull(pending);
    requireArgument(pending.isOwnedBy(this), "pending handle was allocated by another cache");
    CacheEntry entry = pending.consume();
    entry.callback = callback;

    // the caller's reference moves to the returned handle and the index takes its own
    entry.retain();

    CacheShard shard = shardFor(entry.hash);
    shard.trackMemory(entry.charge);
    metrics.recordInsert();
    metrics.recordUsage(entry.charge);

    List<CacheEntry> toFree = new ArrayList<>();
    try {
      shard.insert(entry, toFree);
    } finally {
      freeAll(toFree);
    }
    return new Handle(this, entry);
  }

  @Override
  public @Nullable Handle lookup(byte[] key, CacheBehavior behavior) {
    requireNonNull(key);
    requireNonNull(behavior);
    CacheEntry entry = shardFor(hash(key)).lookup(ByteBuffer.wrap(key));

    metrics.recordLookup(behavior);
    if (entry == null) {
      metrics.recordMiss(behavior);
      if (behavior == CacheBehavior.EXPECT_IN_CACHE) {
        logger.log(Level.TRACE, () -> "Cache miss for an expected key of "
            + key.length + " bytes");
      }
      return null;
    }
    metrics.recordHit(behavior);
    return new Handle(this, entry);
  }

  @Override
  public void erase(byte[] key) {
    requireNonNull(key);
    List<CacheEntry> toFree = new ArrayList<>(1);
    try {
      shardFor(hash(key)).erase(ByteBuffer.wrap(key), toFree);
    } finally {
      freeAll(toFree);
    }
  }

  @Override
  public long invalidate(InvalidationControl control) {
    requireNonNull(control);
    @Var long invalidated = 0;
    for (CacheShard shard : shards) {
      // entries unindexed before a user function throws are still freed
      List<CacheEntry> toFree = new ArrayList<>();
      try {
        invalidated += shard.invalidate(control, toFree);
      } finally {
        freeAll(toFree);
      }
    }
    return invalidated;
  }

  /** Drops a handle's reference, freeing the entry if it was the last one. */
  void release(CacheEntry entry) {
    if (entry.release()) {
      free(entry);
    }
  }

  /** Drops the reference of a pending handle that was never inserted. */
  void discard(CacheEntry entry) {
    if (entry.release()) {
      allocator.free(entry.value);
    }
  }

  void freeAll(List<CacheEntry> entries) {
    for (CacheEntry entry : entries) {
      free(entry);
    }
  }

  /** Frees an inserted entry whose last reference was dropped. */
  void free(CacheEntry entry) {
    shardFor(entry.hash).trackMemory(-entry.charge);
    metrics.recordUsage(-entry.charge);
    metrics.recordEviction(entry.charge, requireNonNull(entry.removalCause));
    try {
      notifyEviction(entry);
    } finally {
      allocator.free(entry.value);
    }
  }

  void notifyEviction(CacheEntry entry) {
    EvictionCallback callback = entry.callback;
    if (callback == null) {
      return;
    }
    try {
      callback.onEviction(entry.keyView(), entry.valueView());
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by eviction callback", t);
    }
  }

  @Override
  public long capacity() {
    return capacity;
  }

  @Override
  public long usage() {
    @Var long usage = 0;
    for (CacheShard shard : shards) {
      usage += shard.usage();
    }
    return usage;
  }

  @Override
  public long estimatedSize() {
    @Var long size = 0;
    for (CacheShard shard : shards) {
      size += shard.size();
    }
    return size;
  }

  @Override
  public EvictionPolicy policy() {
    return policy;
  }

  @Override
  public CacheStats stats() {
    return metrics.snapshot();
  }

  int shardCount() {
    return shards.length;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "policy=" + policy + ", "
        + "capacity=" + capacity + ", "
        + "shards=" + shards.length + ", "
        + "usage=" + usage() + ", "
        + "estimatedSize=" + estimatedSize()
        + '}';
  }
}
