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

import static com.github.colstore.cache.CacheContext.encode;
import static com.google.common.truth.Truth.assertThat;

import java.nio.ByteBuffer;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.github.colstore.cache.memory.ConcurrentMemoryTracker;
import com.github.colstore.cache.memory.DirectBufferAllocator;
import com.github.colstore.cache.stats.CacheStats;
import com.github.colstore.testing.ConcurrentTestHarness;

/**
 * Races inserts, lookups and erases across threads and verifies that every inserted entry is freed
 * exactly once.
 */
public final class CacheConcurrencyTest {
  static final int THREADS = 8;
  static final int OPERATIONS = 10_000;
  static final int KEYS = 64;

  @Test(dataProvider = "policies")
  public void insertLookupErase(EvictionPolicy policy) {
    var allocator = new DirectBufferAllocator();
    var tracker = new ConcurrentMemoryTracker("concurrent");
    var cache = CacheBuilder.newBuilder()
        .capacity(32)
        .shardCount(4)
        .evictionPolicy(policy)
        .allocator(allocator)
        .memoryTracker(tracker)
        .memoryTrackerApproximationRatio(0.0)
        .recordStats()
        .build();

    var inserts = new LongAdder();
    var evictions = new LongAdder();
    EvictionCallback callback = (key, value) -> {
      if (key.getInt(0) != value.getInt(0)) {
        throw new AssertionError("value does not match its key");
      }
      evictions.increment();
    };

    ConcurrentTestHarness.timeTasks(THREADS, () -> {
      var random = ThreadLocalRandom.current();
      for (int i = 0; i < OPERATIONS; i++) {
        int key = random.nextInt(KEYS);
        switch (random.nextInt(3)) {
          case 0:
            PendingHandle pending = cache.allocate(encode(key), Integer.BYTES, 1);
            pending.mutableValue().putInt(key);
            cache.insert(pending, callback).close();
            inserts.increment();
            break;
          case 1:
            try (Handle handle = cache.lookup(encode(key), CacheBehavior.NO_CHECK)) {
              if (handle != null) {
                ByteBuffer value = handle.value();
                assertThat(value.getInt(0)).isEqualTo(key);
              }
            }
            break;
          default:
            cache.erase(encode(key));
        }
      }
    });

    cache.invalidate(InvalidationControl.invalidateAll());

    assertThat(cache.usage()).isEqualTo(0);
    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(evictions.sum()).isEqualTo(inserts.sum());
    assertThat(allocator.allocatedBytes()).isEqualTo(0);
    assertThat(tracker.consumption()).isEqualTo(0);

    CacheStats stats = cache.stats();
    assertThat(stats.insertCount()).isEqualTo(inserts.sum());
    assertThat(stats.evictionCount()).isEqualTo(inserts.sum());
    assertThat(stats.evictionCharge()).isEqualTo(inserts.sum());
    assertThat(stats.usage()).isEqualTo(0);
    assertThat(stats.hitCount() + stats.missCount()).isEqualTo(stats.lookupCount());
  }

  @Test
  public void pinnedWhileRacing() {
    var cache = CacheBuilder.newBuilder().capacity(4).singleShard().build();
    PendingHandle pending = cache.allocate(encode(-1), Integer.BYTES, 1);
    pending.mutableValue().putInt(-1);

    try (Handle pinned = cache.insert(pending, null)) {
      ConcurrentTestHarness.timeTasks(THREADS, () -> {
        for (int i = 0; i < OPERATIONS; i++) {
          PendingHandle other = cache.allocate(encode(i), Integer.BYTES, 1);
          cache.insert(other, null).close();
        }
      });
      assertThat(pinned.value().getInt(0)).isEqualTo(-1);
      assertThat(cache.usage()).isAtMost(4L);
    }
  }

  @DataProvider(name = "policies")
  public Object[][] providesPolicies() {
    return new Object[][] {{ EvictionPolicy.LRU }, { EvictionPolicy.FIFO }};
  }
}
