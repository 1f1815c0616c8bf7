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

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import org.testng.annotations.Test;

import com.github.colstore.cache.memory.BufferAllocator;
import com.github.colstore.cache.memory.ConcurrentMemoryTracker;
import com.github.colstore.cache.memory.DirectBufferAllocator;
import com.github.colstore.cache.memory.MemoryTracker;
import com.github.colstore.cache.stats.CacheMetrics;
import com.github.colstore.cache.stats.CacheStats;
import com.github.colstore.cache.stats.ConcurrentCacheMetrics;
import com.google.common.testing.NullPointerTester;

/**
 * A test for the builder methods.
 */
public final class CacheBuilderTest {

  @Test
  public void nullParameters() {
    var npeTester = new NullPointerTester();
    npeTester.testAllPublicInstanceMethods(CacheBuilder.newBuilder());
    npeTester.testAllPublicStaticMethods(CacheBuilder.class);
  }

  @Test
  public void unconfigured() {
    var builder = CacheBuilder.newBuilder();
    assertThrows(IllegalStateException.class, builder::build);
    assertThat(builder.toString()).isEqualTo("CacheBuilder{}");
    assertThat(builder.toString()).isEqualTo(CacheBuilder.newBuilder().toString());
  }

  @Test
  public void defaults() {
    var builder = CacheBuilder.newBuilder().capacity(100);
    assertThat(builder.getEvictionPolicy()).isEqualTo(EvictionPolicy.LRU);
    assertThat(builder.getMemoryTrackerApproximationRatio()).isEqualTo(0.01);
    assertThat(builder.getAllocator()).isSameInstanceAs(BufferAllocator.heap());
    assertThat(builder.getMemoryTracker()).isSameInstanceAs(MemoryTracker.disabled());
    assertThat(builder.getMetrics()).isSameInstanceAs(CacheMetrics.disabledMetrics());
    assertThat(builder.isRecordingStats()).isFalse();

    int shards = builder.getShardCount();
    assertThat(Integer.bitCount(shards)).isEqualTo(1);
    assertThat(shards).isAtLeast(Runtime.getRuntime().availableProcessors());

    Cache cache = builder.build();
    assertThat(cache.capacity()).isEqualTo(100);
    assertThat(cache.policy()).isEqualTo(EvictionPolicy.LRU);
    assertThat(cache.stats()).isEqualTo(CacheStats.empty());
  }

  @Test
  public void configured() {
    var tracker = new ConcurrentMemoryTracker("configured");
    var allocator = new DirectBufferAllocator();
    var builder = CacheBuilder.newBuilder()
        .capacity(1024)
        .evictionPolicy(EvictionPolicy.FIFO)
        .shardCount(4)
        .memoryTrackerApproximationRatio(0.5)
        .allocator(allocator)
        .memoryTracker(tracker)
        .recordStats();

    assertThat(builder.getCapacity()).isEqualTo(1024);
    assertThat(builder.getEvictionPolicy()).isEqualTo(EvictionPolicy.FIFO);
    assertThat(builder.getShardCount()).isEqualTo(4);
    assertThat(builder.getMemoryTrackerApproximationRatio()).isEqualTo(0.5);
    assertThat(builder.getAllocator()).isSameInstanceAs(allocator);
    assertThat(builder.getMemoryTracker()).isSameInstanceAs(tracker);
    assertThat(builder.isRecordingStats()).isTrue();

    var cache = (ShardedCache) builder.build();
    assertThat(cache.shardCount()).isEqualTo(4);
    assertThat(cache.policy()).isEqualTo(EvictionPolicy.FIFO);

    assertThat(builder.toString()).isEqualTo("CacheBuilder{capacity=1024, evictionPolicy=FIFO, "
        + "shardCount=4, memoryTrackerApproximationRatio=0.5, allocator, memoryTracker, "
        + "recordStats }");
  }

  @Test
  public void ceilingPowerOfTwo() {
    assertThat(CacheBuilder.ceilingPowerOfTwo(1)).isEqualTo(1);
    assertThat(CacheBuilder.ceilingPowerOfTwo(2)).isEqualTo(2);
    assertThat(CacheBuilder.ceilingPowerOfTwo(3)).isEqualTo(4);
    assertThat(CacheBuilder.ceilingPowerOfTwo(12)).isEqualTo(16);
    assertThat(CacheBuilder.ceilingPowerOfTwo(64)).isEqualTo(64);
  }

  /* --------------- capacity --------------- */

  @Test
  public void capacity_negative() {
    assertThrows(IllegalArgumentException.class, () -> CacheBuilder.newBuilder().capacity(-1));
  }

  @Test
  public void capacity_twice() {
    var builder = CacheBuilder.newBuilder().capacity(1);
    assertThrows(IllegalStateException.class, () -> builder.capacity(1));
  }

  @Test
  public void capacity_zero() {
    var context = CacheContext.of(CacheBuilder.newBuilder().capacity(0).singleShard());
    context.insert(1, 1);
    assertThat(context.lookup(1)).isEqualTo(-1);
    assertThat(context.evictedKeys()).containsExactly(1);
  }

  /* --------------- evictionPolicy --------------- */

  @Test
  public void evictionPolicy_twice() {
    var builder = CacheBuilder.newBuilder().evictionPolicy(EvictionPolicy.LRU);
    assertThrows(IllegalStateException.class, () -> builder.evictionPolicy(EvictionPolicy.FIFO));
  }

  /* --------------- shards --------------- */

  @Test
  public void shardCount_invalid() {
    for (int shardCount : new int[] {-1, 0, 3, 12, (1 << 17)}) {
      assertThrows(IllegalArgumentException.class,
          () -> CacheBuilder.newBuilder().shardCount(shardCount));
    }
  }

  @Test
  public void shardCount_maximum() {
    var builder = CacheBuilder.newBuilder().shardCount(1 << 16);
    assertThat(builder.getShardCount()).isEqualTo(1 << 16);
  }

  @Test
  public void shardCount_twice() {
    var builder = CacheBuilder.newBuilder().shardCount(2);
    assertThrows(IllegalStateException.class, () -> builder.shardCount(2));
  }

  @Test
  public void shardCount_afterSingleShard() {
    var builder = CacheBuilder.newBuilder().singleShard();
    assertThrows(IllegalStateException.class, () -> builder.shardCount(2));
  }

  @Test
  public void singleShard() {
    var builder = CacheBuilder.newBuilder().capacity(10).singleShard();
    assertThat(builder.getShardCount()).isEqualTo(1);
    assertThat(((ShardedCache) builder.build()).shardCount()).isEqualTo(1);
    assertThat(builder.toString()).isEqualTo("CacheBuilder{capacity=10, singleShard }");
  }

  @Test
  public void singleShard_twice() {
    var builder = CacheBuilder.newBuilder().singleShard();
    assertThrows(IllegalStateException.class, builder::singleShard);
  }

  @Test
  public void singleShard_afterShardCount() {
    var builder = CacheBuilder.newBuilder().shardCount(2);
    assertThrows(IllegalStateException.class, builder::singleShard);
  }

  /* --------------- memoryTrackerApproximationRatio --------------- */

  @Test
  public void approximationRatio_invalid() {
    for (double ratio : new double[] {-0.1, 1.1, Double.NaN}) {
      assertThrows(IllegalArgumentException.class,
          () -> CacheBuilder.newBuilder().memoryTrackerApproximationRatio(ratio));
    }
  }

  @Test
  public void approximationRatio_bounds() {
    assertThat(CacheBuilder.newBuilder().memoryTrackerApproximationRatio(0.0)
        .getMemoryTrackerApproximationRatio()).isEqualTo(0.0);
    assertThat(CacheBuilder.newBuilder().memoryTrackerApproximationRatio(1.0)
        .getMemoryTrackerApproximationRatio()).isEqualTo(1.0);
  }

  @Test
  public void approximationRatio_twice() {
    var builder = CacheBuilder.newBuilder().memoryTrackerApproximationRatio(0.1);
    assertThrows(IllegalStateException.class,
        () -> builder.memoryTrackerApproximationRatio(0.1));
  }

  /* --------------- collaborators --------------- */

  @Test
  public void allocator_twice() {
    var builder = CacheBuilder.newBuilder().allocator(BufferAllocator.heap());
    assertThrows(IllegalStateException.class, () -> builder.allocator(BufferAllocator.heap()));
  }

  @Test
  public void memoryTracker_twice() {
    var builder = CacheBuilder.newBuilder().memoryTracker(MemoryTracker.disabled());
    assertThrows(IllegalStateException.class,
        () -> builder.memoryTracker(MemoryTracker.disabled()));
  }

  @Test
  public void recordStats_twice() {
    var builder = CacheBuilder.newBuilder().recordStats();
    assertThrows(IllegalStateException.class, builder::recordStats);
  }

  @Test
  public void metrics_afterRecordStats() {
    var builder = CacheBuilder.newBuilder().recordStats();
    assertThrows(IllegalStateException.class, () -> builder.metrics(new ConcurrentCacheMetrics()));
  }

  @Test
  public void metrics_guarded() {
    var metrics = new ConcurrentCacheMetrics();
    var builder = CacheBuilder.newBuilder().metrics(metrics);
    assertThat(builder.getMetrics()).isNotSameInstanceAs(metrics);
    assertThat(builder.getMetrics())
        .isSameInstanceAs(CacheMetrics.guardedMetrics(builder.getMetrics()));
  }

  /* --------------- from --------------- */

  @Test
  public void fromString() {
    var cache = (ShardedCache) CacheBuilder.from("capacity=1k, policy=fifo, shards=2").build();
    assertThat(cache.capacity()).isEqualTo(1024);
    assertThat(cache.policy()).isEqualTo(EvictionPolicy.FIFO);
    assertThat(cache.shardCount()).isEqualTo(2);
  }

  @Test
  public void fromSpec() {
    var builder = CacheBuilder.from(CacheSpec.parse(""));
    assertThrows(IllegalStateException.class, builder::build);
    assertThat(builder.capacity(1).build()).isNotNull();
  }

  @Test
  public void fromString_invalid() {
    assertThrows(IllegalArgumentException.class, () -> CacheBuilder.from("shards=3"));
  }
}
