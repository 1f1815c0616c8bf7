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

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.github.colstore.cache.memory.BufferAllocator;
import com.github.colstore.cache.memory.DirectBufferAllocator;
import com.google.common.testing.EqualsTester;
import com.google.common.testing.NullPointerTester;

/**
 * A test for the specification parser.
 */
public final class CacheSpecTest {

  @Test
  public void nullParameters() {
    var npeTester = new NullPointerTester();
    npeTester.testAllPublicStaticMethods(CacheSpec.class);
  }

  @Test
  public void parse_empty() {
    var spec = CacheSpec.parse("");
    assertThat(spec.capacity).isEqualTo(CacheBuilder.UNSET_INT);
    assertThat(spec.shardCount).isEqualTo(CacheBuilder.UNSET_INT);
    assertThat(spec.evictionPolicy).isNull();
    assertThat(spec.allocator).isNull();
    assertThat(spec.singleShard).isFalse();
    assertThat(spec.recordStats).isFalse();
    assertThat(spec.toBuilder().toString()).isEqualTo(CacheBuilder.newBuilder().toString());
  }

  @Test
  public void parse_allSettings() {
    var spec = CacheSpec.parse("capacity=16m, policy=FIFO, shards=8, "
        + "memoryTrackerApproximationRatio=0.25, allocator=direct, recordStats");
    assertThat(spec.capacity).isEqualTo(16L << 20);
    assertThat(spec.evictionPolicy).isEqualTo(EvictionPolicy.FIFO);
    assertThat(spec.shardCount).isEqualTo(8);
    assertThat(spec.memoryTrackerApproximationRatio).isEqualTo(0.25);
    assertThat(spec.allocator).isEqualTo("direct");
    assertThat(spec.recordStats).isTrue();

    CacheBuilder builder = spec.toBuilder();
    assertThat(builder.getCapacity()).isEqualTo(16L << 20);
    assertThat(builder.getEvictionPolicy()).isEqualTo(EvictionPolicy.FIFO);
    assertThat(builder.getShardCount()).isEqualTo(8);
    assertThat(builder.getMemoryTrackerApproximationRatio()).isEqualTo(0.25);
    assertThat(builder.getAllocator()).isInstanceOf(DirectBufferAllocator.class);
    assertThat(builder.isRecordingStats()).isTrue();
  }

  @Test
  public void parse_singleShard() {
    var builder = CacheSpec.parse("capacity=100,singleShard,allocator=HEAP").toBuilder();
    assertThat(builder.getShardCount()).isEqualTo(1);
    assertThat(builder.getAllocator()).isSameInstanceAs(BufferAllocator.heap());
  }

  @Test
  public void parse_whitespace() {
    var spec = CacheSpec.parse("  capacity = 10 ,  policy =  lru  ");
    assertThat(spec.capacity).isEqualTo(10);
    assertThat(spec.evictionPolicy).isEqualTo(EvictionPolicy.LRU);
  }

  @Test
  public void parseSize() {
    assertThat(CacheSpec.parseSize("capacity", "100")).isEqualTo(100);
    assertThat(CacheSpec.parseSize("capacity", "1k")).isEqualTo(1024);
    assertThat(CacheSpec.parseSize("capacity", "2M")).isEqualTo(2L << 20);
    assertThat(CacheSpec.parseSize("capacity", "3g")).isEqualTo(3L << 30);
  }

  @Test(dataProvider = "invalidSpecs")
  public void parse_invalid(String specification) {
    assertThrows(IllegalArgumentException.class, () -> CacheSpec.parse(specification));
  }

  @DataProvider(name = "invalidSpecs")
  public Object[][] providesInvalidSpecs() {
    return new Object[][] {
        { "unknown=1" },
        { "capacity" },
        { "capacity=" },
        { "capacity=abc" },
        { "capacity=-1" },
        { "capacity=1x" },
        { "capacity=9223372036854775807k" },
        { "capacity=1,capacity=2" },
        { "capacity=1=2" },
        { "policy=mru" },
        { "policy" },
        { "policy=lru,policy=fifo" },
        { "shards=0" },
        { "shards=-1" },
        { "shards=two" },
        { "shards=2,singleShard" },
        { "singleShard,shards=2" },
        { "singleShard=true" },
        { "singleShard,singleShard" },
        { "memoryTrackerApproximationRatio=-0.5" },
        { "memoryTrackerApproximationRatio=high" },
        { "memoryTrackerApproximationRatio=0.1,memoryTrackerApproximationRatio=0.2" },
        { "allocator=slab" },
        { "allocator" },
        { "allocator=heap,allocator=direct" },
        { "recordStats=true" },
        { "recordStats,recordStats" },
    };
  }

  @Test
  public void toBuilder_invalidValue() {
    var spec = CacheSpec.parse("shards=3");
    assertThrows(IllegalArgumentException.class, spec::toBuilder);
  }

  @Test
  public void equalsAndHashCode() {
    new EqualsTester()
        .addEqualityGroup(CacheSpec.parse(""), CacheSpec.parse(""), CacheSpec.parse(" , "))
        .addEqualityGroup(CacheSpec.parse("capacity=1k"), CacheSpec.parse("capacity=1024"))
        .addEqualityGroup(CacheSpec.parse("policy=lru"), CacheSpec.parse("policy=LRU"))
        .addEqualityGroup(CacheSpec.parse("shards=2"), CacheSpec.parse(" shards = 2 "))
        .addEqualityGroup(CacheSpec.parse("singleShard"))
        .addEqualityGroup(CacheSpec.parse("memoryTrackerApproximationRatio=0.5"))
        .addEqualityGroup(CacheSpec.parse("allocator=direct"), CacheSpec.parse("allocator=DIRECT"))
        .addEqualityGroup(CacheSpec.parse("recordStats"))
        .addEqualityGroup(CacheSpec.parse("capacity=1k,recordStats"),
            CacheSpec.parse("recordStats,capacity=1024"))
        .testEquals();
  }

  @Test
  public void toParsableString() {
    String specification = "capacity=64k, policy=fifo, singleShard, recordStats";
    var spec = CacheSpec.parse(specification);
    assertThat(spec.toParsableString()).isEqualTo(specification);
    assertThat(CacheSpec.parse(spec.toParsableString())).isEqualTo(spec);
    assertThat(spec.toString()).isEqualTo("CacheSpec{" + specification + "}");
  }
}
