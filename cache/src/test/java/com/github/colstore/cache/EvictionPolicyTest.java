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

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * The order in which each policy evicts entries.
 */
public final class EvictionPolicyTest {

  @Test
  public void fifo() {
    int cacheSize = 10 * 1024;
    int elements = 20;
    int sizePerElement = cacheSize / elements;
    var context = CacheContext.of(CacheBuilder.newBuilder()
        .capacity(cacheSize)
        .evictionPolicy(EvictionPolicy.FIFO)
        .singleShard());

    // fill the cache while looking up the first entry, which must not protect it
    int index = 0;
    do {
      context.insert(index, index, sizePerElement);
      context.lookup(0);
      index++;
    } while (context.evictedKeys().isEmpty());
    assertThat(index).isGreaterThan(1);
    assertThat(context.lookup(0)).isEqualTo(-1);

    int capacity = index - 1;
    assertThat(capacity).isEqualTo(elements);

    for (int i = 1; i < capacity / 2; i++) {
      assertThat(context.lookup(i)).isEqualTo(i);
      context.insert(capacity + i, capacity + i, sizePerElement);
      assertThat(context.lookup(capacity + i)).isEqualTo(capacity + i);
      assertThat(context.lookup(i)).isEqualTo(-1);
    }
    assertThat(context.evictedKeys()).hasSize(capacity / 2);

    for (int i = 0; i < capacity / 2; i++) {
      assertThat(context.lookup(i)).isEqualTo(-1);
    }
    for (int i = capacity / 2; i < capacity; i++) {
      assertThat(context.lookup(i)).isEqualTo(i);
    }
  }

  @Test(dataProvider = "lruBuilders")
  public void lru(CacheBuilder builder) {
    int elements = 1000;
    int sizePerElement = CacheTest.CACHE_SIZE / elements;
    var context = CacheContext.of(builder);

    context.insert(100, 101);
    context.insert(200, 201);

    // the frequently used entry is never evicted
    for (int i = 0; i < elements + 1000; i++) {
      context.insert(1000 + i, 2000 + i, sizePerElement);
      assertThat(context.lookup(1000 + i)).isEqualTo(2000 + i);
      assertThat(context.lookup(100)).isEqualTo(101);
    }
    assertThat(context.lookup(100)).isEqualTo(101);
    assertThat(context.lookup(200)).isEqualTo(-1);
  }

  @Test
  public void lru_accessReordersEviction() {
    var context = CacheContext.of(CacheBuilder.newBuilder()
        .capacity(3)
        .evictionPolicy(EvictionPolicy.LRU)
        .singleShard());
    context.insert(1, 1);
    context.insert(2, 2);
    context.insert(3, 3);
    assertThat(context.lookup(1)).isEqualTo(1);

    context.insert(4, 4);
    assertThat(context.evictedKeys()).containsExactly(2);
    assertThat(context.lookup(1)).isEqualTo(1);
  }

  @Test
  public void fifo_accessDoesNotReorder() {
    var context = CacheContext.of(CacheBuilder.newBuilder()
        .capacity(3)
        .evictionPolicy(EvictionPolicy.FIFO)
        .singleShard());
    context.insert(1, 1);
    context.insert(2, 2);
    context.insert(3, 3);
    assertThat(context.lookup(1)).isEqualTo(1);

    context.insert(4, 4);
    assertThat(context.evictedKeys()).containsExactly(1);
    assertThat(context.lookup(2)).isEqualTo(2);
  }

  @Test(dataProvider = "policies")
  public void replace_movesToNewest(EvictionPolicy policy) {
    var context = CacheContext.of(CacheBuilder.newBuilder()
        .capacity(3)
        .evictionPolicy(policy)
        .singleShard());
    context.insert(1, 1);
    context.insert(2, 2);
    context.insert(3, 3);
    context.insert(1, 10);
    assertThat(context.evictedKeys()).containsExactly(1);

    context.insert(4, 4);
    assertThat(context.evictedKeys()).containsExactly(1, 2).inOrder();
    assertThat(context.lookup(1)).isEqualTo(10);
  }

  @Test(dataProvider = "policies")
  public void policy(EvictionPolicy policy) {
    var cache = CacheBuilder.newBuilder().capacity(10).evictionPolicy(policy).build();
    assertThat(cache.policy()).isEqualTo(policy);
  }

  @DataProvider(name = "policies")
  public Object[][] providesPolicies() {
    return new Object[][] {
        { EvictionPolicy.FIFO },
        { EvictionPolicy.LRU },
    };
  }

  @DataProvider(name = "lruBuilders")
  public Object[][] providesLruBuilders() {
    return new Object[][] {
        { CacheBuilder.newBuilder().capacity(CacheTest.CACHE_SIZE).shardCount(4) },
        { CacheBuilder.newBuilder().capacity(CacheTest.CACHE_SIZE).singleShard() },
    };
  }
}
