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

import org.jspecify.annotations.Nullable;

/**
 * The eviction order of a shard's indexed entries. Entries are linked at the most valuable end when
 * inserted and evicted from the least valuable end; the policies differ in how an access is
 * treated. Instances are guarded by the shard's lock.
 */
abstract class EvictionOrder {
  final AccessOrderDeque<CacheEntry> deque;

  EvictionOrder() {
    this.deque = new AccessOrderDeque<>();
  }

  /** Returns the order implementing the given policy. */
  static EvictionOrder forPolicy(EvictionPolicy policy) {
    switch (policy) {
      case LRU:
        return new Lru();
      case FIFO:
        return new Fifo();
      default:
        throw new IllegalArgumentException("Unknown eviction policy: " + policy);
    }
  }

  /** Returns the policy that this order implements. */
  abstract EvictionPolicy policy();

  /** Links a newly indexed entry as the most valuable one. */
  void onInsert(CacheEntry entry) {
    deque.linkLast(entry);
  }

  /** Records that the indexed entry was returned by a lookup. */
  abstract void onAccess(CacheEntry entry);

  /** Unlinks an entry that left the index. */
  void onRemove(CacheEntry entry) {
    deque.remove(entry);
  }

  /** Unlinks and returns the least valuable entry, or {@code null} if there are none. */
  @Nullable CacheEntry evictOne() {
    return deque.pollFirst();
  }

  /** Returns the least valuable entry, where an oldest-first traversal starts. */
  @Nullable CacheEntry oldest() {
    return deque.peekFirst();
  }

  /** Returns the entry that follows {@code entry} in an oldest-first traversal. */
  @Nullable CacheEntry next(CacheEntry entry) {
    return deque.successor(entry);
  }

  boolean isEmpty() {
    return deque.isEmpty();
  }

  int size() {
    return deque.size();
  }

  /** Each lookup moves the entry to the most recently used end. */
  static final class Lru extends EvictionOrder {
    @Override EvictionPolicy policy() {
      return EvictionPolicy.LRU;
    }

    @Override void onAccess(CacheEntry entry) {
      if (deque.contains(entry)) {
        deque.moveToBack(entry);
      }
    }
  }

  /** Lookups leave the insertion order untouched. */
  static final class Fifo extends EvictionOrder {
    @Override EvictionPolicy policy() {
      return EvictionPolicy.FIFO;
    }

    @Override void onAccess(CacheEntry entry) {}
  }
}
