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
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.AccessOrderDeque.AccessOrder;

/**
 * A key/value pair owned by a {@link ShardedCache}. The reference count is the number of open
 * handles plus one while the entry is indexed by its shard; the entry is freed by whichever thread
 * drops the count to zero.
 */
final class CacheEntry implements AccessOrder<CacheEntry> {
  final byte[] key;
  final ByteBuffer keyView;
  final ByteBuffer value;
  final long charge;
  final int hash;
  final AtomicInteger refs;

  // guarded by the owning shard's lock
  boolean inCache;
  @Nullable CacheEntry previousInAccessOrder;
  @Nullable CacheEntry nextInAccessOrder;

  volatile @Nullable EvictionCallback callback;
  volatile @Nullable RemovalCause removalCause;

  /**
   * Creates an unindexed entry holding the single reference of its pending handle.
   *
   * @param key a private copy of the key
   * @param value the buffer obtained from the allocator
   * @param charge the charge counted against the shard's capacity
   * @param hash the spread hash of the key
   */
  CacheEntry(byte[] key, ByteBuffer value, long charge, int hash) {
    this.key = key;
    this.keyView = ByteBuffer.wrap(key).asReadOnlyBuffer();
    this.value = value;
    this.charge = charge;
    this.hash = hash;
    this.refs = new AtomicInteger(1);
  }

  /** Returns a read-only view of the key positioned at its start. */
  ByteBuffer keyView() {
    return keyView.duplicate();
  }

  /** Returns a read-only view of the whole value. */
  ByteBuffer valueView() {
    ByteBuffer view = value.asReadOnlyBuffer();
    view.clear();
    return view;
  }

  /** Takes an additional reference. */
  void retain() {
    refs.incrementAndGet();
  }

  /** Drops a reference, returning whether it was the last one. */
  boolean release() {
    int remaining = refs.decrementAndGet();
    if (remaining < 0) {
      throw new IllegalStateException("Reference count underflow for " + this);
    }
    return (remaining == 0);
  }

  @Override
  public @Nullable CacheEntry getPreviousInAccessOrder() {
    return previousInAccessOrder;
  }

  @Override
  public void setPreviousInAccessOrder(@Nullable CacheEntry prev) {
    this.previousInAccessOrder = prev;
  }

  @Override
  public @Nullable CacheEntry getNextInAccessOrder() {
    return nextInAccessOrder;
  }

  @Override
  public void setNextInAccessOrder(@Nullable CacheEntry next) {
    this.nextInAccessOrder = next;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "keyLength=" + key.length + ", "
        + "valueLength=" + value.capacity() + ", "
        + "charge=" + charge + ", "
        + "refs=" + refs.get() + ", "
        + "cause=" + removalCause
        + '}';
  }
}
