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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An entry that was allocated by {@link Cache#allocate} and is not yet visible to lookups. The
 * caller fills the value through {@link #mutableValue()} and then publishes the entry with
 * {@link Cache#insert}, which consumes this handle.
 * <p>
 * Closing a pending handle that was never inserted returns the value's memory to the allocator
 * without notifying any {@link EvictionCallback}, as the entry never became visible. Closing it
 * after it was inserted has no effect.
 */
public final class PendingHandle implements AutoCloseable {
  private final ShardedCache cache;
  private final CacheEntry entry;
  private final AtomicBoolean consumed;

  PendingHandle(ShardedCache cache, CacheEntry entry) {
    this.cache = cache;
    this.entry = entry;
    this.consumed = new AtomicBoolean();
  }

  /**
   * Returns a writable view of the entry's value. The view spans the whole value, which has the
   * length requested at allocation.
   *
   * @return a writable buffer over the value's memory
   * @throws IllegalStateException if the handle was already inserted or closed
   */
  public ByteBuffer mutableValue() {
    checkPending();
    ByteBuffer view = entry.value.duplicate();
    view.clear();
    return view;
  }

  /** Returns a read-only view of the entry's key. */
  public ByteBuffer key() {
    checkPending();
    return entry.keyView();
  }

  /** Returns the length of the value, in bytes. */
  public int valueLength() {
    return entry.value.capacity();
  }

  /** Returns the charge that the entry will count against the cache's capacity. */
  public long charge() {
    return entry.charge;
  }

  /** Returns whether the handle was inserted or closed. */
  public boolean isConsumed() {
    return consumed.get();
  }

  /** Frees the entry if it was never inserted. */
  @Override
  public void close() {
    if (consumed.compareAndSet(false, true)) {
      cache.discard(entry);
    }
  }

  /**
   * Marks the handle as consumed by an insertion.
   *
   * @throws IllegalStateException if the handle was already inserted or closed
   */
  CacheEntry consume() {
    CacheBuilder.requireState(consumed.compareAndSet(false, true),
        "pending handle was already inserted or closed");
    return entry;
  }

  boolean isOwnedBy(ShardedCache owner) {
    return (cache == owner);
  }

  private void checkPending() {
    CacheBuilder.requireState(!consumed.get(), "pending handle was already inserted or closed");
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "consumed=" + consumed.get() + ", "
        + "entry=" + entry
        + '}';
  }
}
