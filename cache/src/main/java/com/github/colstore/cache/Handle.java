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
 * A reference to an entry that was inserted into or looked up from a {@link Cache}. While the
 * handle is open the entry's memory stays valid, even if the entry is evicted, erased or replaced
 * in the meantime. Closing the handle releases the reference; if it was the last one the entry is
 * freed and its {@link EvictionCallback} runs on the closing thread.
 * <p>
 * A handle should be closed exactly once, typically with a try-with-resources statement. Closing it
 * again has no effect, and reading from a closed handle fails with an
 * {@link IllegalStateException}.
 */
public final class Handle implements AutoCloseable {
  private final ShardedCache cache;
  private final CacheEntry entry;
  private final AtomicBoolean closed;

  Handle(ShardedCache cache, CacheEntry entry) {
    this.cache = cache;
    this.entry = entry;
    this.closed = new AtomicBoolean();
  }

  /** Returns a read-only view of the entry's key. */
  public ByteBuffer key() {
    checkOpen();
    return entry.keyView();
  }

  /** Returns a read-only view of the entry's value. */
  public ByteBuffer value() {
    checkOpen();
    return entry.valueView();
  }

  /** Returns the charge that the entry counts against the cache's capacity. */
  public long charge() {
    return entry.charge;
  }

  /** Returns whether the handle was closed. */
  public boolean isClosed() {
    return closed.get();
  }

  /** Releases this handle's reference to the entry. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      cache.release(entry);
    }
  }

  private void checkOpen() {
    CacheBuilder.requireState(!closed.get(), "handle was already closed");
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "closed=" + closed.get() + ", "
        + "entry=" + entry
        + '}';
  }
}
