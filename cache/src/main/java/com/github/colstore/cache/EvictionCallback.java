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

/**
 * A callback that is notified when an inserted entry is freed. An entry is freed once it has left
 * the index (by eviction, erasure, replacement or invalidation) and its last {@link Handle} has
 * been closed. The callback is invoked exactly once per inserted entry, on the thread that released
 * the last reference, and never while a shard lock is held.
 * <p>
 * An instance may be called concurrently by multiple threads. Implementations must not call back
 * into the cache that invoked them. Any exception thrown by the callback is logged and
 * swallowed.
 */
@FunctionalInterface
public interface EvictionCallback {

  /**
   * Notifies the callback that an entry was freed. The buffers are read-only views that are only
   * valid for the duration of the call, as the value's memory is returned to the allocator
   * afterwards.
   *
   * @param key the key of the freed entry
   * @param value the value of the freed entry
   */
  void onEviction(ByteBuffer key, ByteBuffer value);
}
