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
package com.github.colstore.cache.memory;

import java.nio.ByteBuffer;

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Supplies the buffers that back cache values. An allocator is handed to the cache when it is
 * built; there is no process-wide default instance.
 * <p>
 * Implementations must be thread-safe. A buffer is returned to {@link #free} at most once, and
 * possibly on a different thread than the one that allocated it.
 */
public interface BufferAllocator {

  /**
   * Returns a buffer with a capacity and limit of exactly {@code size} bytes, positioned at zero.
   *
   * @param size the number of bytes requested
   * @return a buffer owned by the caller until it is passed to {@link #free}
   * @throws AllocationException if the memory cannot be provided
   */
  ByteBuffer allocate(@NonNegative int size);

  /**
   * Releases a buffer previously returned by {@link #allocate}.
   *
   * @param buffer the buffer to release
   */
  void free(ByteBuffer buffer);

  /**
   * Returns an allocator backed by the Java heap.
   *
   * @return the heap allocator
   */
  static BufferAllocator heap() {
    return HeapBufferAllocator.INSTANCE;
  }
}
