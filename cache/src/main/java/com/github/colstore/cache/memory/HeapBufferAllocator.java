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

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;

/**
 * A {@link BufferAllocator} that hands out plain heap buffers and leaves reclamation to the
 * garbage collector.
 */
enum HeapBufferAllocator implements BufferAllocator {
  INSTANCE;

  @Override
  public ByteBuffer allocate(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative: " + size);
    }
    try {
      return ByteBuffer.allocate(size);
    } catch (OutOfMemoryError e) {
      throw new AllocationException(size, "heap exhausted allocating " + size + " bytes", e);
    }
  }

  @Override
  public void free(ByteBuffer buffer) {
    requireNonNull(buffer);
  }

  @Override
  public String toString() {
    return "HeapBufferAllocator";
  }
}
