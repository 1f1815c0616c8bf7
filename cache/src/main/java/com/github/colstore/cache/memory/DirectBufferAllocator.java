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
import java.util.concurrent.atomic.AtomicLong;

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * A {@link BufferAllocator} that hands out direct (off-heap) buffers, optionally refusing requests
 * once a fixed number of bytes is outstanding.
 */
public final class DirectBufferAllocator implements BufferAllocator {
  static final long UNBOUNDED = Long.MAX_VALUE;

  private final long limitInBytes;
  private final AtomicLong allocatedBytes;

  /** Creates an allocator without a limit on outstanding bytes. */
  public DirectBufferAllocator() {
    this(UNBOUNDED);
  }

  /**
   * Creates an allocator that fails once {@code limitInBytes} are outstanding.
   *
   * @param limitInBytes the maximum number of bytes handed out and not yet freed
   */
  public DirectBufferAllocator(@NonNegative long limitInBytes) {
    if (limitInBytes < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limitInBytes);
    }
    this.limitInBytes = limitInBytes;
    this.allocatedBytes = new AtomicLong();
  }

  @Override
  public ByteBuffer allocate(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative: " + size);
    }
    reserve(size);
    try {
      return ByteBuffer.allocateDirect(size);
    } catch (OutOfMemoryError e) {
      allocatedBytes.addAndGet(-size);
      throw new AllocationException(size,
          "direct memory exhausted allocating " + size + " bytes", e);
    }
  }

  private void reserve(int size) {
    for (;;) {
      long current = allocatedBytes.get();
      long next = current + size;
      if (next > limitInBytes) {
        throw new AllocationException(size, String.format(
            "allocating %d bytes would exceed the limit of %d (%d outstanding)",
            size, limitInBytes, current));
      }
      if (allocatedBytes.compareAndSet(current, next)) {
        return;
      }
    }
  }

  @Override
  public void free(ByteBuffer buffer) {
    requireNonNull(buffer);
    allocatedBytes.addAndGet(-buffer.capacity());
  }

  /** Returns the number of bytes handed out and not yet freed. */
  public long allocatedBytes() {
    return allocatedBytes.get();
  }

  @Override
  public String toString() {
    return "DirectBufferAllocator{allocatedBytes=" + allocatedBytes.get()
        + ", limitInBytes=" + ((limitInBytes == UNBOUNDED) ? "unbounded" : limitInBytes) + '}';
  }
}
