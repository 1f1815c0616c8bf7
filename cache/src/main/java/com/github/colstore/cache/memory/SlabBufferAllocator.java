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
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * A {@link BufferAllocator} that carves buffers out of a single pre-allocated direct region.
 * <p>
 * The region is divided into fixed-size segments. A segment is lazily assigned a slot size when it
 * is first needed; slot sizes are powers of two no smaller than {@link #MIN_BLOCK_SIZE}. A request
 * is served from a segment of the smallest slot size that fits it, and a segment returns to the
 * free pool once its last slot is released. Requests larger than a segment, or arriving when no
 * segment of the right size class has a free slot and no unassigned segment remains, fail with an
 * {@link AllocationException}.
 * <p>
 * The buffers handed out are slices of the shared region, so the memory is reused instead of
 * being returned to the operating system until the allocator itself is discarded.
 */
public final class SlabBufferAllocator implements BufferAllocator {
  /** The smallest slot size, in bytes. */
  public static final int MIN_BLOCK_SIZE = 64;

  /** The default segment size, in bytes. */
  public static final int DEFAULT_SEGMENT_SIZE = 1024 * 1024;

  private final ByteBuffer region;
  private final int segmentSize;
  private final Segment[] segments;

  @GuardedBy("this")
  private final ArrayDeque<Segment> freeSegments;
  @GuardedBy("this")
  private final ArrayDeque<Segment>[] partialSegments;
  @GuardedBy("this")
  private final Map<ByteBuffer, Slot> slots;
  @GuardedBy("this")
  private long allocatedBytes;
  @GuardedBy("this")
  private long occupiedBytes;

  /**
   * Creates an allocator over a region of {@code capacityInBytes} using the default segment size.
   *
   * @param capacityInBytes the size of the backing region
   */
  public SlabBufferAllocator(int capacityInBytes) {
    this(capacityInBytes, DEFAULT_SEGMENT_SIZE);
  }

  /**
   * Creates an allocator over a region of {@code capacityInBytes}, rounded down to a whole number
   * of segments.
   *
   * @param capacityInBytes the size of the backing region
   * @param segmentSize the size of a segment; a power of two no smaller than
   *        {@link #MIN_BLOCK_SIZE}
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public SlabBufferAllocator(int capacityInBytes, int segmentSize) {
    if ((segmentSize < MIN_BLOCK_SIZE) || (Integer.bitCount(segmentSize) != 1)) {
      throw new IllegalArgumentException(
          "segment size must be a power of two >= " + MIN_BLOCK_SIZE + ": " + segmentSize);
    }
    if (capacityInBytes < segmentSize) {
      throw new IllegalArgumentException(String.format(
          "capacity %d must hold at least one segment of %d bytes", capacityInBytes, segmentSize));
    }
    this.segmentSize = segmentSize;
    this.segments = new Segment[capacityInBytes / segmentSize];
    this.region = ByteBuffer.allocateDirect(segments.length * segmentSize);
    this.freeSegments = new ArrayDeque<>(segments.length);
    for (int i = 0; i < segments.length; i++) {
      segments[i] = new Segment(i * segmentSize);
      freeSegments.add(segments[i]);
    }
    int sizeClasses = Integer.numberOfTrailingZeros(segmentSize / MIN_BLOCK_SIZE) + 1;
    this.partialSegments = new ArrayDeque[sizeClasses];
    for (int i = 0; i < sizeClasses; i++) {
      partialSegments[i] = new ArrayDeque<>();
    }
    this.slots = new IdentityHashMap<>();
  }

  @Override
  public synchronized ByteBuffer allocate(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative: " + size);
    } else if (size > segmentSize) {
      throw new AllocationException(size, String.format(
          "%d bytes exceeds the maximum block size of %d", size, segmentSize));
    }

    int sizeClass = sizeClassOf(size);
    Segment segment = segmentFor(sizeClass);
    if (segment == null) {
      throw new AllocationException(size, String.format(
          "no free %d byte slot for a %d byte request (%d of %d bytes occupied)",
          slotSizeOf(sizeClass), size, occupiedBytes, region.capacity()));
    }

    int slotIndex = segment.used.nextClearBit(0);
    segment.used.set(slotIndex);
    segment.usedCount++;
    if (segment.isFull()) {
      partialSegments[sizeClass].remove(segment);
    }

    int offset = segment.offset + (slotIndex * segment.slotSize);
    ByteBuffer buffer = region.duplicate();
    buffer.limit(offset + size).position(offset);
    ByteBuffer slice = buffer.slice();

    slots.put(slice, new Slot(segment, slotIndex));
    allocatedBytes += size;
    occupiedBytes += segment.slotSize;
    return slice;
  }

  /** Returns a segment with a free slot of the size class, assigning a free segment if needed. */
  @GuardedBy("this")
  private @Nullable Segment segmentFor(int sizeClass) {
    Segment partial = partialSegments[sizeClass].peekFirst();
    if (partial != null) {
      return partial;
    }
    Segment segment = freeSegments.pollFirst();
    if (segment == null) {
      return null;
    }
    segment.slotSize = slotSizeOf(sizeClass);
    partialSegments[sizeClass].addFirst(segment);
    return segment;
  }

  @Override
  public synchronized void free(ByteBuffer buffer) {
    requireNonNull(buffer);
    Slot slot = slots.remove(buffer);
    if (slot == null) {
      throw new IllegalArgumentException("buffer was not allocated here or was already freed");
    }

    Segment segment = slot.segment;
    int sizeClass = sizeClassOf(segment.slotSize);
    boolean wasFull = segment.isFull();
    segment.used.clear(slot.index);
    segment.usedCount--;
    allocatedBytes -= buffer.capacity();
    occupiedBytes -= segment.slotSize;

    if (segment.usedCount == 0) {
      if (!wasFull) {
        partialSegments[sizeClass].remove(segment);
      }
      segment.slotSize = 0;
      freeSegments.addLast(segment);
    } else if (wasFull) {
      partialSegments[sizeClass].addLast(segment);
    }
  }

  /** Returns the number of bytes requested by outstanding buffers. */
  public synchronized long allocatedBytes() {
    return allocatedBytes;
  }

  /** Returns the number of bytes held by outstanding slots, including rounding to slot sizes. */
  public synchronized long occupiedBytes() {
    return occupiedBytes;
  }

  /** Returns the number of segments not assigned to any slot size. */
  public synchronized int freeSegmentCount() {
    return freeSegments.size();
  }

  /** Returns the total size of the backing region. */
  public int capacity() {
    return region.capacity();
  }

  /** Returns the size class whose slots are the smallest that hold {@code size} bytes. */
  static int sizeClassOf(int size) {
    if (size <= MIN_BLOCK_SIZE) {
      return 0;
    }
    int slotSize = 1 << -Integer.numberOfLeadingZeros(size - 1);
    return Integer.numberOfTrailingZeros(slotSize / MIN_BLOCK_SIZE);
  }

  static int slotSizeOf(int sizeClass) {
    return MIN_BLOCK_SIZE << sizeClass;
  }

  @Override
  public synchronized String toString() {
    return "SlabBufferAllocator{capacity=" + region.capacity()
        + ", segmentSize=" + segmentSize
        + ", allocatedBytes=" + allocatedBytes
        + ", occupiedBytes=" + occupiedBytes
        + ", freeSegments=" + freeSegments.size() + '}';
  }

  /** A fixed-size region of the slab that is divided into equally sized slots. */
  private final class Segment {
    final int offset;
    final BitSet used;

    int slotSize;
    int usedCount;

    Segment(int offset) {
      this.offset = offset;
      this.used = new BitSet();
    }

    boolean isFull() {
      return usedCount == (segmentSize / slotSize);
    }
  }

  /** The location of an outstanding buffer. */
  private static final class Slot {
    final Segment segment;
    final int index;

    Slot(Segment segment, int index) {
      this.segment = segment;
      this.index = index;
    }
  }
}
