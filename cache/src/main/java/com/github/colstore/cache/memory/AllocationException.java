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

/**
 * Thrown when a {@link BufferAllocator} cannot satisfy a request. The cache does not retry the
 * allocation or shrink itself in response; the exception is propagated to the caller that asked
 * for the memory.
 */
public final class AllocationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int requestedBytes;

  public AllocationException(int requestedBytes, String message) {
    super(message);
    this.requestedBytes = requestedBytes;
  }

  public AllocationException(int requestedBytes, String message, Throwable cause) {
    super(message, cause);
    this.requestedBytes = requestedBytes;
  }

  /** Returns the size of the allocation that failed. */
  public int requestedBytes() {
    return requestedBytes;
  }
}
