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
 * Accounts for memory consumed by a component so that a process can apply backpressure across
 * all of its consumers. The cache reports every change of the charge it holds; it never reads the
 * tracker back, and treats it as a best-effort counter that must tolerate concurrent updates.
 */
public interface MemoryTracker {

  /**
   * Records that {@code bytes} more are in use.
   *
   * @param bytes the number of bytes consumed
   */
  void consume(long bytes);

  /**
   * Records that {@code bytes} are no longer in use.
   *
   * @param bytes the number of bytes released
   */
  void release(long bytes);

  /** Returns the number of bytes currently consumed. */
  long consumption();

  /** Returns the highest consumption observed. */
  long peakConsumption();

  /**
   * Returns a tracker that ignores every update.
   *
   * @return a tracker that does not record consumption
   */
  static MemoryTracker disabled() {
    return DisabledMemoryTracker.INSTANCE;
  }
}
