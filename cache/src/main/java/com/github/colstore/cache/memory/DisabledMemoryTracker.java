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

/** A {@link MemoryTracker} that does not record anything. */
enum DisabledMemoryTracker implements MemoryTracker {
  INSTANCE;

  @Override
  public void consume(long bytes) {}

  @Override
  public void release(long bytes) {}

  @Override
  public long consumption() {
    return 0L;
  }

  @Override
  public long peakConsumption() {
    return 0L;
  }
}
