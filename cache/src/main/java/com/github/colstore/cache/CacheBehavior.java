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

/**
 * Describes what the caller expects of a {@link Cache#lookup}. The behavior does not change the
 * result of the lookup; it only decides how a miss is accounted for.
 */
public enum CacheBehavior {

  /**
   * The caller expects the key to be present, e.g. a block that was recently read. Hits and misses
   * are also counted as caching hits and misses, and a miss is logged at {@code TRACE}.
   */
  EXPECT_IN_CACHE,

  /** The caller is probing the cache and a miss is not noteworthy. */
  NO_CHECK
}
