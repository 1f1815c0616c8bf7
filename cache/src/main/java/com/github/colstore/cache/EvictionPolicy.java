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

/** The order in which a shard discards entries when its charges exceed its capacity. */
public enum EvictionPolicy {

  /** Evicts the entry that was inserted earliest; lookups do not refresh an entry. */
  FIFO,

  /** Evicts the entry that was least recently inserted or looked up. */
  LRU
}
