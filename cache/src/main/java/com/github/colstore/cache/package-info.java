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

/**
 * This package contains a sharded, capacity-bounded cache of byte-blob keys and values whose
 * entries are pinned by reference-counted handles. The entry point is
 * {@link com.github.colstore.cache.CacheBuilder}, which builds a
 * {@link com.github.colstore.cache.Cache}.
 * <p>
 * An entry is published in two steps: {@link com.github.colstore.cache.Cache#allocate} reserves
 * the memory of the value and {@link com.github.colstore.cache.Cache#insert} makes it visible.
 * Every handle must be closed; an entry that has left the cache is freed, and its
 * {@link com.github.colstore.cache.EvictionCallback} notified, when its last handle is closed.
 * <p>
 * The {@link com.github.colstore.cache.EvictionPolicy#LRU} policy refreshes an entry on every
 * lookup, while {@link com.github.colstore.cache.EvictionPolicy#FIFO} evicts strictly in the order
 * of insertion.
 * <p>
 * The components in this package are nonnull by default and return values are checked.
 */
@NullMarked
@CheckReturnValue
package com.github.colstore.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
