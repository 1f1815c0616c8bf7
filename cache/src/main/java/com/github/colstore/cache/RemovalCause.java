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
 * The reason why a cached entry left the index. The cause is reported to the cache metrics when
 * the entry is finally freed, which may be long after it left the index if a handle still pinned
 * it.
 */
public enum RemovalCause {

  /**
   * The entry was manually removed by the user through {@link Cache#erase}.
   */
  EXPLICIT {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * The entry itself was not actually removed, but another entry was inserted under the same key
   * through {@link Cache#insert}.
   */
  REPLACED {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * The entry was judged invalid by the {@link InvalidationControl.ValidityFunction} passed to
   * {@link Cache#invalidate}.
   */
  INVALIDATED {
    @Override public boolean wasEvicted() {
      return false;
    }
  },

  /**
   * The entry was evicted because the charges of the shard's entries exceeded its capacity.
   */
  SIZE {
    @Override public boolean wasEvicted() {
      return true;
    }
  };

  /**
   * Returns {@code true} if there was an automatic removal due to eviction (the cause is
   * {@link #SIZE}).
   *
   * @return if the entry was automatically removed due to eviction
   */
  public abstract boolean wasEvicted();
}
