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

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;

import com.google.errorprone.annotations.Immutable;

/**
 * Controls a bulk {@link Cache#invalidate} pass. Each shard walks its entries from the least to
 * the most valuable end. Before visiting an entry the {@link IterationFunction} is asked whether to
 * continue, given how many valid and invalid entries the shard has seen so far; the visited entry
 * is then erased if the {@link ValidityFunction} rejects it.
 * <p>
 * Both functions are evaluated while the shard's lock is held and must not call back into the
 * cache.
 */
@Immutable
public final class InvalidationControl {
  private static final InvalidationControl INVALIDATE_ALL = new InvalidationControl(
      ValidityFunction.allInvalid(), IterationFunction.alwaysContinue());

  @SuppressWarnings("Immutable")
  private final ValidityFunction validityFunction;
  @SuppressWarnings("Immutable")
  private final IterationFunction iterationFunction;

  private InvalidationControl(ValidityFunction validityFunction,
      IterationFunction iterationFunction) {
    this.validityFunction = requireNonNull(validityFunction);
    this.iterationFunction = requireNonNull(iterationFunction);
  }

  /**
   * Returns a control that visits every entry and considers all of them invalid.
   *
   * @return a control that invalidates the whole cache
   */
  public static InvalidationControl invalidateAll() {
    return INVALIDATE_ALL;
  }

  /**
   * Returns a control that visits every entry and erases those rejected by {@code validity}.
   *
   * @param validity the predicate deciding whether an entry may stay
   * @return a control using the validity function
   */
  public static InvalidationControl of(ValidityFunction validity) {
    return new InvalidationControl(validity, IterationFunction.alwaysContinue());
  }

  /**
   * Returns a control that erases the entries rejected by {@code validity} for as long as
   * {@code iteration} allows the walk to continue.
   *
   * @param validity the predicate deciding whether an entry may stay
   * @param iteration the predicate deciding whether to visit the next entry
   * @return a control using both functions
   */
  public static InvalidationControl of(ValidityFunction validity, IterationFunction iteration) {
    return new InvalidationControl(validity, iteration);
  }

  public ValidityFunction validityFunction() {
    return validityFunction;
  }

  public IterationFunction iterationFunction() {
    return iterationFunction;
  }

  /** Decides whether an entry is still valid. */
  @FunctionalInterface
  public interface ValidityFunction {

    /**
     * Returns whether the entry should stay in the cache.
     *
     * @param key a read-only view of the entry's key
     * @param value a read-only view of the entry's value
     * @return {@code true} to keep the entry, {@code false} to erase it
     */
    boolean isValid(ByteBuffer key, ByteBuffer value);

    /** Returns a function that considers every entry invalid. */
    static ValidityFunction allInvalid() {
      return (key, value) -> false;
    }
  }

  /** Decides whether an invalidation pass should visit the next entry of a shard. */
  @FunctionalInterface
  public interface IterationFunction {

    /**
     * Returns whether to visit the next entry.
     *
     * @param validCount the number of entries of the shard found valid so far
     * @param invalidCount the number of entries of the shard found invalid so far
     * @return {@code true} to visit the next entry, {@code false} to stop the shard's walk
     */
    boolean shouldContinue(long validCount, long invalidCount);

    /** Returns a function that walks over every entry. */
    static IterationFunction alwaysContinue() {
      return (validCount, invalidCount) -> true;
    }
  }
}
