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

import org.jspecify.annotations.Nullable;

import com.github.colstore.cache.AccessOrderDeque.AccessOrder;

/**
 * An intrusive doubly-linked deque used to represent the eviction order of a shard. The links are
 * stored on the elements themselves, so linking and unlinking never allocate. The first element is
 * the next eviction candidate and the last element is the most recently inserted or accessed.
 * <p>
 * This class is not thread-safe; it is guarded by its shard's lock.
 *
 * @param <E> the type of elements held in this collection
 */
final class AccessOrderDeque<E extends AccessOrder<E>> {
  /**
   * Pointer to first node.
   * Invariant: (first == null && last == null) ||
   *            (first.prev == null)
   */
  @Nullable E first;

  /**
   * Pointer to last node.
   * Invariant: (first == null && last == null) ||
   *            (last.next == null)
   */
  @Nullable E last;

  int size;

  /**
   * Links the element to the back of the deque so that it becomes the last element.
   *
   * @param e the unlinked element
   */
  void linkLast(E e) {
    E l = last;
    last = e;

    if (l == null) {
      first = e;
    } else {
      l.setNextInAccessOrder(e);
      e.setPreviousInAccessOrder(l);
    }
    size++;
  }

  /** Unlinks the non-null element. */
  void unlink(E e) {
    E prev = e.getPreviousInAccessOrder();
    E next = e.getNextInAccessOrder();

    if (prev == null) {
      first = next;
    } else {
      prev.setNextInAccessOrder(next);
      e.setPreviousInAccessOrder(null);
    }

    if (next == null) {
      last = prev;
    } else {
      next.setPreviousInAccessOrder(prev);
      e.setNextInAccessOrder(null);
    }
    size--;
  }

  // A fast-path containment check
  boolean contains(AccessOrder<?> e) {
    return (e.getPreviousInAccessOrder() != null)
        || (e.getNextInAccessOrder() != null)
        || (e == first);
  }

  /** Unlinks the element if it is linked, returning whether it was. */
  boolean remove(E e) {
    if (contains(e)) {
      unlink(e);
      return true;
    }
    return false;
  }

  /** Moves the linked element to the back of the deque. */
  void moveToBack(E e) {
    if (e != last) {
      unlink(e);
      linkLast(e);
    }
  }

  @Nullable E peekFirst() {
    return first;
  }

  @Nullable E peekLast() {
    return last;
  }

  /** Unlinks and returns the first element, or {@code null} if the deque is empty. */
  @Nullable E pollFirst() {
    E f = first;
    if (f != null) {
      unlink(f);
    }
    return f;
  }

  /** Returns the element linked after {@code e}, or {@code null} if it is the last. */
  @Nullable E successor(E e) {
    return e.getNextInAccessOrder();
  }

  boolean isEmpty() {
    return (first == null);
  }

  int size() {
    return size;
  }

  /**
   * An element that is linked on the {@link AccessOrderDeque}.
   */
  interface AccessOrder<T extends AccessOrder<T>> {

    /**
     * Retrieves the previous element or {@code null} if either the element is unlinked or the
     * first element on the deque.
     */
    @Nullable T getPreviousInAccessOrder();

    /** Sets the previous element or {@code null} if there is no link. */
    void setPreviousInAccessOrder(@Nullable T prev);

    /**
     * Retrieves the next element or {@code null} if either the element is unlinked or the last
     * element on the deque.
     */
    @Nullable T getNextInAccessOrder();

    /** Sets the next element or {@code null} if there is no link. */
    void setNextInAccessOrder(@Nullable T next);
  }
}
