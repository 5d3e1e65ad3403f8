/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.attr.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;
import static java.util.Objects.requireNonNull;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Growable array whose capacity is always a whole number of pages.
 *
 * <p>Capacity follows the policy in {@link Pages}: when an operation needs
 * more slots, the array computes the pages required for the new size and
 * reallocates only if that exceeds the pages it already has. Capacity never
 * shrinks.
 *
 * <p>Removal by {@link #remove(int)} takes O(1) time and does not preserve
 * order: the last element moves into the vacated slot.
 *
 * @param <E> Element type
 */
public class PagedArray<E> {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PagedArray.class);

  private static final Object[] EMPTY = {};

  private final int stride;
  private @Nullable Object[] elements = EMPTY;
  private int size;
  private int reallocations;

  /** Creates an empty PagedArray whose slots are {@code stride} bytes. */
  public PagedArray(int stride) {
    checkArgument(Pages.slotsPerPage(stride) > 0);
    this.stride = stride;
  }

  @Override
  public String toString() {
    return asList().toString();
  }

  /** Returns the number of elements. */
  public int size() {
    return size;
  }

  /** Returns whether this array is empty. (Same as {@code size() == 0}.) */
  public boolean isEmpty() {
    return size == 0;
  }

  /** Returns the number of slots allocated; always a whole number of pages. */
  public int capacity() {
    return elements.length;
  }

  /** Returns the number of pages allocated. */
  public int pages() {
    return Pages.pageCount(elements.length, stride);
  }

  /** Returns how many times the backing store has been reallocated. */
  public int reallocations() {
    return reallocations;
  }

  /** Returns the element at position {@code i}. */
  @SuppressWarnings("unchecked")
  public E get(int i) {
    checkElementIndex(i, size);
    return (E) requireNonNull(elements[i]);
  }

  /** Sets the element at position {@code i}, returning the previous one. */
  @SuppressWarnings("unchecked")
  public E set(int i, E e) {
    checkElementIndex(i, size);
    requireNonNull(e);
    final E previous = (E) elements[i];
    elements[i] = e;
    return previous;
  }

  /** Adds an element to the end. */
  public void add(E e) {
    insert(size, e);
  }

  /**
   * Inserts an element at position {@code i}, moving the element currently
   * there, and all after it, one place to the right.
   */
  public void insert(int i, E e) {
    checkPositionIndex(i, size);
    requireNonNull(e);
    reserve(size + 1);
    System.arraycopy(elements, i, elements, i + 1, size - i);
    elements[i] = e;
    ++size;
  }

  /**
   * Removes element {@code i} in O(1) time.
   *
   * <p>If {@code i} is the last element, removes it; otherwise moves the last
   * element into position {@code i} and shortens the array.
   */
  @SuppressWarnings("unchecked")
  public E remove(int i) {
    checkElementIndex(i, size);
    final E e = (E) elements[i];
    final int last = --size;
    if (i != last) {
      elements[i] = elements[last];
    }
    elements[last] = null;
    return e;
  }

  /**
   * Removes element {@code i}, moving every later element one place to the
   * left. Takes O(n) time but preserves order.
   */
  public E removeOrdered(int i) {
    final E e = get(i);
    removeRange(i, i + 1, e2 -> {});
    return e;
  }

  /**
   * Removes the elements in the half-open range {@code [start, end)}, passing
   * each to {@code consumer}; later elements keep their order.
   */
  @SuppressWarnings("unchecked")
  public void removeRange(int start, int end, Consumer<? super E> consumer) {
    checkPositionIndexes(start, end, size);
    for (int i = start; i < end; i++) {
      consumer.accept((E) requireNonNull(elements[i]));
    }
    System.arraycopy(elements, end, elements, start, size - end);
    final int newSize = size - (end - start);
    Arrays.fill(elements, newSize, size, null);
    size = newSize;
  }

  /** Swaps the elements at positions {@code i} and {@code j}. */
  public void swap(int i, int j) {
    checkElementIndex(i, size);
    checkElementIndex(j, size);
    if (i != j) {
      final Object e = elements[i];
      elements[i] = elements[j];
      elements[j] = e;
    }
  }

  /**
   * Changes the size to {@code newSize}. New slots are filled from
   * {@code supplier}; dropped elements are passed to {@code consumer}.
   */
  public void resize(
      int newSize,
      Supplier<? extends E> supplier,
      Consumer<? super E> consumer) {
    checkArgument(newSize >= 0, "negative size %s", newSize);
    if (newSize < size) {
      removeRange(newSize, size, consumer);
      return;
    }
    reserve(newSize);
    for (int i = size; i < newSize; i++) {
      elements[i] = requireNonNull(supplier.get());
    }
    size = newSize;
  }

  /** Removes all elements, passing each to {@code consumer}. */
  public void clear(Consumer<? super E> consumer) {
    removeRange(0, size, consumer);
  }

  /**
   * Ensures that there is room for {@code count} elements.
   *
   * <p>Reallocates only if the number of pages required for {@code count}
   * elements exceeds the number of pages currently allocated. The new
   * allocation is exactly the required number of pages; existing elements are
   * copied and the tail is empty.
   */
  public void reserve(int count) {
    final int required = Pages.pageCount(count, stride);
    final int current = pages();
    if (required > current) {
      LOGGER.trace(
          "Growing from {} to {} pages for {} elements",
          current,
          required,
          count);
      elements = Arrays.copyOf(elements, Pages.slotCount(required, stride));
      ++reallocations;
    }
  }

  /** Calls a consumer with each element, in order. */
  @SuppressWarnings("unchecked")
  public void forEach(Consumer<? super E> consumer) {
    for (int i = 0; i < size; i++) {
      consumer.accept((E) elements[i]);
    }
  }

  /** Returns a view of the contents as a list. */
  public List<E> asList() {
    return new AbstractList<E>() {
      @Override
      public int size() {
        return PagedArray.this.size();
      }

      @Override
      public E get(int index) {
        return PagedArray.this.get(index);
      }

      @Override
      public E set(int index, E element) {
        return PagedArray.this.set(index, element);
      }
    };
  }
}

// End PagedArray.java
