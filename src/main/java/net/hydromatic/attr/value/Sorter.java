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
package net.hydromatic.attr.value;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static net.hydromatic.attr.util.Static.compareCodePoints;

import java.util.Comparator;
import java.util.function.Function;
import net.hydromatic.attr.util.PagedArray;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sorts the elements of a list attribute in place.
 *
 * <p>Each element has a sort key: the element itself if it is a string or an
 * integer, or one of its fields if it is a list or dictionary. Strings are
 * compared by code point (the same order as comparing their UTF-8 bytes);
 * signed and unsigned integers are compared numerically, using the
 * representation of the element being compared against the pivot.
 *
 * <p>The sort is a quicksort with a Lomuto partition around the last element,
 * so it is not stable. Every key is checked before any element moves, so a
 * list containing an unsortable element is left unchanged.
 */
final class Sorter {
  private Sorter() {}

  private static final Comparator<Attribute> STRING_COMPARATOR =
      (a1, a2) -> compareCodePoints(a1.stringValue(), a2.stringValue());

  private static final Comparator<Attribute> INT64_COMPARATOR =
      (a1, a2) -> Long.compare(a1.toInt64(), a2.toInt64());

  private static final Comparator<Attribute> UINT64_COMPARATOR =
      (a1, a2) -> Long.compareUnsigned(a1.toUInt64(), a2.toUInt64());

  /**
   * Returns a key function that uses field {@code fieldIdx} of an element that
   * is a list or dictionary, and any other element as is.
   */
  static Function<Attribute, @Nullable Attribute> field(int fieldIdx) {
    checkArgument(fieldIdx >= 0, "negative field index %s", fieldIdx);
    return element -> {
      if (!element.kind().isContainer()) {
        return element;
      }
      return fieldIdx < element.size() ? element.get(fieldIdx) : null;
    };
  }

  /** Returns a key function that uses the value of {@code key}. */
  static Function<Attribute, @Nullable Attribute> key(String key) {
    return element -> element.isDict() ? element.find(key) : null;
  }

  /** Sorts a list attribute, using a given function to extract keys. */
  static void sort(
      Attribute attribute, Function<Attribute, @Nullable Attribute> keyFn) {
    if (!attribute.isList()) {
      throw new AttributeKindException(
          format("cannot sort %s attribute", attribute.kind()),
          attribute.kind());
    }
    final PagedArray<Attribute> list = attribute.list();
    final Attribute[] keys = keys(list, keyFn);
    quicksort(list, keys, 0, keys.length - 1);
  }

  /** Extracts and validates the key of every element. */
  private static Attribute[] keys(
      PagedArray<Attribute> list,
      Function<Attribute, @Nullable Attribute> keyFn) {
    final Attribute[] keys = new Attribute[list.size()];
    for (int i = 0; i < keys.length; i++) {
      final Attribute element = list.get(i);
      final Attribute key = keyFn.apply(element);
      if (key == null) {
        throw new UnsortableKindException(
            format("element %d (%s) has no sort key", i, element.kind()),
            element.kind(),
            i);
      }
      if (!key.isString() && !key.isInteger()) {
        throw new UnsortableKindException(
            format("cannot sort by %s key (element %d)", key.kind(), i),
            key.kind(),
            i);
      }
      if (i > 0 && key.isString() != keys[0].isString()) {
        throw new UnsortableKindException(
            format(
                "cannot compare %s key (element %d) with %s key",
                key.kind(), i, keys[0].kind()),
            key.kind(),
            i);
      }
      keys[i] = key;
    }
    return keys;
  }

  private static void quicksort(
      PagedArray<Attribute> list, Attribute[] keys, int lo, int hi) {
    // Recurse into the smaller partition and loop on the larger; stack depth
    // is O(log n) even for sorted input.
    while (lo < hi) {
      final int p = partition(list, keys, lo, hi);
      if (p - lo < hi - p) {
        quicksort(list, keys, lo, p - 1);
        lo = p + 1;
      } else {
        quicksort(list, keys, p + 1, hi);
        hi = p - 1;
      }
    }
  }

  private static int partition(
      PagedArray<Attribute> list, Attribute[] keys, int lo, int hi) {
    final Attribute pivot = keys[hi];
    int i = lo - 1;
    for (int j = lo; j < hi; j++) {
      final Attribute key = keys[j];
      if (comparatorFor(key.kind()).compare(key, pivot) <= 0) {
        swap(list, keys, ++i, j);
      }
    }
    swap(list, keys, i + 1, hi);
    return i + 1;
  }

  private static void swap(
      PagedArray<Attribute> list, Attribute[] keys, int i, int j) {
    list.swap(i, j);
    final Attribute key = keys[i];
    keys[i] = keys[j];
    keys[j] = key;
  }

  /** Returns the comparator for keys of a given kind. */
  private static Comparator<Attribute> comparatorFor(Kind kind) {
    switch (kind) {
      case STRING:
        return STRING_COMPARATOR;
      case INT64:
        return INT64_COMPARATOR;
      case UINT64:
        return UINT64_COMPARATOR;
      default:
        throw new AssertionError("unsortable kind " + kind);
    }
  }
}

// End Sorter.java
