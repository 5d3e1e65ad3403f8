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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Tests {@link PagedArray}. */
public class PagedArrayTest {
  @Test
  void testGrowth() {
    final PagedArray<String> a = new PagedArray<>(Pages.ATTRIBUTE_STRIDE);
    assertThat(a.isEmpty(), is(true));
    assertThat(a.capacity(), is(0));
    assertThat(a.pages(), is(0));
    assertThat(a.reallocations(), is(0));

    a.add("x0");
    assertThat(a.size(), is(1));
    assertThat(a.capacity(), is(256));
    assertThat(a.pages(), is(1));
    assertThat(a.reallocations(), is(1));

    for (int i = 1; i < 256; i++) {
      a.add("x" + i);
    }
    assertThat(a.size(), is(256));
    assertThat(a.capacity(), is(256));
    assertThat(a.reallocations(), is(1));

    // The 257th element needs a second page.
    a.add("x256");
    assertThat(a.size(), is(257));
    assertThat(a.capacity(), is(512));
    assertThat(a.pages(), is(2));
    assertThat(a.reallocations(), is(2));
    assertThat(a.get(256), is("x256"));
    assertThat(a.get(0), is("x0"));

    // Removing elements never releases pages.
    final List<String> removed = new ArrayList<>();
    a.clear(removed::add);
    assertThat(removed.size(), is(257));
    assertThat(a.size(), is(0));
    assertThat(a.capacity(), is(512));

    a.resize(512, () -> "y", e -> {});
    assertThat(a.size(), is(512));
    assertThat(a.reallocations(), is(2));

    a.reserve(513);
    assertThat(a.pages(), is(3));
    assertThat(a.reallocations(), is(3));
    assertThat(a.size(), is(512));
  }

  @Test
  void testPairStride() {
    final PagedArray<Integer> a = new PagedArray<>(Pages.PAIR_STRIDE);
    for (int i = 0; i < 128; i++) {
      a.add(i);
    }
    assertThat(a.capacity(), is(128));
    a.add(128);
    assertThat(a.capacity(), is(256));
    assertThat(a.reallocations(), is(2));

    // Reserving in advance allocates the exact number of pages once.
    final PagedArray<Integer> b = new PagedArray<>(Pages.PAIR_STRIDE);
    b.reserve(300);
    assertThat(b.capacity(), is(384));
    assertThat(b.reallocations(), is(1));
    b.reserve(384);
    assertThat(b.reallocations(), is(1));
  }

  @Test
  void testRemove() {
    final PagedArray<String> a = of("a", "b", "c");
    assertThat(a.remove(0), is("a"));
    assertThat(a.asList(), is(Arrays.asList("c", "b")));
    assertThat(a.remove(1), is("b"));
    assertThat(a, hasToString("[c]"));
    assertThat(a.remove(0), is("c"));
    assertThat(a.isEmpty(), is(true));
    assertThrows(IndexOutOfBoundsException.class, () -> a.remove(0));

    final PagedArray<String> b = of("a", "b", "c", "d");
    assertThat(b.removeOrdered(1), is("b"));
    assertThat(b, hasToString("[a, c, d]"));
  }

  @Test
  void testRemoveRange() {
    final PagedArray<String> a = of("a", "b", "c", "d", "e");
    final List<String> removed = new ArrayList<>();
    a.removeRange(1, 3, removed::add);
    assertThat(removed, is(Arrays.asList("b", "c")));
    assertThat(a, hasToString("[a, d, e]"));

    // Empty range
    a.removeRange(2, 2, removed::add);
    assertThat(a.size(), is(3));
    assertThat(removed.size(), is(2));

    assertThrows(
        IndexOutOfBoundsException.class, () -> a.removeRange(2, 1, e -> {}));
    assertThrows(
        IndexOutOfBoundsException.class, () -> a.removeRange(0, 4, e -> {}));
  }

  @Test
  void testInsertAndSwap() {
    final PagedArray<String> a = of("b", "d");
    a.insert(0, "a");
    a.insert(2, "c");
    a.insert(4, "e");
    assertThat(a, hasToString("[a, b, c, d, e]"));
    assertThrows(IndexOutOfBoundsException.class, () -> a.insert(6, "z"));
    assertThrows(IndexOutOfBoundsException.class, () -> a.insert(-1, "z"));

    a.swap(0, 4);
    a.swap(2, 2);
    assertThat(a, hasToString("[e, b, c, d, a]"));
    assertThrows(IndexOutOfBoundsException.class, () -> a.swap(0, 5));

    assertThat(a.set(1, "B"), is("b"));
    assertThat(a.get(1), is("B"));
    assertThrows(IndexOutOfBoundsException.class, () -> a.get(5));
  }

  @Test
  void testResize() {
    final PagedArray<String> a = of("a", "b", "c");
    final List<String> removed = new ArrayList<>();
    a.resize(5, () -> "-", removed::add);
    assertThat(a, hasToString("[a, b, c, -, -]"));
    a.resize(1, () -> "-", removed::add);
    assertThat(a, hasToString("[a]"));
    assertThat(removed, is(Arrays.asList("b", "c", "-", "-")));
    assertThrows(
        IllegalArgumentException.class, () -> a.resize(-1, () -> "-", e -> {}));
  }

  /** Applies random operations to a PagedArray and to an ArrayList and checks
   * that they stay the same. */
  @Test
  void testRandom() {
    final Random r = new Random(0);
    final PagedArray<Integer> a = new PagedArray<>(Pages.ATTRIBUTE_STRIDE);
    final List<Integer> list = new ArrayList<>();
    int maxSize = 0;
    for (int i = 0; i < 5_000; i++) {
      final int op = r.nextInt(10);
      if (op < 5 || list.isEmpty()) {
        final int pos = r.nextInt(list.size() + 1);
        a.insert(pos, i);
        list.add(pos, i);
      } else if (op < 7) {
        final int pos = r.nextInt(list.size());
        final int last = list.size() - 1;
        Collections.swap(list, pos, last);
        assertThat(a.remove(pos), is(list.remove(last)));
      } else if (op < 9) {
        final int pos = r.nextInt(list.size());
        assertThat(a.removeOrdered(pos), is(list.remove(pos)));
      } else {
        final int i0 = r.nextInt(list.size());
        final int i1 = r.nextInt(list.size());
        a.swap(i0, i1);
        Collections.swap(list, i0, i1);
      }
      maxSize = Math.max(maxSize, list.size());
      assertThat(a.asList(), is(list));
      assertThat(a.capacity(), is(Pages.slotCount(
          Pages.pageCount(maxSize, Pages.ATTRIBUTE_STRIDE),
          Pages.ATTRIBUTE_STRIDE)));
    }
  }

  @SafeVarargs
  private static <E> PagedArray<E> of(E... elements) {
    final PagedArray<E> a = new PagedArray<>(Pages.ATTRIBUTE_STRIDE);
    for (E e : elements) {
      a.add(e);
    }
    return a;
  }
}

// End PagedArrayTest.java
