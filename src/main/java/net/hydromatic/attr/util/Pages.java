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

/**
 * Page-granular allocation policy for container storage.
 *
 * <p>Lists and dictionaries size their backing arrays in whole pages of
 * {@link #PAGE_BYTES} bytes. A page holds {@code PAGE_BYTES / stride} slots,
 * where the stride is the nominal size of one slot: {@link #ATTRIBUTE_STRIDE}
 * for a list element, {@link #PAIR_STRIDE} for a (key, value) pair.
 *
 * <p>A container only reallocates when the number of pages it needs grows.
 */
public final class Pages {
  private Pages() {}

  /** Size of a page, in bytes. */
  public static final int PAGE_BYTES = 1 << 12;

  /** Nominal size of an attribute: a kind, a size, and a 64-bit payload. */
  public static final int ATTRIBUTE_STRIDE = 16;

  /** Nominal size of a dictionary entry: a key attribute and a value. */
  public static final int PAIR_STRIDE = 2 * ATTRIBUTE_STRIDE;

  /**
   * Returns the number of pages required to hold {@code count} slots of
   * {@code stride} bytes each; that is, {@code ceil(count * stride /
   * PAGE_BYTES)}.
   */
  public static int pageCount(int count, int stride) {
    checkArgument(count >= 0, "negative count %s", count);
    checkStride(stride);
    final long bytes = (long) count * stride;
    return (int) ((bytes + PAGE_BYTES - 1) / PAGE_BYTES);
  }

  /** Returns the number of slots in {@code pages} pages. */
  public static int slotCount(int pages, int stride) {
    checkArgument(pages >= 0, "negative page count %s", pages);
    return pages * slotsPerPage(stride);
  }

  /** Returns the number of slots of a given stride that fit in a page. */
  public static int slotsPerPage(int stride) {
    checkStride(stride);
    return PAGE_BYTES / stride;
  }

  private static void checkStride(int stride) {
    checkArgument(
        stride > 0 && PAGE_BYTES % stride == 0,
        "stride %s must divide page size %s",
        stride,
        PAGE_BYTES);
  }
}

// End Pages.java
