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

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Compares two strings by code point.
   *
   * <p>This is the same order as comparing the UTF-8 encodings of the strings
   * byte by byte, treating bytes as unsigned. It differs from {@link
   * String#compareTo} only for strings containing supplementary characters.
   */
  public static int compareCodePoints(String s1, String s2) {
    final int n1 = s1.length();
    final int n2 = s2.length();
    int i = 0;
    while (i < n1 && i < n2) {
      final int c1 = s1.codePointAt(i);
      final int c2 = s2.codePointAt(i);
      if (c1 != c2) {
        return Integer.compare(c1, c2);
      }
      i += Character.charCount(c1);
    }
    return Integer.compare(n1 - i, n2 - i);
  }
}

// End Static.java
