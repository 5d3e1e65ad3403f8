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
package net.hydromatic.attr.text;

/** Utilities for reading and writing attribute text. */
public final class Parsers {
  private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

  private Parsers() {}

  /**
   * Returns whether a character is skipped between tokens: space, tab,
   * carriage return or line feed.
   */
  public static boolean isBlank(char c) {
    switch (c) {
      case ' ':
      case '\t':
      case '\r':
      case '\n':
        return true;
      default:
        return false;
    }
  }

  /** Returns the value of a hexadecimal digit (either case), or -1. */
  public static int hexValue(char c) {
    if (c >= '0' && c <= '9') {
      return c - '0';
    }
    if (c >= 'A' && c <= 'F') {
      return c - 'A' + 10;
    }
    if (c >= 'a' && c <= 'f') {
      return c - 'a' + 10;
    }
    return -1;
  }

  /** Appends a byte as two upper-case hexadecimal digits. */
  public static StringBuilder appendHexByte(StringBuilder buf, byte b) {
    return buf.append(HEX_DIGITS[(b >> 4) & 0xF]).append(HEX_DIGITS[b & 0xF]);
  }

  /**
   * Returns the quote character to enclose a string in.
   *
   * <p>Strings are not escaped, so a string is written in single quotes
   * unless it contains a single quote, in which case double quotes are used.
   *
   * @throws IllegalArgumentException if the string contains both
   */
  public static char quoteFor(String s) {
    if (s.indexOf('\'') < 0) {
      return '\'';
    }
    if (s.indexOf('"') < 0) {
      return '"';
    }
    throw new IllegalArgumentException(
        "string contains both kinds of quote: " + s);
  }

  /** Appends a string enclosed in quotes. */
  public static StringBuilder appendQuoted(StringBuilder buf, String s) {
    final char quote = quoteFor(s);
    return buf.append(quote).append(s).append(quote);
  }
}

// End Parsers.java
