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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Position of a character in the text being parsed. */
public class Pos {
  /** Zero-based offset of the character in the text. */
  public final int offset;
  /** One-based line number. */
  public final int line;
  /** One-based column number. */
  public final int column;

  /** Creates a Pos. */
  public Pos(int offset, int line, int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /**
   * Creates a Pos from an offset in a string, computing its line and column.
   * The offset may equal the length of the string, which denotes the end of
   * input.
   */
  public static Pos of(String text, int offset) {
    checkArgument(
        offset >= 0 && offset <= text.length(),
        "offset %s out of range",
        offset);
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new Pos(offset, line, offset - lineStart + 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, line, column);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.offset == ((Pos) o).offset
            && this.line == ((Pos) o).line
            && this.column == ((Pos) o).column;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Appends a description, such as "1.5" for line 1, column 5. */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(line).append('.').append(column);
  }
}

// End Pos.java
