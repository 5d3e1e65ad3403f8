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

/** Kind of an {@link Attribute}. */
public enum Kind {
  /** No value. A new attribute, and one that has been released, is nil. */
  NIL,
  BOOLEAN,
  /** Signed 64-bit integer. */
  INT64,
  /** Unsigned 64-bit integer. */
  UINT64,
  /** Double-precision floating point. */
  FLOATING,
  STRING,
  /** Sequence of bytes. */
  DATA,
  /** Ordered list of attributes. */
  LIST,
  /** Dictionary of string keys to attributes, in insertion order. */
  DICT,
  /** Reference to a live object that the attribute does not own. */
  EXTERNAL_REF;

  /** Returns whether attributes of this kind contain other attributes. */
  public boolean isContainer() {
    return this == LIST || this == DICT;
  }

  /** Returns whether attributes of this kind hold a 64-bit integer. */
  public boolean isInteger() {
    return this == INT64 || this == UINT64;
  }
}

// End Kind.java
