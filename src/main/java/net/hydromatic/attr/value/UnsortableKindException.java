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

/**
 * Thrown when a list cannot be sorted because one of its elements (or the
 * field of an element that is used as a sort key) is not a string or an
 * integer.
 */
public class UnsortableKindException extends AttributeKindException {
  private final int index;

  public UnsortableKindException(String message, Kind kind, int index) {
    super(message, kind);
    this.index = index;
  }

  /** Returns the position of the offending element in the list. */
  public int index() {
    return index;
  }
}

// End UnsortableKindException.java
