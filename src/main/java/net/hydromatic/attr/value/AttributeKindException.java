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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when an operation is applied to an attribute of the wrong kind; for
 * example, indexing a string, or reading the bytes of a list.
 */
public class AttributeKindException extends IllegalStateException {
  private final Kind kind;

  public AttributeKindException(String message, Kind kind) {
    super(message);
    this.kind = requireNonNull(kind);
  }

  /** Returns the kind of the attribute that the operation rejected. */
  public Kind kind() {
    return kind;
  }
}

// End AttributeKindException.java
