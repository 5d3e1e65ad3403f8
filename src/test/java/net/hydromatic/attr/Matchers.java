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
package net.hydromatic.attr;

import net.hydromatic.attr.value.Attribute;
import net.hydromatic.attr.value.Kind;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for JUnit tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a Throwable whose {@code toString()} contains a message. */
  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  /** Matches an attribute whose text representation is {@code text}. */
  public static Matcher<Attribute> hasText(String text) {
    return new CustomTypeSafeMatcher<Attribute>("attribute " + text) {
      @Override protected boolean matchesSafely(Attribute item) {
        return item.toString().equals(text);
      }
    };
  }

  /** Matches an attribute of a given kind and size. */
  public static Matcher<Attribute> isKind(Kind kind, int size) {
    return new CustomTypeSafeMatcher<Attribute>(
        "attribute of kind " + kind + " and size " + size) {
      @Override protected boolean matchesSafely(Attribute item) {
        return item.kind() == kind && item.size() == size;
      }
    };
  }
}

// End Matchers.java
