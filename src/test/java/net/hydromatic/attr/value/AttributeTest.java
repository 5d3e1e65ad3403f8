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

import static net.hydromatic.attr.Matchers.hasText;
import static net.hydromatic.attr.Matchers.isKind;
import static net.hydromatic.attr.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Attribute} scalars, strings, data and copying. */
public class AttributeTest {
  @Test
  void testNil() {
    final Attribute a = new Attribute();
    assertThat(a.isNil(), is(true));
    assertThat(a, isKind(Kind.NIL, 0));
    assertThat(a, hasText("None"));
    assertThat(Attribute.ofString(null).isNil(), is(true));
    assertThat(Attribute.nil(), is(a));
  }

  @Test
  void testScalars() {
    final Attribute a = Attribute.ofBoolean(true);
    assertThat(a.toBoolean(), is(true));
    assertThat(a, hasText("true"));

    // Each make method replaces the previous value and kind.
    a.makeInt64(-5);
    assertThat(a, isKind(Kind.INT64, 0));
    assertThat(a.toInt64(), is(-5L));
    assertThat(a.toInt(), is(-5));
    assertThat(a.isInteger(), is(true));

    a.makeUInt64(-1L);
    assertThat(a.isUInt64(), is(true));
    assertThat(a, hasText("18446744073709551615"));

    a.makeFloat(2.5);
    assertThat(a.toFloat(), is(2.5));
    assertThat(a, hasText("2.5000"));
    assertThat(a.isInteger(), is(false));

    a.makeNil();
    assertThat(a.isNil(), is(true));
  }

  @Test
  void testWrongKind() {
    final Attribute a = Attribute.ofString("abc");
    final AttributeKindException e =
        assertThrows(AttributeKindException.class, a::toBoolean);
    assertThat(e.kind(), is(Kind.STRING));
    assertThat(e,
        throwsA("toBoolean requires BOOLEAN but attribute is STRING"));

    assertThrows(AttributeKindException.class, a::toInt64);
    assertThrows(AttributeKindException.class, a::toFloat);
    assertThrows(AttributeKindException.class, a::toRef);
    assertThrows(AttributeKindException.class, () -> a.get(0));
    assertThrows(AttributeKindException.class, () -> a.listAdd(a));
    assertThrows(AttributeKindException.class, () -> a.find("x"));
    assertThrows(AttributeKindException.class, () -> a.byteAt(0));
    assertThrows(
        AttributeKindException.class, () -> Attribute.nil().stringValue());

    // Kind errors are IllegalStateExceptions.
    assertThrows(IllegalStateException.class, a::data);
  }

  @Test
  void testString() {
    final Attribute a = Attribute.ofString("héllo");
    assertThat(a.stringValue(), is("héllo"));
    // Size is the length in UTF-8 bytes.
    assertThat(a, isKind(Kind.STRING, 6));
    assertThat(a.isEqualToString("héllo"), is(true));
    assertThat(a.isEqualToString("hello"), is(false));
    assertThat(Attribute.ofInt64(1).isEqualToString("1"), is(false));
    assertThat(a, hasText("'héllo'"));

    a.makeString("");
    assertThat(a, isKind(Kind.STRING, 0));
    assertThat(a, hasText("''"));
  }

  @Test
  void testData() {
    final Attribute inline = Attribute.ofData(new byte[] {0x0A, (byte) 0xFF});
    assertThat(inline, isKind(Kind.DATA, 2));
    assertThat(inline.byteAt(1), is((byte) 0xFF));
    assertThat(inline, hasText("(0A,FF)"));
    inline.setByte(0, (byte) 0x7F);
    assertThat(inline, hasText("(7F,FF)"));
    assertThrows(IndexOutOfBoundsException.class, () -> inline.byteAt(2));

    final byte[] bytes = new byte[Attribute.INLINE_BYTES + 3];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) (i * 17);
    }
    final Attribute large = Attribute.ofData(bytes);
    assertThat(large, isKind(Kind.DATA, 11));
    assertThat(large.data(), is(bytes));
    // The attribute has its own copy.
    bytes[0] = 99;
    assertThat(large.byteAt(0), is((byte) 0));
    assertThat(large, hasText("(00,11,22,33,44,55,66,77,88,99,AA)"));

    final Attribute zeros = new Attribute().makeData(3);
    assertThat(zeros, hasText("(00,00,00)"));
    assertThat(new Attribute().makeData(0), hasText("()"));

    // Only the first n bytes are used.
    assertThat(new Attribute().makeData(1, new byte[] {1, 2}),
        hasText("(01)"));
    assertThrows(IllegalArgumentException.class,
        () -> new Attribute().makeData(3, new byte[2]));

    // Data is compared by content, whether inline or not.
    assertThat(Attribute.ofData(new byte[] {1, 2}),
        is(Attribute.ofData(new byte[] {1, 2})));
    assertThat(large, is(large.deepCopy()));
  }

  @Test
  void testReference() {
    final Service service = () -> "logger";
    final Attribute a = new Attribute(service);
    assertThat(a.isRef(), is(true));
    assertThat(a.toRef(), sameInstance(service));
    assertThat(a.toRef().faceName(), is("IService"));
    assertThat(a, hasText("{'Type':'IService','ModuleName':'logger'}"));

    // A copy refers to the same object; references are equal by identity.
    final Attribute copy = a.deepCopy();
    assertThat(copy.toRef(), sameInstance(service));
    assertThat(copy, is(a));
    assertThat(new Attribute((Service) () -> "logger"), not(a));

    // An object that is not a service has no text representation.
    final Face face = () -> "IOther";
    assertThrows(AttributeKindException.class,
        () -> new Attribute(face).toConfig());
  }

  @Test
  void testDeepCopy() {
    final Attribute list =
        Attribute.ofList(Attribute.ofInt64(1), Attribute.ofString("x"));
    final Attribute dict = Attribute.ofDict().dictPut("list", list);

    final Attribute copy = dict.deepCopy();
    assertThat(copy, is(dict));
    assertThat(copy.hashCode(), is(dict.hashCode()));

    // Changing the copy does not change the original.
    copy.get("list").get(0).makeInt64(2);
    assertThat(copy, hasText("{'list':[2,'x']}"));
    assertThat(dict, hasText("{'list':[1,'x']}"));
    assertThat(copy, not(dict));

    // The value stored by dictPut is a copy too.
    list.listAdd(Attribute.nil());
    assertThat(dict, hasText("{'list':[1,'x']}"));
  }

  @Test
  void testCloneFrom() {
    final Attribute a = Attribute.ofString("a");
    final Attribute b = Attribute.ofList(Attribute.ofBoolean(false));
    a.cloneFrom(b);
    assertThat(a, is(b));
    assertThat(a.kind(), is(Kind.LIST));

    // Self-assignment does nothing.
    a.cloneFrom(a);
    assertThat(a, hasText("[false]"));

    // Assigning an element to its container.
    final Attribute nested =
        Attribute.ofList(Attribute.ofList(Attribute.ofInt64(7)));
    nested.cloneFrom(nested.get(0));
    assertThat(nested, hasText("[7]"));
  }

  @Test
  void testRelease() {
    final Attribute list = Attribute.ofList(Attribute.ofList(
        Attribute.ofInt64(1)));
    final Attribute inner = list.get(0);
    list.release();
    assertThat(list.isNil(), is(true));
    assertThat(list.size(), is(0));
    // Elements are released too.
    assertThat(inner.isNil(), is(true));

    // Releasing twice is harmless.
    list.release();
    assertThat(list.isNil(), is(true));
  }

  @Test
  void testEquals() {
    assertThat(Attribute.ofInt64(1), is(Attribute.ofInt64(1)));
    // Kinds must match, even if the bits are the same.
    assertThat(Attribute.ofInt64(1), not(Attribute.ofUInt64(1)));
    assertThat(Attribute.ofString("1"), not(Attribute.ofInt64(1)));
    assertThat(Attribute.ofList(), is(Attribute.ofList()));
    assertThat(Attribute.ofList(), not(Attribute.ofDict()));
    assertThat(Attribute.ofDict().dictPut("a", Attribute.ofInt64(1)),
        is(Attribute.ofDict().dictPut("a", Attribute.ofInt64(1))));
    // Dictionaries are ordered.
    assertThat(
        Attribute.ofDict()
            .dictPut("a", Attribute.nil())
            .dictPut("b", Attribute.nil()),
        not(
            Attribute.ofDict()
                .dictPut("b", Attribute.nil())
                .dictPut("a", Attribute.nil())));
  }
}

// End AttributeTest.java
