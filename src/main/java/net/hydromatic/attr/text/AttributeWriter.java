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
import static net.hydromatic.attr.text.Parsers.appendHexByte;
import static net.hydromatic.attr.text.Parsers.appendQuoted;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.attr.value.Attribute;
import net.hydromatic.attr.value.AttributeKindException;
import net.hydromatic.attr.value.Face;
import net.hydromatic.attr.value.Kind;
import net.hydromatic.attr.value.Service;

/**
 * Converts an {@link Attribute} to text.
 *
 * <p>The text format is:
 *
 * <ul>
 *   <li>nil: {@code None}
 *   <li>boolean: {@code true}, {@code false}
 *   <li>integer: unsigned decimal, such as {@code 42}
 *   <li>floating point: fixed decimals, such as {@code 1.5000}
 *   <li>string: {@code 'abc'}
 *   <li>data: upper-case hexadecimal bytes, such as {@code (0A,FF)}
 *   <li>list: {@code [1,2,3]}
 *   <li>dictionary: {@code {'a':1,'b':'x'}}
 *   <li>service reference: {@code {'Type':'IService','ModuleName':'name'}}
 * </ul>
 *
 * <p>There is no white space between tokens. A writer has no mutable state
 * and may be shared between threads.
 */
public class AttributeWriter {
  private static final AttributeWriter DEFAULT =
      new AttributeWriter(ImmutableMap.of());

  private final String floatFormat;

  /** Creates a writer with the given properties. */
  public AttributeWriter(Map<Prop, Object> props) {
    final int floatDecimals = Prop.FLOAT_DECIMALS.intValue(props);
    checkArgument(
        floatDecimals >= 1,
        "floatDecimals must be at least 1: %s",
        floatDecimals);
    this.floatFormat = "%." + floatDecimals + "f";
  }

  /** Writes an attribute using default properties. */
  public static String write(Attribute a) {
    return DEFAULT.toString(a);
  }

  /** Writes an attribute. */
  public String toString(Attribute a) {
    return append(new StringBuilder(), a).toString();
  }

  /** Appends the text of an attribute to a builder. */
  public StringBuilder append(StringBuilder buf, Attribute a) {
    switch (a.kind()) {
      case NIL:
        return buf.append("None");
      case BOOLEAN:
        return buf.append(a.toBoolean());
      case INT64:
        // Integers are written unsigned; a negative INT64 reads back as
        // UINT64 with the same bits.
        return buf.append(Long.toUnsignedString(a.toInt64()));
      case UINT64:
        return buf.append(Long.toUnsignedString(a.toUInt64()));
      case FLOATING:
        return appendFloat(buf, a.toFloat());
      case STRING:
        return appendQuoted(buf, a.stringValue());
      case DATA:
        buf.append('(');
        for (int i = 0; i < a.size(); i++) {
          if (i > 0) {
            buf.append(',');
          }
          appendHexByte(buf, a.byteAt(i));
        }
        return buf.append(')');
      case LIST:
        buf.append('[');
        for (int i = 0; i < a.size(); i++) {
          if (i > 0) {
            buf.append(',');
          }
          append(buf, a.get(i));
        }
        return buf.append(']');
      case DICT:
        buf.append('{');
        for (int i = 0; i < a.size(); i++) {
          if (i > 0) {
            buf.append(',');
          }
          appendQuoted(buf, a.dictKey(i)).append(':');
          append(buf, a.dictValue(i));
        }
        return buf.append('}');
      case EXTERNAL_REF:
        return appendRef(buf, a.toRef());
      default:
        throw new AssertionError(a.kind());
    }
  }

  private StringBuilder appendFloat(StringBuilder buf, double d) {
    if (Double.isNaN(d)) {
      return buf.append("NaN");
    }
    if (Double.isInfinite(d)) {
      return buf.append(d > 0 ? "Infinity" : "-Infinity");
    }
    return buf.append(String.format(Locale.ROOT, floatFormat, d));
  }

  private static StringBuilder appendRef(StringBuilder buf, Face face) {
    if (!(face instanceof Service)) {
      throw new AttributeKindException(
          "cannot write reference to " + face.faceName() + " interface",
          Kind.EXTERNAL_REF);
    }
    final Service service = (Service) face;
    buf.append("{'Type':");
    appendQuoted(buf, service.faceName());
    buf.append(",'ModuleName':");
    appendQuoted(buf, service.objectName());
    return buf.append('}');
  }
}

// End AttributeWriter.java
