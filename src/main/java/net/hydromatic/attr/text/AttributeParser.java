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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.attr.text.Parsers.hexValue;
import static net.hydromatic.attr.text.Parsers.isBlank;

import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayOutputStream;
import java.util.Map;
import net.hydromatic.attr.value.Attribute;
import net.hydromatic.attr.value.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an {@link Attribute} from text.
 *
 * <p>Accepts the text that {@link AttributeWriter} produces, plus blanks
 * (space, tab, carriage return, line feed) between tokens, hexadecimal
 * integers such as {@code 0xFF}, negative integers, and strings in double
 * quotes. Strings have no escapes; a string ends at the next occurrence of
 * its opening quote.
 *
 * <p>A dictionary whose "Type" is the service type (see {@link
 * Prop#SERVICE_TYPE}) is replaced by a reference to the service that the
 * {@link Registry} returns for its "ModuleName".
 *
 * <p>A parser reads one text and is not thread-safe.
 */
public class AttributeParser {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AttributeParser.class);

  private final String text;
  private final Registry registry;
  private final int maxDepth;
  private final boolean resolveReferences;
  private final String serviceType;

  /** Offset of the next character to read. */
  private int i;
  private int depth;

  /** Creates a parser. */
  public AttributeParser(
      String text, Registry registry, Map<Prop, Object> props) {
    this.text = requireNonNull(text, "text");
    this.registry = requireNonNull(registry, "registry");
    this.maxDepth = Prop.MAX_DEPTH.intValue(props);
    this.resolveReferences = Prop.RESOLVE_REFERENCES.booleanValue(props);
    this.serviceType = Prop.SERVICE_TYPE.stringValue(props);
  }

  /** Parses text that contains no service references. */
  public static Attribute parse(String text) {
    return parse(text, Registries.empty());
  }

  /** Parses text, resolving service references using a registry. */
  public static Attribute parse(String text, Registry registry) {
    return parse(text, registry, ImmutableMap.of());
  }

  /** Parses text with the given properties. */
  public static Attribute parse(
      String text, Registry registry, Map<Prop, Object> props) {
    return new AttributeParser(text, registry, props).parse();
  }

  /**
   * Parses the whole text as a single value.
   *
   * @throws AttributeParseException if the text is not valid, or if a value
   *     is followed by anything other than blanks
   */
  public Attribute parse() {
    i = 0;
    depth = 0;
    final Attribute a = new Attribute();
    parseValue(a);
    skipBlanks();
    if (i < text.length()) {
      throw error(i, "unexpected '" + text.charAt(i) + "' after value");
    }
    return a;
  }

  /** Parses a value into {@code out}, replacing its previous contents. */
  private void parseValue(Attribute out) {
    skipBlanks();
    if (i >= text.length()) {
      throw error(i, "unexpected end of input; expected a value");
    }
    switch (text.charAt(i)) {
      case '\'':
      case '"':
        out.makeString(parseString());
        return;
      case '[':
        parseList(out);
        return;
      case '{':
        parseDict(out);
        return;
      case '(':
        parseData(out);
        return;
      default:
        parseScalar(out);
    }
  }

  private String parseString() {
    final int start = i;
    final char quote = text.charAt(i++);
    final int end = text.indexOf(quote, i);
    if (end < 0) {
      throw error(start, "unterminated string");
    }
    final String s = text.substring(i, end);
    i = end + 1;
    return s;
  }

  private void parseList(Attribute out) {
    final int start = i++;
    enter(start);
    out.makeList(0);
    skipBlanks();
    if (peek() == ']') {
      ++i;
    } else {
      for (;;) {
        skipBlanks();
        checkNotEnd(start, "list");
        final int n = out.size();
        out.listResize(n + 1);
        parseValue(out.get(n));
        skipBlanks();
        checkNotEnd(start, "list");
        final char c = text.charAt(i++);
        if (c == ']') {
          break;
        }
        if (c != ',') {
          throw error(i - 1, "expected ',' or ']' but got '" + c + "'");
        }
      }
    }
    --depth;
  }

  private void parseDict(Attribute out) {
    final int start = i++;
    enter(start);
    out.makeDict();
    skipBlanks();
    if (peek() == '}') {
      ++i;
    } else {
      for (;;) {
        skipBlanks();
        checkNotEnd(start, "dictionary");
        final char q = text.charAt(i);
        if (q != '\'' && q != '"') {
          throw error(i, "expected string key but got '" + q + "'");
        }
        final String key = parseString();
        skipBlanks();
        checkNotEnd(start, "dictionary");
        if (text.charAt(i) != ':') {
          throw error(i, "expected ':' but got '" + text.charAt(i) + "'");
        }
        ++i;
        checkNotEnd(start, "dictionary");
        // A repeated key replaces the earlier value.
        parseValue(out.getOrCreate(key));
        skipBlanks();
        checkNotEnd(start, "dictionary");
        final char c = text.charAt(i++);
        if (c == '}') {
          break;
        }
        if (c != ',') {
          throw error(i - 1, "expected ',' or '}' but got '" + c + "'");
        }
      }
    }
    --depth;
    if (resolveReferences) {
      resolveReference(out, start);
    }
  }

  /** Replaces a service dictionary with a reference to the service. */
  private void resolveReference(Attribute dict, int start) {
    if (!dict.hasKey("Type")) {
      return;
    }
    final Attribute type = dict.get("Type");
    if (!type.isEqualToString(serviceType)) {
      LOGGER.debug(
          "Dictionary at {} has Type {}; leaving it as a dictionary",
          Pos.of(text, start),
          type);
      return;
    }
    final Attribute moduleName = dict.find("ModuleName");
    if (moduleName == null || !moduleName.isString()) {
      throw error(start, "service reference requires a string ModuleName");
    }
    final String name = moduleName.stringValue();
    final Service service = registry.resolve(name);
    if (service == null) {
      throw new UnresolvedReferenceException(name, Pos.of(text, start));
    }
    LOGGER.debug("Resolved service reference '{}'", name);
    dict.makeRef(service);
  }

  private void parseData(Attribute out) {
    final int start = i++;
    enter(start);
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    skipBlanks();
    if (peek() == ')') {
      ++i;
    } else {
      for (;;) {
        skipBlanks();
        bytes.write(hexByte(start));
        skipBlanks();
        checkNotEnd(start, "data");
        final char c = text.charAt(i++);
        if (c == ')') {
          break;
        }
        if (c != ',') {
          throw error(i - 1, "expected ',' or ')' but got '" + c + "'");
        }
      }
    }
    --depth;
    final byte[] b = bytes.toByteArray();
    out.makeData(b.length, b);
  }

  /** Reads exactly two hexadecimal digits. */
  private int hexByte(int start) {
    int value = 0;
    for (int k = 0; k < 2; k++) {
      checkNotEnd(start, "data");
      final char c = text.charAt(i);
      final int v = hexValue(c);
      if (v < 0) {
        throw error(i, "invalid hex digit '" + c + "'");
      }
      value = value * 16 + v;
      ++i;
    }
    return value;
  }

  private void parseScalar(Attribute out) {
    final int start = i;
    if (text.startsWith("None", i)) {
      i += 4;
      out.makeNil();
    } else if (text.startsWith("true", i)) {
      i += 4;
      out.makeBoolean(true);
    } else if (text.startsWith("false", i)) {
      i += 5;
      out.makeBoolean(false);
    } else if (text.startsWith("NaN", i)) {
      i += 3;
      out.makeFloat(Double.NaN);
    } else if (text.startsWith("Infinity", i)) {
      i += 8;
      out.makeFloat(Double.POSITIVE_INFINITY);
    } else if (text.startsWith("-Infinity", i)) {
      i += 9;
      out.makeFloat(Double.NEGATIVE_INFINITY);
    } else if (text.startsWith("0x", i) || text.startsWith("0X", i)) {
      i += 2;
      final int digits = i;
      while (i < text.length() && hexValue(text.charAt(i)) >= 0) {
        ++i;
      }
      if (i == digits) {
        throw error(start, "expected hex digits after '0x'");
      }
      try {
        out.makeUInt64(Long.parseUnsignedLong(text.substring(digits, i), 16));
      } catch (NumberFormatException e) {
        throw error(start, "integer out of range");
      }
    } else {
      parseNumber(out, start);
    }
  }

  private void parseNumber(Attribute out, int start) {
    final boolean negative = text.charAt(i) == '-';
    if (negative) {
      ++i;
    }
    if (!isDigit(peek())) {
      throw error(start, "unexpected '" + text.charAt(start) + "'");
    }
    skipDigits();
    if (peek() == '.') {
      ++i;
      if (!isDigit(peek())) {
        throw error(i, "expected digit after '.'");
      }
      skipDigits();
      out.makeFloat(Double.parseDouble(text.substring(start, i)));
      return;
    }
    final String s = text.substring(start, i);
    try {
      if (negative) {
        out.makeInt64(Long.parseLong(s));
      } else {
        out.makeUInt64(Long.parseUnsignedLong(s));
      }
    } catch (NumberFormatException e) {
      throw error(start, "integer out of range: " + s);
    }
  }

  private void skipDigits() {
    while (isDigit(peek())) {
      ++i;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Returns the next character, or 0 at the end of input. */
  private char peek() {
    return i < text.length() ? text.charAt(i) : 0;
  }

  private void skipBlanks() {
    while (i < text.length() && isBlank(text.charAt(i))) {
      ++i;
    }
  }

  private void enter(int start) {
    if (++depth > maxDepth) {
      throw error(start, "nesting is deeper than " + maxDepth);
    }
  }

  private void checkNotEnd(int start, String what) {
    if (i >= text.length()) {
      throw error(start, "unterminated " + what);
    }
  }

  private AttributeParseException error(int offset, String message) {
    return new AttributeParseException(message, Pos.of(text, offset));
  }
}

// End AttributeParser.java
