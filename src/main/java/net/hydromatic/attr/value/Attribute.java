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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import net.hydromatic.attr.text.AttributeParser;
import net.hydromatic.attr.text.AttributeWriter;
import net.hydromatic.attr.text.Registry;
import net.hydromatic.attr.util.PagedArray;
import net.hydromatic.attr.util.Pages;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A self-describing value.
 *
 * <p>An attribute has a {@link Kind} and, depending on the kind, a payload:
 *
 * <ul>
 *   <li>{@link Kind#NIL}: nothing;
 *   <li>{@link Kind#BOOLEAN}, {@link Kind#INT64}, {@link Kind#UINT64},
 *       {@link Kind#FLOATING}: a 64-bit word;
 *   <li>{@link Kind#STRING}: a string;
 *   <li>{@link Kind#DATA}: bytes, packed into the 64-bit word if there are no
 *       more than {@link #INLINE_BYTES}, otherwise in an array;
 *   <li>{@link Kind#LIST}: a list of attributes;
 *   <li>{@link Kind#DICT}: a list of (string key, attribute) pairs in
 *       insertion order;
 *   <li>{@link Kind#EXTERNAL_REF}: a reference to a {@link Face}.
 * </ul>
 *
 * <p>Attributes are mutable. Every {@code make} method releases the previous
 * payload before establishing the new one. An attribute exclusively owns its
 * elements: values stored into a list or dictionary are deep-copied, and
 * {@link #get(int)} returns the stored element itself, so changes made
 * through it are visible in the container.
 *
 * <p>Lists and dictionaries allocate storage in pages; see {@link Pages}.
 *
 * <p>Attributes are not thread-safe.
 */
public class Attribute {
  /** Maximum length of data that is stored without a separate array. */
  public static final int INLINE_BYTES = 8;

  private Kind kind = Kind.NIL;

  /** Byte length for {@code STRING} and {@code DATA}, otherwise 0. */
  private int size;

  /** Scalar payload, and inline {@code DATA}. */
  private long bits;

  /**
   * Object payload: a {@link String}, a {@code byte[]}, a {@link PagedArray}
   * of elements or of entries, or a {@link Face}.
   */
  private @Nullable Object payload;

  /** Creates a nil attribute. */
  public Attribute() {}

  /** Creates an attribute that refers to a live object. */
  public Attribute(Face face) {
    makeRef(face);
  }

  /** Creates a nil attribute. */
  public static Attribute nil() {
    return new Attribute();
  }

  /** Creates a boolean attribute. */
  public static Attribute ofBoolean(boolean b) {
    return new Attribute().makeBoolean(b);
  }

  /** Creates a signed 64-bit integer attribute. */
  public static Attribute ofInt64(long i) {
    return new Attribute().makeInt64(i);
  }

  /** Creates an unsigned 64-bit integer attribute. */
  public static Attribute ofUInt64(long u) {
    return new Attribute().makeUInt64(u);
  }

  /** Creates a floating-point attribute. */
  public static Attribute ofFloat(double f) {
    return new Attribute().makeFloat(f);
  }

  /** Creates a string attribute, or a nil attribute if {@code s} is null. */
  public static Attribute ofString(@Nullable String s) {
    return new Attribute().makeString(s);
  }

  /** Creates a data attribute containing a copy of {@code bytes}. */
  public static Attribute ofData(byte[] bytes) {
    return new Attribute().makeData(bytes.length, bytes);
  }

  /** Creates an empty list attribute. */
  public static Attribute ofList() {
    return new Attribute().makeList(0);
  }

  /** Creates a list attribute containing copies of the given attributes. */
  public static Attribute ofList(Attribute... elements) {
    final Attribute list = new Attribute().makeList(0);
    list.list().reserve(elements.length);
    for (Attribute element : elements) {
      list.listAdd(element);
    }
    return list;
  }

  /** Creates an empty dictionary attribute. */
  public static Attribute ofDict() {
    return new Attribute().makeDict();
  }

  /** Creates an attribute by parsing its text representation. */
  public static Attribute fromText(String text) {
    return AttributeParser.parse(text);
  }

  // -- Variant core ---------------------------------------------------------

  /** Returns the kind of this attribute. */
  public Kind kind() {
    return kind;
  }

  /**
   * Returns the size of this attribute: the number of UTF-8 bytes in a
   * string, of bytes in data, of elements in a list, or of pairs in a
   * dictionary; 0 for other kinds.
   */
  public int size() {
    switch (kind) {
      case STRING:
      case DATA:
        return size;
      case LIST:
        return list().size();
      case DICT:
        return dict().size();
      default:
        return 0;
    }
  }

  /** Makes this attribute nil. */
  @CanIgnoreReturnValue
  public Attribute makeNil() {
    release();
    return this;
  }

  /** Makes this attribute a boolean. */
  @CanIgnoreReturnValue
  public Attribute makeBoolean(boolean b) {
    release();
    kind = Kind.BOOLEAN;
    bits = b ? 1L : 0L;
    return this;
  }

  /** Makes this attribute a signed 64-bit integer. */
  @CanIgnoreReturnValue
  public Attribute makeInt64(long i) {
    release();
    kind = Kind.INT64;
    bits = i;
    return this;
  }

  /**
   * Makes this attribute an unsigned 64-bit integer. The value is the
   * two's-complement bits of {@code u}; for example, -1 represents 2^64 - 1.
   */
  @CanIgnoreReturnValue
  public Attribute makeUInt64(long u) {
    release();
    kind = Kind.UINT64;
    bits = u;
    return this;
  }

  /** Makes this attribute a floating-point number. */
  @CanIgnoreReturnValue
  public Attribute makeFloat(double f) {
    release();
    kind = Kind.FLOATING;
    bits = Double.doubleToRawLongBits(f);
    return this;
  }

  /** Makes this attribute a string, or nil if {@code s} is null. */
  @CanIgnoreReturnValue
  public Attribute makeString(@Nullable String s) {
    release();
    if (s != null) {
      kind = Kind.STRING;
      size = s.getBytes(StandardCharsets.UTF_8).length;
      payload = s;
    }
    return this;
  }

  /** Makes this attribute data consisting of {@code n} zero bytes. */
  @CanIgnoreReturnValue
  public Attribute makeData(int n) {
    checkArgument(n >= 0, "negative size %s", n);
    release();
    kind = Kind.DATA;
    size = n;
    if (n > INLINE_BYTES) {
      payload = new byte[n];
    }
    return this;
  }

  /** Makes this attribute data consisting of the first {@code n} bytes. */
  @CanIgnoreReturnValue
  public Attribute makeData(int n, byte[] bytes) {
    checkArgument(n >= 0, "negative size %s", n);
    checkArgument(
        n <= bytes.length, "size %s exceeds %s bytes", n, bytes.length);
    release();
    kind = Kind.DATA;
    size = n;
    if (n > INLINE_BYTES) {
      payload = Arrays.copyOf(bytes, n);
    } else {
      for (int i = 0; i < n; i++) {
        bits |= (bytes[i] & 0xFFL) << (i * 8);
      }
    }
    return this;
  }

  /** Makes this attribute a list of {@code n} nil elements. */
  @CanIgnoreReturnValue
  public Attribute makeList(int n) {
    checkArgument(n >= 0, "negative size %s", n);
    release();
    final PagedArray<Attribute> list = new PagedArray<>(Pages.ATTRIBUTE_STRIDE);
    if (n > 0) {
      list.resize(n, Attribute::new, Attribute::release);
    }
    kind = Kind.LIST;
    payload = list;
    return this;
  }

  /** Makes this attribute an empty dictionary. */
  @CanIgnoreReturnValue
  public Attribute makeDict() {
    release();
    kind = Kind.DICT;
    payload = new PagedArray<Entry>(Pages.PAIR_STRIDE);
    return this;
  }

  /** Makes this attribute a reference to a live object. */
  @CanIgnoreReturnValue
  public Attribute makeRef(Face face) {
    requireNonNull(face, "face");
    release();
    kind = Kind.EXTERNAL_REF;
    payload = face;
    return this;
  }

  /**
   * Releases this attribute's payload and makes it nil.
   *
   * <p>Elements of a list or dictionary are released too, so a reference to
   * an element obtained earlier from {@link #get(int)} now sees a nil value.
   */
  public void release() {
    switch (kind) {
      case LIST:
        list().clear(Attribute::release);
        break;
      case DICT:
        dict().clear(Entry::release);
        break;
      default:
        break;
    }
    kind = Kind.NIL;
    size = 0;
    bits = 0L;
    payload = null;
  }

  /**
   * Makes this attribute a deep copy of another.
   *
   * <p>Lists and dictionaries are copied element by element; strings and data
   * are copied; a reference is copied but the object it refers to is not.
   * Copying an attribute onto itself does nothing; {@code other} may be an
   * element of this attribute.
   */
  @CanIgnoreReturnValue
  public Attribute cloneFrom(Attribute other) {
    if (other != this) {
      final Attribute copy = other.deepCopy();
      release();
      moveFrom(copy);
    }
    return this;
  }

  /** Returns a deep copy of this attribute. */
  public Attribute deepCopy() {
    final Attribute copy = new Attribute();
    copy.kind = kind;
    copy.size = size;
    copy.bits = bits;
    switch (kind) {
      case DATA:
        if (payload != null) {
          copy.payload = ((byte[]) payload).clone();
        }
        break;
      case LIST:
        final PagedArray<Attribute> list = list();
        final PagedArray<Attribute> listCopy =
            new PagedArray<>(Pages.ATTRIBUTE_STRIDE);
        listCopy.reserve(list.size());
        list.forEach(e -> listCopy.add(e.deepCopy()));
        copy.payload = listCopy;
        break;
      case DICT:
        final PagedArray<Entry> dict = dict();
        final PagedArray<Entry> dictCopy = new PagedArray<>(Pages.PAIR_STRIDE);
        dictCopy.reserve(dict.size());
        dict.forEach(e -> dictCopy.add(e.deepCopy()));
        copy.payload = dictCopy;
        break;
      default:
        // Strings are immutable; a referenced object is shared.
        copy.payload = payload;
        break;
    }
    return copy;
  }

  /** Takes the payload of an attribute that is about to be discarded. */
  private void moveFrom(Attribute other) {
    kind = other.kind;
    size = other.size;
    bits = other.bits;
    payload = other.payload;
    other.kind = Kind.NIL;
    other.size = 0;
    other.bits = 0L;
    other.payload = null;
  }

  public boolean isNil() {
    return kind == Kind.NIL;
  }

  public boolean isBoolean() {
    return kind == Kind.BOOLEAN;
  }

  public boolean isInt64() {
    return kind == Kind.INT64;
  }

  public boolean isUInt64() {
    return kind == Kind.UINT64;
  }

  /** Returns whether this attribute is a signed or unsigned integer. */
  public boolean isInteger() {
    return kind.isInteger();
  }

  public boolean isFloating() {
    return kind == Kind.FLOATING;
  }

  public boolean isString() {
    return kind == Kind.STRING;
  }

  public boolean isData() {
    return kind == Kind.DATA;
  }

  public boolean isList() {
    return kind == Kind.LIST;
  }

  public boolean isDict() {
    return kind == Kind.DICT;
  }

  public boolean isRef() {
    return kind == Kind.EXTERNAL_REF;
  }

  /** Returns the value of a boolean attribute. */
  public boolean toBoolean() {
    checkKind(Kind.BOOLEAN, "toBoolean");
    return bits != 0L;
  }

  /**
   * Returns the value of an integer attribute as a signed 64-bit value. An
   * unsigned attribute returns its bits unchanged.
   */
  public long toInt64() {
    checkInteger("toInt64");
    return bits;
  }

  /**
   * Returns the value of an integer attribute as an unsigned 64-bit value,
   * represented in the bits of a {@code long}.
   */
  public long toUInt64() {
    checkInteger("toUInt64");
    return bits;
  }

  /** Returns the low 32 bits of an integer attribute. */
  public int toInt() {
    checkInteger("toInt");
    return (int) bits;
  }

  /** Returns the value of a floating-point attribute. */
  public double toFloat() {
    checkKind(Kind.FLOATING, "toFloat");
    return Double.longBitsToDouble(bits);
  }

  /** Returns the value of a string attribute. */
  public String stringValue() {
    checkKind(Kind.STRING, "stringValue");
    return (String) requireNonNull(payload);
  }

  /** Returns the object that a reference attribute refers to. */
  public Face toRef() {
    checkKind(Kind.EXTERNAL_REF, "toRef");
    return (Face) requireNonNull(payload);
  }

  /** Returns whether this attribute is the string {@code s}. */
  public boolean isEqualToString(String s) {
    return kind == Kind.STRING && s.equals(payload);
  }

  /**
   * Returns the {@code idx}th element of a list, or the {@code idx}th value
   * of a dictionary.
   *
   * @throws AttributeKindException if this is not a list or dictionary
   * @throws IndexOutOfBoundsException if {@code idx} is not in range
   */
  public Attribute get(int idx) {
    switch (kind) {
      case LIST:
        return list().get(idx);
      case DICT:
        return dict().get(idx).value;
      default:
        throw new AttributeKindException(
            format("%s attribute is not indexable", kind), kind);
    }
  }

  /** Replaces the {@code idx}th element of a list or value of a dictionary. */
  @CanIgnoreReturnValue
  public Attribute set(int idx, Attribute value) {
    get(idx).cloneFrom(value);
    return this;
  }

  // -- Data -----------------------------------------------------------------

  /** Returns the {@code idx}th byte of a data attribute. */
  public byte byteAt(int idx) {
    checkKind(Kind.DATA, "byteAt");
    checkElementIndex(idx, size);
    if (size > INLINE_BYTES) {
      return ((byte[]) requireNonNull(payload))[idx];
    }
    return (byte) (bits >>> (idx * 8));
  }

  /** Sets the {@code idx}th byte of a data attribute. */
  @CanIgnoreReturnValue
  public Attribute setByte(int idx, byte b) {
    checkKind(Kind.DATA, "setByte");
    checkElementIndex(idx, size);
    if (size > INLINE_BYTES) {
      ((byte[]) requireNonNull(payload))[idx] = b;
    } else {
      final int shift = idx * 8;
      bits = bits & ~(0xFFL << shift) | (b & 0xFFL) << shift;
    }
    return this;
  }

  /** Returns a copy of the bytes of a data attribute. */
  public byte[] data() {
    checkKind(Kind.DATA, "data");
    if (size > INLINE_BYTES) {
      return ((byte[]) requireNonNull(payload)).clone();
    }
    final byte[] bytes = new byte[size];
    for (int i = 0; i < size; i++) {
      bytes[i] = (byte) (bits >>> (i * 8));
    }
    return bytes;
  }

  // -- List -----------------------------------------------------------------

  /** Appends a copy of {@code value} to a list. */
  @CanIgnoreReturnValue
  public Attribute listAdd(Attribute value) {
    return listInsertAt(list().size(), value);
  }

  /**
   * Inserts a copy of {@code value} into a list at position {@code idx},
   * moving later elements to the right.
   *
   * @throws IndexOutOfBoundsException if {@code idx} is greater than the size
   */
  @CanIgnoreReturnValue
  public Attribute listInsertAt(int idx, Attribute value) {
    final PagedArray<Attribute> list = list();
    checkPositionIndex(idx, list.size());
    list.insert(idx, value.deepCopy());
    return this;
  }

  /**
   * Removes the {@code idx}th element of a list.
   *
   * <p>Does not preserve order: unless the removed element is the last, the
   * last element moves into its place. Removing element 0 from {@code [A, B,
   * C]} gives {@code [C, B]}.
   */
  @CanIgnoreReturnValue
  public Attribute listRemoveAt(int idx) {
    list().remove(idx).release();
    return this;
  }

  /**
   * Removes the elements of a list in the range {@code [start, end)}. The
   * remaining elements keep their order.
   */
  @CanIgnoreReturnValue
  public Attribute listTrim(int start, int end) {
    list().removeRange(start, end, Attribute::release);
    return this;
  }

  /** Swaps two elements of a list. */
  @CanIgnoreReturnValue
  public Attribute listSwap(int i, int j) {
    list().swap(i, j);
    return this;
  }

  /**
   * Changes the number of elements in a list, adding nil elements or
   * releasing elements at the end.
   */
  @CanIgnoreReturnValue
  public Attribute listResize(int n) {
    list().resize(n, Attribute::new, Attribute::release);
    return this;
  }

  /**
   * Returns the number of elements (pairs, for a dictionary) that the
   * storage of a list or dictionary can hold without reallocating; 0 for
   * other kinds.
   */
  public int capacity() {
    switch (kind) {
      case LIST:
        return list().capacity();
      case DICT:
        return dict().capacity();
      default:
        return 0;
    }
  }

  /** Returns how many times a list or dictionary has grown its storage. */
  public int reallocations() {
    switch (kind) {
      case LIST:
        return list().reallocations();
      case DICT:
        return dict().reallocations();
      default:
        return 0;
    }
  }

  /**
   * Sorts the elements of a list. Elements that are strings or integers are
   * their own sort key; elements that are lists or dictionaries are sorted by
   * their first field.
   *
   * @throws UnsortableKindException if an element has no string or integer
   *     key
   */
  public void sort() {
    sort(0);
  }

  /**
   * Sorts a list whose elements are lists (or dictionaries) by the field at
   * position {@code fieldIdx} of each element.
   */
  public void sort(int fieldIdx) {
    Sorter.sort(this, Sorter.field(fieldIdx));
  }

  /** Sorts a list of dictionaries by the value of {@code key}. */
  public void sort(String key) {
    Sorter.sort(this, Sorter.key(key));
  }

  // -- Dictionary -----------------------------------------------------------

  /**
   * Returns the value of {@code key} in a dictionary.
   *
   * @throws NoSuchElementException if the key is not present
   */
  public Attribute get(String key) {
    final Attribute value = find(key);
    if (value == null) {
      throw new NoSuchElementException("key not found: " + key);
    }
    return value;
  }

  /** Returns the value of {@code key} in a dictionary, or null. */
  public @Nullable Attribute find(String key) {
    final PagedArray<Entry> dict = dict();
    final int i = indexOfKey(dict, key);
    return i < 0 ? null : dict.get(i).value;
  }

  /**
   * Returns the value of {@code key} in a dictionary, first adding the key
   * with a nil value if it is not present.
   */
  public Attribute getOrCreate(String key) {
    final PagedArray<Entry> dict = dict();
    final int i = indexOfKey(dict, key);
    if (i >= 0) {
      return dict.get(i).value;
    }
    final Entry entry = new Entry(ofString(key), new Attribute());
    dict.add(entry);
    return entry.value;
  }

  /**
   * Sets the value of {@code key} in a dictionary to a copy of {@code value}.
   * If the key is present its old value is released and the size does not
   * change; otherwise the pair is added at the end.
   */
  @CanIgnoreReturnValue
  public Attribute dictPut(String key, Attribute value) {
    getOrCreate(key).cloneFrom(value);
    return this;
  }

  /**
   * Removes {@code key} from a dictionary, preserving the order of the other
   * keys. Returns whether the key was present.
   */
  public boolean dictRemove(String key) {
    final PagedArray<Entry> dict = dict();
    final int i = indexOfKey(dict, key);
    if (i < 0) {
      return false;
    }
    dict.removeOrdered(i).release();
    return true;
  }

  /**
   * Returns whether a dictionary contains {@code key} with a value that is not
   * nil. A key whose value is nil is treated as absent.
   */
  public boolean hasKey(String key) {
    final Attribute value = find(key);
    return value != null && !value.isNil();
  }

  /** Returns the {@code idx}th key of a dictionary. */
  public String dictKey(int idx) {
    return dict().get(idx).key.stringValue();
  }

  /** Returns the {@code idx}th value of a dictionary. */
  public Attribute dictValue(int idx) {
    return dict().get(idx).value;
  }

  /** Calls a consumer with each key and value of a dictionary, in order. */
  public void forEachEntry(BiConsumer<String, Attribute> consumer) {
    dict().forEach(e -> consumer.accept(e.key.stringValue(), e.value));
  }

  private static int indexOfKey(PagedArray<Entry> dict, String key) {
    for (int i = 0; i < dict.size(); i++) {
      if (dict.get(i).key.isEqualToString(key)) {
        return i;
      }
    }
    return -1;
  }

  // -- Text -----------------------------------------------------------------

  /** Returns the text representation; same as {@link #toString()}. */
  public String toConfig() {
    return AttributeWriter.write(this);
  }

  /** Replaces this attribute with the value parsed from {@code text}. */
  @CanIgnoreReturnValue
  public Attribute fromConfig(String text) {
    return cloneFrom(AttributeParser.parse(text));
  }

  /**
   * Replaces this attribute with the value parsed from {@code text},
   * resolving service references in {@code registry}.
   */
  @CanIgnoreReturnValue
  public Attribute fromConfig(String text, Registry registry) {
    return cloneFrom(AttributeParser.parse(text, registry));
  }

  // -- Object ---------------------------------------------------------------

  @Override
  public boolean equals(@Nullable Object o) {
    return o == this || o instanceof Attribute && equalTo((Attribute) o);
  }

  private boolean equalTo(Attribute that) {
    if (kind != that.kind) {
      return false;
    }
    switch (kind) {
      case NIL:
        return true;
      case BOOLEAN:
      case INT64:
      case UINT64:
      case FLOATING:
        return bits == that.bits;
      case STRING:
        return Objects.equals(payload, that.payload);
      case DATA:
        return size == that.size && Arrays.equals(data(), that.data());
      case LIST:
        return list().asList().equals(that.list().asList());
      case DICT:
        return dict().asList().equals(that.dict().asList());
      case EXTERNAL_REF:
        return payload == that.payload;
      default:
        throw new AssertionError(kind);
    }
  }

  @Override
  public int hashCode() {
    switch (kind) {
      case STRING:
        return Objects.hash(kind, payload);
      case DATA:
        return Objects.hash(kind, Arrays.hashCode(data()));
      case LIST:
        return Objects.hash(kind, list().asList());
      case DICT:
        return Objects.hash(kind, dict().asList());
      case EXTERNAL_REF:
        return Objects.hash(kind, System.identityHashCode(payload));
      default:
        return Objects.hash(kind, bits);
    }
  }

  /** Returns the text representation, for example {@code ['a',1,None]}. */
  @Override
  public String toString() {
    return AttributeWriter.write(this);
  }

  // -- Internals ------------------------------------------------------------

  /** Returns the elements of a list. */
  @SuppressWarnings("unchecked")
  PagedArray<Attribute> list() {
    checkKind(Kind.LIST, "list operation");
    return (PagedArray<Attribute>) requireNonNull(payload);
  }

  @SuppressWarnings("unchecked")
  private PagedArray<Entry> dict() {
    checkKind(Kind.DICT, "dictionary operation");
    return (PagedArray<Entry>) requireNonNull(payload);
  }

  private void checkKind(Kind expected, String operation) {
    if (kind != expected) {
      throw new AttributeKindException(
          format(
              "%s requires %s but attribute is %s", operation, expected, kind),
          kind);
    }
  }

  private void checkInteger(String operation) {
    if (!kind.isInteger()) {
      throw new AttributeKindException(
          format(
              "%s requires INT64 or UINT64 but attribute is %s",
              operation,
              kind),
          kind);
    }
  }

  /** A (key, value) pair in a dictionary. The key is a string attribute. */
  private static final class Entry {
    final Attribute key;
    final Attribute value;

    Entry(Attribute key, Attribute value) {
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    Entry deepCopy() {
      return new Entry(key.deepCopy(), value.deepCopy());
    }

    void release() {
      key.release();
      value.release();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o == this
          || o instanceof Entry
              && key.equals(((Entry) o).key)
              && value.equals(((Entry) o).value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(key, value);
    }
  }
}

// End Attribute.java
