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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how attributes are written and parsed.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Integer property "floatDecimals" is the number of digits after the
   * decimal point when a floating-point value is written. Default is 4;
   * minimum is 1, so that a written float always reads back as a float.
   */
  FLOAT_DECIMALS("floatDecimals", Integer.class, 4, 1),

  /**
   * Integer property "maxDepth" is the deepest nesting of lists, dictionaries
   * and data that the parser accepts. Default is 512.
   */
  MAX_DEPTH("maxDepth", Integer.class, 512, 0),

  /**
   * Boolean property "resolveReferences" controls whether the parser turns
   * service dictionaries into references. If false, they remain
   * dictionaries. Default is true.
   */
  RESOLVE_REFERENCES("resolveReferences", Boolean.class, true),

  /**
   * String property "serviceType" is the value of the "Type" key that marks
   * a dictionary as a reference to a service. Default is "IService".
   */
  SERVICE_TYPE("serviceType", String.class, "IService");

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;
  /** Smallest allowed value of an integer property. */
  private final int minimum;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this(camelName, type, defaultValue, 0);
  }

  Prop(String camelName, Class<?> type, Object defaultValue, int minimum) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    this.minimum = minimum;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException(
          "property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /**
   * Sets the value of a property, or restores its default if {@code value}
   * is null. Checks that the value has the right type, and that integer
   * values are not below the property's minimum.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must have type " + type);
    }
    if (value instanceof Integer && (Integer) value < minimum) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must be at least " + minimum);
    }
    map.put(this, value);
  }
}

// End Prop.java
