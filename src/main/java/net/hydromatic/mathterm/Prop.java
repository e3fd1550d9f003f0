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
package net.hydromatic.mathterm;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/** Property that configures {@link MathTerms}.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 *
 * @see MathTerms#map */
public enum Prop {
  /** String property "notation" is the name of the notation that
   * {@link MathTerms#render(net.hydromatic.mathterm.ast.Ast.Exp)} uses.
   * Default is "infix". */
  NOTATION("notation", String.class, "infix"),

  /** String property "grammars" is a comma-separated list of the grammars
   * that {@link MathTerms#parse(String)} tries, in order, until one
   * succeeds. Default is "term,boolExpression". */
  GRAMMARS("grammars", String.class, "term,boolExpression"),

  /** Boolean property "indent" controls whether
   * {@link MathTerms#toXml} starts each child element on a new line.
   * Default is false. */
  INDENT("indent", Boolean.class, false);

  /** Prefix of the system properties that set properties, for example
   * "mathterm.notation". */
  public static final String SYSTEM_PREFIX = "mathterm.";

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE,
        camelName).equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Reads the values of properties from system properties such as
   * "mathterm.indent=true". */
  public static Map<Prop, Object> fromSystemProperties(Properties properties) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (Prop prop : values()) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Sets the value of a property, allowing strings for boolean
   * properties. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      switch (((String) value).toLowerCase(Locale.ROOT)) {
      case "true":
        set(map, true);
        return;
      case "false":
        set(map, false);
        return;
      default:
        throw new IllegalArgumentException("value for property "
            + camelName + " must be true or false");
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value reverts the property to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
