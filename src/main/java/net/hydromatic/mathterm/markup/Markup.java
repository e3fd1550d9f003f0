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
package net.hydromatic.mathterm.markup;

import net.hydromatic.mathterm.ast.Op;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/** Vocabulary of MathML content markup, and the tables that map between
 * it and the AST.
 *
 * <p>All tables are immutable and are built once, when this class is
 * initialized. */
public final class Markup {
  private Markup() {}

  /** The one namespace used by all elements. */
  public static final String NAMESPACE_URI =
      "http://www.w3.org/1998/Math/MathML";

  public static final String MATH = "math";
  public static final String APPLY = "apply";
  public static final String CI = "ci";
  public static final String CN = "cn";
  public static final String SEP = "sep";
  public static final String PIECEWISE = "piecewise";
  public static final String PIECE = "piece";
  public static final String OTHERWISE = "otherwise";
  public static final String LIST = "list";
  public static final String INTERVAL = "interval";
  public static final String TRUE = "true";
  public static final String FALSE = "false";

  /** Attribute of "cn" that holds the kind of number. */
  public static final String TYPE = "type";

  /** Attribute of "interval" that holds its closure. */
  public static final String CLOSURE = "closure";

  /** Maps operator symbols to element names. "!=" and "&lt;&gt;" both map
   * to "neq". */
  public static final ImmutableMap<String, String> OPERATOR_ELEMENTS =
      ImmutableMap.<String, String>builder()
          .put("+", "plus")
          .put("-", "minus")
          .put("*", "times")
          .put("/", "divide")
          .put("^", "power")
          .put("|", "factorof")
          .put("=", "eq")
          .put("<>", "neq")
          .put("!=", "neq")
          .put(">", "gt")
          .put(">=", "geq")
          .put("<=", "leq")
          .put("<", "lt")
          .put("and", "and")
          .put("or", "or")
          .put("not", "not")
          .build();

  /** Maps element names to operator symbols; the inverse of
   * {@link #OPERATOR_ELEMENTS}. "neq" maps to "&lt;&gt;". */
  public static final ImmutableMap<String, String> ELEMENT_OPERATORS =
      invert(OPERATOR_ELEMENTS);

  /** Maps the names of bound constants to element names. */
  public static final ImmutableBiMap<String, String> CONSTANT_ELEMENTS =
      ImmutableBiMap.<String, String>builder()
          .put("true", TRUE)
          .put("false", FALSE)
          .put("pi", "pi")
          .put("e", "exponentiale")
          .put("i", "imaginaryi")
          .build();

  /** Maps each kind of numeric literal to the value of the "type"
   * attribute of its "cn" element. */
  public static final ImmutableBiMap<Op, String> NUMBER_TYPES =
      ImmutableBiMap.<Op, String>builder()
          .put(Op.INTEGER_LITERAL, "integer")
          .put(Op.DECIMAL_LITERAL, "decimal")
          .put(Op.RATIONAL_LITERAL, "rational")
          .put(Op.COMPLEX_LITERAL, "complex")
          .put(Op.E_NOTATION_LITERAL, "e-notation")
          .build();

  /** Other spellings of number types that are accepted when reading
   * markup. */
  private static final ImmutableMap<String, Op> NUMBER_TYPE_ALIASES =
      ImmutableMap.of("real", Op.DECIMAL_LITERAL,
          "enotation", Op.E_NOTATION_LITERAL,
          "complex-cartesian", Op.COMPLEX_LITERAL);

  /** Returns the kind of literal for a value of the "type" attribute of a
   * "cn" element, or null if not known. */
  public static @Nullable Op numberType(String type) {
    final Op op = NUMBER_TYPES.inverse().get(type);
    return op != null ? op : NUMBER_TYPE_ALIASES.get(type);
  }

  /** Inverts a map; where several keys have the same value, the first key
   * wins. */
  private static ImmutableMap<String, String> invert(Map<String, String> map) {
    final Map<String, String> inverse = new LinkedHashMap<>();
    map.forEach((k, v) -> inverse.putIfAbsent(v, k));
    return ImmutableMap.copyOf(inverse);
  }
}

// End Markup.java
