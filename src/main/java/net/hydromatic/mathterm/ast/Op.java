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
package net.hydromatic.mathterm.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sub-types of {@link AstNode}.
 *
 * <p>Operators carry their symbol, their precedence (higher binds tighter)
 * and their associativity. Atoms have precedence {@link #ATOM}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INTEGER_LITERAL(true),
  DECIMAL_LITERAL(true),
  RATIONAL_LITERAL(true),
  COMPLEX_LITERAL(true),
  E_NOTATION_LITERAL(true),

  // constructs
  CASE(true),
  CLAUSE,
  LIST(true),
  INTERVAL(true),
  /** Call to a named function, such as "sin(x)". */
  FUNCTION(true),

  // operators
  OR("or", 1, Assoc.LEFT),
  AND("and", 2, Assoc.LEFT),
  NOT("not", 3, Assoc.PREFIX),
  EQ("=", 4, Assoc.NONE),
  NE("<>", 4, Assoc.NONE),
  GT(">", 4, Assoc.NONE),
  GE(">=", 4, Assoc.NONE),
  LE("<=", 4, Assoc.NONE),
  LT("<", 4, Assoc.NONE),
  PLUS("+", 5, Assoc.LEFT),
  MINUS("-", 5, Assoc.LEFT),
  TIMES("*", 6, Assoc.LEFT),
  DIVIDE("/", 6, Assoc.LEFT),
  FACTOR_OF("|", 7, Assoc.LEFT),
  NEGATE("-", 8, Assoc.PREFIX),
  POWER("^", 9, Assoc.RIGHT);

  /** Precedence of atoms and of other constructs that bracket their
   * contents, such as function calls and {@code CASE ... END}. */
  public static final int ATOM = 99;

  /** Operator symbol, e.g. "+" or "and"; null if not an operator. */
  public final @Nullable String symbol;
  /** Binding priority; higher binds tighter. */
  public final int precedence;
  public final Assoc assoc;

  /** Binary operators by symbol, including the alias "!=" for
   * {@link #NE}. */
  private static final ImmutableMap<String, Op> BY_BINARY_SYMBOL;

  /** Prefix operators by symbol. */
  private static final ImmutableMap<String, Op> BY_PREFIX_SYMBOL;

  static {
    final Map<String, Op> binary = new LinkedHashMap<>();
    final Map<String, Op> prefix = new LinkedHashMap<>();
    for (Op op : values()) {
      if (op.symbol != null) {
        (op.assoc == Assoc.PREFIX ? prefix : binary).put(op.symbol, op);
      }
    }
    binary.put("!=", NE);
    BY_BINARY_SYMBOL = ImmutableMap.copyOf(binary);
    BY_PREFIX_SYMBOL = ImmutableMap.copyOf(prefix);
  }

  Op() {
    this(null, 0, Assoc.NONE);
  }

  Op(boolean atom) {
    this(null, ATOM, Assoc.NONE);
    assert atom;
  }

  Op(@Nullable String symbol, int precedence, Assoc assoc) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.assoc = assoc;
  }

  /** Returns whether this is an operator (as opposed to an atom or a
   * function call). */
  public boolean isOperator() {
    return symbol != null;
  }

  /** Returns whether this operator is a comparison. */
  public boolean isRelational() {
    return precedence == EQ.precedence && symbol != null;
  }

  /** Returns the number of operands this operator expects. */
  public int arity() {
    return assoc == Assoc.PREFIX ? 1 : 2;
  }

  /** Returns whether this operator can be applied to a given number of
   * operands. "+", "*", "and" and "or" are n-ary, as in MathML. */
  public boolean acceptsArity(int n) {
    switch (this) {
    case PLUS:
    case TIMES:
    case AND:
    case OR:
      return n >= 2;
    default:
      return n == arity();
    }
  }

  /** Returns the operator for a symbol applied to a given number of
   * operands, or null if the symbol is not an operator (in which case it
   * is presumably the name of a function).
   *
   * <p>"-" with one operand is {@link #NEGATE}. */
  public static @Nullable Op forSymbol(String symbol, int arity) {
    if (arity == 1) {
      final Op op = BY_PREFIX_SYMBOL.get(symbol);
      if (op != null) {
        return op;
      }
    }
    final Op op = BY_BINARY_SYMBOL.get(symbol);
    if (op != null) {
      return op;
    }
    return BY_PREFIX_SYMBOL.get(symbol);
  }

  /** Returns whether a string is the symbol of an operator. */
  public static boolean isOperatorSymbol(String symbol) {
    return BY_BINARY_SYMBOL.containsKey(symbol)
        || BY_PREFIX_SYMBOL.containsKey(symbol);
  }

  /** Associativity of an operator. */
  public enum Assoc {
    LEFT,
    RIGHT,
    /** Non-associative; "a = b = c" is not valid. */
    NONE,
    /** Prefix (unary) operator. */
    PREFIX
  }
}

// End Op.java
