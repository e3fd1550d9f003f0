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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Long names of constants, and the short names that the AST uses. */
  private static final ImmutableMap<String, String> CONSTANT_ALIASES =
      ImmutableMap.of("exponentiale", "e",
          "imaginaryi", "i");

  /** Creates a reference to a name.
   *
   * <p>"exponentiale" and "imaginaryi" become "e" and "i". */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, CONSTANT_ALIASES.getOrDefault(name, name));
  }

  public Ast.Id id(String name) {
    return id(Pos.ZERO, name);
  }

  public Ast.Literal literal(Pos pos, Num value) {
    return new Ast.Literal(pos, value);
  }

  public Ast.Literal literal(Num value) {
    return literal(Pos.ZERO, value);
  }

  public Ast.Literal intLiteral(long value) {
    return literal(Num.integer(value));
  }

  public Ast.Literal decimalLiteral(String text) {
    return literal(Num.decimal(text));
  }

  public Ast.Literal complexLiteral(String real, String imaginary) {
    return literal(
        Num.complex(new BigDecimal(real), new BigDecimal(imaginary)));
  }

  public Ast.Literal boolLiteral(boolean value) {
    return literal(Num.bool(value));
  }

  /** Creates an application of an operator or function.
   *
   * <p>If {@code operator} is an operator symbol, the node's {@link Op} is
   * that of the operator, and the symbol is normalized ("!=" becomes
   * "&lt;&gt;"); otherwise the node is a call to a function of that name.
   * "-" applied to one operand is negation. */
  public Ast.Apply apply(Pos pos, String operator, List<? extends Ast.Exp> args) {
    final @Nullable Op op = Op.forSymbol(operator, args.size());
    if (op == null) {
      return new Ast.Apply(pos, Op.FUNCTION, operator,
          ImmutableList.copyOf(args));
    }
    return new Ast.Apply(pos, op, requireSymbol(op),
        ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(String operator, Ast.Exp... args) {
    return apply(Pos.ZERO, operator, ImmutableList.copyOf(args));
  }

  /** Creates a call to a named function. */
  public Ast.Apply function(Pos pos, String name, List<? extends Ast.Exp> args) {
    checkArgument(!Op.isOperatorSymbol(name), "not a function name: %s",
        name);
    return new Ast.Apply(pos, Op.FUNCTION, name, ImmutableList.copyOf(args));
  }

  /** Creates a call to a binary operator. */
  public Ast.Apply infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.Apply(pos, op, requireSymbol(op), ImmutableList.of(a0, a1));
  }

  /** Creates a call to a prefix operator. */
  public Ast.Apply prefixCall(Pos pos, Op op, Ast.Exp a) {
    checkArgument(op.assoc == Op.Assoc.PREFIX, "not prefix: %s", op);
    return new Ast.Apply(pos, op, requireSymbol(op), ImmutableList.of(a));
  }

  private static String requireSymbol(Op op) {
    checkArgument(op.symbol != null, "not an operator: %s", op);
    return op.symbol;
  }

  public Ast.Clause clause(Pos pos, Ast.Exp condition, Ast.Exp value) {
    return new Ast.Clause(pos, condition, value);
  }

  public Ast.Clause clause(Ast.Exp condition, Ast.Exp value) {
    return clause(Pos.ZERO, condition, value);
  }

  public Ast.Case caseOf(Pos pos, List<Ast.Clause> clauses,
      Ast.@Nullable Exp otherwise) {
    return new Ast.Case(pos, ImmutableList.copyOf(clauses), otherwise);
  }

  public Ast.Case caseOf(Ast.Exp condition, Ast.Exp value,
      Ast.@Nullable Exp otherwise) {
    return caseOf(Pos.ZERO, ImmutableList.of(clause(condition, value)),
        otherwise);
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> items) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(items));
  }

  public Ast.ListExp list(Ast.Exp... items) {
    return list(Pos.ZERO, ImmutableList.copyOf(items));
  }

  public Ast.Interval interval(Pos pos, Ast.Closure closure,
      List<? extends Ast.Exp> items) {
    return new Ast.Interval(pos, closure, ImmutableList.copyOf(items));
  }

  public Ast.Interval interval(Ast.Closure closure, Ast.Exp low,
      Ast.Exp high) {
    return interval(Pos.ZERO, closure, ImmutableList.of(low, high));
  }
}

// End AstBuilder.java
