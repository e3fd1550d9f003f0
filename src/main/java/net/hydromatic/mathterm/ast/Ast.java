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

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.ObjIntConsumer;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Various sub-classes of AST nodes.
 *
 * <p>Use {@link AstBuilder#ast} to create instances. */
public class Ast {
  private Ast() {}

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }

    /** Returns the binding priority of this expression when it occurs as
     * the operand of an operator; see {@link Op#precedence}. */
    public int precedence() {
      return op.precedence;
    }
  }

  /** Parse tree node of an identifier.
   *
   * <p>The identifier is either a bound constant ("pi", "e", "i") or a free
   * variable. Identifiers may contain dots, e.g. "a.b", but no scoping is
   * applied. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Parse tree node of a literal (constant). */
  public static class Literal extends Exp {
    public final Num value;

    /** Creates a Literal. */
    Literal(Pos pos, Num value) {
      super(pos, value.op());
      this.value = value;
    }

    @Override public int precedence() {
      // "-3" binds like a negation
      return value.isNegative() ? Op.NEGATE.precedence : Op.ATOM;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      return buf.append(value);
    }
  }

  /** Application of an operator or a named function to a list of
   * operands.
   *
   * <p>If {@link #op} is {@link Op#FUNCTION}, {@link #operator} is the name
   * of the function; otherwise it is the operator's symbol, for instance
   * "+" or "and". */
  public static class Apply extends Exp {
    public final String operator;
    public final List<Exp> args;

    Apply(Pos pos, Op op, String operator, ImmutableList<Exp> args) {
      super(pos, op);
      this.operator = requireNonNull(operator);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "%s has no operands", operator);
      checkArgument(op == Op.FUNCTION || op.acceptsArity(args.size()),
          "operator %s cannot be applied to %s operands", operator,
          args.size());
    }

    /** Returns whether this is a call to a named function. */
    public boolean isFunction() {
      return op == Op.FUNCTION;
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public int hashCode() {
      return Objects.hash(operator, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && this.operator.equals(((Apply) o).operator)
          && this.args.equals(((Apply) o).args);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      buf.append('(').append(operator);
      for (Exp arg : args) {
        arg.describeTo(buf.append(' '));
      }
      return buf.append(')');
    }
  }

  /** "CASE WHEN ... THEN ... ELSE ... END" expression. */
  public static class Case extends Exp {
    public final List<Clause> clauses;
    public final @Nullable Exp otherwise;

    Case(Pos pos, ImmutableList<Clause> clauses, @Nullable Exp otherwise) {
      super(pos, Op.CASE);
      this.clauses = requireNonNull(clauses);
      this.otherwise = otherwise;
      checkArgument(!clauses.isEmpty(), "case must have at least one clause");
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      int i = 0;
      for (Clause clause : clauses) {
        action.accept(clause.condition, i++);
        action.accept(clause.value, i++);
      }
      if (otherwise != null) {
        action.accept(otherwise, i);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(clauses, otherwise);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Case
          && this.clauses.equals(((Case) o).clauses)
          && Objects.equals(this.otherwise, ((Case) o).otherwise);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      buf.append("(case");
      for (Clause clause : clauses) {
        clause.describeTo(buf.append(' '));
      }
      if (otherwise != null) {
        otherwise.describeTo(buf.append(' '));
      }
      return buf.append(')');
    }
  }

  /** One "WHEN condition THEN value" clause of a {@link Case}. */
  public static class Clause extends AstNode {
    public final Exp condition;
    public final Exp value;

    Clause(Pos pos, Exp condition, Exp value) {
      super(pos, Op.CLAUSE);
      this.condition = requireNonNull(condition);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Clause
          && this.condition.equals(((Clause) o).condition)
          && this.value.equals(((Clause) o).value);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      buf.append('[');
      condition.describeTo(buf);
      buf.append(' ');
      value.describeTo(buf);
      return buf.append(']');
    }
  }

  /** Base class for expressions that hold an ordered collection of
   * items. */
  public abstract static class Collection extends Exp {
    public final List<Exp> items;

    Collection(Pos pos, Op op, ImmutableList<Exp> items) {
      super(pos, op);
      this.items = requireNonNull(items);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(items, action);
    }

    StringBuilder describeItems(StringBuilder buf, String name) {
      buf.append('(').append(name);
      for (Exp item : items) {
        item.describeTo(buf.append(' '));
      }
      return buf.append(')');
    }
  }

  /** List expression, "{a, b, c}". */
  public static class ListExp extends Collection {
    ListExp(Pos pos, ImmutableList<Exp> items) {
      super(pos, Op.LIST, items);
    }

    @Override public int hashCode() {
      return items.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp
          && this.items.equals(((ListExp) o).items);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      return describeItems(buf, "list");
    }
  }

  /** Interval expression, for example "[a, b)".
   *
   * <p>Always has exactly two items, the lower and upper bound. */
  public static class Interval extends Collection {
    public final Closure closure;

    Interval(Pos pos, Closure closure, ImmutableList<Exp> items) {
      super(pos, Op.INTERVAL, items);
      this.closure = requireNonNull(closure);
      checkArgument(items.size() == 2,
          "interval must have 2 items, has %s", items.size());
    }

    /** Returns the lower bound. */
    public Exp low() {
      return items.get(0);
    }

    /** Returns the upper bound. */
    public Exp high() {
      return items.get(1);
    }

    @Override public int hashCode() {
      return Objects.hash(closure, items);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Interval
          && this.closure == ((Interval) o).closure
          && this.items.equals(((Interval) o).items);
    }

    @Override StringBuilder describeTo(StringBuilder buf) {
      return describeItems(buf, "interval:" + closure.markupName);
    }
  }

  /** Which of an interval's endpoints are inclusive. */
  public enum Closure {
    OPEN("(", ")"),
    CLOSED("[", "]"),
    OPEN_CLOSED("(", "]"),
    CLOSED_OPEN("[", ")");

    /** Value of the "closure" attribute of an "interval" element,
     * e.g. "open-closed". */
    public final String markupName;
    public final String open;
    public final String close;

    private static final ImmutableMap<String, Closure> BY_MARKUP_NAME;

    static {
      final ImmutableMap.Builder<String, Closure> b = ImmutableMap.builder();
      for (Closure closure : values()) {
        b.put(closure.markupName, closure);
      }
      BY_MARKUP_NAME = b.build();
    }

    Closure(String open, String close) {
      this.markupName = name().toLowerCase(Locale.ROOT).replace('_', '-');
      this.open = open;
      this.close = close;
    }

    /** Returns the closure with a given markup name, or null. */
    public static @Nullable Closure forMarkupName(String name) {
      return BY_MARKUP_NAME.get(name);
    }

    /** Returns the closure given whether each end is closed. */
    public static Closure of(boolean lowClosed, boolean highClosed) {
      return lowClosed
          ? (highClosed ? CLOSED : CLOSED_OPEN)
          : (highClosed ? OPEN_CLOSED : OPEN);
    }
  }

  /** Calls an action for each element of a list, with its index. */
  static <E> void forEachIndexed(List<E> list, ObjIntConsumer<E> action) {
    for (int i = 0; i < list.size(); i++) {
      action.accept(list.get(i), i);
    }
  }
}

// End Ast.java
