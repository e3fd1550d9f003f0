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

import net.hydromatic.mathterm.ast.Ast;
import net.hydromatic.mathterm.ast.Num;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Converts an AST into a stream of markup events.
 *
 * <p>Each kind of node has one markup shape:
 *
 * <ul>
 *   <li>a bound constant ("pi", "e", "i", true, false) is an empty element
 *   such as {@code <exponentiale/>};
 *   <li>any other identifier is {@code <ci>name</ci>};
 *   <li>a number is {@code <cn type="...">}, where a two-part number
 *   separates its parts with {@code <sep/>};
 *   <li>an operator call is {@code <apply>} whose first child is the
 *   operator's empty element, and a function call is {@code <apply>}
 *   whose first child is {@code <ci>name</ci>};
 *   <li>a case is {@code <piecewise>} holding one {@code <piece>} per
 *   clause (value then condition) and an optional {@code <otherwise>};
 *   <li>a list is {@code <list>} and an interval is
 *   {@code <interval closure="...">}.
 * </ul>
 */
public class MarkupEmitter {
  private static final Map<String, String> NO_ATTRIBUTES = ImmutableMap.of();

  private final EventSink sink;

  private MarkupEmitter(EventSink sink) {
    this.sink = requireNonNull(sink);
  }

  /** Emits the markup for a term, bracketed by document and namespace
   * events. */
  public static void emit(Ast.Exp exp, EventSink sink) {
    sink.startDocument();
    sink.prefixDeclaration(Markup.NAMESPACE_URI);
    new MarkupEmitter(sink).exp(exp);
    sink.endDocument();
  }

  private void exp(Ast.Exp exp) {
    switch (exp.op) {
    case ID:
      final String name = ((Ast.Id) exp).name;
      final String constant = Markup.CONSTANT_ELEMENTS.get(name);
      if (constant != null) {
        empty(constant);
      } else {
        leaf(Markup.CI, name);
      }
      return;

    case BOOL_LITERAL:
      final Num.BoolNum b = (Num.BoolNum) ((Ast.Literal) exp).value;
      empty(b.value ? Markup.TRUE : Markup.FALSE);
      return;

    case INTEGER_LITERAL:
    case DECIMAL_LITERAL:
    case RATIONAL_LITERAL:
    case COMPLEX_LITERAL:
    case E_NOTATION_LITERAL:
      number(((Ast.Literal) exp).value);
      return;

    case CASE:
      final Ast.Case case_ = (Ast.Case) exp;
      open(Markup.PIECEWISE);
      for (Ast.Clause clause : case_.clauses) {
        open(Markup.PIECE);
        exp(clause.value);
        exp(clause.condition);
        close(Markup.PIECE);
      }
      if (case_.otherwise != null) {
        open(Markup.OTHERWISE);
        exp(case_.otherwise);
        close(Markup.OTHERWISE);
      }
      close(Markup.PIECEWISE);
      return;

    case LIST:
      open(Markup.LIST);
      args(((Ast.ListExp) exp).items);
      close(Markup.LIST);
      return;

    case INTERVAL:
      final Ast.Interval interval = (Ast.Interval) exp;
      sink.open(Markup.INTERVAL,
          ImmutableMap.of(Markup.CLOSURE, interval.closure.markupName));
      args(interval.items);
      close(Markup.INTERVAL);
      return;

    case FUNCTION:
      final Ast.Apply call = (Ast.Apply) exp;
      open(Markup.APPLY);
      leaf(Markup.CI, call.operator);
      args(call.args);
      close(Markup.APPLY);
      return;

    default:
      if (!exp.op.isOperator()) {
        throw new AssertionError("unknown op " + exp.op);
      }
      final Ast.Apply apply = (Ast.Apply) exp;
      open(Markup.APPLY);
      empty(requireNonNull(Markup.OPERATOR_ELEMENTS.get(apply.operator),
          apply.operator));
      args(apply.args);
      close(Markup.APPLY);
    }
  }

  private void number(Num value) {
    sink.open(Markup.CN,
        ImmutableMap.of(Markup.TYPE, Markup.NUMBER_TYPES.get(value.op())));
    final List<String> parts = value.parts();
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        empty(Markup.SEP);
      }
      sink.text(parts.get(i));
    }
    close(Markup.CN);
  }

  private void args(List<Ast.Exp> args) {
    args.forEach(this::exp);
  }

  private void open(String name) {
    sink.open(name, NO_ATTRIBUTES);
  }

  private void close(String name) {
    sink.close(name);
  }

  private void empty(String name) {
    open(name);
    close(name);
  }

  private void leaf(String name, String text) {
    open(name);
    sink.text(text);
    close(name);
  }
}

// End MarkupEmitter.java
