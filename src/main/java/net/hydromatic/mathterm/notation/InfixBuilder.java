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
package net.hydromatic.mathterm.notation;

import net.hydromatic.mathterm.ast.Ast;
import net.hydromatic.mathterm.ast.Num;
import net.hydromatic.mathterm.ast.Op;

import java.util.List;

/** Writes terms in infix notation, the notation that
 * {@link net.hydromatic.mathterm.parse.Parsers} reads.
 *
 * <p>A child is parenthesized only if it binds less tightly than its
 * parent, or equally tightly on the side where the parent does not
 * associate; so parsing the output gives the same tree. Relational and
 * boolean operators are surrounded by spaces ({@code a = b},
 * {@code x and y}); arithmetic operators are not ({@code 1+2*3}). */
public class InfixBuilder implements NotationBuilder {
  public static final InfixBuilder INSTANCE = new InfixBuilder();

  private InfixBuilder() {}

  @Override public String build(Ast.Exp exp) {
    final NotationWriter w = new NotationWriter();
    unparse(w, exp);
    return w.toString();
  }

  private void unparse(NotationWriter w, Ast.Exp exp) {
    switch (exp.op) {
    case ID:
      w.append(((Ast.Id) exp).name);
      return;

    case BOOL_LITERAL:
    case INTEGER_LITERAL:
    case DECIMAL_LITERAL:
    case RATIONAL_LITERAL:
    case E_NOTATION_LITERAL:
    case COMPLEX_LITERAL:
      literal(w, ((Ast.Literal) exp).value);
      return;

    case FUNCTION:
      final Ast.Apply call = (Ast.Apply) exp;
      w.append(call.operator).append("(");
      list(w, call.args);
      w.append(")");
      return;

    case CASE:
      final Ast.Case case_ = (Ast.Case) exp;
      w.append("CASE");
      for (Ast.Clause clause : case_.clauses) {
        w.append(" WHEN ");
        unparse(w, clause.condition);
        w.append(" THEN ");
        unparse(w, clause.value);
      }
      if (case_.otherwise != null) {
        w.append(" ELSE ");
        unparse(w, case_.otherwise);
      }
      w.append(" END");
      return;

    case LIST:
      w.append("{");
      list(w, ((Ast.ListExp) exp).items);
      w.append("}");
      return;

    case INTERVAL:
      final Ast.Interval interval = (Ast.Interval) exp;
      w.append(interval.closure.open);
      list(w, interval.items);
      w.append(interval.closure.close);
      return;

    default:
      operator(w, (Ast.Apply) exp);
    }
  }

  private void operator(NotationWriter w, Ast.Apply apply) {
    final Op op = apply.op;
    if (op.assoc == Op.Assoc.PREFIX) {
      w.append(op == Op.NOT ? "not " : apply.operator);
      child(w, apply.args.get(0), apply.args.get(0).precedence() < op.precedence);
      return;
    }
    final String padded = op.isRelational() || op == Op.AND || op == Op.OR
        ? " " + apply.operator + " "
        : apply.operator;
    for (int i = 0; i < apply.args.size(); i++) {
      if (i > 0) {
        w.append(padded);
      }
      final Ast.Exp arg = apply.args.get(i);
      child(w, arg, needsParens(op, i, arg.precedence()));
    }
  }

  /** Returns whether the operand at position {@code i} of a binary
   * operator needs parentheses. */
  private static boolean needsParens(Op op, int i, int childPrecedence) {
    if (childPrecedence != op.precedence) {
      return childPrecedence < op.precedence;
    }
    switch (op.assoc) {
    case LEFT:
      return i > 0;
    case RIGHT:
      return i == 0;
    default:
      return true;
    }
  }

  private void child(NotationWriter w, Ast.Exp exp, boolean parens) {
    if (parens) {
      w.append("(");
      unparse(w, exp);
      w.append(")");
    } else {
      unparse(w, exp);
    }
  }

  private void list(NotationWriter w, List<Ast.Exp> exps) {
    for (int i = 0; i < exps.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      unparse(w, exps.get(i));
    }
  }

  /** Writes a constant. A complex number with a real part is written
   * "(1+3i)", which parses as an addition but denotes the same value. */
  private static void literal(NotationWriter w, Num value) {
    if (value.op() == Op.COMPLEX_LITERAL
        && !((Num.PairNum) value).isPureImaginary()) {
      w.append("(").append(value.toString()).append(")");
    } else {
      w.append(value.toString());
    }
  }
}

// End InfixBuilder.java
