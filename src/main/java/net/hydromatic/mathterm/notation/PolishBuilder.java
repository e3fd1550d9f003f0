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
import net.hydromatic.mathterm.ast.Op;

import java.util.List;

/** Writes terms in prefix (Polish) or postfix (reverse Polish) notation.
 *
 * <p>Each operator is a token written before, or after, its operands, and
 * tokens are separated by spaces. There are no parentheses. Where the
 * number of operands is not implied by the token, it is appended after a
 * slash: "+/3" is addition of three operands, "-/1" is negation, "f/2" is
 * a call to a function of two arguments (one argument is implied), and
 * "list/0" is an empty list. A case has operands condition, value,
 * condition, value, ..., and an optional default. An interval's token is
 * its pair of brackets, for example "[)". */
public class PolishBuilder implements NotationBuilder {
  public static final PolishBuilder PREFIX = new PolishBuilder(true);
  public static final PolishBuilder POSTFIX = new PolishBuilder(false);

  private final boolean prefix;

  private PolishBuilder(boolean prefix) {
    this.prefix = prefix;
  }

  @Override public String build(Ast.Exp exp) {
    final NotationWriter w = new NotationWriter();
    unparse(w, exp);
    return w.toString();
  }

  private void unparse(NotationWriter w, Ast.Exp exp) {
    switch (exp.op) {
    case ID:
      w.token(((Ast.Id) exp).name);
      return;

    case BOOL_LITERAL:
    case INTEGER_LITERAL:
    case DECIMAL_LITERAL:
    case RATIONAL_LITERAL:
    case E_NOTATION_LITERAL:
    case COMPLEX_LITERAL:
      w.token(((Ast.Literal) exp).value.toString());
      return;

    case FUNCTION:
      final Ast.Apply call = (Ast.Apply) exp;
      node(w, withArity(call.operator, call.args.size(), 1), call.args);
      return;

    case CASE:
      final List<Ast.Exp> operands = exp.args();
      node(w, "case/" + operands.size(), operands);
      return;

    case LIST:
      final List<Ast.Exp> items = ((Ast.ListExp) exp).items;
      node(w, "list/" + items.size(), items);
      return;

    case INTERVAL:
      final Ast.Interval interval = (Ast.Interval) exp;
      node(w, interval.closure.open + interval.closure.close,
          interval.items);
      return;

    default:
      final Ast.Apply apply = (Ast.Apply) exp;
      node(w,
          withArity(apply.operator, apply.args.size(), naturalArity(apply.op)),
          apply.args);
    }
  }

  /** Returns the number of operands implied by an operator's token. "-"
   * is subtraction unless marked otherwise. */
  private static int naturalArity(Op op) {
    return op == Op.NOT ? 1 : 2;
  }

  private static String withArity(String token, int arity, int natural) {
    return arity == natural ? token : token + "/" + arity;
  }

  private void node(NotationWriter w, String token, List<Ast.Exp> operands) {
    if (prefix) {
      w.token(token);
    }
    for (Ast.Exp operand : operands) {
      unparse(w, operand);
    }
    if (!prefix) {
      w.token(token);
    }
  }
}

// End PolishBuilder.java
