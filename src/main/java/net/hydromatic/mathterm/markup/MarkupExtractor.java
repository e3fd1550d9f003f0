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
import net.hydromatic.mathterm.ast.Op;
import net.hydromatic.mathterm.ast.Pos;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static net.hydromatic.mathterm.ast.AstBuilder.ast;

/** Reconstructs an AST from a tree of markup.
 *
 * <p>This is the inverse of {@link MarkupEmitter}: for every term that the
 * parser produces, extracting the emitted markup gives an equal term.
 *
 * <p>A {@code <piecewise>} with several pieces becomes a nest of
 * single-clause cases; the {@code <otherwise>}, if any, belongs to the
 * innermost one. */
public class MarkupExtractor {
  private MarkupExtractor() {}

  /** Converts the root of a markup tree to a term. A {@code <math>} wrapper
   * element, if present, is skipped.
   *
   * @throws UnsupportedConstructException if the markup has a shape that
   * has no equivalent term */
  public static Ast.Exp extract(MarkupNode root) {
    if (root.kind().equals(Markup.MATH)) {
      final List<? extends MarkupNode> children = root.children();
      if (children.size() != 1) {
        throw new UnsupportedConstructException("math element must have "
            + "exactly one child, but has " + children.size());
      }
      return exp(children.get(0));
    }
    return exp(root);
  }

  private static Ast.Exp exp(MarkupNode node) {
    final String kind = node.kind();
    switch (kind) {
    case Markup.CI:
      return ast.id(name(node));
    case Markup.CN:
      return number(node);
    case Markup.TRUE:
      checkEmpty(node);
      return ast.boolLiteral(true);
    case Markup.FALSE:
      checkEmpty(node);
      return ast.boolLiteral(false);
    case Markup.APPLY:
      return apply(node);
    case Markup.PIECEWISE:
      return piecewise(node);
    case Markup.LIST:
      return ast.list(Pos.ZERO, items(node.children()));
    case Markup.INTERVAL:
      return interval(node);
    default:
      final String constant = Markup.CONSTANT_ELEMENTS.inverse().get(kind);
      if (constant != null) {
        checkEmpty(node);
        return ast.id(constant);
      }
      throw new UnsupportedConstructException("unknown element: " + kind);
    }
  }

  private static Ast.Exp number(MarkupNode node) {
    final String type = node.attribute(Markup.TYPE);
    final List<String> parts = trim(node.textParts());
    final Op op;
    if (type == null) {
      op = parts.get(0).indexOf('.') >= 0
          ? Op.DECIMAL_LITERAL
          : Op.INTEGER_LITERAL;
    } else {
      op = Markup.numberType(type);
      if (op == null) {
        throw new UnsupportedConstructException("unknown number type: "
            + type);
      }
    }
    for (MarkupNode child : node.children()) {
      if (!child.kind().equals(Markup.SEP)) {
        throw new UnsupportedConstructException("unexpected element in cn: "
            + child.kind());
      }
    }
    try {
      switch (op) {
      case INTEGER_LITERAL:
        checkPartCount(type, parts, 1);
        return ast.literal(Num.integer(new BigInteger(parts.get(0))));
      case DECIMAL_LITERAL:
        checkPartCount(type, parts, 1);
        return ast.literal(Num.decimal(new BigDecimal(parts.get(0))));
      case RATIONAL_LITERAL:
        checkPartCount(type, parts, 2);
        return ast.literal(Num.rational(decimal(parts, 0), decimal(parts, 1)));
      case COMPLEX_LITERAL:
        checkPartCount(type, parts, 2);
        return ast.literal(Num.complex(decimal(parts, 0), decimal(parts, 1)));
      case E_NOTATION_LITERAL:
        checkPartCount(type, parts, 2);
        return ast.literal(Num.eNotation(decimal(parts, 0), decimal(parts, 1)));
      default:
        throw new AssertionError(op);
      }
    } catch (NumberFormatException e) {
      throw new UnsupportedConstructException("invalid number: "
          + String.join(" ", parts));
    }
  }

  private static BigDecimal decimal(List<String> parts, int i) {
    return new BigDecimal(parts.get(i));
  }

  private static void checkPartCount(@Nullable String type,
      List<String> parts, int count) {
    if (parts.size() != count) {
      throw new UnsupportedConstructException("cn of type " + type
          + " must have " + count + " part(s), but has " + parts.size());
    }
  }

  private static Ast.Exp apply(MarkupNode node) {
    final List<? extends MarkupNode> children = node.children();
    if (children.isEmpty()) {
      throw new UnsupportedConstructException("apply has no operator");
    }
    final MarkupNode head = children.get(0);
    final List<Ast.Exp> args = items(children.subList(1, children.size()));
    final String operator;
    if (head.kind().equals(Markup.CI)) {
      operator = name(head);
    } else if (!head.children().isEmpty()) {
      throw new UnsupportedConstructException(
          "function composition is not supported: " + head.kind());
    } else {
      final String symbol = Markup.ELEMENT_OPERATORS.get(head.kind());
      operator = symbol != null ? symbol : head.kind();
    }
    if (args.isEmpty()) {
      throw new UnsupportedConstructException("operator " + head.kind()
          + " has no operands");
    }
    final Op op = Op.forSymbol(operator, args.size());
    if (op != null && !op.acceptsArity(args.size())) {
      throw new UnsupportedConstructException("operator " + head.kind()
          + " cannot be applied to " + args.size() + " operands");
    }
    return ast.apply(Pos.ZERO, operator, args);
  }

  private static Ast.Exp piecewise(MarkupNode node) {
    final List<Ast.Clause> clauses = new ArrayList<>();
    Ast.Exp otherwise = null;
    for (MarkupNode child : node.children()) {
      switch (child.kind()) {
      case Markup.PIECE:
        final List<? extends MarkupNode> pair = child.children();
        if (pair.size() != 2) {
          throw new UnsupportedConstructException("piece must have 2 "
              + "children, but has " + pair.size());
        }
        final Ast.Exp value = exp(pair.get(0));
        final Ast.Exp condition = exp(pair.get(1));
        clauses.add(ast.clause(condition, value));
        break;
      case Markup.OTHERWISE:
        if (otherwise != null) {
          throw new UnsupportedConstructException(
              "piecewise has more than one otherwise");
        }
        final List<? extends MarkupNode> single = child.children();
        if (single.size() != 1) {
          throw new UnsupportedConstructException("otherwise must have 1 "
              + "child, but has " + single.size());
        }
        otherwise = exp(single.get(0));
        break;
      default:
        throw new UnsupportedConstructException("unexpected element in "
            + "piecewise: " + child.kind());
      }
    }
    if (clauses.isEmpty()) {
      if (otherwise == null) {
        throw new UnsupportedConstructException("piecewise has no pieces");
      }
      return otherwise;
    }
    Ast.Exp e = otherwise;
    for (Ast.Clause clause : Lists.reverse(clauses)) {
      e = ast.caseOf(clause.condition, clause.value, e);
    }
    return e;
  }

  private static Ast.Exp interval(MarkupNode node) {
    final List<? extends MarkupNode> children = node.children();
    if (children.size() != 2) {
      throw new UnsupportedConstructException("interval must have 2 "
          + "children, but has " + children.size());
    }
    final String closureName = node.attribute(Markup.CLOSURE);
    final Ast.Closure closure = closureName == null
        ? Ast.Closure.CLOSED
        : Ast.Closure.forMarkupName(closureName);
    if (closure == null) {
      throw new UnsupportedConstructException("unknown interval closure: "
          + closureName);
    }
    return ast.interval(closure, exp(children.get(0)), exp(children.get(1)));
  }

  private static List<Ast.Exp> items(List<? extends MarkupNode> nodes) {
    final ImmutableList.Builder<Ast.Exp> b = ImmutableList.builder();
    for (MarkupNode node : nodes) {
      b.add(exp(node));
    }
    return b.build();
  }

  /** Returns the name inside a "ci" element. */
  private static String name(MarkupNode node) {
    checkLeaf(node);
    final String name = node.text().trim();
    if (name.isEmpty()) {
      throw new UnsupportedConstructException("ci has no name");
    }
    return name;
  }

  /** Checks that an element contains only text. */
  private static void checkLeaf(MarkupNode node) {
    if (!node.children().isEmpty()) {
      throw new UnsupportedConstructException(node.kind()
          + " must contain only text");
    }
  }

  /** Checks that an element has no child elements and no text. */
  private static void checkEmpty(MarkupNode node) {
    checkLeaf(node);
    if (!node.text().trim().isEmpty()) {
      throw new UnsupportedConstructException(node.kind()
          + " must be empty");
    }
  }

  private static List<String> trim(List<String> parts) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (String part : parts) {
      b.add(part.trim());
    }
    return b.build();
  }
}

// End MarkupExtractor.java
