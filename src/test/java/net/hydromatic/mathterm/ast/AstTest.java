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
import org.junit.jupiter.api.Test;

import static net.hydromatic.mathterm.Matchers.isAst;
import static net.hydromatic.mathterm.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests construction of AST nodes and {@link Op}. */
public class AstTest {
  @Test void testApply() {
    final Ast.Apply plus = ast.apply("+", ast.intLiteral(1), ast.id("x"));
    assertThat(plus.op, is(Op.PLUS));
    assertThat(plus, isAst("(+ 1 x)"));
    assertThat(plus.isFunction(), is(false));
    // "+" is n-ary
    assertThat(ast.apply("+", ast.intLiteral(1), ast.intLiteral(2),
        ast.intLiteral(3)), isAst("(+ 1 2 3)"));
    // "-" with one operand is negation
    assertThat(ast.apply("-", ast.id("x")).op, is(Op.NEGATE));
    assertThat(ast.apply("!=", ast.id("x"), ast.id("y")),
        isAst("(<> x y)"));
    final Ast.Apply sin = ast.apply("sin", ast.id("x"));
    assertThat(sin.op, is(Op.FUNCTION));
    assertThat(sin.isFunction(), is(true));
  }

  @Test void testApplyChecksArity() {
    assertThrows(IllegalArgumentException.class,
        () -> ast.apply("f"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.apply("-", ast.id("a"), ast.id("b"), ast.id("c")));
    assertThrows(IllegalArgumentException.class,
        () -> ast.apply("^", ast.id("a")));
    assertThrows(IllegalArgumentException.class,
        () -> ast.function(Pos.ZERO, "+", ImmutableList.of(ast.id("a"))));
  }

  @Test void testConstantAliases() {
    assertThat(ast.id("exponentiale"), is(ast.id("e")));
    assertThat(ast.id("imaginaryi").name, is("i"));
    assertThat(ast.id("pi").name, is("pi"));
  }

  @Test void testEqualityIgnoresPosition() {
    final Pos pos = Pos.of("abc", 0, 3);
    assertThat(ast.id(pos, "abc"), is(ast.id("abc")));
    assertThat(ast.id(pos, "abc").hashCode(), is(ast.id("abc").hashCode()));
    assertThat(ast.id("abc"), not(ast.id("abd")));
  }

  @Test void testCase() {
    final Ast.Case c = ast.caseOf(ast.id("c"), ast.intLiteral(1), null);
    assertThat(c, isAst("(case [c 1])"));
    assertThat(c.otherwise, nullValue());
    assertThat(c.args().size(), is(2));
    final Ast.Case c2 =
        ast.caseOf(ast.id("c"), ast.intLiteral(1), ast.intLiteral(2));
    assertThat(c2, isAst("(case [c 1] 2)"));
    assertThat(c2.args().size(), is(3));
    assertThat(c, not(c2));
    assertThrows(IllegalArgumentException.class,
        () -> ast.caseOf(Pos.ZERO, ImmutableList.of(), null));
  }

  @Test void testInterval() {
    final Ast.Interval interval = ast.interval(Ast.Closure.OPEN_CLOSED,
        ast.intLiteral(0), ast.id("x"));
    assertThat(interval, isAst("(interval:open-closed 0 x)"));
    assertThat(interval.low(), is(ast.intLiteral(0)));
    assertThat(interval.high(), is(ast.id("x")));
    assertThat(interval,
        not(ast.interval(Ast.Closure.OPEN, ast.intLiteral(0), ast.id("x"))));
    assertThrows(IllegalArgumentException.class,
        () -> ast.interval(Pos.ZERO, Ast.Closure.OPEN,
            ImmutableList.of(ast.id("x"))));
  }

  @Test void testClosure() {
    assertThat(Ast.Closure.CLOSED_OPEN.markupName, is("closed-open"));
    assertThat(Ast.Closure.forMarkupName("open"), is(Ast.Closure.OPEN));
    assertThat(Ast.Closure.forMarkupName("half-open"), nullValue());
    assertThat(Ast.Closure.of(true, false), is(Ast.Closure.CLOSED_OPEN));
    assertThat(Ast.Closure.of(false, true), is(Ast.Closure.OPEN_CLOSED));
    assertThat(Ast.Closure.OPEN_CLOSED.open + Ast.Closure.OPEN_CLOSED.close,
        is("(]"));
  }

  @Test void testList() {
    assertThat(ast.list(), isAst("(list)"));
    assertThat(ast.list(ast.id("a"), ast.id("b")).args().size(), is(2));
  }

  @Test void testOp() {
    assertThat(Op.forSymbol("-", 2), is(Op.MINUS));
    assertThat(Op.forSymbol("-", 1), is(Op.NEGATE));
    assertThat(Op.forSymbol("not", 1), is(Op.NOT));
    assertThat(Op.forSymbol("!=", 2), is(Op.NE));
    assertThat(Op.forSymbol("sin", 1), nullValue());
    assertThat(Op.isOperatorSymbol("|"), is(true));
    assertThat(Op.isOperatorSymbol("f"), is(false));
    assertThat(Op.EQ.isRelational(), is(true));
    assertThat(Op.PLUS.isRelational(), is(false));
    assertThat(Op.AND.acceptsArity(3), is(true));
    assertThat(Op.MINUS.acceptsArity(3), is(false));
    assertThat(Op.NOT.arity(), is(1));
    assertThat(Op.POWER.assoc, is(Op.Assoc.RIGHT));
    assertThat(Op.TIMES.precedence > Op.PLUS.precedence, is(true));
  }

  @Test void testLiteralPrecedence() {
    assertThat(ast.intLiteral(3).precedence(), is(Op.ATOM));
    assertThat(ast.intLiteral(-3).precedence(), is(Op.NEGATE.precedence));
  }

  @Test void testPos() {
    final Pos pos = Pos.of("ab\ncd", 3, 5);
    assertThat(pos.startLine, is(2));
    assertThat(pos.startColumn, is(1));
    assertThat(pos.endColumn, is(3));
    assertThat(pos.toString(), is("2.1-2.3"));
    assertThat(Pos.ZERO.plus(pos), is(pos));
    assertThat(pos.plus(Pos.ZERO), is(pos));
    final Pos pos2 = Pos.of("ab\ncd", 0, 1);
    assertThat(pos.plus(pos2).startOffset, is(0));
    assertThat(pos.plus(pos2).endOffset, is(5));
    assertThrows(IllegalArgumentException.class, () -> Pos.of("ab", 0, 3));
  }

  @Test void testPosOffset() {
    assertThat(Pos.offset("ab\ncd", 1, 1), is(0));
    assertThat(Pos.offset("ab\ncd", 2, 2), is(4));
    assertThat(Pos.offset("a\tb", 1, 3), is(2));
    assertThrows(IllegalArgumentException.class,
        () -> Pos.offset("ab", 2, 1));
  }
}

// End AstTest.java
