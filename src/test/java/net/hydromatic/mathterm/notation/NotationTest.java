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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.hydromatic.mathterm.ast.AstBuilder.ast;
import static net.hydromatic.mathterm.parse.Parsers.parseBoolExpression;
import static net.hydromatic.mathterm.parse.Parsers.parseTerm;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests the notation builders and their registry. */
public class NotationTest {
  private static String infix(Ast.Exp exp) {
    return Notations.render(exp, "infix");
  }

  private static String prefix(String term) {
    return Notations.render(parseTerm(term), "prefix");
  }

  private static String postfix(String term) {
    return Notations.render(parseTerm(term), "postfix");
  }

  /** Checks that a term renders as itself in infix notation. */
  private static void assertInfixSame(String term) {
    assertThat(infix(parseTerm(term)), is(term));
  }

  @Test void testInfixMinimalParentheses() {
    assertInfixSame("1+2*3");
    assertInfixSame("(1+2)*3");
    assertInfixSame("1-2-3");
    assertInfixSame("1-(2-3)");
    assertInfixSame("1-(2+3)");
    assertInfixSame("a/(b*c)");
    assertInfixSame("x|y^2");
    assertInfixSame("(a+b)|c");
    assertInfixSame("-x");
    assertInfixSame("-(1+2)");
    assertInfixSame("-2^2");
    assertInfixSame("(-2)^2");
    assertInfixSame("6*-1");
    assertInfixSame("1--2");
    // the exponent is parenthesized, but parses the same either way
    assertThat(infix(parseTerm("2^-1")), is("2^(-1)"));
    assertThat(parseTerm("2^(-1)"), is(parseTerm("2^-1")));
  }

  @Test void testInfixNormalizesSpacing() {
    assertThat(infix(parseTerm("1 + 2 * 3")), is("1+2*3"));
    assertThat(infix(parseTerm("x=y")), is("x = y"));
    assertThat(infix(parseTerm("a != b")), is("a <> b"));
    assertThat(infix(parseTerm("((x))")), is("x"));
    assertThat(infix(parseTerm(".5")), is("0.5"));
  }

  @Test void testInfixForcedParentheses() {
    final Ast.Exp exp = ast.apply("*",
        ast.apply("+", ast.intLiteral(1), ast.intLiteral(2)),
        ast.intLiteral(3));
    assertThat(infix(exp), is("(1+2)*3"));
  }

  @Test void testInfixPower() {
    assertInfixSame("2^3^4");
    final Ast.Exp leftGrouped = ast.apply("^",
        ast.apply("^", ast.intLiteral(2), ast.intLiteral(3)),
        ast.intLiteral(4));
    assertThat(infix(leftGrouped), is("(2^3)^4"));
  }

  @Test void testInfixRelations() {
    assertInfixSame("x+1 >= y");
    assertInfixSame("(a = b) = c");
    assertInfixSame("a = (b = c)");
    assertInfixSame("(a < b)*2");
  }

  @Test void testInfixBoolean() {
    final String[] exps = {
        "a = 1 or b > 5 and true",
        "(a or b) and c",
        "a or b and c",
        "not a = 1",
        "not (a and b)",
        "not not x",
        "not a or b",
    };
    for (String s : exps) {
      assertThat(infix(parseBoolExpression(s)), is(s));
    }
  }

  @Test void testInfixConstructs() {
    assertInfixSame("CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END");
    assertInfixSame("CASE WHEN x > 0 and y THEN 1 END");
    assertInfixSame("CASE WHEN a THEN 1 ELSE CASE WHEN b THEN 2 END END");
    assertInfixSame("f(x, y+1)");
    assertInfixSame("sin(-45*a.b)");
    assertInfixSame("{1, x, {}}");
    assertInfixSame("[1, 2)");
    assertInfixSame("(a, b]");
    assertInfixSame("2*(1+3i)");
  }

  @Test void testInfixLiterals() {
    assertInfixSame("3//4");
    assertInfixSame("1.2e10");
    assertInfixSame("3i");
    assertInfixSame("true");
    // complex with a real part, and negative constants, from markup
    assertThat(infix(ast.complexLiteral("1", "0.3")), is("(1+0.3i)"));
    assertThat(
        infix(ast.apply("^", ast.intLiteral(-2), ast.intLiteral(2))),
        is("(-2)^2"));
    assertThat(
        infix(ast.apply("+", ast.intLiteral(1), ast.intLiteral(2),
            ast.intLiteral(3))),
        is("1+2+3"));
  }

  /** Rendering then parsing gives back the same term. */
  @Test void testInfixRoundTrip() {
    final List<String> terms = ImmutableList.of(
        "1 + 2 * 3",
        "a - (b - c) - d",
        "2 ^ 3 ^ 4",
        "(2 ^ 3) ^ 4",
        "-x ^ 2 + (-x) ^ 2",
        "CASE WHEN a THEN 1 WHEN b THEN 2 ELSE 3 END",
        ".1*pi+2*(1+3i)-5.6-6*-1/sin(-45*a.b)"
            + " * CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END + 1",
        "{[1, 2), (3, 4]}",
        "f(g(x), 3//4, 1.2e-3)",
        "(x <> 1) = (y > 2)");
    for (String term : terms) {
      final Ast.Exp exp = parseTerm(term);
      assertThat(term, parseTerm(infix(exp)), is(exp));
    }
  }

  @Test void testPrefix() {
    assertThat(prefix("1+2*3"), is("+ 1 * 2 3"));
    assertThat(prefix("(1+2)*3"), is("* + 1 2 3"));
    assertThat(prefix("-x"), is("-/1 x"));
    assertThat(prefix("sin(x)"), is("sin x"));
    assertThat(prefix("f(x, y)"), is("f/2 x y"));
    assertThat(prefix("CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END"),
        is("case/3 | 3 12 + 1 3 ^ e * 4 1"));
    assertThat(prefix("CASE WHEN x THEN 1 END"), is("case/2 x 1"));
    assertThat(prefix("{a, b}"), is("list/2 a b"));
    assertThat(prefix("{}"), is("list/0"));
    assertThat(prefix("[1, 2)"), is("[) 1 2"));
    assertThat(prefix("1+3i"), is("+ 1 3i"));
    assertThat(
        Notations.render(parseBoolExpression("not a or b = 1"), "prefix"),
        is("or not a = b 1"));
    assertThat(
        Notations.render(
            ast.apply("+", ast.id("a"), ast.id("b"), ast.id("c")),
            "prefix"),
        is("+/3 a b c"));
  }

  @Test void testPostfix() {
    assertThat(postfix("1+2*3"), is("1 2 3 * +"));
    assertThat(postfix("(1+2)*3"), is("1 2 + 3 *"));
    assertThat(postfix("-x"), is("x -/1"));
    assertThat(postfix("f(x, y)"), is("x y f/2"));
    assertThat(postfix("CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END"),
        is("3 12 | 1 3 + e 4 1 * ^ case/3"));
    assertThat(postfix("(a, b]"), is("a b (]"));
    assertThat(postfix("2^3^4"), is("2 3 4 ^ ^"));
  }

  @Test void testUnknownNotation() {
    final UnknownNotationException e =
        assertThrows(UnknownNotationException.class,
            () -> Notations.render(parseTerm("1"), "rpn"));
    assertThat(e.name(), is("rpn"));
    assertThat(e.getMessage(), containsString("Unknown notation 'rpn'"));
  }

  @Test void testRegister() {
    assertThat(Notations.names(), hasItems("infix", "prefix", "postfix"));
    Notations.register("debug", Object::toString);
    assertThat(Notations.render(parseTerm("1+2"), "debug"), is("(+ 1 2)"));
    assertThat(Notations.names(), hasItems("infix", "debug"));
    // registering again replaces
    Notations.register("debug", exp -> exp.op.name());
    assertThat(Notations.render(parseTerm("1+2"), "debug"), is("PLUS"));
    assertThat(Notations.lookup("infix"), is(InfixBuilder.INSTANCE));
  }
}

// End NotationTest.java
