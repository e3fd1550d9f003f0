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
package net.hydromatic.mathterm;

import net.hydromatic.mathterm.ast.Ast;
import net.hydromatic.mathterm.markup.DomMarkupNode;
import net.hydromatic.mathterm.markup.MarkupTreeBuilder;
import net.hydromatic.mathterm.notation.UnknownNotationException;
import net.hydromatic.mathterm.parse.Grammar;
import net.hydromatic.mathterm.parse.MathTermParseException;
import net.hydromatic.mathterm.parse.TermSource;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static net.hydromatic.mathterm.Matchers.isAst;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link MathTerms}, {@link Prop} and {@link Tracers}. */
public class MathTermsTest {
  private static final String TERM = ".1*pi+2*(1+3i)-5.6-6*-1/sin(-45*a.b)"
      + " * CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END + 1";
  private static final String BOOL_TERM =
      TERM + " = 1 or " + TERM + " > 5 and true";

  private static MathTerms terms() {
    return MathTerms.create(ImmutableMap.of(), Tracers.empty());
  }

  @Test void testParseWithFallback() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnParseFailure(tracer,
        (grammar, e) -> events.add("fail " + grammar.camelName));
    tracer = Tracers.withOnParse(tracer,
        (grammar, exp) -> events.add("parse " + grammar.camelName));
    final MathTerms terms = terms().withTracer(tracer);

    final Ast.Exp exp = terms.parse(BOOL_TERM);
    assertThat(exp.op.name(), is("OR"));
    assertThat(events, is(ImmutableList.of("fail term", "parse boolExpression")));

    events.clear();
    terms.parse("1+2");
    assertThat(events, is(ImmutableList.of("parse term")));
  }

  @Test void testParseFails() {
    final List<Grammar> failed = new ArrayList<>();
    final MathTerms terms = terms().withTracer(
        Tracers.withOnParseFailure(Tracers.empty(),
            (grammar, e) -> failed.add(grammar)));
    final MathTermParseException e =
        assertThrows(MathTermParseException.class,
            () -> terms.parse("1+*2"));
    assertThat(e.getMessage(),
        startsWith("Not parsable as any of [term, boolExpression]"));
    assertThat(failed,
        is(ImmutableList.of(Grammar.TERM, Grammar.BOOL_EXPRESSION)));
  }

  @Test void testGrammarsProperty() {
    final MathTerms terms = terms().with(Prop.GRAMMARS, "term");
    assertThat(terms.grammars(), is(ImmutableList.of(Grammar.TERM)));
    assertThrows(MathTermParseException.class, () -> terms.parse("a or b"));
    final MathTerms lists = terms().with(Prop.GRAMMARS, " termList ");
    assertThat(lists.parse("1, 2"), isAst("(list 1 2)"));
    assertThrows(IllegalArgumentException.class,
        () -> terms().with(Prop.GRAMMARS, "sql"));
    assertThrows(IllegalArgumentException.class,
        () -> terms().with(Prop.GRAMMARS, ","));
  }

  @Test void testParseReader() {
    assertThat(terms().parse(TermSource.of(new StringReader("x*2"))),
        isAst("(* x 2)"));
  }

  @Test void testMarkupRoundTrip() {
    final List<Ast.Exp> extracted = new ArrayList<>();
    final MathTerms terms = terms().withTracer(
        Tracers.withOnExtract(Tracers.empty(), extracted::add));
    final Ast.Exp exp = terms.parse(BOOL_TERM);
    final MarkupTreeBuilder builder = new MarkupTreeBuilder();
    terms.toMarkup(exp, builder);
    assertThat(terms.fromMarkup(builder.root()), is(exp));
    assertThat(terms.fromMarkup(DomMarkupNode.parse(terms.toXml(exp))),
        is(exp));
    assertThat(extracted.size(), is(2));
  }

  @Test void testToXml() {
    final String ns = " xmlns=\"http://www.w3.org/1998/Math/MathML\"";
    assertThat(terms().toXml(terms().parse("pi")), is("<pi" + ns + "/>"));
    assertThat(terms().with(Prop.INDENT, true).toXml(terms().parse("-x")),
        is("<apply" + ns + ">\n  <minus/>\n  <ci>x</ci>\n</apply>\n"));
  }

  @Test void testRender() {
    final List<String> rendered = new ArrayList<>();
    final MathTerms terms = terms().withTracer(
        Tracers.withOnRender(Tracers.empty(),
            (notation, text) -> rendered.add(notation + ": " + text)));
    final Ast.Exp exp = terms.parse("CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END");
    assertThat(terms.render(exp),
        is("CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END"));
    assertThat(terms.render(exp, "postfix"),
        is("3 12 | 1 3 + e 4 1 * ^ case/3"));
    assertThat(rendered,
        is(ImmutableList.of("infix: CASE WHEN 3|12 THEN 1+3 ELSE e^(4*1) END",
            "postfix: 3 12 | 1 3 + e 4 1 * ^ case/3")));
    assertThat(terms.with(Prop.NOTATION, "prefix").render(exp),
        is("case/3 | 3 12 + 1 3 ^ e * 4 1"));
    assertThrows(UnknownNotationException.class,
        () -> terms.render(exp, "rpn"));
    assertThrows(UnknownNotationException.class,
        () -> terms.with(Prop.NOTATION, "rpn").render(exp));
  }

  @Test void testConvert() {
    assertThat(terms().convert("1 + 2 * 3", "infix"), is("1+2*3"));
    assertThat(terms().convert("1 + 2 * 3", "prefix"), is("+ 1 * 2 3"));
    assertThat(terms().convert("a = 1 or not b", "postfix"),
        is("a 1 = b not or"));
  }

  /** Property of the example term: it survives every conversion. */
  @Test void testExampleSurvivesEverything() {
    final MathTerms terms = terms();
    for (String text : ImmutableList.of(TERM, BOOL_TERM)) {
      final Ast.Exp exp = terms.parse(text);
      final Ast.Exp extracted =
          terms.fromMarkup(DomMarkupNode.parse(terms.toXml(exp)));
      assertThat(extracted, is(exp));
      assertThat(terms.parse(terms.render(extracted)), is(exp));
    }
  }

  @Test void testProp() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.NOTATION.stringValue(map), is("infix"));
    assertThat(Prop.GRAMMARS.stringValue(map), is("term,boolExpression"));
    assertThat(Prop.INDENT.booleanValue(map), is(false));
    Prop.INDENT.setLenient(map, "TRUE");
    assertThat(Prop.INDENT.booleanValue(map), is(true));
    Prop.INDENT.set(map, null);
    assertThat(Prop.INDENT.booleanValue(map), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT.set(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT.stringValue(map));
    assertThat(Prop.lookup("notation"), is(Prop.NOTATION));
    assertThat(Prop.lookup("GRAMMARS"), is(Prop.GRAMMARS));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
  }

  @Test void testPropFromSystemProperties() {
    final Properties properties = new Properties();
    properties.setProperty("mathterm.notation", "postfix");
    properties.setProperty("mathterm.indent", "true");
    properties.setProperty("other.notation", "prefix");
    final Map<Prop, Object> map = Prop.fromSystemProperties(properties);
    assertThat(map.size(), is(2));
    assertThat(Prop.NOTATION.stringValue(map), is("postfix"));
    final MathTerms terms = MathTerms.create(map, Tracers.empty());
    assertThat(terms.render(terms.parse("1+2")), is("1 2 +"));
  }
}

// End MathTermsTest.java
