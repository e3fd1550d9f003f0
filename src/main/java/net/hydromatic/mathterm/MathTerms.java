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
import net.hydromatic.mathterm.markup.EventSink;
import net.hydromatic.mathterm.markup.MarkupEmitter;
import net.hydromatic.mathterm.markup.MarkupExtractor;
import net.hydromatic.mathterm.markup.MarkupNode;
import net.hydromatic.mathterm.markup.MarkupWriter;
import net.hydromatic.mathterm.notation.Notations;
import net.hydromatic.mathterm.parse.Grammar;
import net.hydromatic.mathterm.parse.MathTermParseException;
import net.hydromatic.mathterm.parse.ParseResult;
import net.hydromatic.mathterm.parse.Parsers;
import net.hydromatic.mathterm.parse.TermSource;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Entry point for converting terms between text, markup and notations.
 *
 * <p>An instance is immutable and may be shared between threads. Its
 * behavior is controlled by a map of {@link Prop} values, and it reports
 * what it does to a {@link Tracer}.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * MathTerms terms = MathTerms.create();
 * Ast.Exp exp = terms.parse("1+2*3");
 * String xml = terms.toXml(exp);
 * String prefix = terms.render(exp, "prefix"); // "+ 1 * 2 3"
 * </pre></blockquote> */
public class MathTerms {
  /** Property values. */
  public final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;
  private final ImmutableList<Grammar> grammars;

  private MathTerms(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
    final ImmutableList.Builder<Grammar> b = ImmutableList.builder();
    for (String name : Splitter.on(',').trimResults().omitEmptyStrings()
        .split(Prop.GRAMMARS.stringValue(map))) {
      b.add(Grammar.lookup(name));
    }
    this.grammars = b.build();
    if (grammars.isEmpty()) {
      throw new IllegalArgumentException("property "
          + Prop.GRAMMARS.camelName + " must name at least one grammar");
    }
  }

  /** Creates an instance whose properties are read from system
   * properties, and which has no tracer. */
  public static MathTerms create() {
    return create(Prop.fromSystemProperties(System.getProperties()),
        Tracers.empty());
  }

  /** Creates an instance with given properties and tracer. */
  public static MathTerms create(Map<Prop, Object> map, Tracer tracer) {
    return new MathTerms(map, tracer);
  }

  /** Returns a copy of this instance with a property set. */
  public MathTerms with(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new EnumMap<>(Prop.class);
    map2.putAll(map);
    prop.setLenient(map2, value);
    return new MathTerms(map2, tracer);
  }

  /** Returns a copy of this instance with a different tracer. */
  public MathTerms withTracer(Tracer tracer) {
    return new MathTerms(map, tracer);
  }

  /** Returns the grammars that {@link #parse} tries, in order. */
  public List<Grammar> grammars() {
    return grammars;
  }

  /** Parses text, trying each grammar in turn.
   *
   * @throws MathTermParseException if no grammar can parse the text; its
   * position is that of the attempt that got furthest */
  public Ast.Exp parse(TermSource source) {
    final List<ParseResult> results = Parsers.attempt(source, grammars);
    for (ParseResult result : results) {
      if (result.isSuccess()) {
        tracer.onParse(result.grammar, result.exp());
        return result.exp();
      }
      tracer.onParseFailure(result.grammar, result.exception());
    }
    throw MathTermParseException.unparsable(results);
  }

  /** Parses a string, trying each grammar in turn. */
  public Ast.Exp parse(String text) {
    return parse(TermSource.of(text));
  }

  /** Sends the markup of a term to a sink. */
  public void toMarkup(Ast.Exp exp, EventSink sink) {
    MarkupEmitter.emit(exp, sink);
  }

  /** Returns the markup of a term as XML text, indented if the
   * {@link Prop#INDENT} property is set. */
  public String toXml(Ast.Exp exp) {
    final StringBuilder buf = new StringBuilder();
    toMarkup(exp, new MarkupWriter(buf, Prop.INDENT.booleanValue(map)));
    return buf.toString();
  }

  /** Converts markup to a term. */
  public Ast.Exp fromMarkup(MarkupNode node) {
    final Ast.Exp exp = MarkupExtractor.extract(node);
    tracer.onExtract(exp);
    return exp;
  }

  /** Renders a term in the default notation, given by the
   * {@link Prop#NOTATION} property. */
  public String render(Ast.Exp exp) {
    return render(exp, Prop.NOTATION.stringValue(map));
  }

  /** Renders a term in a given notation. */
  public String render(Ast.Exp exp, String notation) {
    final String text = Notations.render(exp, notation);
    tracer.onRender(notation, text);
    return text;
  }

  /** Parses text and renders it in a given notation. */
  public String convert(String text, String notation) {
    return render(parse(text), notation);
  }
}

// End MathTerms.java
