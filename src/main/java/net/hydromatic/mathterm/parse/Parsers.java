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
package net.hydromatic.mathterm.parse;

import net.hydromatic.mathterm.ast.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Parses an arithmetic term, such as "1 + 2 * sin(x)".
   *
   * @throws MathTermParseException if the text is not a valid term */
  public static Ast.Exp parseTerm(String text) {
    return parse(Grammar.TERM, text);
  }

  /** Parses a boolean expression, such as "x &gt; 1 and not y = 2".
   *
   * @throws MathTermParseException if the text is not a valid boolean
   * expression */
  public static Ast.Exp parseBoolExpression(String text) {
    return parse(Grammar.BOOL_EXPRESSION, text);
  }

  /** Parses a comma-separated list of terms, such as "1, a, b + 2".
   *
   * @throws MathTermParseException if the text is not a valid list */
  public static Ast.ListExp parseTermList(String text) {
    return (Ast.ListExp) parse(Grammar.TERM_LIST, text);
  }

  /** Parses text using a given grammar. */
  public static Ast.Exp parse(Grammar grammar, String text) {
    final TermParserImpl parser = TermParserImpl.of(text);
    try {
      return grammar.parse(parser);
    } catch (ParseException e) {
      throw parser.error(e);
    }
  }

  /** Parses text using each of a list of grammars in turn, stopping after
   * the first that succeeds.
   *
   * <p>Returns one result per attempt; the last result is the successful
   * one, if any. This is how a caller that does not know whether its input
   * is a term or a boolean expression should proceed: attempt
   * {@link Grammar#TERM} then {@link Grammar#BOOL_EXPRESSION}. */
  public static List<ParseResult> attempt(TermSource source,
      List<Grammar> grammars) {
    final String text = source.read();
    final ImmutableList.Builder<ParseResult> results = ImmutableList.builder();
    for (Grammar grammar : grammars) {
      try {
        results.add(ParseResult.success(grammar, parse(grammar, text)));
        break;
      } catch (MathTermParseException e) {
        results.add(ParseResult.failure(grammar, e));
      }
    }
    return results.build();
  }

  /** Returns the successful result among a list of results, if any. */
  public static Optional<ParseResult> firstSuccess(
      List<ParseResult> results) {
    return results.stream().filter(ParseResult::isSuccess).findFirst();
  }
}

// End Parsers.java
