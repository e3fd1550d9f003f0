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

import net.hydromatic.mathterm.ast.Pos;
import net.hydromatic.mathterm.util.MathTermException;

import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Exception caused by a parse error.
 *
 * <p>Malformed or incomplete input is never partially consumed; the
 * exception says where parsing stopped, what was expected there, and what
 * was found. The cause is the {@link ParseException} thrown by the
 * generated parser. */
public class MathTermParseException extends RuntimeException
    implements MathTermException {
  /** Kinds of token that can start an operand; if the parser expected
   * any operand, the error message says "expression" rather than listing
   * them all. */
  private static final ImmutableSet<Integer> OPERAND_START =
      ImmutableSet.of(TermParserImplConstants.INTEGER_LITERAL,
          TermParserImplConstants.DECIMAL_LITERAL,
          TermParserImplConstants.E_NOTATION_LITERAL,
          TermParserImplConstants.IMAGINARY_LITERAL,
          TermParserImplConstants.RATIONAL_LITERAL,
          TermParserImplConstants.TRUE,
          TermParserImplConstants.FALSE,
          TermParserImplConstants.IDENTIFIER,
          TermParserImplConstants.CASE,
          TermParserImplConstants.NOT,
          TermParserImplConstants.MINUS,
          TermParserImplConstants.LPAREN,
          TermParserImplConstants.LBRACKET,
          TermParserImplConstants.LBRACE);

  private final Pos pos;
  private final String expected;
  private final String found;

  MathTermParseException(ParseException cause, Pos pos, String expected,
      String found) {
    super(message(pos, expected, found), cause);
    this.pos = requireNonNull(pos);
    this.expected = requireNonNull(expected);
    this.found = requireNonNull(found);
  }

  /** Converts an exception thrown by the generated parser. The position
   * is that of the token after the last token consumed. */
  static MathTermParseException of(ParseException e, TermParserImpl parser) {
    final Token token = requireNonNull(e.currentToken, "currentToken").next;
    final SortedSet<Integer> kinds = new TreeSet<>();
    if (e.expectedTokenSequences != null) {
      for (int[] sequence : e.expectedTokenSequences) {
        if (sequence.length == 1) {
          kinds.add(sequence[0]);
        }
      }
    }
    return new MathTermParseException(e, parser.pos(token),
        describeExpected(kinds), describe(token));
  }

  /** Describes the kinds of token that were expected, for example
   * "\")\" or \"]\"". */
  private static String describeExpected(SortedSet<Integer> kinds) {
    final List<String> names = new ArrayList<>();
    final boolean operand =
        kinds.contains(TermParserImplConstants.IDENTIFIER);
    if (operand) {
      names.add("expression");
    }
    for (int kind : kinds) {
      if (!operand || !OPERAND_START.contains(kind)) {
        names.add(TermParserImplConstants.tokenImage[kind]);
      }
    }
    if (names.size() <= 1) {
      return String.join("", names);
    }
    return String.join(", ", names.subList(0, names.size() - 1))
        + " or " + names.get(names.size() - 1);
  }

  /** Describes a token as it appears in an error message. */
  private static String describe(Token token) {
    return token.kind == TermParserImplConstants.EOF
        ? TermParserImplConstants.tokenImage[TermParserImplConstants.EOF]
        : "\"" + token.image + "\"";
  }

  private MathTermParseException(String message, MathTermParseException e) {
    super(message);
    this.pos = e.pos;
    this.expected = e.expected;
    this.found = e.found;
  }

  /** Creates an exception that reports that a piece of text could not be
   * parsed by any of several grammars.
   *
   * <p>The position is that of the attempt that got furthest; the other
   * attempts' exceptions are attached as suppressed exceptions. */
  public static MathTermParseException unparsable(List<ParseResult> results) {
    checkArgument(!results.isEmpty());
    MathTermParseException furthest = null;
    for (ParseResult result : results) {
      checkArgument(!result.isSuccess(), "%s succeeded", result.grammar);
      furthest = furthest(furthest, result.exception());
    }
    final String grammars = results.stream()
        .map(r -> r.grammar.camelName)
        .collect(Collectors.joining(", "));
    final MathTermParseException e =
        new MathTermParseException("Not parsable as any of [" + grammars
            + "]: " + requireNonNull(furthest).getMessage(), furthest);
    for (ParseResult result : results) {
      e.addSuppressed(result.exception());
    }
    return e;
  }

  /** Returns whichever of two exceptions occurred later in the input.
   * If they are at the same position, returns the first. */
  private static MathTermParseException furthest(MathTermParseException e0,
      MathTermParseException e1) {
    if (e0 == null) {
      return e1;
    }
    return e1.pos.startOffset > e0.pos.startOffset ? e1 : e0;
  }

  private static String message(Pos pos, String expected, String found) {
    return "Encountered " + found + " at line " + pos.startLine
        + ", column " + pos.startColumn + ". Was expecting: " + expected;
  }

  @Override public Pos pos() {
    return pos;
  }

  /** Returns a description of what the parser expected, for example
   * "\")\"" or "expression". */
  public String expected() {
    return expected;
  }

  /** Returns a description of the token that was found instead, for
   * example "\"*\"" or "&lt;EOF&gt;". */
  public String found() {
    return found;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End MathTermParseException.java
