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

import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Outcome of parsing a piece of text with one {@link Grammar}: either an
 * expression or the exception that explains why the text does not conform
 * to the grammar. */
public class ParseResult {
  public final Grammar grammar;
  private final Ast.@Nullable Exp exp;
  private final @Nullable MathTermParseException exception;

  private ParseResult(Grammar grammar, Ast.@Nullable Exp exp,
      @Nullable MathTermParseException exception) {
    this.grammar = requireNonNull(grammar);
    this.exp = exp;
    this.exception = exception;
    checkArgument((exp == null) != (exception == null));
  }

  static ParseResult success(Grammar grammar, Ast.Exp exp) {
    return new ParseResult(grammar, requireNonNull(exp), null);
  }

  static ParseResult failure(Grammar grammar,
      MathTermParseException exception) {
    return new ParseResult(grammar, null, requireNonNull(exception));
  }

  public boolean isSuccess() {
    return exp != null;
  }

  /** Returns the expression; throws if parsing failed. */
  public Ast.Exp exp() {
    if (exp == null) {
      throw new IllegalStateException("parse with " + grammar.camelName
          + " failed", exception);
    }
    return exp;
  }

  /** Returns the exception; throws if parsing succeeded. */
  public MathTermParseException exception() {
    if (exception == null) {
      throw new IllegalStateException("parse with " + grammar.camelName
          + " succeeded");
    }
    return exception;
  }

  @Override public String toString() {
    return grammar.camelName + ": "
        + (exp != null ? exp : requireNonNull(exception).getMessage());
  }
}

// End ParseResult.java
