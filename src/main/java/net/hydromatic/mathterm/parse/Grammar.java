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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/** Grammar that text can be parsed with.
 *
 * <p>The parser never tries one grammar after another; callers that do not
 * know which grammar their input conforms to list the grammars to try, in
 * order, and call {@link Parsers#attempt}. */
public enum Grammar {
  /** Arithmetic term, optionally a single relation; for example
   * "1 + 2 * x" or "a &lt; b". */
  TERM {
    @Override Ast.Exp parse(TermParserImpl parser) throws ParseException {
      return parser.termEof();
    }
  },

  /** Boolean combination of relations and terms; for example
   * "a = 1 or not b &gt; 2". */
  BOOL_EXPRESSION {
    @Override Ast.Exp parse(TermParserImpl parser) throws ParseException {
      return parser.boolExpressionEof();
    }
  },

  /** Comma-separated list of terms; for example "1, x, 2 * y". */
  TERM_LIST {
    @Override Ast.Exp parse(TermParserImpl parser) throws ParseException {
      return parser.termListEof();
    }
  };

  /** Name in lower camel case, for example "boolExpression". */
  public final String camelName =
      CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());

  private static final ImmutableMap<String, Grammar> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Grammar> b = ImmutableMap.builder();
    for (Grammar grammar : values()) {
      b.put(grammar.camelName.toLowerCase(Locale.ROOT), grammar);
    }
    BY_NAME = b.build();
  }

  /** Parses the whole input of a parser. */
  abstract Ast.Exp parse(TermParserImpl parser) throws ParseException;

  /** Looks up a grammar by name, case-insensitively; accepts either
   * "boolExpression" or "BOOL_EXPRESSION". Throws if not found. */
  public static Grammar lookup(String name) {
    final Grammar grammar =
        BY_NAME.get(name.replace("_", "").toLowerCase(Locale.ROOT));
    if (grammar == null) {
      throw new IllegalArgumentException("unknown grammar '" + name
          + "'; expected one of " + BY_NAME.keySet());
    }
    return grammar;
  }
}

// End Grammar.java
