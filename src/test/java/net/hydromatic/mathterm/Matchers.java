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
import net.hydromatic.mathterm.ast.AstNode;
import net.hydromatic.mathterm.ast.Op;

import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation, for example
   * "(+ 1 (* 2 3))". */
  public static <T extends AstNode> Matcher<T> isAst(String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        return t.toString().equals(expected);
      }
    };
  }

  /** Matches a literal by kind and text. */
  public static Matcher<Ast.Exp> isLiteral(Op op, String text) {
    return new TypeSafeMatcher<Ast.Exp>() {
      @Override protected boolean matchesSafely(Ast.Exp exp) {
        return exp instanceof Ast.Literal
            && exp.op == op
            && ((Ast.Literal) exp).value.toString().equals(text);
      }

      @Override public void describeTo(Description description) {
        description.appendText("literal " + op + " with text " + text);
      }
    };
  }
}

// End Matchers.java
