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
import net.hydromatic.mathterm.parse.Grammar;
import net.hydromatic.mathterm.parse.MathTermParseException;

/** Called on various events while converting terms. */
public interface Tracer {
  /** Called when text has been parsed successfully by a grammar. */
  void onParse(Grammar grammar, Ast.Exp exp);

  /** Called when an attempt to parse text using a grammar has failed. The
   * next grammar, if any, will be tried. */
  void onParseFailure(Grammar grammar, MathTermParseException e);

  /** Called when a term has been extracted from markup. */
  void onExtract(Ast.Exp exp);

  /** Called when a term has been rendered in a notation. */
  void onRender(String notation, String text);
}

// End Tracer.java
