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

import net.hydromatic.mathterm.ast.Pos;
import net.hydromatic.mathterm.util.MathTermException;

import static java.util.Objects.requireNonNull;

/** Exception thrown when a term is rendered in a notation that has not
 * been registered. */
public class UnknownNotationException extends RuntimeException
    implements MathTermException {
  private final String name;

  UnknownNotationException(String name, Iterable<String> knownNames) {
    super("Unknown notation '" + name + "'; known notations are "
        + knownNames);
    this.name = requireNonNull(name);
  }

  /** Returns the name that was not found. */
  public String name() {
    return name;
  }

  @Override public Pos pos() {
    return Pos.ZERO;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End UnknownNotationException.java
