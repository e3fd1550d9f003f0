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
package net.hydromatic.mathterm.markup;

import net.hydromatic.mathterm.ast.Pos;
import net.hydromatic.mathterm.util.MathTermException;

/** Exception thrown when markup has a shape that cannot be converted to an
 * AST; for example, function composition, an unknown element, or a
 * "piece" that does not have exactly two children. */
public class UnsupportedConstructException extends RuntimeException
    implements MathTermException {
  UnsupportedConstructException(String detail) {
    super(detail);
  }

  @Override public Pos pos() {
    return Pos.ZERO;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End UnsupportedConstructException.java
