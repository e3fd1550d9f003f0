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
package net.hydromatic.mathterm.util;

import net.hydromatic.mathterm.ast.Pos;

/** Exception that reports that a term, document or request cannot be
 * represented.
 *
 * <p>All such exceptions are terminal: conversions are exact, so there is
 * nothing to retry. */
public interface MathTermException {
  /** Returns the position where the error occurred, or {@link Pos#ZERO} if
   * the error did not come from parsing text. */
  Pos pos();

  /** Writes a description of the error, including its position. */
  StringBuilder describeTo(StringBuilder buf);
}

// End MathTermException.java
