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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Read-only view of a markup element, as consumed by
 * {@link MarkupExtractor}.
 *
 * <p>Implementations adapt a particular tree representation:
 * {@link MarkupElement} for the in-memory tree, {@link DomMarkupNode} for a
 * W3C DOM. */
public interface MarkupNode {
  /** Returns the local name of this element, without namespace prefix;
   * for example "apply". */
  String kind();

  /** Returns the child elements, in document order. Text, comments and
   * processing instructions are not included. */
  List<? extends MarkupNode> children();

  /** Returns the character data of this element, split at each child
   * element. An element with {@code n} child elements has {@code n + 1}
   * parts, some of which may be empty; for example,
   * {@code <cn>1<sep/>0.3</cn>} has parts "1" and "0.3". */
  List<String> textParts();

  /** Returns the value of an attribute, or null if absent. */
  @Nullable String attribute(String name);

  /** Returns all character data directly inside this element. */
  default String text() {
    return String.join("", textParts());
  }
}

// End MarkupNode.java
