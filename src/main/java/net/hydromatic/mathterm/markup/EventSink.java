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

import java.util.Map;

/** Receives the events that describe a markup document.
 *
 * <p>{@link MarkupEmitter} calls the methods in this order:
 * {@link #startDocument()}, {@link #prefixDeclaration(String)}, a
 * well-nested sequence of {@link #open}, {@link #text} and {@link #close}
 * calls, then {@link #endDocument()}.
 *
 * <p>Element names are local names in the namespace given to
 * {@link #prefixDeclaration(String)}; attribute names have no namespace. */
public interface EventSink {
  /** Called before any other event. */
  default void startDocument() {
  }

  /** Called after all other events. */
  default void endDocument() {
  }

  /** Declares the default namespace of the elements that follow. */
  void prefixDeclaration(String namespaceUri);

  /** Starts an element. */
  void open(String name, Map<String, String> attributes);

  /** Adds character data to the current element. */
  void text(String content);

  /** Ends the current element. */
  void close(String name);
}

// End EventSink.java
