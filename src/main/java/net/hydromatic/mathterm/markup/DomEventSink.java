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
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Map;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import static com.google.common.base.Preconditions.checkState;

import static java.util.Objects.requireNonNull;

/** Event sink that builds a W3C DOM document.
 *
 * <p>Elements are created in the namespace given to
 * {@link #prefixDeclaration(String)}, without prefix. */
public class DomEventSink implements EventSink {
  private final Document document;
  private Node current;
  private @Nullable String namespaceUri;

  /** Creates a sink that builds a new, empty document. */
  public DomEventSink() {
    this(newDocument());
  }

  /** Creates a sink that appends to an existing document, which must not
   * yet have a document element. */
  public DomEventSink(Document document) {
    this.document = requireNonNull(document);
    this.current = document;
  }

  /** Creates an empty, namespace-aware document. */
  static Document newDocument() {
    try {
      final DocumentBuilderFactory factory =
          DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      return factory.newDocumentBuilder().newDocument();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e);
    }
  }

  @Override public void prefixDeclaration(String namespaceUri) {
    this.namespaceUri = namespaceUri;
  }

  @Override public void open(String name, Map<String, String> attributes) {
    final Element element = document.createElementNS(namespaceUri, name);
    attributes.forEach(element::setAttribute);
    current.appendChild(element);
    current = element;
  }

  @Override public void text(String content) {
    current.appendChild(document.createTextNode(content));
  }

  @Override public void close(String name) {
    checkState(current instanceof Element
        && name.equals(current.getLocalName()),
        "close of %s does not match open", name);
    current = current.getParentNode();
  }

  /** Returns the document being built. */
  public Document document() {
    return document;
  }
}

// End DomEventSink.java
