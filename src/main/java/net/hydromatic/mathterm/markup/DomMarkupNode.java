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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import static java.util.Objects.requireNonNull;

/** Adapts a W3C DOM {@link Element} to {@link MarkupNode}. */
public class DomMarkupNode implements MarkupNode {
  private static final String DISALLOW_DOCTYPE =
      "http://apache.org/xml/features/disallow-doctype-decl";

  private final Element element;

  public DomMarkupNode(Element element) {
    this.element = requireNonNull(element);
  }

  /** Wraps the document element of a document. */
  public static DomMarkupNode of(Document document) {
    return new DomMarkupNode(document.getDocumentElement());
  }

  /** Parses XML text into a document, and wraps its document element.
   *
   * <p>Documents that contain a DOCTYPE declaration are rejected, so that
   * no entity is ever resolved.
   *
   * @throws IllegalArgumentException if the text is not well-formed XML,
   * or has a DOCTYPE */
  public static DomMarkupNode parse(String xml) {
    try {
      final DocumentBuilderFactory factory =
          DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature(DISALLOW_DOCTYPE, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      final Document document = factory.newDocumentBuilder()
          .parse(new InputSource(new StringReader(xml)));
      return of(document);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e);
    } catch (SAXException e) {
      throw new IllegalArgumentException("invalid XML: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns the underlying DOM element. */
  public Element element() {
    return element;
  }

  @Override public String kind() {
    final String localName = element.getLocalName();
    return localName != null ? localName : element.getTagName();
  }

  @Override public List<DomMarkupNode> children() {
    final ImmutableList.Builder<DomMarkupNode> b = ImmutableList.builder();
    final NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      final Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        b.add(new DomMarkupNode((Element) node));
      }
    }
    return b.build();
  }

  @Override public List<String> textParts() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    final StringBuilder buf = new StringBuilder();
    final NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      final Node node = nodes.item(i);
      switch (node.getNodeType()) {
      case Node.ELEMENT_NODE:
        b.add(buf.toString());
        buf.setLength(0);
        break;
      case Node.TEXT_NODE:
      case Node.CDATA_SECTION_NODE:
        buf.append(node.getNodeValue());
        break;
      default:
        break;
      }
    }
    return b.add(buf.toString()).build();
  }

  @Override public @Nullable String attribute(String name) {
    return element.hasAttribute(name) ? element.getAttribute(name) : null;
  }
}

// End DomMarkupNode.java
