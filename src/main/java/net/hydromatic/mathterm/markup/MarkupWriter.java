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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Event sink that writes XML text.
 *
 * <p>Empty elements are written in short form, {@code <pi/>}. The
 * namespace declared by {@link #prefixDeclaration(String)} becomes an
 * {@code xmlns} attribute of the next element.
 *
 * <p>If {@code indent} is true, each child element starts on a new line,
 * indented by two spaces per level, except inside elements that contain
 * text, where white space would change the content.
 *
 * <p>Text and attribute values that contain characters XML 1.0 does not
 * allow, such as control characters and unpaired surrogates, are rejected
 * with {@link IllegalArgumentException}. */
public class MarkupWriter implements EventSink {
  private final StringBuilder buf;
  private final boolean indent;
  private final Deque<Frame> stack = new ArrayDeque<>();
  private @Nullable String namespaceUri;
  private boolean startTagOpen;

  public MarkupWriter(StringBuilder buf, boolean indent) {
    this.buf = requireNonNull(buf);
    this.indent = indent;
  }

  @Override public void endDocument() {
    if (indent) {
      buf.append('\n');
    }
  }

  @Override public void prefixDeclaration(String namespaceUri) {
    this.namespaceUri = namespaceUri;
  }

  @Override public void open(String name, Map<String, String> attributes) {
    finishStartTag();
    final Frame parent = stack.peek();
    if (parent != null) {
      if (indent && !parent.hasText) {
        newline(stack.size());
      }
      parent.hasElements = true;
    }
    buf.append('<').append(name);
    if (namespaceUri != null) {
      attribute("xmlns", namespaceUri);
      namespaceUri = null;
    }
    attributes.forEach(this::attribute);
    startTagOpen = true;
    stack.push(new Frame());
  }

  @Override public void text(String content) {
    finishStartTag();
    requireNonNull(stack.peek(), "text outside element").hasText = true;
    escape(content, false);
  }

  @Override public void close(String name) {
    final Frame frame = stack.pop();
    if (startTagOpen) {
      buf.append("/>");
      startTagOpen = false;
      return;
    }
    if (indent && frame.hasElements && !frame.hasText) {
      newline(stack.size());
    }
    buf.append("</").append(name).append('>');
  }

  private void attribute(String name, String value) {
    buf.append(' ').append(name).append("=\"");
    escape(value, true);
    buf.append('"');
  }

  private void finishStartTag() {
    if (startTagOpen) {
      buf.append('>');
      startTagOpen = false;
    }
  }

  private void newline(int depth) {
    buf.append('\n');
    for (int i = 0; i < depth; i++) {
      buf.append("  ");
    }
  }

  private void escape(String s, boolean attribute) {
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (Character.isSurrogate(c)) {
        final int codePoint = s.codePointAt(i);
        if (!Character.isSupplementaryCodePoint(codePoint)) {
          throw invalidCharacter(codePoint);
        }
        buf.appendCodePoint(codePoint);
        ++i;
        continue;
      }
      if (!isXmlChar(c)) {
        throw invalidCharacter(c);
      }
      switch (c) {
      case '&':
        buf.append("&amp;");
        break;
      case '<':
        buf.append("&lt;");
        break;
      case '>':
        buf.append("&gt;");
        break;
      case '"':
        buf.append(attribute ? "&quot;" : "\"");
        break;
      default:
        buf.append(c);
      }
    }
  }

  /** Returns whether a character in the Basic Multilingual Plane may
   * appear in an XML 1.0 document. */
  private static boolean isXmlChar(char c) {
    return c == '\t' || c == '\n' || c == '\r'
        || c >= 0x20 && c <= 0xD7FF
        || c >= 0xE000 && c <= 0xFFFD;
  }

  private static IllegalArgumentException invalidCharacter(int codePoint) {
    return new IllegalArgumentException(
        String.format("character U+%04X is not allowed in XML", codePoint));
  }

  /** State of an element that has been opened but not closed. */
  private static class Frame {
    boolean hasText;
    boolean hasElements;
  }
}

// End MarkupWriter.java
