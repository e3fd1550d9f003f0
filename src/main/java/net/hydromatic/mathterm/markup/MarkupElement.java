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
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** Immutable in-memory markup element.
 *
 * <p>Content is a list whose members are either {@link String} (character
 * data) or {@code MarkupElement} (child elements), in document order.
 * Build a tree using {@link MarkupTreeBuilder}. */
public class MarkupElement implements MarkupNode {
  public final String name;
  public final ImmutableMap<String, String> attributes;
  public final ImmutableList<Object> content;

  MarkupElement(String name, ImmutableMap<String, String> attributes,
      ImmutableList<Object> content) {
    this.name = requireNonNull(name);
    this.attributes = requireNonNull(attributes);
    this.content = requireNonNull(content);
  }

  @Override public String kind() {
    return name;
  }

  @Override public List<MarkupElement> children() {
    final ImmutableList.Builder<MarkupElement> b = ImmutableList.builder();
    for (Object o : content) {
      if (o instanceof MarkupElement) {
        b.add((MarkupElement) o);
      }
    }
    return b.build();
  }

  @Override public List<String> textParts() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    final StringBuilder buf = new StringBuilder();
    for (Object o : content) {
      if (o instanceof MarkupElement) {
        b.add(buf.toString());
        buf.setLength(0);
      } else {
        buf.append((String) o);
      }
    }
    return b.add(buf.toString()).build();
  }

  @Override public @Nullable String attribute(String name) {
    return attributes.get(name);
  }

  /** Sends the events that describe this element and its descendants to a
   * sink. Does not send document or namespace events. */
  public void accept(EventSink sink) {
    sink.open(name, attributes);
    for (Object o : content) {
      if (o instanceof MarkupElement) {
        ((MarkupElement) o).accept(sink);
      } else {
        sink.text((String) o);
      }
    }
    sink.close(name);
  }

  @Override public int hashCode() {
    return Objects.hash(name, attributes, content);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof MarkupElement
        && name.equals(((MarkupElement) o).name)
        && attributes.equals(((MarkupElement) o).attributes)
        && content.equals(((MarkupElement) o).content);
  }

  /** Returns the XML text of this element, without namespace
   * declaration. */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    accept(new MarkupWriter(buf, false));
    return buf.toString();
  }
}

// End MarkupElement.java
