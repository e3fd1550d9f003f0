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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/** Event sink that builds a tree of {@link MarkupElement}.
 *
 * <p>Adjacent text events are merged. */
public class MarkupTreeBuilder implements EventSink {
  private final Deque<Frame> stack = new ArrayDeque<>();
  private @Nullable MarkupElement root;

  @Override public void prefixDeclaration(String namespaceUri) {
    // elements are identified by local name; the namespace is implied
  }

  @Override public void open(String name, Map<String, String> attributes) {
    checkState(root == null, "document already has a root element");
    stack.push(new Frame(name, attributes));
  }

  @Override public void text(String content) {
    checkState(!stack.isEmpty(), "text outside element");
    stack.peek().text(content);
  }

  @Override public void close(String name) {
    checkState(!stack.isEmpty(), "close without open: %s", name);
    final Frame frame = stack.pop();
    checkState(frame.name.equals(name), "expected close of %s, got %s",
        frame.name, name);
    final MarkupElement element = frame.build();
    if (stack.isEmpty()) {
      root = element;
    } else {
      stack.peek().add(element);
    }
  }

  /** Returns the root element.
   *
   * @throws IllegalStateException if the document is not complete */
  public MarkupElement root() {
    checkState(root != null && stack.isEmpty(), "document is not complete");
    return root;
  }

  /** Element under construction. */
  private static class Frame {
    final String name;
    final ImmutableMap<String, String> attributes;
    final ImmutableList.Builder<Object> content = ImmutableList.builder();
    final StringBuilder text = new StringBuilder();

    Frame(String name, Map<String, String> attributes) {
      this.name = name;
      this.attributes = ImmutableMap.copyOf(attributes);
    }

    void text(String s) {
      text.append(s);
    }

    void add(MarkupElement element) {
      flush();
      content.add(element);
    }

    MarkupElement build() {
      flush();
      return new MarkupElement(name, attributes, content.build());
    }

    private void flush() {
      if (text.length() > 0) {
        content.add(text.toString());
        text.setLength(0);
      }
    }
  }
}

// End MarkupTreeBuilder.java
