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
package net.hydromatic.mathterm.parse;

import com.google.common.io.CharStreams;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

import static java.util.Objects.requireNonNull;

/** Source of the text of a term.
 *
 * <p>Either {@link RawText} or {@link Stream}; the text is read once, by
 * {@link #read()}, before parsing starts. */
public abstract class TermSource {
  private TermSource() {}

  /** Creates a source from a string. */
  public static TermSource of(String text) {
    return new RawText(text);
  }

  /** Creates a source that reads from a character stream. The stream is
   * read to the end but not closed. */
  public static TermSource of(Reader reader) {
    return new Stream(reader);
  }

  /** Returns the text. */
  public abstract String read();

  /** Source whose text is a string. */
  public static final class RawText extends TermSource {
    public final String text;

    RawText(String text) {
      this.text = requireNonNull(text);
    }

    @Override public String read() {
      return text;
    }

    @Override public String toString() {
      return text;
    }
  }

  /** Source whose text comes from a {@link Reader}. */
  public static final class Stream extends TermSource {
    private final Reader reader;

    Stream(Reader reader) {
      this.reader = requireNonNull(reader);
    }

    @Override public String read() {
      try {
        return CharStreams.toString(reader);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}

// End TermSource.java
