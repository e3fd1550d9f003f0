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
package net.hydromatic.mathterm;

import net.hydromatic.mathterm.ast.Ast;
import net.hydromatic.mathterm.parse.Grammar;
import net.hydromatic.mathterm.parse.MathTermParseException;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each successful
   * parse, then calls the underlying tracer. */
  public static Tracer withOnParse(Tracer tracer,
      BiConsumer<Grammar, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParse(Grammar grammar, Ast.Exp exp) {
        consumer.accept(grammar, exp);
        super.onParse(grammar, exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on each failed
   * parse, then calls the underlying tracer. */
  public static Tracer withOnParseFailure(Tracer tracer,
      BiConsumer<Grammar, MathTermParseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParseFailure(Grammar grammar,
          MathTermParseException e) {
        consumer.accept(grammar, e);
        super.onParseFailure(grammar, e);
      }
    };
  }

  public static Tracer withOnExtract(Tracer tracer,
      Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onExtract(Ast.Exp exp) {
        consumer.accept(exp);
        super.onExtract(exp);
      }
    };
  }

  public static Tracer withOnRender(Tracer tracer,
      BiConsumer<String, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRender(String notation, String text) {
        consumer.accept(notation, text);
        super.onRender(notation, text);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onParse(Grammar grammar, Ast.Exp exp) {
    }

    @Override public void onParseFailure(Grammar grammar,
        MathTermParseException e) {
    }

    @Override public void onExtract(Ast.Exp exp) {
    }

    @Override public void onRender(String notation, String text) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onParse(Grammar grammar, Ast.Exp exp) {
      tracer.onParse(grammar, exp);
    }

    @Override public void onParseFailure(Grammar grammar,
        MathTermParseException e) {
      tracer.onParseFailure(grammar, e);
    }

    @Override public void onExtract(Ast.Exp exp) {
      tracer.onExtract(exp);
    }

    @Override public void onRender(String notation, String text) {
      tracer.onRender(notation, text);
    }
  }
}

// End Tracers.java
