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
package net.hydromatic.mathterm.notation;

import net.hydromatic.mathterm.ast.Ast;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Registry of notations.
 *
 * <p>Initially holds "infix", "prefix" and "postfix". The registry is an
 * immutable map that is replaced on each registration, so lookups need no
 * lock. */
public final class Notations {
  private Notations() {}

  private static volatile ImmutableMap<String, NotationBuilder> builders =
      ImmutableMap.of("infix", InfixBuilder.INSTANCE,
          "prefix", PolishBuilder.PREFIX,
          "postfix", PolishBuilder.POSTFIX);

  /** Registers a builder under a name, replacing any builder that already
   * has that name. */
  public static synchronized void register(String name,
      NotationBuilder builder) {
    requireNonNull(name, "name");
    requireNonNull(builder, "builder");
    final Map<String, NotationBuilder> map = new LinkedHashMap<>(builders);
    map.put(name, builder);
    builders = ImmutableMap.copyOf(map);
  }

  /** Returns the names of the registered notations, in order of
   * registration. */
  public static Set<String> names() {
    return builders.keySet();
  }

  /** Returns the builder for a notation.
   *
   * @throws UnknownNotationException if there is no such notation */
  public static NotationBuilder lookup(String name) {
    final ImmutableMap<String, NotationBuilder> map = builders;
    final NotationBuilder builder = map.get(name);
    if (builder == null) {
      throw new UnknownNotationException(name, map.keySet());
    }
    return builder;
  }

  /** Renders a term in a given notation.
   *
   * @throws UnknownNotationException if there is no such notation */
  public static String render(Ast.Exp exp, String name) {
    return lookup(name).build(exp);
  }
}

// End Notations.java
