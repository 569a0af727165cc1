/*
 * Copyright 2025 The Komrad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.komrad.ast;

import org.jspecify.annotations.Nullable;

/** One position of a {@link Pattern}; matched against the message term at the same position. */
public interface PatternTerm {

  /** A bare identifier; matches a word with exactly the same text. */
  record Word(String text) implements PatternTerm {
    @Override
    public String toString() {
      return text;
    }
  }

  /** A literal number, string, boolean or none; matches an equal value. */
  record Literal(Expr.Literal literal) implements PatternTerm {
    @Override
    public String toString() {
      return Exprs.render(literal);
    }
  }

  /** {@code _name}: matches anything and binds it. */
  record ValueHole(String name) implements PatternTerm {
    @Override
    public String toString() {
      return "_" + name;
    }
  }

  /** {@code _{name}}: matches only a block, and binds it. */
  record BlockHole(String name) implements PatternTerm {
    @Override
    public String toString() {
      return "_{" + name + "}";
    }
  }

  /** {@code _(name: Type)}: matches a value of the named type, and binds it. */
  record TypedHole(String name, String typeName) implements PatternTerm {
    @Override
    public String toString() {
      return "_(" + name + ": " + typeName + ")";
    }
  }

  /**
   * {@code _(expr)}: binds {@code subject} to the message term, then matches if {@code predicate}
   * evaluates to true.
   */
  record PredicateHole(String subject, Expr predicate) implements PatternTerm {
    @Override
    public String toString() {
      return "_(" + predicate.render() + ")";
    }
  }

  /** {@code _}: matches anything without binding. */
  enum Discard implements PatternTerm {
    INSTANCE;

    @Override
    public String toString() {
      return "_";
    }
  }

  /** Returns the name this term binds, or null if it doesn't bind one. */
  static @Nullable String boundName(PatternTerm term) {
    if (term instanceof ValueHole h) {
      return h.name();
    } else if (term instanceof BlockHole h) {
      return h.name();
    } else if (term instanceof TypedHole h) {
      return h.name();
    } else if (term instanceof PredicateHole h) {
      return h.subject();
    }
    return null;
  }
}
