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

package org.komrad.impl;

import com.google.common.flogger.FluentLogger;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.Expr;
import org.komrad.ast.Pattern;
import org.komrad.ast.PatternTerm;

/**
 * Matches messages against handler patterns.
 *
 * <p>A pattern matches a message only if they have the same number of terms and each term matches
 * the value at the same position: words match the identical word, literals match equal values
 * (comparing numbers by value; keyword literals also match their word), holes bind the value to
 * their name (block holes and typed holes only after checking its type), predicate holes bind
 * their subject and then match if the predicate evaluates to {@code true}, and discards match
 * anything.
 */
final class PatternMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Evaluator evaluator;

  PatternMatcher(Evaluator evaluator) {
    this.evaluator = evaluator;
  }

  /** The handler selected for a message, and the bindings made by its pattern. */
  record Match(Expr.HandlerDecl handler, Scope bindings) {}

  /** Returns the first of {@code handlers} whose pattern matches {@code message}, or null. */
  @Nullable Match select(
      List<Expr.HandlerDecl> handlers, Message message, Scope parent, Activation activation) {
    for (Expr.HandlerDecl handler : handlers) {
      Scope bindings = match(handler.pattern(), message, parent, activation);
      if (bindings != null) {
        return new Match(handler, bindings);
      }
    }
    return null;
  }

  /**
   * If {@code pattern} matches {@code message}, returns a new child of {@code parent} containing
   * the pattern's bindings; otherwise returns null.
   *
   * @param activation used to evaluate predicate holes; may only be null if {@code pattern} has
   *     none
   */
  @Nullable Scope match(
      Pattern pattern, Message message, Scope parent, @Nullable Activation activation) {
    if (pattern.arity() != message.size()) {
      return null;
    }
    Scope bindings = parent.newChild();
    for (int i = 0; i < pattern.arity(); i++) {
      PatternTerm term = pattern.term(i);
      Value value = message.term(i);
      boolean matched;
      if (term instanceof PatternTerm.Word w) {
        matched = value instanceof WordValue wv && wv.text().equals(w.text());
      } else if (term instanceof PatternTerm.Literal lit) {
        matched = literalMatches(Evaluator.literalValue(lit.literal()), value);
      } else if (term instanceof PatternTerm.ValueHole h) {
        bindings.bind(h.name(), value);
        matched = true;
      } else if (term instanceof PatternTerm.BlockHole h) {
        matched = value instanceof BlockValue;
        if (matched) {
          bindings.bind(h.name(), value);
        }
      } else if (term instanceof PatternTerm.TypedHole h) {
        matched = BaseType.matches(h.typeName(), value);
        if (matched) {
          bindings.bind(h.name(), value);
        }
      } else if (term instanceof PatternTerm.PredicateHole h) {
        bindings.bind(h.subject(), value);
        matched = testPredicate(h, bindings, activation);
      } else {
        matched = (term == PatternTerm.Discard.INSTANCE);
      }
      if (!matched) {
        return null;
      }
    }
    return bindings;
  }

  /**
   * The keyword literals {@code true}, {@code false} and {@code none} also match the word with the
   * same text, so that a message built from Java with {@code Message.of("true", ...)} reaches a
   * handler whose pattern starts with the keyword.
   */
  private static boolean literalMatches(Value literal, Value value) {
    boolean keyword = literal instanceof BoolValue || literal == NoneValue.NONE;
    if (keyword && value instanceof WordValue w) {
      return w.text().equals(literal.toString());
    }
    return Value.equal(literal, value);
  }

  private boolean testPredicate(
      PatternTerm.PredicateHole hole, Scope bindings, @Nullable Activation activation) {
    if (activation == null) {
      throw new IllegalArgumentException("Predicate holes need an activation");
    }
    try {
      return evaluator.evaluate(hole.predicate(), bindings, activation) == BoolValue.TRUE;
    } catch (EvalError e) {
      logger.atFine().log("Predicate %s failed: %s", hole, e);
      return false;
    }
  }
}
