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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A node of the Komrad syntax tree. Statements are expressions too (see {@link Statement}), so the
 * declaration forms ({@link Assignment}, {@link FieldDecl}, {@link HandlerDecl}, {@link AgentDecl})
 * implement this interface along with the ordinary expressions.
 *
 * <p>All implementations are immutable records; equality is structural.
 */
public sealed interface Expr {

  /** Renders this node in (approximately) the syntax it was parsed from. */
  default String render() {
    return Exprs.render(this);
  }

  /**
   * A literal number, string, boolean or none. {@code value} is a Long, Double, String, Boolean, or
   * null (for {@code none}).
   */
  record Literal(@Nullable Object value) implements Expr {
    public static final Literal NONE = new Literal(null);
    public static final Literal TRUE = new Literal(true);
    public static final Literal FALSE = new Literal(false);

    public Literal {
      Preconditions.checkArgument(
          value == null
              || value instanceof Long
              || value instanceof Double
              || value instanceof String
              || value instanceof Boolean,
          "Unexpected literal %s",
          value);
    }

    public static Literal of(long n) {
      return new Literal(n);
    }

    public static Literal of(double d) {
      return new Literal(d);
    }

    public static Literal of(String s) {
      return new Literal(s);
    }
  }

  /** A reference to a name; may turn out to be a word or a self-send if the name is unbound. */
  record Variable(String name) implements Expr {}

  /**
   * A message send {@code target term*}. If {@code target} is a {@link Variable} that is unbound
   * when the send is evaluated, the send is directed at the current agent.
   */
  record Send(Expr target, ImmutableList<Expr> terms) implements Expr {
    /** Returns a copy of this send with {@code term} appended; used to desugar pipelines. */
    public Send withLastTerm(Expr term) {
      return new Send(
          target, ImmutableList.<Expr>builderWithExpectedSize(terms.size() + 1)
              .addAll(terms)
              .add(term)
              .build());
    }
  }

  /** A block literal; evaluates to a closure over the current scope. */
  record BlockExpr(ImmutableList<Statement> body) implements Expr {}

  record ListExpr(ImmutableList<Expr> elements) implements Expr {}

  record MappingExpr(ImmutableList<Entry> entries) implements Expr {
    public record Entry(Expr key, Expr value) {}
  }

  enum BinaryOp {
    OR("||", 1),
    AND("&&", 2),
    EQ("==", 3),
    NE("!=", 3),
    LT("<", 3),
    LE("<=", 3),
    GT(">", 3),
    GE(">=", 3),
    DIVISIBLE("%%", 3),
    ADD("+", 4),
    SUBTRACT("-", 4),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5);

    public final String symbol;

    /** Higher binds tighter. */
    public final int precedence;

    BinaryOp(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }
  }

  record Binary(BinaryOp op, Expr left, Expr right) implements Expr {}

  enum UnaryOp {
    NOT("!"),
    NEGATE("-");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  record Unary(UnaryOp op, Expr operand) implements Expr {}

  /**
   * {@code spawn agentName}, optionally followed by either a list of field assignments ({@code
   * spawn C { count = 0 }}) or an expression that evaluates to a mapping ({@code spawn C [count:
   * 0]}). At most one of {@code fields} and {@code config} is non-empty/non-null.
   */
  record Spawn(String agentName, ImmutableList<Assignment> fields, @Nullable Expr config)
      implements Expr {
    public Spawn {
      Preconditions.checkArgument(fields.isEmpty() || config == null);
    }
  }

  /** {@code *expr}: runs the block that {@code expr} evaluates to. */
  record Expand(Expr block) implements Expr {}

  /** A fenced verbatim text segment; evaluates to its text as a string. */
  record EmbeddedText(ImmutableList<String> tags, String text) implements Expr {}

  /** {@code name = value} */
  record Assignment(String name, Expr value) implements Expr {}

  /** {@code name: typeName = value}; only allowed at the top level or in an agent body. */
  record FieldDecl(String name, String typeName, Expr value) implements Expr {}

  /** {@code [pattern] { body }} */
  record HandlerDecl(Pattern pattern, ImmutableList<Statement> body, Location location)
      implements Expr {}

  /** {@code agent Name { ... }} */
  record AgentDecl(AgentDefinition definition) implements Expr {}
}
