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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.komrad.util.StringUtil;

/** Static-only traversal and formatting helpers for the syntax tree. */
public class Exprs {

  private Exprs() {}

  /**
   * Returns the name bound by a predicate hole with the given expression:
   *
   * <ul>
   *   <li>for a binary operation, the subject of its left operand ({@code x >= 3});
   *   <li>for a negation, the subject of its operand;
   *   <li>for a send, the last term that is a variable ({@code Number is-int n}, {@code is-even
   *       n});
   *   <li>otherwise the first variable in source order.
   * </ul>
   */
  public static Optional<String> predicateSubject(Expr predicate) {
    if (predicate instanceof Expr.Variable v) {
      return Optional.of(v.name());
    } else if (predicate instanceof Expr.Binary binary) {
      Optional<String> left = predicateSubject(binary.left());
      return left.isPresent() ? left : predicateSubject(binary.right());
    } else if (predicate instanceof Expr.Unary unary) {
      return predicateSubject(unary.operand());
    } else if (predicate instanceof Expr.Send send) {
      for (Expr term : send.terms().reverse()) {
        if (term instanceof Expr.Variable v) {
          return Optional.of(v.name());
        }
      }
    }
    return firstVariable(predicate);
  }

  /** Returns the name of the first variable reference in {@code expr}, in source order. */
  public static Optional<String> firstVariable(Expr expr) {
    for (Expr child : children(expr)) {
      if (child instanceof Expr.Variable v) {
        return Optional.of(v.name());
      }
      Optional<String> nested = firstVariable(child);
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  /** Returns the direct subexpressions of {@code expr}, in source order. */
  public static ImmutableList<Expr> children(Expr expr) {
    if (expr instanceof Expr.Send send) {
      return ImmutableList.<Expr>builder().add(send.target()).addAll(send.terms()).build();
    } else if (expr instanceof Expr.Binary binary) {
      return ImmutableList.of(binary.left(), binary.right());
    } else if (expr instanceof Expr.Unary unary) {
      return ImmutableList.of(unary.operand());
    } else if (expr instanceof Expr.ListExpr list) {
      return list.elements();
    } else if (expr instanceof Expr.MappingExpr mapping) {
      ImmutableList.Builder<Expr> builder = ImmutableList.builder();
      mapping.entries().forEach(e -> builder.add(e.key(), e.value()));
      return builder.build();
    } else if (expr instanceof Expr.Expand expand) {
      return ImmutableList.of(expand.block());
    } else if (expr instanceof Expr.Assignment assignment) {
      return ImmutableList.of(assignment.value());
    } else if (expr instanceof Expr.FieldDecl field) {
      return ImmutableList.of(field.value());
    } else if (expr instanceof Expr.Spawn spawn) {
      if (spawn.config() != null) {
        return ImmutableList.of(spawn.config());
      }
      return ImmutableList.<Expr>copyOf(spawn.fields());
    }
    // Blocks, handlers and agent declarations introduce their own statement sequences; their
    // contents aren't subexpressions in the sense used here.
    return ImmutableList.of();
  }

  /** Renders {@code expr} in (approximately) Komrad syntax. */
  public static String render(Expr expr) {
    if (expr instanceof Expr.Literal literal) {
      Object value = literal.value();
      if (value == null) {
        return "none";
      }
      return (value instanceof String s) ? StringUtil.escape(s) : value.toString();
    } else if (expr instanceof Expr.Variable v) {
      return v.name();
    } else if (expr instanceof Expr.Send send) {
      StringBuilder sb = new StringBuilder(renderOperand(send.target()));
      send.terms().forEach(t -> sb.append(' ').append(renderOperand(t)));
      return sb.toString();
    } else if (expr instanceof Expr.BlockExpr block) {
      return renderBody(block.body());
    } else if (expr instanceof Expr.ListExpr list) {
      ImmutableList<Expr> elements = list.elements();
      return StringUtil.joinElements("[", "]", elements.size(), i -> render(elements.get(i)));
    } else if (expr instanceof Expr.MappingExpr mapping) {
      if (mapping.entries().isEmpty()) {
        return "[:]";
      }
      return mapping.entries().stream()
          .map(e -> render(e.key()) + ": " + render(e.value()))
          .collect(Collectors.joining(", ", "[", "]"));
    } else if (expr instanceof Expr.Binary binary) {
      return renderOperand(binary.left())
          + " "
          + binary.op().symbol
          + " "
          + renderOperand(binary.right());
    } else if (expr instanceof Expr.Unary unary) {
      return unary.op().symbol + renderOperand(unary.operand());
    } else if (expr instanceof Expr.Spawn spawn) {
      if (spawn.config() != null) {
        return "spawn " + spawn.agentName() + " " + renderOperand(spawn.config());
      } else if (spawn.fields().isEmpty()) {
        return "spawn " + spawn.agentName();
      }
      return spawn.fields().stream()
          .map(Exprs::render)
          .collect(Collectors.joining("; ", "spawn " + spawn.agentName() + " { ", " }"));
    } else if (expr instanceof Expr.Expand expand) {
      return "*" + renderOperand(expand.block());
    } else if (expr instanceof Expr.EmbeddedText text) {
      return "```" + String.join(" ", text.tags()) + "\n" + text.text() + "```";
    } else if (expr instanceof Expr.Assignment assignment) {
      return assignment.name() + " = " + render(assignment.value());
    } else if (expr instanceof Expr.FieldDecl field) {
      return field.name() + ": " + field.typeName() + " = " + render(field.value());
    } else if (expr instanceof Expr.HandlerDecl handler) {
      return handler.pattern() + " " + renderBody(handler.body());
    } else if (expr instanceof Expr.AgentDecl decl) {
      AgentDefinition def = decl.definition();
      ImmutableList<String> parts =
          ImmutableList.<String>builder()
              .addAll(def.initializers().stream().map(Statement::toString).iterator())
              .addAll(def.handlers().stream().map(Exprs::render).iterator())
              .build();
      return "agent "
          + def.name()
          + (parts.isEmpty() ? " {}" : " { " + String.join("; ", parts) + " }");
    }
    throw new AssertionError(expr);
  }

  private static String renderBody(List<Statement> body) {
    if (body.isEmpty()) {
      return "{}";
    }
    return body.stream().map(Statement::toString).collect(Collectors.joining("; ", "{ ", " }"));
  }

  /** Renders an operand or send term, parenthesizing it if it wouldn't otherwise parse as one. */
  private static String renderOperand(Expr expr) {
    String s = render(expr);
    boolean compound =
        expr instanceof Expr.Binary
            || expr instanceof Expr.Send
            || expr instanceof Expr.Assignment
            || expr instanceof Expr.Spawn;
    return compound ? "(" + s + ")" : s;
  }
}
