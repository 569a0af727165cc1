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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;

/** A parsed source unit: the top-level statements of a module, in order. */
public record Program(String name, ImmutableList<Statement> statements) {

  /** The agent definitions declared at the top level. */
  public ImmutableList<AgentDefinition> agents() {
    return statements.stream()
        .filter(s -> s.expr() instanceof Expr.AgentDecl)
        .map(s -> ((Expr.AgentDecl) s.expr()).definition())
        .collect(toImmutableList());
  }

  /** The module-level ("bare") handlers, such as {@code [main]}. */
  public ImmutableList<Expr.HandlerDecl> handlers() {
    return statements.stream()
        .filter(s -> s.expr() instanceof Expr.HandlerDecl)
        .map(s -> (Expr.HandlerDecl) s.expr())
        .collect(toImmutableList());
  }

  /** The statements that are executed when the module is loaded. */
  public ImmutableList<Statement> body() {
    return statements.stream()
        .filter(
            s -> !(s.expr() instanceof Expr.AgentDecl || s.expr() instanceof Expr.HandlerDecl))
        .collect(toImmutableList());
  }
}
