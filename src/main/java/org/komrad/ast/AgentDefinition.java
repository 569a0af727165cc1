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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * A named template for agent instances. Never executed directly: each spawn runs {@code
 * initializers} in the new instance to seed its fields, and the instance dispatches messages to
 * {@code handlers} in declaration order.
 *
 * <p>{@code fieldTypes} has an entry for each field declared with a type ({@code name: Type =
 * expr}); spawn-site overrides of those fields are checked against the type.
 */
public record AgentDefinition(
    String name,
    ImmutableList<Statement> initializers,
    ImmutableList<Expr.HandlerDecl> handlers,
    ImmutableMap<String, String> fieldTypes,
    Location location) {

  /** Returns the declared type of the given field, or null if it has none. */
  public @Nullable String fieldType(String field) {
    return fieldTypes.get(field);
  }
}
