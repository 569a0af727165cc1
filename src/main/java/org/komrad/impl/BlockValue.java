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

import org.komrad.ast.Expr;

/**
 * A block together with the scope it was created in. Expanding the block ({@code *b}) runs its
 * statements in that scope again each time, so it sees the current values of any fields it reads.
 */
public record BlockValue(Expr.BlockExpr block, Scope env) implements Value {

  @Override
  public BaseType baseType() {
    return BaseType.BLOCK;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof BlockValue b && b.block.equals(block) && b.env == env;
  }

  @Override
  public int hashCode() {
    return block.hashCode();
  }

  @Override
  public String toString() {
    return block.render();
  }
}
