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

import com.google.common.collect.ImmutableMap;

/**
 * Every Value has a BaseType, which determines its representation. Type names used in typed holes
 * and typed fields ({@code _(n: Int)}, {@code count: Number = 0}) are checked with {@link
 * #matches}.
 */
public enum BaseType {
  INT("Int"),
  FLOAT("Float"),
  STRING("String"),
  BOOLEAN("Boolean"),
  WORD("Word"),
  LIST("List"),
  MAPPING("Dict"),
  AGENT("Agent"),
  BLOCK("Block"),
  NONE("Empty");

  /** The name used for this type in Komrad source. */
  public final String typeName;

  BaseType(String typeName) {
    this.typeName = typeName;
  }

  /** Alternate spellings accepted in type constraints. */
  private static final ImmutableMap<String, BaseType> ALIASES =
      ImmutableMap.of(
          "Bool", BOOLEAN,
          "Mapping", MAPPING,
          "Map", MAPPING,
          "None", NONE,
          "Str", STRING);

  /**
   * Returns true if {@code value} belongs to the type named {@code typeName}. Besides the BaseType
   * names, {@code Number} matches ints and floats, {@code Any} matches everything, and any other
   * name matches a reference to an agent spawned from the definition with that name.
   */
  public static boolean matches(String typeName, Value value) {
    switch (typeName) {
      case "Any":
        return true;
      case "Number":
        return value.baseType() == INT || value.baseType() == FLOAT;
      default:
        break;
    }
    BaseType alias = ALIASES.get(typeName);
    if (alias != null) {
      return value.baseType() == alias;
    }
    for (BaseType type : values()) {
      if (type.typeName.equals(typeName)) {
        return value.baseType() == type;
      }
    }
    return value instanceof AgentRef ref && ref.typeName().equals(typeName);
  }

  @Override
  public String toString() {
    return typeName;
  }
}
