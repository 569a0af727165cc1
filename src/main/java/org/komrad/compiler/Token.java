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

package org.komrad.compiler;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.Location;

/**
 * A lexical token. {@code text} is the token's source text; {@code value} is its decoded value for
 * literals (Long, Double or String), the name for holes, or an {@link Embedded} for embedded text.
 */
record Token(Type type, String text, @Nullable Object value, Location location) {

  enum Type {
    IDENT("an identifier"),
    AGENT("'agent'"),
    SPAWN("'spawn'"),
    TRUE("'true'"),
    FALSE("'false'"),
    NONE("'none'"),
    INT("a number"),
    FLOAT("a number"),
    STRING("a string"),
    EMBEDDED("embedded text"),
    /** {@code _name} */
    HOLE("a hole"),
    /** {@code _{name}} */
    BLOCK_HOLE("a block hole"),
    /** {@code _(} */
    PRED_OPEN("'_('"),
    /** {@code _} */
    DISCARD("'_'"),
    OR("'||'"),
    AND("'&&'"),
    EQ("'=='"),
    NE("'!='"),
    LT("'<'"),
    LE("'<='"),
    GT("'>'"),
    GE("'>='"),
    DIVISIBLE("'%%'"),
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    PERCENT("'%'"),
    BANG("'!'"),
    PIPE("'|'"),
    ASSIGN("'='"),
    COLON("':'"),
    COMMA("','"),
    SEMI("';'"),
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    NEWLINE("a newline"),
    EOF("end of input");

    final String description;

    Type(String description) {
      this.description = description;
    }
  }

  /** The decoded contents of a fenced text segment. */
  record Embedded(ImmutableList<String> tags, String text) {}

  /** Describes this token for an error message. */
  String describe() {
    return switch (type) {
      case NEWLINE, EOF -> type.description;
      default -> "'" + text + "'";
    };
  }

  @Override
  public String toString() {
    return type + (type == Type.NEWLINE || type == Type.EOF ? "" : "(" + text + ")");
  }
}
