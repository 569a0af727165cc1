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

package org.komrad.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static helpers for rendering Komrad values and source text as strings. */
public final class StringUtil {

  private StringUtil() {}

  /** Single-character escapes, keyed by the character that follows the backslash. */
  private static final ImmutableMap<Character, Character> ESCAPES =
      ImmutableMap.<Character, Character>builder()
          .put('"', '"')
          .put('\'', '\'')
          .put('`', '`')
          .put('\\', '\\')
          .put('b', '\b')
          .put('t', '\t')
          .put('n', '\n')
          .put('f', '\f')
          .put('r', '\r')
          .buildOrThrow();

  private static final Escaper LITERAL_ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\b', "\\b")
          .addEscape('\t', "\\t")
          .addEscape('\n', "\\n")
          .addEscape('\f', "\\f")
          .addEscape('\r', "\\r")
          .build();

  /** Returns {@code s} as a double-quoted Komrad string literal. */
  public static String escape(String s) {
    return "\"" + LITERAL_ESCAPER.escape(s) + "\"";
  }

  /**
   * Returns the string denoted by the body of a Komrad string literal (the text between the
   * quotes). Besides the single-character escapes, {@code \}{@code uXXXX} gives a UTF-16 unit.
   *
   * @throws IllegalArgumentException if {@code body} has a malformed escape sequence
   */
  public static String unescape(String body) {
    int backslash = body.indexOf('\\');
    if (backslash < 0) {
      return body;
    }
    StringBuilder sb = new StringBuilder(body.length());
    int pos = 0;
    while (backslash >= 0) {
      sb.append(body, pos, backslash);
      Preconditions.checkArgument(
          backslash + 1 < body.length(), "Unterminated escape sequence");
      char c = body.charAt(backslash + 1);
      pos = backslash + 2;
      if (c == 'u') {
        Preconditions.checkArgument(pos + 4 <= body.length(), "Incomplete \\u escape");
        sb.append((char) Integer.parseUnsignedInt(body.substring(pos, pos + 4), 16));
        pos += 4;
      } else {
        Character unescaped = ESCAPES.get(c);
        Preconditions.checkArgument(unescaped != null, "Invalid escape \\%s", c);
        sb.append(unescaped.charValue());
      }
      backslash = body.indexOf('\\', pos);
    }
    return sb.append(body, pos, body.length()).toString();
  }

  /**
   * Returns the elements {@code elements.apply(0)} through {@code elements.apply(size - 1)},
   * separated by {@code ", "} and wrapped in {@code prefix} and {@code suffix}.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<?> elements) {
    return joinElements(prefix, suffix, ", ", size, elements);
  }

  public static String joinElements(
      String prefix, String suffix, String separator, int size, IntFunction<?> elements) {
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  /** Returns up to four hex digits derived from the identity hash of {@code x}. */
  public static String id(Object x) {
    return Integer.toHexString(System.identityHashCode(x) & 0xffff);
  }
}
