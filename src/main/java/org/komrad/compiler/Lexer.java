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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.Location;
import org.komrad.compiler.Token.Type;
import org.komrad.util.StringUtil;

/**
 * Splits Komrad source text into tokens.
 *
 * <p>Newlines are significant (they separate statements) except inside parentheses and square
 * brackets; the Lexer tracks bracket nesting so that it only emits {@link Type#NEWLINE} tokens at
 * the top level or directly inside braces. Consecutive newlines produce a single token.
 */
final class Lexer {

  private static final ImmutableMap<String, Type> KEYWORDS =
      ImmutableMap.of(
          "agent", Type.AGENT,
          "spawn", Type.SPAWN,
          "true", Type.TRUE,
          "false", Type.FALSE,
          "none", Type.NONE);

  /** Characters after which a {@code -} directly followed by a digit starts a negative number. */
  private static final String NEGATIVE_NUMBER_CONTEXT = " \t\r\n([{,:=|";

  private final String source;
  private final String sourceName;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  /** The currently open brackets, innermost first. */
  private final ArrayDeque<Character> brackets = new ArrayDeque<>();

  private int pos;
  private int line = 1;
  private int lineStart;
  private @Nullable Type lastType;

  private Lexer(String source, String sourceName) {
    this.source = source;
    this.sourceName = sourceName;
  }

  /** Returns the tokens of {@code source}, ending with {@link Type#EOF}. */
  static ImmutableList<Token> tokenize(String source, String sourceName) throws ParseError {
    Lexer lexer = new Lexer(source, sourceName);
    lexer.run();
    return lexer.tokens.build();
  }

  private void run() throws ParseError {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\r') {
        pos++;
      } else if (c == '\n') {
        newline(pos);
        pos++;
        startLine();
      } else if (source.startsWith("//", pos)) {
        while (pos < source.length() && source.charAt(pos) != '\n') {
          pos++;
        }
      } else if (source.startsWith("/*", pos)) {
        blockComment();
      } else if (Character.isLetter(c)) {
        identifier();
      } else if (c == '_') {
        hole();
      } else if (isDigit(c) || (c == '-' && isDigit(peekChar(1)) && negativeAllowed())) {
        number();
      } else if (source.startsWith("\"\"\"", pos)) {
        rawString();
      } else if (c == '"' || c == '\'') {
        string(c);
      } else if (source.startsWith("```", pos)) {
        embedded();
      } else {
        operator(c);
      }
    }
    newline(pos);
    add(Type.EOF, pos, pos, null);
  }

  private Location location(int offset) {
    return new Location(sourceName, offset, line, offset - lineStart + 1);
  }

  private ParseError error(int offset, String expected, String found) {
    return new ParseError(location(offset), expected, found);
  }

  private void add(Type type, int start, int end, @Nullable Object value) {
    tokens.add(new Token(type, source.substring(start, end), value, location(start)));
    lastType = type;
  }

  private void newline(int offset) {
    boolean significant = brackets.isEmpty() || brackets.peek() == '{';
    if (significant && lastType != null && lastType != Type.NEWLINE) {
      add(Type.NEWLINE, offset, offset, null);
    }
  }

  private void startLine() {
    line++;
    lineStart = pos;
  }

  private char peekChar(int ahead) {
    int i = pos + ahead;
    return (i < source.length()) ? source.charAt(i) : '\0';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private boolean negativeAllowed() {
    return pos == 0 || NEGATIVE_NUMBER_CONTEXT.indexOf(source.charAt(pos - 1)) >= 0;
  }

  private void blockComment() throws ParseError {
    int start = pos;
    int end = source.indexOf("*/", pos + 2);
    if (end < 0) {
      throw error(start, "'*/'", "end of input");
    }
    for (int i = pos; i < end; i++) {
      if (source.charAt(i) == '\n') {
        newline(i);
        pos = i + 1;
        startLine();
      }
    }
    pos = end + 2;
  }

  /** Scans an identifier starting at {@code pos}; returns its end. */
  private int scanIdentifier(int start) {
    int end = start;
    while (end < source.length()) {
      char c = source.charAt(end);
      if (isIdentifierPart(c)) {
        end++;
      } else if (c == '-'
          && end + 1 < source.length()
          && Character.isLetter(source.charAt(end + 1))) {
        // "read-all", "is-int"; "x-1" is still a subtraction
        end++;
      } else {
        break;
      }
    }
    return end;
  }

  private void identifier() {
    int start = pos;
    pos = scanIdentifier(pos);
    String text = source.substring(start, pos);
    add(KEYWORDS.getOrDefault(text, Type.IDENT), start, pos, text);
  }

  private void hole() throws ParseError {
    int start = pos;
    char next = peekChar(1);
    if (Character.isLetter(next)) {
      pos = scanIdentifier(pos + 1);
      add(Type.HOLE, start, pos, source.substring(start + 1, pos));
    } else if (next == '{') {
      pos += 2;
      skipSpaces();
      if (!Character.isLetter(peekChar(0))) {
        throw error(pos, "a name in block hole", describeChar(pos));
      }
      int nameStart = pos;
      pos = scanIdentifier(pos);
      String name = source.substring(nameStart, pos);
      skipSpaces();
      if (peekChar(0) != '}') {
        throw error(pos, "'}'", describeChar(pos));
      }
      pos++;
      add(Type.BLOCK_HOLE, start, pos, name);
    } else if (next == '(') {
      pos += 2;
      brackets.push('(');
      add(Type.PRED_OPEN, start, pos, null);
    } else {
      pos++;
      add(Type.DISCARD, start, pos, null);
    }
  }

  private void skipSpaces() {
    while (peekChar(0) == ' ' || peekChar(0) == '\t') {
      pos++;
    }
  }

  private String describeChar(int offset) {
    return (offset < source.length()) ? "'" + source.charAt(offset) + "'" : "end of input";
  }

  private void number() throws ParseError {
    int start = pos;
    if (source.charAt(pos) == '-') {
      pos++;
    }
    while (isDigit(peekChar(0))) {
      pos++;
    }
    boolean isFloat = peekChar(0) == '.' && isDigit(peekChar(1));
    if (isFloat) {
      pos++;
      while (isDigit(peekChar(0))) {
        pos++;
      }
    }
    String text = source.substring(start, pos);
    try {
      if (isFloat) {
        add(Type.FLOAT, start, pos, Double.parseDouble(text));
      } else {
        add(Type.INT, start, pos, Long.parseLong(text));
      }
    } catch (NumberFormatException e) {
      throw error(start, "a number in range", "'" + text + "'");
    }
  }

  private void string(char quote) throws ParseError {
    int start = pos;
    int i = pos + 1;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == quote) {
        break;
      } else if (c == '\n') {
        throw error(start, "closing " + quote, "end of line");
      } else if (c == '\\') {
        i++;
      }
      i++;
    }
    if (i >= source.length()) {
      throw error(start, "closing " + quote, "end of input");
    }
    String body = source.substring(start + 1, i);
    pos = i + 1;
    add(Type.STRING, start, pos, unescape(body, start));
  }

  private void rawString() throws ParseError {
    int start = pos;
    int end = source.indexOf("\"\"\"", pos + 3);
    if (end < 0) {
      throw error(start, "closing \"\"\"", "end of input");
    }
    String body = source.substring(start + 3, end);
    pos = end + 3;
    add(Type.STRING, start, pos, body);
    countLines(start, pos);
  }

  /**
   * Scans {@code ```tags\ntext```}. The tags are identifiers on the opening line, separated by
   * spaces or commas.
   */
  private void embedded() throws ParseError {
    int start = pos;
    int headerEnd = source.indexOf('\n', pos + 3);
    if (headerEnd < 0) {
      throw error(start, "a newline after '```'", "end of input");
    }
    ImmutableList.Builder<String> tags = ImmutableList.builder();
    for (String tag : source.substring(pos + 3, headerEnd).trim().split("[ ,\t]+")) {
      if (!tag.isEmpty()) {
        tags.add(tag);
      }
    }
    int bodyStart = headerEnd + 1;
    int end = bodyStart;
    while (end < source.length() && !source.startsWith("```", end)) {
      end += (source.charAt(end) == '\\') ? 2 : 1;
    }
    if (end >= source.length()) {
      throw error(start, "closing '```'", "end of input");
    }
    String body = source.substring(bodyStart, end);
    pos = end + 3;
    add(Type.EMBEDDED, start, pos, new Token.Embedded(tags.build(), unescape(body, bodyStart)));
    countLines(start, pos);
  }

  /** Advances the line count past a multi-line token that has already been added. */
  private void countLines(int start, int end) {
    for (int i = start; i < end; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
  }

  private String unescape(String body, int start) throws ParseError {
    try {
      return StringUtil.unescape(body);
    } catch (IllegalArgumentException e) {
      throw error(start, "a valid escape sequence", e.getMessage());
    }
  }

  private void operator(char c) throws ParseError {
    int start = pos;
    Type type =
        switch (c) {
          case '|' -> (peekChar(1) == '|') ? Type.OR : Type.PIPE;
          case '&' -> (peekChar(1) == '&') ? Type.AND : null;
          case '=' -> (peekChar(1) == '=') ? Type.EQ : Type.ASSIGN;
          case '!' -> (peekChar(1) == '=') ? Type.NE : Type.BANG;
          case '<' -> (peekChar(1) == '=') ? Type.LE : Type.LT;
          case '>' -> (peekChar(1) == '=') ? Type.GE : Type.GT;
          case '%' -> (peekChar(1) == '%') ? Type.DIVISIBLE : Type.PERCENT;
          case '+' -> Type.PLUS;
          case '-' -> Type.MINUS;
          case '*' -> Type.STAR;
          case '/' -> Type.SLASH;
          case ':' -> Type.COLON;
          case ',' -> Type.COMMA;
          case ';' -> Type.SEMI;
          case '(' -> Type.LPAREN;
          case ')' -> Type.RPAREN;
          case '[' -> Type.LBRACKET;
          case ']' -> Type.RBRACKET;
          case '{' -> Type.LBRACE;
          case '}' -> Type.RBRACE;
          default -> null;
        };
    if (type == null) {
      throw error(start, "a token", describeChar(start));
    }
    pos += switch (type) {
      case OR, AND, EQ, NE, LE, GE, DIVISIBLE -> 2;
      default -> 1;
    };
    switch (type) {
      case LPAREN -> brackets.push('(');
      case LBRACKET -> brackets.push('[');
      case LBRACE -> brackets.push('{');
      case RPAREN, RBRACKET, RBRACE -> brackets.poll();
      default -> {}
    }
    add(type, start, pos, null);
  }
}
