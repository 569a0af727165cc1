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
import com.google.common.flogger.FluentLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.AgentDefinition;
import org.komrad.ast.Expr;
import org.komrad.ast.Expr.BinaryOp;
import org.komrad.ast.Exprs;
import org.komrad.ast.Location;
import org.komrad.ast.Pattern;
import org.komrad.ast.PatternTerm;
import org.komrad.ast.Program;
import org.komrad.ast.Statement;
import org.komrad.compiler.Token.Type;

/**
 * A recursive-descent parser from Komrad source text to the syntax tree in {@link org.komrad.ast}.
 *
 * <p>The grammar, from statements down:
 *
 * <pre>
 *   statement  := 'agent' IDENT '{' statement* '}'       (top level only)
 *               | '[' term+ ']' '{' statement* '}'       (top level or agent body)
 *               | IDENT ':' IDENT '=' expression         (top level or agent body)
 *               | IDENT '=' expression
 *               | expression
 *   expression := send ('|' send)*
 *   send       := primary operand+ | binary
 *   binary     := unary (BINOP unary)*                   (precedence climbing)
 *   unary      := ('!' | '-') unary | primary
 * </pre>
 *
 * A send's terms are collected greedily, each a {@code binary}, for as long as the next token can
 * start one; keywords, operators that can't start an operand, separators and closing brackets all
 * end the send.
 *
 * <p>Parsing stops at the first error.
 */
public final class Parser {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Which declaration forms are allowed in a statement sequence. */
  private enum Context {
    TOP_LEVEL,
    AGENT_BODY,
    BLOCK
  }

  private final ImmutableList<Token> tokens;
  private int pos;

  private Parser(ImmutableList<Token> tokens) {
    this.tokens = tokens;
  }

  /** Parses a complete source unit. */
  public static Program parse(String source, String name) throws ParseError {
    Parser parser = new Parser(Lexer.tokenize(source, name));
    ImmutableList<Statement> statements = parser.statements(Type.EOF, Context.TOP_LEVEL);
    logger.atFine().log("Parsed %s: %d top-level statements", name, statements.size());
    return new Program(name, statements);
  }

  /** Parses a single expression, which must make up all of {@code source}. */
  public static Expr parseExpression(String source) throws ParseError {
    Parser parser = new Parser(Lexer.tokenize(source, "(expression)"));
    parser.skipSeparators();
    Expr result = parser.expression();
    parser.skipSeparators();
    parser.expect(Type.EOF, "end of input");
    return result;
  }

  /**
   * Parses a pattern given without its enclosing brackets, e.g. {@code "get _m _key"}; used to
   * declare the intrinsic handlers of system agents.
   */
  public static Pattern parsePattern(String source) throws ParseError {
    Parser parser = new Parser(Lexer.tokenize(source, "(pattern)"));
    ImmutableList.Builder<PatternTerm> terms = ImmutableList.builder();
    while (!parser.at(Type.EOF) && !parser.at(Type.NEWLINE)) {
      terms.add(parser.patternTerm());
    }
    parser.skipSeparators();
    parser.expect(Type.EOF, "end of pattern");
    ImmutableList<PatternTerm> result = terms.build();
    if (result.isEmpty()) {
      throw parser.error("a pattern term");
    }
    return new Pattern(result);
  }

  // Token access

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private boolean at(Type type) {
    return peek().type() == type;
  }

  private Token next() {
    Token result = tokens.get(pos);
    if (result.type() != Type.EOF) {
      pos++;
    }
    return result;
  }

  private Token expect(Type type, String expected) throws ParseError {
    if (!at(type)) {
      throw error(expected);
    }
    return next();
  }

  private Token expect(Type type) throws ParseError {
    return expect(type, type.description);
  }

  private ParseError error(String expected) {
    Token token = peek();
    return new ParseError(token.location(), expected, token.describe());
  }

  private void skipSeparators() {
    while (at(Type.NEWLINE) || at(Type.SEMI)) {
      next();
    }
  }

  // Statements

  /** Parses statements up to (but not including) {@code terminator}. */
  private ImmutableList<Statement> statements(Type terminator, Context context)
      throws ParseError {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    for (; ; ) {
      skipSeparators();
      if (at(terminator)) {
        return result.build();
      }
      result.add(statement(context));
      if (at(Type.NEWLINE) || at(Type.SEMI)) {
        next();
      } else if (!at(terminator)) {
        throw error("a newline or ';'");
      }
    }
  }

  private Statement statement(Context context) throws ParseError {
    Location location = peek().location();
    Expr expr;
    if (at(Type.AGENT)) {
      if (context != Context.TOP_LEVEL) {
        throw error("a statement (agents may only be defined at the top level)");
      }
      expr = agentDecl();
    } else if (at(Type.LBRACKET) && isHandlerAhead()) {
      if (context == Context.BLOCK) {
        throw error("a statement (handlers may only be defined at the top level or in an agent)");
      }
      expr = handlerDecl();
    } else if (at(Type.IDENT) && peek(1).type() == Type.ASSIGN) {
      String name = next().text();
      next();
      expr = new Expr.Assignment(name, expression());
    } else if (at(Type.IDENT)
        && peek(1).type() == Type.COLON
        && peek(2).type() == Type.IDENT
        && peek(3).type() == Type.ASSIGN) {
      if (context == Context.BLOCK) {
        throw error(
            "a statement (typed fields may only be declared at the top level or in an agent)");
      }
      String name = next().text();
      next();
      String typeName = next().text();
      next();
      expr = new Expr.FieldDecl(name, typeName, expression());
    } else {
      expr = expression();
    }
    return new Statement(expr, location);
  }

  /**
   * Returns true if the {@code [} at the current position is the start of a handler pattern, i.e.
   * its matching {@code ]} is immediately followed by an opening brace.
   */
  private boolean isHandlerAhead() {
    int depth = 0;
    for (int i = pos; i < tokens.size(); i++) {
      switch (tokens.get(i).type()) {
        case LBRACKET, LPAREN, LBRACE, PRED_OPEN -> depth++;
        case RBRACKET, RPAREN, RBRACE -> {
          depth--;
          if (depth == 0) {
            return i + 1 < tokens.size() && tokens.get(i + 1).type() == Type.LBRACE;
          }
        }
        case EOF -> {
          return false;
        }
        default -> {}
      }
    }
    return false;
  }

  private Expr.AgentDecl agentDecl() throws ParseError {
    Location location = expect(Type.AGENT).location();
    String name = expect(Type.IDENT, "an agent name").text();
    expect(Type.LBRACE);
    ImmutableList<Statement> body = statements(Type.RBRACE, Context.AGENT_BODY);
    expect(Type.RBRACE);
    ImmutableList.Builder<Statement> initializers = ImmutableList.builder();
    ImmutableList.Builder<Expr.HandlerDecl> handlers = ImmutableList.builder();
    Map<String, String> fieldTypes = new LinkedHashMap<>();
    for (Statement statement : body) {
      if (statement.expr() instanceof Expr.HandlerDecl handler) {
        handlers.add(handler);
      } else {
        if (statement.expr() instanceof Expr.FieldDecl field) {
          fieldTypes.put(field.name(), field.typeName());
        }
        initializers.add(statement);
      }
    }
    return new Expr.AgentDecl(
        new AgentDefinition(
            name,
            initializers.build(),
            handlers.build(),
            ImmutableMap.copyOf(fieldTypes),
            location));
  }

  private Expr.HandlerDecl handlerDecl() throws ParseError {
    Location location = peek().location();
    Pattern pattern = pattern();
    ImmutableList<Statement> body = blockBody();
    return new Expr.HandlerDecl(pattern, body, location);
  }

  /** Parses {@code { statement* }} and returns the statements. */
  private ImmutableList<Statement> blockBody() throws ParseError {
    expect(Type.LBRACE);
    ImmutableList<Statement> body = statements(Type.RBRACE, Context.BLOCK);
    expect(Type.RBRACE);
    return body;
  }

  // Patterns

  private Pattern pattern() throws ParseError {
    expect(Type.LBRACKET);
    ImmutableList.Builder<PatternTerm> terms = ImmutableList.builder();
    while (!at(Type.RBRACKET)) {
      terms.add(patternTerm());
    }
    ImmutableList<PatternTerm> result = terms.build();
    if (result.isEmpty()) {
      throw error("a pattern term");
    }
    next();
    return new Pattern(result);
  }

  private PatternTerm patternTerm() throws ParseError {
    Token token = peek();
    switch (token.type()) {
      case IDENT, AGENT, SPAWN:
        next();
        return new PatternTerm.Word(token.text());
      case INT, FLOAT, STRING, TRUE, FALSE, NONE:
        return new PatternTerm.Literal(literal());
      case HOLE:
        next();
        return new PatternTerm.ValueHole((String) token.value());
      case BLOCK_HOLE:
        next();
        return new PatternTerm.BlockHole((String) token.value());
      case DISCARD:
        next();
        return PatternTerm.Discard.INSTANCE;
      case PRED_OPEN:
        return predicateHole();
      default:
        throw error("a pattern term");
    }
  }

  /** Parses {@code _(name: Type)}, {@code _(literal)} or {@code _(expression)}. */
  private PatternTerm predicateHole() throws ParseError {
    expect(Type.PRED_OPEN);
    if (at(Type.IDENT)
        && peek(1).type() == Type.COLON
        && peek(2).type() == Type.IDENT
        && peek(3).type() == Type.RPAREN) {
      String name = next().text();
      next();
      String typeName = next().text();
      next();
      return new PatternTerm.TypedHole(name, typeName);
    }
    Location location = peek().location();
    Expr predicate = expression();
    expect(Type.RPAREN);
    if (predicate instanceof Expr.Literal literal) {
      return new PatternTerm.Literal(literal);
    }
    Optional<String> subject = Exprs.predicateSubject(predicate);
    if (subject.isEmpty()) {
      throw new ParseError(location, "a variable in predicate", "'" + predicate.render() + "'");
    }
    return new PatternTerm.PredicateHole(subject.get(), predicate);
  }

  // Expressions

  private Expr expression() throws ParseError {
    Expr left = send();
    while (at(Type.PIPE)) {
      next();
      Location location = peek().location();
      Expr right = send();
      if (right instanceof Expr.Send send) {
        left = send.withLastTerm(left);
      } else if (right instanceof Expr.Variable) {
        left = new Expr.Send(right, ImmutableList.of(left));
      } else {
        throw new ParseError(location, "a message send after '|'", "'" + right.render() + "'");
      }
    }
    return left;
  }

  private Expr send() throws ParseError {
    boolean prefixed = at(Type.BANG) || at(Type.MINUS);
    Expr head = unary();
    if (prefixed || !startsOperand(peek())) {
      return binaryRest(head, 0);
    }
    ImmutableList.Builder<Expr> terms = ImmutableList.builder();
    while (startsOperand(peek())) {
      terms.add(binary(0));
    }
    return new Expr.Send(head, terms.build());
  }

  /** True if {@code token} can start a send term. */
  private static boolean startsOperand(Token token) {
    return switch (token.type()) {
      case IDENT, INT, FLOAT, STRING, EMBEDDED, TRUE, FALSE, NONE, LPAREN, LBRACKET, LBRACE -> true;
      default -> false;
    };
  }

  private static @Nullable BinaryOp binaryOp(Token token) {
    return switch (token.type()) {
      case OR -> BinaryOp.OR;
      case AND -> BinaryOp.AND;
      case EQ -> BinaryOp.EQ;
      case NE -> BinaryOp.NE;
      case LT -> BinaryOp.LT;
      case LE -> BinaryOp.LE;
      case GT -> BinaryOp.GT;
      case GE -> BinaryOp.GE;
      case DIVISIBLE -> BinaryOp.DIVISIBLE;
      case PLUS -> BinaryOp.ADD;
      case MINUS -> BinaryOp.SUBTRACT;
      case STAR -> BinaryOp.MULTIPLY;
      case SLASH -> BinaryOp.DIVIDE;
      case PERCENT -> BinaryOp.MODULO;
      default -> null;
    };
  }

  private Expr binary(int minPrecedence) throws ParseError {
    return binaryRest(unary(), minPrecedence);
  }

  /** Continues a binary expression whose first operand has already been parsed. */
  private Expr binaryRest(Expr left, int minPrecedence) throws ParseError {
    for (; ; ) {
      BinaryOp op = binaryOp(peek());
      if (op == null || op.precedence < minPrecedence) {
        return left;
      }
      next();
      Expr right = binary(op.precedence + 1);
      left = new Expr.Binary(op, left, right);
    }
  }

  private Expr unary() throws ParseError {
    if (at(Type.BANG)) {
      next();
      return new Expr.Unary(Expr.UnaryOp.NOT, unary());
    } else if (at(Type.MINUS)) {
      next();
      return new Expr.Unary(Expr.UnaryOp.NEGATE, unary());
    }
    return primary();
  }

  private Expr primary() throws ParseError {
    Token token = peek();
    switch (token.type()) {
      case INT, FLOAT, STRING, TRUE, FALSE, NONE:
        return literal();
      case EMBEDDED:
        next();
        Token.Embedded embedded = (Token.Embedded) token.value();
        return new Expr.EmbeddedText(embedded.tags(), embedded.text());
      case IDENT:
        next();
        return new Expr.Variable(token.text());
      case LPAREN:
        {
          next();
          Expr result = expression();
          expect(Type.RPAREN);
          return result;
        }
      case LBRACE:
        return new Expr.BlockExpr(blockBody());
      case LBRACKET:
        return listOrMapping();
      case SPAWN:
        return spawn();
      case STAR:
        next();
        return new Expr.Expand(primary());
      case HOLE, BLOCK_HOLE, PRED_OPEN, DISCARD:
        throw error("an expression (holes may only appear in handler patterns)");
      default:
        throw error("an expression");
    }
  }

  private Expr.Literal literal() throws ParseError {
    Token token = next();
    return switch (token.type()) {
      case INT, FLOAT, STRING -> new Expr.Literal(token.value());
      case TRUE -> Expr.Literal.TRUE;
      case FALSE -> Expr.Literal.FALSE;
      case NONE -> Expr.Literal.NONE;
      default -> throw new AssertionError(token);
    };
  }

  /**
   * Parses {@code []}, {@code [:]}, a list {@code [a b, c]} (commas optional) or a mapping {@code
   * [k: v, ...]} (commas required, since a mapping value may be a send).
   */
  private Expr listOrMapping() throws ParseError {
    expect(Type.LBRACKET);
    if (at(Type.COLON) && peek(1).type() == Type.RBRACKET) {
      next();
      next();
      return new Expr.MappingExpr(ImmutableList.of());
    }
    if (at(Type.RBRACKET)) {
      next();
      return new Expr.ListExpr(ImmutableList.of());
    }
    Expr first = binary(0);
    if (at(Type.COLON)) {
      return mappingRest(first);
    }
    ImmutableList.Builder<Expr> elements = ImmutableList.builder();
    elements.add(first);
    for (; ; ) {
      if (at(Type.COMMA)) {
        next();
      }
      if (at(Type.RBRACKET)) {
        next();
        return new Expr.ListExpr(elements.build());
      }
      elements.add(binary(0));
    }
  }

  private Expr mappingRest(Expr firstKey) throws ParseError {
    ImmutableList.Builder<Expr.MappingExpr.Entry> entries = ImmutableList.builder();
    Expr key = firstKey;
    for (; ; ) {
      expect(Type.COLON);
      entries.add(new Expr.MappingExpr.Entry(mappingKey(key), expression()));
      if (at(Type.RBRACKET)) {
        next();
        return new Expr.MappingExpr(entries.build());
      }
      expect(Type.COMMA, "',' or ']'");
      key = binary(0);
    }
  }

  /** A bare identifier used as a mapping key stands for the string with that name. */
  private static Expr mappingKey(Expr key) {
    return (key instanceof Expr.Variable v) ? Expr.Literal.of(v.name()) : key;
  }

  /**
   * Parses {@code spawn Name}, {@code spawn Name { field = expr ... }} or {@code spawn Name
   * primary}.
   */
  private Expr spawn() throws ParseError {
    expect(Type.SPAWN);
    String name = expect(Type.IDENT, "an agent name").text();
    if (at(Type.LBRACE)) {
      next();
      ImmutableList.Builder<Expr.Assignment> fields = ImmutableList.builder();
      for (; ; ) {
        while (at(Type.NEWLINE) || at(Type.SEMI) || at(Type.COMMA)) {
          next();
        }
        if (at(Type.RBRACE)) {
          next();
          return new Expr.Spawn(name, fields.build(), null);
        }
        String field = expect(Type.IDENT, "a field name").text();
        expect(Type.ASSIGN);
        fields.add(new Expr.Assignment(field, expression()));
        if (!(at(Type.NEWLINE) || at(Type.SEMI) || at(Type.COMMA) || at(Type.RBRACE))) {
          throw error("a newline, ';' or '}'");
        }
      }
    } else if (startsOperand(peek())) {
      return new Expr.Spawn(name, ImmutableList.of(), primary());
    }
    return new Expr.Spawn(name, ImmutableList.of(), null);
  }
}
