package minicst.parser;

import static minicst.token.Terminal.*;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import minicst.CstConfig;
import minicst.ast.CstValidationError;
import minicst.ast.MaybeSentinel;
import minicst.ast.Module;
import minicst.ast.expression.Arg;
import minicst.ast.expression.BaseExpression;
import minicst.ast.expression.Call;
import minicst.ast.expression.From;
import minicst.ast.expression.IntegerLiteral;
import minicst.ast.expression.Name;
import minicst.ast.expression.Parenthesized;
import minicst.ast.expression.SimpleString;
import minicst.ast.op.Comma;
import minicst.ast.op.Semicolon;
import minicst.ast.statement.Aumenta;
import minicst.ast.statement.BaseStatement;
import minicst.ast.statement.Break;
import minicst.ast.statement.Continua;
import minicst.ast.statement.Continue;
import minicst.ast.statement.Devuelve;
import minicst.ast.statement.Expr;
import minicst.ast.statement.Pass;
import minicst.ast.statement.Raise;
import minicst.ast.statement.Return;
import minicst.ast.statement.Rompe;
import minicst.ast.statement.SimpleStatementLine;
import minicst.ast.statement.SmallStatement;
import minicst.ast.whitespace.Comment;
import minicst.ast.whitespace.EmptyLine;
import minicst.ast.whitespace.Newline;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.ast.whitespace.TrailingWhitespace;
import minicst.token.Terminal;
import minicst.token.Token;
import minicst.util.LookAheadIterator;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser turning the lossless token stream of the {@link minicst.lexer.Lexer}
 * into a concrete syntax tree. Every whitespace, comment and newline token ends up in some node.
 *
 * <p>A parser instance parses exactly one input.
 */
public class Parser {
  private static final Logger LOGGER = LoggerFactory.getLogger("Parser");
  private static final Terminal[] ATOM_START = {NAME, INTEGER, STRING, LPAREN};

  private final LookAheadIterator<Token> tokens;
  private final CstConfig config;
  private Token currentToken;
  @Nullable private Token previousToken;
  private String defaultNewline;

  public Parser(Iterator<Token> tokens) {
    this(tokens, CstConfig.defaults());
  }

  public Parser(Iterator<Token> tokens, CstConfig config) {
    this.tokens = new LookAheadIterator<>(tokens);
    this.config = config;
    this.defaultNewline = config.defaultNewline();
  }

  private Token consumeToken() {
    Token eaten = currentToken;
    if (tokens.hasNext()) {
      currentToken = tokens.next();
    } else if (currentToken == null) {
      currentToken = new Token(EOF, new SourceRange(SourcePosition.BEGIN_OF_PROGRAM, 0), "");
    }
    if (eaten != null) {
      previousToken = eaten;
    }
    return eaten;
  }

  private Token lookAhead(int n) {
    if (n == 0) {
      return currentToken;
    }
    return tokens.lookAhead(n).orElse(endOfInput());
  }

  private Token endOfInput() {
    return new Token(EOF, new SourceRange(currentToken.range().end, 0), "");
  }

  private Token expectAndConsume(Terminal terminal) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    return consumeToken();
  }

  private <T> T unexpectCurrentToken(Terminal... expectedTerminals) {
    if (isCurrentTokenTypeOf(RESERVED)) {
      throw new ParserError(
          currentToken.range(), "'" + currentToken.lexval + "' is not supported");
    }
    throw new ParserError(
        Thread.currentThread().getStackTrace()[2].getMethodName(), currentToken, expectedTerminals);
  }

  private boolean isCurrentTokenTypeOf(Terminal terminal) {
    return currentToken.terminal == terminal;
  }

  private boolean isCurrentTokenNotTypeOf(Terminal terminal) {
    return !isCurrentTokenTypeOf(terminal);
  }

  /** True if the current token, optionally preceded by whitespace, is one of {@code terminals}. */
  private boolean followsAfterWhitespace(Terminal... terminals) {
    Token next = isCurrentTokenTypeOf(WS) ? lookAhead(1) : currentToken;
    return next.isOneOf(terminals);
  }

  /**
   * Builds a node from the parts parsed so far. Invalid combinations of parts are reported as a
   * {@link ParserError} at {@code at}.
   */
  private static <T> T build(Token at, Supplier<T> constructor) {
    try {
      return constructor.get();
    } catch (CstValidationError e) {
      ParserError error = new ParserError(at.range(), e.getMessage());
      error.initCause(e);
      throw error;
    }
  }

  /** Module -> EmptyLine* (EmptyLine* StatementLine)* EmptyLine* EOF */
  public Module parseModule() {
    consumeToken();
    defaultNewline = detectDefaultNewline();
    LOGGER.debug("Parsing module with default newline {}", escape(defaultNewline));

    List<EmptyLine> header = ImmutableList.of();
    List<BaseStatement> body = new ArrayList<>();
    List<EmptyLine> pending = parseEmptyLines();
    while (isCurrentTokenNotTypeOf(EOF)) {
      if (body.isEmpty()) {
        header = pending;
        pending = ImmutableList.of();
      }
      body.add(parseStatementLine(pending));
      pending = parseEmptyLines();
    }
    if (body.isEmpty()) {
      header = pending;
      pending = ImmutableList.of();
    }
    boolean hasTrailingNewline = previousToken == null || previousToken.terminal == NEWLINE;
    expectAndConsume(EOF);
    LOGGER.debug("Parsed module with {} statement lines", body.size());
    return new Module(body, header, pending, defaultNewline, hasTrailingNewline);
  }

  /** Parses a single statement line, including the empty lines above it. */
  public SimpleStatementLine parseStatement() {
    consumeToken();
    List<EmptyLine> leadingLines = parseEmptyLines();
    SimpleStatementLine line = parseStatementLine(leadingLines);
    expectAndConsume(EOF);
    return line;
  }

  /** Parses a single expression without surrounding whitespace. */
  public BaseExpression parseExpression() {
    consumeToken();
    BaseExpression expression = parseExpr();
    expectAndConsume(EOF);
    return expression;
  }

  /** The first newline sequence of the input, or the configured one if there is none. */
  private String detectDefaultNewline() {
    for (int i = 0; ; i++) {
      Token token = lookAhead(i);
      if (token.terminal == NEWLINE) {
        return token.lexval;
      }
      if (token.terminal == EOF) {
        return config.defaultNewline();
      }
    }
  }

  private boolean isAtEmptyLine() {
    int i = 0;
    if (lookAhead(i).terminal == WS) {
      i++;
    }
    if (lookAhead(i).terminal == COMMENT) {
      i++;
    }
    Token end = lookAhead(i);
    // A lone EOF is the end of the input, not an empty line
    return end.terminal == NEWLINE || (end.terminal == EOF && i > 0);
  }

  /** EmptyLine* */
  private List<EmptyLine> parseEmptyLines() {
    List<EmptyLine> lines = new ArrayList<>();
    while (isAtEmptyLine()) {
      SimpleWhitespace whitespace = parseSimpleWhitespace();
      Comment comment = parseOptionalComment();
      lines.add(new EmptyLine(whitespace, comment, parseNewline()));
    }
    return lines;
  }

  /** StatementLine -> SmallStatement (; SmallStatement)* ;? TrailingWhitespace */
  private SimpleStatementLine parseStatementLine(List<EmptyLine> leadingLines) {
    if (isCurrentTokenTypeOf(WS)) {
      throw new ParserError(currentToken.range(), "unexpected indent");
    }
    List<SmallStatement> body = new ArrayList<>();
    while (true) {
      SmallStatement statement = parseSmallStatement();
      if (!followsAfterWhitespace(SEMICOLON)) {
        body.add(statement);
        break;
      }
      SimpleWhitespace before = parseSimpleWhitespace();
      expectAndConsume(SEMICOLON);
      SimpleWhitespace after = parseSimpleWhitespace();
      body.add(statement.withSemicolon(MaybeSentinel.explicit(new Semicolon(before, after))));
      if (currentToken.isOneOf(COMMENT, NEWLINE, EOF)) {
        break;
      }
    }
    return new SimpleStatementLine(body, leadingLines, parseTrailingWhitespace());
  }

  /** TrailingWhitespace -> WS? COMMENT? (NEWLINE | EOF) */
  private TrailingWhitespace parseTrailingWhitespace() {
    SimpleWhitespace whitespace = parseSimpleWhitespace();
    Comment comment = parseOptionalComment();
    if (!currentToken.isOneOf(NEWLINE, EOF)) {
      unexpectCurrentToken(SEMICOLON, COMMENT, NEWLINE);
    }
    return new TrailingWhitespace(whitespace, comment, parseNewline());
  }

  /** SmallStatement -> Raise | Return | Break | Continue | Pass | Expr */
  private SmallStatement parseSmallStatement() {
    switch (currentToken.terminal) {
      case RAISE:
      case AUMENTA:
        return parseRaise();
      case RETURN:
      case DEVUELVE:
        return parseReturn();
      case BREAK:
        consumeToken();
        return new Break();
      case ROMPE:
        consumeToken();
        return new Rompe();
      case CONTINUE:
        consumeToken();
        return new Continue();
      case CONTINUA:
        consumeToken();
        return new Continua();
      case PASS:
        consumeToken();
        return new Pass();
      case NAME:
      case INTEGER:
      case STRING:
      case LPAREN:
        return new Expr(parseExpr());
      default:
        return unexpectCurrentToken(
            RAISE, RETURN, BREAK, CONTINUE, PASS, AUMENTA, DEVUELVE, ROMPE, CONTINUA, NAME);
    }
  }

  /** Raise -> (raise | aumenta) (WS? Expr (WS? from WS? Expr)?)? */
  private SmallStatement parseRaise() {
    Token keyword = consumeToken();
    MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword = MaybeSentinel.useDefault();
    BaseExpression exc = null;
    From cause = null;
    if (followsAfterWhitespace(ATOM_START)) {
      whitespaceAfterKeyword = MaybeSentinel.explicit(parseSimpleWhitespace());
      exc = parseExpr();
      if (followsAfterWhitespace(FROM)) {
        cause = parseFrom();
      }
    }
    MaybeSentinel<SimpleWhitespace> whitespace = whitespaceAfterKeyword;
    BaseExpression e = exc;
    From c = cause;
    if (keyword.terminal == AUMENTA) {
      return build(
          keyword, () -> new Aumenta(e, c, whitespace, MaybeSentinel.useDefault()));
    }
    return build(keyword, () -> new Raise(e, c, whitespace, MaybeSentinel.useDefault()));
  }

  /** From -> WS? from WS? Expr */
  private From parseFrom() {
    SimpleWhitespace before = parseSimpleWhitespace();
    Token from = expectAndConsume(FROM);
    SimpleWhitespace after = parseSimpleWhitespace();
    BaseExpression item = parseExpr();
    return build(from, () -> new From(item, MaybeSentinel.explicit(before), after));
  }

  /** Return -> (return | devuelve) (WS? Expr)? */
  private SmallStatement parseReturn() {
    Token keyword = consumeToken();
    MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword = MaybeSentinel.useDefault();
    BaseExpression value = null;
    if (followsAfterWhitespace(ATOM_START)) {
      whitespaceAfterKeyword = MaybeSentinel.explicit(parseSimpleWhitespace());
      value = parseExpr();
    }
    MaybeSentinel<SimpleWhitespace> whitespace = whitespaceAfterKeyword;
    BaseExpression v = value;
    if (keyword.terminal == DEVUELVE) {
      return build(keyword, () -> new Devuelve(v, whitespace, MaybeSentinel.useDefault()));
    }
    return build(keyword, () -> new Return(v, whitespace, MaybeSentinel.useDefault()));
  }

  /** Expr -> Atom (WS? ( Args ))* */
  private BaseExpression parseExpr() {
    BaseExpression expression = parseAtom();
    while (followsAfterWhitespace(LPAREN)) {
      expression = parseCall(expression);
    }
    return expression;
  }

  /** Call -> WS? ( WS? (Arg (, WS? Arg)* ,?)? ) */
  private Call parseCall(BaseExpression func) {
    SimpleWhitespace whitespaceAfterFunc = parseSimpleWhitespace();
    expectAndConsume(LPAREN);
    SimpleWhitespace whitespaceBeforeArgs = parseSimpleWhitespace();
    List<Arg> args = new ArrayList<>();
    while (isCurrentTokenNotTypeOf(RPAREN)) {
      BaseExpression value = parseExpr();
      SimpleWhitespace whitespace = parseSimpleWhitespace();
      if (isCurrentTokenTypeOf(COMMA)) {
        consumeToken();
        Comma comma = new Comma(whitespace, parseSimpleWhitespace());
        args.add(new Arg(value, MaybeSentinel.explicit(comma), SimpleWhitespace.EMPTY));
      } else {
        args.add(new Arg(value, MaybeSentinel.useDefault(), whitespace));
        break;
      }
    }
    expectAndConsume(RPAREN);
    return new Call(func, args, whitespaceAfterFunc, whitespaceBeforeArgs);
  }

  /** Atom -> NAME | INTEGER | STRING | ( WS? Expr WS? ) */
  private BaseExpression parseAtom() {
    Token token = currentToken;
    switch (currentToken.terminal) {
      case NAME:
        consumeToken();
        return build(token, () -> new Name(token.lexval));
      case INTEGER:
        consumeToken();
        return build(token, () -> new IntegerLiteral(token.lexval));
      case STRING:
        consumeToken();
        return build(token, () -> new SimpleString(token.lexval));
      case LPAREN:
        consumeToken();
        SimpleWhitespace afterLpar = parseSimpleWhitespace();
        BaseExpression value = parseExpr();
        SimpleWhitespace beforeRpar = parseSimpleWhitespace();
        expectAndConsume(RPAREN);
        return new Parenthesized(value, afterLpar, beforeRpar);
      default:
        return unexpectCurrentToken(ATOM_START);
    }
  }

  private SimpleWhitespace parseSimpleWhitespace() {
    if (isCurrentTokenNotTypeOf(WS)) {
      return SimpleWhitespace.EMPTY;
    }
    return new SimpleWhitespace(consumeToken().lexval);
  }

  @Nullable
  private Comment parseOptionalComment() {
    if (isCurrentTokenNotTypeOf(COMMENT)) {
      return null;
    }
    return new Comment(consumeToken().lexval);
  }

  /**
   * Consumes a NEWLINE token. Newlines equal to the default newline stay defaulted, and the end of
   * the input yields a default newline the module drops again when rendering.
   */
  private Newline parseNewline() {
    if (isCurrentTokenTypeOf(EOF)) {
      return new Newline();
    }
    String value = expectAndConsume(NEWLINE).lexval;
    return value.equals(defaultNewline) ? new Newline() : new Newline(value);
  }

  private static String escape(String newline) {
    return newline.replace("\r", "\\r").replace("\n", "\\n");
  }
}
