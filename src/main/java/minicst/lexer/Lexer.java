package minicst.lexer;

import static minicst.token.Terminal.*;

import com.google.common.collect.ImmutableSet;
import java.util.Iterator;
import minicst.token.Terminal;
import minicst.token.Token;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;

/**
 * Lossless lexer. Every character of the input ends up in exactly one token, so concatenating the
 * {@link Token#lexval}s of all tokens yields the input again.
 */
public class Lexer implements Iterator<Token> {

  static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

  private final String input;
  private int offset = 0;
  private int line = 1;
  private int column = 0;
  private Token eof;
  private SourcePosition tokenBegin;
  private int tokenBeginOffset;

  public Lexer(String input) {
    this.input = input;
  }

  private int ch() {
    return peek(0);
  }

  private int peek(int n) {
    int i = offset;
    for (int k = 0; k < n; k++) {
      if (i >= input.length()) {
        return -1;
      }
      i += Character.charCount(input.codePointAt(i));
    }
    return i < input.length() ? input.codePointAt(i) : -1;
  }

  private void nextChar() {
    int c = ch();
    if (c == -1) {
      return;
    }
    int width = Character.charCount(c);
    offset += width;
    if (c == '\n' || (c == '\r' && ch() != '\n')) {
      line++;
      column = 0;
    } else {
      column += width;
    }
  }

  private SourcePosition position() {
    return new SourcePosition(line, column);
  }

  private Token scan() {
    tokenBegin = position();
    tokenBeginOffset = offset;
    int c = ch();
    if (isDigit(c)) {
      return scanInt();
    }
    if (isIdentifierStart(c)) {
      return scanKeywordIdentifierOrString();
    }
    switch (c) {
      case -1:
        return (eof = createToken(EOF));
      case ' ':
      case '\t':
      case '\f':
        return scanWhitespace();
      case '\n':
        nextChar();
        return createToken(NEWLINE);
      case '\r':
        nextChar();
        if (ch() == '\n') {
          nextChar();
        }
        return createToken(NEWLINE);
      case '#':
        return scanComment();
      case '\'':
      case '"':
        return scanStringBody();
      case '(':
        nextChar();
        return createToken(LPAREN);
      case ')':
        nextChar();
        return createToken(RPAREN);
      case ',':
        nextChar();
        return createToken(COMMA);
      case ';':
        nextChar();
        return createToken(SEMICOLON);
      case '\\':
        throw new LexerError(tokenBegin, "line continuations are not supported");
    }
    throw new LexerError(
        tokenBegin,
        String.format(
            "tokens must not start with character '%s' (%d)", new String(Character.toChars(c)), c));
  }

  private static boolean isDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isIdentifierStart(int ch) {
    return ch == '_' || (ch != -1 && Character.isLetter(ch));
  }

  private static boolean isIdentifierPart(int ch) {
    return isIdentifierStart(ch) || (ch != -1 && Character.isDigit(ch));
  }

  private Token scanWhitespace() {
    while (ch() == ' ' || ch() == '\t' || ch() == '\f') {
      nextChar();
    }
    return createToken(WS);
  }

  private Token scanComment() {
    while (ch() != -1 && ch() != '\n' && ch() != '\r') {
      nextChar();
    }
    return createToken(COMMENT);
  }

  private Token scanInt() {
    while (isDigit(ch()) || (ch() == '_' && isDigit(peek(1)))) {
      nextChar();
    }
    return createToken(INTEGER);
  }

  private Token scanKeywordIdentifierOrString() {
    while (isIdentifierPart(ch())) {
      nextChar();
    }
    String word = currentText();
    if ((ch() == '"' || ch() == '\'') && STRING_PREFIXES.contains(word.toLowerCase())) {
      return scanStringBody();
    }
    Terminal keywordTerminal = KEYWORDS.get(word);
    if (keywordTerminal != null) {
      return createToken(keywordTerminal);
    }
    if (RESERVED_IDENTIFIERS.contains(word)) {
      return createToken(RESERVED);
    }
    return createToken(NAME);
  }

  /** Scans from the opening quote to the matching closing quote, on a single line. */
  private Token scanStringBody() {
    int quote = ch();
    if (peek(1) == quote && peek(2) == quote) {
      throw new LexerError(position(), "triple-quoted strings are not supported");
    }
    nextChar();
    while (ch() != quote) {
      if (ch() == -1 || ch() == '\n' || ch() == '\r') {
        throw new LexerError(
            position(), "Reached end of line, but string starting at " + tokenBegin + " is open");
      }
      if (ch() == '\\') {
        nextChar();
        if (ch() == -1 || ch() == '\n' || ch() == '\r') {
          throw new LexerError(position(), "line continuations are not supported");
        }
      }
      nextChar();
    }
    nextChar();
    return createToken(STRING);
  }

  private String currentText() {
    return input.substring(tokenBeginOffset, offset);
  }

  private Token createToken(Terminal terminal) {
    return new Token(terminal, new SourceRange(tokenBegin, position()), currentText());
  }

  @Override
  public boolean hasNext() {
    return eof == null;
  }

  @Override
  public Token next() {
    if (eof != null) {
      return eof;
    }
    return scan();
  }
}
