package minicst.lexer;

import minicst.parser.ParserError;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;

/** A {@link ParserError} raised before any token could be formed. */
public class LexerError extends ParserError {

  LexerError(SourcePosition position, String message) {
    super(new SourceRange(position, 1), "Lexer error", message);
  }
}
