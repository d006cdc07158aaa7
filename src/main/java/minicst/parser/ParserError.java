package minicst.parser;

import java.util.Arrays;
import java.util.List;
import minicst.CstError;
import minicst.token.Terminal;
import minicst.token.Token;
import minicst.util.SourceRange;

/** Raised when source text cannot be turned into a tree. */
public class ParserError extends CstError {

  public final SourceRange range;

  public ParserError(SourceRange range, String message) {
    this(range, "Parser error", message);
  }

  protected ParserError(SourceRange range, String kind, String message) {
    super(String.format("%s at %s: %s", kind, range, message));
    this.range = range;
  }

  ParserError(String rule, Terminal expectedTerminal, Token actualToken) {
    this(
        actualToken.range(),
        String.format(
            "parsed via %s: expected %s but got %s", rule, expectedTerminal, actualToken));
  }

  ParserError(String rule, Token unexpectedToken, Terminal[] expectedTerminals) {
    this(
        unexpectedToken.range(),
        String.format(
            "parsed via %s: unexpected %s with value '%s' expected one of %s",
            rule,
            unexpectedToken.terminal,
            unexpectedToken.lexval,
            Arrays.toString(expectedTerminals)));
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
