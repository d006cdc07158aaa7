package minicst.token;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import minicst.util.SourceRange;

/**
 * Instances of this class are immutable. Unlike an abstract syntax token, every token keeps its
 * exact source text in {@link #lexval}, including whitespace, comments and newlines.
 */
public class Token {

  public final Terminal terminal;
  public final String lexval;
  private final SourceRange range;

  public Token(Terminal terminal, SourceRange range, String lexval) {
    this.terminal = checkNotNull(terminal);
    this.range = checkNotNull(range);
    this.lexval = checkNotNull(lexval);
  }

  public SourceRange range() {
    return range;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(range.begin.toString());
    sb.append(" ");
    switch (terminal) {
      case NAME:
        sb.append("identifier (").append(lexval).append(")");
        break;
      case INTEGER:
        sb.append("integer literal (").append(lexval).append(")");
        break;
      case STRING:
        sb.append("string literal ").append(lexval);
        break;
      case WS:
        sb.append("whitespace");
        break;
      case COMMENT:
        sb.append("comment");
        break;
      case NEWLINE:
        sb.append("newline");
        break;
      case RESERVED:
        sb.append(lexval);
        break;
      case EOF:
        sb.append("EOF");
        break;
      default:
        sb.append(terminal.string.get());
    }
    return sb.toString();
  }

  public boolean isOneOf(Terminal... terminals) {
    return Arrays.stream(terminals).anyMatch(t -> terminal == t);
  }
}
