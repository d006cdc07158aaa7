package minicst.codegen;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import minicst.CstConfig;
import minicst.ast.CstNode;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;

/**
 * Output accumulator of a single rendering pass. Nodes append tokens in document order; the state
 * tracks the current line and column and records the range every rendered node occupies.
 *
 * <p>Positions are keyed by node identity. A node instance that is rendered at several places (a
 * shared whitespace constant, say) keeps the range of its last occurrence.
 *
 * <p>Instances are not thread-safe and must not be shared between passes.
 */
public class CodegenState {

  private final String defaultNewline;
  private final String defaultSemicolon;
  private final List<String> tokens = new ArrayList<>();
  private int line = 1;
  private int column = 0;
  private final Map<CstNode, SourcePosition> openNodes = new IdentityHashMap<>();
  private final Map<CstNode, SourceRange> positions = new IdentityHashMap<>();
  private final Map<CstNode, SourceRange> syntacticPositions = new IdentityHashMap<>();

  public CodegenState(CstConfig config) {
    this.defaultNewline = config.defaultNewline();
    this.defaultSemicolon = config.defaultSemicolon();
  }

  public String defaultNewline() {
    return defaultNewline;
  }

  public String defaultSemicolon() {
    return defaultSemicolon;
  }

  public void addToken(String value) {
    tokens.add(value);
    advance(value);
  }

  /**
   * Removes the last token if it is the default newline. Returns true if a token was removed.
   * Used for sources that do not end with a newline.
   */
  public boolean removeTrailingDefaultNewline() {
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).equals(defaultNewline)) {
      return false;
    }
    tokens.remove(tokens.size() - 1);
    line = 1;
    column = 0;
    tokens.forEach(this::advance);
    return true;
  }

  private void advance(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean crlf = c == '\r' && i + 1 < value.length() && value.charAt(i + 1) == '\n';
      if (c == '\n' || (c == '\r' && !crlf)) {
        line++;
        column = 0;
      } else if (!crlf) {
        column++;
      }
    }
  }

  public SourcePosition currentPosition() {
    return new SourcePosition(line, column);
  }

  public void beforeCodegen(CstNode node) {
    openNodes.put(node, currentPosition());
  }

  public void afterCodegen(CstNode node) {
    SourcePosition begin = openNodes.remove(node);
    checkState(begin != null, "afterCodegen without beforeCodegen for %s", node);
    positions.put(node, new SourceRange(begin, currentPosition()));
  }

  /**
   * Records the syntactic extent of {@code node}, which excludes formatting the node owns but that
   * does not belong to its syntax, like a trailing semicolon.
   */
  public void recordSyntacticPosition(CstNode node, SourcePosition begin, SourcePosition end) {
    syntacticPositions.put(node, new SourceRange(begin, end));
  }

  /** The range {@code node} occupies, including all whitespace it owns. */
  public Optional<SourceRange> positionOf(CstNode node) {
    return Optional.ofNullable(positions.get(node));
  }

  /** The syntactic range of {@code node}; same as {@link #positionOf} for most nodes. */
  public Optional<SourceRange> syntacticPositionOf(CstNode node) {
    SourceRange syntactic = syntacticPositions.get(node);
    return syntactic != null ? Optional.of(syntactic) : positionOf(node);
  }

  public String code() {
    return String.join("", tokens);
  }
}
