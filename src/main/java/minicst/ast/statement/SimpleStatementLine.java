package minicst.ast.statement;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.EmptyLine;
import minicst.ast.whitespace.TrailingWhitespace;
import minicst.codegen.CodegenState;
import minicst.util.SourcePosition;

/**
 * One physical line of small statements separated by semicolons, together with the empty lines
 * above it and whatever trails its last statement.
 */
public final class SimpleStatementLine extends BaseStatement {

  /** The statements on this line. An empty body renders as {@code pass}. */
  public final ImmutableList<SmallStatement> body;

  /** Blank or comment-only lines directly above this one. */
  public final ImmutableList<EmptyLine> leadingLines;

  public final TrailingWhitespace trailingWhitespace;

  public SimpleStatementLine(List<? extends SmallStatement> body) {
    this(body, ImmutableList.of(), new TrailingWhitespace());
  }

  public SimpleStatementLine(
      List<? extends SmallStatement> body,
      List<EmptyLine> leadingLines,
      TrailingWhitespace trailingWhitespace) {
    this.body = ImmutableList.copyOf(body);
    this.leadingLines = ImmutableList.copyOf(leadingLines);
    this.trailingWhitespace = checkNotNull(trailingWhitespace);
  }

  public SimpleStatementLine withBody(List<? extends SmallStatement> body) {
    return new SimpleStatementLine(body, leadingLines, trailingWhitespace);
  }

  public SimpleStatementLine withLeadingLines(List<EmptyLine> leadingLines) {
    return new SimpleStatementLine(body, leadingLines, trailingWhitespace);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    ImmutableList<EmptyLine> lines =
        ChildVisits.visitSequence(this, "leadingLines", leadingLines, EmptyLine.class, transformer);
    ImmutableList<SmallStatement> statements =
        ChildVisits.visitSequence(this, "body", body, SmallStatement.class, transformer);
    TrailingWhitespace trailing =
        ChildVisits.visitRequired(
            this, "trailingWhitespace", trailingWhitespace, TrailingWhitespace.class, transformer);
    return new SimpleStatementLine(statements, lines, trailing);
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    for (EmptyLine line : leadingLines) {
      line.codegen(state);
    }
    SourcePosition begin = state.currentPosition();
    if (body.isEmpty()) {
      state.addToken("pass");
    } else {
      int last = body.size() - 1;
      for (int i = 0; i < body.size(); i++) {
        body.get(i).codegen(state, i != last);
      }
    }
    state.recordSyntacticPosition(this, begin, state.currentPosition());
    trailingWhitespace.codegen(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SimpleStatementLine that = (SimpleStatementLine) o;
    return body.equals(that.body)
        && leadingLines.equals(that.leadingLines)
        && trailingWhitespace.equals(that.trailingWhitespace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(body, leadingLines, trailingWhitespace);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("body", body)
        .add("leadingLines", leadingLines)
        .add("trailingWhitespace", trailingWhitespace)
        .toString();
  }
}
