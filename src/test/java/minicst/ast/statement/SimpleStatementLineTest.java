package minicst.ast.statement;

import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThat;

import com.google.common.collect.ImmutableList;
import minicst.CstConfig;
import minicst.ast.MaybeSentinel;
import minicst.ast.expression.Name;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.Comment;
import minicst.ast.whitespace.EmptyLine;
import minicst.ast.whitespace.Newline;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.ast.whitespace.TrailingWhitespace;
import minicst.codegen.CodegenState;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;
import org.junit.Test;

public class SimpleStatementLineTest {

  @Test
  public void emptyBody_rendersPass() {
    assertThat(new SimpleStatementLine(ImmutableList.of()).code(), is("pass\n"));
  }

  @Test
  public void defaultSemicolons_onlyBetweenStatements() {
    SimpleStatementLine line =
        new SimpleStatementLine(ImmutableList.of(new Break(), new Continue(), new Pass()));

    assertThat(line.code(), is("break; continue; pass\n"));
  }

  @Test
  public void explicitTrailingSemicolon_isKept() {
    SimpleStatementLine line =
        new SimpleStatementLine(
            ImmutableList.of(
                new Expr(new Name("x")), new Pass(MaybeSentinel.explicit(new Semicolon()))));

    assertThat(line.code(), is("x; pass;\n"));
  }

  @Test
  public void leadingLinesAndTrailingWhitespace_surroundTheStatements() {
    SimpleStatementLine line =
        new SimpleStatementLine(
            ImmutableList.of(new Return(new Name("x"))),
            ImmutableList.of(
                new EmptyLine(),
                new EmptyLine(SimpleWhitespace.EMPTY, new Comment("# doc"), new Newline())),
            new TrailingWhitespace(
                new SimpleWhitespace("  "), new Comment("# why"), new Newline("\r\n")));

    assertThat(line.code(), is("\n# doc\nreturn x  # why\r\n"));
  }

  @Test
  public void syntacticRange_excludesLeadingLinesAndTrailingWhitespace() {
    SimpleStatementLine line =
        new SimpleStatementLine(
            ImmutableList.of(new Break()),
            ImmutableList.of(new EmptyLine()),
            new TrailingWhitespace(SimpleWhitespace.SPACE, new Comment("#"), new Newline()));
    CodegenState state = new CodegenState(CstConfig.defaults());
    line.codegen(state);

    assertThat(
        state.positionOf(line).get(),
        is(new SourceRange(new SourcePosition(1, 0), new SourcePosition(3, 0))));
    assertThat(
        state.syntacticPositionOf(line).get(),
        is(new SourceRange(new SourcePosition(2, 0), new SourcePosition(2, 5))));
  }
}
