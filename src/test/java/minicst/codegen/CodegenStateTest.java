package minicst.codegen;

import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThat;

import minicst.Cst;
import minicst.CstConfig;
import minicst.ast.Module;
import minicst.ast.expression.From;
import minicst.ast.expression.Name;
import minicst.ast.statement.Raise;
import minicst.ast.statement.SimpleStatementLine;
import minicst.ast.statement.SmallStatement;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;
import org.junit.Test;

public class CodegenStateTest {

  private static SourceRange range(int beginLine, int beginColumn, int endLine, int endColumn) {
    return new SourceRange(
        new SourcePosition(beginLine, beginColumn), new SourcePosition(endLine, endColumn));
  }

  @Test
  public void addToken_tracksLinesAndColumns() {
    CodegenState state = new CodegenState(CstConfig.defaults());

    state.addToken("ab");
    assertThat(state.currentPosition(), is(new SourcePosition(1, 2)));
    state.addToken("\r\n");
    assertThat(state.currentPosition(), is(new SourcePosition(2, 0)));
    state.addToken("c\rd\n");
    assertThat(state.currentPosition(), is(new SourcePosition(4, 0)));
    assertThat(state.code(), is("ab\r\nc\rd\n"));
  }

  @Test
  public void removeTrailingDefaultNewline_onlyRemovesDefault() {
    CodegenState state = new CodegenState(CstConfig.defaults());
    state.addToken("x");
    state.addToken("\r");

    assertThat(state.removeTrailingDefaultNewline(), is(false));

    state.addToken("\n");
    assertThat(state.removeTrailingDefaultNewline(), is(true));
    assertThat(state.code(), is("x\r"));
    assertThat(state.currentPosition(), is(new SourcePosition(2, 0)));
  }

  @Test
  public void defaults_comeFromConfig() {
    CodegenState state =
        new CodegenState(
            CstConfig.defaults().withDefaultSemicolon(" ;").withDefaultNewline("\r\n"));

    assertThat(state.defaultSemicolon(), is(" ;"));
    assertThat(state.defaultNewline(), is("\r\n"));
  }

  @Test
  public void positions_recordedForEveryRenderedNode() {
    Module module = Cst.parseModule("pass\nraise x from y ;  break\n", CstConfig.defaults());
    SimpleStatementLine line = (SimpleStatementLine) module.body.get(1);
    Raise raise = (Raise) line.body.get(0);
    SmallStatement breakStatement = line.body.get(1);
    From cause = raise.cause.get();
    Name exc = (Name) raise.exc.get();

    CodegenState state = Cst.codegen(module, CstConfig.defaults());

    assertThat(state.code(), is("pass\nraise x from y ;  break\n"));
    assertThat(state.positionOf(module).get(), is(range(1, 0, 3, 0)));
    assertThat(state.positionOf(exc).get(), is(range(2, 6, 2, 7)));
    assertThat(state.positionOf(cause).get(), is(range(2, 7, 2, 14)));
    assertThat(state.positionOf(cause.item).get(), is(range(2, 13, 2, 14)));
    // the statement owns its semicolon, but its syntax ends before it
    assertThat(state.positionOf(raise).get(), is(range(2, 0, 2, 18)));
    assertThat(state.syntacticPositionOf(raise).get(), is(range(2, 0, 2, 14)));
    assertThat(state.positionOf(breakStatement).get(), is(range(2, 18, 2, 23)));
    assertThat(state.syntacticPositionOf(exc).get(), is(range(2, 6, 2, 7)));
  }

  @Test
  public void positionOf_unrenderedNodeIsEmpty() {
    CodegenState state = new CodegenState(CstConfig.defaults());

    assertThat(state.positionOf(new Name("x")).isPresent(), is(false));
  }

  @Test(expected = IllegalStateException.class)
  public void afterCodegenWithoutBefore_throws() {
    new CodegenState(CstConfig.defaults()).afterCodegen(new Name("x"));
  }
}
