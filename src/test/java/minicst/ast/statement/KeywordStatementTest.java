package minicst.ast.statement;

import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.Assert.assertThat;

import minicst.CstConfig;
import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;
import org.junit.Test;

public class KeywordStatementTest {

  private static String render(
      SmallStatement statement, boolean defaultSemicolon, CstConfig config) {
    CodegenState state = new CodegenState(config);
    statement.codegen(state, defaultSemicolon);
    return state.code();
  }

  @Test
  public void render_keywordOnly() {
    assertThat(new Break().code(), is("break"));
    assertThat(new Rompe().code(), is("rompe"));
    assertThat(new Continue().code(), is("continue"));
    assertThat(new Continua().code(), is("continúa"));
    assertThat(new Pass().code(), is("pass"));
  }

  @Test
  public void defaultSemicolon_usesConfiguredText() {
    CstConfig tight = CstConfig.defaults().withDefaultSemicolon(";");

    assertThat(render(new Break(), true, CstConfig.defaults()), is("break; "));
    assertThat(render(new Break(), true, tight), is("break;"));
    assertThat(render(new Break(), false, CstConfig.defaults()), is("break"));
  }

  @Test
  public void explicitSemicolon_renderedVerbatimEitherWay() {
    Continue statement =
        new Continue(
            MaybeSentinel.explicit(new Semicolon(SimpleWhitespace.SPACE, SimpleWhitespace.EMPTY)));

    assertThat(render(statement, true, CstConfig.defaults()), is("continue ;"));
    assertThat(render(statement, false, CstConfig.defaults()), is("continue ;"));
  }

  @Test
  public void withSemicolon_keepsKind() {
    Rompe rompe = new Rompe().withSemicolon(MaybeSentinel.explicit(new Semicolon()));

    assertThat(rompe.code(), is("rompe;"));
    assertThat(rompe.withSemicolon(MaybeSentinel.useDefault()), is(new Rompe()));
  }

  @Test
  public void equality_keywordSensitive() {
    assertThat(new Break(), is(new Break()));
    assertThat(new Break().hashCode(), is(new Break().hashCode()));
    assertThat((KeywordStatement) new Break(), is(not((KeywordStatement) new Rompe())));
    assertThat((KeywordStatement) new Continue(), is(not((KeywordStatement) new Break())));
  }
}
