package minicst.parser;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThat;

import com.google.common.collect.ImmutableList;
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
import minicst.ast.op.Comma;
import minicst.ast.op.Semicolon;
import minicst.ast.statement.Break;
import minicst.ast.statement.Continue;
import minicst.ast.statement.Raise;
import minicst.ast.statement.Return;
import minicst.ast.statement.SimpleStatementLine;
import minicst.ast.statement.SmallStatement;
import minicst.ast.whitespace.Newline;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.lexer.Lexer;
import minicst.token.Terminal;
import minicst.token.Token;
import minicst.util.SourcePosition;
import minicst.util.SourceRange;
import org.junit.Assert;
import org.junit.Test;

public class ParserTest {

  private static Module parse(String source) {
    return new Parser(new Lexer(source), CstConfig.defaults()).parseModule();
  }

  private static SimpleStatementLine onlyLine(Module module) {
    assertThat(module.body, hasSize(1));
    return (SimpleStatementLine) module.body.get(0);
  }

  @Test
  public void parseRaiseFrom_keepsAllWhitespace() {
    SimpleStatementLine line = onlyLine(parse("raise x  from\ty\n"));

    Raise expected =
        new Raise(
            new Name("x"),
            new From(
                new Name("y"),
                MaybeSentinel.explicit(new SimpleWhitespace("  ")),
                new SimpleWhitespace("\t")),
            MaybeSentinel.explicit(SimpleWhitespace.SPACE),
            MaybeSentinel.useDefault());
    assertThat(line.body, is(ImmutableList.<SmallStatement>of(expected)));
  }

  @Test
  public void parseBareReturn_whitespaceAfterKeywordIsDefault() {
    SimpleStatementLine line = onlyLine(parse("return  \n"));

    Return ret = (Return) line.body.get(0);
    assertThat(ret.value.isPresent(), is(false));
    assertThat(ret.whitespaceAfterKeyword.isDefault(), is(true));
    assertThat(line.trailingWhitespace.whitespace, is(new SimpleWhitespace("  ")));
  }

  @Test
  public void parseSemicolons_ownTheirWhitespace() {
    SimpleStatementLine line = onlyLine(parse("break ;  continue;\n"));

    assertThat(
        line.body,
        is(
            ImmutableList.<SmallStatement>of(
                new Break(
                    MaybeSentinel.explicit(
                        new Semicolon(SimpleWhitespace.SPACE, new SimpleWhitespace("  ")))),
                new Continue(MaybeSentinel.explicit(new Semicolon())))));
  }

  @Test
  public void parseEmptyLines_distributedToHeaderLeadingLinesAndFooter() {
    Module module = parse("# header\n\nbreak\n  # above\ncontinue\n\n# footer\n");

    assertThat(module.header, hasSize(2));
    assertThat(module.footer, hasSize(2));
    assertThat(module.body, hasSize(2));
    assertThat(((SimpleStatementLine) module.body.get(0)).leadingLines, is(empty()));
    SimpleStatementLine second = (SimpleStatementLine) module.body.get(1);
    assertThat(second.leadingLines, hasSize(1));
    assertThat(second.leadingLines.get(0).comment.get().value, is("# above"));
  }

  @Test
  public void parseWithoutFinalNewline_noTrailingNewline() {
    assertThat(parse("pass").hasTrailingNewline, is(false));
    assertThat(parse("pass\n").hasTrailingNewline, is(true));
    assertThat(parse("").hasTrailingNewline, is(true));
  }

  @Test
  public void parseCrlf_detectedAsDefaultNewline() {
    Module module = parse("a\r\nb\n");

    assertThat(module.defaultNewline, is("\r\n"));
    assertThat(onlyLineAt(module, 0).trailingWhitespace.newline, is(new Newline()));
    assertThat(onlyLineAt(module, 1).trailingWhitespace.newline, is(new Newline("\n")));
  }

  @Test
  public void parseWithoutAnyNewline_usesConfiguredNewline() {
    Module module =
        new Parser(new Lexer("pass"), CstConfig.defaults().withDefaultNewline("\r"))
            .parseModule();

    assertThat(module.defaultNewline, is("\r"));
  }

  private static SimpleStatementLine onlyLineAt(Module module, int index) {
    return (SimpleStatementLine) module.body.get(index);
  }

  @Test
  public void parseExpression_callWithTrailingComma() {
    BaseExpression expression = new Parser(new Lexer("f(a , 1, )")).parseExpression();

    Call expected =
        new Call(
            new Name("f"),
            ImmutableList.of(
                new Arg(
                    new Name("a"),
                    MaybeSentinel.explicit(
                        new Comma(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE)),
                    SimpleWhitespace.EMPTY),
                new Arg(
                    new IntegerLiteral("1"),
                    MaybeSentinel.explicit(
                        new Comma(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE)),
                    SimpleWhitespace.EMPTY)));
    assertThat(expression, is(expected));
  }

  @Test
  public void parseStatement_singleLine() {
    SimpleStatementLine line = new Parser(new Lexer("\nreturn 1\n")).parseStatement();

    assertThat(line.leadingLines, hasSize(1));
    assertThat(line.body.get(0), instanceOf(Return.class));
  }

  @Test
  public void parseIndentedLine_throwsUnexpectedIndent() {
    try {
      parse("pass\n  pass\n");
      Assert.fail("expected ParserError");
    } catch (ParserError e) {
      assertThat(e.getMessage(), containsString("unexpected indent"));
      assertThat(e.range.begin, is(new SourcePosition(2, 0)));
    }
  }

  @Test
  public void parseReservedKeyword_throwsNotSupported() {
    try {
      parse("while x\n");
      Assert.fail("expected ParserError");
    } catch (ParserError e) {
      assertThat(e.getMessage(), containsString("'while' is not supported"));
    }
  }

  @Test
  public void parseInvalidSequences_throwParserError() {
    String[] inputs = {
      "raise x y\n", "raise from x\n", "return (x\n", "f(,)\n", ";\n", "x from y\n",
    };
    for (String input : inputs) {
      try {
        parse(input);
      } catch (ParserError e) {
        continue;
      }
      Assert.fail(String.format("Didn't fail with input '%s'", input));
    }
  }

  @Test
  public void parseInvalidNodeCombination_reportedAtKeyword() {
    SourceRange keywordRange = new SourceRange(SourcePosition.BEGIN_OF_PROGRAM, 5);
    // "raisex" cannot come out of the lexer, so the tokens are built by hand
    ImmutableList<Token> tokens =
        ImmutableList.of(
            new Token(Terminal.RAISE, keywordRange, "raise"),
            new Token(Terminal.NAME, new SourceRange(new SourcePosition(1, 5), 1), "x"),
            new Token(Terminal.EOF, new SourceRange(new SourcePosition(1, 6), 0), ""));
    try {
      new Parser(tokens.iterator()).parseModule();
      Assert.fail("expected ParserError");
    } catch (ParserError e) {
      assertThat(e.range, is(keywordRange));
      assertThat(e.getMessage(), containsString("Must have at least one space after 'raise'."));
      assertThat(e.getCause(), instanceOf(CstValidationError.class));
    }
  }
}
