package minicst.ast;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.Assert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import minicst.Cst;
import minicst.CstConfig;
import minicst.ast.expression.From;
import minicst.ast.expression.Name;
import minicst.ast.op.Semicolon;
import minicst.ast.statement.Break;
import minicst.ast.statement.Continue;
import minicst.ast.statement.Pass;
import minicst.ast.statement.Raise;
import minicst.ast.statement.Return;
import minicst.ast.statement.SimpleStatementLine;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.visitors.CstVisitor;
import minicst.ast.whitespace.SimpleWhitespace;
import org.junit.Assert;
import org.junit.Test;

public class CstTransformerTest {

  private static Module parse(String source) {
    return Cst.parseModule(source, CstConfig.defaults());
  }

  /** Replaces every node of type {@code from} with the result of {@code replacement}. */
  private static CstTransformer replacing(
      Class<? extends CstNode> from, Function<CstNode, CstNode> replacement) {
    return new CstTransformer() {
      @Override
      public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
        return Optional.of(from.isInstance(updated) ? replacement.apply(updated) : updated);
      }
    };
  }

  private static CstTransformer removing(Class<? extends CstNode> type) {
    return new CstTransformer() {
      @Override
      public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
        return type.isInstance(updated) ? Optional.empty() : Optional.of(updated);
      }
    };
  }

  @Test
  public void continueToBreak_changesOnlyKeywords() {
    String source = "continue ;continue  # again\n\nx\ncontinue\n";
    Module module = parse(source);

    Module transformed =
        module.visitModule(
            replacing(Continue.class, node -> new Break(((Continue) node).semicolon)));

    assertThat(transformed.code(), is("break ;break  # again\n\nx\nbreak\n"));
  }

  @Test
  public void unchangedTransform_returnsEqualTree() {
    Module module = parse("raise x from y; return\n# end\n");

    Module visited = module.visitModule(new CstTransformer() {});

    assertThat(visited, is(module));
    assertThat(visited.code(), is(module.code()));
  }

  @Test
  public void breakToReturn_defaultWhitespaceAdaptsToValue() {
    Module module = parse("break\nbreak\n");
    List<CstNode> remaining = new ArrayList<>();
    remaining.add(new Return(new Name("x")));
    remaining.add(new Return());

    Module transformed = module.visitModule(replacing(Break.class, node -> remaining.remove(0)));

    assertThat(transformed.code(), is("return x\nreturn\n"));
  }

  @Test
  public void removedStatements_droppedFromSequence() {
    Module module = parse("pass; x\npass\n");

    Module transformed = module.visitModule(removing(Pass.class));

    // a line without statements renders as pass again
    assertThat(transformed.code(), is("x\npass\n"));
  }

  @Test
  public void removedSemicolon_resetsToDefault() {
    Module module = parse("break ;continue\n");

    Module transformed = module.visitModule(removing(Semicolon.class));

    assertThat(transformed.code(), is("break; continue\n"));
  }

  @Test
  public void removedOptionalCause_emptiesSlot() {
    Module module = parse("raise x from y\n");

    Module transformed = module.visitModule(removing(From.class));

    assertThat(transformed.code(), is("raise x\n"));
  }

  @Test
  public void removedExcWithCause_failsValidation() {
    Raise raise = new Raise(new Name("x"), new From(new Name("y")));
    Name exc = (Name) raise.exc.get();
    try {
      raise.deepRemove(exc);
      Assert.fail("expected CstValidationError");
    } catch (CstValidationError e) {
      assertThat(e.getMessage(), is("Must have an 'exc' when specifying 'cause' on Raise."));
    }
  }

  @Test
  public void removedRequiredChild_failsValidation() {
    From from = new From(new Name("y"));
    try {
      from.deepRemove(from.item);
      Assert.fail("expected CstValidationError");
    } catch (CstValidationError e) {
      assertThat(
          e.getMessage(), is("Field 'item' of From is required and its node cannot be removed."));
    }
  }

  @Test
  public void replacementOfWrongType_failsValidation() {
    Raise raise = new Raise(new Name("x"), null);
    try {
      raise.deepReplace(raise.exc.get(), new Pass());
      Assert.fail("expected CstValidationError");
    } catch (CstValidationError e) {
      assertThat(e.getMessage(), containsString("Expected a node of type BaseExpression"));
      assertThat(e.getMessage(), containsString("'exc' of Raise"));
    }
  }

  @Test
  public void replacementProducingInvalidCombination_failsValidation() {
    Raise raise =
        new Raise(
            new Name("x"),
            null,
            MaybeSentinel.explicit(new SimpleWhitespace(" ")),
            MaybeSentinel.useDefault());
    try {
      raise.deepReplace(raise.whitespaceAfterKeyword.get(), SimpleWhitespace.EMPTY);
      Assert.fail("expected CstValidationError");
    } catch (CstValidationError e) {
      assertThat(e.getMessage(), is("Must have at least one space after 'raise'."));
    }
  }

  @Test
  public void onVisitFalse_skipsChildren() {
    Module module = parse("continue\n");
    List<String> visited = new ArrayList<>();

    module.visitModule(
        new CstTransformer() {
          @Override
          public boolean onVisit(CstNode node) {
            visited.add(node.getClass().getSimpleName());
            return !(node instanceof SimpleStatementLine);
          }
        });

    assertThat(visited, contains("Module", "SimpleStatementLine"));
  }

  @Test
  public void children_inSourceOrder() {
    Name exc = new Name("x");
    From cause = new From(new Name("y"));
    SimpleWhitespace space = new SimpleWhitespace(" ");
    Raise raise = new Raise(exc, cause, MaybeSentinel.explicit(space), MaybeSentinel.useDefault());

    List<CstNode> children = raise.children();

    assertThat(children.size(), is(3));
    assertThat(children.get(0), is(sameInstance((CstNode) space)));
    assertThat(children.get(1), is(sameInstance((CstNode) exc)));
    assertThat(children.get(2), is(sameInstance((CstNode) cause)));
  }

  @Test
  public void walk_visitsEveryNodeOnce() {
    Module module = parse("raise x\n");
    List<String> left = new ArrayList<>();

    module.walk(
        new CstVisitor() {
          @Override
          public void onLeave(CstNode node) {
            left.add(node.getClass().getSimpleName());
          }
        });

    assertThat(
        left,
        contains(
            "SimpleWhitespace",
            "Name",
            "Raise",
            "SimpleWhitespace",
            "Newline",
            "TrailingWhitespace",
            "SimpleStatementLine",
            "Module"));
  }

  @Test
  public void deepReplace_matchesByIdentity() {
    Name first = new Name("x");
    Name second = new Name("x");
    SimpleStatementLine line =
        new SimpleStatementLine(ImmutableList.of(new Return(first), new Return(second)));

    CstNode replaced = line.deepReplace(second, new Name("y"));

    assertThat(replaced.code(), is("return x; return y\n"));
  }

  @Test
  public void deepRemove_ofRootIsEmpty() {
    Break root = new Break();

    assertThat(root.deepRemove(root), is(Optional.<CstNode>empty()));
  }

  @Test(expected = CstValidationError.class)
  public void removingModule_isRejected() {
    parse("pass\n").visitModule(removing(Module.class));
  }
}
