package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;

/** An expression in parentheses. The parentheses make it safe next to any keyword. */
public final class Parenthesized extends BaseExpression {

  public final BaseExpression value;
  public final SimpleWhitespace whitespaceAfterLpar;
  public final SimpleWhitespace whitespaceBeforeRpar;

  public Parenthesized(BaseExpression value) {
    this(value, SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
  }

  public Parenthesized(
      BaseExpression value,
      SimpleWhitespace whitespaceAfterLpar,
      SimpleWhitespace whitespaceBeforeRpar) {
    this.value = checkNotNull(value);
    this.whitespaceAfterLpar = checkNotNull(whitespaceAfterLpar);
    this.whitespaceBeforeRpar = checkNotNull(whitespaceBeforeRpar);
  }

  @Override
  public boolean safeToUseWithWordOperator(ExpressionPosition position) {
    return true;
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    SimpleWhitespace afterLpar =
        ChildVisits.visitRequired(
            this, "whitespaceAfterLpar", whitespaceAfterLpar, SimpleWhitespace.class, transformer);
    BaseExpression visitedValue =
        ChildVisits.visitRequired(this, "value", value, BaseExpression.class, transformer);
    SimpleWhitespace beforeRpar =
        ChildVisits.visitRequired(
            this,
            "whitespaceBeforeRpar",
            whitespaceBeforeRpar,
            SimpleWhitespace.class,
            transformer);
    return new Parenthesized(visitedValue, afterLpar, beforeRpar);
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    state.addToken("(");
    whitespaceAfterLpar.codegen(state);
    value.codegen(state);
    whitespaceBeforeRpar.codegen(state);
    state.addToken(")");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Parenthesized that = (Parenthesized) o;
    return value.equals(that.value)
        && whitespaceAfterLpar.equals(that.whitespaceAfterLpar)
        && whitespaceBeforeRpar.equals(that.whitespaceBeforeRpar);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, whitespaceAfterLpar, whitespaceBeforeRpar);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("value", value)
        .add("whitespaceAfterLpar", whitespaceAfterLpar)
        .add("whitespaceBeforeRpar", whitespaceBeforeRpar)
        .toString();
  }
}
