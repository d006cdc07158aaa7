package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.MaybeSentinel;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;

/** The {@code from cause} clause of a raise statement. */
public final class From extends CstNode {

  /** The expression after {@code from}. */
  public final BaseExpression item;

  /**
   * Whitespace between the raised expression and {@code from}. The owning statement renders a
   * single space in the default case.
   */
  public final MaybeSentinel<SimpleWhitespace> whitespaceBeforeFrom;

  public final SimpleWhitespace whitespaceAfterFrom;

  public From(BaseExpression item) {
    this(item, MaybeSentinel.useDefault(), SimpleWhitespace.SPACE);
  }

  public From(
      BaseExpression item,
      MaybeSentinel<SimpleWhitespace> whitespaceBeforeFrom,
      SimpleWhitespace whitespaceAfterFrom) {
    this.item = checkNotNull(item);
    this.whitespaceBeforeFrom = checkNotNull(whitespaceBeforeFrom);
    this.whitespaceAfterFrom = checkNotNull(whitespaceAfterFrom);
    if (whitespaceAfterFrom.isEmpty()
        && !item.safeToUseWithWordOperator(ExpressionPosition.RIGHT)) {
      throw new CstValidationError("Must have at least one space after 'from'.");
    }
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    MaybeSentinel<SimpleWhitespace> beforeFrom =
        ChildVisits.visitSentinel(
            this,
            "whitespaceBeforeFrom",
            whitespaceBeforeFrom,
            SimpleWhitespace.class,
            transformer);
    SimpleWhitespace afterFrom =
        ChildVisits.visitRequired(
            this, "whitespaceAfterFrom", whitespaceAfterFrom, SimpleWhitespace.class, transformer);
    BaseExpression visitedItem =
        ChildVisits.visitRequired(this, "item", item, BaseExpression.class, transformer);
    return new From(visitedItem, beforeFrom, afterFrom);
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    codegenImpl(state, "");
  }

  /** Renders this clause, writing {@code defaultSpace} if the space before 'from' is defaulted. */
  public void codegen(CodegenState state, String defaultSpace) {
    state.beforeCodegen(this);
    codegenImpl(state, defaultSpace);
    state.afterCodegen(this);
  }

  private void codegenImpl(CodegenState state, String defaultSpace) {
    if (whitespaceBeforeFrom.isDefault()) {
      state.addToken(defaultSpace);
    } else {
      whitespaceBeforeFrom.get().codegen(state);
    }
    state.addToken("from");
    whitespaceAfterFrom.codegen(state);
    item.codegen(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    From that = (From) o;
    return item.equals(that.item)
        && whitespaceBeforeFrom.equals(that.whitespaceBeforeFrom)
        && whitespaceAfterFrom.equals(that.whitespaceAfterFrom);
  }

  @Override
  public int hashCode() {
    return Objects.hash(item, whitespaceBeforeFrom, whitespaceAfterFrom);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("item", item)
        .add("whitespaceBeforeFrom", whitespaceBeforeFrom)
        .add("whitespaceAfterFrom", whitespaceAfterFrom)
        .toString();
  }
}
