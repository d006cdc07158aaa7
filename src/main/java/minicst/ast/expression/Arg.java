package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.MaybeSentinel;
import minicst.ast.op.Comma;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;

/** A positional argument of a {@link Call}, with the comma that may follow it. */
public final class Arg extends CstNode {

  public final BaseExpression value;
  public final MaybeSentinel<Comma> comma;
  public final SimpleWhitespace whitespaceAfterArg;

  public Arg(BaseExpression value) {
    this(value, MaybeSentinel.useDefault(), SimpleWhitespace.EMPTY);
  }

  public Arg(
      BaseExpression value, MaybeSentinel<Comma> comma, SimpleWhitespace whitespaceAfterArg) {
    this.value = checkNotNull(value);
    this.comma = checkNotNull(comma);
    this.whitespaceAfterArg = checkNotNull(whitespaceAfterArg);
  }

  public Arg withComma(MaybeSentinel<Comma> comma) {
    return new Arg(value, comma, whitespaceAfterArg);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    BaseExpression visitedValue =
        ChildVisits.visitRequired(this, "value", value, BaseExpression.class, transformer);
    SimpleWhitespace afterArg =
        ChildVisits.visitRequired(
            this, "whitespaceAfterArg", whitespaceAfterArg, SimpleWhitespace.class, transformer);
    MaybeSentinel<Comma> visitedComma =
        ChildVisits.visitSentinel(this, "comma", comma, Comma.class, transformer);
    return new Arg(visitedValue, visitedComma, afterArg);
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    codegenImpl(state, false);
  }

  /** Renders this argument; a defaulted comma becomes {@code ", "} if {@code defaultComma}. */
  public void codegen(CodegenState state, boolean defaultComma) {
    state.beforeCodegen(this);
    codegenImpl(state, defaultComma);
    state.afterCodegen(this);
  }

  private void codegenImpl(CodegenState state, boolean defaultComma) {
    value.codegen(state);
    whitespaceAfterArg.codegen(state);
    if (comma.isDefault()) {
      if (defaultComma) {
        state.addToken(", ");
      }
    } else {
      comma.get().codegen(state);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Arg that = (Arg) o;
    return value.equals(that.value)
        && comma.equals(that.comma)
        && whitespaceAfterArg.equals(that.whitespaceAfterArg);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, comma, whitespaceAfterArg);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("value", value)
        .add("comma", comma)
        .add("whitespaceAfterArg", whitespaceAfterArg)
        .toString();
  }
}
