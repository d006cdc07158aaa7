package minicst.ast.statement;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.op.Semicolon;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** An expression used as a statement, usually a call whose result is discarded. */
public final class Expr extends SmallStatement {

  public final BaseExpression value;

  public Expr(BaseExpression value) {
    this(value, MaybeSentinel.useDefault());
  }

  public Expr(BaseExpression value, MaybeSentinel<Semicolon> semicolon) {
    super(semicolon);
    this.value = checkNotNull(value);
  }

  public Expr withValue(BaseExpression value) {
    return new Expr(value, semicolon);
  }

  @Override
  public Expr withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Expr(value, semicolon);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return new Expr(
        ChildVisits.visitRequired(this, "value", value, BaseExpression.class, transformer),
        ChildVisits.visitSentinel(this, "semicolon", semicolon, Semicolon.class, transformer));
  }

  @Override
  protected void codegenSyntax(CodegenState state) {
    value.codegen(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Expr that = (Expr) o;
    return value.equals(that.value) && semicolon.equals(that.semicolon);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, semicolon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("value", value)
        .add("semicolon", semicolon)
        .toString();
  }
}
