package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import org.jetbrains.annotations.Nullable;

/** The Spanish spelling of {@link Return}. */
public final class Devuelve extends ReturnLike {

  public Devuelve() {
    this(null);
  }

  public Devuelve(@Nullable BaseExpression value) {
    this(value, MaybeSentinel.useDefault(), MaybeSentinel.useDefault());
  }

  public Devuelve(
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super("devuelve", value, whitespaceAfterKeyword, semicolon);
  }

  @Override
  protected Devuelve create(
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    return new Devuelve(value, whitespaceAfterKeyword, semicolon);
  }
}
