package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import org.jetbrains.annotations.Nullable;

/** A {@code return} statement, with or without a value. */
public final class Return extends ReturnLike {

  public Return() {
    this(null);
  }

  public Return(@Nullable BaseExpression value) {
    this(value, MaybeSentinel.useDefault(), MaybeSentinel.useDefault());
  }

  public Return(
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super("return", value, whitespaceAfterKeyword, semicolon);
  }

  @Override
  protected Return create(
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    return new Return(value, whitespaceAfterKeyword, semicolon);
  }
}
