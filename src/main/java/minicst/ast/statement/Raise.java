package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.expression.From;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import org.jetbrains.annotations.Nullable;

/** A {@code raise} statement. A bare {@code raise} re-raises the active exception. */
public final class Raise extends RaiseLike {

  public Raise() {
    this(null, null);
  }

  public Raise(@Nullable BaseExpression exc, @Nullable From cause) {
    this(exc, cause, MaybeSentinel.useDefault(), MaybeSentinel.useDefault());
  }

  public Raise(
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super("raise", exc, cause, whitespaceAfterKeyword, semicolon);
  }

  @Override
  protected Raise create(
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    return new Raise(exc, cause, whitespaceAfterKeyword, semicolon);
  }
}
