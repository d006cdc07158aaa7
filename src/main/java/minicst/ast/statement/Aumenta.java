package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.expression.From;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import org.jetbrains.annotations.Nullable;

/** The Spanish spelling of {@link Raise}. */
public final class Aumenta extends RaiseLike {

  public Aumenta() {
    this(null, null);
  }

  public Aumenta(@Nullable BaseExpression exc, @Nullable From cause) {
    this(exc, cause, MaybeSentinel.useDefault(), MaybeSentinel.useDefault());
  }

  public Aumenta(
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super("aumenta", exc, cause, whitespaceAfterKeyword, semicolon);
  }

  @Override
  protected Aumenta create(
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    return new Aumenta(exc, cause, whitespaceAfterKeyword, semicolon);
  }
}
