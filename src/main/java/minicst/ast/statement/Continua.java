package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;

/** The Spanish spelling of {@link Continue}: {@code continúa}. */
public final class Continua extends KeywordStatement {

  public Continua() {
    this(MaybeSentinel.useDefault());
  }

  public Continua(MaybeSentinel<Semicolon> semicolon) {
    super("continúa", semicolon);
  }

  @Override
  public Continua withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Continua(semicolon);
  }
}
