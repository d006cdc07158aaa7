package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;

/** The Spanish spelling of {@link Break}. */
public final class Rompe extends KeywordStatement {

  public Rompe() {
    this(MaybeSentinel.useDefault());
  }

  public Rompe(MaybeSentinel<Semicolon> semicolon) {
    super("rompe", semicolon);
  }

  @Override
  public Rompe withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Rompe(semicolon);
  }
}
