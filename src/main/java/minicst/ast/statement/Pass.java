package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;

/** A {@code pass} statement. */
public final class Pass extends KeywordStatement {

  public Pass() {
    this(MaybeSentinel.useDefault());
  }

  public Pass(MaybeSentinel<Semicolon> semicolon) {
    super("pass", semicolon);
  }

  @Override
  public Pass withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Pass(semicolon);
  }
}
