package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;

/** Represents a {@code break} statement, which leaves the enclosing loop early. */
public final class Break extends KeywordStatement {

  public Break() {
    this(MaybeSentinel.useDefault());
  }

  public Break(MaybeSentinel<Semicolon> semicolon) {
    super("break", semicolon);
  }

  @Override
  public Break withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Break(semicolon);
  }
}
