package minicst.ast.statement;

import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;

/**
 * Represents a {@code continue} statement, which skips to the next iteration of the enclosing
 * loop.
 */
public final class Continue extends KeywordStatement {

  public Continue() {
    this(MaybeSentinel.useDefault());
  }

  public Continue(MaybeSentinel<Semicolon> semicolon) {
    super("continue", semicolon);
  }

  @Override
  public Continue withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return new Continue(semicolon);
  }
}
