package minicst.ast.expression;

import minicst.ast.CstNode;

/**
 * The capability statements rely on: an expression renders itself and tells whether it can touch
 * a word keyword without whitespace in between.
 */
public abstract class BaseExpression extends CstNode {

  /**
   * True if this expression can be written directly next to a word keyword at {@code position}
   * and still lex as two separate tokens. {@code raise(x)} is fine, {@code raisex} is not.
   */
  public abstract boolean safeToUseWithWordOperator(ExpressionPosition position);
}
