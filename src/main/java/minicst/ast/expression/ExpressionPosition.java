package minicst.ast.expression;

/** Where an expression sits relative to a word keyword such as {@code raise} or {@code from}. */
public enum ExpressionPosition {
  /** The expression comes before the keyword, as {@code exc} in {@code exc from}. */
  LEFT,
  /** The expression comes after the keyword, as {@code exc} in {@code raise exc}. */
  RIGHT
}
