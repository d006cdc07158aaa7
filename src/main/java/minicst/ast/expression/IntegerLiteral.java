package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.regex.Pattern;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** A decimal integer, with optional single underscores between digits. */
public final class IntegerLiteral extends BaseExpression {

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[0-9]+(_[0-9]+)*");

  public final String value;

  public IntegerLiteral(String value) {
    this.value = checkNotNull(value);
    if (!INTEGER_PATTERN.matcher(value).matches()) {
      throw new CstValidationError("Got invalid integer literal '" + value + "'.");
    }
  }

  /**
   * A number may be followed directly by a keyword, {@code 5from x} lexes fine. A keyword directly
   * before a number would glue both into one name.
   */
  @Override
  public boolean safeToUseWithWordOperator(ExpressionPosition position) {
    return position == ExpressionPosition.LEFT;
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return this;
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    state.addToken(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return value.equals(((IntegerLiteral) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue(value).toString();
  }
}
