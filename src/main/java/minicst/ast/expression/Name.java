package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;
import minicst.token.Terminal;

/** An identifier such as {@code Exception}, {@code x} or {@code True}. */
public final class Name extends BaseExpression {

  public final String value;

  public Name(String value) {
    this.value = checkNotNull(value);
    if (value.isEmpty()) {
      throw new CstValidationError("Cannot have empty name identifier.");
    }
    int first = value.codePointAt(0);
    if (first != '_' && !Character.isLetter(first)) {
      throw new CstValidationError("Name '" + value + "' must start with a letter or '_'.");
    }
    if (!value.codePoints().allMatch(c -> c == '_' || Character.isLetterOrDigit(c))) {
      throw new CstValidationError("Name '" + value + "' contains invalid characters.");
    }
    if (Terminal.isKeyword(value)) {
      throw new CstValidationError("Name '" + value + "' is a reserved keyword.");
    }
  }

  @Override
  public boolean safeToUseWithWordOperator(ExpressionPosition position) {
    return false;
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
    return value.equals(((Name) o).value);
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
