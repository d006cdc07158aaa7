package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** A single-line string literal including its prefix and quotes, e.g. {@code b'\x00'}. */
public final class SimpleString extends BaseExpression {

  private static final ImmutableSet<String> PREFIXES =
      ImmutableSet.of("", "r", "u", "b", "f", "br", "rb", "fr", "rf");

  public final String value;

  public SimpleString(String value) {
    this.value = checkNotNull(value);
    int quoteIndex = firstQuoteIndex(value);
    if (quoteIndex < 0 || value.length() - quoteIndex < 2) {
      throw new CstValidationError("String '" + value + "' must have enclosing quotes.");
    }
    if (!PREFIXES.contains(value.substring(0, quoteIndex).toLowerCase())) {
      throw new CstValidationError("String '" + value + "' has an invalid prefix.");
    }
    if (value.charAt(value.length() - 1) != value.charAt(quoteIndex)) {
      throw new CstValidationError("String '" + value + "' must end with its opening quote.");
    }
    if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
      throw new CstValidationError("String '" + value + "' must not span lines.");
    }
  }

  private static int firstQuoteIndex(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\'') {
        return i;
      }
    }
    return -1;
  }

  /** The prefix letters before the opening quote, possibly empty. */
  public String prefix() {
    return value.substring(0, firstQuoteIndex(value));
  }

  public char quote() {
    return value.charAt(firstQuoteIndex(value));
  }

  /** Always safe on the left, as it ends with a quote; safe on the right without prefix. */
  @Override
  public boolean safeToUseWithWordOperator(ExpressionPosition position) {
    return position == ExpressionPosition.LEFT || prefix().isEmpty();
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
    return value.equals(((SimpleString) o).value);
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
