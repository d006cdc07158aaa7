package minicst.ast.whitespace;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.regex.Pattern;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** A run of spaces, tabs and form feeds between two tokens on the same line. */
public final class SimpleWhitespace extends CstNode {

  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("[ \f\t]*");

  public static final SimpleWhitespace EMPTY = new SimpleWhitespace("");
  public static final SimpleWhitespace SPACE = new SimpleWhitespace(" ");

  public final String value;

  public SimpleWhitespace(String value) {
    this.value = checkNotNull(value);
    if (!WHITESPACE_PATTERN.matcher(value).matches()) {
      throw new CstValidationError(
          "Got non-whitespace value '" + value + "' for SimpleWhitespace.");
    }
  }

  public boolean isEmpty() {
    return value.isEmpty();
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
    return value.equals(((SimpleWhitespace) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue("'" + value + "'").toString();
  }
}
