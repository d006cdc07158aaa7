package minicst.ast.whitespace;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** A {@code #} comment, running up to but not including the end of the line. */
public final class Comment extends CstNode {

  public final String value;

  public Comment(String value) {
    this.value = checkNotNull(value);
    if (!value.startsWith("#")) {
      throw new CstValidationError("Comment must start with '#', got '" + value + "'.");
    }
    if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
      throw new CstValidationError("Comment must not contain a line break.");
    }
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
    return value.equals(((Comment) o).value);
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
