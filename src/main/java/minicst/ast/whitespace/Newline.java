package minicst.ast.whitespace;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;
import org.jetbrains.annotations.Nullable;

/**
 * The end of a line. Without an explicit value the state's default newline is rendered, which
 * keeps new lines consistent with the rest of the file.
 */
public final class Newline extends CstNode {

  private static final ImmutableSet<String> VALID_NEWLINES = ImmutableSet.of("\n", "\r\n", "\r");

  public final Optional<String> value;

  public Newline() {
    this(null);
  }

  public Newline(@Nullable String value) {
    this.value = Optional.ofNullable(value);
    if (value != null && !VALID_NEWLINES.contains(value)) {
      throw new CstValidationError("Got an invalid value for Newline node.");
    }
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return this;
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    state.addToken(value.orElse(state.defaultNewline()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return value.equals(((Newline) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .addValue(value.map(v -> v.replace("\r", "\\r").replace("\n", "\\n")).orElse("default"))
        .toString();
  }
}
