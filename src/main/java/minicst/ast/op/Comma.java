package minicst.ast.op;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;

/** Separator between call arguments. It owns the whitespace on both of its sides. */
public final class Comma extends CstNode {

  public final SimpleWhitespace whitespaceBefore;
  public final SimpleWhitespace whitespaceAfter;

  public Comma() {
    this(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
  }

  public Comma(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) {
    this.whitespaceBefore = checkNotNull(whitespaceBefore);
    this.whitespaceAfter = checkNotNull(whitespaceAfter);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return new Comma(
        ChildVisits.visitRequired(
            this, "whitespaceBefore", whitespaceBefore, SimpleWhitespace.class, transformer),
        ChildVisits.visitRequired(
            this, "whitespaceAfter", whitespaceAfter, SimpleWhitespace.class, transformer));
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    whitespaceBefore.codegen(state);
    state.addToken(",");
    whitespaceAfter.codegen(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Comma that = (Comma) o;
    return whitespaceBefore.equals(that.whitespaceBefore)
        && whitespaceAfter.equals(that.whitespaceAfter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(whitespaceBefore, whitespaceAfter);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("whitespaceBefore", whitespaceBefore)
        .add("whitespaceAfter", whitespaceAfter)
        .toString();
  }
}
