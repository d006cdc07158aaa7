package minicst.ast.statement;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;

/** A statement consisting of a single keyword, like {@code break} or {@code pass}. */
public abstract class KeywordStatement extends SmallStatement {

  public final String keyword;

  protected KeywordStatement(String keyword, MaybeSentinel<Semicolon> semicolon) {
    super(semicolon);
    this.keyword = checkNotNull(keyword);
  }

  @Override
  public abstract KeywordStatement withSemicolon(MaybeSentinel<Semicolon> semicolon);

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return withSemicolon(
        ChildVisits.visitSentinel(this, "semicolon", semicolon, Semicolon.class, transformer));
  }

  @Override
  protected void codegenSyntax(CodegenState state) {
    state.addToken(keyword);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return semicolon.equals(((KeywordStatement) o).semicolon);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyword, semicolon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("semicolon", semicolon).toString();
  }
}
