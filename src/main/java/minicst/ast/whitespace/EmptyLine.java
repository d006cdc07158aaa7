package minicst.ast.whitespace;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;
import org.jetbrains.annotations.Nullable;

/** A line holding nothing but optional whitespace and an optional comment. */
public final class EmptyLine extends CstNode {

  public final SimpleWhitespace whitespace;
  public final Optional<Comment> comment;
  public final Newline newline;

  public EmptyLine() {
    this(SimpleWhitespace.EMPTY, null, new Newline());
  }

  public EmptyLine(SimpleWhitespace whitespace, @Nullable Comment comment, Newline newline) {
    this.whitespace = checkNotNull(whitespace);
    this.comment = Optional.ofNullable(comment);
    this.newline = checkNotNull(newline);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    return new EmptyLine(
        ChildVisits.visitRequired(
            this, "whitespace", whitespace, SimpleWhitespace.class, transformer),
        ChildVisits.visitOptional(this, "comment", comment, Comment.class, transformer)
            .orElse(null),
        ChildVisits.visitRequired(this, "newline", newline, Newline.class, transformer));
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    whitespace.codegen(state);
    comment.ifPresent(c -> c.codegen(state));
    newline.codegen(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EmptyLine that = (EmptyLine) o;
    return whitespace.equals(that.whitespace)
        && comment.equals(that.comment)
        && newline.equals(that.newline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(whitespace, comment, newline);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("whitespace", whitespace)
        .add("comment", comment.orElse(null))
        .add("newline", newline)
        .omitNullValues()
        .toString();
  }
}
