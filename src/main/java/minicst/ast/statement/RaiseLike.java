package minicst.ast.statement;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.CstValidationError;
import minicst.ast.MaybeSentinel;
import minicst.ast.expression.BaseExpression;
import minicst.ast.expression.ExpressionPosition;
import minicst.ast.expression.From;
import minicst.ast.op.Semicolon;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code <keyword> exc} or {@code <keyword> exc from cause} statement. The keyword depends on the
 * subclass, see {@link Raise} and {@link Aumenta}.
 */
public abstract class RaiseLike extends SmallStatement {

  public final String keyword;

  /** The exception that should be raised. */
  public final Optional<BaseExpression> exc;

  /**
   * Optionally, a {@code from cause} clause to raise an exception out of another exception's
   * context.
   */
  public final Optional<From> cause;

  /** Any whitespace appearing between the keyword and the exception. */
  public final MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword;

  protected RaiseLike(
      String keyword,
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super(semicolon);
    this.keyword = checkNotNull(keyword);
    this.exc = Optional.ofNullable(exc);
    this.cause = Optional.ofNullable(cause);
    this.whitespaceAfterKeyword = checkNotNull(whitespaceAfterKeyword);
    validate();
  }

  private void validate() {
    if (!exc.isPresent() && cause.isPresent()) {
      throw new CstValidationError(
          "Must have an 'exc' when specifying 'cause' on " + getClass().getSimpleName() + ".");
    }
    if (!exc.isPresent()) {
      return;
    }
    BaseExpression e = exc.get();
    if (hasNoGap(whitespaceAfterKeyword)
        && !e.safeToUseWithWordOperator(ExpressionPosition.RIGHT)) {
      throw new CstValidationError("Must have at least one space after '" + keyword + "'.");
    }
    if (cause.isPresent()
        && hasNoGap(cause.get().whitespaceBeforeFrom)
        && !e.safeToUseWithWordOperator(ExpressionPosition.LEFT)) {
      throw new CstValidationError("Must have at least one space before 'from'.");
    }
  }

  /** Builds a node of the same spelling from the given parts, validating them. */
  protected abstract RaiseLike create(
      @Nullable BaseExpression exc,
      @Nullable From cause,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon);

  public RaiseLike withExc(@Nullable BaseExpression exc) {
    return create(exc, cause.orElse(null), whitespaceAfterKeyword, semicolon);
  }

  public RaiseLike withCause(@Nullable From cause) {
    return create(exc.orElse(null), cause, whitespaceAfterKeyword, semicolon);
  }

  public RaiseLike withWhitespaceAfterKeyword(MaybeSentinel<SimpleWhitespace> whitespace) {
    return create(exc.orElse(null), cause.orElse(null), whitespace, semicolon);
  }

  @Override
  public RaiseLike withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return create(exc.orElse(null), cause.orElse(null), whitespaceAfterKeyword, semicolon);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    MaybeSentinel<SimpleWhitespace> whitespace =
        ChildVisits.visitSentinel(
            this,
            "whitespaceAfterKeyword",
            whitespaceAfterKeyword,
            SimpleWhitespace.class,
            transformer);
    Optional<BaseExpression> visitedExc =
        ChildVisits.visitOptional(this, "exc", exc, BaseExpression.class, transformer);
    Optional<From> visitedCause =
        ChildVisits.visitOptional(this, "cause", cause, From.class, transformer);
    MaybeSentinel<Semicolon> visitedSemicolon =
        ChildVisits.visitSentinel(this, "semicolon", semicolon, Semicolon.class, transformer);
    return create(
        visitedExc.orElse(null), visitedCause.orElse(null), whitespace, visitedSemicolon);
  }

  @Override
  protected void codegenSyntax(CodegenState state) {
    state.addToken(keyword);
    codegenWhitespaceAfterKeyword(state, whitespaceAfterKeyword, exc.isPresent());
    exc.ifPresent(e -> e.codegen(state));
    cause.ifPresent(c -> c.codegen(state, " "));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    RaiseLike that = (RaiseLike) o;
    return exc.equals(that.exc)
        && cause.equals(that.cause)
        && whitespaceAfterKeyword.equals(that.whitespaceAfterKeyword)
        && semicolon.equals(that.semicolon);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyword, exc, cause, whitespaceAfterKeyword, semicolon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("exc", exc.orElse(null))
        .add("cause", cause.orElse(null))
        .add("whitespaceAfterKeyword", whitespaceAfterKeyword)
        .add("semicolon", semicolon)
        .omitNullValues()
        .toString();
  }
}
