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
import minicst.ast.op.Semicolon;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code <keyword>} or {@code <keyword> x} statement, see {@link Return} and {@link Devuelve}.
 */
public abstract class ReturnLike extends SmallStatement {

  public final String keyword;

  /** The optional expression that will be evaluated and returned. */
  public final Optional<BaseExpression> value;

  /** Optional whitespace after the keyword before the optional value expression. */
  public final MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword;

  protected ReturnLike(
      String keyword,
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon) {
    super(semicolon);
    this.keyword = checkNotNull(keyword);
    this.value = Optional.ofNullable(value);
    this.whitespaceAfterKeyword = checkNotNull(whitespaceAfterKeyword);
    if (value != null
        && hasNoGap(whitespaceAfterKeyword)
        && !value.safeToUseWithWordOperator(ExpressionPosition.RIGHT)) {
      throw new CstValidationError("Must have at least one space after '" + keyword + "'.");
    }
  }

  /** Builds a node of the same spelling from the given parts, validating them. */
  protected abstract ReturnLike create(
      @Nullable BaseExpression value,
      MaybeSentinel<SimpleWhitespace> whitespaceAfterKeyword,
      MaybeSentinel<Semicolon> semicolon);

  public ReturnLike withValue(@Nullable BaseExpression value) {
    return create(value, whitespaceAfterKeyword, semicolon);
  }

  public ReturnLike withWhitespaceAfterKeyword(MaybeSentinel<SimpleWhitespace> whitespace) {
    return create(value.orElse(null), whitespace, semicolon);
  }

  @Override
  public ReturnLike withSemicolon(MaybeSentinel<Semicolon> semicolon) {
    return create(value.orElse(null), whitespaceAfterKeyword, semicolon);
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
    Optional<BaseExpression> visitedValue =
        ChildVisits.visitOptional(this, "value", value, BaseExpression.class, transformer);
    MaybeSentinel<Semicolon> visitedSemicolon =
        ChildVisits.visitSentinel(this, "semicolon", semicolon, Semicolon.class, transformer);
    return create(visitedValue.orElse(null), whitespace, visitedSemicolon);
  }

  @Override
  protected void codegenSyntax(CodegenState state) {
    state.addToken(keyword);
    codegenWhitespaceAfterKeyword(state, whitespaceAfterKeyword, value.isPresent());
    value.ifPresent(v -> v.codegen(state));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ReturnLike that = (ReturnLike) o;
    return value.equals(that.value)
        && whitespaceAfterKeyword.equals(that.whitespaceAfterKeyword)
        && semicolon.equals(that.semicolon);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyword, value, whitespaceAfterKeyword, semicolon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("value", value.orElse(null))
        .add("whitespaceAfterKeyword", whitespaceAfterKeyword)
        .add("semicolon", semicolon)
        .omitNullValues()
        .toString();
  }
}
