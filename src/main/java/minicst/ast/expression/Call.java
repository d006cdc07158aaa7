package minicst.ast.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import minicst.ast.ChildVisits;
import minicst.ast.CstNode;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;

/** A call {@code func(args)}. */
public final class Call extends BaseExpression {

  public final BaseExpression func;
  public final ImmutableList<Arg> args;
  public final SimpleWhitespace whitespaceAfterFunc;
  public final SimpleWhitespace whitespaceBeforeArgs;

  public Call(BaseExpression func, List<Arg> args) {
    this(func, args, SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
  }

  public Call(
      BaseExpression func,
      List<Arg> args,
      SimpleWhitespace whitespaceAfterFunc,
      SimpleWhitespace whitespaceBeforeArgs) {
    this.func = checkNotNull(func);
    this.args = ImmutableList.copyOf(args);
    this.whitespaceAfterFunc = checkNotNull(whitespaceAfterFunc);
    this.whitespaceBeforeArgs = checkNotNull(whitespaceBeforeArgs);
  }

  /** A call ends with a parenthesis; what it starts with depends on {@link #func}. */
  @Override
  public boolean safeToUseWithWordOperator(ExpressionPosition position) {
    return position == ExpressionPosition.LEFT || func.safeToUseWithWordOperator(position);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    BaseExpression visitedFunc =
        ChildVisits.visitRequired(this, "func", func, BaseExpression.class, transformer);
    SimpleWhitespace afterFunc =
        ChildVisits.visitRequired(
            this, "whitespaceAfterFunc", whitespaceAfterFunc, SimpleWhitespace.class, transformer);
    SimpleWhitespace beforeArgs =
        ChildVisits.visitRequired(
            this,
            "whitespaceBeforeArgs",
            whitespaceBeforeArgs,
            SimpleWhitespace.class,
            transformer);
    ImmutableList<Arg> visitedArgs =
        ChildVisits.visitSequence(this, "args", args, Arg.class, transformer);
    return new Call(visitedFunc, visitedArgs, afterFunc, beforeArgs);
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    func.codegen(state);
    whitespaceAfterFunc.codegen(state);
    state.addToken("(");
    whitespaceBeforeArgs.codegen(state);
    int last = args.size() - 1;
    for (int i = 0; i < args.size(); i++) {
      args.get(i).codegen(state, i != last);
    }
    state.addToken(")");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Call that = (Call) o;
    return func.equals(that.func)
        && args.equals(that.args)
        && whitespaceAfterFunc.equals(that.whitespaceAfterFunc)
        && whitespaceBeforeArgs.equals(that.whitespaceBeforeArgs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(func, args, whitespaceAfterFunc, whitespaceBeforeArgs);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("func", func)
        .add("args", args)
        .add("whitespaceAfterFunc", whitespaceAfterFunc)
        .add("whitespaceBeforeArgs", whitespaceBeforeArgs)
        .toString();
  }
}
