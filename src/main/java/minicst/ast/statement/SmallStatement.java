package minicst.ast.statement;

import static com.google.common.base.Preconditions.checkNotNull;

import minicst.ast.CstNode;
import minicst.ast.MaybeSentinel;
import minicst.ast.op.Semicolon;
import minicst.ast.whitespace.SimpleWhitespace;
import minicst.codegen.CodegenState;
import minicst.util.SourcePosition;

/**
 * A statement that fits on part of a line and may be followed by a semicolon, like {@code return x}
 * or {@code break}. Several of them make up a {@link SimpleStatementLine}.
 */
public abstract class SmallStatement extends CstNode {

  /**
   * Optional semicolon when this is used in a statement line. This semicolon owns the whitespace
   * on both sides of it when it is used.
   */
  public final MaybeSentinel<Semicolon> semicolon;

  protected SmallStatement(MaybeSentinel<Semicolon> semicolon) {
    this.semicolon = checkNotNull(semicolon);
  }

  public abstract SmallStatement withSemicolon(MaybeSentinel<Semicolon> semicolon);

  /** Writes everything but the semicolon. */
  protected abstract void codegenSyntax(CodegenState state);

  @Override
  protected final void codegenImpl(CodegenState state) {
    codegenImpl(state, false);
  }

  /**
   * Renders this statement. If the semicolon is defaulted and {@code defaultSemicolon} is set, the
   * state's default semicolon text is written, "; " unless configured otherwise.
   */
  public final void codegen(CodegenState state, boolean defaultSemicolon) {
    state.beforeCodegen(this);
    codegenImpl(state, defaultSemicolon);
    state.afterCodegen(this);
  }

  private void codegenImpl(CodegenState state, boolean defaultSemicolon) {
    SourcePosition begin = state.currentPosition();
    codegenSyntax(state);
    state.recordSyntacticPosition(this, begin, state.currentPosition());

    if (semicolon.isDefault()) {
      if (defaultSemicolon) {
        state.addToken(state.defaultSemicolon());
      }
    } else {
      semicolon.get().codegen(state);
    }
  }

  /** True if {@code whitespace} explicitly asks for no gap at all. */
  static boolean hasNoGap(MaybeSentinel<SimpleWhitespace> whitespace) {
    return whitespace.isExplicit() && whitespace.get().isEmpty();
  }

  /**
   * Writes the whitespace after a keyword. The default is a single space, and only if something
   * follows the keyword.
   */
  static void codegenWhitespaceAfterKeyword(
      CodegenState state, MaybeSentinel<SimpleWhitespace> whitespace, boolean childFollows) {
    if (whitespace.isDefault()) {
      if (childFollows) {
        state.addToken(" ");
      }
    } else {
      whitespace.get().codegen(state);
    }
  }
}
