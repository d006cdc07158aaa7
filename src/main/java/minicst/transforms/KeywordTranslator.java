package minicst.transforms;

import java.util.Optional;
import minicst.ast.CstNode;
import minicst.ast.statement.Aumenta;
import minicst.ast.statement.Break;
import minicst.ast.statement.Continua;
import minicst.ast.statement.Continue;
import minicst.ast.statement.Devuelve;
import minicst.ast.statement.Raise;
import minicst.ast.statement.RaiseLike;
import minicst.ast.statement.Return;
import minicst.ast.statement.ReturnLike;
import minicst.ast.statement.Rompe;
import minicst.ast.visitors.CstTransformer;

/**
 * Rewrites statements from one keyword spelling into the other. Children and formatting are carried
 * over unchanged, so only the keywords of the rendered text differ.
 *
 * <p>{@code pass} has a single spelling and is left alone.
 */
public class KeywordTranslator implements CstTransformer {

  private final boolean toSpanish;

  private KeywordTranslator(boolean toSpanish) {
    this.toSpanish = toSpanish;
  }

  /** raise, return, break, continue to aumenta, devuelve, rompe, continúa. */
  public static KeywordTranslator toSpanish() {
    return new KeywordTranslator(true);
  }

  public static KeywordTranslator toEnglish() {
    return new KeywordTranslator(false);
  }

  @Override
  public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
    return Optional.of(toSpanish ? spanish(updated) : english(updated));
  }

  private static CstNode spanish(CstNode node) {
    if (node instanceof Raise) {
      RaiseLike raise = (RaiseLike) node;
      return new Aumenta(
          raise.exc.orElse(null),
          raise.cause.orElse(null),
          raise.whitespaceAfterKeyword,
          raise.semicolon);
    }
    if (node instanceof Return) {
      ReturnLike ret = (ReturnLike) node;
      return new Devuelve(ret.value.orElse(null), ret.whitespaceAfterKeyword, ret.semicolon);
    }
    if (node instanceof Break) {
      return new Rompe(((Break) node).semicolon);
    }
    if (node instanceof Continue) {
      return new Continua(((Continue) node).semicolon);
    }
    return node;
  }

  private static CstNode english(CstNode node) {
    if (node instanceof Aumenta) {
      RaiseLike raise = (RaiseLike) node;
      return new Raise(
          raise.exc.orElse(null),
          raise.cause.orElse(null),
          raise.whitespaceAfterKeyword,
          raise.semicolon);
    }
    if (node instanceof Devuelve) {
      ReturnLike ret = (ReturnLike) node;
      return new Return(ret.value.orElse(null), ret.whitespaceAfterKeyword, ret.semicolon);
    }
    if (node instanceof Rompe) {
      return new Break(((Rompe) node).semicolon);
    }
    if (node instanceof Continua) {
      return new Continue(((Continua) node).semicolon);
    }
    return node;
  }
}
