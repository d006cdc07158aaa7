package minicst.ast.visitors;

import java.util.Optional;
import minicst.ast.CstNode;

/**
 * Rebuilds a tree bottom-up. For every node, {@link #onVisit} is called before its children are
 * visited and {@link #onLeave} after the node was rebuilt from the (possibly replaced) children.
 *
 * <p>Returning an empty {@link Optional} from {@link #onLeave} removes the node from its parent.
 * This is only legal where the parent's slot is optional or a sequence.
 */
public interface CstTransformer {

  /** Returns false to leave the children of {@code node} untouched. */
  default boolean onVisit(CstNode node) {
    return true;
  }

  /**
   * @param original the node as it was before its children were visited
   * @param updated the node rebuilt from the visited children, equal to {@code original} if
   *     nothing changed
   * @return the node to put in place of {@code original}, or empty to remove it
   */
  default Optional<CstNode> onLeave(CstNode original, CstNode updated) {
    return Optional.of(updated);
  }
}
