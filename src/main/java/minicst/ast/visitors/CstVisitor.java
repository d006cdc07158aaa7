package minicst.ast.visitors;

import minicst.ast.CstNode;

/** A read-only walk over a tree. */
public interface CstVisitor {

  /** Returns false to skip the children of {@code node}. */
  default boolean onVisit(CstNode node) {
    return true;
  }

  default void onLeave(CstNode node) {}
}
