package minicst.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import minicst.ast.visitors.CstTransformer;

/**
 * Helpers used by {@link CstNode#visitAndReplaceChildren} implementations. Each helper visits one
 * slot and checks that whatever the transformer returned fits into it.
 */
public final class ChildVisits {

  private ChildVisits() {}

  /** Visits a slot that must stay filled. Removing its node is an error. */
  public static <T extends CstNode> T visitRequired(
      CstNode parent, String field, T child, Class<T> type, CstTransformer transformer) {
    Optional<CstNode> result = child.visit(transformer);
    if (!result.isPresent()) {
      throw new CstValidationError(
          String.format(
              "Field '%s' of %s is required and its node cannot be removed.",
              field, parent.getClass().getSimpleName()));
    }
    return cast(parent, field, result.get(), type);
  }

  /** Visits an optional semantic child. Removing its node empties the slot. */
  public static <T extends CstNode> Optional<T> visitOptional(
      CstNode parent, String field, Optional<T> child, Class<T> type, CstTransformer transformer) {
    if (!child.isPresent()) {
      return child;
    }
    return child.get().visit(transformer).map(node -> cast(parent, field, node, type));
  }

  /** Visits a formatting slot. Removing its node resets the slot to the default. */
  public static <T extends CstNode> MaybeSentinel<T> visitSentinel(
      CstNode parent,
      String field,
      MaybeSentinel<T> child,
      Class<T> type,
      CstTransformer transformer) {
    if (child.isDefault()) {
      return child;
    }
    return MaybeSentinel.fromOptional(
        child.get().visit(transformer).map(node -> cast(parent, field, node, type)));
  }

  /** Visits a sequence of nodes in order. Removed nodes are dropped from the sequence. */
  public static <T extends CstNode> ImmutableList<T> visitSequence(
      CstNode parent,
      String field,
      List<T> children,
      Class<T> type,
      CstTransformer transformer) {
    ImmutableList.Builder<T> visited = ImmutableList.builder();
    for (T child : children) {
      child.visit(transformer).ifPresent(node -> visited.add(cast(parent, field, node, type)));
    }
    return visited.build();
  }

  private static <T extends CstNode> T cast(
      CstNode parent, String field, CstNode node, Class<T> type) {
    if (!type.isInstance(node)) {
      throw new CstValidationError(
          String.format(
              "Expected a node of type %s for field '%s' of %s, but got %s.",
              type.getSimpleName(),
              field,
              parent.getClass().getSimpleName(),
              node.getClass().getSimpleName()));
    }
    return type.cast(node);
  }
}
