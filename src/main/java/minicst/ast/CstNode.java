package minicst.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import minicst.CstConfig;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.visitors.CstVisitor;
import minicst.codegen.CodegenState;

/**
 * Base class of every concrete syntax tree node.
 *
 * <p>Nodes are immutable values: {@code equals} compares structure, never identity. A node
 * validates its direct children and formatting in its constructor and throws {@link
 * CstValidationError} if they cannot be rendered, so every node that exists is renderable.
 * Editing a tree means building new nodes, usually through {@link #visit(CstTransformer)}.
 */
public abstract class CstNode {

  /**
   * Visits every child in source order and builds a new node of the same kind from the results.
   * Constructing the new node re-runs validation. Nodes without children return themselves.
   */
  protected abstract CstNode visitAndReplaceChildren(CstTransformer transformer);

  /** Writes the tokens of this node to {@code state}. Never fails for a constructed node. */
  protected abstract void codegenImpl(CodegenState state);

  /** Renders this node into {@code state} and records the range it occupies. */
  public final void codegen(CodegenState state) {
    state.beforeCodegen(this);
    codegenImpl(state);
    state.afterCodegen(this);
  }

  /**
   * Transforms the tree rooted at this node. Returns the replacement produced by {@link
   * CstTransformer#onLeave}, or empty if the transformer asked for this node to be removed.
   */
  public final Optional<CstNode> visit(CstTransformer transformer) {
    CstNode updated = transformer.onVisit(this) ? visitAndReplaceChildren(transformer) : this;
    return transformer.onLeave(this, updated);
  }

  /** Walks the tree rooted at this node without changing it. */
  public final void walk(CstVisitor visitor) {
    visit(
        new CstTransformer() {
          @Override
          public boolean onVisit(CstNode node) {
            return visitor.onVisit(node);
          }

          @Override
          public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
            visitor.onLeave(original);
            return Optional.of(original);
          }
        });
  }

  /** The direct children of this node, in source order. */
  public final List<CstNode> children() {
    ImmutableList.Builder<CstNode> children = ImmutableList.builder();
    walk(
        new CstVisitor() {
          @Override
          public boolean onVisit(CstNode node) {
            if (node == CstNode.this) {
              return true;
            }
            children.add(node);
            return false;
          }
        });
    return children.build();
  }

  /**
   * Returns a copy of this tree in which the node identical to {@code old} is replaced by {@code
   * replacement}. Nodes are matched by identity, so equal but distinct nodes are left alone.
   */
  public final CstNode deepReplace(CstNode old, CstNode replacement) {
    return visit(
            new CstTransformer() {
              @Override
              public boolean onVisit(CstNode node) {
                return node != old;
              }

              @Override
              public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
                return Optional.of(original == old ? replacement : updated);
              }
            })
        .get();
  }

  /**
   * Returns a copy of this tree without the node identical to {@code old}, or empty if this node
   * is {@code old} itself.
   */
  public final Optional<CstNode> deepRemove(CstNode old) {
    return visit(
        new CstTransformer() {
          @Override
          public boolean onVisit(CstNode node) {
            return node != old;
          }

          @Override
          public Optional<CstNode> onLeave(CstNode original, CstNode updated) {
            return original == old ? Optional.empty() : Optional.of(updated);
          }
        });
  }

  /** Renders this node on its own, with the default configuration. */
  public String code() {
    CodegenState state = new CodegenState(CstConfig.defaults());
    codegen(state);
    return state.code();
  }

  @Override
  public abstract boolean equals(Object o);

  @Override
  public abstract int hashCode();
}
