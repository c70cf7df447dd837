package com.countdown.core.expr;

/**
 * Immutable node of a candidate expression tree. The hierarchy is closed: a node is either a
 * {@link NumberLeaf} or a {@link BinaryOp}.
 *
 * <pre>
 *            BinaryOp *
 *           /          \
 *     BinaryOp -     NumberLeaf 7
 *     /        \
 * NumberLeaf 5  NumberLeaf 3
 * </pre>
 *
 * The tree above renders as {@code (5 - 3) * 7} and evaluates to {@code 14}.
 */
public sealed interface Node permits NumberLeaf, BinaryOp {

    /**
     * Evaluates the subtree rooted at this node.
     */
    default Evaluation evaluate() {
        return ExpressionEvaluator.evaluate(this);
    }

    /**
     * Returns the canonical infix rendering with minimal parentheses. Two trees with the same
     * rendering are treated as the same candidate during search.
     */
    default String render() {
        return ExpressionRenderer.render(this);
    }

    /**
     * Returns a structurally identical tree that shares no node with this one.
     */
    Node deepCopy();

    /**
     * Returns the number of leaves in this subtree.
     */
    int leafCount();
}
