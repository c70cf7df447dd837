package com.countdown.core.expr;

import java.util.Objects;

/**
 * Operator node combining the values of its two subtrees.
 */
public record BinaryOp(Operator operator, Node left, Node right) implements Node {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    /**
     * Convenience factory for an operator applied to two numbers.
     */
    public static BinaryOp of(Operator operator, int left, int right) {
        return new BinaryOp(operator, new NumberLeaf(left), new NumberLeaf(right));
    }

    @Override
    public Node deepCopy() {
        return new BinaryOp(operator, left.deepCopy(), right.deepCopy());
    }

    @Override
    public int leafCount() {
        return left.leafCount() + right.leafCount();
    }

    @Override
    public String toString() {
        return render();
    }
}
