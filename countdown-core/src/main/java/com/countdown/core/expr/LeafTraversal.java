package com.countdown.core.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Left-to-right leaf addressing for expression trees. Leaves are numbered {@code 0, 1, 2, ...} in
 * depth-first order; all functions are pure and never modify the trees they receive.
 */
public final class LeafTraversal {

    private LeafTraversal() {
    }

    /**
     * Returns the leaves of {@code root} in traversal order.
     */
    public static List<NumberLeaf> leaves(Node root) {
        Objects.requireNonNull(root, "root");
        List<NumberLeaf> leaves = new ArrayList<>(root.leafCount());
        collect(root, leaves);
        return leaves;
    }

    /**
     * Returns the leaf at position {@code index}.
     */
    public static NumberLeaf leafAt(Node root, int index) {
        Objects.requireNonNull(root, "root");
        checkIndex(root, index);
        Node current = root;
        int remaining = index;
        while (current instanceof BinaryOp op) {
            int leftCount = op.left().leafCount();
            if (remaining < leftCount) {
                current = op.left();
            } else {
                remaining -= leftCount;
                current = op.right();
            }
        }
        return (NumberLeaf) current;
    }

    /**
     * Returns a new tree in which the leaf at position {@code index} is replaced by
     * {@code replacement}. Nodes on the path to that leaf are rebuilt, untouched subtrees are shared.
     */
    public static Node replaceLeaf(Node root, int index, Node replacement) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(replacement, "replacement");
        checkIndex(root, index);
        return replace(root, index, replacement);
    }

    private static Node replace(Node node, int index, Node replacement) {
        if (node instanceof NumberLeaf) {
            return replacement;
        }
        BinaryOp op = (BinaryOp) node;
        int leftCount = op.left().leafCount();
        if (index < leftCount) {
            return new BinaryOp(op.operator(), replace(op.left(), index, replacement), op.right());
        }
        return new BinaryOp(op.operator(), op.left(), replace(op.right(), index - leftCount, replacement));
    }

    private static void collect(Node node, List<NumberLeaf> leaves) {
        if (node instanceof NumberLeaf leaf) {
            leaves.add(leaf);
            return;
        }
        BinaryOp op = (BinaryOp) node;
        collect(op.left(), leaves);
        collect(op.right(), leaves);
    }

    private static void checkIndex(Node root, int index) {
        int count = root.leafCount();
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Leaf index " + index + " out of range for " + count + " leaves");
        }
    }
}
