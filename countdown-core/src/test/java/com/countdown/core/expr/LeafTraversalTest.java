package com.countdown.core.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class LeafTraversalTest {

    private static final Node TREE = new BinaryOp(Operator.MULTIPLY,
            new BinaryOp(Operator.ADD, BinaryOp.of(Operator.SUBTRACT, 10, 4), new NumberLeaf(1)),
            BinaryOp.of(Operator.ADD, 25, 50));

    @Test
    void numbersLeavesLeftToRight() {
        assertEquals(List.of(new NumberLeaf(10), new NumberLeaf(4), new NumberLeaf(1), new NumberLeaf(25),
                new NumberLeaf(50)), LeafTraversal.leaves(TREE));
        assertEquals(new NumberLeaf(1), LeafTraversal.leafAt(TREE, 2));
        assertEquals(new NumberLeaf(50), LeafTraversal.leafAt(TREE, 4));
    }

    @Test
    void replacesOnlyTheAddressedLeaf() {
        Node replaced = LeafTraversal.replaceLeaf(TREE, 3, BinaryOp.of(Operator.DIVIDE, 25, 5));

        assertEquals("(10 - 4 + 1) * (25 / 5 + 50)", replaced.render());
        assertEquals("(10 - 4 + 1) * (25 + 50)", TREE.render());
        assertSame(((BinaryOp) TREE).left(), ((BinaryOp) replaced).left());
    }

    @Test
    void replacingSingleLeafReturnsReplacement() {
        Node replacement = BinaryOp.of(Operator.ADD, 3, 4);

        assertSame(replacement, LeafTraversal.replaceLeaf(new NumberLeaf(3), 0, replacement));
    }

    @Test
    void rejectsOutOfRangeIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> LeafTraversal.leafAt(TREE, 5));
        assertThrows(IndexOutOfBoundsException.class,
                () -> LeafTraversal.replaceLeaf(TREE, -1, new NumberLeaf(1)));
    }
}
