package com.countdown.core.expr;

/**
 * Terminal node holding one of the game numbers.
 */
public record NumberLeaf(int value) implements Node {

    @Override
    public Node deepCopy() {
        return new NumberLeaf(value);
    }

    @Override
    public int leafCount() {
        return 1;
    }

    @Override
    public String toString() {
        return render();
    }
}
