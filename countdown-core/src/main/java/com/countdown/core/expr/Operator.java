package com.countdown.core.expr;

/**
 * The four arithmetic operators allowed in a Countdown expression.
 */
public enum Operator {
    ADD("+", true, 1),
    SUBTRACT("-", false, 1),
    MULTIPLY("*", true, 2),
    DIVIDE("/", false, 2);

    private final String symbol;
    private final boolean commutative;
    private final int precedence;

    Operator(String symbol, boolean commutative, int precedence) {
        this.symbol = symbol;
        this.commutative = commutative;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns {@code true} if swapping the operands never changes the result.
     */
    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Rendering rank; multiplication and division bind tighter than addition and subtraction.
     */
    public int precedence() {
        return precedence;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
