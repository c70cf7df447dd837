package com.countdown.core.expr;

/**
 * Reasons a candidate expression is not a legal Countdown calculation.
 */
public enum EvaluationError {
    DIVISION_BY_ZERO("Division by zero"),
    DIVISION_REMAINDER("Division leaves a remainder"),
    NON_POSITIVE_RESULT("Subtraction result is not positive"),
    OVERFLOW("Result does not fit in an int");

    private final String description;

    EvaluationError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
