package com.countdown.core.expr;

import java.util.Objects;

/**
 * Outcome of evaluating an expression tree: either a value or the first arithmetic rule the tree
 * breaks. Failures are ordinary values so the search loop never unwinds the stack for them.
 */
public sealed interface Evaluation permits Evaluation.Value, Evaluation.Failure {

    boolean isValid();

    /**
     * Returns the computed value.
     *
     * @throws ArithmeticException if the evaluation failed
     */
    int orElseThrow();

    static Evaluation of(int value) {
        return new Value(value);
    }

    static Evaluation failure(EvaluationError error, Operator operator) {
        return new Failure(error, operator);
    }

    record Value(int value) implements Evaluation {

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public int orElseThrow() {
            return value;
        }
    }

    /**
     * @param error    the broken rule
     * @param operator the operator whose application broke it
     */
    record Failure(EvaluationError error, Operator operator) implements Evaluation {

        public Failure {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(operator, "operator");
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public int orElseThrow() {
            throw new ArithmeticException(error.description() + " (" + operator.symbol() + ")");
        }
    }
}
