package com.countdown.core.solver;

import com.countdown.core.expr.Node;
import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Solver} implementations.
 *
 * @param bestExpression the exact or closest expression found, or {@code null} if no candidate
 *                       evaluated successfully
 * @param distance       absolute difference between the expression's value and the target, or
 *                       {@link #NO_DISTANCE} without an expression
 * @param outcome        how the search ended
 * @param telemetry      counters collected during the search
 */
public record SolveResult(Node bestExpression, int distance, Outcome outcome, SearchTelemetry telemetry) {

    public static final int NO_DISTANCE = -1;

    public SolveResult {
        Objects.requireNonNull(outcome, "outcome");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        if (bestExpression == null) {
            if (distance != NO_DISTANCE) {
                throw new IllegalArgumentException("distance requires an expression");
            }
            if (outcome == Outcome.SOLVED) {
                throw new IllegalArgumentException("a solved result requires an expression");
            }
        } else if (distance < 0) {
            throw new IllegalArgumentException("distance must not be negative");
        } else if ((outcome == Outcome.SOLVED) != (distance == 0)) {
            throw new IllegalArgumentException("SOLVED must coincide with a zero distance");
        }
    }

    public Optional<Node> expression() {
        return Optional.ofNullable(bestExpression);
    }

    public boolean isExact() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * How a search ended.
     */
    public enum Outcome {
        /** An expression equal to the target was found. */
        SOLVED,
        /** The queue ran dry; the result is the closest expression in the whole search space. */
        EXHAUSTED,
        /** A state budget or time limit stopped the search; the result is the closest seen so far. */
        CUT_OFF
    }
}
