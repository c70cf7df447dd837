package com.countdown.core.solver;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Solver} implementations.
 *
 * @param mode          queue discipline
 * @param leafExpansion which leaf positions are grafted onto when a state is expanded
 * @param stateBudget   maximum number of states taken off the queue, {@code 0} for no limit
 * @param timeLimit     wall-clock limit, {@link Duration#ZERO} for no limit
 */
public record SolveConstraints(SearchMode mode, LeafExpansion leafExpansion, long stateBudget, Duration timeLimit) {

    public static final long UNBOUNDED = 0L;

    private static final SolveConstraints DEFAULTS = new SolveConstraints(SearchMode.BREADTH_FIRST,
            LeafExpansion.ALL_LEAVES, UNBOUNDED, Duration.ZERO);

    public SolveConstraints {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(leafExpansion, "leafExpansion");
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (stateBudget < 0L) {
            throw new IllegalArgumentException("stateBudget must not be negative");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    /**
     * Breadth-first, every leaf expanded, no cutoff.
     */
    public static SolveConstraints defaults() {
        return DEFAULTS;
    }

    public SolveConstraints withMode(SearchMode mode) {
        return new SolveConstraints(mode, leafExpansion, stateBudget, timeLimit);
    }

    public SolveConstraints withLeafExpansion(LeafExpansion leafExpansion) {
        return new SolveConstraints(mode, leafExpansion, stateBudget, timeLimit);
    }

    public SolveConstraints withStateBudget(long stateBudget) {
        return new SolveConstraints(mode, leafExpansion, stateBudget, timeLimit);
    }

    public SolveConstraints withTimeLimit(Duration timeLimit) {
        return new SolveConstraints(mode, leafExpansion, stateBudget, timeLimit);
    }

    public boolean isBounded() {
        return stateBudget != UNBOUNDED || !timeLimit.isZero();
    }

    /**
     * Queue discipline used by the search loop.
     */
    public enum SearchMode {
        /** FIFO: every candidate with k numbers is examined before any with k + 1. */
        BREADTH_FIRST,
        /** LIFO: follows one line of successors down to the last number before backtracking. */
        DEPTH_FIRST
    }

    /**
     * Leaf positions considered when grafting a new operator onto a tree.
     */
    public enum LeafExpansion {
        /** Only the leftmost leaf; successor trees stay left-deep chains. */
        FIRST_LEAF,
        /** Every leaf, so any tree shape over the numbers can be produced. */
        ALL_LEAVES
    }
}
