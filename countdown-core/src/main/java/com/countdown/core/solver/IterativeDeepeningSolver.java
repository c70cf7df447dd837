package com.countdown.core.solver;

import com.countdown.core.CountdownGame;
import com.countdown.core.expr.Evaluation;
import com.countdown.core.expr.Node;
import com.countdown.core.solver.state.SearchState;
import com.countdown.core.solver.state.StateExpander;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queue-driven search over partial expression trees.
 *
 * <p>The queue is seeded with one single-number state per input number. Each popped state is
 * evaluated, compared against the target and, while numbers remain in its pool, expanded into
 * successor states. In {@link SolveConstraints.SearchMode#BREADTH_FIRST} mode the queue is FIFO, so
 * expressions are examined in order of the number of numbers they use and the first exact match
 * uses as few numbers as the expansion policy allows. In
 * {@link SolveConstraints.SearchMode#DEPTH_FIRST} mode the queue is LIFO.
 *
 * <p>Every expansion removes one number from the pool, so the search always terminates; budgets
 * in {@link SolveConstraints} only shorten it.
 */
public final class IterativeDeepeningSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(IterativeDeepeningSolver.class.getName());

    private SearchListener listener = SearchListener.NONE;
    private SolveResult lastResult;

    public void setListener(SearchListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Solves {@code game} with every leaf expanded and no cutoff.
     *
     * @return the exact or closest expression
     */
    public Optional<Node> solve(CountdownGame game, SolveConstraints.SearchMode mode) {
        Objects.requireNonNull(mode, "mode");
        return solve(game, SolveConstraints.defaults().withMode(mode)).expression();
    }

    public SolveResult getLastResult() {
        return lastResult;
    }

    public long getLastVisitedStateCount() {
        return lastResult == null ? 0L : lastResult.telemetry().poppedStates();
    }

    public boolean wasLastSearchCutOff() {
        return lastResult != null && lastResult.outcome() == SolveResult.Outcome.CUT_OFF;
    }

    @Override
    public SolveResult solve(List<Integer> numbers, int target, SolveConstraints constraints) {
        Objects.requireNonNull(numbers, "numbers");
        Objects.requireNonNull(constraints, "constraints");
        if (numbers.isEmpty()) {
            throw new IllegalArgumentException("At least one number is required");
        }

        long searchStart = System.nanoTime();
        long deadline = toDeadline(searchStart, constraints.timeLimit());
        long stateBudget = constraints.stateBudget();
        boolean depthFirst = constraints.mode() == SolveConstraints.SearchMode.DEPTH_FIRST;
        StateExpander expander = new StateExpander(constraints.leafExpansion());

        Deque<SearchState> queue = new ArrayDeque<>(SearchState.seeds(numbers));
        Set<String> visited = new HashSet<>();

        Node best = null;
        int bestDistance = Integer.MAX_VALUE;
        SolveResult.Outcome outcome = SolveResult.Outcome.EXHAUSTED;

        long popped = 0L;
        long duplicates = 0L;
        long invalid = 0L;
        long expanded = 0L;
        long generated = 0L;
        int peakQueueSize = queue.size();

        while (!queue.isEmpty()) {
            if ((stateBudget != SolveConstraints.UNBOUNDED && popped >= stateBudget)
                    || (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline)) {
                outcome = SolveResult.Outcome.CUT_OFF;
                break;
            }

            SearchState state = depthFirst ? queue.pollLast() : queue.pollFirst();
            popped++;

            if (!visited.add(state.canonicalKey())) {
                duplicates++;
                continue;
            }

            Evaluation evaluation = state.root().evaluate();
            listener.onStateExamined(state, evaluation);
            if (evaluation.isValid()) {
                int distance = Math.abs(evaluation.orElseThrow() - target);
                if (distance == 0) {
                    best = state.root();
                    bestDistance = 0;
                    outcome = SolveResult.Outcome.SOLVED;
                    break;
                }
                if (distance < bestDistance) {
                    best = state.root();
                    bestDistance = distance;
                }
            } else {
                invalid++;
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Rejected " + state.canonicalKey() + ": " + evaluation);
                }
            }

            // A failing subtree can still be repaired by grafting onto one of its own leaves.
            if (state.canExpand()) {
                List<SearchState> successors = expander.expand(state);
                expanded++;
                generated += successors.size();
                if (depthFirst) {
                    for (int i = successors.size() - 1; i >= 0; i--) {
                        queue.addLast(successors.get(i));
                    }
                } else {
                    queue.addAll(successors);
                }
                peakQueueSize = Math.max(peakQueueSize, queue.size());
            }
        }

        SearchTelemetry telemetry = new SearchTelemetry(popped, duplicates, invalid, expanded, generated,
                peakQueueSize, System.nanoTime() - searchStart);
        SolveResult result = best == null
                ? new SolveResult(null, SolveResult.NO_DISTANCE, outcome, telemetry)
                : new SolveResult(best, bestDistance, outcome, telemetry);

        final SolveResult summary = result;
        LOGGER.info(() -> String.format("Solver popped %d states (mode=%s, leaves=%s, outcome=%s, distance=%d)",
                summary.telemetry().poppedStates(), constraints.mode(), constraints.leafExpansion(),
                summary.outcome(), summary.distance()));

        lastResult = result;
        return result;
    }

    private static long toDeadline(long start, Duration timeLimit) {
        if (timeLimit.isZero()) {
            return Long.MAX_VALUE;
        }
        long nanos = Math.max(1L, timeLimit.toNanos());
        return saturatingAdd(start, nanos);
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
