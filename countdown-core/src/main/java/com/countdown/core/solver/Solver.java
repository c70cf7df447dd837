package com.countdown.core.solver;

import com.countdown.core.CountdownGame;
import java.util.List;
import java.util.Objects;

/**
 * Generic interface for Countdown numbers-round solvers.
 */
public interface Solver {

    /**
     * Searches for an expression over {@code numbers} that reaches {@code target}, or the closest
     * expression found before the search ends.
     *
     * @param numbers the numbers available, each usable at most once
     * @param target the value to reach
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SolveResult solve(List<Integer> numbers, int target, SolveConstraints constraints);

    default SolveResult solve(CountdownGame game, SolveConstraints constraints) {
        Objects.requireNonNull(game, "game");
        return solve(game.numbers(), game.target(), constraints);
    }
}
