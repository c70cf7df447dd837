package com.countdown.core.solver;

import com.countdown.core.CountdownGame;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves batches of randomly drawn games under one configuration and keeps running totals of how
 * many were solved exactly and how close the rest came.
 */
public final class RandomGameRunner {

    private static final Logger LOGGER = Logger.getLogger(RandomGameRunner.class.getName());

    private final Solver solver;
    private final SolveConstraints constraints;
    private final Random random;
    private final Integer largeNumbers;

    private int gamesPlayed;
    private int gamesSolved;
    private int gamesMeasured;
    private long cumulativeDistance;
    private long cumulativeStates;

    /**
     * @param largeNumbers fixed count of big numbers per game, or {@code null} to draw it per game
     */
    public RandomGameRunner(Solver solver, SolveConstraints constraints, Random random, Integer largeNumbers) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.random = Objects.requireNonNull(random, "random");
        if (largeNumbers != null && (largeNumbers < 0 || largeNumbers > CountdownGame.MAX_LARGE_NUMBERS)) {
            throw new IllegalArgumentException("largeNumbers must be between 0 and "
                    + CountdownGame.MAX_LARGE_NUMBERS + ": " + largeNumbers);
        }
        this.largeNumbers = largeNumbers;
    }

    public Summary playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        for (int i = 0; i < gameCount; i++) {
            playSingleGame();
        }
        return summary();
    }

    public Summary summary() {
        return new Summary(gamesPlayed, gamesSolved, gamesMeasured, cumulativeDistance, cumulativeStates);
    }

    private void playSingleGame() {
        CountdownGame game = largeNumbers == null
                ? CountdownGame.generate(random)
                : CountdownGame.generate(largeNumbers, random);
        SolveResult result = solver.solve(game, constraints);

        gamesPlayed++;
        if (result.isExact()) {
            gamesSolved++;
        }
        if (result.expression().isPresent()) {
            gamesMeasured++;
            cumulativeDistance += result.distance();
        }
        cumulativeStates += result.telemetry().poppedStates();

        final int gameNumber = gamesPlayed;
        final String expression = result.expression().map(Object::toString).orElse("-");
        LOGGER.info(() -> String.format("Game %d: %s -> %s (outcome=%s, distance=%d, states=%d)",
                gameNumber, game, expression, result.outcome(), result.distance(),
                result.telemetry().poppedStates()));
    }

    /**
     * Totals over every game played by one runner.
     *
     * @param gamesMeasured games that ended with an expression; only these contribute to
     *                      {@link #averageDistance()}
     */
    public record Summary(int gamesPlayed, int gamesSolved, int gamesMeasured, long cumulativeDistance,
            long cumulativeStates) {

        public double solvedRatio() {
            return gamesPlayed == 0 ? 0.0 : (double) gamesSolved / gamesPlayed;
        }

        public double averageDistance() {
            return gamesMeasured == 0 ? 0.0 : (double) cumulativeDistance / gamesMeasured;
        }
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            SolverOptions options = SolverOptions.parse(args, 1);
            if (!options.positional().isEmpty()) {
                throw new IllegalArgumentException("Unrecognised argument: " + options.positional().get(0));
            }
            IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
            RandomGameRunner runner = new RandomGameRunner(solver, options.constraints(), options.random(),
                    options.largeNumbers());
            Summary summary = runner.playGames(gameCount);
            System.out.printf("Solved %d of %d games (%.1f%%), average distance %.2f%n",
                    summary.gamesSolved(), summary.gamesPlayed(), summary.solvedRatio() * 100.0,
                    summary.averageDistance());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    private static void printUsage() {
        System.err.println("Usage: RandomGameRunner <gameCount> " + SolverOptions.USAGE);
    }
}
