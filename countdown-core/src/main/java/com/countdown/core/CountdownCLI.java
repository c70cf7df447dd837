package com.countdown.core;

import com.countdown.core.expr.Node;
import com.countdown.core.solver.IterativeDeepeningSolver;
import com.countdown.core.solver.SolveResult;
import com.countdown.core.solver.SolverOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end: solves the given game, or a random one when no numbers are supplied.
 */
public final class CountdownCLI {

    private static final Logger LOGGER = Logger.getLogger(CountdownCLI.class.getName());

    private CountdownCLI() {
    }

    public static void main(String[] args) {
        try {
            SolverOptions options = SolverOptions.parse(args, 0);
            CountdownGame game = createGame(options);
            System.out.println(game);

            IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
            SolveResult result = solver.solve(game, options.constraints());
            printResult(result);
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    static CountdownGame createGame(SolverOptions options) {
        List<String> positional = options.positional();
        if (positional.isEmpty()) {
            Integer large = options.largeNumbers();
            return large == null
                    ? CountdownGame.generate(options.random())
                    : CountdownGame.generate(large, options.random());
        }
        if (positional.size() != CountdownGame.NUMBER_COUNT + 1) {
            throw new IllegalArgumentException("Expected " + CountdownGame.NUMBER_COUNT
                    + " numbers followed by a target, got " + positional.size() + " values");
        }
        List<Integer> numbers = new ArrayList<>(CountdownGame.NUMBER_COUNT);
        for (int i = 0; i < CountdownGame.NUMBER_COUNT; i++) {
            numbers.add(Integer.parseInt(positional.get(i)));
        }
        int target = Integer.parseInt(positional.get(CountdownGame.NUMBER_COUNT));
        return new CountdownGame(numbers, target);
    }

    private static void printResult(SolveResult result) {
        if (result.expression().isEmpty()) {
            System.out.println("No valid expression found.");
            return;
        }
        Node expression = result.expression().get();
        System.out.printf("%s = %d%n", expression.render(), expression.evaluate().orElseThrow());
        switch (result.outcome()) {
            case SOLVED -> System.out.println("Exact solution.");
            case EXHAUSTED -> System.out.printf("No exact solution, %d away.%n", result.distance());
            case CUT_OFF -> System.out.printf("Search stopped early, best is %d away.%n", result.distance());
        }
        System.out.printf("Examined %d states in %.1f ms%n", result.telemetry().examinedStates(),
                result.telemetry().elapsedMillis());
    }

    private static void printUsage() {
        System.err.println("Usage: CountdownCLI [n1 n2 n3 n4 n5 n6 target] " + SolverOptions.USAGE);
    }
}
