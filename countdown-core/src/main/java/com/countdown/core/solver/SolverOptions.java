package com.countdown.core.solver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Command line options shared by the console drivers. Options use the {@code --name=value} form;
 * anything else is kept as a positional argument.
 *
 * <p>Without options the drivers search depth-first over every leaf for at most
 * {@link #DEFAULT_TIME_LIMIT}.
 *
 * @param constraints  search configuration built from the options
 * @param random       random source, seeded when {@code --seed} is given
 * @param largeNumbers requested count of big numbers for random games, or {@code null}
 * @param positional   arguments that are not options, in order
 */
public record SolverOptions(SolveConstraints constraints, Random random, Integer largeNumbers,
        List<String> positional) {

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(20);
    public static final SolveConstraints DEFAULT_CONSTRAINTS = SolveConstraints.defaults()
            .withMode(SolveConstraints.SearchMode.DEPTH_FIRST)
            .withTimeLimit(DEFAULT_TIME_LIMIT);

    public static final String USAGE = "[--mode=bfs|dfs] [--leaves=all|first] [--large=<0-4>] "
            + "[--budget=<states>] [--timeLimitMillis=<value>] [--seed=<value>]";

    public SolverOptions {
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(random, "random");
        positional = List.copyOf(positional);
    }

    /**
     * Parses {@code args} starting at index {@code from}.
     *
     * @throws IllegalArgumentException on an unknown option or an invalid value
     */
    public static SolverOptions parse(String[] args, int from) {
        Objects.requireNonNull(args, "args");
        SolveConstraints constraints = DEFAULT_CONSTRAINTS;
        Random random = null;
        Integer largeNumbers = null;
        List<String> positional = new ArrayList<>();

        for (int index = from; index < args.length; index++) {
            String arg = args[index].trim();
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            int separator = arg.indexOf('=');
            if (separator < 0) {
                throw new IllegalArgumentException("Option requires a value: " + arg);
            }
            String name = arg.substring(2, separator);
            String value = arg.substring(separator + 1).trim();
            switch (name) {
                case "mode" -> constraints = constraints.withMode(parseMode(value));
                case "leaves" -> constraints = constraints.withLeafExpansion(parseLeafExpansion(value));
                case "large" -> largeNumbers = Integer.parseInt(value);
                case "budget" -> constraints = constraints.withStateBudget(Long.parseLong(value));
                case "timeLimitMillis" -> {
                    long millis = Long.parseLong(value);
                    if (millis < 0L) {
                        throw new IllegalArgumentException("timeLimitMillis must be non-negative");
                    }
                    constraints = constraints.withTimeLimit(Duration.ofMillis(millis));
                }
                case "seed" -> random = new Random(Long.parseLong(value));
                default -> throw new IllegalArgumentException("Unrecognised option: " + arg);
            }
        }
        return new SolverOptions(constraints, random == null ? new Random() : random, largeNumbers, positional);
    }

    static SolveConstraints.SearchMode parseMode(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "bfs", "breadth_first", "breadth-first" -> SolveConstraints.SearchMode.BREADTH_FIRST;
            case "dfs", "depth_first", "depth-first" -> SolveConstraints.SearchMode.DEPTH_FIRST;
            default -> throw new IllegalArgumentException("Unknown search mode: " + value);
        };
    }

    static SolveConstraints.LeafExpansion parseLeafExpansion(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "all", "all_leaves" -> SolveConstraints.LeafExpansion.ALL_LEAVES;
            case "first", "first_leaf" -> SolveConstraints.LeafExpansion.FIRST_LEAF;
            default -> throw new IllegalArgumentException("Unknown leaf expansion: " + value);
        };
    }
}
