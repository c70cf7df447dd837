package com.countdown.core.solver.state;

import com.countdown.core.expr.Node;
import com.countdown.core.expr.NumberLeaf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One candidate expression together with the numbers still available to extend it. States are
 * never modified; expansion always derives new ones.
 */
public record SearchState(Node root, RemainingPool remaining) {

    public SearchState {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(remaining, "remaining");
    }

    /**
     * Builds the initial states of a search: one single-leaf state per number, each holding the
     * other numbers as its pool. Seeds keep the order of {@code numbers}.
     */
    public static List<SearchState> seeds(List<Integer> numbers) {
        Objects.requireNonNull(numbers, "numbers");
        List<SearchState> seeds = new ArrayList<>(numbers.size());
        for (int i = 0; i < numbers.size(); i++) {
            List<Integer> others = new ArrayList<>(numbers);
            int value = others.remove(i);
            seeds.add(new SearchState(new NumberLeaf(value), RemainingPool.of(others)));
        }
        return seeds;
    }

    /**
     * Returns the key used to recognise equivalent candidates.
     */
    public String canonicalKey() {
        return root.render();
    }

    public boolean canExpand() {
        return !remaining.isEmpty();
    }
}
