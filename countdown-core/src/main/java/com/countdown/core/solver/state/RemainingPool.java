package com.countdown.core.solver.state;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable, ascending multiset of the numbers a search state has not used yet.
 */
public final class RemainingPool {

    private static final RemainingPool EMPTY = new RemainingPool(new int[0]);

    private final int[] values;

    private RemainingPool(int[] sortedValues) {
        this.values = sortedValues;
    }

    public static RemainingPool empty() {
        return EMPTY;
    }

    public static RemainingPool of(Collection<Integer> numbers) {
        Objects.requireNonNull(numbers, "numbers");
        int[] values = numbers.stream().mapToInt(number -> Objects.requireNonNull(number, "number")).toArray();
        return of(values);
    }

    public static RemainingPool of(int... numbers) {
        Objects.requireNonNull(numbers, "numbers");
        if (numbers.length == 0) {
            return EMPTY;
        }
        int[] sorted = numbers.clone();
        Arrays.sort(sorted);
        return new RemainingPool(sorted);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public int get(int index) {
        return values[index];
    }

    /**
     * Returns a pool holding every number except the one at {@code index}.
     */
    public RemainingPool without(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("Pool index " + index + " out of range for size " + values.length);
        }
        if (values.length == 1) {
            return EMPTY;
        }
        int[] next = new int[values.length - 1];
        System.arraycopy(values, 0, next, 0, index);
        System.arraycopy(values, index + 1, next, index, values.length - index - 1);
        return new RemainingPool(next);
    }

    public List<Integer> toList() {
        return Arrays.stream(values).boxed().collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof RemainingPool other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
