package com.countdown.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Immutable Countdown numbers round: six numbers and a three-digit target.
 * Big numbers (25, 50, 75, 100) may appear once, small numbers (1-10) at most twice.
 */
public final class CountdownGame {

    public static final int NUMBER_COUNT = 6;
    public static final int MIN_TARGET = 100;
    public static final int MAX_TARGET = 999;
    public static final int MAX_LARGE_NUMBERS = 4;
    public static final List<Integer> BIG_NUMBERS = List.of(25, 50, 75, 100);
    public static final int MAX_SMALL_NUMBER = 10;

    private static final int SMALL_NUMBER_COPIES = 2;

    private final List<Integer> numbers;
    private final int target;

    /**
     * Creates a validated game.
     *
     * @throws IllegalArgumentException if the numbers or the target break the game rules
     */
    public CountdownGame(List<Integer> numbers, int target) {
        Objects.requireNonNull(numbers, "numbers");
        if (target < MIN_TARGET || target > MAX_TARGET) {
            throw new IllegalArgumentException("Target must be between " + MIN_TARGET + " and " + MAX_TARGET
                    + " inclusive: " + target);
        }
        if (numbers.size() != NUMBER_COUNT) {
            throw new IllegalArgumentException("Exactly " + NUMBER_COUNT + " numbers are required, got "
                    + numbers.size());
        }
        List<Integer> sorted = new ArrayList<>(numbers);
        Collections.sort(sorted);
        int[] frequencies = new int[MAX_SMALL_NUMBER + 1];
        boolean[] bigSeen = new boolean[BIG_NUMBERS.size()];
        for (Integer number : sorted) {
            Objects.requireNonNull(number, "number");
            int bigIndex = BIG_NUMBERS.indexOf(number);
            if (bigIndex >= 0) {
                if (bigSeen[bigIndex]) {
                    throw new IllegalArgumentException("Big numbers can be used at most once: " + number);
                }
                bigSeen[bigIndex] = true;
            } else if (number >= 1 && number <= MAX_SMALL_NUMBER) {
                if (frequencies[number] == SMALL_NUMBER_COPIES) {
                    throw new IllegalArgumentException("Small numbers can be used at most twice: " + number);
                }
                frequencies[number]++;
            } else {
                throw new IllegalArgumentException("Number " + number + " is not a valid Countdown number");
            }
        }
        this.numbers = List.copyOf(sorted);
        this.target = target;
    }

    /**
     * Draws a random game with a random number of big numbers.
     */
    public static CountdownGame generate(Random random) {
        Objects.requireNonNull(random, "random");
        return generate(random.nextInt(MAX_LARGE_NUMBERS + 1), random);
    }

    /**
     * Draws a random game with exactly {@code largeNumbers} big numbers. The card decks are built and
     * shuffled per call from the supplied random source.
     */
    public static CountdownGame generate(int largeNumbers, Random random) {
        Objects.requireNonNull(random, "random");
        if (largeNumbers < 0 || largeNumbers > MAX_LARGE_NUMBERS) {
            throw new IllegalArgumentException("The number of large numbers must be between 0 and "
                    + MAX_LARGE_NUMBERS + " inclusive: " + largeNumbers);
        }
        List<Integer> small = new ArrayList<>();
        for (int value = 1; value <= MAX_SMALL_NUMBER; value++) {
            for (int copy = 0; copy < SMALL_NUMBER_COPIES; copy++) {
                small.add(value);
            }
        }
        List<Integer> big = new ArrayList<>(BIG_NUMBERS);
        Collections.shuffle(small, random);
        Collections.shuffle(big, random);

        int target = MIN_TARGET + random.nextInt(MAX_TARGET - MIN_TARGET + 1);
        List<Integer> numbers = new ArrayList<>(NUMBER_COUNT);
        numbers.addAll(small.subList(0, NUMBER_COUNT - largeNumbers));
        numbers.addAll(big.subList(0, largeNumbers));
        return new CountdownGame(numbers, target);
    }

    /**
     * Returns the numbers in ascending order.
     */
    public List<Integer> numbers() {
        return numbers;
    }

    public int target() {
        return target;
    }

    /**
     * Returns how many of the numbers are big numbers.
     */
    public int largeNumberCount() {
        return (int) numbers.stream().filter(BIG_NUMBERS::contains).count();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CountdownGame other)) {
            return false;
        }
        return target == other.target && numbers.equals(other.numbers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numbers, target);
    }

    @Override
    public String toString() {
        String joined = numbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return "Numbers: " + joined + ", Target: " + target;
    }
}
