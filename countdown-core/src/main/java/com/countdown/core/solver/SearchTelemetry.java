package com.countdown.core.solver;

/**
 * Instrumentation data captured during a single {@link Solver#solve} call.
 *
 * @param poppedStates    states taken off the queue
 * @param duplicateStates popped states skipped because an equivalent one was already examined
 * @param invalidStates   examined states whose expression broke an arithmetic rule
 * @param expandedStates  states handed to the expander
 * @param generatedStates successor states pushed onto the queue
 * @param peakQueueSize   largest queue length observed
 * @param elapsedNanos    wall-clock duration of the search
 */
public record SearchTelemetry(
        long poppedStates,
        long duplicateStates,
        long invalidStates,
        long expandedStates,
        long generatedStates,
        int peakQueueSize,
        long elapsedNanos) {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L, 0L, 0, 0L);

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    /**
     * Popped states that were not duplicates.
     */
    public long examinedStates() {
        return poppedStates - duplicateStates;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
