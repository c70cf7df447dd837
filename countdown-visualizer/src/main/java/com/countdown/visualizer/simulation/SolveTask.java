package com.countdown.visualizer.simulation;

import com.countdown.core.CountdownGame;
import com.countdown.core.expr.Evaluation;
import com.countdown.core.solver.IterativeDeepeningSolver;
import com.countdown.core.solver.SearchListener;
import com.countdown.core.solver.SearchTelemetry;
import com.countdown.core.solver.SolveConstraints;
import com.countdown.core.solver.SolveResult;
import com.countdown.core.solver.state.SearchState;
import com.countdown.visualizer.model.SolveFrame;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that solves one game and publishes a {@link SolveFrame} each time the search finds
 * an expression closer to the target.
 */
public final class SolveTask extends Task<SolveResult> {

    private static final long MESSAGE_INTERVAL = 50_000L;

    private final IterativeDeepeningSolver solver;
    private final CountdownGame game;
    private final SolveConstraints constraints;
    private final Consumer<SolveFrame> frameListener;

    private long examined;
    private int bestDistance = Integer.MAX_VALUE;

    public SolveTask(IterativeDeepeningSolver solver, CountdownGame game, SolveConstraints constraints,
            Consumer<SolveFrame> frameListener) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.game = Objects.requireNonNull(game, "game");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    @Override
    protected SolveResult call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Search must not run on the JavaFX application thread");
        }

        updateMessage("Searching...");
        updateProgress(-1, 1);
        solver.setListener(this::onStateExamined);
        try {
            SolveResult result = solver.solve(game, constraints);
            updateProgress(1, 1);
            updateMessage(switch (result.outcome()) {
                case SOLVED -> "Solved";
                case EXHAUSTED -> String.format("Closest: %d away", result.distance());
                case CUT_OFF -> "Stopped at limit";
            });
            return result;
        } finally {
            solver.setListener(SearchListener.NONE);
        }
    }

    private void onStateExamined(SearchState state, Evaluation evaluation) {
        if (isCancelled()) {
            throw new CancellationException("Search cancelled");
        }
        examined++;
        if (examined % MESSAGE_INTERVAL == 0) {
            updateMessage(String.format("Examined %,d states", examined));
        }
        if (!evaluation.isValid()) {
            return;
        }
        int distance = Math.abs(evaluation.orElseThrow() - game.target());
        if (distance < bestDistance) {
            bestDistance = distance;
            SolveFrame frame = new SolveFrame(game, state.root(), distance, examined, null,
                    SearchTelemetry.empty());
            Platform.runLater(() -> frameListener.accept(frame));
        }
    }
}
