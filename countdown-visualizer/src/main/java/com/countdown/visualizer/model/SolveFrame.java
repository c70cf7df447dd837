package com.countdown.visualizer.model;

import com.countdown.core.CountdownGame;
import com.countdown.core.expr.Node;
import com.countdown.core.solver.SearchTelemetry;
import com.countdown.core.solver.SolveResult;
import java.util.Objects;

/**
 * Snapshot of the best expression known at one point of a search.
 *
 * @param game        the game being solved
 * @param expression  best expression so far, or {@code null} before one evaluated successfully
 * @param distance    distance of {@code expression} from the target, or {@link SolveResult#NO_DISTANCE}
 * @param examined    number of states examined when the snapshot was taken
 * @param outcome     how the search ended, or {@code null} while it is still running
 * @param telemetry   search counters, empty while the search is still running
 */
public record SolveFrame(
        CountdownGame game,
        Node expression,
        int distance,
        long examined,
        SolveResult.Outcome outcome,
        SearchTelemetry telemetry) {

    public SolveFrame {
        Objects.requireNonNull(game, "game");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public static SolveFrame initial(CountdownGame game) {
        return new SolveFrame(game, null, SolveResult.NO_DISTANCE, 0L, null, SearchTelemetry.empty());
    }

    public static SolveFrame finished(CountdownGame game, SolveResult result) {
        Objects.requireNonNull(result, "result");
        return new SolveFrame(game, result.bestExpression(), result.distance(),
                result.telemetry().examinedStates(), result.outcome(), result.telemetry());
    }

    public boolean hasExpression() {
        return expression != null;
    }

    public boolean isFinal() {
        return outcome != null;
    }
}
