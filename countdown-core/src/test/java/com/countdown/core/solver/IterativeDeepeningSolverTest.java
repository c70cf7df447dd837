package com.countdown.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.countdown.core.CountdownGame;
import com.countdown.core.expr.Node;
import com.countdown.core.expr.NumberLeaf;
import com.countdown.core.solver.SolveConstraints.LeafExpansion;
import com.countdown.core.solver.SolveConstraints.SearchMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IterativeDeepeningSolverTest {

    private static final List<Integer> ONE_TO_SIX = List.of(1, 2, 3, 4, 5, 6);
    private static final List<Integer> ALL_ONES = List.of(1, 1, 1, 1, 1, 1);

    @Test
    void returnsMatchingNumberWithoutCombining() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ONE_TO_SIX, 6, SolveConstraints.defaults());

        assertEquals(SolveResult.Outcome.SOLVED, result.outcome());
        assertEquals(Optional.of(new NumberLeaf(6)), result.expression());
        assertEquals(0, result.distance());
    }

    @Test
    void findsTwoNumberSolutionBreadthFirst() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ONE_TO_SIX, 11, SolveConstraints.defaults());

        assertTrue(result.isExact());
        Node expression = result.expression().orElseThrow();
        assertEquals(11, expression.evaluate().orElseThrow());
        assertEquals(2, expression.leafCount());
    }

    @Test
    void findsChainSolutionDepthFirst() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        CountdownGame game = new CountdownGame(List.of(1, 10, 25, 50, 4, 4), 350);

        SolveResult result = solver.solve(game, SolveConstraints.defaults()
                .withMode(SearchMode.DEPTH_FIRST)
                .withLeafExpansion(LeafExpansion.FIRST_LEAF));

        assertTrue(result.isExact());
        assertEquals(350, result.expression().orElseThrow().evaluate().orElseThrow());
    }

    @Test
    void findsSolutionDepthFirst() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ONE_TO_SIX, 11, SolveConstraints.defaults().withMode(SearchMode.DEPTH_FIRST));

        assertTrue(result.isExact());
        assertEquals(11, result.expression().orElseThrow().evaluate().orElseThrow());
    }

    @Test
    void breadthFirstUsesFewestNumbers() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        CountdownGame game = new CountdownGame(List.of(1, 10, 25, 50, 4, 4), 350);

        for (LeafExpansion leafExpansion : LeafExpansion.values()) {
            SolveResult result = solver.solve(game, SolveConstraints.defaults().withLeafExpansion(leafExpansion));

            assertTrue(result.isExact(), "Expected an exact solution with " + leafExpansion);
            Node expression = result.expression().orElseThrow();
            assertEquals(350, expression.evaluate().orElseThrow());
            assertEquals(3, expression.leafCount(), "No pair of numbers reaches 350");
        }
    }

    @Test
    void solvesGameThroughModeShortcut() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        CountdownGame game = new CountdownGame(List.of(1, 10, 25, 50, 4, 4), 350);

        Optional<Node> expression = solver.solve(game, SearchMode.BREADTH_FIRST);

        assertEquals(350, expression.orElseThrow().evaluate().orElseThrow());
        assertTrue(solver.getLastVisitedStateCount() > 0);
        assertFalse(solver.wasLastSearchCutOff());
    }

    @Test
    void fallsBackToClosestWhenUnsolvable() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ALL_ONES, 999, SolveConstraints.defaults());

        assertEquals(SolveResult.Outcome.EXHAUSTED, result.outcome());
        Node expression = result.expression().orElseThrow();
        assertEquals(9, expression.evaluate().orElseThrow(), "(1 + 1 + 1) * (1 + 1 + 1) is the largest value");
        assertEquals(990, result.distance());
    }

    @Test
    void firstLeafPolicyOnlyReachesChains() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ALL_ONES, 999,
                SolveConstraints.defaults().withLeafExpansion(LeafExpansion.FIRST_LEAF));

        assertEquals(SolveResult.Outcome.EXHAUSTED, result.outcome());
        assertEquals(6, result.expression().orElseThrow().evaluate().orElseThrow());
        assertEquals(993, result.distance());
    }

    @Test
    void bestResultIsClosestOfEveryExaminedState() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        int[] closest = {Integer.MAX_VALUE};
        solver.setListener((state, evaluation) -> {
            if (evaluation.isValid()) {
                closest[0] = Math.min(closest[0], Math.abs(evaluation.orElseThrow() - 999));
            }
        });

        SolveResult result = solver.solve(ALL_ONES, 999, SolveConstraints.defaults().withMode(SearchMode.DEPTH_FIRST));

        assertEquals(SolveResult.Outcome.EXHAUSTED, result.outcome());
        assertEquals(closest[0], result.distance());
        assertEquals(990, result.distance());
    }

    @Test
    void expandsStatesThatFailToEvaluate() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        Set<String> examined = new HashSet<>();
        solver.setListener((state, evaluation) -> examined.add(state.canonicalKey()));

        solver.solve(List.of(2, 3, 5), 999, SolveConstraints.defaults());

        assertTrue(examined.contains("3 - 5"));
        assertTrue(examined.contains("3 * 2 - 5"), "Only reachable by grafting onto the failing 3 - 5");
    }

    @Test
    void depthFirstFollowsLastSeedInGenerationOrder() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        List<String> examined = new ArrayList<>();
        solver.setListener((state, evaluation) -> examined.add(state.canonicalKey()));

        SolveResult result = solver.solve(ONE_TO_SIX, 999,
                SolveConstraints.defaults().withMode(SearchMode.DEPTH_FIRST).withStateBudget(50));

        assertEquals(List.of("6", "6 + 1", "6 + 2 + 1"), examined.subList(0, 3));
        for (String seed : List.of("1", "2", "3", "4", "5")) {
            assertFalse(examined.contains(seed), "Seed " + seed + " waits until the subtree of 6 is done");
        }
        assertTrue(result.telemetry().peakQueueSize() < 300, "Queue holds one branch of siblings per depth");
    }

    @Test
    void breadthFirstExaminesEverySeedFirst() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        List<String> examined = new ArrayList<>();
        solver.setListener((state, evaluation) -> examined.add(state.canonicalKey()));
        SolveConstraints constraints = SolveConstraints.defaults().withStateBudget(50);

        SolveResult breadthFirst = solver.solve(ONE_TO_SIX, 999, constraints);
        SolveResult depthFirst = new IterativeDeepeningSolver().solve(ONE_TO_SIX, 999,
                constraints.withMode(SearchMode.DEPTH_FIRST));

        assertEquals(List.of("1", "2", "3", "4", "5", "6"), examined.subList(0, 6));
        assertEquals("1 + 2", examined.get(6));
        assertTrue(breadthFirst.telemetry().peakQueueSize() > depthFirst.telemetry().peakQueueSize());
    }

    @Test
    void overflowingProductIsNeverReportedAsMatch() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(List.of(65537, 65537), 131073, SolveConstraints.defaults());

        assertFalse(result.isExact());
        assertEquals(SolveResult.Outcome.EXHAUSTED, result.outcome());
        assertEquals("65537 + 65537", result.expression().orElseThrow().render());
        assertEquals(1, result.distance());
    }

    @Test
    void terminatesOnceQueueRunsDry() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
        List<Integer> numbers = List.of(1, 2, 3, 4);

        SolveResult result = solver.solve(numbers, 999, SolveConstraints.defaults());

        SearchTelemetry telemetry = result.telemetry();
        assertEquals(SolveResult.Outcome.EXHAUSTED, result.outcome());
        assertEquals(numbers.size() + telemetry.generatedStates(), telemetry.poppedStates(),
                "Every seed and successor is popped exactly once");
        assertTrue(telemetry.duplicateStates() > 0);
        assertTrue(telemetry.invalidStates() > 0);
        assertEquals(999 - 36, result.distance(), "(1 + 2) * 3 * 4 is the largest value");
    }

    @Test
    void stopsAtStateBudget() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ONE_TO_SIX, 999, SolveConstraints.defaults().withStateBudget(1));

        assertEquals(SolveResult.Outcome.CUT_OFF, result.outcome());
        assertEquals(1L, result.telemetry().poppedStates());
        assertEquals(Optional.of(new NumberLeaf(1)), result.expression());
        assertEquals(998, result.distance());
        assertTrue(solver.wasLastSearchCutOff());
    }

    @Test
    void reportsNoExpressionWhenDeadlinePassesFirst() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        SolveResult result = solver.solve(ONE_TO_SIX, 999, SolveConstraints.defaults().withTimeLimit(Duration.ofNanos(1)));

        assertEquals(SolveResult.Outcome.CUT_OFF, result.outcome());
        assertFalse(result.expression().isPresent());
        assertEquals(SolveResult.NO_DISTANCE, result.distance());
    }

    @Test
    void rejectsEmptyNumberList() {
        IterativeDeepeningSolver solver = new IterativeDeepeningSolver();

        assertThrows(IllegalArgumentException.class, () -> solver.solve(List.of(), 100, SolveConstraints.defaults()));
    }
}
