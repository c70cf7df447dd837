package com.countdown.core.solver.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.countdown.core.expr.BinaryOp;
import com.countdown.core.expr.NumberLeaf;
import com.countdown.core.expr.Operator;
import com.countdown.core.solver.SolveConstraints;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StateExpanderTest {

    @Test
    void combinesLeafWithEveryPoolNumberAndOperator() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.FIRST_LEAF);
        SearchState seed = new SearchState(new NumberLeaf(5), RemainingPool.of(7, 3));

        List<SearchState> successors = expander.expand(seed);

        assertEquals(List.of(
                "5 + 3", "5 - 3", "3 - 5", "5 * 3", "5 / 3", "3 / 5",
                "5 + 7", "5 - 7", "7 - 5", "5 * 7", "5 / 7", "7 / 5"), keys(successors));
        assertEquals(RemainingPool.of(7), successors.get(0).remaining());
        assertEquals(RemainingPool.of(3), successors.get(6).remaining());
    }

    @Test
    void firstLeafPolicyOnlyGraftsOntoLeftmostLeaf() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.FIRST_LEAF);
        SearchState state = new SearchState(BinaryOp.of(Operator.MULTIPLY, 10, 25), RemainingPool.of(4));

        List<SearchState> successors = expander.expand(state);

        assertEquals(List.of(
                "(10 + 4) * 25", "(10 - 4) * 25", "(4 - 10) * 25", "10 * 4 * 25", "10 / 4 * 25", "4 / 10 * 25"),
                keys(successors));
        for (SearchState successor : successors) {
            assertTrue(successor.remaining().isEmpty());
        }
    }

    @Test
    void allLeavesPolicyGraftsOntoEveryLeaf() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.ALL_LEAVES);
        SearchState state = new SearchState(BinaryOp.of(Operator.MULTIPLY, 10, 25), RemainingPool.of(4, 6));

        List<SearchState> successors = expander.expand(state);

        assertEquals(2 * 2 * 6, successors.size());
        assertEquals("(10 + 4) * 25", successors.get(0).canonicalKey());
        assertEquals("10 * (25 + 4)", successors.get(12).canonicalKey());
        assertEquals("10 * (25 / 6)", successors.get(22).canonicalKey());
        assertEquals(RemainingPool.of(4), successors.get(22).remaining());
    }

    @Test
    void expansionLeavesParentUntouched() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.ALL_LEAVES);
        SearchState state = new SearchState(BinaryOp.of(Operator.ADD, 50, 75), RemainingPool.of(2));

        expander.expand(state);

        assertEquals("50 + 75", state.canonicalKey());
        assertEquals(RemainingPool.of(2), state.remaining());
    }

    @Test
    void expandsDesignatedLeafOnly() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.FIRST_LEAF);
        SearchState state = new SearchState(BinaryOp.of(Operator.ADD, 50, 75), RemainingPool.of(2));

        List<SearchState> successors = expander.expandLeaf(state, 1);

        assertEquals(List.of("50 + 75 + 2", "50 + (75 - 2)", "50 + (2 - 75)", "50 + 75 * 2", "50 + 75 / 2",
                "50 + 2 / 75"), keys(successors));
    }

    @Test
    void refusesToExpandExhaustedState() {
        StateExpander expander = new StateExpander(SolveConstraints.LeafExpansion.ALL_LEAVES);
        SearchState state = new SearchState(new NumberLeaf(9), RemainingPool.empty());

        assertThrows(IllegalStateException.class, () -> expander.expand(state));
    }

    private static List<String> keys(List<SearchState> states) {
        return states.stream().map(SearchState::canonicalKey).collect(Collectors.toList());
    }
}
