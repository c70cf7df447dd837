package com.countdown.core.solver.state;

import com.countdown.core.expr.BinaryOp;
import com.countdown.core.expr.LeafTraversal;
import com.countdown.core.expr.Node;
import com.countdown.core.expr.NumberLeaf;
import com.countdown.core.expr.Operator;
import com.countdown.core.solver.SolveConstraints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Generates successor states by grafting an operator node onto one leaf of the current tree,
 * combining that leaf with one number taken from the pool.
 */
public final class StateExpander {

    private static final Operator[] OPERATORS = Operator.values();
    private static final int OPERAND_ORDERINGS = OPERATORS.length
            + (int) Arrays.stream(OPERATORS).filter(op -> !op.isCommutative()).count();

    private final SolveConstraints.LeafExpansion leafExpansion;

    public StateExpander(SolveConstraints.LeafExpansion leafExpansion) {
        this.leafExpansion = Objects.requireNonNull(leafExpansion, "leafExpansion");
    }

    public SolveConstraints.LeafExpansion leafExpansion() {
        return leafExpansion;
    }

    /**
     * Expands every leaf position selected by the configured {@link SolveConstraints.LeafExpansion}.
     * Successors are returned leaf by leaf, then pool number by pool number, then operator by
     * operator.
     *
     * @throws IllegalStateException if the state has no numbers left
     */
    public List<SearchState> expand(SearchState state) {
        Objects.requireNonNull(state, "state");
        if (!state.canExpand()) {
            throw new IllegalStateException("Cannot expand a state with an empty pool: " + state.canonicalKey());
        }
        int positions = switch (leafExpansion) {
            case FIRST_LEAF -> 1;
            case ALL_LEAVES -> state.root().leafCount();
        };
        List<SearchState> successors = new ArrayList<>(
                positions * state.remaining().size() * OPERAND_ORDERINGS);
        for (int leafIndex = 0; leafIndex < positions; leafIndex++) {
            expandLeaf(state, leafIndex, successors);
        }
        return successors;
    }

    /**
     * Expands a single leaf position, regardless of the configured policy.
     */
    public List<SearchState> expandLeaf(SearchState state, int leafIndex) {
        Objects.requireNonNull(state, "state");
        if (!state.canExpand()) {
            throw new IllegalStateException("Cannot expand a state with an empty pool: " + state.canonicalKey());
        }
        List<SearchState> successors = new ArrayList<>(state.remaining().size() * OPERAND_ORDERINGS);
        expandLeaf(state, leafIndex, successors);
        return successors;
    }

    private void expandLeaf(SearchState state, int leafIndex, List<SearchState> successors) {
        Node root = state.root();
        RemainingPool pool = state.remaining();
        int leafValue = LeafTraversal.leafAt(root, leafIndex).value();

        for (int poolIndex = 0; poolIndex < pool.size(); poolIndex++) {
            int number = pool.get(poolIndex);
            RemainingPool nextPool = pool.without(poolIndex);
            for (Operator operator : OPERATORS) {
                successors.add(graft(root, leafIndex, new BinaryOp(operator,
                        new NumberLeaf(leafValue), new NumberLeaf(number)), nextPool));
                if (!operator.isCommutative()) {
                    successors.add(graft(root, leafIndex, new BinaryOp(operator,
                            new NumberLeaf(number), new NumberLeaf(leafValue)), nextPool));
                }
            }
        }
    }

    private static SearchState graft(Node root, int leafIndex, BinaryOp replacement, RemainingPool nextPool) {
        return new SearchState(LeafTraversal.replaceLeaf(root, leafIndex, replacement), nextPool);
    }
}
