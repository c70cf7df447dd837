package com.countdown.core.solver;

import com.countdown.core.expr.Evaluation;
import com.countdown.core.solver.state.SearchState;

/**
 * Call-back sink for search progress. Called on the solving thread; implementations should return
 * quickly.
 */
public interface SearchListener {

    SearchListener NONE = (state, evaluation) -> { };

    /**
     * Invoked once for every non-duplicate state the search examines.
     */
    void onStateExamined(SearchState state, Evaluation evaluation);
}
