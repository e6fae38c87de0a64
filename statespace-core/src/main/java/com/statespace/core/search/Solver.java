package com.statespace.core.search;

import com.statespace.core.State;
import java.util.Optional;

/**
 * Common interface of the state-space search strategies.
 *
 * <p>Implementations are re-entrant: every call allocates its own frontier, visited set and
 * best-goal bookkeeping, so a previous call never influences the next one.
 */
public interface Solver {

    /**
     * Searches the state space rooted at {@code root} for a goal state.
     *
     * @param root the state to start from
     * @return the search outcome; a missing goal is a normal result, not an error
     */
    SearchResult search(State root);

    /**
     * Convenience wrapper around {@link #search(State)} that only reports the goal.
     */
    default Optional<State> solve(State root) {
        return search(root).goal();
    }

    /**
     * Releases worker threads held by this solver. Sequential solvers hold none.
     */
    default void shutdown() {
    }
}
