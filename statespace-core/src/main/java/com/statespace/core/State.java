package com.statespace.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a search problem. Every domain implements this contract independently;
 * the solvers only ever talk to a state through it.
 *
 * <p>Implementations must guarantee that two semantically identical states report the same
 * {@link #identifier()} and that distinct reachable states never collide. The solvers rely on the
 * identifier for duplicate suppression and for breaking ties between goals, and they do not verify
 * this property.
 */
public interface State {

    /**
     * Returns the successor states in a deterministic order. The list may be empty and never
     * contains this state itself.
     */
    List<State> children();

    /**
     * Returns {@code true} if this state satisfies the goal predicate of its problem.
     */
    boolean isGoal();

    /**
     * Returns the deterministic 64-bit encoding of this state's content.
     */
    long identifier();

    /**
     * Returns the state this one was expanded from, or empty for a root state.
     */
    Optional<State> predecessor();

    /**
     * Returns the number of edges between the root and this state.
     */
    default int depth() {
        int depth = 0;
        Optional<State> current = predecessor();
        while (current.isPresent()) {
            depth++;
            current = current.get().predecessor();
        }
        return depth;
    }

    /**
     * Rebuilds the path from the root to this state, both ends included.
     */
    default List<State> pathFromRoot() {
        List<State> path = new ArrayList<>();
        State current = this;
        while (current != null) {
            path.add(current);
            current = current.predecessor().orElse(null);
        }
        Collections.reverse(path);
        return path;
    }
}
