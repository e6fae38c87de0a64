package com.statespace.core.search;

import com.statespace.core.State;
import java.util.Optional;

/**
 * One-shot entry points for the four search strategies. Each call builds its own solver with
 * {@link SearchConfig#defaults()} and releases any worker pool before returning.
 */
public final class Solvers {

    private Solvers() {
    }

    public static Optional<State> bfsSequential(State root) {
        return run(Algorithm.BFS_SEQUENTIAL, root);
    }

    public static Optional<State> bfsParallel(State root) {
        return run(Algorithm.BFS_PARALLEL, root);
    }

    public static Optional<State> iddfsSequential(State root) {
        return run(Algorithm.IDDFS_SEQUENTIAL, root);
    }

    public static Optional<State> iddfsParallel(State root) {
        return run(Algorithm.IDDFS_PARALLEL, root);
    }

    private static Optional<State> run(Algorithm algorithm, State root) {
        Solver solver = algorithm.newSolver(SearchConfig.defaults());
        try {
            return solver.solve(root);
        } finally {
            solver.shutdown();
        }
    }
}
