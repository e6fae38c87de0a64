package com.statespace.core.bench;

import com.statespace.core.search.Algorithm;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of timing one algorithm on one problem.
 *
 * @param algorithm      the algorithm that ran
 * @param elapsed        wall time of the solve call
 * @param found          whether a goal was found
 * @param solutionDepth  edge count from the root to the goal, {@code -1} without a goal
 * @param expandedStates states expanded over the whole solve
 * @param generatedStates children produced over the whole solve, duplicates included
 * @param maxActiveTasks  peak number of concurrently running tasks, 1 for sequential solvers
 */
public record BenchmarkResult(Algorithm algorithm, Duration elapsed, boolean found, int solutionDepth,
        long expandedStates, long generatedStates, long maxActiveTasks) {

    public BenchmarkResult {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
}
