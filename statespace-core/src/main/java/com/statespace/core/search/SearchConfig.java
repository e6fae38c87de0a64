package com.statespace.core.search;

/**
 * Immutable tuning knobs shared by the {@link Solver} implementations.
 *
 * @param parallelism        worker count of the pool owned by a parallel solver
 * @param forkDepthThreshold depth (edges from the root) below which parallel IDDFS forks one task
 *                           per child; deeper nodes are explored sequentially inside their task
 * @param maxDepthLimit      the largest depth limit iterative deepening will try before giving up;
 *                           {@link Integer#MAX_VALUE} leaves the outer loop unbounded
 */
public record SearchConfig(int parallelism, int forkDepthThreshold, int maxDepthLimit) {

    public static final int DEFAULT_FORK_DEPTH_THRESHOLD = 8;
    public static final int UNBOUNDED_DEPTH = Integer.MAX_VALUE;

    public SearchConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (forkDepthThreshold < 0) {
            throw new IllegalArgumentException("forkDepthThreshold must not be negative");
        }
        if (maxDepthLimit < 1) {
            throw new IllegalArgumentException("maxDepthLimit must be at least 1");
        }
    }

    public static SearchConfig defaults() {
        return new SearchConfig(Runtime.getRuntime().availableProcessors(), DEFAULT_FORK_DEPTH_THRESHOLD,
                UNBOUNDED_DEPTH);
    }

    public SearchConfig withParallelism(int parallelism) {
        return new SearchConfig(parallelism, forkDepthThreshold, maxDepthLimit);
    }

    public SearchConfig withForkDepthThreshold(int forkDepthThreshold) {
        return new SearchConfig(parallelism, forkDepthThreshold, maxDepthLimit);
    }

    public SearchConfig withMaxDepthLimit(int maxDepthLimit) {
        return new SearchConfig(parallelism, forkDepthThreshold, maxDepthLimit);
    }

    public boolean isDepthBounded() {
        return maxDepthLimit != UNBOUNDED_DEPTH;
    }
}
