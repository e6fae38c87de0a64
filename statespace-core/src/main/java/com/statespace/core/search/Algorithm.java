package com.statespace.core.search;

import com.statespace.core.search.parallel.ForkJoinIddfsSolver;
import com.statespace.core.search.parallel.LevelSynchronousBfsSolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The four search strategies, each with the bit it occupies in an algorithm selection mask.
 */
public enum Algorithm {
    BFS_SEQUENTIAL("BFS (Sequential)", 1, false),
    BFS_PARALLEL("BFS (Parallel)", 2, true),
    IDDFS_SEQUENTIAL("IDDFS (Sequential)", 4, false),
    IDDFS_PARALLEL("IDDFS (Parallel)", 8, true);

    public static final int ALL_MASK = 1 | 2 | 4 | 8;

    private final String displayName;
    private final int maskBit;
    private final boolean parallel;

    Algorithm(String displayName, int maskBit, boolean parallel) {
        this.displayName = displayName;
        this.maskBit = maskBit;
        this.parallel = parallel;
    }

    public String displayName() {
        return displayName;
    }

    public int maskBit() {
        return maskBit;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isBreadthFirst() {
        return this == BFS_SEQUENTIAL || this == BFS_PARALLEL;
    }

    /**
     * Creates a fresh solver for this algorithm. Parallel solvers own a worker pool that the caller
     * must release through {@link Solver#shutdown()}.
     */
    public Solver newSolver(SearchConfig config) {
        Objects.requireNonNull(config, "config");
        switch (this) {
            case BFS_SEQUENTIAL:
                return new BreadthFirstSolver();
            case BFS_PARALLEL:
                return new LevelSynchronousBfsSolver(config);
            case IDDFS_SEQUENTIAL:
                return new IterativeDeepeningSolver(config);
            case IDDFS_PARALLEL:
                return new ForkJoinIddfsSolver(config);
            default:
                throw new IllegalStateException("Unhandled algorithm " + this);
        }
    }

    /**
     * Returns the algorithms selected by {@code mask}, in declaration order.
     */
    public static List<Algorithm> fromMask(int mask) {
        if ((mask & ~ALL_MASK) != 0) {
            throw new IllegalArgumentException("Unknown algorithm bits in mask: " + mask);
        }
        List<Algorithm> selected = new ArrayList<>();
        for (Algorithm algorithm : values()) {
            if ((mask & algorithm.maskBit) != 0) {
                selected.add(algorithm);
            }
        }
        return Collections.unmodifiableList(selected);
    }
}
