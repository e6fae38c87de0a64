package com.statespace.core.search;

import com.statespace.core.State;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sequential iterative-deepening depth-first search.
 *
 * <p>Each pass runs a depth-limited traversal from the root, starting with a limit of 1 and growing
 * by one per pass. Revisits are excluded only along the current root-to-node path. A pass always
 * completes its whole limited traversal and keeps the goal with the lowest identifier. When a pass
 * finds no goal and no state was cut off by the limit, every state reachable along a simple path
 * has been seen and the search ends empty. On an infinite state space without a goal the loop only
 * ends at {@link SearchConfig#maxDepthLimit()}.
 */
public final class IterativeDeepeningSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(IterativeDeepeningSolver.class.getName());

    private final SearchConfig config;

    public IterativeDeepeningSolver() {
        this(SearchConfig.defaults());
    }

    public IterativeDeepeningSolver(SearchConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public SearchResult search(State root) {
        Objects.requireNonNull(root, "root");

        long searchStart = System.nanoTime();
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        long totalExpanded = 0L;
        int depthLimit = 0;

        while (depthLimit < config.maxDepthLimit()) {
            depthLimit++;
            long passStart = System.nanoTime();
            Pass pass = new Pass(depthLimit);
            pass.visit(root, 0, AncestorPath.empty());
            long passNanos = System.nanoTime() - passStart;

            iterations.add(new SearchTelemetry.Iteration(depthLimit, pass.expanded, pass.generated, 1L, passNanos));
            totalExpanded += pass.expanded;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(String.format("IDDFS pass depthLimit=%d: expanded=%d cutoff=%b goal=%b", depthLimit,
                        pass.expanded, pass.cutoff, pass.best != null));
            }

            if (pass.best != null) {
                return finish(pass.best, pass.bestDepth, totalExpanded, iterations, searchStart);
            }
            if (!pass.cutoff) {
                LOGGER.info(String.format("IDDFS (sequential) exhausted the state space at depth limit %d",
                        depthLimit));
                return finish(null, depthLimit, totalExpanded, iterations, searchStart);
            }
        }

        LOGGER.warning(String.format("IDDFS (sequential) stopped at the configured depth cap %d without a goal",
                config.maxDepthLimit()));
        return finish(null, depthLimit, totalExpanded, iterations, searchStart);
    }

    private SearchResult finish(State solution, int depthReached, long totalExpanded,
            List<SearchTelemetry.Iteration> iterations, long searchStart) {
        long elapsedNanos = System.nanoTime() - searchStart;
        LOGGER.info(() -> String.format("IDDFS (sequential) expanded %d states (depth=%d, found=%b, %.3f ms)",
                totalExpanded, depthReached, solution != null, elapsedNanos / 1_000_000.0));
        return new SearchResult(solution, Algorithm.IDDFS_SEQUENTIAL, totalExpanded, depthReached,
                new SearchTelemetry(iterations));
    }

    /**
     * State of one depth-limited traversal. Never shared between passes.
     */
    private static final class Pass {

        private final int depthLimit;
        private State best;
        private int bestDepth;
        private boolean cutoff;
        private long expanded;
        private long generated;

        private Pass(int depthLimit) {
            this.depthLimit = depthLimit;
        }

        private void visit(State node, int depth, AncestorPath path) {
            if (node.isGoal()) {
                if (GoalTieBreak.improves(node, best)) {
                    best = node;
                    bestDepth = depth;
                }
                return;
            }
            if (depth >= depthLimit) {
                cutoff = true;
                return;
            }

            expanded++;
            AncestorPath branch = path.extend(node.identifier());
            for (State child : node.children()) {
                generated++;
                if (!branch.contains(child.identifier())) {
                    visit(child, depth + 1, branch);
                }
            }
        }
    }
}
