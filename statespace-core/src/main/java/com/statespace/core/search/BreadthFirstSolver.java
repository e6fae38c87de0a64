package com.statespace.core.search;

import com.statespace.core.State;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queue based breadth-first search with a global visited set.
 *
 * <p>FIFO order guarantees that the first goal dequeued lies at minimum depth. When several goals
 * share that depth the one enqueued first wins, which depends on the children enumeration order of
 * their ancestors rather than on identifiers.
 */
public final class BreadthFirstSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSolver.class.getName());

    @Override
    public SearchResult search(State root) {
        Objects.requireNonNull(root, "root");

        long searchStart = System.nanoTime();
        Set<Long> visited = new HashSet<>();
        Deque<Node> queue = new ArrayDeque<>();
        queue.offer(new Node(root, 0));

        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        LevelCounter level = new LevelCounter(0, searchStart);
        long totalExpanded = 0L;
        State solution = null;
        int solutionDepth = -1;

        while (!queue.isEmpty()) {
            Node current = queue.poll();
            if (current.depth != level.depth) {
                iterations.add(level.close());
                level = new LevelCounter(current.depth, System.nanoTime());
            }

            if (!visited.add(current.state.identifier())) {
                continue;
            }
            if (current.state.isGoal()) {
                solution = current.state;
                solutionDepth = current.depth;
                break;
            }

            level.expanded++;
            totalExpanded++;
            for (State child : current.state.children()) {
                level.generated++;
                if (!visited.contains(child.identifier())) {
                    queue.offer(new Node(child, current.depth + 1));
                }
            }
        }
        iterations.add(level.close());

        int depthReached = solution != null ? solutionDepth : level.depth;
        long elapsedNanos = System.nanoTime() - searchStart;
        final long expanded = totalExpanded;
        final boolean found = solution != null;
        LOGGER.info(() -> String.format("BFS (sequential) expanded %d states (depth=%d, found=%b, %.3f ms)",
                expanded, depthReached, found, elapsedNanos / 1_000_000.0));

        return new SearchResult(solution, Algorithm.BFS_SEQUENTIAL, totalExpanded, depthReached,
                new SearchTelemetry(iterations));
    }

    private record Node(State state, int depth) {
    }

    private static final class LevelCounter {

        private final int depth;
        private final long startNanos;
        private long expanded;
        private long generated;

        private LevelCounter(int depth, long startNanos) {
            this.depth = depth;
            this.startNanos = startNanos;
        }

        private SearchTelemetry.Iteration close() {
            SearchTelemetry.Iteration iteration = new SearchTelemetry.Iteration(depth, expanded, generated, 1L,
                    System.nanoTime() - startNanos);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(String.format("BFS level %d: expanded=%d generated=%d", depth, expanded, generated));
            }
            return iteration;
        }
    }
}
