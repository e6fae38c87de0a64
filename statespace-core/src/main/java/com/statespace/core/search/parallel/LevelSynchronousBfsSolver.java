package com.statespace.core.search.parallel;

import com.statespace.core.State;
import com.statespace.core.search.Algorithm;
import com.statespace.core.search.GoalTieBreak;
import com.statespace.core.search.SearchConfig;
import com.statespace.core.search.SearchResult;
import com.statespace.core.search.SearchTelemetry;
import com.statespace.core.search.Solver;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Level-synchronous parallel breadth-first search.
 *
 * <p>Every round expands the whole current frontier on the fork-join pool, one task per frontier
 * member. Each discovered child is checked against the visited set, appended to the next frontier and
 * compared against the round's goal candidate inside a single critical section. The round ends when
 * all tasks have joined; the search stops after the first round that recorded a goal or when the
 * next frontier is empty.
 *
 * <p>Among the goals of the shallowest goal-bearing level the one with the lowest identifier is
 * returned. The depth always matches {@link com.statespace.core.search.BreadthFirstSolver}, the
 * chosen goal may not.
 */
public final class LevelSynchronousBfsSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(LevelSynchronousBfsSolver.class.getName());

    private final ForkJoinPool pool;

    public LevelSynchronousBfsSolver() {
        this(SearchConfig.defaults());
    }

    public LevelSynchronousBfsSolver(SearchConfig config) {
        this(new ForkJoinPool(Objects.requireNonNull(config, "config").parallelism()));
    }

    public LevelSynchronousBfsSolver(ForkJoinPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Shuts down the {@link ForkJoinPool} backing this solver.
     */
    @Override
    public void shutdown() {
        pool.shutdown();
    }

    @Override
    public SearchResult search(State root) {
        Objects.requireNonNull(root, "root");

        long searchStart = System.nanoTime();
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(root.identifier());

        if (root.isGoal()) {
            return finish(root, 0, 0L, iterations, searchStart);
        }

        List<State> frontier = List.of(root);
        long totalExpanded = 0L;
        int depth = 0;

        while (!frontier.isEmpty()) {
            long roundStart = System.nanoTime();
            Round round = new Round(visited);
            pool.invoke(new ExpandTask(frontier, 0, frontier.size(), round));
            depth++;

            long expanded = round.expanded.get();
            totalExpanded += expanded;
            iterations.add(new SearchTelemetry.Iteration(depth - 1, expanded, round.generated.get(),
                    round.maxActiveTasks.get(), System.nanoTime() - roundStart));
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(String.format("BFS round %d: frontier=%d next=%d goal=%b", depth - 1, frontier.size(),
                        round.nextFrontier.size(), round.goal != null));
            }

            if (round.goal != null) {
                return finish(round.goal, depth, totalExpanded, iterations, searchStart);
            }
            frontier = round.nextFrontier;
        }

        // the last round expanded level depth - 1 and discovered nothing new
        return finish(null, Math.max(0, depth - 1), totalExpanded, iterations, searchStart);
    }

    private SearchResult finish(State solution, int depthReached, long totalExpanded,
            List<SearchTelemetry.Iteration> iterations, long searchStart) {
        long elapsedNanos = System.nanoTime() - searchStart;
        LOGGER.info(() -> String.format("BFS (parallel) expanded %d states (depth=%d, found=%b, parallelism=%d, %.3f ms)",
                totalExpanded, depthReached, solution != null, pool.getParallelism(), elapsedNanos / 1_000_000.0));
        return new SearchResult(solution, Algorithm.BFS_PARALLEL, totalExpanded, depthReached,
                new SearchTelemetry(iterations));
    }

    /**
     * Splits a frontier range in halves until a single member is left, then expands it.
     */
    private static final class ExpandTask extends RecursiveAction {

        private static final long serialVersionUID = 1L;

        private final List<State> frontier;
        private final int from;
        private final int to;
        private final Round round;

        private ExpandTask(List<State> frontier, int from, int to, Round round) {
            this.frontier = frontier;
            this.from = from;
            this.to = to;
            this.round = round;
        }

        @Override
        protected void compute() {
            if (to - from > 1) {
                int middle = (from + to) >>> 1;
                invokeAll(new ExpandTask(frontier, from, middle, round), new ExpandTask(frontier, middle, to, round));
                return;
            }
            round.taskStarted();
            try {
                round.expand(frontier.get(from));
            } finally {
                round.taskFinished();
            }
        }
    }

    /**
     * Shared bookkeeping of one round. The visited set belongs to the whole search, the next frontier
     * and goal candidate to this round only; all three are guarded by {@code lock}.
     */
    private static final class Round {

        private final Object lock = new Object();
        private final Set<Long> visited;
        private final List<State> nextFrontier = new ArrayList<>();
        private State goal;

        private final AtomicLong expanded = new AtomicLong();
        private final AtomicLong generated = new AtomicLong();
        private final AtomicInteger activeTasks = new AtomicInteger();
        private final AtomicLong maxActiveTasks = new AtomicLong();

        private Round(Set<Long> visited) {
            this.visited = visited;
        }

        private void expand(State state) {
            List<State> children = state.children();
            expanded.incrementAndGet();
            generated.addAndGet(children.size());
            for (State child : children) {
                long identifier = child.identifier();
                boolean isGoal = child.isGoal();
                synchronized (lock) {
                    if (visited.add(identifier)) {
                        if (isGoal && GoalTieBreak.improves(child, goal)) {
                            goal = child;
                        }
                        nextFrontier.add(child);
                    }
                }
            }
        }

        private void taskStarted() {
            int current = activeTasks.incrementAndGet();
            maxActiveTasks.accumulateAndGet(current, Math::max);
        }

        private void taskFinished() {
            activeTasks.decrementAndGet();
        }
    }
}
