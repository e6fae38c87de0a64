package com.statespace.core.search.parallel;

import com.statespace.core.State;
import com.statespace.core.search.Algorithm;
import com.statespace.core.search.AncestorPath;
import com.statespace.core.search.GoalTieBreak;
import com.statespace.core.search.SearchConfig;
import com.statespace.core.search.SearchResult;
import com.statespace.core.search.SearchTelemetry;
import com.statespace.core.search.Solver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parallel iterative-deepening search built on recursive fork-join tasks.
 *
 * <p>The outer loop matches {@link com.statespace.core.search.IterativeDeepeningSolver}. Inside a
 * pass, a node shallower than {@link SearchConfig#forkDepthThreshold()} forks one task per child and
 * joins them all before returning; deeper nodes recurse sequentially inside their task. Each child
 * receives its own immutable {@link AncestorPath}, so concurrent branches never share a mutable
 * visited structure.
 *
 * <p>Tasks of a pass share a best-goal cell that only changes under a lock and only on a strict
 * identifier improvement. A volatile read lets a task skip the lock when its goal cannot win.
 * Running tasks are never cancelled once a goal is known; the pass simply reports the best goal
 * after every task has joined.
 */
public final class ForkJoinIddfsSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(ForkJoinIddfsSolver.class.getName());

    private final ForkJoinPool pool;
    private final SearchConfig config;

    public ForkJoinIddfsSolver() {
        this(SearchConfig.defaults());
    }

    public ForkJoinIddfsSolver(SearchConfig config) {
        this(config, new ForkJoinPool(Objects.requireNonNull(config, "config").parallelism()));
    }

    public ForkJoinIddfsSolver(SearchConfig config, ForkJoinPool pool) {
        this.config = Objects.requireNonNull(config, "config");
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
        long totalExpanded = 0L;
        int depthLimit = 0;

        while (depthLimit < config.maxDepthLimit()) {
            depthLimit++;
            long passStart = System.nanoTime();
            PassContext context = new PassContext(depthLimit, config.forkDepthThreshold());
            boolean cutoff = pool.invoke(new DepthLimitedTask(root, 0, AncestorPath.empty(), context));
            long passNanos = System.nanoTime() - passStart;

            long expanded = context.expanded.get();
            totalExpanded += expanded;
            iterations.add(new SearchTelemetry.Iteration(depthLimit, expanded, context.generated.get(),
                    context.maxActiveTasks.get(), passNanos));
            State best = context.best;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(String.format("IDDFS pass depthLimit=%d: expanded=%d cutoff=%b goal=%b tasks=%d",
                        depthLimit, expanded, cutoff, best != null, context.maxActiveTasks.get()));
            }

            if (best != null) {
                return finish(best, context.bestDepth, totalExpanded, iterations, searchStart);
            }
            if (!cutoff) {
                LOGGER.info(String.format("IDDFS (parallel) exhausted the state space at depth limit %d",
                        depthLimit));
                return finish(null, depthLimit, totalExpanded, iterations, searchStart);
            }
        }

        LOGGER.warning(String.format("IDDFS (parallel) stopped at the configured depth cap %d without a goal",
                config.maxDepthLimit()));
        return finish(null, depthLimit, totalExpanded, iterations, searchStart);
    }

    private SearchResult finish(State solution, int depthReached, long totalExpanded,
            List<SearchTelemetry.Iteration> iterations, long searchStart) {
        long elapsedNanos = System.nanoTime() - searchStart;
        LOGGER.info(() -> String.format("IDDFS (parallel) expanded %d states (depth=%d, found=%b, parallelism=%d, %.3f ms)",
                totalExpanded, depthReached, solution != null, pool.getParallelism(), elapsedNanos / 1_000_000.0));
        return new SearchResult(solution, Algorithm.IDDFS_PARALLEL, totalExpanded, depthReached,
                new SearchTelemetry(iterations));
    }

    /**
     * Explores {@code node} within the pass limit and reports whether anything was cut off.
     */
    private static boolean explore(State node, int depth, AncestorPath path, PassContext context) {
        if (node.isGoal()) {
            context.offer(node, depth);
            return false;
        }
        if (depth >= context.depthLimit) {
            return true;
        }

        List<State> children = node.children();
        context.expanded.incrementAndGet();
        context.generated.addAndGet(children.size());
        AncestorPath branch = path.extend(node.identifier());
        boolean cutoff = false;

        if (depth < context.forkDepthThreshold) {
            List<DepthLimitedTask> forked = new ArrayList<>(children.size());
            for (State child : children) {
                if (branch.contains(child.identifier())) {
                    continue;
                }
                DepthLimitedTask task = new DepthLimitedTask(child, depth + 1, branch, context);
                forked.add(task);
                task.fork();
            }
            for (DepthLimitedTask task : forked) {
                cutoff |= task.join();
            }
            return cutoff;
        }

        for (State child : children) {
            if (!branch.contains(child.identifier())) {
                cutoff |= explore(child, depth + 1, branch, context);
            }
        }
        return cutoff;
    }

    private static final class DepthLimitedTask extends RecursiveTask<Boolean> {

        private static final long serialVersionUID = 1L;

        private final State node;
        private final int depth;
        private final AncestorPath path;
        private final PassContext context;

        private DepthLimitedTask(State node, int depth, AncestorPath path, PassContext context) {
            this.node = node;
            this.depth = depth;
            this.path = path;
            this.context = context;
        }

        @Override
        protected Boolean compute() {
            context.taskStarted();
            try {
                return explore(node, depth, path, context);
            } finally {
                context.taskFinished();
            }
        }
    }

    /**
     * Coordination state of a single pass, allocated fresh for every depth limit of every search.
     */
    private static final class PassContext {

        private final int depthLimit;
        private final int forkDepthThreshold;
        private final Object goalLock = new Object();
        private volatile State best;
        private int bestDepth;

        private final AtomicLong expanded = new AtomicLong();
        private final AtomicLong generated = new AtomicLong();
        private final AtomicInteger activeTasks = new AtomicInteger();
        private final AtomicLong maxActiveTasks = new AtomicLong();

        private PassContext(int depthLimit, int forkDepthThreshold) {
            this.depthLimit = depthLimit;
            this.forkDepthThreshold = forkDepthThreshold;
        }

        private void offer(State goal, int depth) {
            if (!GoalTieBreak.improves(goal, best)) {
                return;
            }
            synchronized (goalLock) {
                if (GoalTieBreak.improves(goal, best)) {
                    bestDepth = depth;
                    best = goal;
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
