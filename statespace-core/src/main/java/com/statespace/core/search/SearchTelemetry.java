package com.statespace.core.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Instrumentation captured during a single {@link Solver#search} call. Breadth-first solvers
 * record one {@link Iteration} per level, iterative deepening records one per depth-limited pass.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;

    public SearchTelemetry(List<Iteration> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            this.iterations = List.of();
        } else {
            this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public Iteration latest() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }

    public long totalExpanded() {
        return iterations.stream().mapToLong(Iteration::expandedStates).sum();
    }

    public long totalGenerated() {
        return iterations.stream().mapToLong(Iteration::generatedStates).sum();
    }

    public long maxActiveTasks() {
        return iterations.stream().mapToLong(Iteration::maxActiveTasks).max().orElse(0L);
    }

    /**
     * @param depth           the BFS level or the IDDFS depth limit this entry describes
     * @param expandedStates  states whose children were enumerated
     * @param generatedStates children produced, duplicates included
     * @param maxActiveTasks  peak number of concurrently running tasks, 1 for sequential solvers
     * @param elapsedNanos    wall time spent on this level or pass
     */
    public record Iteration(
            int depth,
            long expandedStates,
            long generatedStates,
            long maxActiveTasks,
            long elapsedNanos) {
    }
}
