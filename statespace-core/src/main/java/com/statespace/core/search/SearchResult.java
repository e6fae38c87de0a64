package com.statespace.core.search;

import com.statespace.core.State;
import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Solver} implementations.
 *
 * @param solution       the goal that was selected, or {@code null} if none was found
 * @param algorithm      the algorithm that produced this result
 * @param expandedStates total number of expanded states across all levels or passes
 * @param depthReached   depth of the solution, otherwise the deepest level or limit explored
 * @param telemetry      per-level or per-pass instrumentation
 */
public record SearchResult(State solution, Algorithm algorithm, long expandedStates, int depthReached,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(algorithm, "algorithm");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public Optional<State> goal() {
        return Optional.ofNullable(solution);
    }

    public boolean found() {
        return solution != null;
    }
}
