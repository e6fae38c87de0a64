package com.statespace.core.bench;

import com.statespace.core.State;
import com.statespace.core.search.Algorithm;
import com.statespace.core.search.SearchConfig;
import com.statespace.core.search.SearchResult;
import com.statespace.core.search.SearchTelemetry;
import com.statespace.core.search.Solver;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a selection of algorithms one after another on the same root state and records how long
 * each solve took. A fresh solver is built for every algorithm so runs never share state.
 */
public final class AlgorithmBenchmark {

    private static final Logger LOGGER = Logger.getLogger(AlgorithmBenchmark.class.getName());
    private static final String SEPARATOR = "--------------------";

    private final State root;
    private final List<Algorithm> algorithms;
    private final SearchConfig config;
    private final List<BenchmarkResult> results = new ArrayList<>();

    public AlgorithmBenchmark(State root, int algorithmMask) {
        this(root, Algorithm.fromMask(algorithmMask), SearchConfig.defaults());
    }

    public AlgorithmBenchmark(State root, List<Algorithm> algorithms, SearchConfig config) {
        this.root = Objects.requireNonNull(root, "root");
        this.algorithms = List.copyOf(Objects.requireNonNull(algorithms, "algorithms"));
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Runs every selected algorithm, printing progress to {@code out}, and returns the results in
     * execution order.
     */
    public List<BenchmarkResult> run(PrintStream out) {
        Objects.requireNonNull(out, "out");
        results.clear();
        for (Algorithm algorithm : algorithms) {
            out.println("Running " + algorithm.displayName() + "...");
            results.add(runAlgorithm(algorithm));
        }
        return getResults();
    }

    public List<BenchmarkResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    public void printResults(PrintStream out) {
        out.println();
        out.println("Results:");
        out.println(SEPARATOR);
        for (BenchmarkResult result : results) {
            out.println(describe(result));
        }
        out.println(SEPARATOR);
    }

    static String describe(BenchmarkResult result) {
        if (result.found()) {
            return String.format("%s: Solution found in %.6f seconds (depth %d, %s).",
                    result.algorithm().displayName(), result.elapsedSeconds(), result.solutionDepth(),
                    workSummary(result));
        }
        return String.format("%s: Solution not found. Time: %.6f seconds (%s).",
                result.algorithm().displayName(), result.elapsedSeconds(), workSummary(result));
    }

    private static String workSummary(BenchmarkResult result) {
        return String.format("%d states expanded, %d generated, peak tasks %d", result.expandedStates(),
                result.generatedStates(), result.maxActiveTasks());
    }

    private BenchmarkResult runAlgorithm(Algorithm algorithm) {
        Solver solver = algorithm.newSolver(config);
        try {
            long start = System.nanoTime();
            SearchResult result = solver.search(root);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            int depth = result.found() ? result.depthReached() : -1;
            LOGGER.info(() -> String.format("%s finished in %.3f ms (found=%b)", algorithm.displayName(),
                    elapsed.toNanos() / 1_000_000.0, result.found()));
            SearchTelemetry telemetry = result.telemetry();
            return new BenchmarkResult(algorithm, elapsed, result.found(), depth, result.expandedStates(),
                    telemetry.totalGenerated(), telemetry.maxActiveTasks());
        } finally {
            solver.shutdown();
        }
    }
}
