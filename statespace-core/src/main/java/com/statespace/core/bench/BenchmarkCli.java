package com.statespace.core.bench;

import com.statespace.core.State;
import com.statespace.core.io.ProblemDefinition;
import com.statespace.core.io.ProblemFiles;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point: benchmarks the selected algorithms on a built-in or loaded problem, or
 * runs the {@link ProblemWizard}.
 */
public final class BenchmarkCli {

    private static final Logger LOGGER = Logger.getLogger(BenchmarkCli.class.getName());
    private static final String LOGGING_CONFIG = "/statespace-logging.properties";

    private BenchmarkCli() {
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = run(args, System.in, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the command line and returns the process exit code.
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        BenchmarkOptions options;
        try {
            options = BenchmarkOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            printUsage(err);
            return 1;
        }
        if (options.help()) {
            printUsage(out);
            return 0;
        }

        try {
            if (options.generate()) {
                new ProblemWizard(new Scanner(in), out).run();
                return 0;
            }
            ProblemDefinition definition = options.problemFile() != null
                    ? ProblemFiles.load(options.problemFile())
                    : ProblemDefinition.defaults(options.problemType());
            out.println("Problem: " + definition.type().fileName() + " " + definition.parameters());
            State root = definition.generate();

            AlgorithmBenchmark benchmark = new AlgorithmBenchmark(root, options.algorithmMask());
            benchmark.run(out);
            benchmark.printResults(out);
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Benchmark failed", ex);
            err.println("Error: " + ex.getMessage());
            return 1;
        }
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: statespace-bench [options]");
        out.println("Options:");
        out.println("  -m, --maze          Solve the built-in maze problem");
        out.println("  -s, --sat           Solve the built-in SAT problem (default)");
        out.println("  -h, --hanoi         Solve the built-in Tower of Hanoi problem");
        out.println("  -f, --file <path>   Load the problem from a file");
        out.println("  -g, --generate      Generate a new problem interactively");
        out.println("  -P, --parallel      Run only the parallel algorithms");
        out.println("  -S, --sequential    Run only the sequential algorithms");
        out.println("      --bfs           Run only breadth-first search");
        out.println("      --iddfs         Run only iterative deepening search");
        out.println("  -H, --help          Show this help message");
    }

    private static void configureLogging() {
        try (InputStream config = BenchmarkCli.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration " + LOGGING_CONFIG, ex);
        }
    }
}
