package com.statespace.core.bench;

import com.statespace.core.io.ProblemType;
import com.statespace.core.search.Algorithm;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command line of {@link BenchmarkCli}.
 *
 * @param problemType   the built-in problem to solve, {@code null} when a file or the wizard is used
 * @param problemFile   the problem file to load, or {@code null}
 * @param generate      whether to run the interactive problem wizard instead of benchmarking
 * @param help          whether only the usage text was requested
 * @param algorithmMask the algorithms to run, see {@link Algorithm#maskBit()}
 */
public record BenchmarkOptions(ProblemType problemType, Path problemFile, boolean generate, boolean help,
        int algorithmMask) {

    /**
     * Parses the command line arguments.
     *
     * @throws IllegalArgumentException on unknown or conflicting arguments
     */
    public static BenchmarkOptions parse(String... args) {
        boolean maze = false;
        boolean sat = false;
        boolean hanoi = false;
        boolean generate = false;
        boolean parallel = false;
        boolean sequential = false;
        boolean bfs = false;
        boolean iddfs = false;
        boolean help = false;
        Path file = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--maze":
                case "-m":
                    maze = true;
                    break;
                case "--sat":
                case "-s":
                    sat = true;
                    break;
                case "--hanoi":
                case "-h":
                    hanoi = true;
                    break;
                case "--file":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Error: Missing filename after --file.");
                    }
                    file = Paths.get(args[++i]);
                    break;
                case "--generate":
                case "-g":
                    generate = true;
                    break;
                case "--parallel":
                case "-P":
                    parallel = true;
                    break;
                case "--sequential":
                case "-S":
                    sequential = true;
                    break;
                case "--bfs":
                    bfs = true;
                    break;
                case "--iddfs":
                    iddfs = true;
                    break;
                case "--help":
                case "-H":
                    help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Error: Unknown argument: " + arg);
            }
        }

        int sources = (maze ? 1 : 0) + (sat ? 1 : 0) + (hanoi ? 1 : 0) + (file != null ? 1 : 0);
        if (sources > 1) {
            throw new IllegalArgumentException("Error: Only one of --maze, --sat, --hanoi, or --file can be specified.");
        }
        if (generate && (parallel || sequential || bfs || iddfs)) {
            throw new IllegalArgumentException(
                    "Error: --generate cannot be used with --parallel, --sequential, --bfs, or --iddfs.");
        }
        if ((bfs && iddfs) || (parallel && sequential)) {
            throw new IllegalArgumentException(
                    "Error: --bfs cannot be used with --iddfs, and --parallel cannot be used with --sequential.");
        }

        ProblemType type = null;
        if (maze) {
            type = ProblemType.MAZE;
        } else if (hanoi) {
            type = ProblemType.HANOI;
        } else if (sat || (file == null && !generate)) {
            type = ProblemType.SAT;
        }
        return new BenchmarkOptions(type, file, generate, help, algorithmMask(parallel, sequential, bfs, iddfs));
    }

    private static int algorithmMask(boolean parallel, boolean sequential, boolean bfs, boolean iddfs) {
        int bfsBits = Algorithm.BFS_SEQUENTIAL.maskBit() | Algorithm.BFS_PARALLEL.maskBit();
        int iddfsBits = Algorithm.IDDFS_SEQUENTIAL.maskBit() | Algorithm.IDDFS_PARALLEL.maskBit();
        int parallelBits = Algorithm.BFS_PARALLEL.maskBit() | Algorithm.IDDFS_PARALLEL.maskBit();
        int sequentialBits = Algorithm.BFS_SEQUENTIAL.maskBit() | Algorithm.IDDFS_SEQUENTIAL.maskBit();

        int mask = Algorithm.ALL_MASK;
        if (bfs) {
            mask &= bfsBits;
        } else if (iddfs) {
            mask &= iddfsBits;
        }
        if (parallel) {
            mask &= parallelBits;
        } else if (sequential) {
            mask &= sequentialBits;
        }
        return mask;
    }
}
