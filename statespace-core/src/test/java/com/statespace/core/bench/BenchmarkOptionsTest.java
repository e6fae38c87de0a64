package com.statespace.core.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.statespace.core.io.ProblemType;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BenchmarkOptionsTest {

    @Test
    void defaultsToSatWithEveryAlgorithm() {
        BenchmarkOptions options = BenchmarkOptions.parse();

        assertEquals(ProblemType.SAT, options.problemType());
        assertNull(options.problemFile());
        assertFalse(options.generate());
        assertFalse(options.help());
        assertEquals(15, options.algorithmMask());
    }

    @ParameterizedTest
    @CsvSource({
            "--bfs, 3",
            "--iddfs, 12",
            "--parallel, 10",
            "-S, 5",
            "--sequential --bfs, 1",
            "-P --iddfs, 8",
            "-m --bfs --parallel, 2"})
    void narrowsAlgorithmMask(String arguments, int expectedMask) {
        BenchmarkOptions options = BenchmarkOptions.parse(arguments.split(" "));

        assertEquals(expectedMask, options.algorithmMask());
    }

    @Test
    void selectsProblemSource() {
        assertEquals(ProblemType.MAZE, BenchmarkOptions.parse("--maze").problemType());
        assertEquals(ProblemType.HANOI, BenchmarkOptions.parse("-h").problemType());

        BenchmarkOptions fromFile = BenchmarkOptions.parse("-f", "problems/maze.json");
        assertNull(fromFile.problemType());
        assertEquals(Paths.get("problems/maze.json"), fromFile.problemFile());
    }

    @Test
    void generateNeedsNoProblemType() {
        BenchmarkOptions options = BenchmarkOptions.parse("--generate");

        assertTrue(options.generate());
        assertNull(options.problemType());
    }

    @Test
    void helpFlagIsRecognised() {
        assertTrue(BenchmarkOptions.parse("-H").help());
        assertTrue(BenchmarkOptions.parse("--help").help());
    }

    @ParameterizedTest
    @CsvSource({
            "--maze --sat",
            "--hanoi --file x.json",
            "--generate --bfs",
            "--generate --parallel",
            "--bfs --iddfs",
            "--parallel --sequential",
            "--unknown",
            "--file"})
    void rejectsInvalidCombinations(String arguments) {
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(arguments.split(" ")));
    }
}
