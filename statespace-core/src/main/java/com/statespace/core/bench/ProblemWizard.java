package com.statespace.core.bench;

import com.statespace.core.State;
import com.statespace.core.hanoi.HanoiState;
import com.statespace.core.io.ProblemDefinition;
import com.statespace.core.io.ProblemFiles;
import com.statespace.core.io.ProblemType;
import com.statespace.core.maze.MazeState;
import com.statespace.core.sat.SatProblem;
import com.statespace.core.sat.SatState;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Scanner;

/**
 * Console dialogue that asks for a problem type and its parameters, shows the generated problem and
 * optionally saves its definition to a file.
 */
public final class ProblemWizard {

    private static final Map<String, String> PROMPTS = Map.of(
            "width", "Enter maze width (odd number >= 3): ",
            "height", "Enter maze height (odd number >= 3): ",
            "seed", "Enter random seed: ",
            "num_variables", "Enter number of variables (1-" + SatProblem.MAX_VARIABLES + "): ",
            "num_clauses", "Enter number of clauses: ",
            "max_literals_per_clause", "Enter maximum literals per clause: ",
            "num_pegs", "Enter number of pegs (>= 3): ",
            "num_discs", "Enter number of discs (>= 1): ");

    private final Scanner in;
    private final PrintStream out;

    public ProblemWizard(Scanner in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Runs the dialogue and returns the definition that was generated.
     *
     * @throws com.statespace.core.InvalidConfigurationException if the type or a parameter is invalid
     */
    public ProblemDefinition run() {
        out.print("Select problem type (maze, sat, hanoi): ");
        ProblemType type = ProblemType.fromFileName(nextToken().toLowerCase());

        Map<String, String> parameters = new LinkedHashMap<>();
        for (String key : type.parameterKeys()) {
            out.print(PROMPTS.getOrDefault(key, "Enter " + key + ": "));
            parameters.put(key, nextToken());
        }

        ProblemDefinition definition = new ProblemDefinition(type, parameters);
        State root = definition.generate();
        out.println();
        out.println(describe(root));

        out.print("Save problem to file? (yes/no): ");
        String answer = nextToken();
        if (answer.equalsIgnoreCase("yes") || answer.equalsIgnoreCase("y")) {
            out.print("Enter filename: ");
            Path file = Paths.get(nextToken());
            ProblemFiles.save(file, definition);
            out.println("Problem saved to " + file);
        }
        return definition;
    }

    /**
     * Renders a generated root state for display.
     */
    static String describe(State root) {
        if (root instanceof MazeState) {
            MazeState maze = (MazeState) root;
            return "Maze (" + maze.grid().width() + "x" + maze.grid().height() + "):"
                    + System.lineSeparator() + maze.grid().render();
        }
        if (root instanceof SatState) {
            SatProblem problem = ((SatState) root).problem();
            return String.format("SAT Problem (Number of variables: %d, Number of clauses: %d):%n%s",
                    problem.variableCount(), problem.clauseCount(), problem.render());
        }
        if (root instanceof HanoiState) {
            HanoiState hanoi = (HanoiState) root;
            return String.format("Tower of Hanoi (%d pegs, %d discs):%n%s", hanoi.pegCount(), hanoi.discCount(),
                    hanoi.render());
        }
        return root.toString();
    }

    private String nextToken() {
        try {
            return in.next().trim();
        } catch (NoSuchElementException ex) {
            throw new IllegalStateException("Input ended before the problem was complete", ex);
        }
    }
}
