package com.statespace.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.statespace.core.State;
import com.statespace.core.hanoi.HanoiState;
import com.statespace.core.maze.MazeGenerator;
import com.statespace.core.maze.MazeGrid;
import com.statespace.core.maze.MazeState;
import com.statespace.core.sat.Clause;
import com.statespace.core.sat.Literal;
import com.statespace.core.sat.SatProblem;
import com.statespace.core.sat.SatState;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Runs every algorithm against the built-in domains; all of them must agree on solution depth.
 */
class SolverAgreementTest {

    private static final SearchConfig CONFIG = SearchConfig.defaults().withParallelism(4).withForkDepthThreshold(2);

    private static SearchResult search(Algorithm algorithm, State root) {
        Solver solver = algorithm.newSolver(CONFIG);
        try {
            return solver.search(root);
        } finally {
            solver.shutdown();
        }
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void solvesSmallHanoiInThreeMoves(Algorithm algorithm) {
        SearchResult result = search(algorithm, HanoiState.initial(3, 2));

        assertTrue(result.found(), algorithm.displayName());
        assertEquals(algorithm, result.algorithm());
        assertEquals(3, result.depthReached());
        assertEquals(3, result.solution().depth());
        HanoiState goal = (HanoiState) result.solution();
        assertEquals(List.of(List.of(), List.of(), List.of(2, 1)), goal.pegs());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void reportsNoGoalForUnsatisfiableFormula(Algorithm algorithm) {
        SatProblem problem = new SatProblem(1, List.of(Clause.of(Literal.positive(1)), Clause.of(Literal.negative(1))));

        SearchResult result = search(algorithm, SatState.initial(problem));

        assertFalse(result.found(), algorithm.displayName());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void findsSatisfyingAssignment(Algorithm algorithm) {
        // (x1 v x2) & (~x1) & (x2 v ~x3)
        SatProblem problem = new SatProblem(3, List.of(
                Clause.of(Literal.positive(1), Literal.positive(2)),
                Clause.of(Literal.negative(1)),
                Clause.of(Literal.positive(2), Literal.negative(3))));

        SearchResult result = search(algorithm, SatState.initial(problem));

        assertTrue(result.found());
        assertEquals(3, result.depthReached());
        SatState goal = (SatState) result.solution();
        assertEquals(Optional.of(Boolean.FALSE), goal.valueOf(1));
        assertEquals(Optional.of(Boolean.TRUE), goal.valueOf(2));
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void walksHandDrawnMaze(Algorithm algorithm) {
        MazeGrid grid = MazeGrid.parse(
                "#####",
                "#S  #",
                "### #",
                "#G  #",
                "#####");

        SearchResult result = search(algorithm, new MazeState(grid));

        assertTrue(result.found());
        assertEquals(6, result.depthReached());
        MazeState goal = (MazeState) result.solution();
        assertEquals(3, goal.row());
        assertEquals(1, goal.column());
        assertEquals(7, goal.pathFromRoot().size());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void agreesWithSequentialBfsOnGeneratedMaze(Algorithm algorithm) {
        MazeState root = new MazeGenerator(11, 9, 42L).generate();
        SearchResult reference = new BreadthFirstSolver().search(root);

        SearchResult result = search(algorithm, root);

        assertTrue(result.found());
        assertEquals(reference.depthReached(), result.depthReached());
        assertEquals(reference.solution().identifier(), result.solution().identifier(), "a maze has a single goal");
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void solvesSmallestSquareMaze(Algorithm algorithm) {
        MazeState root = new MazeGenerator(5, 5, 8L).generate();

        SearchResult result = search(algorithm, root);

        assertTrue(result.found());
        assertEquals(new BreadthFirstSolver().search(root).depthReached(), result.depthReached());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void solverCanBeReused(Algorithm algorithm) {
        Solver solver = algorithm.newSolver(CONFIG);
        try {
            SearchResult first = solver.search(HanoiState.initial(3, 2));
            SearchResult second = solver.search(HanoiState.initial(3, 3));

            assertEquals(3, first.depthReached());
            assertEquals(7, second.depthReached());
        } finally {
            solver.shutdown();
        }
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void terminatesOnCyclicGraphWithoutGoal(Algorithm algorithm) {
        GraphState root = GraphState.graph()
                .edge(1, 2, 3)
                .edge(2, 4)
                .edge(3, 4)
                .edge(4, 1)
                .root(1);

        assertTrue(search(algorithm, root).goal().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void oneShotEntryPointsMatchSolvers(Algorithm algorithm) {
        State root = HanoiState.initial(3, 2);
        Optional<State> goal;
        switch (algorithm) {
            case BFS_SEQUENTIAL:
                goal = Solvers.bfsSequential(root);
                break;
            case BFS_PARALLEL:
                goal = Solvers.bfsParallel(root);
                break;
            case IDDFS_SEQUENTIAL:
                goal = Solvers.iddfsSequential(root);
                break;
            default:
                goal = Solvers.iddfsParallel(root);
                break;
        }

        assertTrue(goal.isPresent());
        assertEquals(8L, goal.get().identifier());
    }
}
