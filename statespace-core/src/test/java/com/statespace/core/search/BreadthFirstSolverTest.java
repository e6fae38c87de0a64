package com.statespace.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.statespace.core.State;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class BreadthFirstSolverTest {

    private final BreadthFirstSolver solver = new BreadthFirstSolver();

    @Test
    void returnsRootWhenRootIsGoal() {
        GraphState root = GraphState.graph().edge(1, 2).goal(1).root(1);

        SearchResult result = solver.search(root);

        assertTrue(result.found());
        assertSame(root, result.solution());
        assertEquals(0, result.depthReached());
        assertEquals(0L, result.expandedStates(), "the goal itself is never expanded");
    }

    @Test
    void findsShallowestGoal() {
        GraphState root = GraphState.graph()
                .edge(1, 2, 3)
                .edge(2, 4)
                .edge(4, 5)
                .edge(3, 5)
                .goal(5)
                .root(1);

        SearchResult result = solver.search(root);

        assertTrue(result.found());
        assertEquals(2, result.depthReached());
        assertEquals(List.of(1L, 3L, 5L), identifiers(result.solution().pathFromRoot()));
        assertEquals(2, result.solution().depth());
    }

    @Test
    void prefersFirstEnqueuedGoalAtShallowestDepth() {
        GraphState root = GraphState.graph()
                .edge(10, 7, 3)
                .edge(7, 5)
                .edge(3, 4)
                .goal(4, 5)
                .root(10);

        SearchResult result = solver.search(root);

        assertEquals(5L, result.solution().identifier(), "goal under the first child is enqueued first");
        assertEquals(2, result.depthReached());
    }

    @Test
    void terminatesOnCycleWithoutGoal() {
        GraphState root = GraphState.graph()
                .edge(1, 2)
                .edge(2, 3)
                .edge(3, 4)
                .edge(4, 1)
                .root(1);

        SearchResult result = solver.search(root);

        assertFalse(result.found());
        assertTrue(result.goal().isEmpty());
        assertEquals(4L, result.expandedStates(), "each state of the cycle is expanded exactly once");
    }

    @Test
    void recordsOneTelemetryIterationPerLevel() {
        GraphState root = GraphState.graph()
                .edge(1, 2, 3)
                .edge(2, 4)
                .edge(3, 5)
                .goal(5)
                .root(1);

        SearchResult result = solver.search(root);

        List<SearchTelemetry.Iteration> iterations = result.telemetry().iterations();
        assertEquals(3, iterations.size());
        assertEquals(0, iterations.get(0).depth());
        assertEquals(2, result.telemetry().latest().depth());
        assertEquals(result.expandedStates(), result.telemetry().totalExpanded());
    }

    @Test
    void repeatedSearchesAreIndependent() {
        GraphState root = GraphState.graph()
                .edge(1, 2, 3)
                .edge(3, 4)
                .goal(4)
                .root(1);

        SearchResult first = solver.search(root);
        SearchResult second = solver.search(root);

        assertEquals(first.solution().identifier(), second.solution().identifier());
        assertEquals(first.expandedStates(), second.expandedStates());
        assertEquals(first.depthReached(), second.depthReached());
    }

    static List<Long> identifiers(List<State> path) {
        return path.stream().map(State::identifier).collect(Collectors.toList());
    }
}
