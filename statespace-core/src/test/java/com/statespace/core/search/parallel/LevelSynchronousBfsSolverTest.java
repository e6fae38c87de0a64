package com.statespace.core.search.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.statespace.core.search.GraphState;
import com.statespace.core.search.SearchConfig;
import com.statespace.core.search.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LevelSynchronousBfsSolverTest {

    private final LevelSynchronousBfsSolver solver =
            new LevelSynchronousBfsSolver(SearchConfig.defaults().withParallelism(4));

    @AfterEach
    void shutdownPool() {
        solver.shutdown();
    }

    @Test
    void testsRootBeforeExpanding() {
        GraphState root = GraphState.graph().edge(1, 2).goal(1).root(1);

        SearchResult result = solver.search(root);

        assertSame(root, result.solution());
        assertEquals(0, result.depthReached());
        assertEquals(0L, result.expandedStates());
    }

    @Test
    void prefersLowestIdentifierAmongShallowestGoals() {
        GraphState root = GraphState.graph()
                .edge(10, 7, 3)
                .edge(7, 5)
                .edge(3, 4)
                .goal(4, 5)
                .root(10);

        SearchResult result = solver.search(root);

        assertEquals(4L, result.solution().identifier());
        assertEquals(2, result.depthReached());
    }

    @Test
    void ignoresDeeperGoalsWhenShallowerOneExists() {
        GraphState root = GraphState.graph()
                .edge(1, 2, 3)
                .edge(2, 0)
                .edge(3, 9)
                .goal(0, 3)
                .root(1);

        SearchResult result = solver.search(root);

        assertEquals(3L, result.solution().identifier());
        assertEquals(1, result.depthReached());
    }

    @Test
    void picksSameGoalAcrossWideFrontier() {
        GraphState.Graph graph = GraphState.graph();
        for (long child = 1; child <= 50; child++) {
            graph.edge(0, child);
            graph.edge(child, 100 + child);
        }
        graph.goal(149, 120, 130);

        for (int run = 0; run < 5; run++) {
            SearchResult result = solver.search(graph.root(0));
            assertEquals(120L, result.solution().identifier(), "run " + run);
            assertEquals(2, result.depthReached());
            assertEquals(2, result.solution().depth());
        }
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
        assertEquals(4L, result.expandedStates());
        assertEquals(3, result.depthReached());
    }

    @Test
    void singleWorkerGivesSameAnswer() {
        LevelSynchronousBfsSolver single = new LevelSynchronousBfsSolver(SearchConfig.defaults().withParallelism(1));
        try {
            GraphState root = GraphState.graph()
                    .edge(10, 7, 3)
                    .edge(7, 5)
                    .edge(3, 4)
                    .goal(4, 5)
                    .root(10);

            SearchResult result = single.search(root);

            assertTrue(result.found());
            assertEquals(4L, result.solution().identifier());
            assertEquals(2, result.depthReached());
        } finally {
            single.shutdown();
        }
    }
}
