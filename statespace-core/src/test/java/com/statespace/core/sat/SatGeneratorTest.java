package com.statespace.core.sat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.statespace.core.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

class SatGeneratorTest {

    @Test
    void sameSeedGivesSameFormula() {
        SatProblem first = new SatGenerator(14, 9, 4, 1L).generateProblem();
        SatProblem second = new SatGenerator(14, 9, 4, 1L).generateProblem();

        assertEquals(first, second);
        assertEquals(first.render(), second.render());
    }

    @Test
    void respectsRequestedShape() {
        SatProblem problem = new SatGenerator(6, 20, 3, 77L).generateProblem();

        assertEquals(6, problem.variableCount());
        assertEquals(20, problem.clauseCount());
        for (Clause clause : problem.clauses()) {
            assertTrue(clause.literals().size() >= 1 && clause.literals().size() <= 3, clause.toString());
            assertTrue(clause.maxVariable() <= 6, clause.toString());
        }
    }

    @Test
    void generatesUnassignedRoot() {
        SatState root = new SatGenerator(4, 3, 2, 9L).generate();

        assertEquals(0L, root.identifier());
        assertTrue(root.assignment().isEmpty());
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(InvalidConfigurationException.class, () -> new SatGenerator(0, 1, 1, 1L));
        assertThrows(InvalidConfigurationException.class, () -> new SatGenerator(1, 0, 1, 1L));
        assertThrows(InvalidConfigurationException.class, () -> new SatGenerator(1, 1, 0, 1L));
        assertThrows(InvalidConfigurationException.class, () -> new SatGenerator(SatProblem.MAX_VARIABLES + 1, 1, 1, 1L));
    }
}
