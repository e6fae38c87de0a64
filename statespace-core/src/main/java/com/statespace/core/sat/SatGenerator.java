package com.statespace.core.sat;

import com.statespace.core.InvalidConfigurationException;
import com.statespace.core.ProblemGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random CNF formulas. Every clause holds between one and
 * {@code maxLiteralsPerClause} literals with uniformly drawn variables and polarities.
 */
public final class SatGenerator implements ProblemGenerator {

    private final int variableCount;
    private final int clauseCount;
    private final int maxLiteralsPerClause;
    private final long seed;

    public SatGenerator(int variableCount, int clauseCount, int maxLiteralsPerClause, long seed) {
        if (variableCount <= 0 || clauseCount <= 0 || maxLiteralsPerClause <= 0) {
            throw new InvalidConfigurationException(
                    "Number of variables, clauses, and max literals per clause must be positive.");
        }
        if (variableCount > SatProblem.MAX_VARIABLES) {
            throw new InvalidConfigurationException(
                    "At most " + SatProblem.MAX_VARIABLES + " variables fit a 64-bit state identifier.");
        }
        this.variableCount = variableCount;
        this.clauseCount = clauseCount;
        this.maxLiteralsPerClause = maxLiteralsPerClause;
        this.seed = seed;
    }

    @Override
    public SatState generate() {
        return SatState.initial(generateProblem());
    }

    public SatProblem generateProblem() {
        Random random = new Random(seed);
        List<Clause> clauses = new ArrayList<>(clauseCount);
        for (int i = 0; i < clauseCount; i++) {
            int literalCount = 1 + random.nextInt(maxLiteralsPerClause);
            List<Literal> literals = new ArrayList<>(literalCount);
            for (int j = 0; j < literalCount; j++) {
                int variable = 1 + random.nextInt(variableCount);
                literals.add(new Literal(variable, random.nextBoolean()));
            }
            clauses.add(new Clause(literals));
        }
        return new SatProblem(variableCount, clauses);
    }
}
