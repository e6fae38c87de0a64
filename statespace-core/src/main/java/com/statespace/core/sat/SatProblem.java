package com.statespace.core.sat;

import com.statespace.core.InvalidConfigurationException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * CNF formula over variables {@code 1..variableCount}.
 */
public record SatProblem(int variableCount, List<Clause> clauses) {

    /**
     * Largest variable count whose two-bit-per-variable encoding still fits a 64-bit identifier.
     */
    public static final int MAX_VARIABLES = Long.SIZE / 2;

    public SatProblem {
        Objects.requireNonNull(clauses, "clauses");
        if (variableCount < 1 || variableCount > MAX_VARIABLES) {
            throw new InvalidConfigurationException(
                    "Number of variables must be between 1 and " + MAX_VARIABLES + ": " + variableCount);
        }
        if (clauses.isEmpty()) {
            throw new InvalidConfigurationException("A SAT problem needs at least one clause");
        }
        clauses = List.copyOf(clauses);
        for (Clause clause : clauses) {
            if (clause.maxVariable() > variableCount) {
                throw new InvalidConfigurationException(
                        "Clause " + clause + " refers to a variable beyond " + variableCount);
            }
        }
    }

    public int clauseCount() {
        return clauses.size();
    }

    /**
     * Renders the formula as {@code (1 v ~2) & (3)}.
     */
    public String render() {
        return clauses.stream().map(Clause::toString).collect(Collectors.joining(" & "));
    }
}
