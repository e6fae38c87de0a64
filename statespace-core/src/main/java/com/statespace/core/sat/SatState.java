package com.statespace.core.sat;

import com.statespace.core.State;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Partial assignment of a {@link SatProblem}.
 *
 * <p>The assignment is kept in its identifier encoding: two bits per variable, variable 1 in the
 * most significant pair, {@code 10} for true, {@code 01} for false and {@code 00} while unassigned.
 */
public final class SatState implements State {

    private static final long TRUE_BITS = 2L;
    private static final long FALSE_BITS = 1L;
    private static final long SLOT_MASK = 3L;

    private final SatProblem problem;
    private final long encoded;
    private final SatState predecessor;

    private SatState(SatProblem problem, long encoded, SatState predecessor) {
        this.problem = problem;
        this.encoded = encoded;
        this.predecessor = predecessor;
    }

    /**
     * Creates the root state in which no variable is assigned.
     */
    public static SatState initial(SatProblem problem) {
        return new SatState(Objects.requireNonNull(problem, "problem"), 0L, null);
    }

    /**
     * Assigns the lowest unassigned variable, {@code true} first and {@code false} second. Goals and
     * complete assignments have no children.
     */
    @Override
    public List<State> children() {
        if (isGoal()) {
            return List.of();
        }
        int next = firstUnassigned();
        if (next < 0) {
            return List.of();
        }
        return List.of(
                new SatState(problem, encoded | (TRUE_BITS << shift(next)), this),
                new SatState(problem, encoded | (FALSE_BITS << shift(next)), this));
    }

    /**
     * A goal is a complete assignment that satisfies every clause.
     */
    @Override
    public boolean isGoal() {
        if (firstUnassigned() >= 0) {
            return false;
        }
        for (Clause clause : problem.clauses()) {
            if (!isSatisfied(clause)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public long identifier() {
        return encoded;
    }

    @Override
    public Optional<State> predecessor() {
        return Optional.ofNullable(predecessor);
    }

    public SatProblem problem() {
        return problem;
    }

    /**
     * Returns the value of {@code variable}, or empty while it is unassigned.
     */
    public Optional<Boolean> valueOf(int variable) {
        if (variable < 1 || variable > problem.variableCount()) {
            throw new IllegalArgumentException("Variable out of range: " + variable);
        }
        long slot = (encoded >>> shift(variable)) & SLOT_MASK;
        if (slot == TRUE_BITS) {
            return Optional.of(Boolean.TRUE);
        }
        if (slot == FALSE_BITS) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Returns the assigned variables in ascending order.
     */
    public Map<Integer, Boolean> assignment() {
        Map<Integer, Boolean> assignment = new LinkedHashMap<>();
        for (int variable = 1; variable <= problem.variableCount(); variable++) {
            Optional<Boolean> value = valueOf(variable);
            if (value.isPresent()) {
                assignment.put(variable, value.get());
            }
        }
        return Collections.unmodifiableMap(assignment);
    }

    private boolean isSatisfied(Clause clause) {
        for (Literal literal : clause.literals()) {
            Optional<Boolean> value = valueOf(literal.variable());
            if (value.isPresent() && literal.holdsFor(value.get())) {
                return true;
            }
        }
        return false;
    }

    private int firstUnassigned() {
        for (int variable = 1; variable <= problem.variableCount(); variable++) {
            if (((encoded >>> shift(variable)) & SLOT_MASK) == 0L) {
                return variable;
            }
        }
        return -1;
    }

    private int shift(int variable) {
        return 2 * (problem.variableCount() - variable);
    }

    @Override
    public String toString() {
        return "SatState" + assignment();
    }
}
