package com.statespace.core.sat;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Disjunction of literals.
 */
public record Clause(List<Literal> literals) {

    public Clause {
        Objects.requireNonNull(literals, "literals");
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("A clause needs at least one literal");
        }
        literals = List.copyOf(literals);
    }

    public static Clause of(Literal... literals) {
        return new Clause(List.of(literals));
    }

    public int maxVariable() {
        return literals.stream().mapToInt(Literal::variable).max().orElse(0);
    }

    @Override
    public String toString() {
        return literals.stream().map(Literal::toString).collect(Collectors.joining(" v ", "(", ")"));
    }
}
