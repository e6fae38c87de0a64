package com.statespace.core.sat;

/**
 * A boolean variable or its negation.
 *
 * @param variable 1-based variable index
 * @param negated  {@code true} for the negated form
 */
public record Literal(int variable, boolean negated) {

    public Literal {
        if (variable < 1) {
            throw new IllegalArgumentException("Variable index must be at least 1: " + variable);
        }
    }

    public static Literal positive(int variable) {
        return new Literal(variable, false);
    }

    public static Literal negative(int variable) {
        return new Literal(variable, true);
    }

    /**
     * Returns whether the literal holds when its variable takes {@code value}.
     */
    public boolean holdsFor(boolean value) {
        return value != negated;
    }

    @Override
    public String toString() {
        return (negated ? "~" : "") + variable;
    }
}
