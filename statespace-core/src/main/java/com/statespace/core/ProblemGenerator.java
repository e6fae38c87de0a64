package com.statespace.core;

/**
 * Builds the root state of a search problem from already validated parameters.
 */
public interface ProblemGenerator {

    /**
     * Generates the root state. Generators seeded with the same parameters produce roots with
     * equal identifiers and equal state spaces.
     *
     * @return the root state of the generated problem
     */
    State generate();
}
