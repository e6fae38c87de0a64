package com.statespace.core.io;

import com.statespace.core.ProblemGenerator;
import com.statespace.core.State;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The generation parameters of a problem, which is all a problem file stores. Regenerating from
 * the same definition yields an identical root state.
 *
 * @param type       the problem family
 * @param parameters parameter values keyed by {@link ProblemType#parameterKeys()}, kept sorted
 */
public record ProblemDefinition(ProblemType type, Map<String, String> parameters) {

    public ProblemDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(parameters, "parameters");
        parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    /**
     * Returns the built-in benchmark instance of {@code type}.
     */
    public static ProblemDefinition defaults(ProblemType type) {
        return new ProblemDefinition(type, type.defaultParameters());
    }

    public ProblemGenerator generator() {
        return type.createGenerator(parameters);
    }

    public State generate() {
        return generator().generate();
    }
}
