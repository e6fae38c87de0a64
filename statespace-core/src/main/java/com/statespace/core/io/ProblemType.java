package com.statespace.core.io;

import com.statespace.core.InvalidConfigurationException;
import com.statespace.core.ProblemGenerator;
import com.statespace.core.hanoi.HanoiGenerator;
import com.statespace.core.maze.MazeGenerator;
import com.statespace.core.sat.SatGenerator;
import java.util.List;
import java.util.Map;

/**
 * The supported problem families together with the parameter keys they are stored under.
 */
public enum ProblemType {
    MAZE("maze", List.of("width", "height", "seed"), Map.of("width", "69", "height", "69", "seed", "8")) {
        @Override
        ProblemGenerator newGenerator(Map<String, String> parameters) {
            return new MazeGenerator(intParameter(parameters, "width"), intParameter(parameters, "height"),
                    longParameter(parameters, "seed"));
        }
    },
    SAT("sat", List.of("num_variables", "num_clauses", "max_literals_per_clause", "seed"),
            Map.of("num_variables", "14", "num_clauses", "9", "max_literals_per_clause", "4", "seed", "1")) {
        @Override
        ProblemGenerator newGenerator(Map<String, String> parameters) {
            return new SatGenerator(intParameter(parameters, "num_variables"), intParameter(parameters, "num_clauses"),
                    intParameter(parameters, "max_literals_per_clause"), longParameter(parameters, "seed"));
        }
    },
    HANOI("hanoi", List.of("num_pegs", "num_discs"), Map.of("num_pegs", "3", "num_discs", "4")) {
        @Override
        ProblemGenerator newGenerator(Map<String, String> parameters) {
            return new HanoiGenerator(intParameter(parameters, "num_pegs"), intParameter(parameters, "num_discs"));
        }
    };

    private final String fileName;
    private final List<String> parameterKeys;
    private final Map<String, String> defaultParameters;

    ProblemType(String fileName, List<String> parameterKeys, Map<String, String> defaultParameters) {
        this.fileName = fileName;
        this.parameterKeys = parameterKeys;
        this.defaultParameters = defaultParameters;
    }

    abstract ProblemGenerator newGenerator(Map<String, String> parameters);

    /**
     * Returns the name used for this type in problem files and on the console.
     */
    public String fileName() {
        return fileName;
    }

    /**
     * Returns the parameter keys, in the order they are asked for interactively.
     */
    public List<String> parameterKeys() {
        return parameterKeys;
    }

    public Map<String, String> defaultParameters() {
        return defaultParameters;
    }

    /**
     * Builds a generator after checking that every required parameter is present.
     *
     * @throws InvalidConfigurationException if a parameter is missing, not a number, or rejected by
     *                                       the generator
     */
    public ProblemGenerator createGenerator(Map<String, String> parameters) {
        for (String key : parameterKeys) {
            if (!parameters.containsKey(key)) {
                throw new InvalidConfigurationException("Missing parameter '" + key + "' for " + fileName + " problem");
            }
        }
        return newGenerator(parameters);
    }

    public static ProblemType fromFileName(String name) {
        for (ProblemType type : values()) {
            if (type.fileName.equals(name)) {
                return type;
            }
        }
        throw new InvalidConfigurationException("Unknown problem type: " + name);
    }

    private static int intParameter(Map<String, String> parameters, String key) {
        String value = parameters.get(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Parameter '" + key + "' is not an integer: " + value, ex);
        }
    }

    private static long longParameter(Map<String, String> parameters, String key) {
        String value = parameters.get(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Parameter '" + key + "' is not an integer: " + value, ex);
        }
    }
}
