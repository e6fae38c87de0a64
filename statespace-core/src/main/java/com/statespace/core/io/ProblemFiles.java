package com.statespace.core.io;

import com.statespace.core.InvalidConfigurationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes problem definitions in a small JSON-shaped text format:
 *
 * <pre>
 * {
 *   "problem_type": "maze",
 *   "parameters": {
 *     "height": "5",
 *     "seed": "7",
 *     "width": "5"
 *   }
 * }
 * </pre>
 *
 * Every value is a string. Only this flat layout is understood; it is not a general JSON parser.
 */
public final class ProblemFiles {

    private static final Logger LOGGER = Logger.getLogger(ProblemFiles.class.getName());

    private static final Pattern TYPE_PATTERN = Pattern.compile("\"problem_type\"\\s*:\\s*\"([^\"]*)\"");
    private static final Pattern PARAMETERS_PATTERN = Pattern.compile("\"parameters\"\\s*:\\s*\\{([^}]*)}");
    private static final Pattern ENTRY_PATTERN = Pattern.compile("\"([^\"]+)\"\\s*:\\s*\"([^\"]*)\"");

    private ProblemFiles() {
    }

    public static void save(Path path, ProblemDefinition definition) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(definition, "definition");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, format(definition), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save problem to " + path, ex);
            throw new UncheckedIOException("Could not open file for writing: " + path, ex);
        }
        LOGGER.info(() -> String.format("Saved %s problem to %s", definition.type().fileName(), path));
    }

    public static ProblemDefinition load(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to load problem from " + path, ex);
            throw new UncheckedIOException("Could not open file for reading: " + path, ex);
        }
        ProblemDefinition definition = parse(content);
        LOGGER.info(() -> String.format("Loaded %s problem from %s", definition.type().fileName(), path));
        return definition;
    }

    public static String format(ProblemDefinition definition) {
        String newline = "\n";
        StringBuilder builder = new StringBuilder();
        builder.append('{').append(newline);
        builder.append("  \"problem_type\": \"").append(definition.type().fileName()).append("\",").append(newline);
        builder.append("  \"parameters\": {").append(newline);
        Iterator<Map.Entry<String, String>> entries = definition.parameters().entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, String> entry = entries.next();
            builder.append("    \"").append(entry.getKey()).append("\": \"").append(entry.getValue()).append('"');
            if (entries.hasNext()) {
                builder.append(',');
            }
            builder.append(newline);
        }
        builder.append("  }").append(newline);
        builder.append('}').append(newline);
        return builder.toString();
    }

    /**
     * Parses the text produced by {@link #format(ProblemDefinition)}.
     *
     * @throws InvalidConfigurationException if the type or the parameter block is missing, or the
     *                                       type is unknown
     */
    public static ProblemDefinition parse(String content) {
        Objects.requireNonNull(content, "content");
        Matcher typeMatcher = TYPE_PATTERN.matcher(content);
        if (!typeMatcher.find()) {
            throw new InvalidConfigurationException("Problem file has no \"problem_type\" entry");
        }
        ProblemType type = ProblemType.fromFileName(typeMatcher.group(1));

        Matcher parametersMatcher = PARAMETERS_PATTERN.matcher(content);
        if (!parametersMatcher.find()) {
            throw new InvalidConfigurationException("Problem file has no \"parameters\" block");
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        Matcher entryMatcher = ENTRY_PATTERN.matcher(parametersMatcher.group(1));
        while (entryMatcher.find()) {
            parameters.put(entryMatcher.group(1), entryMatcher.group(2));
        }
        return new ProblemDefinition(type, parameters);
    }
}
