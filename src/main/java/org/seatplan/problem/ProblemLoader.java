package org.seatplan.problem;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a seating problem from JSON (comments are tolerated) and validates it.
 * <pre>
 * {
 *   "people":   [ { "name": "Alice", "preferences": ["Bob"] }, ... ],
 *   "tables":   [ 4, 4, 2 ],
 *   "plusOnes": [ { "personOne": "Alice", "personTwo": "Bob" } ]
 * }
 * </pre>
 */
public final class ProblemLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProblemLoader.class);
    private static final Gson GSON = new GsonBuilder()
        .setLenient()
        .create();

    private ProblemLoader() {}

    /**
     * Reads and validates the problem stored in the given file.
     *
     * @param file path of the JSON document
     * @return the validated problem
     * @throws ProblemValidationException if the file cannot be read, is not valid JSON or
     *                                    describes an inconsistent problem
     */
    public static SeatingProblem loadFromFile(Path file) throws ProblemValidationException {
        final String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ProblemValidationException("Problem file not found: " + file.toAbsolutePath(), e);
        } catch (IOException e) {
            throw new ProblemValidationException("Failed to read problem file '" + file + "': " + e.getMessage(), e);
        }
        SeatingProblem problem = parse(content, file.toString());
        LOG.debug("Loaded problem from {}: {} people, {} tables, {} companion pairs",
                file, problem.getPeopleCount(), problem.getTableCapacities().size(), problem.getCompanions().size());
        return problem;
    }

    /**
     * Parses and validates a problem held in memory.
     *
     * @param json   the JSON document
     * @param source a name for the document used in error messages
     * @return the validated problem
     * @throws ProblemValidationException if the document is malformed or inconsistent
     */
    public static SeatingProblem parse(String json, String source) throws ProblemValidationException {
        final ProblemDocument document;
        try {
            document = GSON.fromJson(json, ProblemDocument.class);
        } catch (JsonParseException e) {
            throw new ProblemValidationException(formatJsonError(e, source), e);
        }
        if (document == null) {
            throw new ProblemValidationException("Problem document '" + source + "' is empty");
        }
        SeatingProblem problem = toProblem(document, source);
        problem.validate();
        return problem;
    }

    private static SeatingProblem toProblem(ProblemDocument document, String source) throws ProblemValidationException {
        List<Person> people = new ArrayList<>();
        if (document.people != null) {
            for (ProblemDocument.PersonEntry entry : document.people) {
                if (entry == null || entry.name == null) {
                    throw new ProblemValidationException("Every person in '" + source + "' needs a name");
                }
                List<String> preferences = new ArrayList<>();
                if (entry.preferences != null) {
                    for (String preference : entry.preferences) {
                        if (preference != null) {
                            preferences.add(preference);
                        }
                    }
                }
                people.add(new Person(entry.name, preferences));
            }
        }

        if (document.tables == null) {
            throw new ProblemValidationException("Problem document '" + source + "' has no 'tables' list");
        }
        List<Integer> capacities = new ArrayList<>();
        for (int i = 0; i < document.tables.size(); i++) {
            Integer capacity = document.tables.get(i);
            if (capacity == null) {
                throw new ProblemValidationException(String.format("Table %d in '%s' has no capacity", i, source));
            }
            capacities.add(capacity);
        }

        Map<String, String> companions = new LinkedHashMap<>();
        if (document.plusOnes != null) {
            for (ProblemDocument.CompanionEntry entry : document.plusOnes) {
                if (entry == null || entry.personOne == null || entry.personTwo == null) {
                    throw new ProblemValidationException("Companion pairs in '" + source + "' need personOne and personTwo");
                }
                String previous = companions.put(entry.personOne, entry.personTwo);
                if (previous != null && !previous.equals(entry.personTwo)) {
                    LOG.warn("Companion of '{}' redeclared: '{}' replaces '{}'", entry.personOne, entry.personTwo, previous);
                }
            }
        }

        return new SeatingProblem(people, capacities, companions);
    }

    /**
     * Formats a JSON parsing exception into a user-friendly error message.
     *
     * @param e the exception
     * @param source the name of the document
     * @return a formatted error message
     */
    private static String formatJsonError(JsonParseException e, String source) {
        StringBuilder sb = new StringBuilder();
        sb.append("Invalid JSON in '").append(source).append("'");
        String message = e.getMessage();
        if (e instanceof JsonSyntaxException && message != null && message.contains("at line")) {
            int lineStart = message.indexOf("at line") + 7;
            int lineEnd = message.indexOf("column", lineStart);
            if (lineEnd > lineStart) {
                sb.append(" at line ").append(message.substring(lineStart, lineEnd).trim());
            }
        }
        if (message != null) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
