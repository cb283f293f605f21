package org.seatplan.runtime.scoring;

import org.seatplan.runtime.model.Assignment;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The objective maximised by the annealer. One variant is selected per run and held fixed.
 * <p>
 * Every variant treats companion pairs as hard constraints: as soon as one person is seated
 * away from their declared companion the preference counts are replaced by the negated number
 * of violations, so no amount of satisfied preferences can outweigh a broken pair.
 */
public enum ObjectiveFunction {

    /** Total number of satisfied preferences. */
    SUM("sum"),

    /** Number of people with at least one satisfied preference. */
    COUNT("count"),

    /**
     * {@code COUNT * M + SUM} with {@code M = max(people, preferences)}, which orders assignments
     * by COUNT first and SUM second.
     */
    HYBRID("hybrid");

    private final String configName;

    ObjectiveFunction(String configName) {
        this.configName = configName;
    }

    /**
     * @return the name used for this variant in configuration and on the command line
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Scores an assignment. Higher is better.
     *
     * @param assignment the assignment to score
     * @param companions declared companion pairs, {@code personOne -> personTwo}
     * @return the score
     */
    public double score(Assignment assignment, Map<String, String> companions) {
        return score(assignment, PreferenceTally.of(assignment, companions));
    }

    double score(Assignment assignment, PreferenceTally tally) {
        double sum = tally.hasViolations() ? -tally.companionViolations() : tally.satisfiedPreferences();
        double count = tally.hasViolations() ? -tally.companionViolations() : tally.satisfiedPeople();
        return switch (this) {
            case SUM -> sum;
            case COUNT -> count;
            case HYBRID -> count * Math.max(assignment.getPeopleCount(), assignment.getPreferenceCount()) + sum;
        };
    }

    /**
     * Resolves a variant from its configuration name, ignoring case.
     *
     * @param name one of {@code sum}, {@code count} or {@code hybrid}
     * @return the matching variant
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ObjectiveFunction fromName(String name) {
        Objects.requireNonNull(name, "Objective function name cannot be null.");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ObjectiveFunction function : values()) {
            if (function.configName.equals(normalized)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown objective function '" + name + "' (expected one of: sum, count, hybrid)");
    }
}
