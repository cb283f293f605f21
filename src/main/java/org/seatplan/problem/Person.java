package org.seatplan.problem;

import java.util.List;
import java.util.Objects;

/**
 * A guest to be seated. The name is the identity of the person and must be unique within a
 * {@link SeatingProblem}. Preferences name other guests this person would like to share a table
 * with; unknown or repeated names are tolerated and simply never (or repeatedly) match.
 *
 * @param name        unique name of the person
 * @param preferences ordered preferred companion names
 */
public record Person(String name, List<String> preferences) {

    public Person {
        Objects.requireNonNull(name, "name");
        preferences = preferences == null ? List.of() : List.copyOf(preferences);
    }

    public Person(String name, String... preferences) {
        this(name, List.of(preferences));
    }
}
