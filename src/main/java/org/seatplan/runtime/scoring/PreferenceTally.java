package org.seatplan.runtime.scoring;

import org.seatplan.problem.Person;
import org.seatplan.runtime.model.Assignment;
import org.seatplan.runtime.model.Table;

import java.util.Map;

/**
 * Raw counts gathered in one pass over an assignment.
 *
 * @param satisfiedPreferences number of (person, preference) pairs seated together; mutual
 *                             preferences count twice
 * @param satisfiedPeople      number of people with at least one preference at their table
 * @param companionViolations  number of people whose declared companion sits elsewhere
 */
public record PreferenceTally(int satisfiedPreferences, int satisfiedPeople, int companionViolations) {

    /**
     * Counts the satisfied preferences and companion violations of an assignment.
     *
     * @param assignment the assignment to inspect
     * @param companions declared companion pairs, {@code personOne -> personTwo}
     * @return the tally
     */
    public static PreferenceTally of(Assignment assignment, Map<String, String> companions) {
        int preferences = 0;
        int people = 0;
        int violations = 0;
        for (Table table : assignment.getTables()) {
            for (int seat = 0; seat < table.getCapacity(); seat++) {
                Person person = table.getOccupant(seat);
                String companion = companions.get(person.name());
                if (companion != null && !table.isSeated(companion)) {
                    violations++;
                }
                boolean satisfied = false;
                for (String preference : person.preferences()) {
                    if (table.isSeated(preference)) {
                        preferences++;
                        satisfied = true;
                    }
                }
                if (satisfied) {
                    people++;
                }
            }
        }
        return new PreferenceTally(preferences, people, violations);
    }

    public boolean hasViolations() {
        return companionViolations > 0;
    }
}
