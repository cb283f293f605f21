package org.seatplan.runtime.scoring;

import org.seatplan.runtime.model.Assignment;

import java.util.Map;

/**
 * The headline numbers reported for a final assignment. While companion pairs are violated the
 * preference numbers carry the negative penalty, exactly as the objective functions report it.
 *
 * @param satisfiedPeople      people with at least one satisfied preference
 * @param unsatisfiedPeople    people with none
 * @param satisfiedPreferences satisfied preferences in total
 * @param companionViolations  people seated away from their declared companion
 */
public record ScoreSummary(int satisfiedPeople, int unsatisfiedPeople, int satisfiedPreferences, int companionViolations) {

    public static ScoreSummary of(Assignment assignment, Map<String, String> companions) {
        PreferenceTally tally = PreferenceTally.of(assignment, companions);
        int count = (int) ObjectiveFunction.COUNT.score(assignment, tally);
        int sum = (int) ObjectiveFunction.SUM.score(assignment, tally);
        return new ScoreSummary(count, assignment.getPeopleCount() - count, sum, tally.companionViolations());
    }
}
