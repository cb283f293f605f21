package org.seatplan.runtime.anneal;

import org.seatplan.runtime.model.Assignment;

/**
 * Outcome of an annealing run: the assignment held by the coldest level when the schedule ended.
 *
 * @param assignment   the final assignment
 * @param score        its objective value
 * @param initialScore objective value of the shared initial assignment
 * @param rounds       number of cooling rounds run
 * @param seed         master seed of the run
 */
public record AnnealingResult(Assignment assignment, double score, double initialScore, int rounds, long seed) {
}
