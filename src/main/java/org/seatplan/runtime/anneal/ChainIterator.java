package org.seatplan.runtime.anneal;

import org.seatplan.runtime.model.Assignment;
import org.seatplan.runtime.scoring.ObjectiveFunction;
import org.seatplan.runtime.spi.IRandomProvider;

import java.util.Map;

/**
 * Runs one Metropolis chain at a fixed temperature for a bounded number of steps. An iterator
 * holds only read-only collaborators, so a single instance serves every level of the ladder;
 * the mutable state travels in the {@link ChainState} passed in and returned.
 */
public final class ChainIterator {

    private final ObjectiveFunction objective;
    private final Map<String, String> companions;
    private final int internalIterations;
    private final int swapCount;

    public ChainIterator(ObjectiveFunction objective, Map<String, String> companions, int internalIterations, int swapCount) {
        this.objective = objective;
        this.companions = companions;
        this.internalIterations = internalIterations;
        this.swapCount = swapCount;
    }

    /**
     * Advances a chain by {@code internalIterations} steps.
     *
     * @param state       the chain's current assignment and score
     * @param temperature temperature for this invocation, positive
     * @param random      the chain's own random stream
     * @return the state after the last step
     */
    public ChainState iterate(ChainState state, double temperature, IRandomProvider random) {
        Assignment current = state.assignment();
        double currentScore = state.score();
        for (int i = 0; i < internalIterations; i++) {
            Assignment candidate = current.neighbour(swapCount, random);
            double candidateScore = objective.score(candidate, companions);
            if (candidateScore > currentScore || accepts(currentScore, candidateScore, temperature, random.nextDouble())) {
                current = candidate;
                currentScore = candidateScore;
            }
        }
        return new ChainState(current, currentScore);
    }

    /**
     * Metropolis criterion for a candidate that is not strictly better: accept iff
     * {@code draw < exp((candidate - current) / temperature)}.
     *
     * @param currentScore   score of the current state
     * @param candidateScore score of the candidate
     * @param temperature    chain temperature
     * @param draw           uniform draw from [0, 1)
     * @return whether the candidate replaces the current state
     */
    static boolean accepts(double currentScore, double candidateScore, double temperature, double draw) {
        return draw < acceptanceProbability(currentScore, candidateScore, temperature);
    }

    static double acceptanceProbability(double currentScore, double candidateScore, double temperature) {
        return Math.exp((candidateScore - currentScore) / temperature);
    }
}
