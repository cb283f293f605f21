package org.seatplan.runtime.anneal;

import java.util.List;

/**
 * Scores of the replica ladder after one cooling round, coldest level first.
 *
 * @param round           1-based round number
 * @param baseTemperature temperature of level 0 during the round
 * @param levelScores     score held by each level after the exchange pass
 */
public record RoundSnapshot(int round, double baseTemperature, List<Double> levelScores) {

    public RoundSnapshot {
        levelScores = List.copyOf(levelScores);
    }

    public double coldestScore() {
        return levelScores.get(0);
    }
}
