package org.seatplan.runtime.anneal;

import com.typesafe.config.Config;
import org.seatplan.runtime.scoring.ObjectiveFunction;

import java.util.Objects;

/**
 * Numeric configuration of an annealing run. Degenerate values are rejected on construction so
 * that the cooling loop can neither spin forever nor divide by a zero temperature.
 *
 * @param objective          objective function maximised by every chain
 * @param baseTemperature    temperature of the coldest level in the first round
 * @param finalTemperature   the run ends once the base temperature is no longer above this
 * @param coolingRate        factor applied to the base temperature after every round, in (0, 1)
 * @param internalIterations Metropolis steps per chain per round
 * @param swapCount          seat swaps per neighbour
 * @param ladderSize         number of concurrently annealed chains; level {@code i} runs at
 *                           {@code baseTemperature * 2^i}
 * @param seed               master seed, or {@code null} to seed from the clock
 */
public record AnnealingParameters(ObjectiveFunction objective,
                                  double baseTemperature,
                                  double finalTemperature,
                                  double coolingRate,
                                  int internalIterations,
                                  int swapCount,
                                  int ladderSize,
                                  Long seed) {

    /** Configuration path holding the annealing settings. */
    public static final String CONFIG_PATH = "seatplan.annealing";

    public AnnealingParameters {
        Objects.requireNonNull(objective, "objective");
        requirePositive("base temperature", baseTemperature);
        requirePositive("final temperature", finalTemperature);
        if (!(coolingRate > 0.0 && coolingRate < 1.0)) {
            throw new IllegalArgumentException("Cooling rate must lie strictly between 0 and 1 but was " + coolingRate);
        }
        if (internalIterations < 1) {
            throw new IllegalArgumentException("Iterations per round must be at least 1 but was " + internalIterations);
        }
        if (swapCount < 1) {
            throw new IllegalArgumentException("Swap count must be at least 1 but was " + swapCount);
        }
        if (ladderSize < 1) {
            throw new IllegalArgumentException("At least one annealer is required but was " + ladderSize);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("The " + name + " must be a positive finite number but was " + value);
        }
    }

    /**
     * Reads the parameters from the {@value #CONFIG_PATH} block of the given configuration.
     * The {@code seed} key is optional.
     *
     * @param config the resolved application configuration
     * @return the validated parameters
     * @throws IllegalArgumentException if a value is degenerate or the objective name is unknown
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type
     */
    public static AnnealingParameters fromConfig(Config config) {
        Config annealing = config.getConfig(CONFIG_PATH);
        return new AnnealingParameters(
                ObjectiveFunction.fromName(annealing.getString("objective")),
                annealing.getDouble("base-temperature"),
                annealing.getDouble("final-temperature"),
                annealing.getDouble("cooling-rate"),
                annealing.getInt("iterations"),
                annealing.getInt("swaps"),
                annealing.getInt("annealers"),
                annealing.hasPath("seed") ? annealing.getLong("seed") : null);
    }

    /**
     * @return the same parameters with another master seed
     */
    public AnnealingParameters withSeed(Long newSeed) {
        return new AnnealingParameters(objective, baseTemperature, finalTemperature, coolingRate,
                internalIterations, swapCount, ladderSize, newSeed);
    }

    /**
     * Temperature of a ladder level for a given base temperature.
     */
    public static double levelTemperature(double baseTemperature, int level) {
        return baseTemperature * Math.pow(2, level);
    }
}
