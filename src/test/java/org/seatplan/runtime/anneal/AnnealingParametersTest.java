package org.seatplan.runtime.anneal;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.seatplan.runtime.scoring.ObjectiveFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnealingParametersTest {

    @Test
    void fromConfig_readsClasspathDefaults() {
        AnnealingParameters parameters = AnnealingParameters.fromConfig(ConfigFactory.defaultReference());

        assertThat(parameters.objective()).isEqualTo(ObjectiveFunction.HYBRID);
        assertThat(parameters.baseTemperature()).isEqualTo(1.0);
        assertThat(parameters.finalTemperature()).isEqualTo(0.00001);
        assertThat(parameters.coolingRate()).isEqualTo(0.9);
        assertThat(parameters.internalIterations()).isEqualTo(1000);
        assertThat(parameters.swapCount()).isEqualTo(1);
        assertThat(parameters.ladderSize()).isEqualTo(6);
        assertThat(parameters.seed()).isNull();
    }

    @Test
    void fromConfig_readsOverridesAndSeed() {
        Config config = ConfigFactory.parseString("""
            seatplan.annealing {
              objective = "count"
              cooling-rate = 0.5
              annealers = 2
              seed = 99
            }
            """).withFallback(ConfigFactory.defaultReference());

        AnnealingParameters parameters = AnnealingParameters.fromConfig(config);

        assertThat(parameters.objective()).isEqualTo(ObjectiveFunction.COUNT);
        assertThat(parameters.coolingRate()).isEqualTo(0.5);
        assertThat(parameters.ladderSize()).isEqualTo(2);
        assertThat(parameters.seed()).isEqualTo(99L);
    }

    @Test
    void fromConfig_rejectsUnknownObjective() {
        Config config = ConfigFactory.parseString("seatplan.annealing.objective = median")
                .withFallback(ConfigFactory.defaultReference());

        assertThatThrownBy(() -> AnnealingParameters.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
    }

    @Test
    void rejectsCoolingRateOutsideOpenUnitInterval() {
        assertThatThrownBy(() -> parameters(1.0, 0.1, 1.0, 10, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parameters(1.0, 0.1, 0.0, 10, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parameters(1.0, 0.1, -0.5, 10, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parameters(1.0, 0.1, Double.NaN, 10, 1, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveTemperatures() {
        assertThatThrownBy(() -> parameters(1.0, 0.0, 0.9, 10, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("final temperature");
        assertThatThrownBy(() -> parameters(-1.0, 0.1, 0.9, 10, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("base temperature");
        assertThatThrownBy(() -> parameters(Double.POSITIVE_INFINITY, 0.1, 0.9, 10, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDegenerateCounts() {
        assertThatThrownBy(() -> parameters(1.0, 0.1, 0.9, 0, 1, 1)).hasMessageContaining("Iterations");
        assertThatThrownBy(() -> parameters(1.0, 0.1, 0.9, 10, 0, 1)).hasMessageContaining("Swap count");
        assertThatThrownBy(() -> parameters(1.0, 0.1, 0.9, 10, 1, 0)).hasMessageContaining("annealer");
    }

    @Test
    void levelTemperature_doublesPerLevel() {
        assertThat(AnnealingParameters.levelTemperature(0.5, 0)).isEqualTo(0.5);
        assertThat(AnnealingParameters.levelTemperature(0.5, 1)).isEqualTo(1.0);
        assertThat(AnnealingParameters.levelTemperature(0.5, 4)).isEqualTo(8.0);
    }

    @Test
    void withSeed_keepsOtherValues() {
        AnnealingParameters original = parameters(2.0, 0.1, 0.8, 10, 2, 3);

        AnnealingParameters seeded = original.withSeed(5L);

        assertThat(seeded.seed()).isEqualTo(5L);
        assertThat(seeded.withSeed(null)).isEqualTo(original);
    }

    private static AnnealingParameters parameters(double base, double end, double rate, int iterations, int swaps, int ladder) {
        return new AnnealingParameters(ObjectiveFunction.SUM, base, end, rate, iterations, swaps, ladder, null);
    }
}
