package org.seatplan.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.seatplan.runtime.spi.IRandomProvider;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void sameSeed_producesSameSequence() {
        IRandomProvider first = new SeededRandomProvider(42L);
        IRandomProvider second = new SeededRandomProvider(42L);

        for (int i = 0; i < 100; i++) {
            assertThat(first.nextInt(1000)).isEqualTo(second.nextInt(1000));
            assertThat(first.nextDouble()).isEqualTo(second.nextDouble());
        }
    }

    @Test
    void deriveFor_isDeterministicPerScopeAndKey() {
        IRandomProvider master = new SeededRandomProvider(7L);

        IRandomProvider a = master.deriveFor("chain", 3);
        IRandomProvider b = new SeededRandomProvider(7L).deriveFor("chain", 3);

        for (int i = 0; i < 20; i++) {
            assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
        }
    }

    @Test
    void deriveFor_separatesKeys() {
        IRandomProvider master = new SeededRandomProvider(7L);

        double[] levelZero = draw(master.deriveFor("chain", 0), 8);
        double[] levelOne = draw(master.deriveFor("chain", 1), 8);

        assertThat(levelZero).isNotEqualTo(levelOne);
    }

    @Test
    void values_stayInRange() {
        IRandomProvider provider = new SeededRandomProvider(1L);
        for (int i = 0; i < 1000; i++) {
            assertThat(provider.nextInt(5)).isBetween(0, 4);
            assertThat(provider.nextDouble()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }

    private static double[] draw(IRandomProvider provider, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = provider.nextDouble();
        }
        return values;
    }
}
