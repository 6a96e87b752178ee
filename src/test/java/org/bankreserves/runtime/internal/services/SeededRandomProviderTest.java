package org.bankreserves.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void sameSeedProducesSameSequence() {
        SeededRandomProvider a = new SeededRandomProvider(42L);
        SeededRandomProvider b = new SeededRandomProvider(42L);
        for (int i = 0; i < 1000; i++) {
            assertThat(a.nextInt(100)).isEqualTo(b.nextInt(100));
            assertThat(a.nextBoolean()).isEqualTo(b.nextBoolean());
        }
    }

    @Test
    void nextIntStaysWithinBound() {
        SeededRandomProvider random = new SeededRandomProvider(7L);
        for (int i = 0; i < 1000; i++) {
            assertThat(random.nextInt(8)).isBetween(0, 7);
        }
    }

    @Test
    void nextBooleanProducesBothOutcomes() {
        SeededRandomProvider random = new SeededRandomProvider(1L);
        int trueCount = 0;
        for (int i = 0; i < 1000; i++) {
            if (random.nextBoolean()) {
                trueCount++;
            }
        }
        assertThat(trueCount).isBetween(400, 600);
    }

    @Test
    void shuffleThroughJavaRandomIsReproducible() {
        List<Integer> first = shuffled(new SeededRandomProvider(99L));
        List<Integer> second = shuffled(new SeededRandomProvider(99L));

        assertThat(first).isEqualTo(second);
        assertThat(first).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    void javaRandomSharesTheProviderStream() {
        SeededRandomProvider a = new SeededRandomProvider(5L);
        SeededRandomProvider b = new SeededRandomProvider(5L);

        a.asJavaRandom().nextInt(10);
        b.nextInt(10);

        assertThat(a.nextInt(1000)).isEqualTo(b.nextInt(1000));
        assertThat(a.asJavaRandom()).isSameAs(a.asJavaRandom());
        assertThat(a.getSeed()).isEqualTo(5L);
    }

    private static List<Integer> shuffled(SeededRandomProvider random) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            values.add(i);
        }
        Collections.shuffle(values, random.asJavaRandom());
        return values;
    }
}
