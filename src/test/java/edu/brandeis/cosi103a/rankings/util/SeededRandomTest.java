package edu.brandeis.cosi103a.rankings.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeededRandomTest {

    @Test
    void sameSeedSameSequence() {
        SeededRandom a = new SeededRandom(42);
        SeededRandom b = new SeededRandom(42);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextDouble(), b.nextDouble());
        }
    }

    @Test
    void valuesStayInUnitInterval() {
        SeededRandom rng = SeededRandom.fromString("spring");
        for (int i = 0; i < 10_000; i++) {
            double v = rng.nextDouble();
            assertTrue(v >= 0 && v < 1, "value out of range: " + v);
        }
    }

    @Test
    void differentSeedsDiverge() {
        assertNotEquals(new SeededRandom(1).nextDouble(), new SeededRandom(2).nextDouble());
    }

    @Test
    void shuffleIsAPermutationAndReproducible() {
        List<Integer> first = range(20);
        List<Integer> second = range(20);
        SeededRandom.fromString("x").shuffle(first);
        SeededRandom.fromString("x").shuffle(second);

        assertEquals(first, second);
        List<Integer> sorted = new ArrayList<>(first);
        sorted.sort(null);
        assertEquals(range(20), sorted);
    }

    private static List<Integer> range(int n) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(i);
        }
        return out;
    }
}
