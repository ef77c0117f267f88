package org.atmoswing.forecast.core.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CumulativeFrequencyTest {

    @Test
    void testGringortenPositions() {
        double[] f = CumulativeFrequency.gringorten(3);

        assertEquals(3, f.length);
        assertEquals(0.56 / 3.12, f[0], 1e-12);
        assertEquals(1.56 / 3.12, f[1], 1e-12);
        assertEquals(2.56 / 3.12, f[2], 1e-12);
    }

    @Test
    void testPositionsStrictlyIncreasingInsideUnitInterval() {
        double[] f = CumulativeFrequency.gringorten(50);

        assertTrue(f[0] > 0);
        assertTrue(f[49] < 1);
        for (int i = 1; i < f.length; i++) {
            assertTrue(f[i] > f[i - 1]);
        }
    }

    @Test
    void testEmptyAndNegativeSizes() {
        assertEquals(0, CumulativeFrequency.gringorten(0).length);
        assertThrows(IllegalArgumentException.class, () -> CumulativeFrequency.gringorten(-1));
    }
}
