package org.atmoswing.forecast.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalogLayoutTest {

    @Test
    void testRowRanges() {
        AnalogLayout layout = new AnalogLayout(new int[]{3, 0, 2});

        assertEquals(3, layout.leadTimes());
        assertEquals(0, layout.start(0));
        assertEquals(3, layout.end(0));
        assertEquals(3, layout.start(1));
        assertEquals(3, layout.end(1));
        assertEquals(3, layout.start(2));
        assertEquals(5, layout.end(2));
        assertEquals(5, layout.totalRows());
        assertEquals(2, layout.analogs(2));
    }

    @Test
    void testOutOfRangeLeadTime() {
        AnalogLayout layout = new AnalogLayout(new int[]{1});
        assertThrows(IndexOutOfBoundsException.class, () -> layout.start(1));
        assertThrows(IndexOutOfBoundsException.class, () -> layout.end(-1));
    }

    @Test
    void testNegativeAnalogsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AnalogLayout(new int[]{2, -1}));
    }
}
