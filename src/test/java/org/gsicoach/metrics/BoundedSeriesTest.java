package org.gsicoach.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundedSeriesTest {

    @Test
    void evictsOldestAndKeepsRunningMean() {
        BoundedSeries s = new BoundedSeries(3);
        assertTrue(s.latest().isEmpty());
        assertTrue(s.mean().isEmpty());

        s.add(1, 10);
        s.add(2, 20);
        s.add(3, 30);
        s.add(4, 40); // evicts 10

        assertEquals(3, s.size());
        assertEquals(40, s.latest().getAsInt());
        assertEquals(30.0, s.mean().getAsDouble(), 1e-9);
        assertEquals(2, s.samples().get(0).gameClock());
    }

    @Test
    void clearResetsSum() {
        BoundedSeries s = new BoundedSeries(2);
        s.add(1, 100);
        s.clear();
        s.add(2, 4);
        assertEquals(4.0, s.mean().getAsDouble(), 1e-9);
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedSeries(0));
    }
}
