package org.gsicoach;

import org.gsicoach.interfaces.RecencyWindow;
import org.gsicoach.util.FixedRecencyWindow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FixedRecencyWindowTest {

    @Test
    void containsAndElapsed() {
        RecencyWindow w = FixedRecencyWindow.ofSeconds(30);
        int now = 600;
        assertTrue(w.contains(now, now));           // same clock
        assertTrue(w.contains(now - 30, now));      // edge is inside
        assertFalse(w.contains(now - 31, now));     // too old
        assertTrue(w.hasElapsed(now - 30, now));
        assertFalse(w.hasElapsed(now - 29, now));
        assertEquals(30, w.seconds());
    }

    @Test
    void startAtIsInclusiveLowerBound() {
        assertEquals(570, FixedRecencyWindow.ofSeconds(30).startAt(600));
        assertEquals(600, FixedRecencyWindow.ofSeconds(0).startAt(600));
    }

    @Test
    void negativeLengthRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FixedRecencyWindow(-1));
    }
}
