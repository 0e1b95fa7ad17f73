package org.gsicoach.util;

import org.gsicoach.interfaces.RecencyWindow;

/**
 * FixedRecencyWindow is a constant-length trailing window on the game clock.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Immutable and thread-safe; the length is final.</li>
 *   <li>Used by the tracker (60s describe / 30s predict) and the engagement
 *       detector (15s quiet gap, 30s fight window, 60s skirmish window).</li>
 * </ul>
 */
public final class FixedRecencyWindow implements RecencyWindow {

    /** Window length in game seconds. */
    private final int seconds;

    /**
     * Constructs a fixed window.
     *
     * @param seconds window length in game seconds, must not be negative
     */
    public FixedRecencyWindow(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("window must not be negative: " + seconds);
        }
        this.seconds = seconds;
    }

    public static FixedRecencyWindow ofSeconds(int seconds) {
        return new FixedRecencyWindow(seconds);
    }

    @Override
    public int seconds() {
        return seconds;
    }

    /**
     * Start of the window ending at {@code now}; samples at or after this clock are inside.
     *
     * @param now current game clock
     * @return first clock value still inside the window
     */
    public int startAt(int now) {
        return now - seconds;
    }

    @Override
    public String toString() {
        return "FixedRecencyWindow{" + "seconds=" + seconds + '}';
    }
}
