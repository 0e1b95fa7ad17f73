package org.gsicoach.interfaces;

/**
 * A trailing window on the game clock. All times are integer game seconds.
 */
public interface RecencyWindow {

    /** Window length in game seconds. */
    int seconds();

    /** True when {@code t} lies inside the window ending at {@code now} ({@code now - t <= seconds}). */
    default boolean contains(int t, int now) {
        return now - t <= seconds();
    }

    /** True once at least the full window length has passed since {@code since}. */
    default boolean hasElapsed(int since, int now) {
        return now - since >= seconds();
    }
}
