package org.gsicoach.engagement;

import java.util.Optional;

/**
 * Answer of {@link EngagementDetector#statusAt(int)}.
 *
 * @param level          what is going on right now
 * @param elapsedSeconds seconds since the engagement started; 0 unless {@link Level#ENGAGED}
 * @param recentEvents   events in the window the level was judged on
 */
public record EngagementStatus(Level level, int elapsedSeconds, int recentEvents) {

    public enum Level {
        /** Nothing notable. */
        QUIET,
        /** Calm, but at least two deaths in the last minute. */
        SKIRMISH,
        /** A team fight is in progress. */
        ENGAGED
    }

    public static EngagementStatus quiet(int recentEvents) {
        return new EngagementStatus(Level.QUIET, 0, recentEvents);
    }

    public Optional<String> advisory() {
        switch (level) {
            case ENGAGED:
                return Optional.of("TEAM FIGHT IN PROGRESS! Started " + elapsedSeconds + " seconds ago");
            case SKIRMISH:
                return Optional.of("Skirmishes detected - team fight may be developing!");
            default:
                return Optional.empty();
        }
    }
}
