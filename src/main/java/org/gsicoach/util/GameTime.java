package org.gsicoach.util;

import java.util.Optional;

/** Game clock formatting helpers. */
public final class GameTime {

    private GameTime() {}

    /** Formats seconds as {@code m:ss}; negative clocks (pre-horn) keep their sign. */
    public static String format(int seconds) {
        String sign = seconds < 0 ? "-" : "";
        int abs = Math.abs(seconds);
        return sign + (abs / 60) + ":" + String.format("%02d", abs % 60);
    }

    public static String format(Optional<Integer> seconds) {
        return seconds.map(GameTime::format).orElse("Unknown");
    }

    /** Whole minutes elapsed; 0 for negative clocks. */
    public static int minutes(int seconds) {
        return Math.max(0, seconds) / 60;
    }
}
