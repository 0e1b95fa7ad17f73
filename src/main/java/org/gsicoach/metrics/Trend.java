package org.gsicoach.metrics;

/**
 * Direction of the latest sample relative to the mean of the retained samples,
 * using fixed absolute thresholds.
 */
public enum Trend {
    UP_SIGNIFICANTLY("trending up significantly!"),
    UP("trending up"),
    FLAT("holding steady"),
    DOWN("trending down"),
    DOWN_SIGNIFICANTLY("trending down significantly");

    public static final double SIGNIFICANT = 100.0;
    public static final double MILD = 20.0;

    private final String phrase;

    Trend(String phrase) {
        this.phrase = phrase;
    }

    public String phrase() {
        return phrase;
    }

    public static Trend classify(double latest, double mean) {
        double diff = latest - mean;
        if (diff >= SIGNIFICANT) return UP_SIGNIFICANTLY;
        if (diff >= MILD) return UP;
        if (diff <= -SIGNIFICANT) return DOWN_SIGNIFICANTLY;
        if (diff <= -MILD) return DOWN;
        return FLAT;
    }
}
