package org.gsicoach.insight;

/** Coarse team fight readiness derived from the readiness score. */
public enum ReadinessTier {
    EXCELLENT("Excellent! All systems ready for team fight."),
    GOOD("Good. Most resources available."),
    CAUTION("Caution advised. Limited resources."),
    NOT_READY("Not ready for team fight. Consider retreating.");

    private final String advice;

    ReadinessTier(String advice) {
        this.advice = advice;
    }

    public String advice() {
        return advice;
    }

    public static ReadinessTier of(int score) {
        if (score >= 4) return EXCELLENT;
        if (score >= 2) return GOOD;
        if (score >= 0) return CAUTION;
        return NOT_READY;
    }
}
