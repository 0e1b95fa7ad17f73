package org.gsicoach.insight;

/** Match phase by game clock: early below 10 minutes, mid below 25, late after. */
public enum GamePhase {
    EARLY("Early Game Phase:"),
    MID("Mid Game Phase:"),
    LATE("Late Game Phase:");

    static final int MID_FROM_MINUTE = 10;
    static final int LATE_FROM_MINUTE = 25;

    private final String heading;

    GamePhase(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }

    public static GamePhase at(int gameClock) {
        int minutes = gameClock / 60;
        if (minutes < MID_FROM_MINUTE) return EARLY;
        if (minutes < LATE_FROM_MINUTE) return MID;
        return LATE;
    }
}
