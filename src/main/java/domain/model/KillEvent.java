package domain.model;

/**
 * A discrete combat event derived by diffing two consecutive snapshots.
 *
 * @param gameClock clock of the snapshot in which the change was observed
 * @param kind      death of the local hero, or an elimination credited to the local player
 * @param subject   who the event is about (local hero name or "player")
 * @param victim    who died
 */
public record KillEvent(int gameClock, Kind kind, String subject, String victim) {

    public enum Kind { DEATH, ELIMINATION }
}
