package domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Local player counters from one snapshot. Every counter is optional because the
 * client omits blocks while spectating, in menus, or during hero selection.
 */
public final class PlayerState {
    private final String teamName;
    private final Integer gold;
    private final Integer gpm;
    private final Integer xpm;
    private final Integer lastHits;
    private final Integer deaths;
    private final Integer netWorth;
    private final Map<String, Integer> killList; // null when the client did not send one

    private PlayerState(Builder b) {
        this.teamName = b.teamName;
        this.gold = b.gold;
        this.gpm = b.gpm;
        this.xpm = b.xpm;
        this.lastHits = b.lastHits;
        this.deaths = b.deaths;
        this.netWorth = b.netWorth;
        this.killList = b.killList == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.killList));
    }

    public static Builder builder() { return new Builder(); }

    public Optional<String> getTeamName() { return Optional.ofNullable(teamName); }
    public Optional<Integer> getGold() { return Optional.ofNullable(gold); }
    public Optional<Integer> getGpm() { return Optional.ofNullable(gpm); }
    public Optional<Integer> getXpm() { return Optional.ofNullable(xpm); }
    public Optional<Integer> getLastHits() { return Optional.ofNullable(lastHits); }
    public Optional<Integer> getDeaths() { return Optional.ofNullable(deaths); }
    public Optional<Integer> getNetWorth() { return Optional.ofNullable(netWorth); }

    /** Elimination counters keyed by victim id (e.g. {@code victimid_3}). */
    public Optional<Map<String, Integer>> getKillList() { return Optional.ofNullable(killList); }

    /**
     * Opposing team id on the minimap: 3 (Dire) for a Radiant player, 2 (Radiant)
     * for a Dire player, and 3 when the team is unknown.
     */
    public static int enemyTeamIdFor(Optional<String> teamName) {
        String team = teamName.map(t -> t.toLowerCase(Locale.ROOT)).orElse("");
        return "dire".equals(team) ? 2 : 3;
    }

    public static final class Builder {
        private String teamName;
        private Integer gold;
        private Integer gpm;
        private Integer xpm;
        private Integer lastHits;
        private Integer deaths;
        private Integer netWorth;
        private Map<String, Integer> killList;

        private Builder() {}

        public Builder teamName(String v) { this.teamName = v; return this; }
        public Builder gold(Integer v) { this.gold = v; return this; }
        public Builder gpm(Integer v) { this.gpm = v; return this; }
        public Builder xpm(Integer v) { this.xpm = v; return this; }
        public Builder lastHits(Integer v) { this.lastHits = v; return this; }
        public Builder deaths(Integer v) { this.deaths = v; return this; }
        public Builder netWorth(Integer v) { this.netWorth = v; return this; }
        public Builder killList(Map<String, Integer> v) { this.killList = v; return this; }

        public PlayerState build() { return new PlayerState(this); }
    }
}
