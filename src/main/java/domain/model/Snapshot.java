package domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Whole-match state at one instant, as delivered by the ingestion boundary.
 * Immutable: collections are copied on build and exposed read-only.
 */
public final class Snapshot {
    private final int gameClock;
    private final String matchId;
    private final PlayerState player;
    private final HeroState hero;
    private final Map<String, AbilityState> abilities;
    private final Map<String, VisibleEntity> minimap;
    private final Map<String, Map<String, BuildingState>> buildings;

    private Snapshot(Builder b) {
        this.gameClock = b.gameClock;
        this.matchId = b.matchId;
        this.player = b.player;
        this.hero = b.hero;
        this.abilities = Collections.unmodifiableMap(new LinkedHashMap<>(b.abilities));
        this.minimap = Collections.unmodifiableMap(new LinkedHashMap<>(b.minimap));
        Map<String, Map<String, BuildingState>> teams = new LinkedHashMap<>();
        b.buildings.forEach((team, byName) ->
                teams.put(team, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.buildings = Collections.unmodifiableMap(teams);
    }

    public static Builder builder() { return new Builder(); }

    /** In-match elapsed seconds; 0 when the client did not report a clock. */
    public int getGameClock() { return gameClock; }

    public Optional<String> getMatchId() { return Optional.ofNullable(matchId); }
    public Optional<PlayerState> getPlayer() { return Optional.ofNullable(player); }
    public Optional<HeroState> getHero() { return Optional.ofNullable(hero); }

    /** Abilities keyed by slot (ability0, ability1, ...); empty when unknown. */
    public Map<String, AbilityState> getAbilities() { return abilities; }

    /** Minimap markers keyed by marker id; empty when unknown. */
    public Map<String, VisibleEntity> getMinimap() { return minimap; }

    /** Buildings keyed by team ("radiant"/"dire") then building name; empty when unknown. */
    public Map<String, Map<String, BuildingState>> getBuildings() { return buildings; }

    /** Local hero position, when both the hero block and its coordinates are present. */
    public Optional<Position> heroPosition() {
        return getHero().flatMap(HeroState::getPosition);
    }

    /** Minimap team id of the opposing side, see {@link PlayerState#enemyTeamIdFor}. */
    public int enemyTeamId() {
        return PlayerState.enemyTeamIdFor(getPlayer().flatMap(PlayerState::getTeamName));
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "gameClock=" + gameClock +
                ", matchId='" + matchId + '\'' +
                ", minimap=" + minimap.size() +
                ", abilities=" + abilities.size() +
                '}';
    }

    public static final class Builder {
        private int gameClock;
        private String matchId;
        private PlayerState player;
        private HeroState hero;
        private final Map<String, AbilityState> abilities = new LinkedHashMap<>();
        private final Map<String, VisibleEntity> minimap = new LinkedHashMap<>();
        private final Map<String, Map<String, BuildingState>> buildings = new LinkedHashMap<>();

        private Builder() {}

        public Builder gameClock(int v) { this.gameClock = v; return this; }
        public Builder matchId(String v) { this.matchId = v; return this; }
        public Builder player(PlayerState v) { this.player = v; return this; }
        public Builder hero(HeroState v) { this.hero = v; return this; }

        public Builder ability(String slot, AbilityState v) {
            abilities.put(slot, v);
            return this;
        }

        public Builder marker(String id, VisibleEntity v) {
            minimap.put(id, v);
            return this;
        }

        public Builder building(String team, String name, BuildingState v) {
            buildings.computeIfAbsent(team, k -> new LinkedHashMap<>()).put(name, v);
            return this;
        }

        public Snapshot build() { return new Snapshot(this); }
    }
}
