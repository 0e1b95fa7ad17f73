package domain.model;

import java.util.Objects;
import java.util.Optional;

/** One minimap marker observed in a snapshot. */
public final class VisibleEntity {
    private final String name;      // unit name, e.g. npc_dota_hero_axe (may be null)
    private final int team;
    private final Position position;
    private final MarkerKind kind;

    public VisibleEntity(String name, int team, Position position, MarkerKind kind) {
        this.name = name;
        this.team = team;
        this.position = Objects.requireNonNull(position, "position");
        this.kind = kind == null ? MarkerKind.OTHER : kind;
    }

    public Optional<String> getName() { return Optional.ofNullable(name); }
    public int getTeam() { return team; }
    public Position getPosition() { return position; }
    public MarkerKind getKind() { return kind; }

    /** True when this marker is a hero icon of the given team. */
    public boolean isHostileHeroOf(int enemyTeamId) {
        return kind == MarkerKind.ENEMY_HERO_ICON && team == enemyTeamId;
    }

    @Override
    public String toString() {
        return "VisibleEntity{" +
                "name='" + name + '\'' +
                ", team=" + team +
                ", position=" + position +
                ", kind=" + kind +
                '}';
    }
}
