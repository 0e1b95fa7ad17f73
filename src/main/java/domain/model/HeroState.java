package domain.model;

import java.util.Optional;

/** The local hero as seen in one snapshot. */
public final class HeroState {
    private final String name;
    private final Boolean alive;
    private final Integer healthPercent;
    private final Integer manaPercent;
    private final Integer buybackCost;
    private final Integer xpos;
    private final Integer ypos;

    private HeroState(Builder b) {
        this.name = b.name;
        this.alive = b.alive;
        this.healthPercent = b.healthPercent;
        this.manaPercent = b.manaPercent;
        this.buybackCost = b.buybackCost;
        this.xpos = b.xpos;
        this.ypos = b.ypos;
    }

    public static Builder builder() { return new Builder(); }

    public Optional<String> getName() { return Optional.ofNullable(name); }
    public Optional<Boolean> getAlive() { return Optional.ofNullable(alive); }
    public Optional<Integer> getHealthPercent() { return Optional.ofNullable(healthPercent); }
    public Optional<Integer> getManaPercent() { return Optional.ofNullable(manaPercent); }
    public Optional<Integer> getBuybackCost() { return Optional.ofNullable(buybackCost); }

    /** Hero position, present only when both coordinates were reported. */
    public Optional<Position> getPosition() {
        if (xpos == null || ypos == null) return Optional.empty();
        return Optional.of(new Position(xpos, ypos));
    }

    public static final class Builder {
        private String name;
        private Boolean alive;
        private Integer healthPercent;
        private Integer manaPercent;
        private Integer buybackCost;
        private Integer xpos;
        private Integer ypos;

        private Builder() {}

        public Builder name(String v) { this.name = v; return this; }
        public Builder alive(Boolean v) { this.alive = v; return this; }
        public Builder healthPercent(Integer v) { this.healthPercent = v; return this; }
        public Builder manaPercent(Integer v) { this.manaPercent = v; return this; }
        public Builder buybackCost(Integer v) { this.buybackCost = v; return this; }
        public Builder position(Integer x, Integer y) { this.xpos = x; this.ypos = y; return this; }

        public HeroState build() { return new HeroState(this); }
    }
}
