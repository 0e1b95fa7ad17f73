package domain.model;

/**
 * One ability slot of the local hero. Unknown flags are reported as the
 * conservative value: not castable, passive, not an ultimate.
 */
public final class AbilityState {
    private final String name;
    private final int level;
    private final Boolean canCast;
    private final Boolean passive;
    private final Boolean ultimate;

    public AbilityState(String name, int level, Boolean canCast, Boolean passive, Boolean ultimate) {
        this.name = name;
        this.level = level;
        this.canCast = canCast;
        this.passive = passive;
        this.ultimate = ultimate;
    }

    public String getName() { return name; }
    public int getLevel() { return level; }

    public boolean canCast() { return canCast != null && canCast; }

    // missing flag counts as passive so it never blocks the "all abilities ready" check
    public boolean isPassive() { return passive == null || passive; }

    public boolean isUltimate() { return ultimate != null && ultimate; }
}
