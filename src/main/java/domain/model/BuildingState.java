package domain.model;

/** Health of one team building. */
public record BuildingState(int health, int maxHealth) {

    /** Health as a whole percentage, 0 when max health is unknown. */
    public int healthPercent() {
        if (maxHealth <= 0) return 0;
        return (int) (health * 100L / maxHealth);
    }
}
