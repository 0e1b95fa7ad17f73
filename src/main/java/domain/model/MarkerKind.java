package domain.model;

/**
 * Classification of a minimap marker. Only {@link #ENEMY_HERO_ICON} is relevant
 * to opponent tracking; everything else the client draws is {@link #OTHER}.
 */
public enum MarkerKind {
    ENEMY_HERO_ICON("minimap_enemyicon"),
    OTHER("");

    private final String imageTag;

    MarkerKind(String imageTag) {
        this.imageTag = imageTag;
    }

    public String imageTag() {
        return imageTag;
    }

    /** Maps the client's image tag to a kind; unknown or missing tags are {@link #OTHER}. */
    public static MarkerKind fromImageTag(String tag) {
        if (ENEMY_HERO_ICON.imageTag.equals(tag)) {
            return ENEMY_HERO_ICON;
        }
        return OTHER;
    }
}
