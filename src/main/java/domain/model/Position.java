package domain.model;

/** Integer map coordinates as reported by the game client. */
public record Position(int x, int y) {

    /** Euclidean distance to another point, in map units. */
    public double distanceTo(Position other) {
        long dx = (long) x - other.x;
        long dy = (long) y - other.y;
        return Math.sqrt((double) (dx * dx + dy * dy));
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
