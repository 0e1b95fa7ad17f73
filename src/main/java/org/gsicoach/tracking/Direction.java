package org.gsicoach.tracking;

/** Dominant cardinal direction of a displacement on the map (y grows north). */
public enum Direction {
    NORTH("North"),
    SOUTH("South"),
    EAST("East"),
    WEST("West");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies a displacement by its larger axis; equal magnitudes go to the
     * horizontal axis. Returns null for a zero displacement.
     */
    static Direction of(int dx, int dy) {
        if (dx == 0 && dy == 0) return null;
        if (Math.abs(dx) >= Math.abs(dy)) {
            return dx > 0 ? EAST : WEST;
        }
        return dy > 0 ? NORTH : SOUTH;
    }
}
