package org.gsicoach.tracking;

import domain.model.Position;

import java.util.Optional;

/**
 * Summary of a recently seen hero.
 *
 * @param name         display name
 * @param secondsAgo   game seconds since the latest sample
 * @param lastPosition position of the latest sample
 * @param lastSeenAt   game clock of the latest sample
 * @param timesSpotted number of snapshots the hero appeared in
 * @param heading      dominant direction of the last displacement; null with a single
 *                     sample or when the hero did not move
 * @param moved        whether two samples were available to judge movement
 */
public record MovementDescription(String name,
                                  int secondsAgo,
                                  Position lastPosition,
                                  int lastSeenAt,
                                  int timesSpotted,
                                  Direction heading,
                                  boolean moved) {

    public Optional<Direction> direction() {
        return Optional.ofNullable(heading);
    }

    /** Human readable line, e.g. {@code Axe: last seen 4 seconds ago at (120, -300)}. */
    public String describe() {
        return name + ": last seen " + secondsAgo + " seconds ago at " + lastPosition;
    }

    /** Second line about movement, present only when two samples exist. */
    public Optional<String> movementLine() {
        if (!moved) return Optional.empty();
        return Optional.of(heading == null ? "holding position" : "moving " + heading.label());
    }
}
