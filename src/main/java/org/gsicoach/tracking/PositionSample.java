package org.gsicoach.tracking;

import domain.model.Position;

/** One observation of a hero: where it was at a given game clock. */
public record PositionSample(int gameClock, Position position) {}
