package org.gsicoach.tracking;

import domain.model.Position;

/** Extrapolated position of a hero at the query clock. */
public record Prediction(String name, Position position) {

    public String describe() {
        return name + " likely at " + position;
    }
}
