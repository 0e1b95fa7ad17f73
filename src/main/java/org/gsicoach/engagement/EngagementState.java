package org.gsicoach.engagement;

/** Fight classifier states. */
public enum EngagementState {
    CALM,
    ENGAGED
}
