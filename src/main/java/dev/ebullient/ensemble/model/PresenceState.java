package dev.ebullient.ensemble.model;

public enum PresenceState {
    PRESENT,
    /** Away with no expected return time */
    ABSENT_OPEN,
    /** Away on a temporary task; returns when the task expires */
    ABSENT_TIMED
}
