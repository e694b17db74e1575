package dev.ebullient.ensemble;

import java.time.Duration;

/**
 * Tunables for the narrative pass.
 *
 * @param driftProbability chance per pass that one character drifts on its own
 * @param driftMinAbsence how long an absent character stays away before drift can bring it back
 * @param taskMinDuration lower bound for a temporary task (inclusive)
 * @param taskMaxDuration upper bound for a temporary task (exclusive)
 */
public record TrackerSettings(
        double driftProbability,
        Duration driftMinAbsence,
        Duration taskMinDuration,
        Duration taskMaxDuration) {

    public TrackerSettings {
        if (driftProbability < 0 || driftProbability > 1) {
            throw new IllegalArgumentException("Drift probability must be 0-1, got " + driftProbability);
        }
        if (taskMaxDuration.compareTo(taskMinDuration) <= 0) {
            throw new IllegalArgumentException(
                    "Task max duration (%s) must exceed min duration (%s)".formatted(taskMaxDuration, taskMinDuration));
        }
    }

    public static TrackerSettings defaults() {
        return new TrackerSettings(0.05, Duration.ofMinutes(10), Duration.ofMinutes(2), Duration.ofMinutes(7));
    }

    public TrackerSettings withDriftProbability(double probability) {
        return new TrackerSettings(probability, driftMinAbsence, taskMinDuration, taskMaxDuration);
    }
}
