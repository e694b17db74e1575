package dev.ebullient.ensemble.model;

/**
 * A timed absence. The character comes back on the first narrative pass
 * that runs after {@code startTime + durationMillis}.
 */
public record TemporaryTask(
        String label,
        long startTime,
        long durationMillis) {

    public TemporaryTask {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got " + durationMillis);
        }
    }

    public boolean isDue(long now) {
        return now - startTime >= durationMillis;
    }
}
