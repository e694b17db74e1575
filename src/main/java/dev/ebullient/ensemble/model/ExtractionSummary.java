package dev.ebullient.ensemble.model;

import java.util.List;

/**
 * Outcome of one narrative pass: which characters were updated, and which of
 * those changed presence.
 */
public record ExtractionSummary(
        List<String> updatedCharacters,
        List<String> departed,
        List<String> returned) {

    public static final ExtractionSummary EMPTY = new ExtractionSummary(List.of(), List.of(), List.of());

    public ExtractionSummary {
        updatedCharacters = updatedCharacters == null ? List.of() : List.copyOf(updatedCharacters);
        departed = departed == null ? List.of() : List.copyOf(departed);
        returned = returned == null ? List.of() : List.copyOf(returned);
    }

    public boolean changed() {
        return !updatedCharacters.isEmpty();
    }
}
