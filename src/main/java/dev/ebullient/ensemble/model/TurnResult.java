package dev.ebullient.ensemble.model;

/**
 * Everything one turn produced.
 *
 * @param inbound what the user's message changed
 * @param review the cleaned narration and what it changed
 * @param html the cleaned narration rendered for display
 * @param regenerated true if the first narration was discarded because absent characters appeared in it
 */
public record TurnResult(
        String sceneId,
        ExtractionSummary inbound,
        ReviewResult review,
        String html,
        boolean regenerated) {
}
