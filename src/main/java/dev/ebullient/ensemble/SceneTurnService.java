package dev.ebullient.ensemble;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import dev.ebullient.ensemble.chat.NarrativeRenderer;
import dev.ebullient.ensemble.chat.SceneDirections;
import dev.ebullient.ensemble.chat.SceneMemoryProvider;
import dev.ebullient.ensemble.chat.SceneNarrator;
import dev.ebullient.ensemble.model.EnforcementResult;
import dev.ebullient.ensemble.model.ExtractionSummary;
import dev.ebullient.ensemble.model.ReviewResult;
import dev.ebullient.ensemble.model.TurnResult;
import io.quarkus.logging.Log;

/**
 * Runs one turn of a scene: the user's message updates the scene, the narrator
 * writes the next part, and the cleaned narration updates the scene again.
 * <p>
 * The narrator is called outside the scene lock; two turns on the same scene
 * may therefore both be generated from the same state.
 */
@ApplicationScoped
public class SceneTurnService {

    @Inject
    SceneService scenes;

    @Inject
    SceneNarrator narrator;

    @Inject
    SceneMemoryProvider memoryProvider;

    @Inject
    NarrativeRenderer renderer;

    @ConfigProperty(name = "ensemble.turn.regenerate-on-violation", defaultValue = "true")
    boolean regenerateOnViolation;

    public TurnResult takeTurn(String sceneId, String userMessage) {
        ExtractionSummary inbound = scenes.ingest(sceneId, userMessage);
        SceneDirections directions = scenes.withScene(sceneId, scene -> SceneDirections.from(scene, userMessage));

        String narration = narrate(sceneId, directions, userMessage);
        boolean regenerated = false;

        EnforcementResult check = scenes.enforce(sceneId, narration);
        if (check.violationsFound() && regenerateOnViolation) {
            Log.warnf("Scene %s: narration included absent characters %s; asking again",
                    sceneId, check.violatingCharacters());
            narration = narrate(sceneId, directions.withViolators(check.violatingCharacters()), userMessage);
            regenerated = true;
        }

        ReviewResult review = scenes.review(sceneId, narration);
        if (review.enforcement().violationsFound()) {
            Log.warnf("Scene %s: keeping narration with absent characters %s",
                    sceneId, review.enforcement().violatingCharacters());
        }
        return new TurnResult(sceneId, inbound, review,
                renderer.toHtml(review.enforcement().cleanedText()), regenerated);
    }

    /**
     * Forget the narrator's conversation history for a scene.
     */
    public void forget(String sceneId) {
        memoryProvider.clear(sceneId);
    }

    private String narrate(String sceneId, SceneDirections directions, String userMessage) {
        return narrator.narrate(sceneId,
                directions.characters(),
                directions.scene(),
                directions.absent(),
                directions.addressed(),
                directions.reminder(),
                userMessage);
    }
}
