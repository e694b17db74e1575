package dev.ebullient.ensemble.chat;

import java.util.List;

import dev.ebullient.ensemble.SceneDescriber;
import dev.ebullient.ensemble.SceneState;
import dev.ebullient.ensemble.StringUtils;

/**
 * Scene state rendered for the narrator: who is here and what they are doing,
 * who is away, and who the user spoke to.
 */
public record SceneDirections(
        String characters,
        String scene,
        String absent,
        String addressed,
        String reminder) {

    static final String NONE = "(none)";

    /**
     * Read directions from the current scene state. Call while holding the scene lock.
     */
    public static SceneDirections from(SceneState scene, String userMessage) {
        List<String> absent = scene.getAbsentCharactersSummary();
        List<String> addressed = scene.getActiveCharacters().stream()
                .map(scene::displayName)
                .filter(name -> StringUtils.mentionsName(userMessage, name))
                .toList();

        return new SceneDirections(
                orNone(SceneDescriber.describeCharacters(scene)),
                orNone(SceneDescriber.describeScene(scene)),
                absent.isEmpty() ? NONE : String.join(", ", absent),
                addressed.isEmpty() ? NONE : String.join(", ", addressed),
                "");
    }

    /**
     * Directions for a second attempt after absent characters showed up in the first.
     */
    public SceneDirections withViolators(List<String> violators) {
        String names = String.join(", ", violators);
        return new SceneDirections(characters, scene, absent, addressed,
                "Your previous reply included " + names
                        + ", who " + (violators.size() == 1 ? "is" : "are")
                        + " not in the scene. Leave them out entirely.");
    }

    private static String orNone(String value) {
        return StringUtils.isBlank(value) ? NONE : value;
    }
}
