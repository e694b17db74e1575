package dev.ebullient.ensemble;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.CharacterRecord;

/**
 * Read-only renderings of a scene, used when assembling directions for the narrator.
 */
public class SceneDescriber {

    private SceneDescriber() {
    }

    /**
     * Describe each present character: name, profile description and any
     * physical details that differ from the defaults.
     *
     * <pre>
     * Ava:
     * A tall woman with ink-stained fingers. (Currently sitting | Holding: cup | Mood: happy)
     * </pre>
     */
    public static String describeCharacters(SceneState scene) {
        return scene.getActiveCharacters().stream()
                .map(id -> describeCharacter(scene.profile(id), scene.record(id), scene.displayName(id)))
                .collect(Collectors.joining("\n\n"));
    }

    static String describeCharacter(CharacterProfile profile, CharacterRecord record, String name) {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(":\n");
        if (!StringUtils.isBlank(profile.description())) {
            sb.append(profile.description().trim());
        }

        List<String> details = new ArrayList<>();
        if (!StringUtils.isBlank(record.position())) {
            details.add("Currently " + record.position());
        }
        if (!record.holdingItems().isEmpty()) {
            details.add("Holding: " + String.join(", ", record.holdingItems()));
        }
        if (notDefault(record.activity(), CharacterRecord.DEFAULT_ACTIVITY)) {
            details.add("Activity: " + record.activity());
        }
        if (notDefault(record.emotionalState(), CharacterRecord.DEFAULT_MOOD)) {
            details.add("Mood: " + record.emotionalState());
        }
        if (!StringUtils.isBlank(record.interactingWith())) {
            details.add("Interacting with: " + record.interactingWith());
        }
        if (notDefault(record.lastAction(), CharacterRecord.DEFAULT_ACTIVITY)) {
            details.add("Last action: " + record.lastAction());
        }
        if (!details.isEmpty()) {
            if (!StringUtils.isBlank(profile.description())) {
                sb.append(' ');
            }
            sb.append('(').append(String.join(" | ", details)).append(')');
        }
        return sb.toString().trim();
    }

    /**
     * One paragraph describing where the present characters are and what they are doing.
     * Empty when nobody is present.
     */
    public static String describeScene(SceneState scene) {
        List<String> active = scene.getActiveCharacters();
        if (active.isEmpty()) {
            return "";
        }
        String location = StringUtils.firstNonBlank(scene.record(active.get(0)).location(),
                CharacterRecord.DEFAULT_LOCATION);

        List<String> sentences = new ArrayList<>();
        for (String id : active) {
            CharacterRecord record = scene.record(id);
            StringBuilder sb = new StringBuilder();
            sb.append(scene.displayName(id)).append(" is ")
                    .append(StringUtils.firstNonBlank(record.position(), "present"));
            if (notDefault(record.activity(), CharacterRecord.DEFAULT_ACTIVITY)) {
                sb.append(" and ").append(record.activity());
            }
            if (!record.holdingItems().isEmpty()) {
                sb.append(" while holding ").append(String.join(", ", record.holdingItems()));
            }
            if (!StringUtils.isBlank(record.interactingWith())) {
                sb.append(" and interacting with ").append(record.interactingWith());
            }
            sentences.add(sb.toString());
        }
        return "Current scene: Characters are in the " + location + ". " + String.join(". ", sentences) + ".";
    }

    private static boolean notDefault(String value, String defaultValue) {
        return !StringUtils.isBlank(value) && !value.equals(defaultValue);
    }
}
