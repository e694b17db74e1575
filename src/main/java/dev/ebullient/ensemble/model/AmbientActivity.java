package dev.ebullient.ensemble.model;

import java.util.List;
import java.util.Locale;

/**
 * Things a character may be found doing when nothing in the narrative says otherwise.
 */
public enum AmbientActivity {
    EXPLORE(List.of("scouting the horizon", "pacing the edge", "searching the shadows")),
    INTERACT(List.of("chatting with a stranger", "trading a quick word", "gesturing animatedly")),
    REST(List.of("leaning against a wall", "sitting in thought", "watching the scene")),
    WORK(List.of("sharpening a tool", "sketching a map", "mending a tear"));

    private final List<String> activities;

    AmbientActivity(List<String> activities) {
        this.activities = activities;
    }

    public List<String> activities() {
        return activities;
    }

    /**
     * Pick the category from profile keywords. Later checks override earlier ones,
     * so a crafty, quiet character works.
     */
    public static AmbientActivity forProfile(CharacterProfile profile) {
        String description = lower(profile.description());
        String personality = lower(profile.personality());
        String scenario = lower(profile.scenario());

        AmbientActivity category = EXPLORE;
        if (description.contains("social") || personality.contains("friendly")) {
            category = INTERACT;
        }
        if (description.contains("calm") || personality.contains("quiet")) {
            category = REST;
        }
        if (description.contains("craft") || scenario.contains("camp")) {
            category = WORK;
        }
        return category;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
