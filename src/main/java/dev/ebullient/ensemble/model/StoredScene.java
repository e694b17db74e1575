package dev.ebullient.ensemble.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What is written to disk for one scene: the character directory it was opened
 * with, and the tracked state.
 */
public record StoredScene(
        Map<String, CharacterProfile> directory,
        SceneSnapshot snapshot) {

    public StoredScene {
        directory = directory == null ? Map.of() : new LinkedHashMap<>(directory);
    }
}
