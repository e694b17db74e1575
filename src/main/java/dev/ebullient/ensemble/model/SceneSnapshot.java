package dev.ebullient.ensemble.model;

import java.util.Map;

/**
 * Serializable form of a scene, round-tripped by the host between turns.
 */
public record SceneSnapshot(
        int version,
        Map<String, CharacterRecord> characters,
        Map<String, TemporaryTask> tasks) {

    public static final int CURRENT_VERSION = 1;

    public SceneSnapshot {
        characters = characters == null ? Map.of() : Map.copyOf(characters);
        tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
    }
}
