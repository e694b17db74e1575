package dev.ebullient.ensemble.model;

import java.util.List;
import java.util.Map;

public record SceneView(
        String sceneId,
        List<String> availableCharacters,
        List<String> activeCharacters,
        List<String> absentCharacters,
        Map<String, CharacterRecord> characters,
        Map<String, TemporaryTask> tasks) {
}
