package dev.ebullient.ensemble.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.ensemble.SceneState;
import dev.ebullient.ensemble.model.CharacterProfile;

class SceneDirectionsTest {

    SceneState scene;

    @BeforeEach
    void setUp() {
        Map<String, CharacterProfile> directory = new LinkedHashMap<>();
        directory.put("ava", CharacterProfile.named("Ava"));
        directory.put("ben", CharacterProfile.named("Ben"));
        directory.put("cid", CharacterProfile.named("Cid"));
        scene = SceneState.create(directory, 0L);
    }

    @Test
    void from_listsAddressedAndAbsentCharacters() {
        scene.depart("cid", "fetch water", "well", null, 1L);

        SceneDirections directions = SceneDirections.from(scene, "Ben, could you pass the bread?");

        assertEquals("Ben", directions.addressed());
        assertEquals("Cid (fetch water at well)", directions.absent());
        assertTrue(directions.characters().contains("Ava:"));
        assertFalse(directions.characters().contains("Cid:"));
        assertTrue(directions.scene().startsWith("Current scene: Characters are in the main area."));
        assertEquals("", directions.reminder());
    }

    @Test
    void from_nothingToReport() {
        SceneDirections directions = SceneDirections.from(scene, "Hello everyone.");

        assertEquals(SceneDirections.NONE, directions.addressed());
        assertEquals(SceneDirections.NONE, directions.absent());
    }

    @Test
    void withViolators_addsReminder() {
        SceneDirections directions = SceneDirections.from(scene, "Hi").withViolators(List.of("Cid"));

        assertEquals("Your previous reply included Cid, who is not in the scene. Leave them out entirely.",
                directions.reminder());
    }
}
