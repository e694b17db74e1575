package dev.ebullient.ensemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.ensemble.model.CharacterProfile;

class SceneDescriberTest {

    SceneState scene;

    @BeforeEach
    void setUp() {
        Map<String, CharacterProfile> directory = new LinkedHashMap<>();
        directory.put("ava", new CharacterProfile("Ava", "curious", "A tall woman with ink-stained fingers.", null, false));
        directory.put("ben", CharacterProfile.named("Ben"));
        scene = SceneState.create(directory, 0L);
    }

    @Test
    void describeCharacters_defaultsOnlyShowPosture() {
        String text = SceneDescriber.describeCharacters(scene);

        assertEquals("""
                Ava:
                A tall woman with ink-stained fingers. (Currently standing)

                Ben:
                (Currently standing)""", text);
    }

    @Test
    void describeCharacters_physicalDetails() {
        scene.update("ava", r -> r.withPosition("sitting", 1L)
                .withItem("quill", "took quill", 1L)
                .withEmotionalState("happy", 1L));

        String text = SceneDescriber.describeCharacters(scene);

        assertTrue(text.contains("(Currently sitting | Holding: quill | Mood: happy | Last action: took quill)"), text);
    }

    @Test
    void describeCharacters_absentLeftOut() {
        scene.depart("ben", "away", "garden", null, 1L);

        assertFalse(SceneDescriber.describeCharacters(scene).contains("Ben"));
    }

    @Test
    void describeScene_locationAndActivities() {
        scene.update("ava", r -> r.withLocation("library").withItem("quill", "took quill", 1L));
        scene.update("ben", r -> r.withInteraction("Ava", "smiled at Ava", 1L));

        assertEquals("Current scene: Characters are in the library. "
                + "Ava is standing while holding quill. Ben is standing and interacting with Ava.",
                SceneDescriber.describeScene(scene));
    }

    @Test
    void describeScene_emptyWhenNobodyPresent() {
        scene.depart("ava", "away", "garden", null, 1L);
        scene.depart("ben", "away", "garden", null, 1L);

        assertEquals("", SceneDescriber.describeScene(scene));
    }
}
