package dev.ebullient.ensemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.CharacterRecord;
import dev.ebullient.ensemble.model.PresenceState;
import dev.ebullient.ensemble.model.SceneSnapshot;
import dev.ebullient.ensemble.model.TemporaryTask;

class SceneStateTest {

    static Map<String, CharacterProfile> directory() {
        Map<String, CharacterProfile> directory = new LinkedHashMap<>();
        directory.put("ava", CharacterProfile.named("Ava"));
        directory.put("ben", CharacterProfile.named("Ben"));
        directory.put("cid", new CharacterProfile("Cid", null, null, null, true));
        return directory;
    }

    SceneState scene;

    @BeforeEach
    void setUp() {
        scene = SceneState.create(directory(), 1000L);
    }

    @Test
    void create_defaultsForNonRemovedCharacters() {
        assertEquals(List.of("ava", "ben"), scene.getAvailableCharacters());
        assertEquals(List.of("ava", "ben"), scene.getActiveCharacters());
        assertFalse(scene.records().containsKey("cid"));

        CharacterRecord ava = scene.record("ava");
        assertTrue(ava.present());
        assertEquals("conversing", ava.activity());
        assertEquals("main area", ava.location());
        assertEquals("standing", ava.position());
        assertEquals("neutral", ava.emotionalState());
        assertTrue(ava.holdingItems().isEmpty());
        assertEquals(1000L, ava.lastSeen());
    }

    @Test
    void record_unknownIdIsCallerError() {
        assertThrows(IllegalArgumentException.class, () -> scene.record("nobody"));
    }

    @Test
    void resolveName_caseInsensitiveAndNeverRemoved() {
        assertEquals(Optional.of("ava"), scene.resolveName("AVA"));
        assertEquals(Optional.of("ben"), scene.resolveName(" ben "));
        assertTrue(scene.resolveName("Cid").isEmpty());
        assertTrue(scene.resolveName("").isEmpty());
    }

    @Test
    void depart_updatesPresenceTaskAndViewsTogether() {
        List<String> before = scene.getActiveCharacters();
        long generation = scene.generation();

        TemporaryTask task = new TemporaryTask("fetch water", 2000L, 60_000L);
        scene.depart("ava", "fetch water", "kitchen", task, 2000L);

        assertTrue(scene.generation() > generation);
        assertEquals(List.of("ava", "ben"), before);
        assertEquals(List.of("ben"), scene.getActiveCharacters());
        assertEquals(List.of("ava"), scene.getAbsentCharacters());
        assertEquals(PresenceState.ABSENT_TIMED, scene.presenceState("ava"));
        assertEquals(Optional.of(task), scene.task("ava"));
        assertEquals(List.of("Ava (fetch water at kitchen)"), scene.getAbsentCharactersSummary());
    }

    @Test
    void depart_withoutTaskIsOpenEnded() {
        scene.depart("ava", "away", "another location", null, 2000L);
        assertEquals(PresenceState.ABSENT_OPEN, scene.presenceState("ava"));
        assertTrue(scene.tasks().isEmpty());
    }

    @Test
    void arrive_clearsTaskAndJoinsSceneLocation() {
        scene.update("ben", r -> r.withLocation("tavern"));
        scene.depart("ava", "fetch water", "kitchen", new TemporaryTask("fetch water", 2000L, 1L), 2000L);

        CharacterRecord ava = scene.arrive("ava", "returning", 5000L);

        assertTrue(ava.present());
        assertEquals("returning", ava.activity());
        assertEquals("tavern", ava.location());
        assertEquals(5000L, ava.lastSeen());
        assertTrue(scene.task("ava").isEmpty());
        assertEquals(PresenceState.PRESENT, scene.presenceState("ava"));
    }

    @Test
    void update_rejectsPresenceChange() {
        assertThrows(IllegalArgumentException.class,
                () -> scene.update("ava", r -> r.withPresence(false, "away", 2000L)));
        assertTrue(scene.record("ava").present());
    }

    @Test
    void update_invalidatesCachedViews() {
        List<String> first = scene.getActiveCharacters();
        assertSame(first, scene.getActiveCharacters());

        scene.update("ava", r -> r.withPosition("sitting", 2000L));

        assertNotSame(first, scene.getActiveCharacters());
        assertEquals(first, scene.getActiveCharacters());
    }

    @Test
    void clearTask_keepsCharacterAway() {
        scene.depart("ava", "fetch water", "kitchen", new TemporaryTask("fetch water", 2000L, 60_000L), 2000L);

        scene.clearTask("ava");

        assertEquals(PresenceState.ABSENT_OPEN, scene.presenceState("ava"));
        assertFalse(scene.record("ava").present());
    }

    @Test
    void absentSummary_fallbacks() {
        scene.depart("ava", "", null, null, 2000L);
        assertEquals(List.of("Ava (away at unknown location)"), scene.getAbsentCharactersSummary());
    }

    @Test
    void refreshDirectory_addsNewAndRemovesMissing() {
        Map<String, CharacterProfile> updated = new LinkedHashMap<>();
        updated.put("ben", CharacterProfile.named("Ben"));
        updated.put("dee", CharacterProfile.named("Dee"));

        scene.refreshDirectory(updated, 3000L);

        assertEquals(List.of("ben", "dee"), scene.getAvailableCharacters());
        assertEquals(3000L, scene.record("dee").lastSeen());
        assertTrue(scene.resolveName("Ava").isEmpty());
        assertTrue(scene.profile("ava").removed());
    }

    @Test
    void restore_repairsInvariants() {
        CharacterRecord awayAva = CharacterRecord.defaults(500L).withPresence(false, "away", 500L);
        SceneSnapshot snapshot = new SceneSnapshot(SceneSnapshot.CURRENT_VERSION,
                Map.of("ava", awayAva, "ghost", CharacterRecord.defaults(500L)),
                Map.of("ava", new TemporaryTask("errand", 500L, 10L),
                        "ben", new TemporaryTask("errand", 500L, 10L)));

        SceneState restored = SceneState.restore(directory(), snapshot, 2000L);

        assertFalse(restored.record("ava").present());
        assertTrue(restored.task("ava").isPresent());
        // ben had no record: created present, so the task is dropped
        assertTrue(restored.record("ben").present());
        assertTrue(restored.task("ben").isEmpty());
        assertFalse(restored.records().containsKey("ghost"));
    }

    @Test
    void snapshot_roundTrip() {
        scene.depart("ava", "fetch water", "kitchen", new TemporaryTask("fetch water", 2000L, 60_000L), 2000L);
        scene.update("ben", r -> r.withItem("mug", "took mug", 2000L));

        SceneState copy = SceneState.restore(directory(), scene.snapshot(), 9000L);

        assertEquals(scene.records(), copy.records());
        assertEquals(scene.tasks(), copy.tasks());
    }
}
