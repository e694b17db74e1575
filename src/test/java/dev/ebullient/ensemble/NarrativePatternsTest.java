package dev.ebullient.ensemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import dev.ebullient.ensemble.NarrativePatterns.Category;
import dev.ebullient.ensemble.NarrativePatterns.RuleMatch;

class NarrativePatternsTest {

    private static Optional<RuleMatch> match(Category category, String text) {
        return NarrativePatterns.firstMatch(category, text);
    }

    // --- leave / return ---

    @Test
    void leave_plainExit() {
        RuleMatch m = match(Category.LEAVE, "leaves the room without a word.").orElseThrow();
        assertEquals("leaves", m.token());
        assertNull(m.target());
    }

    @Test
    void leave_capturesDestination() {
        RuleMatch m = match(Category.LEAVE, "heads to the kitchen.").orElseThrow();
        assertEquals("leaves-for-place", m.token());
        assertEquals("kitchen", m.target());
    }

    @Test
    void leave_onErrand() {
        RuleMatch m = match(Category.LEAVE, "goes to fetch some water.").orElseThrow();
        assertEquals("leaves-on-errand", m.token());
    }

    @Test
    void leave_leftHandIsNotALeave() {
        assertTrue(match(Category.LEAVE, "raises her left hand.").isEmpty());
    }

    @Test
    void leave_walkingIntoTheRoomIsNotALeave() {
        assertTrue(match(Category.LEAVE, "walks into the room.").isEmpty());
    }

    @Test
    void return_comesBack() {
        assertTrue(match(Category.RETURN, "comes back with a tray.").isPresent());
        assertTrue(match(Category.RETURN, "joins the group by the fire.").isPresent());
    }

    // --- tasks, purpose, destination ---

    @Test
    void temporaryTask_errandLabel() {
        RuleMatch m = match(Category.TEMPORARY_TASK, "goes to the kitchen to fetch water.").orElseThrow();
        assertEquals("fetch water", m.target());
    }

    @Test
    void temporaryTask_backSoonHasNoLabel() {
        RuleMatch m = match(Category.TEMPORARY_TASK, "I'll be right back!").orElseThrow();
        assertEquals("back-soon", m.token());
        assertNull(m.target());
    }

    @Test
    void purpose_outForAWalk() {
        assertEquals("out for a walk", match(Category.PURPOSE, "steps out for a walk.").orElseThrow().target());
    }

    @Test
    void destination_generic() {
        assertEquals("garden", match(Category.DESTINATION, "slips out into the garden.").orElseThrow().target());
    }

    // --- posture ---

    @Test
    void position_anyTense() {
        assertEquals("sitting", match(Category.POSITION, "sat down heavily.").orElseThrow().token());
        assertEquals("leaning", match(Category.POSITION, "is leaning on the bar.").orElseThrow().token());
        assertEquals("kneeling", match(Category.POSITION, "knelt beside the hearth.").orElseThrow().token());
        assertEquals("lying", match(Category.POSITION, "lies on the rug.").orElseThrow().token());
    }

    // --- objects ---

    @Test
    void object_pickUp() {
        RuleMatch m = match(Category.OBJECT_INTERACTION, "picks up the lantern.").orElseThrow();
        assertEquals("took", m.token());
        assertEquals("lantern", m.target());
        assertFalse(NarrativePatterns.releases(m));
    }

    @Test
    void object_putDownReleases() {
        RuleMatch m = match(Category.OBJECT_INTERACTION, "puts down the lantern.").orElseThrow();
        assertEquals("put down", m.token());
        assertEquals("lantern", m.target());
        assertTrue(NarrativePatterns.releases(m));
    }

    @Test
    void object_takeASeatIsNotAnItem() {
        assertTrue(match(Category.OBJECT_INTERACTION, "takes a seat.").isEmpty());
    }

    @Test
    void object_pronounDeclined() {
        assertTrue(match(Category.OBJECT_INTERACTION, "grabs it.").isEmpty());
    }

    // --- people, mood, privacy ---

    @Test
    void characterInteraction_capturesClause() {
        RuleMatch m = match(Category.CHARACTER_INTERACTION, "hugs Ben tightly.").orElseThrow();
        assertEquals("hugged", m.token());
        assertEquals("Ben tightly", m.target());
    }

    @Test
    void characterInteraction_predicateSkipsUnusableMatch() {
        Optional<RuleMatch> m = NarrativePatterns.firstMatch(Category.CHARACTER_INTERACTION,
                "looks at the door, then smiles at Ben.", r -> r.target().startsWith("Ben"));
        assertEquals("smiled at", m.orElseThrow().token());
    }

    @Test
    void emotionalState_rootToken() {
        assertEquals("happy", match(Category.EMOTIONAL_STATE, "laughs happily.").orElseThrow().token());
        assertEquals("afraid", match(Category.EMOTIONAL_STATE, "glances around nervously.").orElseThrow().token());
        assertEquals("angry", match(Category.EMOTIONAL_STATE, "is furious.").orElseThrow().token());
    }

    @Test
    void privacy_cues() {
        assertTrue(match(Category.PRIVACY, "Can we talk in private?").isPresent());
        assertTrue(match(Category.PRIVACY, "I'd like a private word with you.").isPresent());
        assertTrue(match(Category.PRIVACY, "Let's all sit together.").isEmpty());
    }

    // --- table ---

    @Test
    void rules_orderedByCategoryWithinTable() {
        assertEquals(3, NarrativePatterns.rules(Category.LEAVE).size());
        assertEquals("leaves-for-place", NarrativePatterns.rules(Category.LEAVE).get(0).name());
        assertEquals(1, NarrativePatterns.VERSION);
    }

    @Test
    void firstMatch_blankText() {
        assertTrue(match(Category.LEAVE, "").isEmpty());
        assertTrue(match(Category.LEAVE, null).isEmpty());
    }
}
