package dev.ebullient.ensemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.EnforcementResult;

class OutputConsistencyEnforcerTest {

    OutputConsistencyEnforcer enforcer = new OutputConsistencyEnforcer();
    SceneState scene;

    @BeforeEach
    void setUp() {
        Map<String, CharacterProfile> directory = new LinkedHashMap<>();
        directory.put("ava", CharacterProfile.named("Ava"));
        directory.put("ben", CharacterProfile.named("Ben"));
        scene = SceneState.create(directory, 0L);
    }

    @Test
    void process_wellFormedTextUnchanged() {
        String text = "**Ava** \"Hello.\" *waves*\n\n*The fire crackles.*";

        EnforcementResult result = enforcer.process(scene, text);

        assertEquals(text, result.cleanedText());
        assertFalse(result.formatIssuesFound());
        assertFalse(result.violationsFound());
        assertTrue(result.violatingCharacters().isEmpty());
    }

    @Test
    void process_blankText() {
        EnforcementResult result = enforcer.process(scene, null);

        assertEquals("", result.cleanedText());
        assertFalse(result.formatIssuesFound());
    }

    // --- layout repairs ---

    @Test
    void process_stripsStrayHeaders() {
        EnforcementResult result = enforcer.process(scene, "Preview\n**Ava** \"Hi.\"\n\n## Response:\n\n**Ben** nods.");

        assertEquals("**Ava** \"Hi.\"\n\n**Ben** nods.", result.cleanedText());
        assertTrue(result.formatIssuesFound());
    }

    @Test
    void process_rewritesNameOnItsOwnLine() {
        EnforcementResult result = enforcer.process(scene, "Ava\n\"Hello there.\"\n\nBen\n*nods*");

        assertEquals("**Ava** \"Hello there.\"\n\n**Ben** *nods*", result.cleanedText());
        assertTrue(result.formatIssuesFound());
    }

    @Test
    void process_dropsOrphanedNameLine() {
        EnforcementResult result = enforcer.process(scene, "Ava\n\n**Ben** \"Hi.\"");

        assertEquals("**Ben** \"Hi.\"", result.cleanedText());
        assertTrue(result.formatIssuesFound());
    }

    @Test
    void process_nameLineMidParagraphStartsNewOne() {
        EnforcementResult result = enforcer.process(scene, "**Ava** \"Well?\"\nBen\n\"Not yet.\"");

        assertEquals("**Ava** \"Well?\"\n\n**Ben** \"Not yet.\"", result.cleanedText());
    }

    @Test
    void process_wrapsNarrationInItalics() {
        EnforcementResult result = enforcer.process(scene, "The fire crackles.\n\n**Ava** smiles.");

        assertEquals("*The fire crackles.*\n\n**Ava** smiles.", result.cleanedText());
        assertFalse(result.formatIssuesFound());
    }

    @Test
    void process_residualHeaderLabelFlagged() {
        EnforcementResult result = enforcer.process(scene, "**Ava** waves.\n\nScene: the tavern at dusk");

        assertTrue(result.formatIssuesFound());
        assertTrue(result.cleanedText().endsWith("*Scene: the tavern at dusk*"));
    }

    // --- absent characters ---

    @Test
    void process_absentCharacterSpeaking() {
        scene.depart("ava", "away", "garden", null, 0L);

        EnforcementResult result = enforcer.process(scene, "**Ava** \"I'm back!\"\n\n**Ben** nods.");

        assertTrue(result.violationsFound());
        assertEquals(List.of("Ava"), result.violatingCharacters());
        assertTrue(result.cleanedText().endsWith(
                "*Note: Ava is not present in this scene and should not speak or act here.*"));
    }

    @Test
    void process_absentCharacterActing() {
        scene.depart("ava", "away", "garden", null, 0L);

        EnforcementResult result = enforcer.process(scene, "**Ava:** *slips back inside*");

        assertEquals(List.of("Ava"), result.violatingCharacters());
    }

    @Test
    void process_absentCharacterMentionedIsFine() {
        scene.depart("ava", "away", "garden", null, 0L);

        EnforcementResult result = enforcer.process(scene, "**Ben** \"Where did Ava go?\"");

        assertFalse(result.violationsFound());
    }

    // --- idempotency ---

    @Test
    void process_idempotent() {
        scene.depart("ava", "away", "garden", null, 0L);
        String messy = "Preview\nAva\n\"Hi.\"\n\nThe rain falls.\n\nBen\n*waves*";

        String once = enforcer.process(scene, messy).cleanedText();
        EnforcementResult twice = enforcer.process(scene, once);

        assertEquals(once, twice.cleanedText());
        assertEquals(1, once.split("\\*Note:", -1).length - 1);
    }

    // --- faults ---

    @Test
    void process_faultReturnsOriginalText() {
        SceneState broken = new SceneState() {
            @Override
            public List<String> availableNames() {
                throw new IllegalStateException("directory unavailable");
            }
        };
        String text = "Ava\nhello";

        EnforcementResult result = enforcer.process(broken, text);

        assertEquals(text, result.cleanedText());
        assertTrue(result.formatIssuesFound());
        assertFalse(result.violationsFound());
    }

    @Test
    void process_narrationOpeningWithItalicSpanKept() {
        String text = "*She sighs.* The rain keeps falling.\n\n**Ava** \"Hi.\"";

        EnforcementResult result = enforcer.process(scene, text);

        assertEquals(text, result.cleanedText());
        assertFalse(result.formatIssuesFound());
    }

    @Test
    void process_narrationWithInlineItalicsWrappedInUnderscores() {
        EnforcementResult result = enforcer.process(scene, "The rain *keeps* falling.\n\n**Ava** \"Hi.\"");

        assertEquals("_The rain *keeps* falling._\n\n**Ava** \"Hi.\"", result.cleanedText());
        assertEquals(result.cleanedText(), enforcer.process(scene, result.cleanedText()).cleanedText());
    }
}
