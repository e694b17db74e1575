package dev.ebullient.ensemble;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure-function utilities for splitting scene text into character blocks and paragraphs.
 */
public class SceneTextParser {

    /** Text attributed to one character: the name inside the marker and what follows it. */
    public record CharacterBlock(String name, String text) {
    }

    // **Name**, **Name:**, **[Name]:** or **Name**:
    private static final Pattern NAME_MARKER = Pattern.compile(
            "\\*\\*\\s*\\[?([^*\\[\\]\\n:]+?)\\]?\\s*:?\\s*\\*\\*:?");

    // a marker starts a new block at the start of a line or after the end of a sentence,
    // which may be closed by quotes, parens or emphasis: *waves.* **Ben**
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?…][*_\"”'’)]*\\s+$");

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private SceneTextParser() {
    }

    /**
     * Split narrative into character-attributed blocks.
     * <p>
     * Each block runs from an emphasized name marker to the end of its line, or to the
     * next marker that opens a new sentence. Markers in the middle of a sentence
     * ({@code **Ava** smiles at **Ben**}) stay part of the current block. Text before
     * the first marker of a line is not attributable and is ignored.
     */
    public static List<CharacterBlock> characterBlocks(String narrative) {
        if (narrative == null || narrative.isBlank()) {
            return List.of();
        }

        List<CharacterBlock> blocks = new ArrayList<>();
        for (String line : narrative.split("\n")) {
            Matcher m = NAME_MARKER.matcher(line);
            String currentName = null;
            int contentStart = -1;

            while (m.find()) {
                if (currentName != null && !startsBlock(line, m.start())) {
                    continue;
                }
                if (currentName != null) {
                    addBlock(blocks, currentName, line.substring(contentStart, m.start()));
                }
                currentName = m.group(1).trim();
                contentStart = m.end();
            }
            if (currentName != null) {
                addBlock(blocks, currentName, line.substring(contentStart));
            }
        }
        return blocks;
    }

    private static boolean startsBlock(String line, int markerStart) {
        String before = line.substring(0, markerStart);
        return before.isBlank() || SENTENCE_END.matcher(before).find();
    }

    private static void addBlock(List<CharacterBlock> blocks, String name, String rawText) {
        // drop emphasis so "*leaves the room*" and "**Ben**" read as plain words
        String text = rawText.replace("*", "").trim();
        if (!name.isEmpty() && !text.isEmpty()) {
            blocks.add(new CharacterBlock(name, text));
        }
    }

    /**
     * Split text on blank lines. Paragraphs are trimmed; empty ones are dropped.
     */
    public static List<String> paragraphs(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text.strip())) {
            String trimmed = paragraph.strip();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        return paragraphs;
    }

    /**
     * Test whether a paragraph opens with an emphasized name marker: {@code **Name** ...}
     */
    public static boolean startsWithNameMarker(String paragraph) {
        if (paragraph == null) {
            return false;
        }
        Matcher m = NAME_MARKER.matcher(paragraph.stripLeading());
        return m.lookingAt();
    }

    /**
     * Test whether a trimmed line consists of nothing but one of the given names,
     * optionally bold, bracketed or followed by a colon ({@code Ava}, {@code **Ava**},
     * {@code [Ava]:}).
     *
     * @return the matching name as spelled in {@code names}
     */
    public static Optional<String> bareName(String line, Collection<String> names) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String candidate = line.trim()
                .replaceAll("^\\*\\*|\\*\\*$", "")
                .replaceAll(":$", "")
                .replaceAll("\\*\\*$", "")
                .trim()
                .replaceAll("^\\[|]$", "")
                .trim();
        for (String name : names) {
            if (name != null && !name.isBlank() && name.trim().equalsIgnoreCase(candidate)) {
                return Optional.of(name.trim());
            }
        }
        return Optional.empty();
    }
}
