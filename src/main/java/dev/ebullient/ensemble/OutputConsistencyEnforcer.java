package dev.ebullient.ensemble;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import dev.ebullient.ensemble.model.EnforcementResult;

/**
 * Cleans up generated scene text and checks it against the scene state.
 * <p>
 * Generators drift away from the {@code **Name** action} layout: they emit
 * "Preview" headers, put a speaker's name on a line of its own, or let absent
 * characters speak. {@link #process} repairs the layout and reports characters
 * that should not have appeared. Running it again on its own output changes nothing.
 */
public class OutputConsistencyEnforcer {
    private static final Logger log = Logger.getLogger(OutputConsistencyEnforcer.class);

    static final String HEADER_WORDS = "(?:Preview|Response|Output|Narrative|Scene)";

    // a header on its own line: "Preview", "## Response", "**Output:**"
    private static final Pattern STRAY_HEADER = Pattern.compile(
            "^\\s*(?:#{1,6}\\s*)?(?:\\*\\*)?\\s*" + HEADER_WORDS + "\\s*:?\\s*(?:\\*\\*)?\\s*:?\\s*$",
            Pattern.CASE_INSENSITIVE);

    // a header label followed by content on the same line: "Preview: Ava waves"
    private static final Pattern HEADER_LABEL = Pattern.compile(
            "(?m)^\\s*(?:#{1,6}\\s*)?(?:\\*\\*)?\\s*" + HEADER_WORDS + "\\s*:(?:\\*\\*)?\\s*\\S",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");

    /**
     * Repair the layout of generated text and flag absent characters that speak or act in it.
     * Never throws: on an internal failure the input comes back unchanged with
     * {@code formatIssuesFound} set.
     */
    public EnforcementResult process(SceneState scene, String text) {
        if (text == null || text.isBlank()) {
            return new EnforcementResult(text == null ? "" : text, false, false, List.of());
        }
        try {
            return normalize(scene, text);
        } catch (RuntimeException e) {
            log.warnf(e, "Unable to normalize generated text; returning it unchanged");
            return new EnforcementResult(text, false, true, List.of());
        }
    }

    EnforcementResult normalize(SceneState scene, String text) {
        List<String> names = scene.availableNames();
        boolean changed = false;

        // 1. stray headers
        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.matcher(text).replaceAll("\n").split("\n", -1)) {
            if (STRAY_HEADER.matcher(line).matches()) {
                changed = true;
            } else {
                lines.add(line);
            }
        }

        // 2 + 3. speaker names on a line of their own
        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : SceneTextParser.paragraphs(String.join("\n", lines))) {
            changed |= attributeSpeakers(paragraph, names, paragraphs);
        }

        String repaired = String.join("\n\n", paragraphs);

        // 4. absent characters that speak or act
        List<String> violators = findViolators(scene, repaired);
        if (!violators.isEmpty()) {
            log.warnf("Absent characters appear in generated text: %s", violators);
            String note = violationNote(violators);
            if (!paragraphs.contains(note)) {
                paragraphs.add(note);
            }
        }

        // 5. narration is emphasized
        List<String> result = new ArrayList<>(paragraphs.size());
        for (String paragraph : paragraphs) {
            result.add(emphasize(paragraph));
        }
        String cleaned = String.join("\n\n", result);

        // 6. leftovers we could not fix
        boolean formatIssues = changed || HEADER_LABEL.matcher(repaired).find();
        if (formatIssues) {
            log.debugf("Generated text had layout problems (repaired: %s)", changed);
        }
        return new EnforcementResult(cleaned, !violators.isEmpty(), formatIssues, violators);
    }

    /**
     * Rewrite {@code Name\ncontent} as {@code **Name** content}; drop name lines with
     * nothing after them. A name line in the middle of a paragraph starts a new one.
     *
     * @return true if the paragraph was changed
     */
    static boolean attributeSpeakers(String paragraph, List<String> names, List<String> out) {
        boolean changed = false;
        String speaker = null;
        List<String> content = new ArrayList<>();

        for (String line : paragraph.split("\n")) {
            Optional<String> name = SceneTextParser.bareName(line, names);
            if (name.isPresent()) {
                flush(speaker, content, out);
                speaker = name.get();
                content.clear();
                changed = true;
            } else {
                content.add(line);
            }
        }
        flush(speaker, content, out);
        return changed;
    }

    private static void flush(String speaker, List<String> content, List<String> out) {
        String body = String.join("\n", content).strip();
        if (body.isEmpty()) {
            return;
        }
        out.add(speaker == null ? body : "**" + speaker + "** " + body);
    }

    static List<String> findViolators(SceneState scene, String text) {
        Set<String> violators = new LinkedHashSet<>();
        for (String id : scene.getAbsentCharacters()) {
            String name = scene.displayName(id).trim();
            if (name.isEmpty()) {
                continue;
            }
            Pattern speaks = Pattern.compile(
                    "\\*\\*\\s*\\[?" + Pattern.quote(name) + "\\]?\\s*:?\\s*\\*\\*:?\\s*[\"'“‘*]",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            if (speaks.matcher(text).find()) {
                violators.add(name);
            }
        }
        return List.copyOf(violators);
    }

    static String violationNote(List<String> violators) {
        String who = String.join(", ", violators);
        String verb = violators.size() == 1 ? "is" : "are";
        return "*Note: " + who + " " + verb + " not present in this scene and should not speak or act here.*";
    }

    /**
     * Wrap a narration paragraph in emphasis. Paragraphs that open with a name marker
     * or with emphasis of their own are left alone. Inline {@code *} emphasis is
     * nested inside {@code _..._} instead.
     */
    static String emphasize(String paragraph) {
        if (SceneTextParser.startsWithNameMarker(paragraph)
                || paragraph.startsWith("*") || paragraph.startsWith("_")) {
            return paragraph;
        }
        if (!paragraph.contains("*")) {
            return "*" + paragraph + "*";
        }
        if (!paragraph.contains("_")) {
            return "_" + paragraph + "_";
        }
        return paragraph;
    }
}
