package dev.ebullient.ensemble;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.ebullient.ensemble.model.Posture;

/**
 * Ordered table of text rules used to infer what characters do in narrative text.
 * <p>
 * Rules are grouped by {@link Category}. Within a category the table order is the
 * priority order: the first rule that matches (and whose extractor accepts the match)
 * wins. Categories are evaluated independently of each other.
 * <p>
 * Bump {@link #VERSION} whenever a rule changes in a way that alters what is inferred
 * from the same text.
 */
public final class NarrativePatterns {

    public static final int VERSION = 1;

    public enum Category {
        LEAVE,
        RETURN,
        /** Errand vocabulary that turns a departure into a timed absence */
        TEMPORARY_TASK,
        /** Why a character left, when no errand is named */
        PURPOSE,
        /** Where a character went, when the leave rule did not capture it */
        DESTINATION,
        POSITION,
        OBJECT_INTERACTION,
        CHARACTER_INTERACTION,
        EMOTIONAL_STATE,
        /** Cues that the conversation became private (checked against the whole text) */
        PRIVACY
    }

    /**
     * What a rule extracted: a normalized token (posture, mood, action label...) and
     * an optional captured phrase (destination, item, target, task label).
     */
    public record RuleMatch(Category category, String token, String target) {
    }

    public record Rule(Category category, String name, Pattern pattern, Function<MatchResult, RuleMatch> extractor) {

        /**
         * @return the extracted match, or empty if the pattern does not match or the
         *         extractor declined the captured text
         */
        public Optional<RuleMatch> apply(String text) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.ofNullable(extractor.apply(matcher.toMatchResult()));
        }
    }

    public static final Set<String> RELEASE_TOKENS = Set.of("put down", "dropped");

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Set<String> PRONOUNS = Set.of(
            "it", "them", "him", "her", "me", "us", "you", "this", "that", "one", "something", "everything");

    private static final String ERRAND = "(?:get|fetch|bring|grab|prepare|make|find|check on|see to|see about"
            + "|answer|help with|take care of|clean|cook|serve|wash|change|feed)";

    // a short noun phrase ending before a conjunction, a preposition or punctuation
    private static final String PHRASE = "(\\p{L}[\\p{L}\\p{N}'’ -]*?)"
            + "(?=\\s+(?:and|to|for|with|while|as|then|before|after|but|from|in|into|on|onto|off"
            + "|down|up|away|back|aside|over)\\b|[,.!?;:\"“”*\\n]|$)";

    // free text up to the end of the clause
    private static final String CLAUSE = "([^,.!?;:\"“”*\\n]+)";

    private static final List<Rule> RULES = List.of(
            // --- leave ---
            phrase(Category.LEAVE, "leaves-for-place",
                    "\\b(?:heads|headed|heading|goes|going|went|hurries|hurried|runs|ran)"
                            + "\\s+(?:off\\s+|out\\s+|back\\s+)?(?:to|towards?|into|for)\\s+(?!" + ERRAND + "\\b)" + PHRASE),
            token(Category.LEAVE, "leaves-on-errand", null,
                    "\\b(?:heads|headed|goes|going|went|runs|ran|hurries|hurried)\\s+(?:off\\s+)?to\\s+" + ERRAND + "\\b"),
            token(Category.LEAVE, "leaves", null,
                    "\\b(?:leaves|left(?!\\s+(?:hand|arm|side|foot|leg|eye|ear|shoulder|cheek))|leaving|exits|exited"
                            + "|departs|departed|walks out|walked out|steps out|stepped out|slips out|slipped out"
                            + "|went away|goes away|is gone|excuses (?:herself|himself|themselves))\\b"),

            // --- return ---
            token(Category.RETURN, "returns", null,
                    "\\b(?:returns|returned|comes back|came back|coming back|is back|arrives|arrived|enters|entered"
                            + "|reappears|reappeared|walks in|walked in|steps in|stepped in)\\b"),
            phrase(Category.RETURN, "joins",
                    "\\b(?:joins|joined|rejoins|rejoined)\\s+" + PHRASE),

            // --- temporary tasks ---
            rule(Category.TEMPORARY_TASK, "errand",
                    "\\bto\\s+(" + ERRAND + "\\b[^,.!?;:\"“”*\\n]*)",
                    m -> new RuleMatch(Category.TEMPORARY_TASK, "errand", m.group(1).trim())),
            rule(Category.TEMPORARY_TASK, "tending",
                    "\\b(checking on|working on|taking care of)\\s+" + PHRASE,
                    m -> new RuleMatch(Category.TEMPORARY_TASK, "tending",
                            m.group(1).toLowerCase() + " " + m.group(2).trim())),
            token(Category.TEMPORARY_TASK, "back-soon", null,
                    "\\b(?:will be back|be right back|back soon|return soon|return in|returns? shortly)\\b"),
            rule(Category.TEMPORARY_TASK, "chore",
                    "\\b(taking orders|serving|cleaning|preparing food|cooking)\\b",
                    m -> new RuleMatch(Category.TEMPORARY_TASK, "chore", m.group(1).toLowerCase())),
            token(Category.TEMPORARY_TASK, "excuse-me", null,
                    "\\b(?:excuse me while I|let me just|I'll just|one moment while I)\\b"),

            // --- purpose and destination ---
            rule(Category.PURPOSE, "out-for",
                    "\\bfor\\s+((?:a|an|some)\\s+(?:walk|stroll|break|smoke|drink|rest|nap|fresh air|air))\\b",
                    m -> new RuleMatch(Category.PURPOSE, "out-for", "out for " + m.group(1).toLowerCase())),
            rule(Category.PURPOSE, "so-that",
                    "\\b(?:in order to|so (?:that )?(?:she|he|they|I) can)\\s+(\\p{L}+(?:\\s+\\p{L}+)?)",
                    m -> new RuleMatch(Category.PURPOSE, "so-that", m.group(1).toLowerCase())),
            phrase(Category.DESTINATION, "to-the-place",
                    "\\b(?:to|towards?|into|for)\\s+the\\s+" + PHRASE),

            // --- posture ---
            posture("\\b(sits|sat|sitting)\\b"),
            posture("\\b(stands|stood|standing)\\b"),
            posture("\\b(leans|leaned|leant|leaning)\\b"),
            posture("\\b(lies|lay|lying)\\b"),
            posture("\\b(kneels|knelt|kneeled|kneeling)\\b"),

            // --- objects ---
            phrase(Category.OBJECT_INTERACTION, "took",
                    "\\b(?:picks|picked|picking)\\s+up\\s+" + PHRASE),
            phrase(Category.OBJECT_INTERACTION, "took",
                    "\\b(?:takes|took|taking|grabs|grabbed|grabbing|lifts|lifted|lifting)\\s+"
                            + "(?!(?:a|another)\\s+(?:seat|step|breath|deep breath|sip|look|moment|break)\\b)" + PHRASE),
            phrase(Category.OBJECT_INTERACTION, "holding",
                    "\\b(?:holds|held|holding)\\s+(?:up\\s+|out\\s+)?" + PHRASE),
            phrase(Category.OBJECT_INTERACTION, "put down",
                    "\\b(?:puts|put|putting|places|placed|placing|sets|set|setting)\\s+(?:down\\s+)?(?!off\\b|out\\b|of\\b)"
                            + PHRASE),
            phrase(Category.OBJECT_INTERACTION, "dropped",
                    "\\b(?:drops|dropped|dropping|releases|released)\\s+" + PHRASE),

            // --- other characters (target resolved by the caller) ---
            clause(Category.CHARACTER_INTERACTION, "approached",
                    "\\b(?:approaches|approached|approaching|walks up to|walked up to|moves closer to|moved closer to)\\s+"),
            clause(Category.CHARACTER_INTERACTION, "touched", "\\b(?:touches|touched|touching)\\s+"),
            clause(Category.CHARACTER_INTERACTION, "hugged", "\\b(?:hugs|hugged|hugging|embraces|embraced)\\s+"),
            clause(Category.CHARACTER_INTERACTION, "kissed", "\\b(?:kisses|kissed|kissing)\\s+"),
            clause(Category.CHARACTER_INTERACTION, "looked at",
                    "\\b(?:looks|looked|looking|glances|glanced|glancing|stares|stared|staring)\\s+(?:over\\s+)?"
                            + "(?:at|toward|towards)\\s+"),
            clause(Category.CHARACTER_INTERACTION, "smiled at",
                    "\\b(?:smiles|smiled|smiling|grins|grinned|winks|winked)\\s+(?:at|to)\\s+"),

            // --- mood, normalized to one root token per group ---
            token(Category.EMOTIONAL_STATE, "happy", "happy",
                    "\\b(?:happy|happily|delighted|excited|excitedly|thrilled|joyful|joyfully|cheerful|cheerfully)\\b"),
            token(Category.EMOTIONAL_STATE, "sad", "sad",
                    "\\b(?:sad|sadly|depressed|upset|disappointed|sorrowful|gloomy)\\b"),
            token(Category.EMOTIONAL_STATE, "angry", "angry",
                    "\\b(?:angry|angrily|furious|furiously|enraged|irritated|annoyed)\\b"),
            token(Category.EMOTIONAL_STATE, "afraid", "afraid",
                    "\\b(?:scared|afraid|terrified|fearful|fearfully|anxious|anxiously|nervous|nervously)\\b"),
            token(Category.EMOTIONAL_STATE, "surprised", "surprised",
                    "\\b(?:surprised|shocked|astonished|amazed|stunned)\\b"),
            token(Category.EMOTIONAL_STATE, "calm", "calm",
                    "\\b(?:calm|calmly|relaxed|peaceful|peacefully|tranquil|serene)\\b"),

            // --- privacy ---
            token(Category.PRIVACY, "in-private", null, "\\bin private\\b"),
            token(Category.PRIVACY, "private-talk", null,
                    "\\bprivate(?:ly)?\\s+(?:conversation|talk|word|words|moment|chat)\\b"),
            token(Category.PRIVACY, "alone-with", null, "\\balone with\\b"),
            token(Category.PRIVACY, "two-of-us", null, "\\bjust the two of us\\b"));

    private NarrativePatterns() {
    }

    public static List<Rule> rules() {
        return RULES;
    }

    public static List<Rule> rules(Category category) {
        return RULES.stream()
                .filter(r -> r.category() == category)
                .toList();
    }

    /**
     * Evaluate the rules of one category in priority order.
     */
    public static Optional<RuleMatch> firstMatch(Category category, String text) {
        return firstMatch(category, text, m -> true);
    }

    /**
     * Evaluate the rules of one category in priority order, skipping matches the
     * caller cannot use (e.g. an interaction whose target is not a known character).
     */
    public static Optional<RuleMatch> firstMatch(Category category, String text, Predicate<RuleMatch> accept) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Rule rule : RULES) {
            if (rule.category() != category) {
                continue;
            }
            Optional<RuleMatch> match = rule.apply(text).filter(accept);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public static boolean releases(RuleMatch match) {
        return match.category() == Category.OBJECT_INTERACTION && RELEASE_TOKENS.contains(match.token());
    }

    // --- Rule builders ---

    private static Rule rule(Category category, String name, String regex, Function<MatchResult, RuleMatch> extractor) {
        return new Rule(category, name, Pattern.compile(regex, FLAGS), extractor);
    }

    /** A rule that only signals a match; {@code target} is a fixed value (may be null). */
    private static Rule token(Category category, String token, String target, String regex) {
        return rule(category, token, regex, m -> new RuleMatch(category, token, target));
    }

    /** A rule whose first group is a noun phrase; pronouns and empty phrases are declined. */
    private static Rule phrase(Category category, String token, String regex) {
        return rule(category, token, regex, m -> {
            String phrase = StringUtils.stripDeterminer(m.group(1));
            if (phrase.isBlank() || PRONOUNS.contains(StringUtils.normalize(phrase))) {
                return null;
            }
            return new RuleMatch(category, token, phrase);
        });
    }

    /** A rule followed by free text, captured as the target. */
    private static Rule clause(Category category, String token, String prefix) {
        return rule(category, token, prefix + CLAUSE,
                m -> new RuleMatch(category, token, m.group(1).trim()));
    }

    private static Rule posture(String regex) {
        return rule(Category.POSITION, "posture", regex, m -> {
            Posture posture = Posture.fromVerb(m.group(1));
            return posture == null ? null : new RuleMatch(Category.POSITION, posture.token(), null);
        });
    }
}
