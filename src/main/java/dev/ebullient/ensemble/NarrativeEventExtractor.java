package dev.ebullient.ensemble;

import java.time.InstantSource;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import dev.ebullient.ensemble.NarrativePatterns.Category;
import dev.ebullient.ensemble.NarrativePatterns.RuleMatch;
import dev.ebullient.ensemble.SceneTextParser.CharacterBlock;
import dev.ebullient.ensemble.model.AmbientActivity;
import dev.ebullient.ensemble.model.CharacterRecord;
import dev.ebullient.ensemble.model.ExtractionSummary;
import dev.ebullient.ensemble.model.TemporaryTask;

/**
 * Infers character state changes from a block of narrative text and applies them
 * to a {@link SceneState}.
 * <p>
 * One call to {@link #extract} is one narrative pass:
 * <ol>
 * <li>expired temporary tasks bring their characters back</li>
 * <li>{@code **Name**} blocks are matched against the rule table, category by category</li>
 * <li>characters that were present get their last-seen time refreshed</li>
 * <li>a private-conversation cue sends unnamed characters away</li>
 * <li>occasionally, one untouched character drifts in or out on its own</li>
 * </ol>
 * Time and randomness come from the injected {@link InstantSource} and {@link RandomSource}.
 */
public class NarrativeEventExtractor {
    private static final Logger log = Logger.getLogger(NarrativeEventExtractor.class);

    static final String RETURNING = "returning";
    static final String AWAY = "away";
    static final String ANOTHER_LOCATION = "another location";
    static final String GIVING_PRIVACY = "giving privacy";
    static final String NEARBY = "nearby";

    private final TrackerSettings settings;
    private final InstantSource clock;
    private final RandomSource random;

    public NarrativeEventExtractor(TrackerSettings settings, InstantSource clock, RandomSource random) {
        this.settings = settings;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Run one narrative pass. Null or blank text is a no-op.
     */
    public ExtractionSummary extract(SceneState scene, String text) {
        if (text == null || text.isBlank()) {
            return ExtractionSummary.EMPTY;
        }
        Pass pass = new Pass(scene, clock.millis());

        sweepTasks(pass);

        List<String> presentBefore = scene.getActiveCharacters();
        for (CharacterBlock block : SceneTextParser.characterBlocks(text)) {
            Optional<String> id = scene.resolveName(block.name());
            if (id.isEmpty()) {
                log.debugf("No character named %s in scene; block skipped", block.name());
                continue;
            }
            applyRules(pass, id.get(), block.text());
        }

        for (String id : presentBefore) {
            scene.update(id, r -> r.seenAt(pass.now));
        }

        applyPrivacy(pass, text);
        applyDrift(pass);

        ExtractionSummary summary = pass.summary();
        if (summary.changed()) {
            log.debugf("Narrative pass updated %s (departed: %s, returned: %s)",
                    summary.updatedCharacters(), summary.departed(), summary.returned());
        }
        return summary;
    }

    void sweepTasks(Pass pass) {
        for (Map.Entry<String, TemporaryTask> entry : pass.scene.tasks().entrySet()) {
            String id = entry.getKey();
            TemporaryTask task = entry.getValue();
            if (!pass.scene.getAvailableCharacters().contains(id)) {
                pass.scene.clearTask(id);
                log.debugf("Dropped task %s of removed character %s", task.label(), id);
            } else if (task.isDue(pass.now)) {
                pass.scene.arrive(id, RETURNING, pass.now);
                pass.returned(id);
                log.debugf("%s is back from %s", pass.scene.displayName(id), task.label());
            }
        }
    }

    void applyRules(Pass pass, String id, String block) {
        // leave wins over return within one block
        if (!applyLeave(pass, id, block)) {
            applyReturn(pass, id, block);
        }
        applyPosition(pass, id, block);
        applyObjectInteraction(pass, id, block);
        applyCharacterInteraction(pass, id, block);
        applyEmotionalState(pass, id, block);
    }

    boolean applyLeave(Pass pass, String id, String block) {
        Optional<RuleMatch> leave = NarrativePatterns.firstMatch(Category.LEAVE, block);
        if (leave.isEmpty()) {
            return false;
        }
        Optional<RuleMatch> task = NarrativePatterns.firstMatch(Category.TEMPORARY_TASK, block);

        String location = Optional.ofNullable(leave.get().target())
                .or(() -> NarrativePatterns.firstMatch(Category.DESTINATION, block).map(RuleMatch::target))
                .orElse(ANOTHER_LOCATION);
        String activity = task.map(RuleMatch::target)
                .or(() -> NarrativePatterns.firstMatch(Category.PURPOSE, block).map(RuleMatch::target))
                .orElse(AWAY);

        TemporaryTask timer = null;
        if (task.isPresent()) {
            long duration = random.nextLong(settings.taskMinDuration().toMillis(), settings.taskMaxDuration().toMillis());
            timer = new TemporaryTask(activity, pass.now, duration);
        }
        pass.scene.depart(id, activity, location, timer, pass.now);
        pass.departed(id);
        return true;
    }

    boolean applyReturn(Pass pass, String id, String block) {
        if (NarrativePatterns.firstMatch(Category.RETURN, block).isEmpty()) {
            return false;
        }
        boolean wasAway = !pass.scene.record(id).present();
        pass.scene.arrive(id, CharacterRecord.DEFAULT_ACTIVITY, pass.now);
        if (wasAway) {
            pass.returned(id);
        } else {
            pass.touch(id);
        }
        return true;
    }

    boolean applyPosition(Pass pass, String id, String block) {
        Optional<RuleMatch> match = NarrativePatterns.firstMatch(Category.POSITION, block);
        match.ifPresent(m -> {
            pass.scene.update(id, r -> r.withPosition(m.token(), pass.now));
            pass.touch(id);
        });
        return match.isPresent();
    }

    boolean applyObjectInteraction(Pass pass, String id, String block) {
        Optional<RuleMatch> match = NarrativePatterns.firstMatch(Category.OBJECT_INTERACTION, block);
        match.ifPresent(m -> {
            String item = m.target();
            String action = m.token() + " " + item;
            if (NarrativePatterns.releases(m)) {
                pass.scene.update(id, r -> r.withoutItem(item, action, pass.now));
            } else {
                pass.scene.update(id, r -> r.withItem(item, action, pass.now));
            }
            pass.touch(id);
        });
        return match.isPresent();
    }

    boolean applyCharacterInteraction(Pass pass, String id, String block) {
        Optional<RuleMatch> match = NarrativePatterns.firstMatch(Category.CHARACTER_INTERACTION, block,
                m -> resolveTarget(pass.scene, id, m.target()).isPresent());
        match.ifPresent(m -> {
            String target = pass.scene.displayName(resolveTarget(pass.scene, id, m.target()).orElseThrow());
            pass.scene.update(id, r -> r.withInteraction(target, m.token() + " " + target, pass.now));
            pass.touch(id);
        });
        return match.isPresent();
    }

    boolean applyEmotionalState(Pass pass, String id, String block) {
        Optional<RuleMatch> match = NarrativePatterns.firstMatch(Category.EMOTIONAL_STATE, block);
        match.ifPresent(m -> {
            pass.scene.update(id, r -> r.withEmotionalState(m.token(), pass.now));
            pass.touch(id);
        });
        return match.isPresent();
    }

    /**
     * When the conversation turns private, every present character who is not
     * named in the text steps away.
     */
    void applyPrivacy(Pass pass, String text) {
        if (NarrativePatterns.firstMatch(Category.PRIVACY, text).isEmpty()) {
            return;
        }
        for (String id : pass.scene.getActiveCharacters()) {
            if (!StringUtils.mentionsName(text, pass.scene.displayName(id))) {
                pass.scene.depart(id, GIVING_PRIVACY, pass.scene.record(id).location(), null, pass.now);
                pass.departed(id);
                log.debugf("%s steps away to give privacy", pass.scene.displayName(id));
            }
        }
    }

    /**
     * With a small probability, one character that this pass has not touched changes
     * on its own: a present character picks up an ambient activity and may wander off;
     * a character that has been away (without a task) long enough comes back.
     */
    void applyDrift(Pass pass) {
        if (settings.driftProbability() <= 0 || random.nextDouble() >= settings.driftProbability()) {
            return;
        }
        List<String> candidates = pass.scene.getAvailableCharacters().stream()
                .filter(id -> !pass.touched(id))
                .toList();
        if (candidates.isEmpty()) {
            return;
        }
        String id = candidates.get(random.nextInt(candidates.size()));
        CharacterRecord record = pass.scene.record(id);

        if (record.present()) {
            List<String> activities = AmbientActivity.forProfile(pass.scene.profile(id)).activities();
            String activity = activities.get(random.nextInt(activities.size()));
            if (random.nextDouble() < 0.5) {
                pass.scene.depart(id, activity, NEARBY, null, pass.now);
                pass.departed(id);
            } else {
                pass.scene.update(id, r -> r.withActivity(activity).seenAt(pass.now));
                pass.touch(id);
            }
            log.debugf("%s drifts: %s", pass.scene.displayName(id), activity);
        } else if (pass.scene.task(id).isEmpty()
                && pass.now - record.lastSeen() >= settings.driftMinAbsence().toMillis()) {
            pass.scene.arrive(id, CharacterRecord.DEFAULT_ACTIVITY, pass.now);
            pass.returned(id);
            log.debugf("%s drifts back into the scene", pass.scene.displayName(id));
        }
    }

    /**
     * Resolve the object of an interaction to another character. The captured text may
     * run past the name ("Ben and waves"), so the longest name it starts with wins.
     */
    static Optional<String> resolveTarget(SceneState scene, String actorId, String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return Optional.empty();
        }
        String candidate = phrase.trim();
        String best = null;
        int bestLength = 0;
        for (String id : scene.getAvailableCharacters()) {
            if (id.equals(actorId)) {
                continue;
            }
            String name = scene.displayName(id).trim();
            if (name.length() > bestLength && startsWithName(candidate, name)) {
                best = id;
                bestLength = name.length();
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean startsWithName(String text, String name) {
        if (!text.regionMatches(true, 0, name, 0, name.length())) {
            return false;
        }
        return text.length() == name.length() || !Character.isLetterOrDigit(text.charAt(name.length()));
    }

    /** Bookkeeping for one pass: the time it runs at and the characters it changed. */
    static class Pass {
        final SceneState scene;
        final long now;
        final Set<String> touched = new LinkedHashSet<>();
        final Set<String> departed = new LinkedHashSet<>();
        final Set<String> returned = new LinkedHashSet<>();

        Pass(SceneState scene, long now) {
            this.scene = scene;
            this.now = now;
        }

        void touch(String id) {
            touched.add(id);
        }

        void departed(String id) {
            touched.add(id);
            returned.remove(id);
            departed.add(id);
        }

        void returned(String id) {
            touched.add(id);
            departed.remove(id);
            returned.add(id);
        }

        boolean touched(String id) {
            return touched.contains(id);
        }

        ExtractionSummary summary() {
            return new ExtractionSummary(List.copyOf(touched), List.copyOf(departed), List.copyOf(returned));
        }
    }
}
