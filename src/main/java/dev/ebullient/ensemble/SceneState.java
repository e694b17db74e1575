package dev.ebullient.ensemble;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.jboss.logging.Logger;

import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.CharacterRecord;
import dev.ebullient.ensemble.model.PresenceState;
import dev.ebullient.ensemble.model.SceneSnapshot;
import dev.ebullient.ensemble.model.TemporaryTask;

/**
 * Character state store for one scene.
 * <p>
 * Holds exactly one {@link CharacterRecord} per non-removed character, the
 * table of temporary tasks, and memoized views of available and active
 * characters. Every mutation increments {@link #generation()}; a memoized view
 * remembers the generation it was computed for and is rebuilt on the first
 * read after any change.
 * <p>
 * Not thread-safe: {@link SceneService} serializes access per scene.
 */
public class SceneState {
    private static final Logger log = Logger.getLogger(SceneState.class);

    private final Map<String, CharacterProfile> directory = new LinkedHashMap<>();
    private final Map<String, CharacterRecord> records = new LinkedHashMap<>();
    private final Map<String, TemporaryTask> tasks = new LinkedHashMap<>();

    private long generation;

    private List<String> availableView;
    private long availableGeneration = -1;
    private List<String> activeView;
    private long activeGeneration = -1;

    SceneState() {
    }

    /**
     * Initialize a fresh scene: every non-removed character starts present,
     * standing, neutral, holding nothing.
     */
    public static SceneState create(Map<String, CharacterProfile> directory, long now) {
        return restore(directory, null, now);
    }

    /**
     * Rebuild a scene from a persisted snapshot. A null snapshot yields a fresh scene.
     * Records for unknown ids are dropped, missing records are created with
     * defaults, and tasks belonging to present characters are discarded.
     */
    public static SceneState restore(Map<String, CharacterProfile> directory, SceneSnapshot snapshot, long now) {
        SceneState state = new SceneState();
        state.directory.putAll(directory);

        if (snapshot != null) {
            snapshot.characters().forEach((id, record) -> {
                if (directory.containsKey(id)) {
                    state.records.put(id, record);
                } else {
                    log.debugf("Dropping persisted record for unknown character %s", id);
                }
            });
            snapshot.tasks().forEach((id, task) -> {
                CharacterRecord record = state.records.get(id);
                if (record != null && !record.present()) {
                    state.tasks.put(id, task);
                } else {
                    log.debugf("Dropping persisted task for %s: character is not away", id);
                }
            });
        }
        state.ensureRecords(now);
        return state;
    }

    private void ensureRecords(long now) {
        directory.forEach((id, profile) -> {
            if (!profile.removed()) {
                records.putIfAbsent(id, CharacterRecord.defaults(now));
            }
        });
    }

    // --- Views ---

    /** All non-removed character ids, in directory order. */
    public List<String> getAvailableCharacters() {
        if (availableView == null || availableGeneration != generation) {
            availableView = directory.entrySet().stream()
                    .filter(e -> !e.getValue().removed())
                    .map(Map.Entry::getKey)
                    .toList();
            availableGeneration = generation;
        }
        return availableView;
    }

    /** Available characters that are currently present. */
    public List<String> getActiveCharacters() {
        if (activeView == null || activeGeneration != generation) {
            activeView = getAvailableCharacters().stream()
                    .filter(id -> records.get(id).present())
                    .toList();
            activeGeneration = generation;
        }
        return activeView;
    }

    public List<String> getAbsentCharacters() {
        List<String> active = getActiveCharacters();
        return getAvailableCharacters().stream()
                .filter(id -> !active.contains(id))
                .toList();
    }

    /**
     * Describe every absent character as {@code "Name (activity at location)"}.
     */
    public List<String> getAbsentCharactersSummary() {
        return getAbsentCharacters().stream()
                .map(id -> {
                    CharacterRecord record = records.get(id);
                    return "%s (%s at %s)".formatted(displayName(id),
                            StringUtils.firstNonBlank(record.activity(), "away"),
                            StringUtils.firstNonBlank(record.location(), "unknown location"));
                })
                .toList();
    }

    // --- Accessors ---

    public CharacterRecord record(String id) {
        CharacterRecord record = records.get(id);
        if (record == null) {
            throw new IllegalArgumentException("Unknown character: " + id);
        }
        return record;
    }

    public CharacterProfile profile(String id) {
        CharacterProfile profile = directory.get(id);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown character: " + id);
        }
        return profile;
    }

    public String displayName(String id) {
        return StringUtils.firstNonBlank(profile(id).name(), id);
    }

    /**
     * Find an available character by display name, ignoring case.
     */
    public Optional<String> resolveName(String name) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        String wanted = name.trim();
        for (String id : getAvailableCharacters()) {
            String displayName = directory.get(id).name();
            if (displayName != null && displayName.trim().equalsIgnoreCase(wanted)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    public List<String> availableNames() {
        return getAvailableCharacters().stream()
                .map(this::displayName)
                .toList();
    }

    public Optional<TemporaryTask> task(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Map<String, TemporaryTask> tasks() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    /** The directory as last applied, removed identities included. */
    public Map<String, CharacterProfile> directory() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(directory));
    }

    public Map<String, CharacterRecord> records() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public PresenceState presenceState(String id) {
        if (record(id).present()) {
            return PresenceState.PRESENT;
        }
        return tasks.containsKey(id) ? PresenceState.ABSENT_TIMED : PresenceState.ABSENT_OPEN;
    }

    /**
     * Where the scene is happening: the location of the first present character
     * other than {@code excludedId}, or the default location.
     */
    public String sceneLocation(String excludedId) {
        return getActiveCharacters().stream()
                .filter(id -> !id.equals(excludedId))
                .map(id -> records.get(id).location())
                .filter(location -> !StringUtils.isBlank(location))
                .findFirst()
                .orElse(CharacterRecord.DEFAULT_LOCATION);
    }

    public long generation() {
        return generation;
    }

    // --- Mutations ---

    /**
     * Replace a record with a changed copy. Presence must not change here:
     * use {@link #depart} or {@link #arrive} so the task table stays consistent.
     */
    public CharacterRecord update(String id, UnaryOperator<CharacterRecord> change) {
        CharacterRecord current = record(id);
        CharacterRecord updated = change.apply(current);
        if (updated.present() != current.present()) {
            throw new IllegalArgumentException("Presence of " + id + " must change through depart or arrive");
        }
        replace(id, updated);
        return updated;
    }

    /**
     * Take a character out of the scene. A non-null task makes the absence timed;
     * a null task makes it open-ended and discards any earlier task.
     */
    public CharacterRecord depart(String id, String activity, String location, TemporaryTask task, long now) {
        CharacterRecord updated = record(id)
                .withPresence(false, activity, now)
                .withLocation(location);
        if (task == null) {
            tasks.remove(id);
        } else {
            tasks.put(id, task);
        }
        replace(id, updated);
        return updated;
    }

    /**
     * Bring a character (back) into the scene and discard any pending task.
     */
    public CharacterRecord arrive(String id, String activity, long now) {
        CharacterRecord current = record(id);
        CharacterRecord updated = current.withPresence(true, activity, now);
        if (!current.present()) {
            updated = updated.withLocation(sceneLocation(id));
        }
        tasks.remove(id);
        replace(id, updated);
        return updated;
    }

    /**
     * Cancel a pending task without bringing the character back: the absence becomes open-ended.
     */
    public void clearTask(String id) {
        record(id);
        if (tasks.remove(id) != null) {
            generation++;
        }
    }

    /**
     * Apply a new character directory. New identities get default records,
     * identities missing from the new directory are treated as removed.
     */
    public void refreshDirectory(Map<String, CharacterProfile> updated, long now) {
        Map<String, CharacterProfile> merged = new LinkedHashMap<>(updated);
        directory.forEach((id, profile) -> {
            if (!merged.containsKey(id)) {
                merged.put(id, new CharacterProfile(profile.name(), profile.personality(),
                        profile.description(), profile.scenario(), true));
            }
        });
        directory.clear();
        directory.putAll(merged);
        ensureRecords(now);
        generation++;
    }

    public SceneSnapshot snapshot() {
        return new SceneSnapshot(SceneSnapshot.CURRENT_VERSION, records, tasks);
    }

    private void replace(String id, CharacterRecord record) {
        records.put(id, record);
        generation++;
    }
}
