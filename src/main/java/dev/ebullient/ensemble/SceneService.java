package dev.ebullient.ensemble;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.EnforcementResult;
import dev.ebullient.ensemble.model.ExtractionSummary;
import dev.ebullient.ensemble.model.ReviewResult;
import dev.ebullient.ensemble.model.SceneSnapshot;
import dev.ebullient.ensemble.model.SceneView;
import dev.ebullient.ensemble.model.StoredScene;

/**
 * Owns scene instances.
 * <p>
 * Every operation on a scene runs under that scene's lock, including the write
 * of its snapshot file, so narrative passes on one scene never interleave.
 * Scenes are kept in memory once opened and reloaded from {@code <sceneDir>/<id>.json}
 * on first use after a restart.
 */
@Singleton
public class SceneService {
    private static final Logger log = Logger.getLogger(SceneService.class);

    static final ConcurrentHashMap<String, Object> SCENE_LOCKS = new ConcurrentHashMap<>();

    private static final Pattern SCENE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    @ConfigProperty(name = "ensemble.scene.dir", defaultValue = "${user.home}/.ensemble")
    String sceneDir;

    @ConfigProperty(name = "ensemble.drift.probability", defaultValue = "0.05")
    double driftProbability;

    @ConfigProperty(name = "ensemble.drift.min-absence", defaultValue = "PT10M")
    Duration driftMinAbsence;

    @ConfigProperty(name = "ensemble.task.min-duration", defaultValue = "PT2M")
    Duration taskMinDuration;

    @ConfigProperty(name = "ensemble.task.max-duration", defaultValue = "PT7M")
    Duration taskMaxDuration;

    @Inject
    ObjectMapper objectMapper;

    InstantSource clock = InstantSource.system();

    RandomSource random = RandomSource.system();

    private final ConcurrentHashMap<String, SceneState> scenes = new ConcurrentHashMap<>();

    private volatile NarrativeEventExtractor extractor;

    private final OutputConsistencyEnforcer enforcer = new OutputConsistencyEnforcer();

    private Path resolveSceneDir() {
        Path dir = Path.of(sceneDir);
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new RuntimeException("Cannot create scene directory: " + dir, e);
            }
        }
        return dir;
    }

    private Path scenePath(String sceneId) {
        if (sceneId == null || !SCENE_ID.matcher(sceneId).matches()) {
            throw new IllegalArgumentException("Invalid scene id: " + sceneId);
        }
        return resolveSceneDir().resolve(sceneId + ".json");
    }

    TrackerSettings settings() {
        return new TrackerSettings(driftProbability, driftMinAbsence, taskMinDuration, taskMaxDuration);
    }

    NarrativeEventExtractor extractor() {
        NarrativeEventExtractor result = extractor;
        if (result == null) {
            synchronized (this) {
                result = extractor;
                if (result == null) {
                    result = extractor = new NarrativeEventExtractor(settings(), clock, random);
                }
            }
        }
        return result;
    }

    private <T> T withLock(String sceneId, Supplier<T> action) {
        Object lock = SCENE_LOCKS.computeIfAbsent(sceneId, k -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }

    // --- Scene lifecycle ---

    /**
     * Open a scene with the given character directory. An open scene picks up
     * directory changes; a scene saved earlier is restored from disk; otherwise
     * every character starts present with default state.
     */
    public SceneView openScene(String sceneId, Map<String, CharacterProfile> directory) {
        if (directory == null || directory.isEmpty()) {
            throw new IllegalArgumentException("A scene needs at least one character");
        }
        return withLock(sceneId, () -> {
            long now = clock.millis();
            SceneState scene = scenes.get(sceneId);
            if (scene != null) {
                scene.refreshDirectory(directory, now);
            } else {
                SceneSnapshot snapshot = readStoredScene(sceneId).map(StoredScene::snapshot).orElse(null);
                scene = SceneState.restore(directory, snapshot, now);
                scenes.put(sceneId, scene);
                log.infof("Opened scene %s with %d characters (%s)", sceneId,
                        scene.getAvailableCharacters().size(), snapshot == null ? "new" : "restored");
            }
            persist(sceneId, scene);
            return toView(sceneId, scene);
        });
    }

    public boolean hasScene(String sceneId) {
        return scenes.containsKey(sceneId) || Files.exists(scenePath(sceneId));
    }

    public List<String> listScenes() {
        Path dir = resolveSceneDir();
        List<String> ids = new ArrayList<>(scenes.keySet());
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json"))
                    .map(name -> name.substring(0, name.length() - 5))
                    .filter(id -> !ids.contains(id))
                    .forEach(ids::add);
        } catch (IOException e) {
            log.errorf(e, "Failed to list scenes in %s", dir);
        }
        return ids.stream().sorted().toList();
    }

    public boolean deleteScene(String sceneId) {
        return withLock(sceneId, () -> {
            boolean known = scenes.remove(sceneId) != null;
            Path path = scenePath(sceneId);
            if (Files.exists(path)) {
                try {
                    Files.delete(path);
                    known = true;
                } catch (IOException e) {
                    throw new RuntimeException("Failed to delete scene file: " + path, e);
                }
            }
            if (known) {
                log.infof("Deleted scene %s", sceneId);
            }
            return known;
        });
    }

    // --- Narrative passes ---

    /**
     * Run a narrative pass over inbound text (what the user wrote).
     */
    public ExtractionSummary ingest(String sceneId, String text) {
        return withScene(sceneId, scene -> {
            ExtractionSummary summary = extractor().extract(scene, text);
            persist(sceneId, scene);
            return summary;
        });
    }

    /**
     * Check generated text against the scene without changing it.
     */
    public EnforcementResult enforce(String sceneId, String text) {
        return withScene(sceneId, scene -> enforcer.process(scene, text));
    }

    /**
     * Accept generated text: clean it up, then run a narrative pass over the cleaned text.
     */
    public ReviewResult review(String sceneId, String text) {
        return withScene(sceneId, scene -> {
            EnforcementResult enforcement = enforcer.process(scene, text);
            ExtractionSummary summary = extractor().extract(scene, enforcement.cleanedText());
            persist(sceneId, scene);
            return new ReviewResult(enforcement, summary);
        });
    }

    // --- Queries ---

    public Optional<SceneView> view(String sceneId) {
        if (!hasScene(sceneId)) {
            return Optional.empty();
        }
        return Optional.of(withScene(sceneId, scene -> toView(sceneId, scene)));
    }

    public SceneSnapshot snapshot(String sceneId) {
        return withScene(sceneId, SceneState::snapshot);
    }

    /**
     * Run an action against a scene while holding its lock.
     *
     * @throws IllegalArgumentException if the scene was never opened
     */
    public <T> T withScene(String sceneId, Function<SceneState, T> action) {
        return withLock(sceneId, () -> action.apply(requireScene(sceneId)));
    }

    private SceneState requireScene(String sceneId) {
        SceneState scene = scenes.get(sceneId);
        if (scene != null) {
            return scene;
        }
        StoredScene stored = readStoredScene(sceneId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown scene: " + sceneId));
        scene = SceneState.restore(stored.directory(), stored.snapshot(), clock.millis());
        scenes.put(sceneId, scene);
        log.infof("Reloaded scene %s", sceneId);
        return scene;
    }

    SceneView toView(String sceneId, SceneState scene) {
        return new SceneView(sceneId,
                scene.getAvailableCharacters(),
                scene.getActiveCharacters(),
                scene.getAbsentCharacters(),
                scene.records(),
                scene.tasks());
    }

    // --- Persistence ---

    private void persist(String sceneId, SceneState scene) {
        Path path = scenePath(sceneId);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new StoredScene(scene.directory(), scene.snapshot()));
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write scene file: " + path, e);
        }
    }

    Optional<StoredScene> readStoredScene(String sceneId) {
        Path path = scenePath(sceneId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            StoredScene stored = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8),
                    StoredScene.class);
            SceneSnapshot snapshot = stored.snapshot();
            if (snapshot != null && snapshot.version() > SceneSnapshot.CURRENT_VERSION) {
                log.warnf("Scene %s was saved by a newer version (%d); reading what we can",
                        sceneId, snapshot.version());
            }
            return Optional.of(stored);
        } catch (IOException e) {
            log.errorf(e, "Failed to read scene file %s; starting fresh", path);
            return Optional.empty();
        }
    }
}
