package github.sarthakdev143.scene_factory.model;

import github.sarthakdev143.scene_factory.model.assembly.AssemblyState;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Aggregate tracked per orchestrator invocation.
 * <p>
 * The scene key set is fixed at creation and keeps insertion order. Each scene lives in its own
 * {@link AtomicReference}, so writers targeting different scenes never contend and readers always see a
 * whole {@link SceneJob}. The overall status is derived on every read.
 */
public final class GenerationJob {

    private final String jobId;
    private final String ownerReference;
    private final Instant createdAt;
    private final boolean continuityEnabled;
    private final Map<String, SceneDescription> descriptions;
    private final Map<String, AtomicReference<SceneJob>> scenes;
    private final Map<String, String> staticImageHandles = new ConcurrentHashMap<>();
    private final Map<String, Path> audioTracks = new ConcurrentHashMap<>();
    private final Set<String> regenerating = ConcurrentHashMap.newKeySet();
    private final AtomicReference<AssemblyStatus> assembly = new AtomicReference<>(AssemblyStatus.pending());

    public GenerationJob(
            String jobId,
            String ownerReference,
            List<SceneDescription> sceneDescriptions,
            boolean continuityEnabled) {
        this.jobId = jobId;
        this.ownerReference = ownerReference;
        this.createdAt = Instant.now();
        this.continuityEnabled = continuityEnabled;

        Map<String, SceneDescription> orderedDescriptions = new LinkedHashMap<>();
        Map<String, AtomicReference<SceneJob>> orderedScenes = new LinkedHashMap<>();
        for (SceneDescription description : sceneDescriptions) {
            if (orderedScenes.containsKey(description.scenario())) {
                throw new IllegalArgumentException("Duplicate scenario: " + description.scenario());
            }
            orderedDescriptions.put(description.scenario(), description);
            orderedScenes.put(
                    description.scenario(),
                    new AtomicReference<>(SceneJob.pending(description.scenario(), description.durationSeconds())));
        }
        this.descriptions = Collections.unmodifiableMap(orderedDescriptions);
        this.scenes = Collections.unmodifiableMap(orderedScenes);
    }

    public String jobId() {
        return jobId;
    }

    public String ownerReference() {
        return ownerReference;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean continuityEnabled() {
        return continuityEnabled;
    }

    public List<SceneDescription> descriptions() {
        return List.copyOf(descriptions.values());
    }

    public Optional<SceneDescription> description(String scenario) {
        return Optional.ofNullable(descriptions.get(scenario));
    }

    public boolean hasScene(String scenario) {
        return scenes.containsKey(scenario);
    }

    public SceneJob scene(String scenario) {
        return sceneRef(scenario).get();
    }

    public List<SceneJob> scenes() {
        List<SceneJob> snapshot = new ArrayList<>(scenes.size());
        for (AtomicReference<SceneJob> reference : scenes.values()) {
            snapshot.add(reference.get());
        }
        return snapshot;
    }

    /**
     * Applies {@code update} to one scene as a single atomic write and returns the new snapshot.
     */
    public SceneJob updateScene(String scenario, UnaryOperator<SceneJob> update) {
        return sceneRef(scenario).updateAndGet(update);
    }

    public OverallStatus overallStatus() {
        return OverallStatus.of(scenes().stream().map(SceneJob::state).toList());
    }

    public void recordStaticImageHandle(String scenario, String handle) {
        if (handle != null) {
            staticImageHandles.put(scenario, handle);
        }
    }

    public Optional<String> staticImageHandle(String scenario) {
        return Optional.ofNullable(staticImageHandles.get(scenario));
    }

    public Map<String, String> staticImageHandles() {
        return Map.copyOf(staticImageHandles);
    }

    public void recordAudioTrack(String scenario, Path audioPath) {
        if (audioPath != null) {
            audioTracks.put(scenario, audioPath);
        }
    }

    public Optional<Path> audioTrack(String scenario) {
        return Optional.ofNullable(audioTracks.get(scenario));
    }

    public boolean beginRegeneration(String scenario) {
        return regenerating.add(scenario);
    }

    public void endRegeneration(String scenario) {
        regenerating.remove(scenario);
    }

    public boolean isRegenerating(String scenario) {
        return regenerating.contains(scenario);
    }

    public AssemblyStatus assembly() {
        return assembly.get();
    }

    public void updateAssembly(AssemblyStatus status) {
        assembly.set(status);
    }

    /**
     * Moves the assembly to {@code running} unless one is already running.
     */
    public boolean tryStartAssembly(AssemblyStatus running) {
        AssemblyStatus current = assembly.get();
        while (current.state() != AssemblyState.RUNNING) {
            if (assembly.compareAndSet(current, running)) {
                return true;
            }
            current = assembly.get();
        }
        return false;
    }

    public GenerationJobStatus snapshot() {
        List<SceneJob> sceneSnapshot = scenes();
        return new GenerationJobStatus(
                jobId,
                ownerReference,
                OverallStatus.of(sceneSnapshot.stream().map(SceneJob::state).toList()),
                createdAt,
                sceneSnapshot,
                assembly.get());
    }

    private AtomicReference<SceneJob> sceneRef(String scenario) {
        AtomicReference<SceneJob> reference = scenes.get(scenario);
        if (reference == null) {
            throw new IllegalArgumentException("Unknown scenario " + scenario + " for job " + jobId);
        }
        return reference;
    }
}
