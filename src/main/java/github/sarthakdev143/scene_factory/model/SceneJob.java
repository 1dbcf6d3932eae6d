package github.sarthakdev143.scene_factory.model;

import java.time.Instant;

/**
 * Immutable snapshot of one scene's generation lifecycle. Every update produces a new snapshot, so a
 * reader always sees state, progress, result and error from the same write.
 */
public record SceneJob(
        String scenario,
        SceneJobState state,
        int progress,
        String resultUri,
        String error,
        int durationSeconds,
        Integer appliedDurationSeconds,
        SeedSource seedSource,
        Instant updatedAt) {

    public static SceneJob pending(String scenario, int durationSeconds) {
        return new SceneJob(scenario, SceneJobState.PENDING, 0, null, null, durationSeconds, null, null, Instant.now());
    }

    public SceneJob generating(int newProgress) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Scene " + scenario + " is already " + state.toApiValue() + ".");
        }
        int boundedProgress = Math.min(Math.max(newProgress, 0), 99);
        int monotonicProgress = state == SceneJobState.GENERATING ? Math.max(progress, boundedProgress) : boundedProgress;
        return new SceneJob(
                scenario,
                SceneJobState.GENERATING,
                monotonicProgress,
                null,
                null,
                durationSeconds,
                appliedDurationSeconds,
                seedSource,
                Instant.now());
    }

    public SceneJob withAppliedDuration(int appliedDuration) {
        return new SceneJob(
                scenario,
                state,
                progress,
                resultUri,
                error,
                durationSeconds,
                appliedDuration,
                seedSource,
                Instant.now());
    }

    public SceneJob completed(String uri, SeedSource source, int appliedDuration) {
        if (state == SceneJobState.PENDING) {
            throw new IllegalStateException("Scene " + scenario + " was never dispatched.");
        }
        return new SceneJob(
                scenario,
                SceneJobState.COMPLETED,
                100,
                uri,
                null,
                durationSeconds,
                appliedDuration,
                source,
                Instant.now());
    }

    public SceneJob failed(String message) {
        if (state == SceneJobState.COMPLETED) {
            throw new IllegalStateException("Scene " + scenario + " is already completed.");
        }
        return new SceneJob(
                scenario,
                SceneJobState.FAILED,
                progress,
                null,
                message == null || message.isBlank() ? "Scene generation failed." : message,
                durationSeconds,
                appliedDurationSeconds,
                seedSource,
                Instant.now());
    }
}
