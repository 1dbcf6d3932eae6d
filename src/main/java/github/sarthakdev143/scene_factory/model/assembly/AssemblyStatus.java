package github.sarthakdev143.scene_factory.model.assembly;

import java.time.Instant;

public record AssemblyStatus(
        AssemblyState state,
        String finalArtifactPath,
        Double totalDurationSeconds,
        Boolean crossfadeApplied,
        String error,
        Instant updatedAt) {

    public static AssemblyStatus pending() {
        return new AssemblyStatus(AssemblyState.PENDING, null, null, null, null, Instant.now());
    }

    public static AssemblyStatus running() {
        return new AssemblyStatus(AssemblyState.RUNNING, null, null, null, null, Instant.now());
    }

    public static AssemblyStatus completed(AssemblyResult result) {
        return new AssemblyStatus(
                AssemblyState.COMPLETED,
                result.finalArtifact().toString(),
                result.totalDurationSeconds(),
                result.crossfadeApplied(),
                null,
                Instant.now());
    }

    public static AssemblyStatus failed(String error) {
        return new AssemblyStatus(AssemblyState.FAILED, null, null, null, error, Instant.now());
    }

    public static AssemblyStatus skipped(String reason) {
        return new AssemblyStatus(AssemblyState.SKIPPED, null, null, null, reason, Instant.now());
    }
}
