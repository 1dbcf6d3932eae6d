package github.sarthakdev143.scene_factory.model.assembly;

import java.nio.file.Path;

public record AssemblyResult(
        Path finalArtifact,
        double totalDurationSeconds,
        int sceneCount,
        boolean crossfadeApplied) {
}
