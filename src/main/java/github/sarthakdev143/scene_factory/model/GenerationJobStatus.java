package github.sarthakdev143.scene_factory.model;

import github.sarthakdev143.scene_factory.model.assembly.AssemblyStatus;

import java.time.Instant;
import java.util.List;

public record GenerationJobStatus(
        String jobId,
        String ownerReference,
        OverallStatus overallStatus,
        Instant createdAt,
        List<SceneJob> scenes,
        AssemblyStatus assembly) {

    public GenerationJobStatus {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }
}
