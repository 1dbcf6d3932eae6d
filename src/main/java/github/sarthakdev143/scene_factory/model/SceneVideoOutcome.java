package github.sarthakdev143.scene_factory.model;

import java.nio.file.Path;

public record SceneVideoOutcome(
        String scenario,
        Path videoPath,
        SeedSource seedSource,
        int appliedDurationSeconds,
        int attempts,
        String error) {

    public boolean succeeded() {
        return videoPath != null;
    }
}
