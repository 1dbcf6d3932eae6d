package github.sarthakdev143.scene_factory.model.assembly;

import java.nio.file.Path;

public record CrossfadeClip(Path path, double durationSeconds, boolean hasAudio) {
}
