package github.sarthakdev143.scene_factory.model.assembly;

import java.nio.file.Path;

/**
 * A scene clip after the audio merge step. {@code audioPath} is null when the clip stayed video-only.
 */
public record AssemblyEntry(
        String scenario,
        Path videoPath,
        Path audioPath) {
}
