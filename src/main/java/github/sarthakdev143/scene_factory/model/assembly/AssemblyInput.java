package github.sarthakdev143.scene_factory.model.assembly;

import java.nio.file.Path;

/**
 * A completed scene handed to the assembly engine. {@code audioPath} is null for video-only scenes.
 */
public record AssemblyInput(String scenario, Path videoPath, Path audioPath) {
}
