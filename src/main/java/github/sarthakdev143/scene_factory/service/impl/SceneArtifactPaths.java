package github.sarthakdev143.scene_factory.service.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Naming of the files a job writes under {@code <output-dir>/<jobId>/}.
 */
final class SceneArtifactPaths {

    private final Path jobDirectory;

    SceneArtifactPaths(Path outputDirectory, String jobId) {
        this.jobDirectory = outputDirectory.resolve(jobId);
    }

    Path jobDirectory() {
        return jobDirectory;
    }

    Path ensureJobDirectory() throws IOException {
        return Files.createDirectories(jobDirectory);
    }

    Path video(int index, String scenario) {
        return sceneFile(index, scenario, ".mp4");
    }

    Path regeneratedVideo(int index, String scenario, long stamp) {
        return sceneFile(index, scenario, "-regen-" + stamp + ".mp4");
    }

    Path lastFrame(int index, String scenario) {
        return sceneFile(index, scenario, "-last.png");
    }

    Path staticImage(int index, String scenario) {
        return sceneFile(index, scenario, "-still.png");
    }

    Path audio(int index, String scenario) {
        return sceneFile(index, scenario, "-audio.mp3");
    }

    Path merged(int index, String scenario) {
        return sceneFile(index, scenario, "-merged.mp4");
    }

    Path finalVideo() {
        return jobDirectory.resolve("final.mp4");
    }

    private Path sceneFile(int index, String scenario, String suffix) {
        return jobDirectory.resolve("scene-" + (index + 1) + "-" + scenario + suffix);
    }
}
