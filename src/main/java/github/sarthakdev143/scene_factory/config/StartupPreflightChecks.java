package github.sarthakdev143.scene_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "scene-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final SceneFactoryProperties properties;
    private final RunwareProps runwareProps;

    public StartupPreflightChecks(SceneFactoryProperties properties, RunwareProps runwareProps) {
        this.properties = properties;
        this.runwareProps = runwareProps;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(resolve(properties.assembly().ffmpegPath(), "FFMPEG_PATH", "ffmpeg"), "FFMPEG_PATH");
        checkBinary(resolve(properties.assembly().ffprobePath(), "FFPROBE_PATH", "ffprobe"), "FFPROBE_PATH");
        checkOutputDirectory(properties.outputDir());
        checkApiKey();
        logger.info("Preflight checks passed, writing outputs to {}", properties.outputDir().toAbsolutePath());
    }

    private void checkBinary(String binary, String envName) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            // The version banner is not needed, only the exit code.
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        binary + " is not available. Install FFmpeg or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(binary + " is not available. Install FFmpeg or set " + envName + ".", e);
        }
    }

    private void checkOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Output directory " + outputDir.toAbsolutePath() + " cannot be created.", e);
        }
        if (!Files.isWritable(outputDir)) {
            throw new IllegalStateException("Output directory " + outputDir.toAbsolutePath() + " is not writable.");
        }
    }

    private void checkApiKey() {
        if (runwareProps.apiKey() == null || runwareProps.apiKey().isBlank()) {
            throw new IllegalStateException(
                    "Runware API key is missing. Set scene-factory.runware.api-key or RUNWARE_API_KEY.");
        }
    }

    private String resolve(String configured, String envName, String fallback) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv(envName);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : fallback;
    }
}
