package github.sarthakdev143.scene_factory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "scene-factory")
public record SceneFactoryProperties(
        Path outputDir,
        Generation generation,
        Assembly assembly) {

    public SceneFactoryProperties {
        outputDir = outputDir == null ? Path.of("outputs") : outputDir;
        generation = generation == null ? Generation.defaults() : generation;
        assembly = assembly == null ? Assembly.defaults() : assembly;
    }

    public static SceneFactoryProperties defaults() {
        return new SceneFactoryProperties(null, null, null);
    }

    public record Generation(
            Boolean continuityEnabled,
            Boolean staticImagesEnabled,
            Integer staticImageMinSuccess,
            Boolean audioEnabled,
            Integer fanOutConcurrency,
            List<Integer> acceptedVideoDurations,
            Integer videoWidth,
            Integer videoHeight,
            Integer imageWidth,
            Integer imageHeight,
            Duration pollInterval,
            Duration maxTaskWait,
            List<Duration> seedRetryBackoff,
            Duration continuitySettleDelay) {

        public Generation {
            continuityEnabled = continuityEnabled == null || continuityEnabled;
            staticImagesEnabled = staticImagesEnabled == null || staticImagesEnabled;
            staticImageMinSuccess = staticImageMinSuccess == null ? 0 : Math.max(staticImageMinSuccess, 0);
            audioEnabled = audioEnabled == null || audioEnabled;
            fanOutConcurrency = fanOutConcurrency == null ? 4 : Math.max(fanOutConcurrency, 1);
            acceptedVideoDurations = acceptedVideoDurations == null ? List.of(5, 10) : List.copyOf(acceptedVideoDurations);
            videoWidth = videoWidth == null ? 1920 : videoWidth;
            videoHeight = videoHeight == null ? 1080 : videoHeight;
            imageWidth = imageWidth == null ? 1024 : imageWidth;
            imageHeight = imageHeight == null ? 1024 : imageHeight;
            pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
            maxTaskWait = maxTaskWait == null ? Duration.ofMinutes(10) : maxTaskWait;
            seedRetryBackoff = seedRetryBackoff == null
                    ? List.of(Duration.ofSeconds(2), Duration.ofSeconds(4))
                    : List.copyOf(seedRetryBackoff);
            continuitySettleDelay = continuitySettleDelay == null ? Duration.ofSeconds(3) : continuitySettleDelay;
        }

        public static Generation defaults() {
            return new Generation(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
    }

    public record Assembly(
            Double transitionSeconds,
            String ffmpegPath,
            String ffprobePath,
            Duration commandTimeout) {

        public Assembly {
            transitionSeconds = transitionSeconds == null ? 0.3 : Math.max(transitionSeconds, 0.0);
            commandTimeout = commandTimeout == null ? Duration.ofMinutes(10) : commandTimeout;
        }

        public static Assembly defaults() {
            return new Assembly(null, null, null, null);
        }
    }
}
