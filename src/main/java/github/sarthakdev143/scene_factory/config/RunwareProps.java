package github.sarthakdev143.scene_factory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "scene-factory.runware")
public record RunwareProps(
        String baseUrl,
        String apiKey,
        String videoModel,
        String imageModel,
        String audioModel,
        Duration connectTimeout,
        Duration readTimeout) {

    public RunwareProps {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.runware.ai/v1" : baseUrl;
        videoModel = videoModel == null || videoModel.isBlank() ? "klingai:6@1" : videoModel;
        imageModel = imageModel == null || imageModel.isBlank() ? "runware:100@1" : imageModel;
        audioModel = audioModel == null || audioModel.isBlank() ? "elevenlabs:1@1" : audioModel;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofMinutes(5) : readTimeout;
    }
}
