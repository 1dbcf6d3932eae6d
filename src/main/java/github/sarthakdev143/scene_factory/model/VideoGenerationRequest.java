package github.sarthakdev143.scene_factory.model;

public record VideoGenerationRequest(
        String prompt,
        int durationSeconds,
        String seedImageHandle,
        int width,
        int height) {
}
