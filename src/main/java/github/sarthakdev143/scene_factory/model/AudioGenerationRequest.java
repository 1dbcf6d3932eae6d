package github.sarthakdev143.scene_factory.model;

public record AudioGenerationRequest(String prompt, int durationSeconds) {
}
