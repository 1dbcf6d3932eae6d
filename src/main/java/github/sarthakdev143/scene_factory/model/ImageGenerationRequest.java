package github.sarthakdev143.scene_factory.model;

public record ImageGenerationRequest(String prompt, int width, int height) {
}
