package github.sarthakdev143.scene_factory.model;

public record MediaProbe(
        double durationSeconds,
        int width,
        int height,
        boolean hasAudio) {
}
