package github.sarthakdev143.scene_factory.model;

public record SceneRegenerationResult(
        String jobId,
        String scenario,
        boolean replaced,
        SceneJob scene,
        String error) {
}
