package github.sarthakdev143.scene_factory.model;

public record SceneDescription(
        String scenario,
        int durationSeconds,
        String visualDescription,
        String cameraWork,
        String lighting,
        String audioDesign,
        String backgroundMusic,
        String soundEffects,
        String dialogNarration) {

    public static SceneDescription of(String scenario, int durationSeconds, String visualDescription) {
        return new SceneDescription(scenario, durationSeconds, visualDescription, null, null, null, null, null, null);
    }
}
