package github.sarthakdev143.scene_factory.dto;

public record SceneDescriptionRequest(
        String scenario,
        Integer durationSeconds,
        String visualDescription,
        String cameraWork,
        String lighting,
        String audioDesign,
        String backgroundMusic,
        String soundEffects,
        String dialogNarration) {
}
