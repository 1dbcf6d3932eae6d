package github.sarthakdev143.scene_factory.model;

/**
 * Handle of an uploaded last frame, usable as the first frame of the next scene.
 */
public record FrameContinuityToken(String handle, String sourceScenario) {
}
