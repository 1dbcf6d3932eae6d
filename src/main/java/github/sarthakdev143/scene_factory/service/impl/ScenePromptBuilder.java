package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.model.SceneDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure prompt assembly from scene descriptions. Blank fields are left out.
 */
public final class ScenePromptBuilder {

    static final String DEFAULT_AUDIO_PROMPT =
            "Professional background music and sound effects that synchronize with the video";

    private ScenePromptBuilder() {
    }

    public static String videoPrompt(SceneDescription scene) {
        List<String> parts = new ArrayList<>();
        appendIfPresent(parts, "Visual: ", scene.visualDescription());
        appendIfPresent(parts, "Camera: ", scene.cameraWork());
        appendIfPresent(parts, "Lighting: ", scene.lighting());
        return String.join(". ", parts);
    }

    public static String imagePrompt(SceneDescription scene) {
        List<String> parts = new ArrayList<>();
        appendIfPresent(parts, "", scene.visualDescription());
        appendIfPresent(parts, "Lighting: ", scene.lighting());
        parts.add("Single cinematic still frame, no text");
        return String.join(". ", parts);
    }

    public static String audioPrompt(SceneDescription scene) {
        List<String> parts = new ArrayList<>();
        appendIfPresent(parts, "", scene.audioDesign());
        appendIfPresent(parts, "Background music: ", scene.backgroundMusic());
        appendIfPresent(parts, "Sound effects: ", scene.soundEffects());
        appendIfPresent(parts, "Dialog/narration: ", scene.dialogNarration());
        return parts.isEmpty() ? DEFAULT_AUDIO_PROMPT : String.join(". ", parts);
    }

    private static void appendIfPresent(List<String> parts, String label, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(label + value.trim());
        }
    }
}
