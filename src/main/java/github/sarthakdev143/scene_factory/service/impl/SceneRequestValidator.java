package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.exception.InvalidSceneRequestException;
import github.sarthakdev143.scene_factory.model.SceneDescription;
import github.sarthakdev143.scene_factory.model.SceneJobSubmission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class SceneRequestValidator {

    private static final int MAX_SCENES = 20;
    private static final int MAX_SCENE_DURATION_SECONDS = 60;
    private static final int MAX_SCENARIO_LENGTH = 64;
    private static final int MAX_OWNER_REFERENCE_LENGTH = 200;
    private static final Pattern SCENARIO_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    /**
     * Validates a submission and returns its scenes with trimmed text fields, in input order.
     */
    public List<SceneDescription> normalizeAndValidate(SceneJobSubmission submission) {
        if (submission == null) {
            throw new InvalidSceneRequestException("Submission is required.");
        }
        if (submission.ownerReference() != null && submission.ownerReference().length() > MAX_OWNER_REFERENCE_LENGTH) {
            throw new InvalidSceneRequestException(
                    "ownerReference must be at most " + MAX_OWNER_REFERENCE_LENGTH + " characters.");
        }

        List<SceneDescription> scenes = submission.scenes();
        if (scenes.isEmpty()) {
            throw new InvalidSceneRequestException("scenes must contain at least one scene.");
        }
        if (scenes.size() > MAX_SCENES) {
            throw new InvalidSceneRequestException("scenes supports at most " + MAX_SCENES + " scenes.");
        }

        List<SceneDescription> normalized = new ArrayList<>(scenes.size());
        Set<String> seenScenarios = new HashSet<>();
        for (int index = 0; index < scenes.size(); index++) {
            SceneDescription scene = scenes.get(index);
            if (scene == null) {
                throw new InvalidSceneRequestException("scenes[" + index + "] is required.");
            }

            String scenario = requireScenario(index, scene.scenario());
            if (!seenScenarios.add(scenario)) {
                throw new InvalidSceneRequestException("Duplicate scenario: " + scenario + ".");
            }

            if (scene.visualDescription() == null || scene.visualDescription().isBlank()) {
                throw new InvalidSceneRequestException("scenes[" + index + "].visualDescription is required.");
            }
            if (scene.durationSeconds() <= 0 || scene.durationSeconds() > MAX_SCENE_DURATION_SECONDS) {
                throw new InvalidSceneRequestException(
                        "scenes[" + index + "].durationSeconds must be between 1 and "
                                + MAX_SCENE_DURATION_SECONDS
                                + " seconds.");
            }

            normalized.add(new SceneDescription(
                    scenario,
                    scene.durationSeconds(),
                    scene.visualDescription().trim(),
                    trimToNull(scene.cameraWork()),
                    trimToNull(scene.lighting()),
                    trimToNull(scene.audioDesign()),
                    trimToNull(scene.backgroundMusic()),
                    trimToNull(scene.soundEffects()),
                    trimToNull(scene.dialogNarration())));
        }
        return normalized;
    }

    private String requireScenario(int index, String scenarioInput) {
        if (scenarioInput == null || scenarioInput.isBlank()) {
            throw new InvalidSceneRequestException("scenes[" + index + "].scenario is required.");
        }
        String scenario = scenarioInput.trim();
        if (scenario.length() > MAX_SCENARIO_LENGTH) {
            throw new InvalidSceneRequestException(
                    "scenes[" + index + "].scenario must be at most " + MAX_SCENARIO_LENGTH + " characters.");
        }
        if (!SCENARIO_PATTERN.matcher(scenario).matches()) {
            throw new InvalidSceneRequestException(
                    "scenes[" + index + "].scenario may only contain letters, digits, '-' and '_'.");
        }
        return scenario;
    }

    private String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
