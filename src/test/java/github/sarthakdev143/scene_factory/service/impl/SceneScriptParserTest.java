package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.model.SceneDescription;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SceneScriptParserTest {

    private static final String SCRIPT = """
            Here is your campaign.

            **SCENE 1: HOOK (5 seconds)**
            **Visual Description:** A glowing bottle spins on a marble counter.
            **Camera/Movement:** Fast orbit around the product.
            **Lighting & Mood:** High contrast studio light.
            **Audio Design:**
            - Background Music: Punchy electronic intro
            - Sound Effects: Whoosh
            - Dialog/Narration: "Meet your new morning."

            **SCENE 2: PROBLEM**
            Visual Description: A tired person waits for a slow kettle.

            **SCENE 3: SOLUTION (10 seconds)**
            Camera/Movement: Static wide shot.

            **SCENE 4: CALL-TO-ACTION (6 seconds - NO TEXT OVERLAY)**
            Visual Description: Product hero shot with logo.
            Lighting & Mood: Soft golden hour glow.
            """;

    @Test
    void parsesLabelledFieldsOfEachScene() {
        List<SceneDescription> scenes = SceneScriptParser.parse(SCRIPT);

        assertThat(scenes).extracting(SceneDescription::scenario).containsExactly("hook", "problem", "cta");

        SceneDescription hook = scenes.get(0);
        assertThat(hook.durationSeconds()).isEqualTo(5);
        assertThat(hook.visualDescription()).isEqualTo("A glowing bottle spins on a marble counter.");
        assertThat(hook.cameraWork()).isEqualTo("Fast orbit around the product.");
        assertThat(hook.lighting()).isEqualTo("High contrast studio light.");
        assertThat(hook.backgroundMusic()).isEqualTo("Punchy electronic intro");
        assertThat(hook.soundEffects()).isEqualTo("Whoosh");
        assertThat(hook.dialogNarration()).isEqualTo("\"Meet your new morning.\"");
    }

    @Test
    void missingDurationAndFieldsUseDefaults() {
        SceneDescription problem = SceneScriptParser.parse(SCRIPT).get(1);

        assertThat(problem.durationSeconds()).isEqualTo(7);
        assertThat(problem.cameraWork()).isEqualTo(SceneScriptParser.DEFAULT_CAMERA_WORK);
        assertThat(problem.lighting()).isEqualTo(SceneScriptParser.DEFAULT_LIGHTING);
        assertThat(problem.backgroundMusic()).isNull();
    }

    @Test
    void callToActionHeaderMapsToCtaScenario() {
        SceneDescription cta = SceneScriptParser.parse(SCRIPT).get(2);

        assertThat(cta.scenario()).isEqualTo("cta");
        assertThat(cta.durationSeconds()).isEqualTo(6);
        assertThat(cta.lighting()).isEqualTo("Soft golden hour glow.");
    }

    @Test
    void unparseableInputYieldsNoScenes() {
        assertThat(SceneScriptParser.parse("no scenes here")).isEmpty();
        assertThat(SceneScriptParser.parse("")).isEmpty();
        assertThat(SceneScriptParser.parse(null)).isEmpty();
    }
}
