package github.sarthakdev143.scene_factory.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneJobTest {

    @Test
    void pendingSceneStartsWithoutResult() {
        SceneJob scene = SceneJob.pending("hook", 7);

        assertThat(scene.state()).isEqualTo(SceneJobState.PENDING);
        assertThat(scene.progress()).isZero();
        assertThat(scene.resultUri()).isNull();
        assertThat(scene.error()).isNull();
        assertThat(scene.durationSeconds()).isEqualTo(7);
    }

    @Test
    void progressNeverDecreasesWhileGenerating() {
        SceneJob scene = SceneJob.pending("hook", 7).generating(30).generating(10);

        assertThat(scene.progress()).isEqualTo(30);
        assertThat(scene.generating(250).progress()).isEqualTo(99);
    }

    @Test
    void completedSceneCarriesResultAndClearsError() {
        SceneJob scene = SceneJob.pending("hook", 7)
                .generating(10)
                .withAppliedDuration(10)
                .completed("outputs/job/scene-1-hook.mp4", SeedSource.STATIC_IMAGE, 10);

        assertThat(scene.state()).isEqualTo(SceneJobState.COMPLETED);
        assertThat(scene.progress()).isEqualTo(100);
        assertThat(scene.resultUri()).isEqualTo("outputs/job/scene-1-hook.mp4");
        assertThat(scene.error()).isNull();
        assertThat(scene.appliedDurationSeconds()).isEqualTo(10);
        assertThat(scene.seedSource()).isEqualTo(SeedSource.STATIC_IMAGE);
    }

    @Test
    void failedSceneHasErrorAndNoResult() {
        SceneJob scene = SceneJob.pending("hook", 7).generating(50).failed(" ");

        assertThat(scene.state()).isEqualTo(SceneJobState.FAILED);
        assertThat(scene.resultUri()).isNull();
        assertThat(scene.error()).isEqualTo("Scene generation failed.");
    }

    @Test
    void terminalSceneCannotReturnToGenerating() {
        SceneJob failed = SceneJob.pending("hook", 7).generating(10).failed("boom");

        assertThatThrownBy(() -> failed.generating(20)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void completedSceneCannotFail() {
        SceneJob completed = SceneJob.pending("hook", 7).generating(10).completed("a.mp4", SeedSource.NONE, 5);

        assertThatThrownBy(() -> completed.failed("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pendingSceneCannotCompleteWithoutDispatch() {
        assertThatThrownBy(() -> SceneJob.pending("hook", 7).completed("a.mp4", SeedSource.NONE, 5))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedSceneCanBeReplacedByRegeneratedResult() {
        SceneJob regenerated = SceneJob.pending("hook", 7)
                .generating(10)
                .failed("boom")
                .completed("b.mp4", SeedSource.STATIC_IMAGE, 10);

        assertThat(regenerated.state()).isEqualTo(SceneJobState.COMPLETED);
        assertThat(regenerated.error()).isNull();
    }
}
