package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyInput;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyResult;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadeClip;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadePlan;
import github.sarthakdev143.scene_factory.support.FakeMediaTranscoder;
import github.sarthakdev143.scene_factory.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SceneAssemblyEngineTest {

    @TempDir
    Path outputDir;

    private FakeMediaTranscoder transcoder;
    private SimpleMeterRegistry meterRegistry;
    private SceneAssemblyEngine engine;

    @BeforeEach
    void setUp() {
        transcoder = new FakeMediaTranscoder(path -> null);
        meterRegistry = new SimpleMeterRegistry();
        engine = new SceneAssemblyEngine(transcoder, TestProperties.fast(outputDir), meterRegistry);
    }

    @Test
    void singleClipIsReturnedAsFinalArtifact() throws Exception {
        List<AssemblyInput> inputs = clips(new double[]{5.0}, false);

        AssemblyResult result = engine.assemble("job-1", inputs);

        assertThat(result.finalArtifact()).isEqualTo(inputs.get(0).videoPath());
        assertThat(result.totalDurationSeconds()).isEqualTo(5.0);
        assertThat(result.sceneCount()).isEqualTo(1);
        assertThat(result.crossfadeApplied()).isFalse();
        assertThat(transcoder.crossfadePlans()).isEmpty();
        assertThat(transcoder.losslessInputs()).isEmpty();
    }

    @Test
    void crossfadesClipsAndShortensTimelineByTransitions() throws Exception {
        List<AssemblyInput> inputs = clips(new double[]{5.0, 5.0, 10.0, 5.0}, true);

        AssemblyResult result = engine.assemble("job-1", inputs);

        assertThat(result.crossfadeApplied()).isTrue();
        assertThat(result.sceneCount()).isEqualTo(4);
        assertThat(result.totalDurationSeconds()).isCloseTo(24.1, within(1e-9));
        assertThat(result.finalArtifact()).isEqualTo(outputDir.resolve("job-1").resolve("final.mp4"));

        CrossfadePlan plan = transcoder.crossfadePlans().get(0);
        assertThat(plan.transitionSec()).isCloseTo(0.3, within(1e-9));
        assertThat(plan.offsetsSec()).hasSize(3);
        assertThat(plan.offsetsSec().get(0)).isCloseTo(4.7, within(1e-9));
        assertThat(plan.offsetsSec().get(1)).isCloseTo(9.4, within(1e-9));
        assertThat(plan.offsetsSec().get(2)).isCloseTo(19.1, within(1e-9));
        // clips with an audio track were merged before crossfading
        assertThat(plan.clips()).extracting(CrossfadeClip::hasAudio).containsOnly(true);
        assertThat(plan.clips().get(0).path().getFileName().toString()).isEqualTo("scene-1-s1-merged.mp4");
    }

    @Test
    void fallsBackToLosslessConcatenationOverAllClips() throws Exception {
        List<AssemblyInput> inputs = clips(new double[]{5.0, 10.0, 5.0}, false);
        transcoder.failCrossfade(true);

        AssemblyResult result = engine.assemble("job-1", inputs);

        assertThat(result.crossfadeApplied()).isFalse();
        assertThat(result.totalDurationSeconds()).isCloseTo(20.0, within(1e-9));
        assertThat(transcoder.losslessInputs()).hasSize(1);
        assertThat(transcoder.losslessInputs().get(0))
                .containsExactly(inputs.get(0).videoPath(), inputs.get(1).videoPath(), inputs.get(2).videoPath());
        assertThat(meterRegistry.counter("scene_factory.assembly.fallbacks").count()).isEqualTo(1.0);
    }

    @Test
    void failsWhenCrossfadeAndLosslessBothFail() {
        List<AssemblyInput> inputs = clips(new double[]{5.0, 5.0}, false);
        transcoder.failCrossfade(true);
        transcoder.failLossless(true);

        assertThatThrownBy(() -> engine.assemble("job-1", inputs))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("both failed");
        assertThat(meterRegistry.counter("scene_factory.assembly.failures").count()).isEqualTo(1.0);
    }

    @Test
    void failedMergeKeepsClipVideoOnly() throws Exception {
        List<AssemblyInput> inputs = clips(new double[]{5.0, 5.0}, true);
        transcoder.failMerge(true);

        AssemblyResult result = engine.assemble("job-1", inputs);

        CrossfadePlan plan = transcoder.crossfadePlans().get(0);
        assertThat(plan.clips()).extracting(CrossfadeClip::path)
                .containsExactly(inputs.get(0).videoPath(), inputs.get(1).videoPath());
        assertThat(plan.clips()).extracting(CrossfadeClip::hasAudio).containsOnly(false);
        assertThat(result.totalDurationSeconds()).isCloseTo(9.7, within(1e-9));
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> engine.assemble("job-1", List.of()))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("no completed scenes");
    }

    @Test
    void singleUnmeasurableClipIsStillReturnedUnchanged() throws Exception {
        Path clip = outputDir.resolve("unprobeable.mp4");

        AssemblyResult result = engine.assemble("job-1", List.of(new AssemblyInput("s1", clip, null)));

        assertThat(result.finalArtifact()).isEqualTo(clip);
        assertThat(result.sceneCount()).isEqualTo(1);
        assertThat(result.crossfadeApplied()).isFalse();
        assertThat(transcoder.crossfadePlans()).isEmpty();
        assertThat(transcoder.losslessInputs()).isEmpty();
    }

    @Test
    void unmeasurableClipFallsBackToLosslessConcatenation() throws Exception {
        transcoder.registerClip(outputDir.resolve("s1.mp4"), 5.0, false);
        List<AssemblyInput> inputs = List.of(
                new AssemblyInput("s1", outputDir.resolve("s1.mp4"), null),
                new AssemblyInput("s2", outputDir.resolve("unprobeable.mp4"), null));

        AssemblyResult result = engine.assemble("job-1", inputs);

        assertThat(result.crossfadeApplied()).isFalse();
        assertThat(result.sceneCount()).isEqualTo(2);
        assertThat(transcoder.crossfadePlans()).isEmpty();
        assertThat(transcoder.losslessInputs()).containsExactly(
                List.of(outputDir.resolve("s1.mp4"), outputDir.resolve("unprobeable.mp4")));
        assertThat(meterRegistry.counter("scene_factory.assembly.fallbacks").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("scene_factory.assembly.failures").count()).isZero();
    }

    @Test
    void invalidTimelineFallsBackToLosslessConcatenation() throws Exception {
        List<AssemblyInput> inputs = clips(new double[]{5.0, 0.0}, false);

        AssemblyResult result = engine.assemble("job-1", inputs);

        assertThat(result.crossfadeApplied()).isFalse();
        assertThat(transcoder.crossfadePlans()).isEmpty();
        assertThat(transcoder.losslessInputs()).hasSize(1);
    }

    private List<AssemblyInput> clips(double[] durations, boolean withAudio) {
        List<AssemblyInput> inputs = new ArrayList<>();
        for (int index = 0; index < durations.length; index++) {
            String scenario = "s" + (index + 1);
            Path video = outputDir.resolve(scenario + ".mp4");
            transcoder.registerClip(video, durations[index], false);
            Path audio = withAudio ? outputDir.resolve(scenario + ".mp3") : null;
            inputs.add(new AssemblyInput(scenario, video, audio));
        }
        return inputs;
    }
}
