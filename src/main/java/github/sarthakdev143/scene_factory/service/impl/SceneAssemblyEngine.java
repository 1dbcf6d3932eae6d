package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.model.MediaProbe;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyEntry;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyInput;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyPlan;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyResult;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadeClip;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadePlan;
import github.sarthakdev143.scene_factory.service.MediaTranscoder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns per-scene clips into one output video.
 * <p>
 * Each clip with audio is merged first; a failed merge keeps the clip video-only. A single clip is
 * returned as-is. Several clips are joined with chained crossfades, falling back to a lossless cut
 * concatenation when measuring the clips, planning the timeline or rendering the crossfade fails.
 */
@Component
public class SceneAssemblyEngine {

    private static final Logger logger = LoggerFactory.getLogger(SceneAssemblyEngine.class);

    private final MediaTranscoder mediaTranscoder;
    private final SceneFactoryProperties properties;
    private final Counter crossfadeFallbackCounter;
    private final Counter assemblyFailureCounter;

    public SceneAssemblyEngine(
            MediaTranscoder mediaTranscoder,
            SceneFactoryProperties properties,
            MeterRegistry meterRegistry) {
        this.mediaTranscoder = mediaTranscoder;
        this.properties = properties;
        this.crossfadeFallbackCounter = meterRegistry.counter("scene_factory.assembly.fallbacks");
        this.assemblyFailureCounter = meterRegistry.counter("scene_factory.assembly.failures");
    }

    public AssemblyResult assemble(String jobId, List<AssemblyInput> inputs)
            throws AssemblyException, InterruptedException {
        if (inputs == null || inputs.isEmpty()) {
            throw new AssemblyException("Job " + jobId + " has no completed scenes to assemble.");
        }
        SceneArtifactPaths paths = new SceneArtifactPaths(properties.outputDir(), jobId);
        try {
            paths.ensureJobDirectory();
        } catch (IOException e) {
            assemblyFailureCounter.increment();
            throw new AssemblyException("Could not create output directory for job " + jobId, e);
        }

        AssemblyPlan plan = buildPlan(jobId, inputs, paths);
        List<AssemblyEntry> entries = plan.consume();
        if (entries.size() == 1) {
            AssemblyEntry only = entries.get(0);
            logger.info("Job {} has a single clip, using {} as the final video", jobId, only.videoPath());
            return new AssemblyResult(only.videoPath(), measureOrExpect(only.videoPath(), 0.0), 1, false);
        }

        Path finalPath = paths.finalVideo();
        try {
            CrossfadePlan crossfadePlan = crossfadePlan(entries);
            mediaTranscoder.concatCrossfade(crossfadePlan, finalPath);
            double measured = measureOrExpect(finalPath, crossfadePlan.expectedDurationSec());
            logger.info(
                    "Assembled job {} from {} clips with {}s crossfades, duration={}s",
                    jobId,
                    entries.size(),
                    crossfadePlan.transitionSec(),
                    measured);
            return new AssemblyResult(finalPath, measured, entries.size(), true);
        } catch (AssemblyException | RuntimeException crossfadeError) {
            crossfadeFallbackCounter.increment();
            logger.warn(
                    "Crossfade assembly failed for job {}, falling back to lossless concatenation: {}",
                    jobId,
                    crossfadeError.getMessage());
            return concatLossless(jobId, entries, finalPath, crossfadeError);
        }
    }

    private AssemblyPlan buildPlan(String jobId, List<AssemblyInput> inputs, SceneArtifactPaths paths)
            throws InterruptedException {
        List<AssemblyEntry> entries = new ArrayList<>(inputs.size());
        for (int index = 0; index < inputs.size(); index++) {
            AssemblyInput input = inputs.get(index);
            Path clipPath = input.videoPath();
            Path audioPath = null;
            if (input.audioPath() == null) {
                logger.warn("Scene {} of job {} has no audio, keeping it video-only", input.scenario(), jobId);
            } else {
                try {
                    clipPath = mediaTranscoder.merge(
                            input.videoPath(),
                            input.audioPath(),
                            paths.merged(index, input.scenario()));
                    audioPath = input.audioPath();
                } catch (AssemblyException e) {
                    logger.warn(
                            "Audio merge failed for scene {} of job {}, keeping it video-only: {}",
                            input.scenario(),
                            jobId,
                            e.getMessage());
                }
            }
            entries.add(new AssemblyEntry(input.scenario(), clipPath, audioPath));
        }
        return new AssemblyPlan(entries);
    }

    private CrossfadePlan crossfadePlan(List<AssemblyEntry> entries) throws AssemblyException, InterruptedException {
        List<Double> durations = new ArrayList<>(entries.size());
        List<CrossfadeClip> clips = new ArrayList<>(entries.size());
        for (AssemblyEntry entry : entries) {
            MediaProbe probe;
            try {
                probe = mediaTranscoder.probe(entry.videoPath());
            } catch (AssemblyException e) {
                throw new AssemblyException("Could not measure clip for scene " + entry.scenario(), e);
            }
            durations.add(probe.durationSeconds());
            clips.add(new CrossfadeClip(entry.videoPath(), probe.durationSeconds(), probe.hasAudio()));
        }
        CrossfadeTimeline timeline = CrossfadeTimeline.of(durations, properties.assembly().transitionSeconds());
        return new CrossfadePlan(
                clips,
                timeline.transitionSeconds(),
                timeline.offsets(),
                timeline.totalDurationSeconds(),
                properties.generation().videoWidth(),
                properties.generation().videoHeight());
    }

    private AssemblyResult concatLossless(
            String jobId,
            List<AssemblyEntry> entries,
            Path finalPath,
            Exception crossfadeError) throws AssemblyException, InterruptedException {
        List<Path> clipPaths = new ArrayList<>(entries.size());
        for (AssemblyEntry entry : entries) {
            clipPaths.add(entry.videoPath());
        }

        try {
            mediaTranscoder.concatLossless(clipPaths, finalPath);
        } catch (AssemblyException e) {
            assemblyFailureCounter.increment();
            e.addSuppressed(crossfadeError);
            logger.error("Lossless concatenation also failed for job {}", jobId, e);
            throw new AssemblyException(
                    "Crossfade and lossless concatenation both failed: " + e.getMessage(),
                    e);
        }

        double measured = measureOrExpect(finalPath, 0.0);
        logger.info("Assembled job {} from {} clips without transitions, duration={}s", jobId, entries.size(), measured);
        return new AssemblyResult(finalPath, measured, entries.size(), false);
    }

    private double measureOrExpect(Path finalPath, double expected) throws InterruptedException {
        try {
            return mediaTranscoder.probe(finalPath).durationSeconds();
        } catch (AssemblyException e) {
            logger.warn("Could not measure {}, reporting the planned duration {}s: {}", finalPath, expected, e.getMessage());
            return expected;
        }
    }
}
