package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.exception.GenerationException;
import github.sarthakdev143.scene_factory.exception.SeedTransferException;
import github.sarthakdev143.scene_factory.model.FrameContinuityToken;
import github.sarthakdev143.scene_factory.model.GenerationJob;
import github.sarthakdev143.scene_factory.model.SceneDescription;
import github.sarthakdev143.scene_factory.model.SceneVideoOutcome;
import github.sarthakdev143.scene_factory.model.SeedSource;
import github.sarthakdev143.scene_factory.model.VideoGenerationRequest;
import github.sarthakdev143.scene_factory.service.GenerationClient;
import github.sarthakdev143.scene_factory.service.MediaTranscoder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Generates scene clips strictly one after another so that each clip can start from the last frame
 * of the previous one. Scene i + 1 is dispatched only once scene i is terminal.
 * <p>
 * Seed selection per scene: the previous scene's continuity frame when continuity is enabled and a
 * frame exists, otherwise the scene's static image, otherwise no seed. A failed scene never stops the
 * chain; the next scene simply has no continuity frame.
 */
@Component
public class FrameChainedVideoGenerator {

    private static final Logger logger = LoggerFactory.getLogger(FrameChainedVideoGenerator.class);
    private static final int PROGRESS_DISPATCHED = 10;
    private static final int PROGRESS_SUBMITTED = 30;
    private static final int PROGRESS_RENDERED = 70;
    private static final int PROGRESS_DOWNLOADED = 90;

    private final GenerationClient generationClient;
    private final MediaTranscoder mediaTranscoder;
    private final GenerationTaskAwaiter taskAwaiter;
    private final VideoDurationPolicy durationPolicy;
    private final SeedRetryPolicy retryPolicy;
    private final SceneFactoryProperties properties;
    private final Counter scenesCompletedCounter;
    private final Counter scenesFailedCounter;
    private final Counter staticFallbackCounter;
    private final Counter backoffRetryCounter;

    public FrameChainedVideoGenerator(
            GenerationClient generationClient,
            MediaTranscoder mediaTranscoder,
            GenerationTaskAwaiter taskAwaiter,
            VideoDurationPolicy durationPolicy,
            SceneFactoryProperties properties,
            MeterRegistry meterRegistry) {
        this.generationClient = generationClient;
        this.mediaTranscoder = mediaTranscoder;
        this.taskAwaiter = taskAwaiter;
        this.durationPolicy = durationPolicy;
        this.retryPolicy = new SeedRetryPolicy(properties.generation().seedRetryBackoff());
        this.properties = properties;
        this.scenesCompletedCounter = meterRegistry.counter("scene_factory.scenes.completed");
        this.scenesFailedCounter = meterRegistry.counter("scene_factory.scenes.failed");
        this.staticFallbackCounter = meterRegistry.counter("scene_factory.seed.fallbacks", "kind", "static_image");
        this.backoffRetryCounter = meterRegistry.counter("scene_factory.seed.fallbacks", "kind", "backoff");
    }

    /**
     * Runs the whole chain for a job, updating each scene as it progresses.
     *
     * @return one outcome per scene, in job order
     * @throws InterruptedException when the worker is interrupted; scenes not yet terminal are left to
     *                              the caller
     */
    public List<SceneVideoOutcome> generate(GenerationJob job) throws InterruptedException {
        SceneArtifactPaths paths = new SceneArtifactPaths(properties.outputDir(), job.jobId());
        List<SceneDescription> scenes = job.descriptions();
        List<SceneVideoOutcome> outcomes = new ArrayList<>(scenes.size());
        FrameContinuityToken continuityToken = null;

        for (int index = 0; index < scenes.size(); index++) {
            SceneDescription scene = scenes.get(index);
            String scenario = scene.scenario();
            String staticHandle = job.staticImageHandle(scenario).orElse(null);
            Seed seed = selectSeed(job.continuityEnabled(), continuityToken, staticHandle);
            int appliedDuration = durationPolicy.apply(scene.durationSeconds());

            job.updateScene(scenario, current -> current.generating(PROGRESS_DISPATCHED).withAppliedDuration(appliedDuration));
            logger.info(
                    "Dispatching scene {} ({}/{}) of job {} seed={} duration={}s",
                    scenario,
                    index + 1,
                    scenes.size(),
                    job.jobId(),
                    seed.source().toApiValue(),
                    appliedDuration);

            SceneVideoOutcome outcome = render(
                    job.jobId(),
                    scene,
                    appliedDuration,
                    seed,
                    staticHandle,
                    paths.video(index, scenario),
                    progress -> job.updateScene(scenario, current -> current.generating(progress)));
            outcomes.add(outcome);

            if (!outcome.succeeded()) {
                job.updateScene(scenario, current -> current.failed(outcome.error()));
                scenesFailedCounter.increment();
                logger.error("Scene {} of job {} failed: {}", scenario, job.jobId(), outcome.error());
                continuityToken = null;
                continue;
            }

            job.updateScene(scenario, current -> current.completed(
                    outcome.videoPath().toString(),
                    outcome.seedSource(),
                    outcome.appliedDurationSeconds()));
            scenesCompletedCounter.increment();
            logger.info(
                    "Scene {} of job {} completed after {} attempt(s) seed={}",
                    scenario,
                    job.jobId(),
                    outcome.attempts(),
                    outcome.seedSource().toApiValue());

            boolean lastScene = index == scenes.size() - 1;
            continuityToken = job.continuityEnabled() && !lastScene
                    ? captureContinuityFrame(job.jobId(), scenario, outcome.videoPath(), paths.lastFrame(index, scenario))
                    : null;
        }
        return outcomes;
    }

    /**
     * Re-renders one scene of an existing job. The seed is the scene's static image when one exists.
     * The scene is only replaced on success; on failure its previous state stays untouched.
     */
    public SceneVideoOutcome regenerate(GenerationJob job, String scenario) throws InterruptedException {
        List<SceneDescription> scenes = job.descriptions();
        int index = indexOf(scenes, scenario);
        SceneDescription scene = scenes.get(index);
        String staticHandle = job.staticImageHandle(scenario).orElse(null);
        Seed seed = staticHandle != null ? new Seed(staticHandle, SeedSource.STATIC_IMAGE) : Seed.none();
        int appliedDuration = durationPolicy.apply(scene.durationSeconds());
        SceneArtifactPaths paths = new SceneArtifactPaths(properties.outputDir(), job.jobId());

        logger.info("Regenerating scene {} of job {} seed={}", scenario, job.jobId(), seed.source().toApiValue());
        SceneVideoOutcome outcome = render(
                job.jobId(),
                scene,
                appliedDuration,
                seed,
                staticHandle,
                paths.regeneratedVideo(index, scenario, System.currentTimeMillis()),
                progress -> {
                });

        if (outcome.succeeded()) {
            job.updateScene(scenario, current -> current.completed(
                    outcome.videoPath().toString(),
                    outcome.seedSource(),
                    outcome.appliedDurationSeconds()));
            scenesCompletedCounter.increment();
            logger.info("Regenerated scene {} of job {}", scenario, job.jobId());
        } else {
            scenesFailedCounter.increment();
            logger.error("Regeneration of scene {} in job {} failed: {}", scenario, job.jobId(), outcome.error());
        }
        return outcome;
    }

    static Seed selectSeed(boolean continuityEnabled, FrameContinuityToken continuityToken, String staticHandle) {
        if (continuityEnabled && continuityToken != null) {
            return new Seed(continuityToken.handle(), SeedSource.CONTINUITY_FRAME);
        }
        if (staticHandle != null) {
            return new Seed(staticHandle, SeedSource.STATIC_IMAGE);
        }
        return Seed.none();
    }

    private SceneVideoOutcome render(
            String jobId,
            SceneDescription scene,
            int appliedDuration,
            Seed initialSeed,
            String staticHandle,
            Path destination,
            IntConsumer progress) throws InterruptedException {
        String scenario = scene.scenario();
        String prompt = ScenePromptBuilder.videoPrompt(scene);
        if (appliedDuration != scene.durationSeconds()) {
            logger.info(
                    "Scene {} of job {} requested {}s, submitting {}s",
                    scenario,
                    jobId,
                    scene.durationSeconds(),
                    appliedDuration);
        }

        Seed seed = initialSeed;
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                progress.accept(PROGRESS_DISPATCHED);
                String taskId = generationClient.submitVideo(new VideoGenerationRequest(
                        prompt,
                        appliedDuration,
                        seed.handle(),
                        properties.generation().videoWidth(),
                        properties.generation().videoHeight()));
                progress.accept(PROGRESS_SUBMITTED);

                String resultUri = taskAwaiter.await(taskId, "scene " + scenario);
                progress.accept(PROGRESS_RENDERED);

                new SceneArtifactPaths(properties.outputDir(), jobId).ensureJobDirectory();
                generationClient.download(resultUri, destination);
                progress.accept(PROGRESS_DOWNLOADED);
                return new SceneVideoOutcome(scenario, destination, seed.source(), appliedDuration, attempts, null);
            } catch (SeedTransferException e) {
                SeedRetryPolicy.Decision decision = retryPolicy.onSeedFailure(
                        seed.source(),
                        attempts,
                        staticHandle != null);
                switch (decision.action()) {
                    case SWITCH_TO_STATIC -> {
                        staticFallbackCounter.increment();
                        logger.warn(
                                "Continuity frame for scene {} of job {} was rejected, switching to static image: {}",
                                scenario,
                                jobId,
                                e.getMessage());
                        seed = new Seed(staticHandle, SeedSource.STATIC_IMAGE);
                    }
                    case RETRY_SAME_SEED -> {
                        backoffRetryCounter.increment();
                        logger.warn(
                                "Seed transfer failed for scene {} of job {} (attempt {}), retrying in {} ms: {}",
                                scenario,
                                jobId,
                                attempts,
                                decision.delay().toMillis(),
                                e.getMessage());
                        sleep(decision.delay());
                    }
                    default -> {
                        return failure(scenario, seed, appliedDuration, attempts,
                                "Seed transfer failed after " + attempts + " attempts: " + e.getMessage());
                    }
                }
            } catch (GenerationException e) {
                return failure(scenario, seed, appliedDuration, attempts, e.getMessage());
            } catch (IOException e) {
                return failure(scenario, seed, appliedDuration, attempts,
                        "Could not prepare output directory: " + e.getMessage());
            }
        }
    }

    private FrameContinuityToken captureContinuityFrame(String jobId, String scenario, Path videoPath, Path framePath)
            throws InterruptedException {
        try {
            mediaTranscoder.extractLastFrame(videoPath, framePath);
            String handle = generationClient.uploadReference(framePath);
            sleep(properties.generation().continuitySettleDelay());
            return new FrameContinuityToken(handle, scenario);
        } catch (AssemblyException | GenerationException e) {
            logger.warn(
                    "Could not capture continuity frame after scene {} of job {}, next scene falls back: {}",
                    scenario,
                    jobId,
                    e.getMessage());
            return null;
        }
    }

    private SceneVideoOutcome failure(String scenario, Seed seed, int appliedDuration, int attempts, String error) {
        return new SceneVideoOutcome(scenario, null, seed.source(), appliedDuration, attempts, error);
    }

    private int indexOf(List<SceneDescription> scenes, String scenario) {
        for (int index = 0; index < scenes.size(); index++) {
            if (scenes.get(index).scenario().equals(scenario)) {
                return index;
            }
        }
        throw new IllegalArgumentException("Unknown scenario " + scenario);
    }

    private void sleep(Duration delay) throws InterruptedException {
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }

    record Seed(String handle, SeedSource source) {

        static Seed none() {
            return new Seed(null, SeedSource.NONE);
        }
    }
}
