package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.exception.GenerationJobNotFoundException;
import github.sarthakdev143.scene_factory.exception.InvalidSceneRequestException;
import github.sarthakdev143.scene_factory.model.AudioGenerationRequest;
import github.sarthakdev143.scene_factory.model.FanOutOutcome;
import github.sarthakdev143.scene_factory.model.GenerationJob;
import github.sarthakdev143.scene_factory.model.GenerationJobStatus;
import github.sarthakdev143.scene_factory.model.ImageGenerationRequest;
import github.sarthakdev143.scene_factory.model.SceneDescription;
import github.sarthakdev143.scene_factory.model.SceneJob;
import github.sarthakdev143.scene_factory.model.SceneJobState;
import github.sarthakdev143.scene_factory.model.SceneJobSubmission;
import github.sarthakdev143.scene_factory.model.SceneRegenerationResult;
import github.sarthakdev143.scene_factory.model.SceneVideoOutcome;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyInput;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyResult;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyStatus;
import github.sarthakdev143.scene_factory.service.GenerationClient;
import github.sarthakdev143.scene_factory.service.SceneOrchestrationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultSceneOrchestrationService implements SceneOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSceneOrchestrationService.class);

    private final SceneRequestValidator requestValidator;
    private final ParallelFanOutGenerator fanOutGenerator;
    private final FrameChainedVideoGenerator videoGenerator;
    private final SceneAssemblyEngine assemblyEngine;
    private final GenerationClient generationClient;
    private final GenerationTaskAwaiter taskAwaiter;
    private final VideoDurationPolicy durationPolicy;
    private final TaskExecutor taskExecutor;
    private final SceneFactoryProperties properties;
    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();
    private final Counter jobsSubmittedCounter;
    private final Counter scenesFailedCounter;

    public DefaultSceneOrchestrationService(
            SceneRequestValidator requestValidator,
            ParallelFanOutGenerator fanOutGenerator,
            FrameChainedVideoGenerator videoGenerator,
            SceneAssemblyEngine assemblyEngine,
            GenerationClient generationClient,
            GenerationTaskAwaiter taskAwaiter,
            VideoDurationPolicy durationPolicy,
            @Qualifier("sceneJobExecutor") TaskExecutor taskExecutor,
            SceneFactoryProperties properties,
            MeterRegistry meterRegistry) {
        this.requestValidator = requestValidator;
        this.fanOutGenerator = fanOutGenerator;
        this.videoGenerator = videoGenerator;
        this.assemblyEngine = assemblyEngine;
        this.generationClient = generationClient;
        this.taskAwaiter = taskAwaiter;
        this.durationPolicy = durationPolicy;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        this.jobsSubmittedCounter = meterRegistry.counter("scene_factory.jobs.submitted");
        this.scenesFailedCounter = meterRegistry.counter("scene_factory.scenes.failed");
    }

    @Override
    public String submitJob(SceneJobSubmission submission) {
        List<SceneDescription> scenes = requestValidator.normalizeAndValidate(submission);
        boolean continuityEnabled = submission.continuityEnabled() != null
                ? submission.continuityEnabled()
                : properties.generation().continuityEnabled();

        String jobId = UUID.randomUUID().toString();
        GenerationJob job = new GenerationJob(jobId, submission.ownerReference(), scenes, continuityEnabled);
        jobs.put(jobId, job);
        jobsSubmittedCounter.increment();

        logger.info(
                "Accepted generation job {} scenes={} continuity={} owner={}",
                jobId,
                scenes.size(),
                continuityEnabled,
                submission.ownerReference());

        try {
            taskExecutor.execute(() -> processJob(job));
        } catch (RuntimeException rejected) {
            logger.error("Generation job {} could not be scheduled", jobId, rejected);
            failUnfinishedScenes(job, "Job could not be scheduled: server is at capacity.");
            job.updateAssembly(AssemblyStatus.skipped("Job could not be scheduled."));
        }
        return jobId;
    }

    @Override
    public GenerationJobStatus getJobStatus(String jobId) {
        return requireJob(jobId).snapshot();
    }

    @Override
    public SceneRegenerationResult regenerateScene(String jobId, String scenario) throws InterruptedException {
        GenerationJob job = requireJob(jobId);
        if (scenario == null || !job.hasScene(scenario)) {
            throw GenerationJobNotFoundException.scene(jobId, scenario);
        }

        SceneJob current = job.scene(scenario);
        if (!current.state().isTerminal()) {
            throw new InvalidSceneRequestException(
                    "Scene " + scenario + " is still " + current.state().toApiValue() + " and cannot be regenerated yet.");
        }
        if (!job.beginRegeneration(scenario)) {
            throw new InvalidSceneRequestException("Scene " + scenario + " is already being regenerated.");
        }

        try {
            SceneVideoOutcome outcome = videoGenerator.regenerate(job, scenario);
            return new SceneRegenerationResult(
                    jobId,
                    scenario,
                    outcome.succeeded(),
                    job.scene(scenario),
                    outcome.error());
        } finally {
            job.endRegeneration(scenario);
        }
    }

    @Override
    public void reassemble(String jobId) {
        GenerationJob job = requireJob(jobId);
        boolean inFlight = job.scenes().stream().anyMatch(scene -> !scene.state().isTerminal());
        if (inFlight) {
            throw new InvalidSceneRequestException("Job " + jobId + " still has scenes in progress.");
        }
        if (!job.tryStartAssembly(AssemblyStatus.running())) {
            throw new InvalidSceneRequestException("Job " + jobId + " is already being assembled.");
        }

        logger.info("Reassembly requested for job {}", jobId);
        try {
            taskExecutor.execute(() -> runAssembly(job));
        } catch (RuntimeException rejected) {
            job.updateAssembly(AssemblyStatus.failed("Assembly could not be scheduled: server is at capacity."));
            throw rejected;
        }
    }

    private void processJob(GenerationJob job) {
        String jobId = job.jobId();
        CompletableFuture<List<FanOutOutcome<Path>>> audioFuture = null;
        try {
            if (properties.generation().staticImagesEnabled() && !prepareStaticImages(job)) {
                job.updateAssembly(AssemblyStatus.skipped("Static image generation did not reach the required minimum."));
                return;
            }

            // Audio does not depend on the video chain, so it runs alongside it.
            audioFuture = properties.generation().audioEnabled()
                    ? fanOutGenerator.submitAll(audioTasks(job))
                    : CompletableFuture.completedFuture(List.of());

            videoGenerator.generate(job);
            recordAudioTracks(job, ParallelFanOutGenerator.awaitOutcomes(audioFuture));

            if (job.tryStartAssembly(AssemblyStatus.running())) {
                runAssembly(job);
            } else {
                logger.info("Assembly for job {} was already started elsewhere", jobId);
            }
            logger.info("Completed generation job {} overallStatus={}", jobId, job.overallStatus().toApiValue());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Generation job {} was interrupted", jobId);
            cancel(audioFuture);
            failUnfinishedScenes(job, "Generation was interrupted.");
        } catch (RuntimeException e) {
            logger.error("Generation job {} failed", jobId, e);
            cancel(audioFuture);
            failUnfinishedScenes(job, "Scene generation failed. Check server logs.");
        }
    }

    private boolean prepareStaticImages(GenerationJob job) throws InterruptedException {
        List<SceneDescription> scenes = job.descriptions();
        SceneArtifactPaths paths = new SceneArtifactPaths(properties.outputDir(), job.jobId());
        List<ParallelFanOutGenerator.GenerationTask<Path>> tasks = new ArrayList<>(scenes.size());
        for (int index = 0; index < scenes.size(); index++) {
            SceneDescription scene = scenes.get(index);
            Path destination = paths.staticImage(index, scene.scenario());
            tasks.add(() -> {
                String taskId = generationClient.submitImage(new ImageGenerationRequest(
                        ScenePromptBuilder.imagePrompt(scene),
                        properties.generation().imageWidth(),
                        properties.generation().imageHeight()));
                String resultUri = taskAwaiter.await(taskId, "still " + scene.scenario());
                paths.ensureJobDirectory();
                generationClient.download(resultUri, destination);
                return destination;
            });
        }

        List<FanOutOutcome<Path>> outcomes = fanOutGenerator.generateAll(tasks, generationClient::uploadReference);
        int registered = 0;
        for (int index = 0; index < outcomes.size(); index++) {
            FanOutOutcome<Path> outcome = outcomes.get(index);
            String scenario = scenes.get(index).scenario();
            if (outcome.hasReusableHandle()) {
                job.recordStaticImageHandle(scenario, outcome.referenceHandle());
                registered++;
            } else if (outcome.succeeded()) {
                logger.warn("Static image for scene {} of job {} has no reusable handle", scenario, job.jobId());
            } else {
                logger.warn("Static image for scene {} of job {} failed: {}", scenario, job.jobId(), outcome.error());
            }
        }

        int required = properties.generation().staticImageMinSuccess();
        logger.info("Job {} registered {}/{} static images (minimum {})", job.jobId(), registered, scenes.size(), required);
        if (registered < required) {
            failUnfinishedScenes(
                    job,
                    "Only " + registered + " of " + scenes.size()
                            + " static images were generated; at least " + required + " are required.");
            return false;
        }
        return true;
    }

    private List<ParallelFanOutGenerator.GenerationTask<Path>> audioTasks(GenerationJob job) {
        List<SceneDescription> scenes = job.descriptions();
        SceneArtifactPaths paths = new SceneArtifactPaths(properties.outputDir(), job.jobId());
        List<ParallelFanOutGenerator.GenerationTask<Path>> tasks = new ArrayList<>(scenes.size());
        for (int index = 0; index < scenes.size(); index++) {
            SceneDescription scene = scenes.get(index);
            Path destination = paths.audio(index, scene.scenario());
            tasks.add(() -> {
                String taskId = generationClient.submitAudio(new AudioGenerationRequest(
                        ScenePromptBuilder.audioPrompt(scene),
                        durationPolicy.apply(scene.durationSeconds())));
                String resultUri = taskAwaiter.await(taskId, "audio " + scene.scenario());
                paths.ensureJobDirectory();
                generationClient.download(resultUri, destination);
                return destination;
            });
        }
        return tasks;
    }

    private void recordAudioTracks(GenerationJob job, List<FanOutOutcome<Path>> outcomes) {
        List<SceneDescription> scenes = job.descriptions();
        for (FanOutOutcome<Path> outcome : outcomes) {
            String scenario = scenes.get(outcome.index()).scenario();
            if (outcome.succeeded()) {
                job.recordAudioTrack(scenario, outcome.result());
            } else {
                logger.warn("Audio for scene {} of job {} failed, scene stays video-only: {}",
                        scenario, job.jobId(), outcome.error());
            }
        }
    }

    /**
     * Assembles the completed scenes of a job. The caller must have moved the assembly to running.
     */
    private void runAssembly(GenerationJob job) {
        List<AssemblyInput> inputs = new ArrayList<>();
        for (SceneJob scene : job.scenes()) {
            if (scene.state() == SceneJobState.COMPLETED) {
                inputs.add(new AssemblyInput(
                        scene.scenario(),
                        Path.of(scene.resultUri()),
                        job.audioTrack(scene.scenario()).orElse(null)));
            }
        }
        if (inputs.isEmpty()) {
            logger.warn("Job {} has no completed scenes, skipping assembly", job.jobId());
            job.updateAssembly(AssemblyStatus.skipped("No completed scenes to assemble."));
            return;
        }

        try {
            AssemblyResult result = assemblyEngine.assemble(job.jobId(), inputs);
            job.updateAssembly(AssemblyStatus.completed(result));
        } catch (AssemblyException e) {
            logger.error("Assembly of job {} failed", job.jobId(), e);
            job.updateAssembly(AssemblyStatus.failed(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.updateAssembly(AssemblyStatus.failed("Assembly was interrupted."));
        } catch (RuntimeException e) {
            logger.error("Assembly of job {} failed unexpectedly", job.jobId(), e);
            job.updateAssembly(AssemblyStatus.failed("Assembly failed. Check server logs."));
        }
    }

    private void failUnfinishedScenes(GenerationJob job, String message) {
        for (SceneJob scene : job.scenes()) {
            if (scene.state().isTerminal()) {
                continue;
            }
            SceneJob updated = job.updateScene(
                    scene.scenario(),
                    current -> current.state().isTerminal() ? current : current.failed(message));
            if (updated.state() == SceneJobState.FAILED) {
                scenesFailedCounter.increment();
            }
        }
    }

    private void cancel(CompletableFuture<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private GenerationJob requireJob(String jobId) {
        GenerationJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw GenerationJobNotFoundException.job(jobId);
        }
        return job;
    }
}
