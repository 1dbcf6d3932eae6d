package github.sarthakdev143.scene_factory.controller;

import github.sarthakdev143.scene_factory.dto.AssemblyRequestResponse;
import github.sarthakdev143.scene_factory.dto.JobSubmissionResponse;
import github.sarthakdev143.scene_factory.dto.SceneDescriptionRequest;
import github.sarthakdev143.scene_factory.dto.SceneJobSubmissionRequest;
import github.sarthakdev143.scene_factory.exception.GenerationJobNotFoundException;
import github.sarthakdev143.scene_factory.exception.InvalidSceneRequestException;
import github.sarthakdev143.scene_factory.model.OverallStatus;
import github.sarthakdev143.scene_factory.model.SceneDescription;
import github.sarthakdev143.scene_factory.model.SceneJobSubmission;
import github.sarthakdev143.scene_factory.service.SceneOrchestrationService;
import github.sarthakdev143.scene_factory.service.impl.SceneScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/scenes")
public class SceneJobController {

    private static final Logger logger = LoggerFactory.getLogger(SceneJobController.class);

    private final SceneOrchestrationService orchestrationService;

    public SceneJobController(SceneOrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @PostMapping(value = "/jobs", consumes = "application/json")
    public ResponseEntity<?> submitJob(@RequestBody SceneJobSubmissionRequest request) {
        try {
            SceneJobSubmission submission = toSubmission(request);
            String jobId = orchestrationService.submitJob(submission);
            return ResponseEntity.accepted()
                    .body(new JobSubmissionResponse(
                            jobId,
                            OverallStatus.GENERATING,
                            "Generation job accepted. Poll /api/scenes/jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Scene job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit generation job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        try {
            return ResponseEntity.ok(orchestrationService.getJobStatus(jobId));
        } catch (GenerationJobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        }
    }

    @PostMapping("/jobs/{jobId}/scenes/{scenario}/regenerate")
    public ResponseEntity<?> regenerateScene(@PathVariable String jobId, @PathVariable String scenario) {
        try {
            return ResponseEntity.ok(orchestrationService.regenerateScene(jobId, scenario));
        } catch (GenerationJobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (InvalidSceneRequestException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Regeneration was interrupted.");
        } catch (Exception e) {
            logger.error("Regeneration of scene {} in job {} failed", scenario, jobId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to regenerate scene. Please try again.");
        }
    }

    @PostMapping("/jobs/{jobId}/assemble")
    public ResponseEntity<?> reassemble(@PathVariable String jobId) {
        try {
            orchestrationService.reassemble(jobId);
            return ResponseEntity.accepted()
                    .body(new AssemblyRequestResponse(
                            jobId,
                            "Assembly started. Poll /api/scenes/jobs/{jobId} for the final video."));
        } catch (GenerationJobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (InvalidSceneRequestException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Reassembly of job {} failed to start", jobId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start assembly. Please try again.");
        }
    }

    private SceneJobSubmission toSubmission(SceneJobSubmissionRequest request) {
        if (request == null) {
            throw new InvalidSceneRequestException("Request body is required.");
        }

        List<SceneDescription> scenes;
        if (request.scenes() != null && !request.scenes().isEmpty()) {
            scenes = new ArrayList<>(request.scenes().size());
            for (SceneDescriptionRequest scene : request.scenes()) {
                scenes.add(scene == null ? null : new SceneDescription(
                        scene.scenario(),
                        scene.durationSeconds() == null ? 0 : scene.durationSeconds(),
                        scene.visualDescription(),
                        scene.cameraWork(),
                        scene.lighting(),
                        scene.audioDesign(),
                        scene.backgroundMusic(),
                        scene.soundEffects(),
                        scene.dialogNarration()));
            }
        } else if (request.script() != null && !request.script().isBlank()) {
            scenes = SceneScriptParser.parse(request.script());
            if (scenes.isEmpty()) {
                throw new InvalidSceneRequestException("script did not contain any parseable scene.");
            }
        } else {
            throw new InvalidSceneRequestException("Either scenes or script is required.");
        }

        return new SceneJobSubmission(request.ownerReference(), scenes, request.continuityEnabled());
    }
}
