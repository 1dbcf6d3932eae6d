package github.sarthakdev143.scene_factory.controller;

import github.sarthakdev143.scene_factory.exception.GenerationJobNotFoundException;
import github.sarthakdev143.scene_factory.exception.InvalidSceneRequestException;
import github.sarthakdev143.scene_factory.model.GenerationJobStatus;
import github.sarthakdev143.scene_factory.model.OverallStatus;
import github.sarthakdev143.scene_factory.model.SceneDescription;
import github.sarthakdev143.scene_factory.model.SceneJob;
import github.sarthakdev143.scene_factory.model.SceneJobState;
import github.sarthakdev143.scene_factory.model.SceneJobSubmission;
import github.sarthakdev143.scene_factory.model.SceneRegenerationResult;
import github.sarthakdev143.scene_factory.model.SeedSource;
import github.sarthakdev143.scene_factory.model.assembly.AssemblyStatus;
import github.sarthakdev143.scene_factory.service.SceneOrchestrationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SceneJobController.class)
class SceneJobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SceneOrchestrationService orchestrationService;

    @Test
    void submitReturnsAcceptedWithJobId() throws Exception {
        when(orchestrationService.submitJob(any())).thenReturn("job-123");

        mockMvc.perform(post("/api/scenes/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "ownerReference": "campaign-7",
                                  "continuityEnabled": false,
                                  "scenes": [
                                    {"scenario": "hook", "durationSeconds": 5, "visualDescription": "City at dawn",
                                     "cameraWork": "Slow push in", "soundEffects": "Birds"},
                                    {"scenario": "cta", "durationSeconds": 10, "visualDescription": "Logo"}
                                  ]
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.jobId").value("job-123"))
                .andExpect(jsonPath("$.overallStatus").value("generating"));

        ArgumentCaptor<SceneJobSubmission> captor = ArgumentCaptor.forClass(SceneJobSubmission.class);
        verify(orchestrationService).submitJob(captor.capture());
        SceneJobSubmission submission = captor.getValue();
        assertThat(submission.ownerReference()).isEqualTo("campaign-7");
        assertThat(submission.continuityEnabled()).isFalse();
        assertThat(submission.scenes()).extracting(SceneDescription::scenario).containsExactly("hook", "cta");
        assertThat(submission.scenes().get(0).cameraWork()).isEqualTo("Slow push in");
        assertThat(submission.scenes().get(0).soundEffects()).isEqualTo("Birds");
    }

    @Test
    void submitParsesScriptWhenNoScenesAreGiven() throws Exception {
        when(orchestrationService.submitJob(any())).thenReturn("job-9");

        mockMvc.perform(post("/api/scenes/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\": \"**SCENE 1: HOOK (5 seconds)**\\nVisual Description: A bottle spins.\\n\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-9"));

        ArgumentCaptor<SceneJobSubmission> captor = ArgumentCaptor.forClass(SceneJobSubmission.class);
        verify(orchestrationService).submitJob(captor.capture());
        assertThat(captor.getValue().scenes()).singleElement().satisfies(scene -> {
            assertThat(scene.scenario()).isEqualTo("hook");
            assertThat(scene.durationSeconds()).isEqualTo(5);
            assertThat(scene.visualDescription()).isEqualTo("A bottle spins.");
        });
    }

    @Test
    void submitWithoutScenesOrScriptIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scenes/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerReference\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Either scenes or script is required.")));

        verifyNoInteractions(orchestrationService);
    }

    @Test
    void submitReturnsBadRequestWhenValidationFails() throws Exception {
        when(orchestrationService.submitJob(any()))
                .thenThrow(new InvalidSceneRequestException("scenes[0].durationSeconds must be between 1 and 60."));

        mockMvc.perform(post("/api/scenes/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scenes\": [{\"scenario\": \"hook\", \"visualDescription\": \"x\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid request: scenes[0].durationSeconds must be between 1 and 60."));
    }

    @Test
    void statusReturnsSceneSnapshot() throws Exception {
        Instant now = Instant.parse("2026-01-05T10:00:00Z");
        GenerationJobStatus snapshot = new GenerationJobStatus(
                "job-123",
                "campaign-7",
                OverallStatus.PARTIAL,
                now,
                List.of(
                        new SceneJob("hook", SceneJobState.COMPLETED, 100, "outputs/job-123/scene-1-hook.mp4", null, 5, 5,
                                SeedSource.STATIC_IMAGE, now),
                        new SceneJob("cta", SceneJobState.FAILED, 30, null, "provider unavailable", 7, 10,
                                SeedSource.CONTINUITY_FRAME, now)),
                AssemblyStatus.pending());
        when(orchestrationService.getJobStatus("job-123")).thenReturn(snapshot);

        mockMvc.perform(get("/api/scenes/jobs/job-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallStatus").value("partial"))
                .andExpect(jsonPath("$.scenes[0].state").value("completed"))
                .andExpect(jsonPath("$.scenes[0].seedSource").value("static_image"))
                .andExpect(jsonPath("$.scenes[1].error").value("provider unavailable"))
                .andExpect(jsonPath("$.scenes[1].appliedDurationSeconds").value(10))
                .andExpect(jsonPath("$.assembly.state").value("pending"));
    }

    @Test
    void statusReturnsNotFoundForUnknownJob() throws Exception {
        when(orchestrationService.getJobStatus("missing")).thenThrow(GenerationJobNotFoundException.job("missing"));

        mockMvc.perform(get("/api/scenes/jobs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Job not found for id: missing"));
    }

    @Test
    void regenerateReturnsResult() throws Exception {
        SceneJob scene = new SceneJob("cta", SceneJobState.COMPLETED, 100, "outputs/job-123/scene-2-cta-regen-1.mp4",
                null, 7, 10, SeedSource.STATIC_IMAGE, Instant.now());
        when(orchestrationService.regenerateScene("job-123", "cta"))
                .thenReturn(new SceneRegenerationResult("job-123", "cta", true, scene, null));

        mockMvc.perform(post("/api/scenes/jobs/job-123/scenes/cta/regenerate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replaced").value(true))
                .andExpect(jsonPath("$.scene.resultUri").value("outputs/job-123/scene-2-cta-regen-1.mp4"));
    }

    @Test
    void regenerateMapsFailuresToStatusCodes() throws Exception {
        when(orchestrationService.regenerateScene("job-123", "outro"))
                .thenThrow(GenerationJobNotFoundException.scene("job-123", "outro"));
        when(orchestrationService.regenerateScene("job-123", "hook"))
                .thenThrow(new InvalidSceneRequestException("Scene hook is still generating and cannot be regenerated yet."));
        when(orchestrationService.regenerateScene("job-123", "cta")).thenThrow(new InterruptedException());

        mockMvc.perform(post("/api/scenes/jobs/job-123/scenes/outro/regenerate"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/scenes/jobs/job-123/scenes/hook/regenerate"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("still generating")));
        mockMvc.perform(post("/api/scenes/jobs/job-123/scenes/cta/regenerate"))
                .andExpect(status().isServiceUnavailable());
        // the handler restored the interrupt flag on the test thread
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void assembleReturnsAccepted() throws Exception {
        mockMvc.perform(post("/api/scenes/jobs/job-123/assemble"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-123"));

        verify(orchestrationService).reassemble("job-123");
    }

    @Test
    void assembleRejectedWhileScenesAreInFlight() throws Exception {
        doThrow(new InvalidSceneRequestException("Job job-123 still has scenes in progress."))
                .when(orchestrationService).reassemble("job-123");

        mockMvc.perform(post("/api/scenes/jobs/job-123/assemble"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid request: Job job-123 still has scenes in progress."));
    }
}
