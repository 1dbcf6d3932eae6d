package github.sarthakdev143.scene_factory.service;

import github.sarthakdev143.scene_factory.model.GenerationJobStatus;
import github.sarthakdev143.scene_factory.model.SceneJobSubmission;
import github.sarthakdev143.scene_factory.model.SceneRegenerationResult;

public interface SceneOrchestrationService {

    String submitJob(SceneJobSubmission submission);

    GenerationJobStatus getJobStatus(String jobId);

    SceneRegenerationResult regenerateScene(String jobId, String scenario) throws InterruptedException;

    void reassemble(String jobId);
}
