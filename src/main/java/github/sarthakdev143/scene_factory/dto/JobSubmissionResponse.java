package github.sarthakdev143.scene_factory.dto;

import github.sarthakdev143.scene_factory.model.OverallStatus;

public record JobSubmissionResponse(
        String jobId,
        OverallStatus overallStatus,
        String message) {
}
