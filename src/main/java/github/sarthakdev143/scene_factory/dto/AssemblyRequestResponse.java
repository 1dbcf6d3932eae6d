package github.sarthakdev143.scene_factory.dto;

public record AssemblyRequestResponse(String jobId, String message) {
}
