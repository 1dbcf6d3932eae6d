package github.sarthakdev143.scene_factory.model;

public record GenerationTaskResult(
        String taskId,
        GenerationTaskState state,
        String resultUri,
        String error) {

    public static GenerationTaskResult running(String taskId) {
        return new GenerationTaskResult(taskId, GenerationTaskState.RUNNING, null, null);
    }

    public static GenerationTaskResult done(String taskId, String resultUri) {
        return new GenerationTaskResult(taskId, GenerationTaskState.DONE, resultUri, null);
    }

    public static GenerationTaskResult error(String taskId, String error) {
        return new GenerationTaskResult(taskId, GenerationTaskState.ERROR, null, error);
    }
}
