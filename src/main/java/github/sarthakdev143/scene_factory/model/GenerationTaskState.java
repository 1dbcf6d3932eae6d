package github.sarthakdev143.scene_factory.model;

public enum GenerationTaskState {
    QUEUED,
    RUNNING,
    DONE,
    ERROR
}
