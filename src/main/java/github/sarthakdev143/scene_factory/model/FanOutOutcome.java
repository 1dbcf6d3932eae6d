package github.sarthakdev143.scene_factory.model;

/**
 * Outcome of one fan-out task, aligned by {@code index} with the submitted task list.
 */
public record FanOutOutcome<T>(
        int index,
        T result,
        String referenceHandle,
        String error) {

    public static <T> FanOutOutcome<T> success(int index, T result, String referenceHandle) {
        return new FanOutOutcome<>(index, result, referenceHandle, null);
    }

    public static <T> FanOutOutcome<T> failure(int index, String error) {
        return new FanOutOutcome<>(index, null, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public boolean hasReusableHandle() {
        return succeeded() && referenceHandle != null;
    }
}
