package github.sarthakdev143.scene_factory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

public enum OverallStatus {
    GENERATING,
    COMPLETED,
    FAILED,
    PARTIAL;

    /**
     * Derives the aggregate status of a job from its scene states.
     * A pending scene is queued for dispatch and counts as in flight.
     */
    public static OverallStatus of(Collection<SceneJobState> states) {
        if (states == null || states.isEmpty()) {
            return PARTIAL;
        }
        if (states.stream().allMatch(state -> state == SceneJobState.COMPLETED)) {
            return COMPLETED;
        }
        if (states.stream().allMatch(state -> state == SceneJobState.FAILED)) {
            return FAILED;
        }
        if (states.stream().anyMatch(state -> state == SceneJobState.GENERATING || state == SceneJobState.PENDING)) {
            return GENERATING;
        }
        return PARTIAL;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
