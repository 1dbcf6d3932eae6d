package github.sarthakdev143.scene_factory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SceneJobState {
    PENDING,
    GENERATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
