package github.sarthakdev143.scene_factory.model.assembly;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssemblyState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
