package github.sarthakdev143.scene_factory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SeedSource {
    CONTINUITY_FRAME,
    STATIC_IMAGE,
    NONE;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
