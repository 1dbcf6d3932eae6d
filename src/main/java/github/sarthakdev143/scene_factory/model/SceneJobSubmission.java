package github.sarthakdev143.scene_factory.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record SceneJobSubmission(
        String ownerReference,
        List<SceneDescription> scenes,
        Boolean continuityEnabled) {

    public SceneJobSubmission {
        // null entries survive so the validator can report them
        scenes = scenes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(scenes));
    }
}
