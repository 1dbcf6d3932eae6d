package github.sarthakdev143.scene_factory.dto;

import java.util.List;

/**
 * Either {@code scenes} or a free-form {@code script} describing them. When both are present the
 * explicit scenes win.
 */
public record SceneJobSubmissionRequest(
        String ownerReference,
        List<SceneDescriptionRequest> scenes,
        String script,
        Boolean continuityEnabled) {
}
