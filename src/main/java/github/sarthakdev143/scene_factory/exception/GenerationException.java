package github.sarthakdev143.scene_factory.exception;

import java.io.IOException;

/**
 * Failure of an external generation step. Recorded on the affected scene, never propagated out of the
 * background pipeline.
 */
public class GenerationException extends IOException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
