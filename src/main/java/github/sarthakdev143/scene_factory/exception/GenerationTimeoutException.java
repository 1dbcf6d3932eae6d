package github.sarthakdev143.scene_factory.exception;

public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String message) {
        super(message);
    }
}
