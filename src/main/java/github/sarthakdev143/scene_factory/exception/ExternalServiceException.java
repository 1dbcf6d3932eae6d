package github.sarthakdev143.scene_factory.exception;

public class ExternalServiceException extends GenerationException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
