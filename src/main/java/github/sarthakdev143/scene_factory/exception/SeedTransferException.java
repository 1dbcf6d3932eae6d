package github.sarthakdev143.scene_factory.exception;

/**
 * The provider could not fetch the seed image of a video request.
 */
public class SeedTransferException extends GenerationException {

    public SeedTransferException(String message) {
        super(message);
    }

    public SeedTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
