package github.sarthakdev143.scene_factory.exception;

public class InvalidSceneRequestException extends IllegalArgumentException {

    public InvalidSceneRequestException(String message) {
        super(message);
    }
}
