package github.sarthakdev143.scene_factory.exception;

import java.io.IOException;

public class AssemblyException extends IOException {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
