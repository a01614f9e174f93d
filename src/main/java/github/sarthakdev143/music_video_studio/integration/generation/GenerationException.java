package github.sarthakdev143.music_video_studio.integration.generation;

import java.io.IOException;

public class GenerationException extends IOException {

    private final GenerationFailureType failureType;

    public GenerationException(GenerationFailureType failureType, String message) {
        super(message);
        this.failureType = failureType;
    }

    public GenerationException(GenerationFailureType failureType, String message, Throwable cause) {
        super(message, cause);
        this.failureType = failureType;
    }

    public GenerationFailureType failureType() {
        return failureType;
    }
}
