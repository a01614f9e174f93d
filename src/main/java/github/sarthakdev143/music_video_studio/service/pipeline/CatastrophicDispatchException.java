package github.sarthakdev143.music_video_studio.service.pipeline;

/**
 * The batch dispatch layer itself failed before per-scene outcomes were known. Every scene of the
 * batch has already been marked failed when this is thrown.
 */
public class CatastrophicDispatchException extends PipelineException {

    private final int failedScenes;

    public CatastrophicDispatchException(String message, int failedScenes, Throwable cause) {
        super(message, cause);
        this.failedScenes = failedScenes;
    }

    public int failedScenes() {
        return failedScenes;
    }
}
