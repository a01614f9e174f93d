package github.sarthakdev143.music_video_studio.service.pipeline;

public class AssemblyException extends PipelineException {

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
