package github.sarthakdev143.music_video_studio.service.pipeline;

/**
 * The pipeline cannot dispatch anything with the current configuration. Raised before any scene
 * changes state.
 */
public class PipelineConfigurationException extends PipelineException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
