package github.sarthakdev143.music_video_studio.model;

/**
 * Ordered passes of a production run. Stages only move forward, except that regenerating a
 * scene sends the session back to {@link #INITIAL}.
 */
public enum PipelineStage {
    INITIAL,
    VIDEO_PASS_1,
    IMAGE_PASS,
    VIDEO_PASS_2,
    DONE
}
