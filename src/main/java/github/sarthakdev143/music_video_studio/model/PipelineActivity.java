package github.sarthakdev143.music_video_studio.model;

public enum PipelineActivity {
    IDLE,
    GENERATING,
    COOLDOWN,
    READY,
    BLOCKED,
    ERROR
}
