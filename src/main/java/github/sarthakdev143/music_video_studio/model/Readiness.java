package github.sarthakdev143.music_video_studio.model;

public enum Readiness {
    IN_PROGRESS,
    BLOCKED_BY_FAILURES,
    READY
}
