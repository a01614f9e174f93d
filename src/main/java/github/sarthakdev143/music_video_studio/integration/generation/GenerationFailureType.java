package github.sarthakdev143.music_video_studio.integration.generation;

public enum GenerationFailureType {
    QUOTA_EXCEEDED,
    TIMEOUT,
    TRANSPORT,
    REJECTED
}
