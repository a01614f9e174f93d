package github.sarthakdev143.music_video_studio.model;

public enum SceneStatus {
    PENDING,
    GENERATING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
