package github.sarthakdev143.music_video_studio.model;

public record ProductionRequest(
        String title,
        String artist,
        AspectRatio aspectRatio,
        String audioTrackHandle) {
}
