package github.sarthakdev143.music_video_studio.model;

public record StoryboardScene(
        int sceneNumber,
        MediaKind mediaKind,
        String description,
        String prompt) {
}
