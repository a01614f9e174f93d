package github.sarthakdev143.music_video_studio.model;

public record AssemblyClip(
        int sceneNumber,
        MediaKind mediaKind,
        String artifactHandle) {
}
