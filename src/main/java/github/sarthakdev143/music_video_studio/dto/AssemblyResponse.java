package github.sarthakdev143.music_video_studio.dto;

public record AssemblyResponse(
        String productionId,
        String combinedArtifactHandle,
        String message) {
}
