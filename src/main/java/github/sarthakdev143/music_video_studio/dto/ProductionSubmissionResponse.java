package github.sarthakdev143.music_video_studio.dto;

public record ProductionSubmissionResponse(
        String productionId,
        int sceneCount,
        String message) {
}
