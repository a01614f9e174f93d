package github.sarthakdev143.music_video_studio.dto;

public record StoryboardSceneRequest(
        Integer scene,
        String type,
        String description,
        String prompt) {
}
