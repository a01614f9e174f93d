package github.sarthakdev143.music_video_studio.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "music-video-studio.gemini")
public record GeminiProperties(
        String apiKey,
        @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
        @DefaultValue("imagen-4.0-generate-001") String imageModel,
        @DefaultValue("720p") String videoResolution,
        @DefaultValue("10s") Duration pollInterval,
        @DefaultValue("60") int maxPolls) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
