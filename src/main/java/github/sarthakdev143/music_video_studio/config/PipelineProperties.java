package github.sarthakdev143.music_video_studio.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "music-video-studio.pipeline")
public record PipelineProperties(
        @DefaultValue("2") int videoBatchSize,
        @DefaultValue("20") int imageBatchSize,
        @DefaultValue("61s") Duration cooldown,
        @DefaultValue({"veo-3.1-fast-generate-preview", "veo-3.1-generate-preview"}) List<String> videoBackends,
        @DefaultValue("false") boolean autoAssemble,
        @DefaultValue("24") int generationThreads) {

    public PipelineProperties {
        if (videoBatchSize < 1) {
            throw new IllegalArgumentException("music-video-studio.pipeline.video-batch-size must be at least 1.");
        }
        if (imageBatchSize < 1) {
            throw new IllegalArgumentException("music-video-studio.pipeline.image-batch-size must be at least 1.");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("music-video-studio.pipeline.cooldown must not be negative.");
        }
        if (generationThreads < 1) {
            throw new IllegalArgumentException("music-video-studio.pipeline.generation-threads must be at least 1.");
        }
        videoBackends = videoBackends == null
                ? List.of()
                : videoBackends.stream()
                        .filter(backend -> backend != null && !backend.isBlank())
                        .map(String::trim)
                        .toList();
    }
}
