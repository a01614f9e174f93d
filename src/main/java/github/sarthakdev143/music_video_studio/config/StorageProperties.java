package github.sarthakdev143.music_video_studio.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "music-video-studio.storage")
public record StorageProperties(Path directory) {

    public StorageProperties {
        if (directory == null) {
            directory = Path.of(System.getProperty("java.io.tmpdir"), "music-video-studio");
        }
    }
}
