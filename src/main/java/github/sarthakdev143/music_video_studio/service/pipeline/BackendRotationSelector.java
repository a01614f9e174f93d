package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class BackendRotationSelector {

    private final List<String> backends;

    public BackendRotationSelector(PipelineProperties properties) {
        this.backends = List.copyOf(properties.videoBackends());
    }

    public void requireConfigured() {
        if (backends.isEmpty()) {
            throw new PipelineConfigurationException(
                    "No video generation backends configured. Set music-video-studio.pipeline.video-backends.");
        }
    }

    /**
     * First video pass: one batch per backend, no wrap-around.
     */
    public Optional<String> selectFirstPass(int cursor) {
        requireConfigured();
        if (cursor < 0) {
            throw new IllegalArgumentException("Rotation cursor must not be negative.");
        }
        if (cursor >= backends.size()) {
            return Optional.empty();
        }
        return Optional.of(backends.get(cursor));
    }

    /**
     * Second video pass: keeps cycling through the backends until no video is left.
     */
    public String selectWrapping(int cursor) {
        requireConfigured();
        return backends.get(Math.floorMod(cursor, backends.size()));
    }

    public int backendCount() {
        return backends.size();
    }
}
