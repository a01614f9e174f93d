package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRotationSelectorTest {

    @Test
    void firstPassStopsOnceEveryBackendWasUsed() {
        BackendRotationSelector selector = selector(List.of("veo-fast", "veo"));

        assertThat(selector.selectFirstPass(0)).contains("veo-fast");
        assertThat(selector.selectFirstPass(1)).contains("veo");
        assertThat(selector.selectFirstPass(2)).isEmpty();
    }

    @Test
    void secondPassWrapsAroundTheBackendList() {
        BackendRotationSelector selector = selector(List.of("veo-fast", "veo"));

        assertThat(selector.selectWrapping(0)).isEqualTo("veo-fast");
        assertThat(selector.selectWrapping(1)).isEqualTo("veo");
        assertThat(selector.selectWrapping(2)).isEqualTo("veo-fast");
        assertThat(selector.selectWrapping(7)).isEqualTo("veo");
    }

    @Test
    void blankBackendNamesAreIgnored() {
        BackendRotationSelector selector = selector(List.of(" ", "veo "));

        assertThat(selector.backendCount()).isEqualTo(1);
        assertThat(selector.selectWrapping(3)).isEqualTo("veo");
    }

    @Test
    void emptyBackendListIsAConfigurationError() {
        BackendRotationSelector selector = selector(List.of());

        assertThatThrownBy(selector::requireConfigured)
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("video-backends");
        assertThatThrownBy(() -> selector.selectFirstPass(0)).isInstanceOf(PipelineConfigurationException.class);
    }

    private BackendRotationSelector selector(List<String> backends) {
        return new BackendRotationSelector(new PipelineProperties(2, 20, Duration.ofSeconds(61), backends, false, 4));
    }
}
