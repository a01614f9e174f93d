package github.sarthakdev143.music_video_studio.service.impl;

import github.sarthakdev143.music_video_studio.dto.StoryboardSceneRequest;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoryboardValidatorTest {

    private final StoryboardValidator validator = new StoryboardValidator();

    @Test
    void normalizesAndOrdersScenes() {
        List<StoryboardScene> scenes = validator.normalizeAndValidate(List.of(
                new StoryboardSceneRequest(2, "image", null, "  neon rain  "),
                new StoryboardSceneRequest(1, "VIDEO", " Opening ", "city skyline")));

        assertThat(scenes).containsExactly(
                new StoryboardScene(1, MediaKind.VIDEO, "Opening", "city skyline"),
                new StoryboardScene(2, MediaKind.IMAGE, "", "neon rain"));
    }

    @Test
    void rejectsEmptyStoryboard() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("storyboard must contain at least one scene.");
    }

    @Test
    void rejectsTooManyScenes() {
        List<StoryboardSceneRequest> scenes = new ArrayList<>();
        for (int scene = 1; scene <= 101; scene++) {
            scenes.add(new StoryboardSceneRequest(scene, "image", "", "prompt"));
        }

        assertThatThrownBy(() -> validator.normalizeAndValidate(scenes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most 100 scenes");
    }

    @Test
    void rejectsUnknownMediaKind() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of(new StoryboardSceneRequest(1, "gif", "", "p"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("storyboard[0].type");
    }

    @Test
    void rejectsBlankPrompt() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of(new StoryboardSceneRequest(1, "video", "", " "))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("storyboard[0].prompt is required.");
    }

    @Test
    void rejectsDuplicateSceneNumbers() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of(
                        new StoryboardSceneRequest(1, "video", "", "a"),
                        new StoryboardSceneRequest(1, "image", "", "b"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scene 1 more than once");
    }

    @Test
    void rejectsGapsInSceneNumbers() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of(
                        new StoryboardSceneRequest(1, "video", "", "a"),
                        new StoryboardSceneRequest(3, "image", "", "b"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing 2");
    }

    @Test
    void rejectsMissingSceneNumber() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(List.of(new StoryboardSceneRequest(null, "video", "", "a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("storyboard[0].scene is required.");
    }
}
