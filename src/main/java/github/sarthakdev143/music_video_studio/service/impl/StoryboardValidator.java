package github.sarthakdev143.music_video_studio.service.impl;

import github.sarthakdev143.music_video_studio.dto.StoryboardSceneRequest;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class StoryboardValidator {

    private static final int MAX_SCENES = 100;
    private static final int MAX_PROMPT_LENGTH = 4000;

    /**
     * Returns the storyboard ordered by scene number. Scene numbers must be unique and run from 1
     * without gaps.
     */
    public List<StoryboardScene> normalizeAndValidate(List<StoryboardSceneRequest> scenes) {
        if (scenes == null || scenes.isEmpty()) {
            throw new IllegalArgumentException("storyboard must contain at least one scene.");
        }
        if (scenes.size() > MAX_SCENES) {
            throw new IllegalArgumentException("storyboard supports at most " + MAX_SCENES + " scenes.");
        }

        List<StoryboardScene> normalized = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int index = 0; index < scenes.size(); index++) {
            StoryboardSceneRequest scene = scenes.get(index);
            if (scene == null) {
                throw new IllegalArgumentException("storyboard[" + index + "] must not be null.");
            }
            if (scene.scene() == null) {
                throw new IllegalArgumentException("storyboard[" + index + "].scene is required.");
            }
            if (!seen.add(scene.scene())) {
                throw new IllegalArgumentException("storyboard contains scene " + scene.scene() + " more than once.");
            }

            MediaKind mediaKind;
            try {
                mediaKind = MediaKind.fromInput(scene.type());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("storyboard[" + index + "].type: " + e.getMessage(), e);
            }

            String prompt = scene.prompt() == null ? "" : scene.prompt().trim();
            if (prompt.isEmpty()) {
                throw new IllegalArgumentException("storyboard[" + index + "].prompt is required.");
            }
            if (prompt.length() > MAX_PROMPT_LENGTH) {
                throw new IllegalArgumentException(
                        "storyboard[" + index + "].prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
            }

            String description = scene.description() == null ? "" : scene.description().trim();
            normalized.add(new StoryboardScene(scene.scene(), mediaKind, description, prompt));
        }

        normalized.sort(Comparator.comparingInt(StoryboardScene::sceneNumber));
        for (int index = 0; index < normalized.size(); index++) {
            int expected = index + 1;
            if (normalized.get(index).sceneNumber() != expected) {
                throw new IllegalArgumentException(
                        "storyboard scene numbers must run from 1 to " + normalized.size() + " without gaps (missing "
                                + expected + ").");
            }
        }
        return List.copyOf(normalized);
    }
}
