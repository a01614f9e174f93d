package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.StoryboardScene;

@FunctionalInterface
public interface SceneGenerationCall {

    /**
     * Generates the media for one scene and returns its artifact handle.
     */
    String generate(StoryboardScene scene) throws Exception;
}
