package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.StoryboardScene;

public record DispatchTicket(StoryboardScene scene, long epoch) {

    public int sceneNumber() {
        return scene.sceneNumber();
    }
}
