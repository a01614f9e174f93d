package github.sarthakdev143.music_video_studio.integration.generation;

import github.sarthakdev143.music_video_studio.model.AspectRatio;

import java.io.IOException;

public interface VideoGenerationClient {

    /**
     * Fails fast when the client cannot possibly dispatch, e.g. missing credentials.
     */
    void checkConfiguration();

    /**
     * Generates one clip and returns the artifact handle it was stored under. Blocks for the
     * whole generation, which typically takes minutes.
     */
    String generateVideo(String prompt, AspectRatio aspectRatio, String backendId)
            throws IOException, InterruptedException;
}
