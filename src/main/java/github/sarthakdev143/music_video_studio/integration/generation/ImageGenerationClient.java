package github.sarthakdev143.music_video_studio.integration.generation;

import github.sarthakdev143.music_video_studio.model.AspectRatio;

import java.io.IOException;

public interface ImageGenerationClient {

    void checkConfiguration();

    String generateImage(String prompt, AspectRatio aspectRatio) throws IOException, InterruptedException;
}
