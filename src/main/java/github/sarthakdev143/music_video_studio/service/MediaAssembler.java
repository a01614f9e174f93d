package github.sarthakdev143.music_video_studio.service;

import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.AssemblyClip;

import java.io.IOException;
import java.util.List;

public interface MediaAssembler {

    /**
     * Combines the clips, in the given order, with the audio track and returns the handle of the
     * combined video.
     */
    String assemble(List<AssemblyClip> clips, String audioTrackHandle, AspectRatio aspectRatio)
            throws IOException, InterruptedException;
}
