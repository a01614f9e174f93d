package github.sarthakdev143.music_video_studio.service.pipeline;

import java.util.List;

public record MergeResult(
        int completed,
        int failed,
        List<SceneOutcome> discarded) {

    public MergeResult {
        discarded = discarded == null ? List.of() : List.copyOf(discarded);
    }
}
