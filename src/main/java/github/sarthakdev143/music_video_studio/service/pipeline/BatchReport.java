package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.MediaKind;

import java.util.List;

public record BatchReport(
        MediaKind mediaKind,
        String backendId,
        List<Integer> sceneNumbers,
        int completed,
        int failed,
        int discarded) {

    public BatchReport {
        sceneNumbers = sceneNumbers == null ? List.of() : List.copyOf(sceneNumbers);
    }

    public int dispatched() {
        return sceneNumbers.size();
    }
}
