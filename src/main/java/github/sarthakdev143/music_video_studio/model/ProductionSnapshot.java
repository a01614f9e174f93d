package github.sarthakdev143.music_video_studio.model;

import java.time.Instant;
import java.util.List;

public record ProductionSnapshot(
        String productionId,
        String title,
        String artist,
        AspectRatio aspectRatio,
        PipelineStage stage,
        PipelineStatus status,
        String statusMessage,
        List<GeneratedMediaItem> items,
        Readiness readiness,
        boolean readyToAssemble,
        String combinedArtifactHandle,
        String fatalError,
        Instant createdAt,
        Instant updatedAt) {

    public ProductionSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
