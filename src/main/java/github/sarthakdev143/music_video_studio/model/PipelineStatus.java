package github.sarthakdev143.music_video_studio.model;

import java.time.Duration;

public record PipelineStatus(
        PipelineStage stage,
        PipelineActivity activity,
        MediaKind mediaKind,
        int batchSize,
        String backendId,
        Duration remainingWait) {

    public static PipelineStatus idle(PipelineStage stage) {
        return new PipelineStatus(stage, PipelineActivity.IDLE, null, 0, null, null);
    }

    public static PipelineStatus generating(PipelineStage stage, MediaKind kind, int batchSize, String backendId) {
        return new PipelineStatus(stage, PipelineActivity.GENERATING, kind, batchSize, backendId, null);
    }

    public static PipelineStatus cooldown(PipelineStage stage, Duration remainingWait) {
        return new PipelineStatus(stage, PipelineActivity.COOLDOWN, MediaKind.VIDEO, 0, null, remainingWait);
    }

    public static PipelineStatus ready(PipelineStage stage) {
        return new PipelineStatus(stage, PipelineActivity.READY, null, 0, null, null);
    }

    public static PipelineStatus blocked(PipelineStage stage) {
        return new PipelineStatus(stage, PipelineActivity.BLOCKED, null, 0, null, null);
    }

    public static PipelineStatus error(PipelineStage stage) {
        return new PipelineStatus(stage, PipelineActivity.ERROR, null, 0, null, null);
    }

    public Long remainingWaitSeconds() {
        if (remainingWait == null) {
            return null;
        }
        return Math.round(remainingWait.toMillis() / 1000.0);
    }

    public String message() {
        return switch (activity) {
            case IDLE -> "Production in progress...";
            case GENERATING -> backendId == null
                    ? "Generating a batch of " + batchSize + " images..."
                    : (stage == PipelineStage.VIDEO_PASS_2 ? "Block 2" : "Block 1")
                            + ": Generating " + batchSize + " video(s) with " + backendId + "...";
            case COOLDOWN -> "Waiting " + remainingWaitSeconds() + "s for API cooldown...";
            case READY -> "All assets are ready!";
            case BLOCKED -> "Some scenes failed. Regenerate them before combining.";
            case ERROR -> "A critical error occurred. Check server logs and resume the production.";
        };
    }
}
