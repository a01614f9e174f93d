package github.sarthakdev143.music_video_studio.service.pipeline;

import java.time.Duration;

public record AdvanceResult(
        AdvanceOutcome outcome,
        Duration retryAfter,
        BatchReport batch) {

    public static AdvanceResult busy() {
        return new AdvanceResult(AdvanceOutcome.BUSY, null, null);
    }

    public static AdvanceResult idle() {
        return new AdvanceResult(AdvanceOutcome.IDLE, null, null);
    }

    public static AdvanceResult transitioned() {
        return new AdvanceResult(AdvanceOutcome.TRANSITIONED, null, null);
    }

    public static AdvanceResult dispatched(BatchReport batch) {
        return new AdvanceResult(AdvanceOutcome.DISPATCHED, null, batch);
    }

    public static AdvanceResult cooldown(Duration retryAfter) {
        return new AdvanceResult(AdvanceOutcome.COOLDOWN, retryAfter, null);
    }

    public boolean madeProgress() {
        return outcome == AdvanceOutcome.TRANSITIONED || outcome == AdvanceOutcome.DISPATCHED;
    }
}
