package github.sarthakdev143.music_video_studio.service.pipeline;

import java.time.Duration;
import java.time.Instant;

public class CooldownWindow {

    private final Duration cooldownDuration;
    private Instant lastBatchStart;

    public CooldownWindow(Duration cooldownDuration) {
        this.cooldownDuration = cooldownDuration;
    }

    public Duration cooldownDuration() {
        return cooldownDuration;
    }

    public synchronized Instant lastBatchStart() {
        return lastBatchStart;
    }

    synchronized void markBatchStart(Instant startedAt) {
        this.lastBatchStart = startedAt;
    }
}
