package github.sarthakdev143.music_video_studio.service.pipeline;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Spaces video batch dispatches at least one cooldown apart, measured start to start.
 */
@Component
public class CooldownGovernor {

    private final Clock clock;

    public CooldownGovernor(Clock clock) {
        this.clock = clock;
    }

    /**
     * Grants the window and stamps the new batch start, or reports how long the caller must wait.
     * The stamp is taken here, before any generation call is issued.
     */
    public CooldownDecision tryAcquire(CooldownWindow window) {
        synchronized (window) {
            Instant now = clock.instant();
            Instant lastBatchStart = window.lastBatchStart();
            if (lastBatchStart != null) {
                Duration elapsed = Duration.between(lastBatchStart, now);
                if (elapsed.compareTo(window.cooldownDuration()) < 0) {
                    return CooldownDecision.deny(window.cooldownDuration().minus(elapsed));
                }
            }
            window.markBatchStart(now);
            return CooldownDecision.grant();
        }
    }
}
