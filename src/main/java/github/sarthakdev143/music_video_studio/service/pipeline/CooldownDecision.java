package github.sarthakdev143.music_video_studio.service.pipeline;

import java.time.Duration;

public record CooldownDecision(boolean granted, Duration remainingWait) {

    public static CooldownDecision grant() {
        return new CooldownDecision(true, Duration.ZERO);
    }

    public static CooldownDecision deny(Duration remainingWait) {
        return new CooldownDecision(false, remainingWait);
    }
}
