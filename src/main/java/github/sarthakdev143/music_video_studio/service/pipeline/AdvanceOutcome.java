package github.sarthakdev143.music_video_studio.service.pipeline;

public enum AdvanceOutcome {
    /** Another advance holds the running guard. */
    BUSY,
    /** Nothing to do; the session is done. */
    IDLE,
    /** The stage changed without dispatching. */
    TRANSITIONED,
    /** One batch was dispatched and settled. */
    DISPATCHED,
    /** A video batch is waiting for the cooldown window. */
    COOLDOWN
}
