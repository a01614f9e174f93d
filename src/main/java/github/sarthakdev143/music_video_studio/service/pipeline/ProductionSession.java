package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.PipelineStage;
import github.sarthakdev143.music_video_studio.model.PipelineStatus;
import github.sarthakdev143.music_video_studio.model.ProductionRequest;
import github.sarthakdev143.music_video_studio.model.ProductionSnapshot;
import github.sarthakdev143.music_video_studio.model.Readiness;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * All mutable state of one production run: the scene table plus the stage, rotation cursor,
 * cooldown window, running guard and the combined artifact.
 *
 * <p>Fields other than the scene table and the guard are read and written under the session's
 * monitor. {@code revision} is bumped by every regeneration so that work started before it can
 * detect that its stage and cursor updates are stale.
 */
public class ProductionSession {

    private final String id;
    private final ProductionRequest request;
    private final SceneTable sceneTable;
    private final CooldownWindow cooldownWindow;
    private final Clock clock;
    private final Instant createdAt;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean rerunRequested = new AtomicBoolean();

    private PipelineStage stage = PipelineStage.INITIAL;
    private int rotationCursor;
    private long revision;
    private PipelineStatus status = PipelineStatus.idle(PipelineStage.INITIAL);
    private Readiness readiness = Readiness.IN_PROGRESS;
    private boolean assemblyAuthorized;
    private String combinedArtifactHandle;
    private String fatalError;
    private boolean closed;
    private ScheduledFuture<?> pendingWakeup;
    private Instant updatedAt;

    public ProductionSession(
            String id,
            ProductionRequest request,
            List<StoryboardScene> storyboard,
            Duration cooldownDuration,
            Clock clock) {
        this.id = id;
        this.request = request;
        this.sceneTable = new SceneTable(storyboard);
        this.cooldownWindow = new CooldownWindow(cooldownDuration);
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    public String id() {
        return id;
    }

    public ProductionRequest request() {
        return request;
    }

    public SceneTable sceneTable() {
        return sceneTable;
    }

    public CooldownWindow cooldownWindow() {
        return cooldownWindow;
    }

    boolean tryAcquireGuard() {
        return running.compareAndSet(false, true);
    }

    void releaseGuard() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    void requestRerun() {
        rerunRequested.set(true);
    }

    boolean consumeRerunRequest() {
        return rerunRequested.getAndSet(false);
    }

    public synchronized PipelineStage stage() {
        return stage;
    }

    public synchronized int rotationCursor() {
        return rotationCursor;
    }

    public synchronized long revision() {
        return revision;
    }

    synchronized boolean transition(long expectedRevision, PipelineStage from, PipelineStage to, boolean resetCursor) {
        if (revision != expectedRevision || stage != from) {
            return false;
        }
        stage = to;
        if (resetCursor) {
            rotationCursor = 0;
        }
        touch();
        return true;
    }

    synchronized boolean advanceCursor(long expectedRevision) {
        if (revision != expectedRevision) {
            return false;
        }
        rotationCursor++;
        touch();
        return true;
    }

    /**
     * Sends the session back to the first stage after a scene was reset. Returns the combined
     * artifact handle that just became stale, if any.
     */
    synchronized String rewindForRegeneration() {
        revision++;
        stage = PipelineStage.INITIAL;
        rotationCursor = 0;
        readiness = Readiness.IN_PROGRESS;
        assemblyAuthorized = false;
        fatalError = null;
        status = PipelineStatus.idle(PipelineStage.INITIAL);
        String staleCombined = combinedArtifactHandle;
        combinedArtifactHandle = null;
        touch();
        return staleCombined;
    }

    public synchronized PipelineStatus status() {
        return status;
    }

    synchronized void updateStatus(PipelineStatus status) {
        this.status = status;
        touch();
    }

    public synchronized Readiness readiness() {
        return readiness;
    }

    synchronized void updateReadiness(Readiness readiness) {
        this.readiness = readiness;
        touch();
    }

    synchronized void grantAssemblyAuthorization() {
        assemblyAuthorized = true;
    }

    synchronized void revokeAssemblyAuthorization() {
        assemblyAuthorized = false;
    }

    synchronized boolean consumeAssemblyAuthorization() {
        boolean granted = assemblyAuthorized;
        assemblyAuthorized = false;
        return granted;
    }

    synchronized void restoreAssemblyAuthorization(long expectedRevision) {
        if (revision == expectedRevision && readiness == Readiness.READY) {
            assemblyAuthorized = true;
        }
    }

    public synchronized String combinedArtifactHandle() {
        return combinedArtifactHandle;
    }

    synchronized boolean storeCombinedArtifact(long expectedRevision, String handle) {
        if (revision != expectedRevision || closed) {
            return false;
        }
        combinedArtifactHandle = handle;
        touch();
        return true;
    }

    public synchronized String fatalError() {
        return fatalError;
    }

    synchronized void recordFatalError(String message) {
        fatalError = message;
        status = PipelineStatus.error(stage);
        touch();
    }

    synchronized void clearFatalError() {
        if (fatalError != null) {
            fatalError = null;
            status = switch (readiness) {
                case READY -> PipelineStatus.ready(stage);
                case BLOCKED_BY_FAILURES -> PipelineStatus.blocked(stage);
                case IN_PROGRESS -> PipelineStatus.idle(stage);
            };
            touch();
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Marks the session closed and returns the combined artifact handle so the caller can release it.
     */
    synchronized String close() {
        closed = true;
        cancelPendingWakeup();
        String combined = combinedArtifactHandle;
        combinedArtifactHandle = null;
        assemblyAuthorized = false;
        touch();
        return combined;
    }

    synchronized void replacePendingWakeup(ScheduledFuture<?> wakeup) {
        cancelPendingWakeup();
        pendingWakeup = wakeup;
    }

    synchronized void clearPendingWakeup() {
        pendingWakeup = null;
    }

    synchronized boolean hasPendingWakeup() {
        return pendingWakeup != null;
    }

    private void cancelPendingWakeup() {
        if (pendingWakeup != null) {
            pendingWakeup.cancel(false);
            pendingWakeup = null;
        }
    }

    public synchronized ProductionSnapshot snapshot() {
        return new ProductionSnapshot(
                id,
                request.title(),
                request.artist(),
                request.aspectRatio(),
                stage,
                status,
                status.message(),
                sceneTable.snapshot(),
                readiness,
                readiness == Readiness.READY,
                combinedArtifactHandle,
                fatalError,
                createdAt,
                updatedAt);
    }

    private void touch() {
        updatedAt = clock.instant();
    }
}
