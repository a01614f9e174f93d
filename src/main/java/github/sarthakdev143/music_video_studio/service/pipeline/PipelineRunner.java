package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Event loop around {@link PipelineStateMachine}. Every step that changed something queues exactly
 * one more step, and a cooldown denial becomes a single deferred wake-up.
 */
@Component
public class PipelineRunner {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    private final PipelineStateMachine stateMachine;
    private final ProductionAssemblyService assemblyService;
    private final ArtifactStore artifactStore;
    private final TaskExecutor pipelineTaskExecutor;
    private final TaskScheduler pipelineTaskScheduler;
    private final Clock clock;
    private final boolean autoAssemble;

    public PipelineRunner(
            PipelineStateMachine stateMachine,
            ProductionAssemblyService assemblyService,
            ArtifactStore artifactStore,
            @Qualifier("pipelineTaskExecutor") TaskExecutor pipelineTaskExecutor,
            @Qualifier("pipelineTaskScheduler") TaskScheduler pipelineTaskScheduler,
            Clock clock,
            PipelineProperties properties) {
        this.stateMachine = stateMachine;
        this.assemblyService = assemblyService;
        this.artifactStore = artifactStore;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
        this.pipelineTaskScheduler = pipelineTaskScheduler;
        this.clock = clock;
        this.autoAssemble = properties.autoAssemble();
    }

    public void enqueueAdvance(ProductionSession session) {
        if (session.isClosed()) {
            return;
        }
        try {
            pipelineTaskExecutor.execute(() -> runAdvance(session));
        } catch (TaskRejectedException e) {
            logger.error("Could not queue the next step of production {}", session.id(), e);
            session.recordFatalError("The pipeline is overloaded and could not continue. Resume the production.");
        }
    }

    /**
     * Clears a fatal error and queues the next step.
     */
    public void resume(ProductionSession session) {
        if (session.isClosed()) {
            throw new IllegalStateException("Production " + session.id() + " has ended.");
        }
        session.clearFatalError();
        enqueueAdvance(session);
    }

    /**
     * Closes the session and releases every artifact it holds. Generation calls still running are
     * not cancelled; whatever they produce is released when their batch settles.
     */
    public void stop(ProductionSession session) {
        String combined = session.close();
        artifactStore.release(combined);
        releaseArtifacts(session);
        artifactStore.release(session.request().audioTrackHandle());
    }

    void runAdvance(ProductionSession session) {
        if (session.isClosed()) {
            return;
        }

        AdvanceResult result;
        try {
            result = stateMachine.advance(session);
            if (session.isClosed()) {
                releaseArtifacts(session);
                return;
            }
        } catch (PipelineConfigurationException e) {
            logger.error("Production {} stopped: {}", session.id(), e.getMessage());
            return;
        } catch (CatastrophicDispatchException e) {
            logger.error(
                    "Production {} lost a whole batch ({} scene(s) marked failed); continuing",
                    session.id(),
                    e.failedScenes(),
                    e);
            enqueueAdvance(session);
            return;
        } catch (RuntimeException e) {
            logger.error("Production {} stopped on an unexpected error", session.id(), e);
            session.recordFatalError(e.getMessage() == null ? "An unknown error occurred." : e.getMessage());
            return;
        }

        switch (result.outcome()) {
            case TRANSITIONED, DISPATCHED -> enqueueAdvance(session);
            case COOLDOWN -> {
                scheduleWakeup(session, result.retryAfter());
                rerunIfRequested(session);
            }
            case IDLE -> {
                if (autoAssemble) {
                    assemblyService.assembleIfAuthorized(session);
                }
                rerunIfRequested(session);
            }
            case BUSY -> {
                if (!session.isRunning()) {
                    rerunIfRequested(session);
                }
            }
        }
    }

    private void releaseArtifacts(ProductionSession session) {
        for (GeneratedMediaItem item : session.sceneTable().snapshot()) {
            if (item.artifactHandle() != null) {
                artifactStore.release(item.artifactHandle());
            }
        }
    }

    private void rerunIfRequested(ProductionSession session) {
        if (session.consumeRerunRequest()) {
            enqueueAdvance(session);
        }
    }

    void scheduleWakeup(ProductionSession session, Duration delay) {
        if (session.isClosed()) {
            return;
        }
        ScheduledFuture<?> wakeup = pipelineTaskScheduler.schedule(
                () -> {
                    session.clearPendingWakeup();
                    enqueueAdvance(session);
                },
                clock.instant().plus(delay));
        session.replacePendingWakeup(wakeup);
        logger.debug("Production {} will resume in {} ms", session.id(), delay.toMillis());
    }
}
