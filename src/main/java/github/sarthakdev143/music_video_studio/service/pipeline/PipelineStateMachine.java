package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import github.sarthakdev143.music_video_studio.integration.generation.ImageGenerationClient;
import github.sarthakdev143.music_video_studio.integration.generation.VideoGenerationClient;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.PipelineStage;
import github.sarthakdev143.music_video_studio.model.PipelineStatus;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Moves a production through its passes, one step per {@link #advance(ProductionSession)} call:
 * videos first (one batch per backend), then all images, then the remaining videos with the
 * backend rotation wrapping around.
 */
@Component
public class PipelineStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final PipelineProperties properties;
    private final CooldownGovernor cooldownGovernor;
    private final BackendRotationSelector rotationSelector;
    private final BatchExecutor batchExecutor;
    private final CompletionAggregator completionAggregator;
    private final VideoGenerationClient videoGenerationClient;
    private final ImageGenerationClient imageGenerationClient;
    private final MeterRegistry meterRegistry;
    private final Counter cooldownDeferralCounter;

    public PipelineStateMachine(
            PipelineProperties properties,
            CooldownGovernor cooldownGovernor,
            BackendRotationSelector rotationSelector,
            BatchExecutor batchExecutor,
            CompletionAggregator completionAggregator,
            VideoGenerationClient videoGenerationClient,
            ImageGenerationClient imageGenerationClient,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.cooldownGovernor = cooldownGovernor;
        this.rotationSelector = rotationSelector;
        this.batchExecutor = batchExecutor;
        this.completionAggregator = completionAggregator;
        this.videoGenerationClient = videoGenerationClient;
        this.imageGenerationClient = imageGenerationClient;
        this.meterRegistry = meterRegistry;
        this.cooldownDeferralCounter = meterRegistry.counter("music_video_studio.cooldown.deferrals");
    }

    public AdvanceResult advance(ProductionSession session) {
        if (!session.tryAcquireGuard()) {
            session.requestRerun();
            logger.debug("Production {} is already advancing", session.id());
            return AdvanceResult.busy();
        }

        try {
            session.clearFatalError();
            return advanceGuarded(session);
        } catch (PipelineException e) {
            session.recordFatalError(e.getMessage());
            throw e;
        } finally {
            session.releaseGuard();
        }
    }

    private AdvanceResult advanceGuarded(ProductionSession session) {
        long revision = session.revision();
        PipelineStage stage = session.stage();

        return switch (stage) {
            case INITIAL -> leaveInitial(session, revision);
            case VIDEO_PASS_1 -> runVideoPass(session, revision, PipelineStage.VIDEO_PASS_1);
            case IMAGE_PASS -> runImagePass(session, revision);
            case VIDEO_PASS_2 -> runVideoPass(session, revision, PipelineStage.VIDEO_PASS_2);
            case DONE -> {
                completionAggregator.evaluate(session);
                yield AdvanceResult.idle();
            }
        };
    }

    private AdvanceResult leaveInitial(ProductionSession session, long revision) {
        SceneTable sceneTable = session.sceneTable();
        PipelineStage next;
        if (!sceneTable.hasPending()) {
            next = PipelineStage.DONE;
        } else if (sceneTable.hasPending(MediaKind.VIDEO)) {
            next = PipelineStage.VIDEO_PASS_1;
        } else {
            next = PipelineStage.IMAGE_PASS;
        }

        moveTo(session, revision, PipelineStage.INITIAL, next, false);
        return AdvanceResult.transitioned();
    }

    private AdvanceResult runVideoPass(ProductionSession session, long revision, PipelineStage stage) {
        rotationSelector.requireConfigured();
        boolean firstPass = stage == PipelineStage.VIDEO_PASS_1;

        List<StoryboardScene> batch = session.sceneTable().pending(MediaKind.VIDEO, properties.videoBatchSize());
        if (batch.isEmpty()) {
            moveTo(session, revision, stage, firstPass ? PipelineStage.IMAGE_PASS : PipelineStage.DONE, firstPass);
            return AdvanceResult.transitioned();
        }

        int cursor = session.rotationCursor();
        Optional<String> backend = firstPass
                ? rotationSelector.selectFirstPass(cursor)
                : Optional.of(rotationSelector.selectWrapping(cursor));
        if (backend.isEmpty()) {
            logger.info(
                    "Production {} used all {} backend(s) in the first video pass; moving on to images",
                    session.id(),
                    rotationSelector.backendCount());
            moveTo(session, revision, stage, PipelineStage.IMAGE_PASS, true);
            return AdvanceResult.transitioned();
        }

        videoGenerationClient.checkConfiguration();
        CooldownDecision decision = cooldownGovernor.tryAcquire(session.cooldownWindow());
        if (!decision.granted()) {
            cooldownDeferralCounter.increment();
            session.updateStatus(PipelineStatus.cooldown(stage, decision.remainingWait()));
            logger.debug(
                    "Production {} waiting {} ms for video cooldown",
                    session.id(),
                    decision.remainingWait().toMillis());
            return AdvanceResult.cooldown(decision.remainingWait());
        }

        String backendId = backend.get();
        AspectRatio aspectRatio = session.request().aspectRatio();
        session.updateStatus(PipelineStatus.generating(stage, MediaKind.VIDEO, batch.size(), backendId));
        logger.info(
                "Production {} {}: generating {} video(s) {} with {}",
                session.id(),
                stage,
                batch.size(),
                sceneNumbers(batch),
                backendId);

        BatchReport report;
        try {
            report = batchExecutor.execute(
                    session.sceneTable(),
                    MediaKind.VIDEO,
                    backendId,
                    batch,
                    scene -> videoGenerationClient.generateVideo(scene.prompt(), aspectRatio, backendId));
        } finally {
            // A dispatched batch uses up its backend slot even when the dispatch failed as a whole.
            session.advanceCursor(revision);
        }
        settle(session, report);
        return AdvanceResult.dispatched(report);
    }

    private AdvanceResult runImagePass(ProductionSession session, long revision) {
        SceneTable sceneTable = session.sceneTable();
        List<StoryboardScene> batch = sceneTable.pending(MediaKind.IMAGE, properties.imageBatchSize());
        if (batch.isEmpty()) {
            moveTo(session, revision, PipelineStage.IMAGE_PASS, PipelineStage.VIDEO_PASS_2, false);
            return AdvanceResult.transitioned();
        }

        imageGenerationClient.checkConfiguration();
        AspectRatio aspectRatio = session.request().aspectRatio();
        session.updateStatus(PipelineStatus.generating(PipelineStage.IMAGE_PASS, MediaKind.IMAGE, batch.size(), null));
        logger.info("Production {} IMAGE_PASS: generating {} image(s)", session.id(), batch.size());

        BatchReport report = batchExecutor.execute(
                sceneTable,
                MediaKind.IMAGE,
                null,
                batch,
                scene -> imageGenerationClient.generateImage(scene.prompt(), aspectRatio));
        if (!sceneTable.hasPending(MediaKind.IMAGE)) {
            moveTo(session, revision, PipelineStage.IMAGE_PASS, PipelineStage.VIDEO_PASS_2, false);
        }
        settle(session, report);
        return AdvanceResult.dispatched(report);
    }

    private void settle(ProductionSession session, BatchReport report) {
        String kind = report.mediaKind().metricTag();
        meterRegistry.counter("music_video_studio.batches.dispatched", "kind", kind).increment();
        meterRegistry.counter("music_video_studio.scenes.completed", "kind", kind).increment(report.completed());
        meterRegistry.counter("music_video_studio.scenes.failed", "kind", kind).increment(report.failed());
        logger.info(
                "Production {} {} batch {} settled: {} complete, {} failed, {} discarded",
                session.id(),
                kind,
                report.sceneNumbers(),
                report.completed(),
                report.failed(),
                report.discarded());
        session.updateStatus(PipelineStatus.idle(session.stage()));
        completionAggregator.evaluate(session);
    }

    private void moveTo(
            ProductionSession session,
            long revision,
            PipelineStage from,
            PipelineStage to,
            boolean resetCursor) {
        if (!session.transition(revision, from, to, resetCursor)) {
            logger.debug("Production {} changed while leaving {}; skipping move to {}", session.id(), from, to);
            return;
        }
        logger.info("Production {} moved from {} to {}", session.id(), from, to);
        if (to == PipelineStage.DONE) {
            completionAggregator.evaluate(session);
        } else {
            session.updateStatus(PipelineStatus.idle(to));
        }
    }

    private List<Integer> sceneNumbers(List<StoryboardScene> batch) {
        return batch.stream().map(StoryboardScene::sceneNumber).toList();
    }
}
