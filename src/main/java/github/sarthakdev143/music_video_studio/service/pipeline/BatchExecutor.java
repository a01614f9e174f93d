package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one batch of generation calls side by side and writes all of their results back together.
 */
@Component
public class BatchExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BatchExecutor.class);
    private static final String UNKNOWN_ERROR = "An unknown error occurred.";

    private final TaskExecutor generationTaskExecutor;
    private final ArtifactStore artifactStore;

    public BatchExecutor(
            @Qualifier("generationTaskExecutor") TaskExecutor generationTaskExecutor,
            ArtifactStore artifactStore) {
        this.generationTaskExecutor = generationTaskExecutor;
        this.artifactStore = artifactStore;
    }

    public BatchReport execute(
            SceneTable sceneTable,
            MediaKind mediaKind,
            String backendId,
            List<StoryboardScene> batch,
            SceneGenerationCall call) {
        if (batch.isEmpty()) {
            return new BatchReport(mediaKind, backendId, List.of(), 0, 0, 0);
        }

        List<DispatchTicket> tickets = sceneTable.markGenerating(batch);
        List<Integer> sceneNumbers = tickets.stream().map(DispatchTicket::sceneNumber).toList();
        List<CompletableFuture<SceneOutcome>> futures = new ArrayList<>(tickets.size());
        List<SceneOutcome> outcomes;

        try {
            for (DispatchTicket ticket : tickets) {
                futures.add(CompletableFuture.supplyAsync(() -> invoke(call, ticket), generationTaskExecutor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
            outcomes = futures.stream().map(CompletableFuture::join).toList();
        } catch (RuntimeException e) {
            String detail = "Batch dispatch failed: " + describe(e);
            int failed = sceneTable.markFailed(tickets, detail);
            futures.forEach(future -> future.thenAccept(this::releaseOrphan));
            logger.error("Dispatch of {} batch {} failed before results were known", mediaKind, sceneNumbers, e);
            throw new CatastrophicDispatchException(detail, failed, e);
        }

        MergeResult merge = sceneTable.merge(outcomes);
        for (SceneOutcome stale : merge.discarded()) {
            logger.warn(
                    "Discarding stale result for scene {} (epoch {}); the scene was reset while generating",
                    stale.sceneNumber(),
                    stale.epoch());
            releaseOrphan(stale);
        }

        return new BatchReport(
                mediaKind,
                backendId,
                sceneNumbers,
                merge.completed(),
                merge.failed(),
                merge.discarded().size());
    }

    private SceneOutcome invoke(SceneGenerationCall call, DispatchTicket ticket) {
        try {
            String handle = call.generate(ticket.scene());
            if (handle == null || handle.isBlank()) {
                return SceneOutcome.failed(ticket, "Generation finished but returned no artifact.");
            }
            return SceneOutcome.succeeded(ticket, handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SceneOutcome.failed(ticket, "Generation was interrupted.");
        } catch (Exception e) {
            logger.warn("Scene {} failed: {}", ticket.sceneNumber(), describe(e));
            return SceneOutcome.failed(ticket, describe(e));
        }
    }

    private void releaseOrphan(SceneOutcome outcome) {
        if (outcome != null && outcome.isSuccess()) {
            artifactStore.release(outcome.artifactHandle());
        }
    }

    private String describe(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? UNKNOWN_ERROR : message;
    }
}
