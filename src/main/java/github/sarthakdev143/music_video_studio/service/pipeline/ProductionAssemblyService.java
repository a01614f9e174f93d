package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.AssemblyClip;
import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import github.sarthakdev143.music_video_studio.model.Readiness;
import github.sarthakdev143.music_video_studio.service.MediaAssembler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hands a ready production to the {@link MediaAssembler}, consuming the authorization granted by
 * the last ready transition.
 */
@Service
public class ProductionAssemblyService {

    private static final Logger logger = LoggerFactory.getLogger(ProductionAssemblyService.class);
    static final String NOT_READY_MESSAGE = "All media clips must be successfully generated before combining.";

    private final MediaAssembler mediaAssembler;
    private final ArtifactStore artifactStore;
    private final CompletionAggregator completionAggregator;
    private final Counter assemblyFailureCounter;

    public ProductionAssemblyService(
            MediaAssembler mediaAssembler,
            ArtifactStore artifactStore,
            CompletionAggregator completionAggregator,
            MeterRegistry meterRegistry) {
        this.mediaAssembler = mediaAssembler;
        this.artifactStore = artifactStore;
        this.completionAggregator = completionAggregator;
        this.assemblyFailureCounter = meterRegistry.counter("music_video_studio.assembly.failures");
    }

    /**
     * Combines every clip with the audio track. A production that was already assembled returns the
     * existing combined artifact.
     *
     * @throws IllegalStateException if a scene is not complete or an assembly is already running
     * @throws AssemblyException     if the assembler fails; the production may be assembled again
     */
    public String assemble(ProductionSession session) {
        AssemblyJob job;
        synchronized (session) {
            if (session.isClosed()) {
                throw new IllegalStateException("Production " + session.id() + " has ended.");
            }
            if (session.readiness() != Readiness.READY) {
                throw new IllegalStateException(NOT_READY_MESSAGE);
            }
            if (!completionAggregator.consumeAuthorization(session)) {
                String existing = session.combinedArtifactHandle();
                if (existing != null) {
                    return existing;
                }
                throw new IllegalStateException("Production " + session.id() + " is already being assembled.");
            }
            job = prepare(session);
        }
        return run(session, job);
    }

    /**
     * Assembles only if an unused authorization is waiting. Failures are logged and counted, not thrown.
     */
    public Optional<String> assembleIfAuthorized(ProductionSession session) {
        AssemblyJob job;
        synchronized (session) {
            if (session.isClosed()
                    || session.readiness() != Readiness.READY
                    || !completionAggregator.consumeAuthorization(session)) {
                return Optional.empty();
            }
            job = prepare(session);
        }
        try {
            return Optional.of(run(session, job));
        } catch (AssemblyException | IllegalStateException e) {
            logger.warn("Automatic assembly of production {} did not finish: {}", session.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private AssemblyJob prepare(ProductionSession session) {
        List<AssemblyClip> clips = session.sceneTable()
                .snapshot()
                .stream()
                .sorted(Comparator.comparingInt(GeneratedMediaItem::sceneNumber))
                .map(item -> new AssemblyClip(item.sceneNumber(), item.mediaKind(), item.artifactHandle()))
                .toList();
        return new AssemblyJob(
                session.revision(),
                clips,
                session.request().audioTrackHandle(),
                session.request().aspectRatio());
    }

    private String run(ProductionSession session, AssemblyJob job) {
        logger.info("Assembling production {} from {} clip(s)", session.id(), job.clips().size());
        String combined;
        try {
            combined = mediaAssembler.assemble(job.clips(), job.audioTrackHandle(), job.aspectRatio());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(session, job, "Assembly was interrupted.", e);
        } catch (IOException | RuntimeException e) {
            throw failed(session, job, "Failed to combine media: " + e.getMessage(), e);
        }

        if (!session.storeCombinedArtifact(job.revision(), combined)) {
            artifactStore.release(combined);
            throw new IllegalStateException(
                    "Production " + session.id() + " changed while it was being assembled; the result was discarded.");
        }
        logger.info("Production {} assembled into {}", session.id(), combined);
        return combined;
    }

    private AssemblyException failed(ProductionSession session, AssemblyJob job, String message, Exception cause) {
        assemblyFailureCounter.increment();
        session.restoreAssemblyAuthorization(job.revision());
        logger.error("Assembly of production {} failed", session.id(), cause);
        return new AssemblyException(message, cause);
    }

    private record AssemblyJob(
            long revision,
            List<AssemblyClip> clips,
            String audioTrackHandle,
            AspectRatio aspectRatio) {
    }
}
