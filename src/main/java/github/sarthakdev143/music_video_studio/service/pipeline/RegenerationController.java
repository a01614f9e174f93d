package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Puts one finished scene back into the pipeline without touching any other scene.
 */
@Component
public class RegenerationController {

    private static final Logger logger = LoggerFactory.getLogger(RegenerationController.class);

    private final ArtifactStore artifactStore;

    public RegenerationController(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    /**
     * Resets {@code sceneNumber} to PENDING and rewinds the session to its first stage.
     *
     * @throws IllegalArgumentException if the scene does not exist
     * @throws IllegalStateException    if the scene is still pending or generating, or the session is closed
     */
    public void regenerate(ProductionSession session, int sceneNumber) {
        GeneratedMediaItem previous;
        String staleCombined;

        synchronized (session) {
            if (session.isClosed()) {
                throw new IllegalStateException("Production " + session.id() + " has ended.");
            }
            if (session.sceneTable().find(sceneNumber).isEmpty()) {
                throw new IllegalArgumentException("Scene " + sceneNumber + " does not exist.");
            }
            previous = session.sceneTable().reset(sceneNumber);
            staleCombined = session.rewindForRegeneration();
        }

        if (previous.artifactHandle() != null) {
            artifactStore.release(previous.artifactHandle());
        }
        if (staleCombined != null) {
            artifactStore.release(staleCombined);
            logger.info("Production {} combined video invalidated by regeneration", session.id());
        }
        logger.info(
                "Production {} scene {} reset for regeneration (was {})",
                session.id(),
                sceneNumber,
                previous.status());
    }
}
