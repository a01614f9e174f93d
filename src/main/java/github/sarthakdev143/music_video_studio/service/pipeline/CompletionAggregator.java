package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.PipelineStatus;
import github.sarthakdev143.music_video_studio.model.Readiness;
import github.sarthakdev143.music_video_studio.model.SceneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides when a production may be assembled. Every switch into {@link Readiness#READY} grants a
 * single assembly authorization.
 */
@Component
public class CompletionAggregator {

    private static final Logger logger = LoggerFactory.getLogger(CompletionAggregator.class);

    public Readiness evaluate(ProductionSession session) {
        SceneTable sceneTable = session.sceneTable();
        synchronized (session) {
            Readiness readiness;
            if (sceneTable.hasUnsettled()) {
                readiness = Readiness.IN_PROGRESS;
            } else if (sceneTable.allComplete()) {
                readiness = Readiness.READY;
            } else {
                readiness = Readiness.BLOCKED_BY_FAILURES;
            }

            if (readiness == session.readiness()) {
                return readiness;
            }

            session.updateReadiness(readiness);
            switch (readiness) {
                case READY -> {
                    session.grantAssemblyAuthorization();
                    session.updateStatus(PipelineStatus.ready(session.stage()));
                    logger.info("Production {} is ready to assemble", session.id());
                }
                case BLOCKED_BY_FAILURES -> {
                    session.revokeAssemblyAuthorization();
                    session.updateStatus(PipelineStatus.blocked(session.stage()));
                    logger.info(
                            "Production {} settled with {} failed scene(s); assembly is blocked",
                            session.id(),
                            sceneTable.count(SceneStatus.FAILED));
                }
                case IN_PROGRESS -> session.revokeAssemblyAuthorization();
            }
            return readiness;
        }
    }

    /**
     * Hands out the authorization granted by the last ready transition, at most once.
     */
    public boolean consumeAuthorization(ProductionSession session) {
        return session.consumeAssemblyAuthorization();
    }
}
