package github.sarthakdev143.music_video_studio.service.impl;

import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.ProductionRequest;
import github.sarthakdev143.music_video_studio.model.ProductionSnapshot;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import github.sarthakdev143.music_video_studio.service.ProductionNotFoundException;
import github.sarthakdev143.music_video_studio.service.ProductionService;
import github.sarthakdev143.music_video_studio.service.pipeline.PipelineRunner;
import github.sarthakdev143.music_video_studio.service.pipeline.ProductionAssemblyService;
import github.sarthakdev143.music_video_studio.service.pipeline.ProductionSession;
import github.sarthakdev143.music_video_studio.service.pipeline.RegenerationController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Service
public class DefaultProductionService implements ProductionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProductionService.class);
    private static final Pattern AUDIO_SUFFIX_PATTERN = Pattern.compile("^\\.[a-z0-9]{1,5}$");
    private static final String DEFAULT_AUDIO_SUFFIX = ".mp3";

    private final ArtifactStore artifactStore;
    private final PipelineRunner pipelineRunner;
    private final RegenerationController regenerationController;
    private final ProductionAssemblyService assemblyService;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;
    private final Map<String, ProductionSession> sessions = new ConcurrentHashMap<>();
    private final Counter productionsStartedCounter;
    private final Counter regenerationCounter;

    public DefaultProductionService(
            ArtifactStore artifactStore,
            PipelineRunner pipelineRunner,
            RegenerationController regenerationController,
            ProductionAssemblyService assemblyService,
            PipelineProperties pipelineProperties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.artifactStore = artifactStore;
        this.pipelineRunner = pipelineRunner;
        this.regenerationController = regenerationController;
        this.assemblyService = assemblyService;
        this.pipelineProperties = pipelineProperties;
        this.clock = clock;
        this.productionsStartedCounter = meterRegistry.counter("music_video_studio.productions.started");
        this.regenerationCounter = meterRegistry.counter("music_video_studio.scenes.regenerated");
    }

    @Override
    public String startProduction(
            MultipartFile audio,
            String title,
            String artist,
            AspectRatio aspectRatio,
            List<StoryboardScene> storyboard) throws IOException {
        String productionId = UUID.randomUUID().toString();
        String audioHandle;
        try (InputStream audioContent = audio.getInputStream()) {
            audioHandle = artifactStore.store(audioContent, resolveAudioSuffix(audio.getOriginalFilename()));
        }

        ProductionSession session = new ProductionSession(
                productionId,
                new ProductionRequest(title, artist, aspectRatio, audioHandle),
                storyboard,
                pipelineProperties.cooldown(),
                clock);
        sessions.put(productionId, session);
        productionsStartedCounter.increment();

        long videoScenes = storyboard.stream().filter(scene -> scene.mediaKind() == MediaKind.VIDEO).count();
        logger.info(
                "Accepted production {} title={} scenes={} videos={} images={} aspectRatio={}",
                productionId,
                title,
                storyboard.size(),
                videoScenes,
                storyboard.size() - videoScenes,
                aspectRatio.apiValue());

        pipelineRunner.enqueueAdvance(session);
        return productionId;
    }

    @Override
    public Optional<ProductionSnapshot> getProduction(String productionId) {
        return Optional.ofNullable(sessions.get(productionId)).map(ProductionSession::snapshot);
    }

    @Override
    public ProductionSnapshot regenerateScene(String productionId, int sceneNumber) {
        ProductionSession session = requireSession(productionId);
        regenerationController.regenerate(session, sceneNumber);
        regenerationCounter.increment();
        pipelineRunner.enqueueAdvance(session);
        return session.snapshot();
    }

    @Override
    public String assemble(String productionId) {
        return assemblyService.assemble(requireSession(productionId));
    }

    @Override
    public ProductionSnapshot resume(String productionId) {
        ProductionSession session = requireSession(productionId);
        pipelineRunner.resume(session);
        logger.info("Resumed production {}", productionId);
        return session.snapshot();
    }

    @Override
    public boolean endProduction(String productionId) {
        ProductionSession session = sessions.remove(productionId);
        if (session == null) {
            return false;
        }
        pipelineRunner.stop(session);
        logger.info("Ended production {}", productionId);
        return true;
    }

    private ProductionSession requireSession(String productionId) {
        ProductionSession session = sessions.get(productionId);
        if (session == null) {
            throw new ProductionNotFoundException(productionId);
        }
        return session;
    }

    private String resolveAudioSuffix(String originalFilename) {
        if (originalFilename != null) {
            int extensionIndex = originalFilename.lastIndexOf('.');
            if (extensionIndex >= 0) {
                String suffix = originalFilename.substring(extensionIndex).toLowerCase(Locale.ROOT);
                if (AUDIO_SUFFIX_PATTERN.matcher(suffix).matches()) {
                    return suffix;
                }
            }
        }
        return DEFAULT_AUDIO_SUFFIX;
    }
}
