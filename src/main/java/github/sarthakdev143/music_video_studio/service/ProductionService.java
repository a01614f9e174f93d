package github.sarthakdev143.music_video_studio.service;

import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.ProductionSnapshot;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ProductionService {

    String startProduction(
            MultipartFile audio,
            String title,
            String artist,
            AspectRatio aspectRatio,
            List<StoryboardScene> storyboard) throws IOException;

    Optional<ProductionSnapshot> getProduction(String productionId);

    ProductionSnapshot regenerateScene(String productionId, int sceneNumber);

    String assemble(String productionId);

    ProductionSnapshot resume(String productionId);

    boolean endProduction(String productionId);
}
