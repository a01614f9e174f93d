package github.sarthakdev143.music_video_studio.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video_studio.dto.AssemblyResponse;
import github.sarthakdev143.music_video_studio.dto.ProductionSubmissionResponse;
import github.sarthakdev143.music_video_studio.dto.StoryboardSceneRequest;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import github.sarthakdev143.music_video_studio.service.ProductionNotFoundException;
import github.sarthakdev143.music_video_studio.service.ProductionService;
import github.sarthakdev143.music_video_studio.service.impl.StoryboardValidator;
import github.sarthakdev143.music_video_studio.service.pipeline.AssemblyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/productions")
public class ProductionController {

    private static final Logger logger = LoggerFactory.getLogger(ProductionController.class);
    private static final int MAX_TITLE_LENGTH = 200;
    private static final int MAX_ARTIST_LENGTH = 200;
    private static final TypeReference<List<StoryboardSceneRequest>> STORYBOARD_TYPE = new TypeReference<>() {
    };

    private final ProductionService productionService;
    private final StoryboardValidator storyboardValidator;
    private final ObjectMapper objectMapper;

    public ProductionController(
            ProductionService productionService,
            StoryboardValidator storyboardValidator,
            ObjectMapper objectMapper) {
        this.productionService = productionService;
        this.storyboardValidator = storyboardValidator;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<?> startProduction(
            @RequestParam("audio") MultipartFile audio,
            @RequestParam("storyboard") String storyboardJson,
            @RequestParam("title") String title,
            @RequestParam(value = "artist", required = false) String artist,
            @RequestParam(value = "aspectRatio", required = false) String aspectRatioInput) {
        try {
            validateBaseRequest(audio, title, artist);
            AspectRatio aspectRatio = AspectRatio.fromInput(aspectRatioInput);
            List<StoryboardScene> storyboard = storyboardValidator.normalizeAndValidate(parseStoryboard(storyboardJson));

            String productionId = productionService.startProduction(
                    audio,
                    title.trim(),
                    artist == null ? "" : artist.trim(),
                    aspectRatio,
                    storyboard);
            return ResponseEntity.accepted()
                    .body(new ProductionSubmissionResponse(
                            productionId,
                            storyboard.size(),
                            "Production accepted. Poll /api/productions/{productionId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Starting a production failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start the production. Please try again.");
        }
    }

    @GetMapping("/{productionId}")
    public ResponseEntity<?> getProduction(@PathVariable String productionId) {
        return productionService.getProduction(productionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(productionId));
    }

    @PostMapping("/{productionId}/scenes/{sceneNumber}/regenerate")
    public ResponseEntity<?> regenerateScene(@PathVariable String productionId, @PathVariable int sceneNumber) {
        try {
            return ResponseEntity.accepted().body(productionService.regenerateScene(productionId, sceneNumber));
        } catch (ProductionNotFoundException e) {
            return notFound(productionId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    @PostMapping("/{productionId}/assemble")
    public ResponseEntity<?> assemble(@PathVariable String productionId) {
        try {
            String combined = productionService.assemble(productionId);
            return ResponseEntity.ok(new AssemblyResponse(productionId, combined, "Music video assembled."));
        } catch (ProductionNotFoundException e) {
            return notFound(productionId);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (AssemblyException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to combine media. Please try again.");
        }
    }

    @PostMapping("/{productionId}/resume")
    public ResponseEntity<?> resume(@PathVariable String productionId) {
        try {
            return ResponseEntity.accepted().body(productionService.resume(productionId));
        } catch (ProductionNotFoundException e) {
            return notFound(productionId);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    @DeleteMapping("/{productionId}")
    public ResponseEntity<?> endProduction(@PathVariable String productionId) {
        if (!productionService.endProduction(productionId)) {
            return notFound(productionId);
        }
        return ResponseEntity.noContent().build();
    }

    private List<StoryboardSceneRequest> parseStoryboard(String storyboardJson) {
        if (storyboardJson == null || storyboardJson.isBlank()) {
            throw new IllegalArgumentException("storyboard is required.");
        }
        try {
            return objectMapper.readValue(storyboardJson, STORYBOARD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("storyboard must be valid JSON.", e);
        }
    }

    private void validateBaseRequest(MultipartFile audio, String title, String artist) {
        if (audio == null || audio.isEmpty()) {
            throw new IllegalArgumentException("Audio file is required.");
        }
        String contentType = audio.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("audio/")) {
            throw new IllegalArgumentException("audio must have an audio/* content type.");
        }

        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title is required.");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title must be at most " + MAX_TITLE_LENGTH + " characters.");
        }
        if (artist != null && artist.length() > MAX_ARTIST_LENGTH) {
            throw new IllegalArgumentException("Artist must be at most " + MAX_ARTIST_LENGTH + " characters.");
        }
    }

    private ResponseEntity<?> notFound(String productionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Production not found for id: " + productionId);
    }
}
