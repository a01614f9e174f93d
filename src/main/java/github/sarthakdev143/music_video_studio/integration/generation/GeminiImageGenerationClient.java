package github.sarthakdev143.music_video_studio.integration.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video_studio.config.GeminiProperties;
import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Map;

@Component
public class GeminiImageGenerationClient implements ImageGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(GeminiImageGenerationClient.class);
    private static final String PREDICT_PATH = "/models/%s:predict";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GeminiProperties properties;
    private final ArtifactStore artifactStore;

    public GeminiImageGenerationClient(
            @Qualifier("geminiRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            GeminiProperties properties,
            ArtifactStore artifactStore) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.artifactStore = artifactStore;
    }

    @Override
    public void checkConfiguration() {
        GeminiHttpSupport.requireApiKey(properties);
    }

    @Override
    public String generateImage(String prompt, AspectRatio aspectRatio) throws IOException {
        checkConfiguration();
        Map<String, Object> requestBody = Map.of(
                "instances", List.of(Map.of("prompt", prompt)),
                "parameters", Map.of(
                        "sampleCount", 1,
                        "aspectRatio", aspectRatio.apiValue(),
                        "outputMimeType", "image/jpeg"));

        String responseBody;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    properties.baseUrl() + String.format(PREDICT_PATH, properties.imageModel()),
                    HttpMethod.POST,
                    new HttpEntity<>(objectMapper.writeValueAsString(requestBody), GeminiHttpSupport.jsonHeaders(properties)),
                    String.class);
            responseBody = response.getBody();
        } catch (RestClientException e) {
            throw GeminiHttpSupport.translate("Image generation", e);
        }

        JsonNode predictions = objectMapper.readTree(responseBody == null ? "{}" : responseBody).path("predictions");
        String encoded = predictions.isArray() && predictions.size() > 0
                ? predictions.get(0).path("bytesBase64Encoded").asText(null)
                : null;
        if (encoded == null || encoded.isBlank()) {
            throw new GenerationException(
                    GenerationFailureType.REJECTED,
                    "Failed to generate image from AI: the response contained no image.");
        }

        byte[] image;
        try {
            image = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new GenerationException(GenerationFailureType.REJECTED, "Generated image was not valid base64.", e);
        }
        String handle = artifactStore.store(image, ".jpg");
        logger.debug("Image generated with {} and stored as {}", properties.imageModel(), handle);
        return handle;
    }
}
