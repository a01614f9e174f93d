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
import java.util.List;
import java.util.Map;

@Component
public class GeminiVideoGenerationClient implements VideoGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(GeminiVideoGenerationClient.class);
    private static final String START_PATH = "/models/%s:predictLongRunning";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GeminiProperties properties;
    private final ArtifactStore artifactStore;

    public GeminiVideoGenerationClient(
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
    public String generateVideo(String prompt, AspectRatio aspectRatio, String backendId)
            throws IOException, InterruptedException {
        checkConfiguration();
        String operationName = startOperation(prompt, aspectRatio, backendId);
        logger.info("Video operation {} started on backend {}", operationName, backendId);

        JsonNode finished = awaitOperation(operationName);
        String videoUri = extractVideoUri(finished);
        byte[] video = download(videoUri);
        String handle = artifactStore.store(video, ".mp4");
        logger.info("Video operation {} finished, stored as {} ({} bytes)", operationName, handle, video.length);
        return handle;
    }

    private String startOperation(String prompt, AspectRatio aspectRatio, String backendId) throws IOException {
        Map<String, Object> requestBody = Map.of(
                "instances", List.of(Map.of("prompt", prompt)),
                "parameters", Map.of(
                        "aspectRatio", aspectRatio.apiValue(),
                        "resolution", properties.videoResolution(),
                        "sampleCount", 1));

        String responseBody;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    properties.baseUrl() + String.format(START_PATH, backendId),
                    HttpMethod.POST,
                    new HttpEntity<>(objectMapper.writeValueAsString(requestBody), GeminiHttpSupport.jsonHeaders(properties)),
                    String.class);
            responseBody = response.getBody();
        } catch (RestClientException e) {
            throw GeminiHttpSupport.translate("Video generation with " + backendId, e);
        }

        JsonNode root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        String operationName = root.path("name").asText(null);
        if (operationName == null || operationName.isBlank()) {
            throw new GenerationException(
                    GenerationFailureType.REJECTED,
                    "Video generation with " + backendId + " did not return an operation name.");
        }
        return operationName;
    }

    private JsonNode awaitOperation(String operationName) throws IOException, InterruptedException {
        for (int attempt = 1; attempt <= properties.maxPolls(); attempt++) {
            Thread.sleep(properties.pollInterval().toMillis());

            String responseBody;
            try {
                ResponseEntity<String> response = restTemplate.exchange(
                        properties.baseUrl() + "/" + operationName,
                        HttpMethod.GET,
                        new HttpEntity<>(GeminiHttpSupport.authHeaders(properties)),
                        String.class);
                responseBody = response.getBody();
            } catch (RestClientException e) {
                throw GeminiHttpSupport.translate("Polling video operation " + operationName, e);
            }

            JsonNode status = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
            if (status.path("done").asBoolean(false)) {
                return status;
            }
            logger.debug("Video operation {} still running ({}/{})", operationName, attempt, properties.maxPolls());
        }

        throw new GenerationException(
                GenerationFailureType.TIMEOUT,
                "Video operation " + operationName + " did not finish after " + properties.maxPolls() + " polls.");
    }

    private String extractVideoUri(JsonNode finished) throws GenerationException {
        if (finished.has("error")) {
            String message = finished.path("error").path("message").asText("Unknown error");
            if (finished.path("error").path("code").asInt() == 429) {
                throw new GenerationException(GenerationFailureType.QUOTA_EXCEEDED, "Video generation failed: " + message);
            }
            throw new GenerationException(GenerationFailureType.REJECTED, "Video generation failed: " + message);
        }

        JsonNode samples = finished.path("response").path("generateVideoResponse").path("generatedSamples");
        if (samples.isArray() && samples.size() > 0) {
            String uri = samples.get(0).path("video").path("uri").asText(null);
            if (uri != null && !uri.isBlank()) {
                return uri;
            }
        }

        JsonNode videos = finished.path("response").path("videos");
        if (videos.isArray() && videos.size() > 0) {
            String uri = videos.get(0).path("uri").asText(videos.get(0).path("gcsUri").asText(null));
            if (uri != null && !uri.isBlank()) {
                return uri;
            }
        }

        JsonNode filtered = finished.path("response").path("generateVideoResponse").path("raiMediaFilteredReasons");
        if (filtered.isArray() && filtered.size() > 0) {
            throw new GenerationException(
                    GenerationFailureType.REJECTED,
                    "Video was blocked by the content filter: " + filtered.get(0).asText());
        }

        throw new GenerationException(
                GenerationFailureType.REJECTED,
                "Video generation completed but no download link was found.");
    }

    private byte[] download(String videoUri) throws GenerationException {
        try {
            ResponseEntity<byte[]> response = restTemplate.exchange(
                    videoUri,
                    HttpMethod.GET,
                    new HttpEntity<>(GeminiHttpSupport.authHeaders(properties)),
                    byte[].class);
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                throw new GenerationException(GenerationFailureType.TRANSPORT, "Downloaded video was empty.");
            }
            return body;
        } catch (RestClientException e) {
            throw GeminiHttpSupport.translate("Downloading generated video", e);
        }
    }
}
