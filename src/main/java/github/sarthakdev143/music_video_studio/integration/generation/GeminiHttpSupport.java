package github.sarthakdev143.music_video_studio.integration.generation;

import github.sarthakdev143.music_video_studio.config.GeminiProperties;
import github.sarthakdev143.music_video_studio.service.pipeline.PipelineConfigurationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

final class GeminiHttpSupport {

    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private GeminiHttpSupport() {
    }

    static void requireApiKey(GeminiProperties properties) {
        if (!properties.hasApiKey()) {
            throw new PipelineConfigurationException(
                    "Gemini API key is missing. Set GEMINI_API_KEY or music-video-studio.gemini.api-key.");
        }
    }

    static HttpHeaders jsonHeaders(GeminiProperties properties) {
        HttpHeaders headers = authHeaders(properties);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    static HttpHeaders authHeaders(GeminiProperties properties) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, properties.apiKey());
        return headers;
    }

    static GenerationException translate(String operation, RestClientException e) {
        if (e instanceof HttpClientErrorException clientError) {
            if (clientError.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new GenerationException(
                        GenerationFailureType.QUOTA_EXCEEDED,
                        operation + " failed: quota exceeded (429). Try again after the rate limit resets.",
                        e);
            }
            return new GenerationException(
                    GenerationFailureType.REJECTED,
                    operation + " was rejected (" + clientError.getStatusCode().value() + "): "
                            + abbreviate(clientError.getResponseBodyAsString()),
                    e);
        }
        if (e instanceof HttpServerErrorException serverError) {
            return new GenerationException(
                    GenerationFailureType.TRANSPORT,
                    operation + " failed with server error " + serverError.getStatusCode().value() + ".",
                    e);
        }
        if (e instanceof ResourceAccessException) {
            return new GenerationException(
                    GenerationFailureType.TRANSPORT,
                    operation + " could not reach the generation service: " + e.getMessage(),
                    e);
        }
        return new GenerationException(GenerationFailureType.TRANSPORT, operation + " failed: " + e.getMessage(), e);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
