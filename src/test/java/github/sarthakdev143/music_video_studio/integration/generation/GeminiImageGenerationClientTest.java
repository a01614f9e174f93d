package github.sarthakdev143.music_video_studio.integration.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video_studio.config.GeminiProperties;
import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiImageGenerationClientTest {

    private static final String PREDICT_URL = "https://gen.test/v1beta/models/imagen-test:predict";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private ArtifactStore artifactStore;
    private GeminiImageGenerationClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        artifactStore = mock(ArtifactStore.class);
        client = new GeminiImageGenerationClient(
                restTemplate,
                new ObjectMapper(),
                new GeminiProperties("secret", "https://gen.test/v1beta", "imagen-test", "720p", Duration.ZERO, 1),
                artifactStore);
    }

    @Test
    void decodesAndStoresGeneratedImage() throws Exception {
        byte[] image = {1, 2, 3, 4};
        server.expect(requestTo(PREDICT_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.instances[0].prompt").value("neon rain on glass"))
                .andExpect(jsonPath("$.parameters.aspectRatio").value("1:1"))
                .andRespond(withSuccess(
                        "{\"predictions\":[{\"bytesBase64Encoded\":\"" + Base64.getEncoder().encodeToString(image) + "\"}]}",
                        MediaType.APPLICATION_JSON));
        when(artifactStore.store(eq(image), eq(".jpg"))).thenReturn("image-handle");

        assertThat(client.generateImage("neon rain on glass", AspectRatio.SQUARE_1_1)).isEqualTo("image-handle");
        server.verify();
    }

    @Test
    void emptyPredictionsAreRejected() {
        server.expect(requestTo(PREDICT_URL))
                .andRespond(withSuccess("{\"predictions\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generateImage("p", AspectRatio.LANDSCAPE_16_9))
                .isInstanceOfSatisfying(GenerationException.class, e ->
                        assertThat(e.failureType()).isEqualTo(GenerationFailureType.REJECTED));
        verifyNoInteractions(artifactStore);
    }

    @Test
    void quotaErrorIsClassified() {
        server.expect(requestTo(PREDICT_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.generateImage("p", AspectRatio.LANDSCAPE_16_9))
                .isInstanceOfSatisfying(GenerationException.class, e ->
                        assertThat(e.failureType()).isEqualTo(GenerationFailureType.QUOTA_EXCEEDED));
    }

    @Test
    void serverErrorIsTransport() {
        server.expect(requestTo(PREDICT_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client.generateImage("p", AspectRatio.LANDSCAPE_16_9))
                .isInstanceOfSatisfying(GenerationException.class, e ->
                        assertThat(e.failureType()).isEqualTo(GenerationFailureType.TRANSPORT));
    }
}
