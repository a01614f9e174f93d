package github.sarthakdev143.music_video_studio.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "music-video-studio.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final PipelineProperties pipelineProperties;
    private final GeminiProperties geminiProperties;

    public StartupPreflightChecks(PipelineProperties pipelineProperties, GeminiProperties geminiProperties) {
        this.pipelineProperties = pipelineProperties;
        this.geminiProperties = geminiProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkBackendConfiguration();
        checkApiKeyConfiguration();
    }

    private void checkFfmpegConfiguration() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path ffmpegPath = Path.of(configuredPath);
            if (!Files.isRegularFile(ffmpegPath)) {
                throw new IllegalStateException(
                        "FFmpeg binary not found at " + ffmpegPath.toAbsolutePath()
                                + ". Set " + FFMPEG_PATH_ENV + " to a valid ffmpeg executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(DEFAULT_FFMPEG_BINARY, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    private void checkBackendConfiguration() {
        if (pipelineProperties.videoBackends().isEmpty()) {
            throw new IllegalStateException(
                    "No video generation backends configured. Set music-video-studio.pipeline.video-backends.");
        }
    }

    private void checkApiKeyConfiguration() {
        if (!geminiProperties.hasApiKey()) {
            throw new IllegalStateException(
                    "Gemini API key is missing. Set GEMINI_API_KEY or music-video-studio.gemini.api-key.");
        }
    }
}
