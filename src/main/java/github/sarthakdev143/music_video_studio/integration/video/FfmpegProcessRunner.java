package github.sarthakdev143.music_video_studio.integration.video;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegProcessRunner.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";

    public String resolveFfmpegBinary() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    /**
     * Runs the command and fails unless it exits with 0.
     */
    public String run(List<String> command, String stage, Duration timeout) throws IOException, InterruptedException {
        ProcessResult result = execute(command, stage, timeout);
        if (result.exitCode() != 0) {
            throw new IOException(
                    "FFmpeg failed during stage "
                            + stage
                            + " with exit code "
                            + result.exitCode()
                            + ". Output: "
                            + result.output());
        }
        return result.output();
    }

    /**
     * Runs the command and returns its combined output whatever the exit code. Used for probing,
     * where ffmpeg exits non-zero because no output file is given.
     */
    public String capture(List<String> command, String stage, Duration timeout) throws IOException, InterruptedException {
        return execute(command, stage, timeout).output();
    }

    private ProcessResult execute(List<String> command, String stage, Duration timeout)
            throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("FFmpeg timed out during stage: " + stage);
        }
        return new ProcessResult(process.exitValue(), output.toString());
    }

    private record ProcessResult(int exitCode, String output) {
    }
}
