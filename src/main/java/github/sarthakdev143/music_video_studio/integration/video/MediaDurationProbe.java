package github.sarthakdev143.music_video_studio.integration.video;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a media file's length from the {@code Duration:} line ffmpeg prints for its input.
 */
@Component
public class MediaDurationProbe {

    private static final Pattern DURATION_PATTERN = Pattern.compile("Duration: (\\d+):(\\d+):(\\d+(?:\\.\\d+)?)");
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(15);

    private final FfmpegProcessRunner processRunner;

    public MediaDurationProbe(FfmpegProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    public double probeSeconds(Path mediaPath) throws IOException, InterruptedException {
        List<String> command = List.of(processRunner.resolveFfmpegBinary(), "-i", mediaPath.toString());
        String output = processRunner.capture(command, "probe " + mediaPath.getFileName(), PROBE_TIMEOUT);
        return parseSeconds(output, mediaPath);
    }

    static double parseSeconds(String ffmpegOutput, Path mediaPath) throws IOException {
        Matcher matcher = DURATION_PATTERN.matcher(ffmpegOutput == null ? "" : ffmpegOutput);
        if (!matcher.find()) {
            throw new IOException("Unable to determine duration of " + mediaPath.getFileName() + ".");
        }

        long hours = Long.parseLong(matcher.group(1));
        long minutes = Long.parseLong(matcher.group(2));
        double seconds = Double.parseDouble(matcher.group(3));
        Duration base = Duration.ofHours(hours).plusMinutes(minutes);
        return base.toSeconds() + seconds;
    }
}
