package github.sarthakdev143.music_video_studio.integration.video;

import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.AssemblyClip;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.service.MediaAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders every clip to a segment of the same size and frame rate, joins the segments in scene
 * order and lays the song underneath. Videos keep their own length; the audio left over after the
 * videos is split evenly between the images.
 */
@Component
public class FfmpegMediaAssembler implements MediaAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaAssembler.class);
    private static final double MIN_IMAGE_SECONDS = 0.5;
    private static final Duration STAGE_TIMEOUT = Duration.ofMinutes(10);

    private final ArtifactStore artifactStore;
    private final MediaDurationProbe durationProbe;
    private final FfmpegProcessRunner processRunner;

    public FfmpegMediaAssembler(
            ArtifactStore artifactStore,
            MediaDurationProbe durationProbe,
            FfmpegProcessRunner processRunner) {
        this.artifactStore = artifactStore;
        this.durationProbe = durationProbe;
        this.processRunner = processRunner;
    }

    @Override
    public String assemble(List<AssemblyClip> clips, String audioTrackHandle, AspectRatio aspectRatio)
            throws IOException, InterruptedException {
        if (clips == null || clips.isEmpty()) {
            throw new IllegalArgumentException("At least one clip is required to assemble a video.");
        }

        List<AssemblyClip> ordered = clips.stream()
                .sorted(Comparator.comparingInt(AssemblyClip::sceneNumber))
                .toList();
        Path audioPath = artifactStore.resolve(audioTrackHandle);

        double totalVideoSeconds = 0.0;
        int imageCount = 0;
        for (AssemblyClip clip : ordered) {
            if (clip.mediaKind() == MediaKind.VIDEO) {
                totalVideoSeconds += durationProbe.probeSeconds(artifactStore.resolve(clip.artifactHandle()));
            } else {
                imageCount++;
            }
        }
        double imageSeconds = imageSeconds(durationProbe.probeSeconds(audioPath), totalVideoSeconds, imageCount);

        Path workDir = Files.createTempDirectory("music-video-studio-assembly-");
        List<Path> segments = new ArrayList<>();
        Path visualTrack = workDir.resolve("visual.mp4");
        String outputHandle = artifactStore.allocate(".mp4");
        boolean completed = false;

        try {
            for (AssemblyClip clip : ordered) {
                Path source = artifactStore.resolve(clip.artifactHandle());
                Path segment = workDir.resolve("scene-" + clip.sceneNumber() + ".mp4");
                List<String> command = clip.mediaKind() == MediaKind.IMAGE
                        ? buildImageSegmentCommand(source, imageSeconds, aspectRatio, segment)
                        : buildVideoSegmentCommand(source, aspectRatio, segment);
                processRunner.run(command, "render scene " + clip.sceneNumber(), STAGE_TIMEOUT);
                segments.add(segment);
            }

            if (segments.size() == 1) {
                Files.copy(segments.get(0), visualTrack);
            } else {
                processRunner.run(buildVisualConcatCommand(segments, visualTrack), "combine scene clips", STAGE_TIMEOUT);
            }

            Path output = artifactStore.locate(outputHandle);
            processRunner.run(
                    buildAudioMuxCommand(audioPath, visualTrack, output),
                    "mux audio and visual tracks",
                    STAGE_TIMEOUT);
            completed = true;
            logger.info(
                    "Assembled {} clip(s) into {} ({} image(s) at {}s each)",
                    ordered.size(),
                    outputHandle,
                    imageCount,
                    formatSeconds(imageSeconds));
            return outputHandle;
        } finally {
            if (!completed) {
                artifactStore.release(outputHandle);
            }
            deleteRecursively(workDir);
        }
    }

    static double imageSeconds(double audioSeconds, double totalVideoSeconds, int imageCount) {
        if (imageCount == 0) {
            return 0.0;
        }
        double remaining = Math.max(0.0, audioSeconds - totalVideoSeconds);
        return Math.max(MIN_IMAGE_SECONDS, remaining / imageCount);
    }

    List<String> buildImageSegmentCommand(Path imagePath, double seconds, AspectRatio aspectRatio, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(processRunner.resolveFfmpegBinary());
        command.add("-y");
        command.add("-loop");
        command.add("1");
        command.add("-i");
        command.add(imagePath.toString());
        command.add("-t");
        command.add(formatSeconds(seconds));
        command.add("-vf");
        command.add(buildScaleFilter(aspectRatio));
        command.add("-r");
        command.add("30");
        command.add("-an");
        appendEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVideoSegmentCommand(Path videoPath, AspectRatio aspectRatio, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(processRunner.resolveFfmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(videoPath.toString());
        command.add("-vf");
        command.add(buildScaleFilter(aspectRatio));
        command.add("-an");
        command.add("-r");
        command.add("30");
        appendEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVisualConcatCommand(List<Path> segments, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(processRunner.resolveFfmpegBinary());
        command.add("-y");
        for (Path segment : segments) {
            command.add("-i");
            command.add(segment.toString());
        }

        StringBuilder filter = new StringBuilder();
        for (int index = 0; index < segments.size(); index++) {
            filter.append("[").append(index).append(":v]");
        }
        filter.append("concat=n=").append(segments.size()).append(":v=1:a=0[v]");

        command.add("-filter_complex");
        command.add(filter.toString());
        command.add("-map");
        command.add("[v]");
        appendEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildAudioMuxCommand(Path audioPath, Path visualTrackPath, Path outputVideoPath) {
        return List.of(
                processRunner.resolveFfmpegBinary(),
                "-y",
                "-i",
                visualTrackPath.toString(),
                "-i",
                audioPath.toString(),
                "-map",
                "0:v:0",
                "-map",
                "1:a:0",
                "-c:v",
                "copy",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-shortest",
                outputVideoPath.toString());
    }

    String buildScaleFilter(AspectRatio aspectRatio) {
        int width = aspectRatio.width();
        int height = aspectRatio.height();
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1";
    }

    private void appendEncoderArguments(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private void deleteRecursively(Path directory) {
        try (var pathStream = Files.walk(directory)) {
            pathStream
                    .sorted(Comparator.reverseOrder())
                    .forEach(this::deleteIfExists);
        } catch (IOException e) {
            logger.warn("Could not clean up assembly directory {}: {}", directory, e.getMessage());
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
