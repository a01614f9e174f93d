package github.sarthakdev143.music_video_studio.integration.video;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MediaDurationProbeTest {

    @Test
    void parsesDurationLine() throws IOException {
        String output = """
                Input #0, mp3, from 'song.mp3':
                  Duration: 00:03:25.48, start: 0.025057, bitrate: 320 kb/s
                  Stream #0:0: Audio: mp3, 44100 Hz, stereo, fltp, 320 kb/s
                At least one output file must be specified
                """;

        assertThat(MediaDurationProbe.parseSeconds(output, Path.of("song.mp3"))).isCloseTo(205.48, within(1e-6));
    }

    @Test
    void parsesHours() throws IOException {
        assertThat(MediaDurationProbe.parseSeconds("Duration: 01:00:08.00, start", Path.of("long.mp4")))
                .isCloseTo(3608.0, within(1e-6));
    }

    @Test
    void failsWhenDurationIsMissing() {
        assertThatThrownBy(() -> MediaDurationProbe.parseSeconds("song.mp3: Invalid data found", Path.of("song.mp3")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("song.mp3");
    }
}
