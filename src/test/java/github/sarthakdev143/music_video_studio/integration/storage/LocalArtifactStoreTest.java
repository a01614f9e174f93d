package github.sarthakdev143.music_video_studio.integration.storage;

import github.sarthakdev143.music_video_studio.config.StorageProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalArtifactStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void storesBytesUnderOpaqueHandle() throws Exception {
        LocalArtifactStore store = new LocalArtifactStore(new StorageProperties(tempDir));

        String handle = store.store(new byte[] {1, 2, 3}, ".jpg");

        assertThat(handle).startsWith("artifact-").endsWith(".jpg");
        assertThat(Files.readAllBytes(store.resolve(handle))).containsExactly(1, 2, 3);
    }

    @Test
    void storesStreams() throws Exception {
        LocalArtifactStore store = new LocalArtifactStore(new StorageProperties(tempDir));

        String handle = store.store(new ByteArrayInputStream(new byte[] {9, 8}), ".MP3");

        assertThat(handle).endsWith(".mp3");
        assertThat(Files.size(store.resolve(handle))).isEqualTo(2);
    }

    @Test
    void allocatedHandleHasNoFileUntilWritten() throws Exception {
        LocalArtifactStore store = new LocalArtifactStore(new StorageProperties(tempDir));

        String handle = store.allocate(".mp4");

        assertThat(store.locate(handle).getParent()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThatThrownBy(() -> store.resolve(handle)).isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void releaseDeletesAndIgnoresUnknownHandles() throws Exception {
        LocalArtifactStore store = new LocalArtifactStore(new StorageProperties(tempDir));
        String handle = store.store(new byte[] {1}, ".png");

        store.release(handle);
        store.release(handle);
        store.release(null);
        store.release("../etc/passwd");

        assertThat(Files.exists(store.locate(handle))).isFalse();
    }

    @Test
    void rejectsHandlesOutsideTheStore() {
        LocalArtifactStore store = new LocalArtifactStore(new StorageProperties(tempDir));

        assertThatThrownBy(() -> store.resolve("../secret.txt")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.store(new byte[] {1}, ".tar.gz")).isInstanceOf(IllegalArgumentException.class);
    }
}
