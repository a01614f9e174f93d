package github.sarthakdev143.music_video_studio.integration.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Holds generated clips, images, uploaded audio and combined videos behind opaque handles.
 */
public interface ArtifactStore {

    String store(byte[] content, String suffix) throws IOException;

    String store(InputStream content, String suffix) throws IOException;

    /**
     * Reserves a fresh, empty location for a tool that writes its own output file.
     */
    String allocate(String suffix) throws IOException;

    Path resolve(String handle) throws IOException;

    /**
     * Location bound to {@code handle}, whether or not anything has been written there yet.
     */
    Path locate(String handle);

    /**
     * Frees whatever is bound to {@code handle}. Unknown or already released handles are ignored.
     */
    void release(String handle);
}
