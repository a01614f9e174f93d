package github.sarthakdev143.music_video_studio.integration.storage;

import github.sarthakdev143.music_video_studio.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.regex.Pattern;

@Component
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStore.class);
    private static final String HANDLE_PREFIX = "artifact-";
    private static final Pattern HANDLE_PATTERN = Pattern.compile("^artifact-[0-9a-f\\-]{36}(\\.[a-z0-9]{1,5})?$");
    private static final Pattern SUFFIX_PATTERN = Pattern.compile("^\\.[a-z0-9]{1,5}$");

    private final Path rootDirectory;

    public LocalArtifactStore(StorageProperties storageProperties) {
        this.rootDirectory = storageProperties.directory().toAbsolutePath().normalize();
    }

    @Override
    public String store(byte[] content, String suffix) throws IOException {
        String handle = newHandle(suffix);
        Path target = pathFor(handle);
        Files.createDirectories(rootDirectory);
        Files.write(target, content);
        logger.debug("Stored artifact {} ({} bytes)", handle, content.length);
        return handle;
    }

    @Override
    public String store(InputStream content, String suffix) throws IOException {
        String handle = newHandle(suffix);
        Path target = pathFor(handle);
        Files.createDirectories(rootDirectory);
        long bytes = Files.copy(content, target);
        logger.debug("Stored artifact {} ({} bytes)", handle, bytes);
        return handle;
    }

    @Override
    public String allocate(String suffix) throws IOException {
        Files.createDirectories(rootDirectory);
        return newHandle(suffix);
    }

    @Override
    public Path resolve(String handle) throws IOException {
        Path path = pathFor(handle);
        if (Files.notExists(path)) {
            throw new FileNotFoundException("No artifact stored for handle " + handle);
        }
        return path;
    }

    @Override
    public Path locate(String handle) {
        return pathFor(handle);
    }

    @Override
    public void release(String handle) {
        if (handle == null || !HANDLE_PATTERN.matcher(handle).matches()) {
            return;
        }
        try {
            if (Files.deleteIfExists(pathFor(handle))) {
                logger.debug("Released artifact {}", handle);
            }
        } catch (IOException e) {
            logger.warn("Could not release artifact {}: {}", handle, e.getMessage());
        }
    }

    private String newHandle(String suffix) {
        String normalizedSuffix = suffix == null ? "" : suffix.trim().toLowerCase();
        if (!normalizedSuffix.isEmpty() && !SUFFIX_PATTERN.matcher(normalizedSuffix).matches()) {
            throw new IllegalArgumentException("Unsupported artifact suffix: " + suffix);
        }
        return HANDLE_PREFIX + UUID.randomUUID() + normalizedSuffix;
    }

    private Path pathFor(String handle) {
        if (handle == null || !HANDLE_PATTERN.matcher(handle).matches()) {
            throw new IllegalArgumentException("Invalid artifact handle: " + handle);
        }
        return rootDirectory.resolve(handle);
    }
}
