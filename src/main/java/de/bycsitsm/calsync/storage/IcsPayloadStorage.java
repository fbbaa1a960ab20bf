package de.bycsitsm.calsync.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the combined ICS document of a source according to the configured
 * {@link StorageStrategy}: in the {@link SyncStore}, in a file below the data
 * directory, or both.
 */
@Component
public class IcsPayloadStorage {

    private static final Logger log = LoggerFactory.getLogger(IcsPayloadStorage.class);

    private final SyncStore store;
    private final StorageStrategy strategy;
    private final Path dataDir;

    public IcsPayloadStorage(SyncStore store, StorageProperties properties) {
        this.store = store;
        this.strategy = properties.strategy();
        this.dataDir = properties.dataDir();
    }

    /**
     * Stores a freshly generated ICS document.
     *
     * @throws ResourceNotFoundException if the source no longer exists
     * @throws StoreException            if the document cannot be written to disk
     */
    public void save(long sourceId, String ics) {
        store.saveIcsData(sourceId, strategy.keepsInMemory() ? ics : null);
        if (!strategy.writesToDisk()) {
            return;
        }
        writeFile(sourceId, ics);
        if (store.findSource(sourceId).isEmpty()) {
            // deleted while the file was being written
            deleteFile(sourceId);
            throw new ResourceNotFoundException(ResourceKind.SOURCE, sourceId);
        }
    }

    /**
     * Removes the stored document of a deleted source from disk.
     *
     * @throws StoreException if the file exists but cannot be deleted
     */
    public void discard(long sourceId) {
        if (strategy.writesToDisk()) {
            deleteFile(sourceId);
        }
    }

    /**
     * Returns the latest ICS document of a source, if one has been generated.
     *
     * @throws StoreException if the file exists but cannot be read
     */
    public Optional<String> load(long sourceId) {
        if (strategy.keepsInMemory()) {
            return store.findIcsData(sourceId);
        }
        var file = fileFor(sourceId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    Path fileFor(long sourceId) {
        return dataDir.resolve("source-" + sourceId + ".ics");
    }

    private void deleteFile(long sourceId) {
        var file = fileFor(sourceId);
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted {}", file);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to delete " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeFile(long sourceId, String ics) {
        var file = fileFor(sourceId);
        try {
            Files.createDirectories(dataDir);
            var temp = Files.createTempFile(dataDir, "source-" + sourceId, ".tmp");
            Files.writeString(temp, ics, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} bytes to {}", ics.length(), file);
        } catch (IOException e) {
            throw new StoreException("Failed to save to disk: " + e.getMessage(), e);
        }
    }
}
