package de.bycsitsm.calsync.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration properties for synchronization state and payload storage.
 *
 * @param strategy     where combined ICS documents are kept
 * @param dataDir      the directory for ICS documents written to disk
 * @param sources      sources added to the store at startup
 * @param destinations destinations added to the store at startup
 */
@ConfigurationProperties(prefix = "storage")
public record StorageProperties(
        StorageStrategy strategy,
        Path dataDir,
        List<SourceEntry> sources,
        List<DestinationEntry> destinations
) {

    public StorageProperties {
        if (strategy == null) {
            strategy = StorageStrategy.MEMORY_ONLY;
        }
        if (dataDir == null) {
            dataDir = Path.of("./data");
        }
        if (sources == null) {
            sources = List.of();
        }
        if (destinations == null) {
            destinations = List.of();
        }
    }

    public record SourceEntry(String name, String caldavUrl, String username, String password,
                              long syncIntervalSecs) {
    }

    public record DestinationEntry(String name, String icsUrl, String caldavUrl, String calendarName,
                                   String username, String password, long syncIntervalSecs,
                                   boolean syncAll, boolean keepLocal) {
    }
}
