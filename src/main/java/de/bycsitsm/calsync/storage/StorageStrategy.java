package de.bycsitsm.calsync.storage;

/**
 * Where the combined ICS document of a source is kept.
 */
public enum StorageStrategy {
    MEMORY_ONLY,
    DISK_ONLY,
    MEMORY_AND_DISK;

    boolean keepsInMemory() {
        return this != DISK_ONLY;
    }

    boolean writesToDisk() {
        return this != MEMORY_ONLY;
    }
}
