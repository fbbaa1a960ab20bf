package de.bycsitsm.calsync.storage;

/**
 * Outcome of the most recent synchronization of a resource.
 * {@link #PENDING} only applies until the first run has finished.
 */
public enum SyncStatus {
    PENDING,
    OK,
    ERROR
}
