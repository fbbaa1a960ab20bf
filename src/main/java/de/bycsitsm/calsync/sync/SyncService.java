package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.storage.IcsPayloadStorage;
import de.bycsitsm.calsync.storage.ResourceKind;
import de.bycsitsm.calsync.storage.ResourceNotFoundException;
import de.bycsitsm.calsync.storage.SyncStatus;
import de.bycsitsm.calsync.storage.SyncStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Service layer for synchronization runs. Loads a resource from the {@link SyncStore},
 * runs its pipeline and records the outcome.
 * <p>
 * The store is only touched before and after the network work of a run, never during it.
 */
@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final SyncStore store;
    private final IcsPayloadStorage payloadStorage;
    private final SourceSynchronizer sourceSynchronizer;
    private final DestinationSynchronizer destinationSynchronizer;
    private final Clock clock;

    SyncService(SyncStore store, IcsPayloadStorage payloadStorage, SourceSynchronizer sourceSynchronizer,
                DestinationSynchronizer destinationSynchronizer, Clock clock) {
        this.store = store;
        this.payloadStorage = payloadStorage;
        this.sourceSynchronizer = sourceSynchronizer;
        this.destinationSynchronizer = destinationSynchronizer;
        this.clock = clock;
    }

    /**
     * Synchronizes a source on demand. A failure is recorded as the source's error
     * status; the previously stored ICS document is kept.
     *
     * @param sourceId the id of the source
     * @return the result of the run
     * @throws ResourceNotFoundException if the source does not exist
     */
    public SourceSyncResult syncSource(long sourceId) {
        try {
            return runSource(sourceId);
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Sync error for source {}: {}", sourceId, e.getMessage());
            try {
                recordSourceError(sourceId, e.getMessage());
            } catch (RuntimeException recordFailure) {
                log.warn("Could not record error for source {}: {}", sourceId, recordFailure.getMessage());
                e.addSuppressed(recordFailure);
            }
            throw e;
        }
    }

    /**
     * Synchronizes a destination on demand. A failure is recorded as the destination's
     * error status.
     *
     * @param destinationId the id of the destination
     * @return the result of the run
     * @throws ResourceNotFoundException if the destination does not exist
     */
    public UploadResult syncDestination(long destinationId) {
        try {
            return runDestination(destinationId);
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Reverse sync error for destination {}: {}", destinationId, e.getMessage());
            try {
                recordDestinationError(destinationId, e.getMessage());
            } catch (RuntimeException recordFailure) {
                log.warn("Could not record error for destination {}: {}", destinationId,
                        recordFailure.getMessage());
                e.addSuppressed(recordFailure);
            }
            throw e;
        }
    }

    /**
     * Runs one source synchronization attempt and records its success. Failures are
     * thrown without touching the store, leaving the decision to the caller.
     */
    public SourceSyncResult runSource(long sourceId) {
        var source = store.findSource(sourceId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceKind.SOURCE, sourceId));

        var result = sourceSynchronizer.synchronize(source.caldavUrl(), source.credentials());

        payloadStorage.save(sourceId, result.ics());
        store.updateSourceLastSynced(sourceId, clock.instant());
        store.updateSourceStatus(sourceId, SyncStatus.OK, null);
        log.info("Source {}: {}", sourceId, result.message());
        return result;
    }

    /**
     * Runs one destination synchronization attempt and records its success. Failures
     * are thrown without touching the store.
     */
    public UploadResult runDestination(long destinationId) {
        var destination = store.findDestination(destinationId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceKind.DESTINATION, destinationId));

        var result = destinationSynchronizer.synchronize(destination);

        store.updateDestinationLastSynced(destinationId, clock.instant());
        store.updateDestinationStatus(destinationId, SyncStatus.OK, null);
        log.info("Destination {}: {}", destinationId, result.message());
        return result;
    }

    public void recordSourceError(long sourceId, String message) {
        store.updateSourceStatus(sourceId, SyncStatus.ERROR, message);
    }

    public void recordDestinationError(long destinationId, String message) {
        store.updateDestinationStatus(destinationId, SyncStatus.ERROR, message);
    }

    /**
     * Deletes a source together with its stored ICS document. A running auto-sync loop
     * of the source ends on its next attempt.
     *
     * @return whether the source existed
     */
    public boolean deleteSource(long sourceId) {
        boolean removed = store.deleteSource(sourceId);
        payloadStorage.discard(sourceId);
        if (removed) {
            log.info("Source {} deleted", sourceId);
        }
        return removed;
    }

    /**
     * Returns the latest combined ICS document of a source.
     *
     * @return the document, or empty if none has been generated yet
     */
    public Optional<String> currentIcs(long sourceId) {
        return payloadStorage.load(sourceId);
    }
}
