package de.bycsitsm.calsync.storage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent state shared by all synchronization runs: the configured sources and
 * destinations, their synchronization status and the generated ICS payloads.
 * <p>
 * Every method is atomic on its own. Implementations must not hold a lock across
 * calls, so the read, network and write phases of different resources interleave freely.
 * Update methods throw {@link ResourceNotFoundException} when the resource has been
 * deleted and {@link StoreException} when the underlying storage fails.
 */
public interface SyncStore {

    Source addSource(Source source);

    Optional<Source> findSource(long id);

    List<Source> listSources();

    /**
     * Replaces the configuration of an existing source, keeping its synchronization state.
     */
    Source updateSource(Source source);

    boolean deleteSource(long id);

    /**
     * Records the outcome of a source synchronization.
     *
     * @param status  {@link SyncStatus#OK} or {@link SyncStatus#ERROR}; a resource never returns to pending
     * @param message the error message, ignored for {@link SyncStatus#OK}
     */
    void updateSourceStatus(long id, SyncStatus status, @Nullable String message);

    void updateSourceLastSynced(long id, Instant at);

    /**
     * Stores the combined ICS document of a source; {@code null} discards the in-memory copy.
     */
    void saveIcsData(long id, @Nullable String ics);

    Optional<String> findIcsData(long id);

    Destination addDestination(Destination destination);

    Optional<Destination> findDestination(long id);

    List<Destination> listDestinations();

    Destination updateDestination(Destination destination);

    boolean deleteDestination(long id);

    void updateDestinationStatus(long id, SyncStatus status, @Nullable String message);

    void updateDestinationLastSynced(long id, Instant at);
}
