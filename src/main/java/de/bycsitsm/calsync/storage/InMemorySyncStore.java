package de.bycsitsm.calsync.storage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * {@link SyncStore} keeping all state in concurrent maps. Each call is atomic
 * through {@link ConcurrentHashMap#compute}, which locks a single entry only.
 */
public class InMemorySyncStore implements SyncStore {

    private final Map<Long, Source> sources = new ConcurrentHashMap<>();
    private final Map<Long, Destination> destinations = new ConcurrentHashMap<>();
    private final Map<Long, String> icsData = new ConcurrentHashMap<>();
    private final AtomicLong sourceIds = new AtomicLong();
    private final AtomicLong destinationIds = new AtomicLong();

    @Override
    public Source addSource(Source source) {
        var stored = source.withId(sourceIds.incrementAndGet());
        sources.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Source> findSource(long id) {
        return Optional.ofNullable(sources.get(id));
    }

    @Override
    public List<Source> listSources() {
        return sources.values().stream()
                .sorted(Comparator.comparingLong(Source::id))
                .toList();
    }

    @Override
    public Source updateSource(Source source) {
        return computeSource(source.id(), source::withStateOf);
    }

    @Override
    public boolean deleteSource(long id) {
        // the source goes first; a payload saved before that is removed below
        boolean removed = sources.remove(id) != null;
        icsData.remove(id);
        return removed;
    }

    @Override
    public void updateSourceStatus(long id, SyncStatus status, @Nullable String message) {
        checkNotPending(status);
        computeSource(id, current -> current.withStatus(status, status == SyncStatus.OK ? null : message));
    }

    @Override
    public void updateSourceLastSynced(long id, Instant at) {
        computeSource(id, current -> current.withLastSynced(at));
    }

    @Override
    public void saveIcsData(long id, @Nullable String ics) {
        computeSource(id, current -> {
            if (ics == null) {
                icsData.remove(id);
            } else {
                icsData.put(id, ics);
            }
            return current;
        });
    }

    @Override
    public Optional<String> findIcsData(long id) {
        return Optional.ofNullable(icsData.get(id));
    }

    @Override
    public Destination addDestination(Destination destination) {
        var stored = destination.withId(destinationIds.incrementAndGet());
        destinations.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Destination> findDestination(long id) {
        return Optional.ofNullable(destinations.get(id));
    }

    @Override
    public List<Destination> listDestinations() {
        return destinations.values().stream()
                .sorted(Comparator.comparingLong(Destination::id))
                .toList();
    }

    @Override
    public Destination updateDestination(Destination destination) {
        return computeDestination(destination.id(), destination::withStateOf);
    }

    @Override
    public boolean deleteDestination(long id) {
        return destinations.remove(id) != null;
    }

    @Override
    public void updateDestinationStatus(long id, SyncStatus status, @Nullable String message) {
        checkNotPending(status);
        computeDestination(id, current -> current.withStatus(status, status == SyncStatus.OK ? null : message));
    }

    @Override
    public void updateDestinationLastSynced(long id, Instant at) {
        computeDestination(id, current -> current.withLastSynced(at));
    }

    private Source computeSource(long id, UnaryOperator<Source> update) {
        var updated = sources.computeIfPresent(id, (key, current) -> update.apply(current));
        if (updated == null) {
            throw new ResourceNotFoundException(ResourceKind.SOURCE, id);
        }
        return updated;
    }

    private Destination computeDestination(long id, UnaryOperator<Destination> update) {
        var updated = destinations.computeIfPresent(id, (key, current) -> update.apply(current));
        if (updated == null) {
            throw new ResourceNotFoundException(ResourceKind.DESTINATION, id);
        }
        return updated;
    }

    private static void checkNotPending(SyncStatus status) {
        if (status == SyncStatus.PENDING) {
            throw new IllegalArgumentException("A synchronized resource cannot return to pending.");
        }
    }
}
