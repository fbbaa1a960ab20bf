package de.bycsitsm.calsync.sync.scheduler;

import de.bycsitsm.calsync.storage.Destination;
import de.bycsitsm.calsync.storage.ResourceKind;
import de.bycsitsm.calsync.storage.Source;
import de.bycsitsm.calsync.storage.SyncStore;
import de.bycsitsm.calsync.sync.SyncService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Supervises one {@link SyncLoop} per source and destination with a positive sync interval.
 * <p>
 * Loops are started once the application is ready and stopped on shutdown. The registry
 * keyed by resource allows reconfiguration while running: {@link #reschedule} replaces the
 * loop of a resource after its interval changed, {@link #cancel} removes it. A resource
 * deleted without cancelling its loop is detected on the next attempt and ends the loop.
 */
@Component
public class AutoSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoSyncScheduler.class);

    private final SyncStore store;
    private final SyncService syncService;
    private final TaskScheduler taskScheduler;
    private final SchedulerProperties properties;
    private final RetryPolicy retryPolicy;

    private final Map<ResourceKey, SyncLoop> loops = new ConcurrentHashMap<>();

    AutoSyncScheduler(SyncStore store, SyncService syncService, TaskScheduler taskScheduler,
                      SchedulerProperties properties) {
        this.store = store;
        this.syncService = syncService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.retryPolicy = properties.retryPolicy();
    }

    @EventListener(ApplicationReadyEvent.class)
    void onApplicationReady() {
        if (!properties.enabled()) {
            log.info("Background auto-sync disabled (sync.enabled=false)");
            return;
        }
        start();
    }

    /**
     * Starts a loop for every stored resource with a positive interval.
     */
    public void start() {
        for (var source : store.listSources()) {
            reschedule(ResourceKind.SOURCE, source.id());
        }
        for (var destination : store.listDestinations()) {
            reschedule(ResourceKind.DESTINATION, destination.id());
        }
        log.info("Auto-sync started with {} loop(s)", loops.size());
    }

    /**
     * Replaces the loop of a resource with one that uses its currently stored configuration.
     * No loop is created when the resource does not exist or its interval is 0.
     *
     * @return whether a loop is now running for the resource
     */
    public boolean reschedule(ResourceKind kind, long id) {
        cancel(kind, id);
        var key = new ResourceKey(kind, id);
        var loop = switch (kind) {
            case SOURCE -> store.findSource(id)
                    .filter(Source::autoSyncEnabled)
                    .map(source -> newLoop(key, source.name(), source.syncIntervalSecs()))
                    .orElse(null);
            case DESTINATION -> store.findDestination(id)
                    .filter(Destination::autoSyncEnabled)
                    .map(destination -> newLoop(key, destination.name(), destination.syncIntervalSecs()))
                    .orElse(null);
        };
        if (loop == null) {
            log.debug("No auto-sync for {}", key);
            return false;
        }
        loops.put(key, loop);
        loop.start();
        return true;
    }

    /**
     * Stops the loop of a resource, if it has one.
     *
     * @return whether a loop was stopped
     */
    public boolean cancel(ResourceKind kind, long id) {
        var loop = loops.remove(new ResourceKey(kind, id));
        if (loop == null) {
            return false;
        }
        loop.cancel();
        log.info("Auto-sync cancelled for {}", loop.key());
        return true;
    }

    public boolean isScheduled(ResourceKind kind, long id) {
        return loops.containsKey(new ResourceKey(kind, id));
    }

    public Set<ResourceKey> scheduledResources() {
        return Set.copyOf(loops.keySet());
    }

    @PreDestroy
    public void stop() {
        loops.values().forEach(SyncLoop::cancel);
        loops.clear();
    }

    private SyncLoop newLoop(ResourceKey key, String name, long intervalSecs) {
        long id = key.id();
        Supplier<String> attempt = switch (key.kind()) {
            case SOURCE -> () -> syncService.runSource(id).message();
            case DESTINATION -> () -> syncService.runDestination(id).message();
        };
        Consumer<String> errorRecorder = switch (key.kind()) {
            case SOURCE -> message -> syncService.recordSourceError(id, message);
            case DESTINATION -> message -> syncService.recordDestinationError(id, message);
        };
        return new SyncLoop(key, name, Duration.ofSeconds(intervalSecs), retryPolicy, taskScheduler,
                attempt, errorRecorder, stopped -> loops.remove(key, stopped));
    }
}
