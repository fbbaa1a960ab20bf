package de.bycsitsm.calsync.sync.scheduler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The periodic synchronization of one resource.
 * <p>
 * Each tick runs the attempt, retrying retryable failures with the {@link RetryPolicy}.
 * Waits are scheduled continuations on the shared {@link TaskScheduler}, so a loop in
 * backoff occupies no worker thread. The next tick is only scheduled once the current
 * run has finished, hence runs of the same resource never overlap.
 * <p>
 * A fatal failure ends the loop. When all attempts of a run fail, the last error is
 * handed to the error recorder and the loop waits for its next tick.
 */
final class SyncLoop {

    private static final Logger log = LoggerFactory.getLogger(SyncLoop.class);

    private final ResourceKey key;
    private final String name;
    private final Duration interval;
    private final RetryPolicy retryPolicy;
    private final TaskScheduler taskScheduler;
    private final Supplier<String> attempt;
    private final Consumer<String> errorRecorder;
    private final Consumer<SyncLoop> onStop;

    private boolean cancelled;
    private @Nullable ScheduledFuture<?> pending;

    /**
     * @param attempt       runs one synchronization and returns a summary for the log
     * @param errorRecorder stores the error message of a run whose attempts are exhausted
     * @param onStop        called once when the loop ends because of a fatal failure
     */
    SyncLoop(ResourceKey key, String name, Duration interval, RetryPolicy retryPolicy, TaskScheduler taskScheduler,
             Supplier<String> attempt, Consumer<String> errorRecorder, Consumer<SyncLoop> onStop) {
        this.key = key;
        this.name = name;
        this.interval = interval;
        this.retryPolicy = retryPolicy;
        this.taskScheduler = taskScheduler;
        this.attempt = attempt;
        this.errorRecorder = errorRecorder;
        this.onStop = onStop;
    }

    ResourceKey key() {
        return key;
    }

    /**
     * Starts the loop; the first tick runs immediately.
     */
    void start() {
        log.info("Auto-sync enabled for {} '{}' (every {}s)", key, name, interval.toSeconds());
        scheduleAfter(Duration.ZERO, () -> runAttempt(1));
    }

    /**
     * Stops the loop. A pending tick or retry is cancelled and a running attempt is interrupted.
     */
    synchronized void cancel() {
        cancelled = true;
        if (pending != null) {
            pending.cancel(true);
            pending = null;
        }
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    private void runAttempt(int attemptNumber) {
        if (isCancelled()) {
            return;
        }
        try {
            var summary = attempt.get();
            log.info("Auto-sync {}: {}", key, summary);
            scheduleNextTick();
        } catch (RuntimeException e) {
            handleFailure(SyncFailure.classify(e), attemptNumber);
        }
    }

    private void handleFailure(SyncFailure failure, int attemptNumber) {
        switch (failure.kind()) {
            case FATAL -> stop(failure);
            case RETRYABLE -> {
                if (retryPolicy.allowsRetryAfter(attemptNumber)) {
                    var delay = retryPolicy.delayAfter(attemptNumber);
                    log.warn("Auto-sync {} attempt {}/{} failed, retrying in {}s: {}", key, attemptNumber,
                            retryPolicy.maxAttempts(), delay.toSeconds(), failure.message());
                    scheduleAfter(delay, () -> runAttempt(attemptNumber + 1));
                } else {
                    log.error("Auto-sync '{}' failed after {} attempts: {}", name, attemptNumber, failure.message());
                    recordError(failure.message());
                }
            }
        }
    }

    private void recordError(String message) {
        try {
            errorRecorder.accept(message);
        } catch (RuntimeException e) {
            var failure = SyncFailure.classify(e);
            if (failure.kind() == SyncFailure.Kind.FATAL) {
                stop(failure);
                return;
            }
            log.error("Failed to record error status for {}: {}", key, failure.message());
        }
        scheduleNextTick();
    }

    private void stop(SyncFailure failure) {
        log.error("Auto-sync '{}' stopping: {}", name, failure.message());
        synchronized (this) {
            cancelled = true;
            pending = null;
        }
        onStop.accept(this);
    }

    private void scheduleNextTick() {
        scheduleAfter(interval, () -> runAttempt(1));
    }

    private synchronized void scheduleAfter(Duration delay, Runnable task) {
        if (cancelled) {
            return;
        }
        pending = taskScheduler.schedule(task, taskScheduler.getClock().instant().plus(delay));
    }
}
