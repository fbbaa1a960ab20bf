package de.bycsitsm.calsync.sync.scheduler;

import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.storage.ResourceKind;
import de.bycsitsm.calsync.storage.ResourceNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SyncLoopTest {

    private static final ResourceKey KEY = new ResourceKey(ResourceKind.SOURCE, 1);
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(Duration.ofMillis(10), Duration.ofMillis(40), 3);

    private final AtomicInteger attempts = new AtomicInteger();
    private final List<String> recordedErrors = new CopyOnWriteArrayList<>();
    private final List<SyncLoop> stopped = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskScheduler taskScheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    private SyncLoop loop(Duration interval, Supplier<String> attempt) {
        return new SyncLoop(KEY, "Team", interval, FAST_RETRY, taskScheduler,
                () -> {
                    attempts.incrementAndGet();
                    return attempt.get();
                },
                recordedErrors::add, stopped::add);
    }

    @Test
    void first_tick_runs_immediately_and_ticks_repeat() {
        var loop = loop(Duration.ofMillis(20), () -> "ok");

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> attempts.get() >= 3);
        assertThat(recordedErrors).isEmpty();
        loop.cancel();
    }

    @Test
    void missing_resource_stops_the_loop_after_one_attempt() {
        var loop = loop(Duration.ofMillis(20), () -> {
            throw new ResourceNotFoundException(ResourceKind.SOURCE, 1);
        });

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> !stopped.isEmpty());
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> attempts.get() == 1);
        assertThat(stopped).containsExactly(loop);
        assertThat(loop.isCancelled()).isTrue();
        assertThat(recordedErrors).isEmpty();
    }

    @Test
    void transient_failures_are_retried_up_to_max_attempts_then_recorded() {
        var loop = loop(Duration.ofHours(1), () -> {
            throw new CalDavException("Connection refused");
        });

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> !recordedErrors.isEmpty());
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> attempts.get() == 3);
        assertThat(recordedErrors).containsExactly("Connection refused");
        assertThat(stopped).isEmpty();
        assertThat(loop.isCancelled()).isFalse();
        loop.cancel();
    }

    @Test
    void loop_keeps_ticking_after_a_run_exhausted_its_attempts() {
        var loop = loop(Duration.ofMillis(20), () -> {
            throw new CalDavException("Connection refused");
        });

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> recordedErrors.size() >= 2);
        assertThat(attempts.get()).isGreaterThanOrEqualTo(6);
        loop.cancel();
    }

    @Test
    void recovery_within_retries_records_no_error() {
        var failures = new AtomicInteger(2);
        var loop = loop(Duration.ofHours(1), () -> {
            if (failures.getAndDecrement() > 0) {
                throw new CalDavException("Temporarily unavailable");
            }
            return "ok";
        });

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> attempts.get() == 3);
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).until(() -> attempts.get() == 3);
        assertThat(recordedErrors).isEmpty();
        loop.cancel();
    }

    @Test
    void resource_deleted_while_recording_error_stops_the_loop() {
        var loop = new SyncLoop(KEY, "Team", Duration.ofMillis(20), FAST_RETRY, taskScheduler,
                () -> {
                    attempts.incrementAndGet();
                    throw new CalDavException("Connection refused");
                },
                message -> {
                    throw new ResourceNotFoundException(ResourceKind.SOURCE, 1);
                },
                stopped::add);

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> !stopped.isEmpty());
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> attempts.get() == 3);
    }

    @Test
    void cancelled_loop_runs_no_further_ticks() {
        var loop = loop(Duration.ofMillis(20), () -> "ok");
        loop.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> attempts.get() >= 1);

        loop.cancel();
        int afterCancel = attempts.get();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .until(() -> attempts.get() <= afterCancel + 1);
        assertThat(loop.isCancelled()).isTrue();
    }
}
