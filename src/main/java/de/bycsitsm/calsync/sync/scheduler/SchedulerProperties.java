package de.bycsitsm.calsync.sync.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for automatic synchronization.
 *
 * @param enabled  whether loops are started when the application is ready
 * @param poolSize the number of worker threads shared by all loops
 * @param retry    the backoff applied within one run
 */
@ConfigurationProperties(prefix = "sync")
public record SchedulerProperties(Boolean enabled, Integer poolSize, Retry retry) {

    public SchedulerProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (poolSize == null) {
            poolSize = 4;
        }
        if (retry == null) {
            retry = new Retry(null, null, null);
        }
    }

    public record Retry(Duration baseDelay, Duration maxDelay, Integer maxAttempts) {

        public Retry {
            if (baseDelay == null) {
                baseDelay = Duration.ofSeconds(30);
            }
            if (maxDelay == null) {
                maxDelay = Duration.ofMinutes(5);
            }
            if (maxAttempts == null) {
                maxAttempts = 5;
            }
        }
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.baseDelay(), retry.maxDelay(), retry.maxAttempts());
    }
}
