package de.bycsitsm.calsync.sync.scheduler;

import de.bycsitsm.calsync.storage.ResourceNotFoundException;

/**
 * A failed synchronization attempt tagged with what the scheduler should do next.
 *
 * @param kind  whether the attempt may be retried
 * @param cause the failure
 */
public record SyncFailure(Kind kind, RuntimeException cause) {

    public enum Kind {
        /**
         * Network, protocol, parse or storage failure; retried with backoff.
         */
        RETRYABLE,
        /**
         * The resource is gone; its loop stops for good.
         */
        FATAL
    }

    public static SyncFailure classify(RuntimeException e) {
        if (e instanceof ResourceNotFoundException) {
            return new SyncFailure(Kind.FATAL, e);
        }
        return new SyncFailure(Kind.RETRYABLE, e);
    }

    public String message() {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
