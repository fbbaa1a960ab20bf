package de.bycsitsm.calsync.storage;

/**
 * Exception thrown when persisting synchronization state or payloads fails.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
