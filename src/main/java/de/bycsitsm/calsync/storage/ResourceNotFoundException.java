package de.bycsitsm.calsync.storage;

/**
 * Thrown when a source or destination is not (or no longer) present in the store.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final ResourceKind kind;
    private final long id;

    public ResourceNotFoundException(ResourceKind kind, long id) {
        super(kind.displayName() + " " + id + " no longer exists");
        this.kind = kind;
        this.id = id;
    }

    public ResourceKind kind() {
        return kind;
    }

    public long id() {
        return id;
    }
}
