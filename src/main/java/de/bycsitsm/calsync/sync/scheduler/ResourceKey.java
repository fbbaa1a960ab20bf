package de.bycsitsm.calsync.sync.scheduler;

import de.bycsitsm.calsync.storage.ResourceKind;

/**
 * Identifies a scheduled resource.
 */
public record ResourceKey(ResourceKind kind, long id) {

    @Override
    public String toString() {
        return kind.displayName().toLowerCase() + " " + id;
    }
}
