package de.bycsitsm.calsync.storage;

import de.bycsitsm.calsync.caldav.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    SyncStore syncStore(StorageProperties properties) {
        var store = new InMemorySyncStore();
        for (var entry : properties.sources()) {
            var source = store.addSource(Source.create(entry.name(), entry.caldavUrl(),
                    new Credentials(entry.username(), entry.password()), entry.syncIntervalSecs()));
            log.info("Configured source {} '{}' ({})", source.id(), source.name(), source.caldavUrl());
        }
        for (var entry : properties.destinations()) {
            var destination = store.addDestination(Destination.create(entry.name(), entry.icsUrl(),
                    entry.caldavUrl(), entry.calendarName(), new Credentials(entry.username(), entry.password()),
                    entry.syncIntervalSecs(), entry.syncAll(), entry.keepLocal()));
            log.info("Configured destination {} '{}' ({} -> {})", destination.id(), destination.name(),
                    destination.icsUrl(), destination.caldavUrl());
        }
        return store;
    }
}
