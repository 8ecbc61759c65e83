package com.ayni.service.config;

import com.ayni.core.domain.Principal;
import com.ayni.core.journal.InMemoryRegistryJournal;
import com.ayni.core.journal.JsonLinesRegistryJournal;
import com.ayni.core.journal.RegistryJournal;
import com.ayni.core.registry.IdentityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the registry, its journal and clock.
 */
@Configuration
public class RegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfiguration.class);

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryJournal registryJournal(RegistryProperties properties) {
        if (properties.isDurable()) {
            Path path = Path.of(properties.getJournalPath());
            log.info("Using registry journal at {}", path.toAbsolutePath());
            return new JsonLinesRegistryJournal(path);
        }
        log.warn("No ayni.registry.journal-path configured, registry state will not survive a restart");
        return new InMemoryRegistryJournal();
    }

    /**
     * Bootstraps the owner and replays every journaled transaction before the registry is exposed.
     */
    @Bean
    public IdentityRegistry identityRegistry(RegistryProperties properties, RegistryJournal journal, Clock clock) {
        Principal owner = Principal.of(properties.getOwner());
        IdentityRegistry registry = IdentityRegistry.inMemory(owner, journal, clock);
        int replayed = registry.replay(journal.readAll());
        log.info("Identity registry ready: owner={}, replayed={}, identities={}",
                owner, replayed, registry.getTotalIdentities());
        return registry;
    }
}
