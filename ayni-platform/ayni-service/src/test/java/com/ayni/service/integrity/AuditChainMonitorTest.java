package com.ayni.service.integrity;

import com.ayni.core.audit.RegistryEvent;
import com.ayni.core.audit.RegistryEventLog;
import com.ayni.core.audit.RegistryEventLog.VerificationResult;
import com.ayni.core.domain.Principal;
import com.ayni.core.journal.InMemoryRegistryJournal;
import com.ayni.core.registry.IdentityRegistry;
import com.ayni.core.store.InMemoryCredentialStore;
import com.ayni.core.store.InMemoryIdentityStore;
import com.ayni.core.store.InMemoryTrustedIssuerStore;
import com.ayni.service.config.RegistryProperties;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditChainMonitorTest {

    private static final Principal OWNER = Principal.of("0x0000000000000000000000000000000000000001");
    private static final Principal ALICE = Principal.of("0x0000000000000000000000000000000000000003");

    @Test
    void reportsIntactChain() {
        IdentityRegistry registry = IdentityRegistry.inMemory(OWNER, new InMemoryRegistryJournal(), Clock.systemUTC());
        registry.createIdentity(ALICE, "Alice", "alice@example.com", "");
        registry.verifyIdentity(OWNER, ALICE, true);
        AuditChainMonitor monitor = new AuditChainMonitor(registry, properties(Duration.ofMinutes(5)));

        assertThat(monitor.getLastResult()).isNull();

        VerificationResult result = monitor.checkIntegrity();

        assertThat(result.valid()).isTrue();
        assertThat(result.eventsVerified()).isEqualTo(3);
        assertThat(monitor.getLastResult()).isSameAs(result);
    }

    @Test
    void reportsFirstBrokenSequence() {
        TamperedEventLog eventLog = new TamperedEventLog();
        IdentityRegistry registry = new IdentityRegistry(OWNER, new InMemoryIdentityStore(),
                new InMemoryCredentialStore(), new InMemoryTrustedIssuerStore(), eventLog,
                new InMemoryRegistryJournal(), Clock.systemUTC());
        registry.createIdentity(ALICE, "Alice", "alice@example.com", "");
        registry.updateProfile(ALICE, ALICE, "Alicia", "alice@example.com", "");

        VerificationResult result = new AuditChainMonitor(registry, properties(Duration.ofMinutes(5))).checkIntegrity();

        assertThat(result.valid()).isFalse();
        assertThat(result.firstBrokenSequence()).isEqualTo(1);
    }

    @Test
    void schedulesCheckAtConfiguredInterval() {
        IdentityRegistry registry = IdentityRegistry.inMemory(OWNER, new InMemoryRegistryJournal(), Clock.systemUTC());
        AuditChainMonitor monitor = new AuditChainMonitor(registry, properties(Duration.ofSeconds(90)));
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        monitor.configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList()).singleElement().satisfies(task -> {
            assertThat(task.getIntervalDuration()).isEqualTo(Duration.ofSeconds(90));
            assertThat(task.getInitialDelayDuration()).isEqualTo(Duration.ofSeconds(90));
        });

        registrar.getFixedDelayTaskList().get(0).getRunnable().run();
        assertThat(monitor.getLastResult()).isNotNull();
        assertThat(monitor.getLastResult().valid()).isTrue();
    }

    private static RegistryProperties properties(Duration interval) {
        RegistryProperties properties = new RegistryProperties();
        properties.setOwner(OWNER.toString());
        properties.setIntegrityCheckInterval(interval);
        return properties;
    }

    /**
     * Event log whose verification sees a copy with a rewritten second event.
     */
    private static final class TamperedEventLog extends RegistryEventLog {

        @Override
        public VerificationResult verifyIntegrity() {
            List<RegistryEvent> copy = new ArrayList<>(getEvents());
            RegistryEvent original = copy.get(1);
            copy.set(1, new RegistryEvent(original.sequenceNumber(), original.type(), ALICE,
                    Map.of("change", "forged"), original.timestamp(),
                    original.previousHash(), original.entryHash()));
            return verifyChain(copy);
        }
    }
}
