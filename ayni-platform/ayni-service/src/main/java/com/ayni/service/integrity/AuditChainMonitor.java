package com.ayni.service.integrity;

import com.ayni.core.audit.RegistryEventLog.VerificationResult;
import com.ayni.core.registry.IdentityRegistry;
import com.ayni.service.config.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically recomputes the audit hash chain and reports breaks.
 * Runs every {@code ayni.registry.integrity-check-interval}, first after one interval.
 */
@Component
public class AuditChainMonitor implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AuditChainMonitor.class);

    private final IdentityRegistry registry;
    private final Duration interval;
    private final AtomicReference<VerificationResult> lastResult = new AtomicReference<>();

    public AuditChainMonitor(IdentityRegistry registry, RegistryProperties properties) {
        this.registry = registry;
        this.interval = properties.getIntegrityCheckInterval();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addFixedDelayTask(new FixedDelayTask(this::checkIntegrity, interval, interval));
    }

    public VerificationResult checkIntegrity() {
        VerificationResult result = registry.verifyAuditChain();
        lastResult.set(result);
        if (result.valid()) {
            log.info("Audit chain intact: {} events verified", result.eventsVerified());
        } else {
            log.error("Audit chain broken at sequence {}: {}", result.firstBrokenSequence(), result.errors());
        }
        return result;
    }

    /**
     * Outcome of the most recent check, or {@code null} before the first run.
     */
    public VerificationResult getLastResult() {
        return lastResult.get();
    }

    public Duration getInterval() {
        return interval;
    }
}
