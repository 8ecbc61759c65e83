package com.ayni.service.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the identity registry.
 */
@Validated
@ConfigurationProperties(prefix = "ayni.registry")
public class RegistryProperties {

    @NotBlank
    private String owner;
    private String journalPath;
    @NotNull
    @DurationMin(seconds = 1)
    private Duration integrityCheckInterval = Duration.ofMinutes(5);

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public String getJournalPath() { return journalPath; }
    public void setJournalPath(String journalPath) { this.journalPath = journalPath; }
    public Duration getIntegrityCheckInterval() { return integrityCheckInterval; }
    public void setIntegrityCheckInterval(Duration interval) { this.integrityCheckInterval = interval; }

    /**
     * Journal on disk when a path is configured, otherwise state lives only as long as the process.
     */
    public boolean isDurable() {
        return journalPath != null && !journalPath.isBlank();
    }
}
