package com.ayni.core.audit;

import com.ayni.core.domain.Principal;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A committed, hash-chained audit event.
 */
public record RegistryEvent(
        long sequenceNumber,
        RegistryEventType type,
        Principal principal,
        Map<String, String> attributes,
        Instant timestamp,
        String previousHash,
        String entryHash
) {
    public RegistryEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(principal, "Principal cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(previousHash, "Previous hash cannot be null");
        Objects.requireNonNull(entryHash, "Entry hash cannot be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
