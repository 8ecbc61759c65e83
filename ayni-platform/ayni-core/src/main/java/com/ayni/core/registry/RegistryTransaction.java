package com.ayni.core.registry;

import com.ayni.core.domain.Principal;

import java.time.Instant;
import java.util.Objects;

/**
 * One ordered input to the registry: who called, when, and what they asked for.
 * The timestamp is the only notion of "now" an operation sees.
 */
public record RegistryTransaction(Principal caller, Instant timestamp, RegistryOperation operation) {

    public RegistryTransaction {
        Objects.requireNonNull(caller, "Caller required");
        Objects.requireNonNull(timestamp, "Timestamp required");
        Objects.requireNonNull(operation, "Operation required");
    }

    public String operationName() {
        return operation.getClass().getSimpleName();
    }
}
