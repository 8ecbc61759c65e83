package com.ayni.core.error;

/**
 * Base class for every rejected registry operation.
 * A rejected operation leaves registry state, the event log and the journal untouched.
 */
public abstract class RegistryException extends RuntimeException {

    private final RegistryErrorKind kind;

    protected RegistryException(RegistryErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistryErrorKind getKind() {
        return kind;
    }
}
