package com.ayni.core.error;

/**
 * Exception thrown when the referenced principal has no identity.
 */
public class IdentityNotFoundException extends RegistryException {

    public IdentityNotFoundException(String message) {
        super(RegistryErrorKind.NOT_FOUND, message);
    }
}
