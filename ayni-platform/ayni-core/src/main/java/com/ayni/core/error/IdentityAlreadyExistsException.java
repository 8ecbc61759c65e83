package com.ayni.core.error;

/**
 * Exception thrown when a principal tries to create a second identity.
 */
public class IdentityAlreadyExistsException extends RegistryException {

    public IdentityAlreadyExistsException(String message) {
        super(RegistryErrorKind.ALREADY_EXISTS, message);
    }
}
