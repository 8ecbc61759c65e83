package com.ayni.core.error;

/**
 * Exception thrown when the caller lacks the role an operation requires.
 */
public class RegistryAccessDeniedException extends RegistryException {

    public RegistryAccessDeniedException(String message) {
        super(RegistryErrorKind.FORBIDDEN, message);
    }
}
