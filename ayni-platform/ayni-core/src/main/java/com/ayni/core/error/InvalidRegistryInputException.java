package com.ayni.core.error;

/**
 * Exception thrown for malformed or empty fields and bad expirations.
 */
public class InvalidRegistryInputException extends RegistryException {

    public InvalidRegistryInputException(String message) {
        super(RegistryErrorKind.INVALID_INPUT, message);
    }
}
