package com.ayni.core.error;

/**
 * Exception thrown when a credential index is past the end of the subject's sequence.
 */
public class CredentialIndexOutOfRangeException extends RegistryException {

    public CredentialIndexOutOfRangeException(String message) {
        super(RegistryErrorKind.INDEX_OUT_OF_RANGE, message);
    }
}
