package com.ayni.core.error;

/**
 * Error kinds surfaced by the registry. The transport layer maps these to its own codes.
 */
public enum RegistryErrorKind {
    INVALID_INPUT,
    NOT_FOUND,
    ALREADY_EXISTS,
    FORBIDDEN,
    INDEX_OUT_OF_RANGE
}
