package com.ayni.core.audit;

/**
 * Audit events emitted by registry operations.
 */
public enum RegistryEventType {
    IDENTITY_CREATED,
    IDENTITY_UPDATED,
    CREDENTIAL_ADDED,
    CREDENTIAL_REVOKED,
    TRUSTED_ISSUER_ADDED,
    TRUSTED_ISSUER_REMOVED,
    REPUTATION_UPDATED
}
