package com.ayni.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Issuer-attested claim about a subject, referencing its payload by content hash.
 *
 * <p>{@code issuer} is the issuer's display name captured at issuance, not a live reference.
 * An {@code expiresAt} of {@link #NEVER_EXPIRES} means the credential does not expire.
 * Expiry is computed against a clock; only revocation clears {@code valid}.
 */
public record Credential(
        String credentialType,
        String issuer,
        String credentialHash,
        Instant issuedAt,
        Instant expiresAt,
        boolean valid
) {
    public static final Instant NEVER_EXPIRES = Instant.EPOCH;

    public Credential {
        Objects.requireNonNull(credentialType, "Credential type required");
        Objects.requireNonNull(issuer, "Issuer required");
        Objects.requireNonNull(credentialHash, "Credential hash required");
        Objects.requireNonNull(issuedAt, "Issuance time required");
        expiresAt = expiresAt != null ? expiresAt : NEVER_EXPIRES;
    }

    public static Credential issue(String credentialType, String issuer, String credentialHash,
                                   Instant issuedAt, Instant expiresAt) {
        return new Credential(credentialType, issuer, credentialHash, issuedAt, expiresAt, true);
    }

    public boolean neverExpires() {
        return NEVER_EXPIRES.equals(expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return !neverExpires() && !expiresAt.isAfter(now);
    }

    /**
     * Not revoked and, unless non-expiring, expiring strictly after {@code now}.
     */
    public boolean isValidAt(Instant now) {
        return valid && !isExpiredAt(now);
    }

    public Credential revoke() {
        return new Credential(credentialType, issuer, credentialHash, issuedAt, expiresAt, false);
    }
}
