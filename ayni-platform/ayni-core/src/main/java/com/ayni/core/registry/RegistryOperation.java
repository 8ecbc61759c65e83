package com.ayni.core.registry;

import com.ayni.core.domain.Principal;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * The mutating operations a transaction can carry.
 * Serialised with an {@code op} discriminator so journals stay readable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RegistryOperation.CreateIdentity.class, name = "createIdentity"),
        @JsonSubTypes.Type(value = RegistryOperation.UpdateProfile.class, name = "updateProfile"),
        @JsonSubTypes.Type(value = RegistryOperation.SetVerification.class, name = "setVerification"),
        @JsonSubTypes.Type(value = RegistryOperation.AddCredential.class, name = "addCredential"),
        @JsonSubTypes.Type(value = RegistryOperation.RevokeCredential.class, name = "revokeCredential"),
        @JsonSubTypes.Type(value = RegistryOperation.AddTrustedIssuer.class, name = "addTrustedIssuer"),
        @JsonSubTypes.Type(value = RegistryOperation.RemoveTrustedIssuer.class, name = "removeTrustedIssuer")
})
public sealed interface RegistryOperation {

    /**
     * Identity for the calling principal.
     */
    record CreateIdentity(String name, String email, String profileHash) implements RegistryOperation {}

    record UpdateProfile(Principal subject, String name, String email, String profileHash)
            implements RegistryOperation {}

    record SetVerification(Principal subject, boolean verified) implements RegistryOperation {}

    /**
     * {@code expiresAt} of {@code null} or the epoch means the credential never expires.
     */
    record AddCredential(Principal subject, String credentialType, String credentialHash, Instant expiresAt)
            implements RegistryOperation {}

    record RevokeCredential(Principal subject, int index) implements RegistryOperation {}

    record AddTrustedIssuer(Principal issuer) implements RegistryOperation {}

    record RemoveTrustedIssuer(Principal issuer) implements RegistryOperation {}
}
