package com.ayni.core.store;

import com.ayni.core.domain.Identity;
import com.ayni.core.domain.Principal;

import java.util.Optional;

/**
 * Principal to identity mapping. Identities are inserted once and never removed.
 */
public interface IdentityStore {

    Optional<Identity> find(Principal principal);

    boolean exists(Principal principal);

    /**
     * Inserts a new identity and bumps the total count.
     *
     * @throws IllegalStateException if the principal already has one
     */
    void insert(Identity identity);

    /**
     * Replaces an existing identity.
     *
     * @throws IllegalStateException if the principal has none
     */
    void update(Identity identity);

    /**
     * Number of identities ever created.
     */
    long totalIdentities();
}
