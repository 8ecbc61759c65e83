package com.ayni.core.store;

import com.ayni.core.domain.Credential;
import com.ayni.core.domain.Principal;

import java.util.List;
import java.util.Optional;

/**
 * Principal to ordered credential sequence. A credential's index never changes.
 */
public interface CredentialStore {

    /**
     * Immutable snapshot of the subject's credentials in index order.
     */
    List<Credential> findAll(Principal subject);

    Optional<Credential> find(Principal subject, int index);

    int count(Principal subject);

    /**
     * Appends a credential and returns its index.
     */
    int append(Principal subject, Credential credential);

    void replace(Principal subject, int index, Credential credential);
}
