package com.ayni.core.store;

import com.ayni.core.domain.Principal;

import java.util.Set;

/**
 * Membership set of principals allowed to verify identities and issue or revoke credentials.
 */
public interface TrustedIssuerStore {

    boolean isTrusted(Principal principal);

    void setTrusted(Principal principal, boolean trusted);

    Set<Principal> trustedIssuers();
}
