package com.ayni.core.store;

import com.ayni.core.domain.Principal;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trusted issuer set backed by a concurrent key set.
 */
public class InMemoryTrustedIssuerStore implements TrustedIssuerStore {

    private final Set<Principal> issuers = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isTrusted(Principal principal) {
        return issuers.contains(principal);
    }

    @Override
    public void setTrusted(Principal principal, boolean trusted) {
        if (trusted) {
            issuers.add(principal);
        } else {
            issuers.remove(principal);
        }
    }

    @Override
    public Set<Principal> trustedIssuers() {
        return Set.copyOf(issuers);
    }
}
