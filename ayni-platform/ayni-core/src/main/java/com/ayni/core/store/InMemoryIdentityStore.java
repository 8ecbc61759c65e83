package com.ayni.core.store;

import com.ayni.core.domain.Identity;
import com.ayni.core.domain.Principal;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity store backed by a concurrent map of immutable records.
 * Readers always see a fully written record.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<Principal, Identity> identities = new ConcurrentHashMap<>();
    private final AtomicLong totalIdentities = new AtomicLong();

    @Override
    public Optional<Identity> find(Principal principal) {
        return Optional.ofNullable(identities.get(principal));
    }

    @Override
    public boolean exists(Principal principal) {
        return identities.containsKey(principal);
    }

    @Override
    public void insert(Identity identity) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (identities.putIfAbsent(identity.principal(), identity) != null) {
            throw new IllegalStateException("Identity already stored for " + identity.principal());
        }
        totalIdentities.incrementAndGet();
    }

    @Override
    public void update(Identity identity) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (identities.replace(identity.principal(), identity) == null) {
            throw new IllegalStateException("No identity stored for " + identity.principal());
        }
    }

    @Override
    public long totalIdentities() {
        return totalIdentities.get();
    }
}
