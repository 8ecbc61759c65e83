package com.ayni.core.store;

import com.ayni.core.domain.Credential;
import com.ayni.core.domain.Principal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store holding one immutable list per subject, swapped on every write.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<Principal, List<Credential>> credentials = new ConcurrentHashMap<>();

    @Override
    public List<Credential> findAll(Principal subject) {
        return credentials.getOrDefault(subject, List.of());
    }

    @Override
    public Optional<Credential> find(Principal subject, int index) {
        List<Credential> sequence = findAll(subject);
        if (index < 0 || index >= sequence.size()) {
            return Optional.empty();
        }
        return Optional.of(sequence.get(index));
    }

    @Override
    public int count(Principal subject) {
        return findAll(subject).size();
    }

    @Override
    public int append(Principal subject, Credential credential) {
        Objects.requireNonNull(credential, "Credential cannot be null");
        List<Credential> updated = credentials.compute(subject, (key, current) -> {
            List<Credential> next = current != null ? new ArrayList<>(current) : new ArrayList<>();
            next.add(credential);
            return List.copyOf(next);
        });
        return updated.size() - 1;
    }

    @Override
    public void replace(Principal subject, int index, Credential credential) {
        Objects.requireNonNull(credential, "Credential cannot be null");
        credentials.compute(subject, (key, current) -> {
            if (current == null || index < 0 || index >= current.size()) {
                throw new IllegalStateException("No credential " + index + " stored for " + subject);
            }
            List<Credential> next = new ArrayList<>(current);
            next.set(index, credential);
            return List.copyOf(next);
        });
    }
}
