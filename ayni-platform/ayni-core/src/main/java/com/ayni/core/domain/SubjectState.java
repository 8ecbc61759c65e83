package com.ayni.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * An identity together with its credentials, as of one committed transaction.
 */
public record SubjectState(Identity identity, List<Credential> credentials) {
    public SubjectState {
        Objects.requireNonNull(identity, "Identity cannot be null");
        credentials = credentials != null ? List.copyOf(credentials) : List.of();
    }
}
