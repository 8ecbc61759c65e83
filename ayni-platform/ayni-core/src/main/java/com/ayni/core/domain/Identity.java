package com.ayni.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Self-owned identity record. One per principal, never deleted.
 * Every mutation returns a new record; {@code lastUpdated} never moves backwards.
 */
public record Identity(
        Principal principal,
        String name,
        String email,
        String profileHash,
        int reputationScore,
        boolean verified,
        Instant createdAt,
        Instant lastUpdated
) {
    public Identity {
        Objects.requireNonNull(principal, "Principal required");
        Objects.requireNonNull(name, "Name required");
        Objects.requireNonNull(email, "Email required");
        Objects.requireNonNull(createdAt, "Creation time required");
        Objects.requireNonNull(lastUpdated, "Last update time required");
        profileHash = profileHash != null ? profileHash : "";
    }

    /**
     * Creates a fresh, unverified identity with the given starting score.
     */
    public static Identity create(Principal principal, String name, String email, String profileHash,
                                  int initialScore, Instant now) {
        return new Identity(principal, name, email, profileHash, initialScore, false, now, now);
    }

    public Identity withProfile(String name, String email, String profileHash, Instant now) {
        return new Identity(principal, name, email, profileHash, reputationScore, verified,
                createdAt, advance(now));
    }

    public Identity withVerified(boolean verified, Instant now) {
        return new Identity(principal, name, email, profileHash, reputationScore, verified,
                createdAt, advance(now));
    }

    public Identity withReputationScore(int reputationScore, Instant now) {
        return new Identity(principal, name, email, profileHash, reputationScore, verified,
                createdAt, advance(now));
    }

    private Instant advance(Instant now) {
        return now.isAfter(lastUpdated) ? now : lastUpdated;
    }
}
