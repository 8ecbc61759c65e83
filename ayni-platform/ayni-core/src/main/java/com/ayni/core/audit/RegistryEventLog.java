package com.ayni.core.audit;

import com.ayni.core.domain.Principal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit log with hash chaining for tamper detection.
 *
 * <ul>
 *   <li>Each entry hashes its sequence number, predecessor hash, type, principal,
 *       attributes and timestamp with SHA-256.</li>
 *   <li>The events of one transaction are appended as a single batch.</li>
 *   <li>Readers get snapshots and never block writers.</li>
 * </ul>
 */
public class RegistryEventLog {

    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private final List<RegistryEvent> entries = new CopyOnWriteArrayList<>();
    private volatile String lastHash = GENESIS_HASH;

    /**
     * Appends a transaction's events, all stamped with the transaction timestamp.
     */
    public synchronized List<RegistryEvent> appendAll(List<PendingEvent> events, Instant timestamp) {
        Objects.requireNonNull(events, "Events cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");

        List<RegistryEvent> appended = new ArrayList<>(events.size());
        String previousHash = lastHash;
        long sequenceNumber = entries.size();
        for (PendingEvent pending : events) {
            String entryHash = computeEntryHash(sequenceNumber, previousHash, pending.type(),
                    pending.principal(), pending.attributes(), timestamp);
            appended.add(new RegistryEvent(sequenceNumber, pending.type(), pending.principal(),
                    pending.attributes(), timestamp, previousHash, entryHash));
            previousHash = entryHash;
            sequenceNumber++;
        }

        entries.addAll(appended);
        lastHash = previousHash;
        return List.copyOf(appended);
    }

    public List<RegistryEvent> getEvents() {
        return List.copyOf(entries);
    }

    public List<RegistryEvent> getEvents(RegistryEventType type) {
        return entries.stream()
                .filter(e -> e.type() == type)
                .toList();
    }

    public List<RegistryEvent> getEvents(Principal principal) {
        return entries.stream()
                .filter(e -> e.principal().equals(principal))
                .toList();
    }

    public List<RegistryEvent> getLatestEvents(int count) {
        List<RegistryEvent> snapshot = List.copyOf(entries);
        int start = Math.max(0, snapshot.size() - count);
        return snapshot.subList(start, snapshot.size());
    }

    public int size() {
        return entries.size();
    }

    public String getLastHash() {
        return lastHash;
    }

    /**
     * Recomputes the whole chain held by this log.
     */
    public VerificationResult verifyIntegrity() {
        return verifyChain(List.copyOf(entries));
    }

    /**
     * Verifies a chain of events starting at the genesis hash, such as an exported copy of a log.
     */
    public static VerificationResult verifyChain(List<RegistryEvent> events) {
        List<String> errors = new ArrayList<>();
        long firstBroken = -1;
        String expectedPrevHash = GENESIS_HASH;

        for (int i = 0; i < events.size(); i++) {
            RegistryEvent event = events.get(i);
            boolean broken = false;

            if (event.sequenceNumber() != i) {
                errors.add("Sequence number mismatch at index " + i);
                broken = true;
            }
            if (!event.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
                broken = true;
            }
            String computedHash = computeEntryHash(event.sequenceNumber(), event.previousHash(),
                    event.type(), event.principal(), event.attributes(), event.timestamp());
            if (!event.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i + " - possible tampering");
                broken = true;
            }
            if (broken && firstBroken < 0) {
                firstBroken = i;
            }

            expectedPrevHash = event.entryHash();
        }

        return new VerificationResult(errors.isEmpty(), firstBroken, errors, events.size());
    }

    private static String computeEntryHash(long sequenceNumber, String previousHash, RegistryEventType type,
                                           Principal principal, Map<String, String> attributes, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String data = sequenceNumber + "|" + previousHash + "|" + type + "|" + principal + "|"
                    + new TreeMap<>(attributes) + "|" + timestamp;
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * An event produced by an operation that has not been committed yet.
     */
    public record PendingEvent(RegistryEventType type, Principal principal, Map<String, String> attributes) {
        public PendingEvent {
            Objects.requireNonNull(type, "Type cannot be null");
            Objects.requireNonNull(principal, "Principal cannot be null");
            attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        }
    }

    /**
     * Result of chain verification. {@code firstBrokenSequence} is -1 for an intact chain.
     */
    public record VerificationResult(
            boolean valid,
            long firstBrokenSequence,
            List<String> errors,
            int eventsVerified
    ) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
