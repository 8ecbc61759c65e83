package com.ayni.core.registry;

import com.ayni.core.audit.RegistryEvent;
import com.ayni.core.audit.RegistryEventLog;
import com.ayni.core.audit.RegistryEventLog.PendingEvent;
import com.ayni.core.audit.RegistryEventType;
import com.ayni.core.error.CredentialIndexOutOfRangeException;
import com.ayni.core.error.IdentityAlreadyExistsException;
import com.ayni.core.error.IdentityNotFoundException;
import com.ayni.core.error.InvalidRegistryInputException;
import com.ayni.core.error.RegistryAccessDeniedException;
import com.ayni.core.error.RegistryException;
import com.ayni.core.domain.Credential;
import com.ayni.core.domain.Identity;
import com.ayni.core.domain.Principal;
import com.ayni.core.domain.RegistryStats;
import com.ayni.core.domain.SubjectState;
import com.ayni.core.journal.JournalException;
import com.ayni.core.journal.RegistryJournal;
import com.ayni.core.reputation.ReputationEngine;
import com.ayni.core.store.CredentialStore;
import com.ayni.core.store.IdentityStore;
import com.ayni.core.store.InMemoryCredentialStore;
import com.ayni.core.store.InMemoryIdentityStore;
import com.ayni.core.store.InMemoryTrustedIssuerStore;
import com.ayni.core.store.TrustedIssuerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Identity Registry - the only write path into identity, credential and issuer state.
 *
 * Every mutation runs in three phases under a single writer lock:
 * - plan: authorization, existence and input checks, then the writes and events to perform
 * - journal: the transaction is appended to the durable journal
 * - commit: the writes are applied and the events appended to the audit log
 *
 * A rejected transaction fails in the plan phase and leaves nothing behind.
 * Single-store queries read the stores directly and never take a lock. Queries spanning
 * stores ({@link #getSubjectState}, {@link #getRegistryStats}) share a read lock with the
 * commit phase, so they never observe a transaction half applied.
 *
 * Roles are checked independently:
 * - owner: trusted issuer management
 * - self: profile updates
 * - trusted issuer: verification, credential issuance and revocation
 */
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    public static final String UNKNOWN_ISSUER = "Unknown Issuer";

    private final Principal owner;
    private final IdentityStore identityStore;
    private final CredentialStore credentialStore;
    private final TrustedIssuerStore trustedIssuerStore;
    private final RegistryEventLog eventLog;
    private final RegistryJournal journal;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ReentrantReadWriteLock publishLock = new ReentrantReadWriteLock();

    public IdentityRegistry(Principal owner,
                            IdentityStore identityStore,
                            CredentialStore credentialStore,
                            TrustedIssuerStore trustedIssuerStore,
                            RegistryEventLog eventLog,
                            RegistryJournal journal,
                            Clock clock) {
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        this.identityStore = Objects.requireNonNull(identityStore, "Identity store cannot be null");
        this.credentialStore = Objects.requireNonNull(credentialStore, "Credential store cannot be null");
        this.trustedIssuerStore = Objects.requireNonNull(trustedIssuerStore, "Trusted issuer store cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log cannot be null");
        this.journal = Objects.requireNonNull(journal, "Journal cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");

        // Owner bootstrap
        trustedIssuerStore.setTrusted(owner, true);
    }

    /**
     * Registry over fresh in-memory stores and an empty event log.
     */
    public static IdentityRegistry inMemory(Principal owner, RegistryJournal journal, Clock clock) {
        return new IdentityRegistry(owner,
                new InMemoryIdentityStore(),
                new InMemoryCredentialStore(),
                new InMemoryTrustedIssuerStore(),
                new RegistryEventLog(),
                journal,
                clock);
    }

    // ==================== Identity Operations ====================

    /**
     * Creates the caller's identity with the initial reputation score.
     */
    public List<RegistryEvent> createIdentity(Principal caller, String name, String email, String profileHash) {
        return submit(stamp(caller, new RegistryOperation.CreateIdentity(name, email, profileHash)));
    }

    /**
     * Overwrites name, email and profile hash. Only the subject itself may call this.
     */
    public List<RegistryEvent> updateProfile(Principal caller, Principal subject,
                                             String name, String email, String profileHash) {
        return submit(stamp(caller, new RegistryOperation.UpdateProfile(subject, name, email, profileHash)));
    }

    /**
     * Sets or clears the verified flag. Trusted issuers only.
     */
    public List<RegistryEvent> verifyIdentity(Principal caller, Principal subject, boolean verified) {
        return submit(stamp(caller, new RegistryOperation.SetVerification(subject, verified)));
    }

    // ==================== Credential Operations ====================

    /**
     * Issues a credential to {@code subject}. Trusted issuers only.
     *
     * @param expiresAt {@link Credential#NEVER_EXPIRES} (or {@code null}) for a non-expiring credential,
     *                  otherwise strictly after the transaction time
     */
    public List<RegistryEvent> addCredential(Principal caller, Principal subject, String credentialType,
                                             String credentialHash, Instant expiresAt) {
        return submit(stamp(caller,
                new RegistryOperation.AddCredential(subject, credentialType, credentialHash, expiresAt)));
    }

    /**
     * Revokes the credential at {@code index}. Revoking an already revoked credential
     * is accepted and applies the penalty again.
     */
    public List<RegistryEvent> revokeCredential(Principal caller, Principal subject, int index) {
        return submit(stamp(caller, new RegistryOperation.RevokeCredential(subject, index)));
    }

    // ==================== Issuer Management ====================

    public List<RegistryEvent> addTrustedIssuer(Principal caller, Principal issuer) {
        return submit(stamp(caller, new RegistryOperation.AddTrustedIssuer(issuer)));
    }

    /**
     * Removes issuer trust. The owner can never be removed.
     */
    public List<RegistryEvent> removeTrustedIssuer(Principal caller, Principal issuer) {
        return submit(stamp(caller, new RegistryOperation.RemoveTrustedIssuer(issuer)));
    }

    // ==================== Transactions ====================

    /**
     * Applies one transaction and returns the events it emitted, in emission order.
     *
     * @throws RegistryException if the transaction is rejected
     * @throws JournalException  if the transaction could not be journaled; state is untouched
     */
    public List<RegistryEvent> submit(RegistryTransaction transaction) {
        Objects.requireNonNull(transaction, "Transaction cannot be null");
        writeLock.lock();
        try {
            Mutation mutation = plan(transaction);
            journal.append(transaction);
            List<RegistryEvent> events = commit(mutation, transaction.timestamp());
            log.debug("Committed {} from {} with {} events",
                    transaction.operationName(), transaction.caller(), events.size());
            return events;
        } catch (RegistryException e) {
            log.info("Rejected {} from {}: {} ({})",
                    transaction.operationName(), transaction.caller(), e.getMessage(), e.getKind());
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Re-applies journaled transactions to a freshly bootstrapped registry.
     * Transactions are not journaled again.
     *
     * @return number of transactions applied
     * @throws JournalException if a transaction is rejected, meaning the journal diverged
     */
    public int replay(List<RegistryTransaction> transactions) {
        Objects.requireNonNull(transactions, "Transactions cannot be null");
        writeLock.lock();
        try {
            if (eventLog.size() > 0) {
                throw new IllegalStateException("Replay requires a registry with no committed transactions");
            }
            int applied = 0;
            for (RegistryTransaction transaction : transactions) {
                try {
                    commit(plan(transaction), transaction.timestamp());
                } catch (RegistryException e) {
                    throw new JournalException("Journal diverged at transaction " + applied
                            + " (" + transaction.operationName() + "): " + e.getMessage(), e);
                }
                applied++;
            }
            log.info("Replayed {} registry transactions, {} identities, {} audit events",
                    applied, identityStore.totalIdentities(), eventLog.size());
            return applied;
        } finally {
            writeLock.unlock();
        }
    }

    private RegistryTransaction stamp(Principal caller, RegistryOperation operation) {
        return new RegistryTransaction(caller, clock.instant(), operation);
    }

    private Mutation plan(RegistryTransaction transaction) {
        Principal caller = transaction.caller();
        Instant now = transaction.timestamp();
        RegistryOperation operation = transaction.operation();

        if (operation instanceof RegistryOperation.CreateIdentity op) {
            return planCreateIdentity(caller, op, now);
        } else if (operation instanceof RegistryOperation.UpdateProfile op) {
            return planUpdateProfile(caller, op, now);
        } else if (operation instanceof RegistryOperation.SetVerification op) {
            return planSetVerification(caller, op, now);
        } else if (operation instanceof RegistryOperation.AddCredential op) {
            return planAddCredential(caller, op, now);
        } else if (operation instanceof RegistryOperation.RevokeCredential op) {
            return planRevokeCredential(caller, op, now);
        } else if (operation instanceof RegistryOperation.AddTrustedIssuer op) {
            return planAddTrustedIssuer(caller, op);
        } else if (operation instanceof RegistryOperation.RemoveTrustedIssuer op) {
            return planRemoveTrustedIssuer(caller, op);
        }
        throw new IllegalArgumentException("Unsupported operation: " + transaction.operationName());
    }

    private List<RegistryEvent> commit(Mutation mutation, Instant timestamp) {
        publishLock.writeLock().lock();
        try {
            mutation.writes.forEach(Runnable::run);
            return eventLog.appendAll(mutation.events, timestamp);
        } finally {
            publishLock.writeLock().unlock();
        }
    }

    private Mutation planCreateIdentity(Principal caller, RegistryOperation.CreateIdentity op, Instant now) {
        if (identityStore.exists(caller)) {
            throw new IdentityAlreadyExistsException("Identity already exists for " + caller);
        }
        requireText(op.name(), "Name");
        requireText(op.email(), "Email");

        Identity identity = Identity.create(caller, op.name(), op.email(), op.profileHash(),
                ReputationEngine.INITIAL_REPUTATION_SCORE, now);
        return new Mutation()
                .write(() -> identityStore.insert(identity))
                .emit(RegistryEventType.IDENTITY_CREATED, caller, Map.of("name", op.name()));
    }

    private Mutation planUpdateProfile(Principal caller, RegistryOperation.UpdateProfile op, Instant now) {
        Principal subject = requirePrincipal(op.subject(), "Subject");
        if (!caller.equals(subject)) {
            throw new RegistryAccessDeniedException("Only " + subject + " may update its own profile");
        }
        Identity current = requireIdentity(subject);
        requireText(op.name(), "Name");
        requireText(op.email(), "Email");

        Identity updated = current.withProfile(op.name(), op.email(), op.profileHash(), now);
        return new Mutation()
                .write(() -> identityStore.update(updated))
                .emit(RegistryEventType.IDENTITY_UPDATED, subject, Map.of("change", "profile"));
    }

    private Mutation planSetVerification(Principal caller, RegistryOperation.SetVerification op, Instant now) {
        requireTrustedIssuer(caller);
        Principal subject = requirePrincipal(op.subject(), "Subject");
        Identity current = requireIdentity(subject);

        int delta = ReputationEngine.verificationDelta(op.verified());
        int newScore = ReputationEngine.applyDelta(current.reputationScore(), delta);
        Identity updated = current.withVerified(op.verified(), now).withReputationScore(newScore, now);

        Mutation mutation = new Mutation().write(() -> identityStore.update(updated));
        emitReputation(mutation, subject, newScore, delta);
        return mutation.emit(RegistryEventType.IDENTITY_UPDATED, subject, Map.of(
                "change", "verification",
                "verified", String.valueOf(op.verified()),
                "verifiedBy", caller.toString()));
    }

    private Mutation planAddCredential(Principal caller, RegistryOperation.AddCredential op, Instant now) {
        requireTrustedIssuer(caller);
        Principal subject = requirePrincipal(op.subject(), "Subject");
        Identity current = requireIdentity(subject);
        requireText(op.credentialType(), "Credential type");
        requireText(op.credentialHash(), "Credential hash");

        Instant expiresAt = op.expiresAt() != null ? op.expiresAt() : Credential.NEVER_EXPIRES;
        if (!Credential.NEVER_EXPIRES.equals(expiresAt) && !expiresAt.isAfter(now)) {
            throw new InvalidRegistryInputException("Expiration " + expiresAt + " must be after " + now);
        }

        // Snapshot of the issuer's name at issuance
        String issuerName = identityStore.find(caller).map(Identity::name).orElse(UNKNOWN_ISSUER);
        Credential credential = Credential.issue(op.credentialType(), issuerName, op.credentialHash(), now, expiresAt);
        int index = credentialStore.count(subject);

        int delta = ReputationEngine.CREDENTIAL_ADDED_DELTA;
        int newScore = ReputationEngine.applyDelta(current.reputationScore(), delta);
        Identity updated = current.withReputationScore(newScore, now);

        Mutation mutation = new Mutation()
                .write(() -> credentialStore.append(subject, credential))
                .write(() -> identityStore.update(updated));
        emitReputation(mutation, subject, newScore, delta);
        return mutation.emit(RegistryEventType.CREDENTIAL_ADDED, subject, Map.of(
                "index", String.valueOf(index),
                "credentialType", op.credentialType(),
                "issuer", caller.toString(),
                "issuerName", issuerName));
    }

    private Mutation planRevokeCredential(Principal caller, RegistryOperation.RevokeCredential op, Instant now) {
        requireTrustedIssuer(caller);
        Principal subject = requirePrincipal(op.subject(), "Subject");
        Credential credential = credentialStore.find(subject, op.index())
                .orElseThrow(() -> new CredentialIndexOutOfRangeException("Credential index " + op.index()
                        + " out of range for " + subject + " (" + credentialStore.count(subject) + " credentials)"));
        Identity current = requireIdentity(subject);

        int delta = ReputationEngine.CREDENTIAL_REVOKED_DELTA;
        int newScore = ReputationEngine.applyDelta(current.reputationScore(), delta);
        Identity updated = current.withReputationScore(newScore, now);

        Mutation mutation = new Mutation()
                .write(() -> credentialStore.replace(subject, op.index(), credential.revoke()))
                .write(() -> identityStore.update(updated));
        emitReputation(mutation, subject, newScore, delta);
        return mutation.emit(RegistryEventType.CREDENTIAL_REVOKED, subject, Map.of(
                "index", String.valueOf(op.index()),
                "revokedBy", caller.toString()));
    }

    private Mutation planAddTrustedIssuer(Principal caller, RegistryOperation.AddTrustedIssuer op) {
        requireOwner(caller);
        Principal issuer = requirePrincipal(op.issuer(), "Issuer");
        return new Mutation()
                .write(() -> trustedIssuerStore.setTrusted(issuer, true))
                .emit(RegistryEventType.TRUSTED_ISSUER_ADDED, issuer, Map.of("addedBy", caller.toString()));
    }

    private Mutation planRemoveTrustedIssuer(Principal caller, RegistryOperation.RemoveTrustedIssuer op) {
        requireOwner(caller);
        Principal issuer = requirePrincipal(op.issuer(), "Issuer");
        if (issuer.equals(owner)) {
            throw new RegistryAccessDeniedException("The owner cannot be removed from the trusted issuer set");
        }
        return new Mutation()
                .write(() -> trustedIssuerStore.setTrusted(issuer, false))
                .emit(RegistryEventType.TRUSTED_ISSUER_REMOVED, issuer, Map.of("removedBy", caller.toString()));
    }

    private void emitReputation(Mutation mutation, Principal subject, int newScore, int delta) {
        mutation.emit(RegistryEventType.REPUTATION_UPDATED, subject, Map.of(
                "newScore", String.valueOf(newScore),
                "delta", String.valueOf(delta)));
    }

    // ==================== Authorization & Validation ====================

    private void requireOwner(Principal caller) {
        if (!owner.equals(caller)) {
            throw new RegistryAccessDeniedException("Only the owner may manage trusted issuers, not " + caller);
        }
    }

    private void requireTrustedIssuer(Principal caller) {
        if (!trustedIssuerStore.isTrusted(caller)) {
            throw new RegistryAccessDeniedException(caller + " is not a trusted issuer");
        }
    }

    private Identity requireIdentity(Principal principal) {
        return identityStore.find(principal)
                .orElseThrow(() -> new IdentityNotFoundException("No identity for " + principal));
    }

    private static Principal requirePrincipal(Principal principal, String field) {
        if (principal == null) {
            throw new InvalidRegistryInputException(field + " is required");
        }
        return principal;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRegistryInputException(field + " cannot be empty");
        }
    }

    // ==================== Queries ====================

    public Principal getOwner() {
        return owner;
    }

    public Optional<Identity> getIdentity(Principal principal) {
        return identityStore.find(principal);
    }

    /**
     * The subject's identity and credentials as of the same committed transaction.
     */
    public Optional<SubjectState> getSubjectState(Principal subject) {
        publishLock.readLock().lock();
        try {
            return identityStore.find(subject)
                    .map(identity -> new SubjectState(identity, credentialStore.findAll(subject)));
        } finally {
            publishLock.readLock().unlock();
        }
    }

    public boolean hasIdentity(Principal principal) {
        return identityStore.exists(principal);
    }

    /**
     * @throws CredentialIndexOutOfRangeException if {@code index} is past the end of the sequence
     */
    public Credential getCredential(Principal subject, int index) {
        return credentialStore.find(subject, index)
                .orElseThrow(() -> new CredentialIndexOutOfRangeException("Credential index " + index
                        + " out of range for " + subject));
    }

    public List<Credential> getCredentials(Principal subject) {
        return credentialStore.findAll(subject);
    }

    public int getCredentialsCount(Principal subject) {
        return credentialStore.count(subject);
    }

    /**
     * False for an out-of-range index, otherwise not revoked and not expired at the clock's current time.
     */
    public boolean isCredentialValid(Principal subject, int index) {
        Instant now = clock.instant();
        return credentialStore.find(subject, index)
                .map(credential -> credential.isValidAt(now))
                .orElse(false);
    }

    public boolean isTrustedIssuer(Principal principal) {
        return trustedIssuerStore.isTrusted(principal);
    }

    public Set<Principal> getTrustedIssuers() {
        return trustedIssuerStore.trustedIssuers();
    }

    /**
     * Total number of identities ever created.
     */
    public long getTotalIdentities() {
        return identityStore.totalIdentities();
    }

    public RegistryStats getRegistryStats() {
        publishLock.readLock().lock();
        try {
            return new RegistryStats(identityStore.totalIdentities(),
                    trustedIssuerStore.trustedIssuers().size(),
                    eventLog.size());
        } finally {
            publishLock.readLock().unlock();
        }
    }

    public List<RegistryEvent> getAuditEvents() {
        return eventLog.getEvents();
    }

    public List<RegistryEvent> getAuditEvents(Principal principal) {
        return eventLog.getEvents(principal);
    }

    public List<RegistryEvent> getAuditEvents(RegistryEventType type) {
        return eventLog.getEvents(type);
    }

    public RegistryEventLog.VerificationResult verifyAuditChain() {
        return eventLog.verifyIntegrity();
    }

    /**
     * Writes and events collected while planning a transaction.
     */
    private static final class Mutation {
        private final List<Runnable> writes = new ArrayList<>();
        private final List<PendingEvent> events = new ArrayList<>();

        Mutation write(Runnable write) {
            writes.add(write);
            return this;
        }

        Mutation emit(RegistryEventType type, Principal principal, Map<String, String> attributes) {
            events.add(new PendingEvent(type, principal, attributes));
            return this;
        }
    }
}
