package com.ayni.core.audit;

import com.ayni.core.TestPrincipals;
import com.ayni.core.audit.RegistryEventLog.PendingEvent;
import com.ayni.core.audit.RegistryEventLog.VerificationResult;
import com.ayni.core.domain.Principal;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ayni.core.TestPrincipals.ALICE;
import static com.ayni.core.TestPrincipals.BOB;
import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for the registry audit log.
 */
class RegistryEventLogPropertyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private RegistryEventLog eventLog;

    @BeforeEach
    void setUp() {
        eventLog = new RegistryEventLog();
    }

    // ==================== Hash Chain Tests ====================

    @Test
    void appendAll_createsHashChain() {
        // Given/When
        List<RegistryEvent> first = eventLog.appendAll(List.of(created(ALICE)), T0);
        List<RegistryEvent> second = eventLog.appendAll(List.of(
                reputation(ALICE, 200), updated(ALICE)), T0.plusSeconds(1));

        // Then
        assertThat(first.get(0).previousHash()).isEqualTo(RegistryEventLog.GENESIS_HASH);
        assertThat(second.get(0).previousHash()).isEqualTo(first.get(0).entryHash());
        assertThat(second.get(1).previousHash()).isEqualTo(second.get(0).entryHash());
        assertThat(eventLog.getLastHash()).isEqualTo(second.get(1).entryHash());
    }

    @Test
    void appendAll_stampsWholeBatchWithOneTimestamp() {
        List<RegistryEvent> batch = eventLog.appendAll(List.of(
                reputation(BOB, 150), updated(BOB)), T0);

        assertThat(batch).extracting(RegistryEvent::timestamp).containsOnly(T0);
        assertThat(batch).extracting(RegistryEvent::sequenceNumber).containsExactly(0L, 1L);
    }

    @Test
    void appendAll_emptyBatchLeavesLogUnchanged() {
        eventLog.appendAll(List.of(), T0);

        assertThat(eventLog.size()).isZero();
        assertThat(eventLog.getLastHash()).isEqualTo(RegistryEventLog.GENESIS_HASH);
    }

    @Test
    void appendAll_createsUniqueHashes() {
        Set<String> hashes = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            hashes.add(eventLog.appendAll(List.of(created(ALICE)), T0).get(0).entryHash());
        }

        assertThat(hashes).hasSize(100);
    }

    /**
     * Property: Sequence numbers are contiguous from zero whatever the batch sizes.
     */
    @Property(tries = 50)
    void sequenceNumbersAreContiguous(@ForAll("batchSizes") List<Integer> batchSizes) {
        RegistryEventLog log = new RegistryEventLog();
        for (int size : batchSizes) {
            List<PendingEvent> batch = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                batch.add(created(TestPrincipals.address(10 + i)));
            }
            log.appendAll(batch, T0);
        }

        List<RegistryEvent> events = log.getEvents();
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i).sequenceNumber()).isEqualTo(i);
        }
        assertThat(log.verifyIntegrity().valid()).isTrue();
    }

    @Provide
    Arbitrary<List<Integer>> batchSizes() {
        return Arbitraries.integers().between(0, 4).list().ofMaxSize(20);
    }

    // ==================== Tamper Detection Tests ====================

    @Test
    void verifyIntegrity_passesForEmptyLog() {
        VerificationResult result = eventLog.verifyIntegrity();

        assertThat(result.valid()).isTrue();
        assertThat(result.firstBrokenSequence()).isEqualTo(-1);
        assertThat(result.eventsVerified()).isZero();
    }

    /**
     * Property: Changing any attribute of any event breaks the chain at that event.
     */
    @Property(tries = 50)
    void tamperedAttributeIsDetected(
            @ForAll @IntRange(min = 1, max = 15) int length,
            @ForAll @IntRange(min = 0, max = 14) int target) {

        Assume.that(target < length);
        RegistryEventLog log = new RegistryEventLog();
        for (int i = 0; i < length; i++) {
            log.appendAll(List.of(reputation(ALICE, 100 + i)), T0.plusSeconds(i));
        }

        List<RegistryEvent> copy = new ArrayList<>(log.getEvents());
        RegistryEvent original = copy.get(target);
        copy.set(target, new RegistryEvent(original.sequenceNumber(), original.type(), original.principal(),
                Map.of("newScore", "1000", "delta", "900"), original.timestamp(),
                original.previousHash(), original.entryHash()));

        VerificationResult result = RegistryEventLog.verifyChain(copy);

        assertThat(result.valid()).isFalse();
        assertThat(result.firstBrokenSequence()).isEqualTo(target);
        assertThat(result.errors()).anyMatch(error -> error.contains("possible tampering"));
        assertThat(log.verifyIntegrity().valid()).isTrue();
    }

    @Test
    void verifyChain_detectsRemovedEvent() {
        for (int i = 0; i < 5; i++) {
            eventLog.appendAll(List.of(created(TestPrincipals.address(20 + i))), T0);
        }
        List<RegistryEvent> copy = new ArrayList<>(eventLog.getEvents());
        copy.remove(2);

        VerificationResult result = RegistryEventLog.verifyChain(copy);

        assertThat(result.valid()).isFalse();
        assertThat(result.firstBrokenSequence()).isEqualTo(2);
    }

    @Test
    void verifyChain_detectsReorderedEvents() {
        eventLog.appendAll(List.of(created(ALICE)), T0);
        eventLog.appendAll(List.of(created(BOB)), T0.plusSeconds(1));
        List<RegistryEvent> copy = new ArrayList<>(eventLog.getEvents());
        RegistryEvent first = copy.get(0);
        copy.set(0, copy.get(1));
        copy.set(1, first);

        VerificationResult result = RegistryEventLog.verifyChain(copy);

        assertThat(result.valid()).isFalse();
        assertThat(result.firstBrokenSequence()).isZero();
    }

    // ==================== Query Tests ====================

    @Test
    void queriesFilterByTypeAndPrincipal() {
        eventLog.appendAll(List.of(created(ALICE)), T0);
        eventLog.appendAll(List.of(created(BOB)), T0);
        eventLog.appendAll(List.of(reputation(ALICE, 200), updated(ALICE)), T0);

        assertThat(eventLog.getEvents(ALICE)).hasSize(3);
        assertThat(eventLog.getEvents(RegistryEventType.IDENTITY_CREATED))
                .extracting(RegistryEvent::principal)
                .containsExactly(ALICE, BOB);
        assertThat(eventLog.getLatestEvents(2))
                .extracting(RegistryEvent::type)
                .containsExactly(RegistryEventType.REPUTATION_UPDATED, RegistryEventType.IDENTITY_UPDATED);
        assertThat(eventLog.getLatestEvents(10)).hasSize(4);
    }

    @Test
    void returnedEventsAreImmutableSnapshots() {
        eventLog.appendAll(List.of(created(ALICE)), T0);
        List<RegistryEvent> snapshot = eventLog.getEvents();

        eventLog.appendAll(List.of(created(BOB)), T0);

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static PendingEvent created(Principal principal) {
        return new PendingEvent(RegistryEventType.IDENTITY_CREATED, principal, Map.of("name", "n"));
    }

    private static PendingEvent updated(Principal principal) {
        return new PendingEvent(RegistryEventType.IDENTITY_UPDATED, principal, Map.of("change", "profile"));
    }

    private static PendingEvent reputation(Principal principal, int score) {
        return new PendingEvent(RegistryEventType.REPUTATION_UPDATED, principal,
                Map.of("newScore", String.valueOf(score), "delta", "0"));
    }
}
