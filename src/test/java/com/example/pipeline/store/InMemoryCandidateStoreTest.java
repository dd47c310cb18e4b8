package com.example.pipeline.store;

import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusChangeSource;
import com.example.pipeline.model.StatusHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.pipeline.CandidateFixtures.NOW;
import static com.example.pipeline.CandidateFixtures.RECRUITER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryCandidateStore")
class InMemoryCandidateStoreTest {

    private InMemoryCandidateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        store.add(Candidate.newCandidate("C100", "Ada Lovelace", NOW.minusDays(3)));
    }

    private static StatusHistoryEntry entry(CandidateStatus from, CandidateStatus to) {
        return StatusHistoryEntry.create(from, to, NOW, RECRUITER, null, null, StatusChangeSource.MANUAL);
    }

    @Test
    @DisplayName("Should swap status and append the entry when the expected status matches")
    void shouldSwapWhenExpectedMatches() {
        // When
        boolean swapped = store.compareAndSwapStatus("C100", CandidateStatus.APPLIED,
                entry(CandidateStatus.APPLIED, CandidateStatus.OFFER), CandidateStatus.OFFER);

        // Then
        assertThat(swapped).isTrue();
        Candidate stored = store.findById("C100").orElseThrow();
        assertThat(stored.currentStatus()).isEqualTo(CandidateStatus.OFFER);
        assertThat(stored.statusHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Should leave the candidate untouched when the expected status is stale")
    void shouldNotSwapWhenExpectedIsStale() {
        boolean swapped = store.compareAndSwapStatus("C100", CandidateStatus.OFFER,
                entry(CandidateStatus.OFFER, CandidateStatus.HIRED), CandidateStatus.HIRED);

        assertThat(swapped).isFalse();
        Candidate stored = store.findById("C100").orElseThrow();
        assertThat(stored.currentStatus()).isEqualTo(CandidateStatus.APPLIED);
        assertThat(stored.statusHistory()).isEmpty();
    }

    @Test
    @DisplayName("Should return false for an unknown candidate")
    void shouldNotSwapUnknownCandidate() {
        assertThat(store.compareAndSwapStatus("missing", CandidateStatus.APPLIED,
                entry(CandidateStatus.APPLIED, CandidateStatus.OFFER), CandidateStatus.OFFER)).isFalse();
    }

    @Test
    @DisplayName("Should not swap the status of a soft-deleted candidate")
    void shouldNotSwapDeletedCandidate() {
        // Given
        store.softDelete("C100");

        // When
        boolean swapped = store.compareAndSwapStatus("C100", CandidateStatus.APPLIED,
                entry(CandidateStatus.APPLIED, CandidateStatus.OFFER), CandidateStatus.OFFER);

        // Then
        assertThat(swapped).isFalse();
        Candidate stored = store.findById("C100").orElseThrow();
        assertThat(stored.currentStatus()).isEqualTo(CandidateStatus.APPLIED);
        assertThat(stored.statusHistory()).isEmpty();
    }

    @Test
    @DisplayName("Should compare a missing stored status as the initial status")
    void shouldSwapFromMissingStatus() {
        store.add(new Candidate("C200", "No Status", NOW, null, List.of(), false));

        boolean swapped = store.compareAndSwapStatus("C200", CandidateStatus.APPLIED,
                entry(CandidateStatus.APPLIED, CandidateStatus.OFFER), CandidateStatus.OFFER);

        assertThat(swapped).isTrue();
        assertThat(store.findById("C200").orElseThrow().currentStatus()).isEqualTo(CandidateStatus.OFFER);
    }

    @Test
    @DisplayName("Should repair a missing status only once")
    void shouldRepairMissingStatusOnce() {
        store.add(new Candidate("C200", "No Status", NOW, null, List.of(), false));

        assertThat(store.repairMissingStatus("C200", CandidateStatus.APPLIED)).isTrue();
        assertThat(store.repairMissingStatus("C200", CandidateStatus.OFFER)).isFalse();
        assertThat(store.repairMissingStatus("C100", CandidateStatus.OFFER)).isFalse();
        assertThat(store.findById("C200").orElseThrow().currentStatus()).isEqualTo(CandidateStatus.APPLIED);
        assertThat(store.findById("C100").orElseThrow().currentStatus()).isEqualTo(CandidateStatus.APPLIED);
    }

    @Test
    @DisplayName("Should reject an entry whose status differs from the target status")
    void shouldRejectMismatchedEntry() {
        assertThatThrownBy(() -> store.compareAndSwapStatus("C100", CandidateStatus.APPLIED,
                entry(CandidateStatus.APPLIED, CandidateStatus.OFFER), CandidateStatus.HIRED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should only initialise history on an empty ledger")
    void shouldInitializeHistoryOnce() {
        assertThat(store.initializeHistory("C100", entry(null, CandidateStatus.APPLIED))).isTrue();
        assertThat(store.initializeHistory("C100", entry(null, CandidateStatus.APPLIED))).isFalse();
        assertThat(store.findById("C100").orElseThrow().statusHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Should refuse duplicate ids and hide soft-deleted candidates from active listings")
    void shouldHandleDuplicatesAndSoftDelete() {
        // Given
        store.add(Candidate.newCandidate("C050", "Grace Hopper", NOW));

        // When
        boolean duplicate = store.add(Candidate.newCandidate("C100", "Someone Else", NOW));
        boolean deleted = store.softDelete("C050");

        // Then
        assertThat(duplicate).isFalse();
        assertThat(deleted).isTrue();
        assertThat(store.findAll(true)).extracting(Candidate::candidateId).containsExactly("C100");
        assertThat(store.findAll(false)).extracting(Candidate::candidateId).containsExactly("C050", "C100");
        assertThat(store.findById("C050").orElseThrow().deleted()).isTrue();
        assertThat(store.softDelete("missing")).isFalse();
    }

    @Test
    @DisplayName("Should trim the ledger to the configured history limit")
    void shouldApplyHistoryLimit() {
        InMemoryCandidateStore small = new InMemoryCandidateStore(3);
        small.add(Candidate.newCandidate("C1", "Limited", NOW));
        CandidateStatus status = CandidateStatus.APPLIED;
        for (int i = 0; i < 5; i++) {
            CandidateStatus next = status == CandidateStatus.APPLIED ? CandidateStatus.OFFER : CandidateStatus.APPLIED;
            assertThat(small.compareAndSwapStatus("C1", status, entry(status, next), next)).isTrue();
            status = next;
        }

        Candidate stored = small.findById("C1").orElseThrow();
        assertThat(stored.statusHistory()).hasSize(3);
        assertThat(stored.currentStatus()).isEqualTo(status);
    }
}
