package votetally.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import votetally.api.domain.TallyEntry;
import votetally.api.domain.TallyResult;
import votetally.api.domain.VoteRecord;
import votetally.api.repository.StorageBackend;
import votetally.api.repository.StorageException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VoteService Tests")
class VoteServiceTest {

    private RecordingBackend backend;
    private RecordingListener listener;
    private VoteService voteService;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        listener = new RecordingListener();
        voteService = new VoteService(backend, new VoterIdGenerator(), listener, List.of("Cats", "Dogs"), false);
    }

    @Nested
    @DisplayName("Nominal Flow - Submit Vote")
    class NominalFlow {

        @Test
        @DisplayName("Should write a record with a hex voter id and the submitted choice")
        void shouldWriteRecord() {
            // When
            VoteRecord record = voteService.submitVote("Cats");

            // Then
            assertThat(record.voterId()).matches("[0-9a-f]{16}");
            assertThat(record.choice()).isEqualTo("Cats");
            assertThat(record.createdAt()).isNotNull();
            assertThat(backend.written).containsExactly(record);
            assertThat(listener.accepted).containsExactly(record);
        }

        @Test
        @DisplayName("Should append twice for the same choice with distinct voter ids")
        void shouldNotDeduplicate() {
            // When
            VoteRecord first = voteService.submitVote("Dogs");
            VoteRecord second = voteService.submitVote("Dogs");

            // Then
            assertThat(first.voterId()).isNotEqualTo(second.voterId());
            assertThat(voteService.getTally().countFor("Dogs")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should accept a choice outside the configured options when not enforced")
        void shouldAcceptUnlistedChoice() {
            VoteRecord record = voteService.submitVote("Parrots");

            assertThat(record.choice()).isEqualTo("Parrots");
            assertThat(backend.written).hasSize(1);
        }

        @Test
        @DisplayName("Should accept an empty string as a literal choice")
        void shouldAcceptEmptyChoice() {
            VoteRecord record = voteService.submitVote("");

            assertThat(record.choice()).isEmpty();
            assertThat(voteService.getTally().countFor("")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Edge Case - Invalid Submissions")
    class InvalidSubmissions {

        @Test
        @DisplayName("Should reject a missing vote without writing")
        void shouldRejectMissingVote() {
            assertThatThrownBy(() -> voteService.submitVote(null))
                    .isInstanceOf(InvalidVoteException.class)
                    .hasMessageContaining("vote");

            assertThat(backend.written).isEmpty();
            assertThat(listener.rejected).hasSize(1);
        }

        @Test
        @DisplayName("Should reject unlisted choices when options are enforced")
        void shouldRejectUnlistedChoiceWhenEnforced() {
            // Given
            VoteService strict = new VoteService(backend, new VoterIdGenerator(), listener,
                    List.of("Cats", "Dogs"), true);

            // When/Then
            assertThatThrownBy(() -> strict.submitVote("Parrots"))
                    .isInstanceOf(InvalidVoteException.class)
                    .hasMessageContaining("Cats");
            assertThat(strict.submitVote("Cats").choice()).isEqualTo("Cats");
            assertThat(backend.written).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Edge Case - Storage Failures")
    class StorageFailures {

        @Test
        @DisplayName("Should propagate a write failure unchanged and report it")
        void shouldPropagateWriteFailure() {
            // Given
            StorageException failure = StorageException.unavailable("down", null);
            backend.failure = failure;

            // When/Then
            assertThatThrownBy(() -> voteService.submitVote("Cats")).isSameAs(failure);
            assertThat(listener.failures).containsExactly("write:UNAVAILABLE");
            assertThat(listener.accepted).isEmpty();
        }

        @Test
        @DisplayName("Should propagate a tally failure unchanged and report it")
        void shouldPropagateTallyFailure() {
            // Given
            StorageException failure = StorageException.unavailable("down", null);
            backend.failure = failure;

            // When/Then
            assertThatThrownBy(() -> voteService.getTally()).isSameAs(failure);
            assertThat(listener.failures).containsExactly("tally:UNAVAILABLE");
        }
    }

    static class RecordingBackend implements StorageBackend {

        final List<VoteRecord> written = new ArrayList<>();
        StorageException failure;

        @Override
        public synchronized void write(VoteRecord record) {
            if (failure != null) {
                throw failure;
            }
            written.add(record);
        }

        @Override
        public synchronized TallyResult tally() {
            if (failure != null) {
                throw failure;
            }
            Map<String, Long> counts = new LinkedHashMap<>();
            written.forEach(record -> counts.merge(record.choice(), 1L, Long::sum));
            List<TallyEntry> entries = new ArrayList<>();
            counts.forEach((choice, count) -> entries.add(new TallyEntry(choice, count)));
            return new TallyResult(entries);
        }
    }

    static class RecordingListener implements VoteEventListener {

        final List<VoteRecord> accepted = new ArrayList<>();
        final List<String> rejected = new ArrayList<>();
        final List<String> failures = new ArrayList<>();

        @Override
        public void onAccepted(VoteRecord record) {
            accepted.add(record);
        }

        @Override
        public void onRejected(String reason) {
            rejected.add(reason);
        }

        @Override
        public void onStorageFailure(String operation, StorageException failure) {
            failures.add(operation + ":" + failure.getKind());
        }
    }
}
