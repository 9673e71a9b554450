package lab.relayer.orchestration;

import lab.relayer.MutableClock;
import lab.relayer.domain.checkpoint.ChainCheckpoint;
import lab.relayer.domain.checkpoint.ChainCheckpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckpointTrackerTest {

    @Mock ChainCheckpointRepository repository;

    CheckpointTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new CheckpointTracker(repository, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void safeCheckpoint_isLowestInFlightBlock() {
        tracker.begin("etherlink", 5);
        tracker.begin("etherlink", 7);
        tracker.begin("etherlink", 7);

        assertThat(tracker.safeCheckpoint("etherlink")).isEqualTo(5);
        assertThat(tracker.inFlightCount("etherlink")).isEqualTo(3);

        tracker.complete("etherlink", 5);
        assertThat(tracker.safeCheckpoint("etherlink")).isEqualTo(7);

        tracker.complete("etherlink", 7);
        assertThat(tracker.safeCheckpoint("etherlink")).isEqualTo(7);
        tracker.complete("etherlink", 7);

        assertThat(tracker.inFlightCount("etherlink")).isZero();
        assertThat(tracker.safeCheckpoint("etherlink")).isEqualTo(7);
        assertThat(tracker.safeCheckpoint("monad")).isZero();
    }

    @Test
    void persist_storesSafeBlock() {
        when(repository.findById("etherlink")).thenReturn(Optional.empty());
        tracker.begin("etherlink", 12);

        tracker.persistAll();

        ArgumentCaptor<ChainCheckpoint> saved = ArgumentCaptor.forClass(ChainCheckpoint.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getChain()).isEqualTo("etherlink");
        assertThat(saved.getValue().getSafeBlock()).isEqualTo(12);
    }

    @Test
    void loadPersisted_readsRepository() {
        when(repository.findById("monad")).thenReturn(Optional.of(
                ChainCheckpoint.builder().chain("monad").safeBlock(42).updatedAt(Instant.EPOCH).build()));

        assertThat(tracker.loadPersisted("monad")).contains(42L);
    }
}
