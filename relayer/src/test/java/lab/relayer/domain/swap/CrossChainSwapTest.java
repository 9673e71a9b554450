package lab.relayer.domain.swap;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CrossChainSwapTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void recoveringCanStillComplete() {
        CrossChainSwap swap = CrossChainSwap.initiated("X", NOW);
        swap.transitionTo(SwapStatus.DEST_LOCKED, NOW);
        swap.transitionTo(SwapStatus.RECOVERING, NOW.plusSeconds(5));

        assertThat(swap.getRecoveryStartedAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(swap.canTransitionTo(SwapStatus.COMPLETED)).isTrue();
        assertThat(swap.canTransitionTo(SwapStatus.FAILED)).isTrue();
        assertThat(swap.canTransitionTo(SwapStatus.SECRET_REVEALED)).isFalse();
    }

    @Test
    void destinationTimelockBecomesTheDeadline() {
        CrossChainSwap swap = CrossChainSwap.initiated("X", NOW);
        swap.recordSourceLeg("a", "0xsrc", "0xmaker", "0xhash", NOW.plusSeconds(7200), NOW);
        assertThat(swap.getExecutionDeadline()).isEqualTo(NOW.plusSeconds(7200));

        swap.recordDestinationLeg("b", "0xdst", "0xresolver", "0xhash", NOW.plusSeconds(3600), NOW);
        assertThat(swap.getExecutionDeadline()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(swap.isDestinationLeg("b", "0xDST")).isTrue();
        assertThat(swap.isSourceLeg("b", "0xsrc")).isFalse();
    }

    @Test
    void failRecordsReasonAndFreezes() {
        CrossChainSwap swap = CrossChainSwap.initiated("X", NOW);
        swap.fail("leg cancelled", NOW);

        assertThat(swap.getStatus()).isEqualTo(SwapStatus.FAILED);
        assertThat(swap.getFailureReason()).isEqualTo("leg cancelled");
        assertThat(swap.canTransitionTo(SwapStatus.COMPLETED)).isFalse();
    }
}
