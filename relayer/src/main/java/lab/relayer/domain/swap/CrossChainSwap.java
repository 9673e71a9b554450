package lab.relayer.domain.swap;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Coordinator-side correlation record tying the source and destination legs of one order.
 * Never stored on a ledger; rebuilt from ledger events on replay.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public class CrossChainSwap {

    private final String orderId;
    private String sourceChain;
    private String destChain;
    private String sourceEscrowId;
    private String destEscrowId;
    private String sourceSender;
    private String destSender;
    private String secretHash;
    private String secret;

    private SwapStatus status;
    private boolean counterWithdrawalSubmitted;
    private String failureReason;

    private final Instant createdAt;
    private Instant updatedAt;
    private Instant executionDeadline;
    private Instant recoveryStartedAt;

    public static CrossChainSwap initiated(String orderId, Instant now) {
        return CrossChainSwap.builder()
                .orderId(orderId)
                .status(SwapStatus.INITIATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean canTransitionTo(SwapStatus next) {
        return !status.isTerminal() && next.ordinal() > status.ordinal();
    }

    public void transitionTo(SwapStatus next, Instant now) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("invalid swap status transition: " + this.status + " -> " + next);
        }
        this.status = next;
        this.updatedAt = now;
        if (next == SwapStatus.RECOVERING) {
            this.recoveryStartedAt = now;
        }
    }

    public void recordSourceLeg(String chain, String escrowId, String sender, String secretHash, Instant timelock, Instant now) {
        this.sourceChain = chain;
        this.sourceEscrowId = escrowId;
        this.sourceSender = sender;
        if (this.secretHash == null) {
            this.secretHash = secretHash;
        }
        // the destination timelock takes over once that leg is seen
        if (this.destEscrowId == null) {
            this.executionDeadline = timelock;
        }
        this.updatedAt = now;
    }

    public void linkSourceEscrow(String escrowId) {
        if (this.sourceEscrowId == null) {
            this.sourceEscrowId = escrowId;
        }
    }

    public void recordDestinationLeg(String chain, String escrowId, String sender, String secretHash, Instant deadline, Instant now) {
        this.destChain = chain;
        this.destEscrowId = escrowId;
        this.destSender = sender;
        if (this.secretHash == null) {
            this.secretHash = secretHash;
        }
        this.executionDeadline = deadline;
        this.updatedAt = now;
    }

    public void revealSecret(String secret, Instant now) {
        this.secret = secret;
        this.updatedAt = now;
    }

    public void markCounterWithdrawalSubmitted(Instant now) {
        this.counterWithdrawalSubmitted = true;
        this.updatedAt = now;
    }

    public void fail(String reason, Instant now) {
        transitionTo(SwapStatus.FAILED, now);
        this.failureReason = reason;
    }

    public boolean isSourceLeg(String chain, String escrowId) {
        return escrowId != null && escrowId.equalsIgnoreCase(sourceEscrowId)
                && (chain == null || sourceChain == null || chain.equals(sourceChain));
    }

    public boolean isDestinationLeg(String chain, String escrowId) {
        return escrowId != null && escrowId.equalsIgnoreCase(destEscrowId)
                && (chain == null || destChain == null || chain.equals(destChain));
    }

    public CrossChainSwap snapshot() {
        return toBuilder().build();
    }
}
