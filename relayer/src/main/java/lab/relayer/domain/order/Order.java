package lab.relayer.domain.order;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * The maker's swap intent as reconstructed by the coordinator.
 * Mutated only under the per-order serialization of the coordinator.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public class Order {

    private final String orderId;
    private final String maker;
    private final String receiver;
    private final String srcChain;
    private String destChain;
    private final String srcAsset;
    private String destAsset;
    private final BigInteger srcAmount;
    private BigInteger destAmount;
    private final String secretHash;
    private final Instant timelock;
    private final Instant auctionStart;
    private final Instant auctionEnd;
    private final BigInteger startRate;
    private final BigInteger endRate;

    private OrderStatus status;
    private String srcEscrowId;
    private String destEscrowId;
    private BigInteger executionRate;

    private final Instant createdAt;
    private Instant updatedAt;

    public boolean canTransitionTo(OrderStatus next) {
        return !status.isTerminal() && next.ordinal() > status.ordinal();
    }

    public void transitionTo(OrderStatus next, Instant now) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("invalid order status transition: " + this.status + " -> " + next);
        }
        this.status = next;
        this.updatedAt = now;
    }

    public void recordDestinationEscrow(String chain, String escrowId, String asset, BigInteger amount, Instant now) {
        this.destChain = chain;
        this.destEscrowId = escrowId;
        if (asset != null) {
            this.destAsset = asset;
        }
        if (amount != null) {
            this.destAmount = amount;
        }
        this.updatedAt = now;
    }

    public void recordExecutionRate(BigInteger rate) {
        this.executionRate = rate;
    }

    public boolean hasAuction() {
        return auctionStart != null && auctionEnd != null && auctionEnd.isAfter(auctionStart);
    }

    public Order snapshot() {
        return toBuilder().build();
    }
}
