package lab.relayer.domain.escrow;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One locked leg of a swap on a single chain.
 * <p>
 * {@code withdrawn} and {@code cancelled} are set at most once and never both.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public class Escrow {

    private final String escrowId;
    private final String sender;
    private final String receiver;
    private final String resolver;
    private final BigInteger amount;
    private final String asset;
    private final String secretHash;
    private final Instant timelock;
    private final String orderId;
    private final Instant createdAt;
    private final Instant auctionStart;
    private final Instant auctionEnd;
    private final BigInteger startRate;
    private final BigInteger endRate;
    private final boolean resolverLeg;
    private final String pairedEscrowId;

    private boolean withdrawn;
    private boolean cancelled;

    public EscrowState getState() {
        if (withdrawn) {
            return EscrowState.WITHDRAWN;
        }
        if (cancelled) {
            return EscrowState.CANCELLED;
        }
        return EscrowState.CREATED;
    }

    public boolean isTerminal() {
        return withdrawn || cancelled;
    }

    public boolean hasAuction() {
        return auctionEnd.isAfter(auctionStart);
    }

    public void markWithdrawn() {
        ensureOpen();
        this.withdrawn = true;
    }

    public void markCancelled() {
        ensureOpen();
        this.cancelled = true;
    }

    // Detached copy handed out to adapters and observers.
    public Escrow snapshot() {
        return toBuilder().build();
    }

    private void ensureOpen() {
        if (withdrawn) {
            throw new EscrowException(EscrowErrorCode.ALREADY_WITHDRAWN, "escrow already withdrawn: " + escrowId);
        }
        if (cancelled) {
            throw new EscrowException(EscrowErrorCode.ALREADY_CANCELLED, "escrow already cancelled: " + escrowId);
        }
    }
}
