package lab.relayer.common;

import java.time.Instant;

public record RelayerNotification(
        Type type,
        String orderId,
        String chain,
        Instant timestamp,
        Object payload
) {

    public enum Type {
        ESCROW_EVENT,
        SWAP_COMPLETED,
        AUCTION_UPDATE,
        RECOVERY_STARTED,
        CANCEL_AVAILABLE
    }
}
