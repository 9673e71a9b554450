package lab.relayer.adapter;

public enum EscrowEventType {
    ESCROW_CREATED,
    ESCROW_WITHDRAWN,
    ESCROW_CANCELLED,
    AUCTION_RATE_UPDATED
}
