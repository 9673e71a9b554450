package lab.relayer.domain.order;

public enum OrderStatus {
    PENDING,
    AUCTION_ACTIVE,
    ACCEPTED,
    EXECUTING,
    COMPLETED,
    CANCELLED,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return ordinal() >= COMPLETED.ordinal();
    }
}
