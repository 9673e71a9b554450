package lab.relayer.domain.escrow;

public enum EscrowErrorCode {
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    INVALID_ORDER_ID(ErrorCategory.VALIDATION),
    INVALID_SECRET_HASH(ErrorCategory.VALIDATION),
    TIMELOCK_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    INVALID_AUCTION_PARAMETERS(ErrorCategory.VALIDATION),
    INSUFFICIENT_FUNDS(ErrorCategory.VALIDATION),
    NOT_FOUND(ErrorCategory.VALIDATION),
    ALREADY_EXISTS(ErrorCategory.STATE_CONFLICT),
    ALREADY_WITHDRAWN(ErrorCategory.STATE_CONFLICT),
    ALREADY_CANCELLED(ErrorCategory.STATE_CONFLICT),
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
    TIMELOCK_NOT_EXPIRED(ErrorCategory.TIMING),
    INVALID_SECRET(ErrorCategory.PROTOCOL_VIOLATION);

    private final ErrorCategory category;

    EscrowErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
