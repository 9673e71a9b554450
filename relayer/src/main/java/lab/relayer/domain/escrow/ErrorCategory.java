package lab.relayer.domain.escrow;

public enum ErrorCategory {
    VALIDATION,
    STATE_CONFLICT,
    AUTHORIZATION,
    TIMING,
    PROTOCOL_VIOLATION,
    TRANSIENT_NETWORK
}
