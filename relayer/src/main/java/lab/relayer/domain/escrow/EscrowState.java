package lab.relayer.domain.escrow;

public enum EscrowState {
    CREATED,
    WITHDRAWN,
    CANCELLED
}
