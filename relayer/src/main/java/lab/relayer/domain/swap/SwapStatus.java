package lab.relayer.domain.swap;

public enum SwapStatus {
    INITIATED,
    SOURCE_LOCKED,
    DEST_LOCKED,
    SECRET_REVEALED,
    RECOVERING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
