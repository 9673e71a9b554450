package lab.relayer.domain.escrow;

import lombok.Getter;

/**
 * Rejection raised by the escrow ledger. Thrown before any state is mutated.
 */
@Getter
public class EscrowException extends RuntimeException {

    private final EscrowErrorCode code;

    public EscrowException(EscrowErrorCode code, String message) {
        super(code + ": " + message);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }
}
