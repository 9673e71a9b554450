package lab.relayer.adapter;

import lab.relayer.domain.escrow.EscrowErrorCode;

/**
 * The transaction was included but rejected by the escrow ledger.
 */
public class TransactionRevertedException extends LedgerAdapterException {

    private final String txHash;
    private final EscrowErrorCode errorCode;

    public TransactionRevertedException(String chain, String txHash, EscrowErrorCode errorCode, String reason) {
        super(chain, "tx " + txHash + " reverted on " + chain + ": " + reason);
        this.txHash = txHash;
        this.errorCode = errorCode;
    }

    public String getTxHash() {
        return txHash;
    }

    public EscrowErrorCode getErrorCode() {
        return errorCode;
    }
}
