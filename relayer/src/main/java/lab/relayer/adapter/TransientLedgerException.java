package lab.relayer.adapter;

/**
 * Connectivity loss or confirmation timeout. Safe to retry.
 */
public class TransientLedgerException extends LedgerAdapterException {

    public TransientLedgerException(String chain, String message) {
        super(chain, message);
    }

    public TransientLedgerException(String chain, String message, Throwable cause) {
        super(chain, message, cause);
    }
}
