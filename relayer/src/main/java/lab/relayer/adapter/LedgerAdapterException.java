package lab.relayer.adapter;

/**
 * Base type for failures surfaced by a {@link LedgerAdapter}.
 */
public class LedgerAdapterException extends RuntimeException {

    private final String chain;

    public LedgerAdapterException(String chain, String message) {
        super(message);
        this.chain = chain;
    }

    public LedgerAdapterException(String chain, String message, Throwable cause) {
        super(message, cause);
        this.chain = chain;
    }

    public String getChain() {
        return chain;
    }
}
