package lab.relayer.orchestration;

/**
 * An order id was re-submitted with different terms.
 */
public class OrderConflictException extends RuntimeException {

    public OrderConflictException(String orderId, String detail) {
        super("order " + orderId + " already registered with different terms: " + detail);
    }
}
