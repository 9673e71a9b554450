package lab.relayer.orchestration;

import lab.relayer.adapter.LedgerAdapter;
import lab.relayer.adapter.LedgerAdapterRouter;
import lab.relayer.adapter.TransactionRevertedException;
import lab.relayer.adapter.TransientLedgerException;
import lab.relayer.common.ErrorLog;
import lab.relayer.common.NotificationFeed;
import lab.relayer.common.RelayerNotification;
import lab.relayer.domain.escrow.Escrow;
import lab.relayer.domain.order.Order;
import lab.relayer.domain.order.OrderStatus;
import lab.relayer.domain.swap.CrossChainSwap;
import lab.relayer.domain.swap.SwapStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Timeout handling for orders and swaps. Always invoked from the order's serialized task;
 * cancel confirmations are awaited on the {@link ConfirmationWatcher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapRecoveryService {

    private final LedgerAdapterRouter router;
    private final ConfirmationWatcher confirmations;
    private final ErrorLog errorLog;
    private final NotificationFeed notificationFeed;

    // legs for which a cancel-available notice was already published; dropped once the leg settles
    private final Set<String> notifiedLegs = ConcurrentHashMap.newKeySet();
    // own legs with a cancel awaiting confirmation
    private final Set<String> pendingCancels = ConcurrentHashMap.newKeySet();

    /**
     * Marks an order still waiting for a counterparty as expired once its timelock has passed.
     *
     * @return true if the order was expired by this call
     */
    public boolean expireIfStale(Order order, Instant now) {
        if (order == null || order.getTimelock() == null) {
            return false;
        }
        boolean waiting = order.getStatus() == OrderStatus.PENDING || order.getStatus() == OrderStatus.AUCTION_ACTIVE;
        if (!waiting || now.isBefore(order.getTimelock())) {
            return false;
        }
        order.transitionTo(OrderStatus.EXPIRED, now);
        log.info("event=recovery.order_expired orderId={} timelock={}", order.getOrderId(), order.getTimelock());
        errorLog.info("order expired without a counterparty", order.getOrderId(), order.getSrcChain());
        return true;
    }

    /**
     * Moves an overdue swap into recovery and releases every still-locked leg that is past its timelock.
     * Legs the relayer sent are cancelled directly; legs owned by someone else are announced instead.
     * A failed swap has its legs released as their timelocks pass, without waiting for the execution deadline.
     *
     * @return true once the swap has failed, its order is closed and none of its legs is still locked,
     *         so later recovery passes can skip it
     */
    public boolean recover(CrossChainSwap swap, Order order, Instant now, boolean submissionsAllowed) {
        if (swap == null || swap.getStatus() == SwapStatus.COMPLETED) {
            return false;
        }
        boolean failed = swap.getStatus() == SwapStatus.FAILED;
        if (!failed && (swap.getExecutionDeadline() == null || now.isBefore(swap.getExecutionDeadline()))) {
            return false;
        }
        if (swap.canTransitionTo(SwapStatus.RECOVERING) && swap.getStatus() != SwapStatus.RECOVERING) {
            swap.transitionTo(SwapStatus.RECOVERING, now);
            log.warn("event=recovery.started orderId={} deadline={} sourceEscrowId={} destEscrowId={}",
                    swap.getOrderId(), swap.getExecutionDeadline(), swap.getSourceEscrowId(), swap.getDestEscrowId());
            errorLog.warn("swap passed its execution deadline, recovery started", swap.getOrderId(), swap.getDestChain());
            notificationFeed.publish(new RelayerNotification(
                    RelayerNotification.Type.RECOVERY_STARTED, swap.getOrderId(), swap.getDestChain(), now, swap.snapshot()));
        }

        String sourceChain = swap.getSourceChain() != null ? swap.getSourceChain() : order == null ? null : order.getSrcChain();
        String destChain = swap.getDestChain() != null ? swap.getDestChain() : order == null ? null : order.getDestChain();
        boolean sourceSettled = releaseLeg(swap.getOrderId(), sourceChain, swap.getSourceEscrowId(), now, submissionsAllowed);
        boolean destSettled = releaseLeg(swap.getOrderId(), destChain, swap.getDestEscrowId(), now, submissionsAllowed);
        boolean orderClosed = order == null || order.getStatus().isTerminal();
        return failed && orderClosed && sourceSettled && destSettled;
    }

    int announcedLegCount() {
        return notifiedLegs.size();
    }

    /**
     * @return true if the leg is no longer locked, or does not exist
     */
    private boolean releaseLeg(String orderId, String chain, String escrowId, Instant now, boolean submissionsAllowed) {
        if (chain == null || escrowId == null) {
            return true;
        }
        Optional<LedgerAdapter> adapterOpt = router.find(chain);
        if (adapterOpt.isEmpty()) {
            return true;
        }
        LedgerAdapter adapter = adapterOpt.get();
        String legKey = chain + ":" + escrowId;
        Optional<Escrow> escrowOpt;
        try {
            escrowOpt = adapter.findEscrow(escrowId);
        } catch (TransientLedgerException e) {
            log.warn("event=recovery.lookup_failed orderId={} chain={} reason={}", orderId, chain, e.getMessage());
            return false;
        }
        if (escrowOpt.isEmpty() || escrowOpt.get().isTerminal()) {
            notifiedLegs.remove(legKey);
            return true;
        }
        Escrow escrow = escrowOpt.get();
        if (now.isBefore(escrow.getTimelock())) {
            return false;
        }

        if (!escrow.getSender().equalsIgnoreCase(adapter.getAccountAddress())) {
            if (notifiedLegs.add(legKey)) {
                log.warn("event=recovery.cancel_available orderId={} chain={} escrowId={} sender={}",
                        orderId, chain, escrowId, escrow.getSender());
                errorLog.warn("escrow " + escrowId + " can be cancelled by its sender " + escrow.getSender(), orderId, chain);
                notificationFeed.publish(new RelayerNotification(
                        RelayerNotification.Type.CANCEL_AVAILABLE, orderId, chain, now,
                        Map.of("escrowId", escrowId, "sender", escrow.getSender())));
            }
            return false;
        }
        if (!submissionsAllowed) {
            log.warn("event=recovery.cancel_skipped orderId={} chain={} escrowId={} reason=shutdown", orderId, chain, escrowId);
            return false;
        }
        if (!pendingCancels.add(legKey)) {
            log.debug("event=recovery.cancel_pending orderId={} chain={} escrowId={}", orderId, chain, escrowId);
            return false;
        }

        LedgerAdapter.PendingTx pending;
        try {
            pending = adapter.submitCancel(escrowId);
        } catch (TransactionRevertedException e) {
            pendingCancels.remove(legKey);
            onCancelReverted(orderId, chain, escrowId, e);
            return false;
        } catch (TransientLedgerException e) {
            pendingCancels.remove(legKey);
            onCancelUnconfirmed(orderId, chain, escrowId, e);
            return false;
        }
        log.info("event=recovery.cancel_submitted orderId={} chain={} escrowId={} txHash={}",
                orderId, chain, escrowId, pending.txHash());
        try {
            confirmations.watch(adapter, pending, outcome -> {
                pendingCancels.remove(legKey);
                if (outcome.confirmed()) {
                    log.info("event=recovery.cancelled orderId={} chain={} escrowId={} txHash={} block={}",
                            orderId, chain, escrowId, outcome.confirmation().txHash(), outcome.confirmation().blockNumber());
                } else if (outcome.failure() instanceof TransactionRevertedException reverted) {
                    onCancelReverted(orderId, chain, escrowId, reverted);
                } else {
                    onCancelUnconfirmed(orderId, chain, escrowId, outcome.failure());
                }
            });
        } catch (RejectedExecutionException e) {
            pendingCancels.remove(legKey);
            onCancelUnconfirmed(orderId, chain, escrowId, e);
        }
        return false;
    }

    private void onCancelReverted(String orderId, String chain, String escrowId, TransactionRevertedException e) {
        log.error("event=recovery.cancel_reverted orderId={} chain={} escrowId={} code={}",
                orderId, chain, escrowId, e.getErrorCode());
        errorLog.error("cancel of " + escrowId + " reverted: " + e.getErrorCode(), orderId, chain);
    }

    private void onCancelUnconfirmed(String orderId, String chain, String escrowId, RuntimeException e) {
        log.warn("event=recovery.cancel_transient orderId={} chain={} escrowId={} reason={}",
                orderId, chain, escrowId, e.getMessage());
        errorLog.warn("cancel of " + escrowId + " not confirmed yet: " + e.getMessage(), orderId, chain);
    }
}
