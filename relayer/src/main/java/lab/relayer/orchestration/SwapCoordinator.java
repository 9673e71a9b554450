package lab.relayer.orchestration;

import lab.relayer.adapter.EscrowEvent;
import lab.relayer.adapter.LedgerAdapter;
import lab.relayer.adapter.LedgerAdapterRouter;
import lab.relayer.adapter.TransactionRevertedException;
import lab.relayer.adapter.TransientLedgerException;
import lab.relayer.auction.AuctionPricer;
import lab.relayer.auction.AuctionSnapshot;
import lab.relayer.common.ErrorLog;
import lab.relayer.common.NotificationFeed;
import lab.relayer.common.RelayerNotification;
import lab.relayer.common.RelayerProperties;
import lab.relayer.domain.escrow.Escrow;
import lab.relayer.domain.escrow.EscrowErrorCode;
import lab.relayer.domain.escrow.EscrowIds;
import lab.relayer.domain.order.Order;
import lab.relayer.domain.order.OrderStatus;
import lab.relayer.domain.swap.CrossChainSwap;
import lab.relayer.domain.swap.SwapStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Off-chain coordinator that correlates escrow events from every configured chain by order id,
 * propagates revealed secrets to the source leg and drives timeout recovery.
 * <p>
 * Order and swap records are only mutated inside tasks run by {@link OrderSerialExecutor}, keyed by
 * order id, so two events for the same order never race. Replayed events are idempotent.
 */
@Service
@Slf4j
public class SwapCoordinator implements SmartLifecycle {

    static final String MDC_ORDER_ID_KEY = "orderId";
    static final String MDC_CHAIN_KEY = "chain";

    private static final int STATE_ERROR_LIMIT = 100;

    private final LedgerAdapterRouter router;
    private final OrderSerialExecutor executor;
    private final ConfirmationWatcher confirmations;
    private final CheckpointTracker checkpoints;
    private final SwapRecoveryService recoveryService;
    private final ErrorLog errorLog;
    private final NotificationFeed notificationFeed;
    private final Clock clock;
    private final boolean replayFromGenesis;
    private final Duration drainTimeout;

    private final ConcurrentHashMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CrossChainSwap> swaps = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LedgerAdapter.Subscription> subscriptions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> lastBlockProcessed = new ConcurrentHashMap<>();
    // copies published at the end of each order task; read by API and scheduler threads
    private final ConcurrentHashMap<String, Order> orderViews = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CrossChainSwap> swapViews = new ConcurrentHashMap<>();
    // orderId -> whether the source withdrawal event was seen while its confirmation is pending
    private final ConcurrentHashMap<String, Boolean> pendingConfirmations = new ConcurrentHashMap<>();
    private final Set<String> settledSwaps = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private volatile boolean shuttingDown;

    public SwapCoordinator(
            LedgerAdapterRouter router,
            OrderSerialExecutor executor,
            ConfirmationWatcher confirmations,
            CheckpointTracker checkpoints,
            SwapRecoveryService recoveryService,
            ErrorLog errorLog,
            NotificationFeed notificationFeed,
            Clock ledgerClock,
            RelayerProperties properties,
            @Value("${relayer.shutdown-drain-timeout-ms:10000}") long drainTimeoutMs
    ) {
        this.router = router;
        this.executor = executor;
        this.confirmations = confirmations;
        this.checkpoints = checkpoints;
        this.recoveryService = recoveryService;
        this.errorLog = errorLog;
        this.notificationFeed = notificationFeed;
        this.clock = ledgerClock;
        this.replayFromGenesis = properties.isReplayFromGenesis();
        this.drainTimeout = Duration.ofMillis(drainTimeoutMs);
    }

    // ---- lifecycle

    @Override
    public void start() {
        shuttingDown = false;
        running = true;
        for (LedgerAdapter adapter : router.all()) {
            long fromBlock = replayFromGenesis ? 0L : checkpoints.loadPersisted(adapter.getChainName()).orElse(0L);
            subscribe(adapter, fromBlock);
        }
        log.info("event=coordinator.started chains={} replayFromGenesis={}", subscriptions.keySet(), replayFromGenesis);
    }

    @Override
    public void stop() {
        shuttingDown = true;
        log.info("event=coordinator.stopping pendingOrders={}", executor.inFlightKeys());
        subscriptions.keySet().forEach(this::unsubscribe);
        boolean confirmed = confirmations.awaitIdle(drainTimeout);
        boolean drained = executor.drain(drainTimeout) && confirmed;
        checkpoints.persistAll();
        router.closeAll();
        running = false;
        log.info("event=coordinator.stopped drained={}", drained);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ---- event intake

    /**
     * Entry point for every adapter subscription. Runs on the chain's dispatcher thread and only enqueues.
     */
    public void onEvent(EscrowEvent event) {
        if (shuttingDown) {
            log.debug("event=coordinator.event_dropped chain={} block={} reason=shutdown", event.chain(), event.blockNumber());
            return;
        }
        if (event.orderId() == null || event.orderId().isBlank()) {
            log.warn("event=coordinator.event_without_order chain={} escrowId={} type={}",
                    event.chain(), event.escrowId(), event.type());
            errorLog.warn("event without order id: " + event.type() + " " + event.escrowId(), null, event.chain());
            return;
        }
        checkpoints.begin(event.chain(), event.blockNumber());
        try {
            executor.submit(event.orderId(), () -> {
                try {
                    handleEvent(event);
                } finally {
                    checkpoints.complete(event.chain(), event.blockNumber());
                }
            });
        } catch (RejectedExecutionException e) {
            checkpoints.complete(event.chain(), event.blockNumber());
            log.warn("event=coordinator.event_rejected orderId={} chain={} reason={}",
                    event.orderId(), event.chain(), e.getMessage());
        }
    }

    void handleEvent(EscrowEvent event) {
        MDC.put(MDC_ORDER_ID_KEY, event.orderId());
        MDC.put(MDC_CHAIN_KEY, event.chain());
        try {
            log.info("event=coordinator.handle type={} escrowId={} block={} txHash={}",
                    event.type(), event.escrowId(), event.blockNumber(), event.txHash());
            switch (event.type()) {
                case ESCROW_CREATED -> onCreated(event);
                case ESCROW_WITHDRAWN -> onWithdrawn(event);
                case ESCROW_CANCELLED -> onCancelled(event);
                default -> log.info("event=coordinator.event_ignored type={}", event.type());
            }
            notificationFeed.publish(new RelayerNotification(
                    RelayerNotification.Type.ESCROW_EVENT, event.orderId(), event.chain(), clock.instant(), event));
        } catch (RuntimeException e) {
            log.error("event=coordinator.handle_failed type={} escrowId={} reason={}",
                    event.type(), event.escrowId(), e.getMessage(), e);
            errorLog.error("failed to handle " + event.type() + ": " + e.getMessage(), event.orderId(), event.chain());
        } finally {
            lastBlockProcessed.merge(event.chain(), event.blockNumber(), Math::max);
            publishViews(event.orderId());
            MDC.remove(MDC_ORDER_ID_KEY);
            MDC.remove(MDC_CHAIN_KEY);
        }
    }

    // ---- Created

    private void onCreated(EscrowEvent event) {
        Order order = orders.get(event.orderId());
        if (isDestinationLeg(event, order)) {
            onDestinationCreated(event, order);
        } else {
            onSourceCreated(event, order);
        }
    }

    private boolean isDestinationLeg(EscrowEvent event, Order order) {
        if (order != null) {
            if (event.escrowId().equalsIgnoreCase(order.getSrcEscrowId())) {
                return false;
            }
            if (event.escrowId().equalsIgnoreCase(order.getDestEscrowId())) {
                return true;
            }
            if (order.getSrcChain() != null && order.getSrcChain().equals(event.chain())) {
                return false;
            }
            if (order.getDestChain() != null && order.getDestChain().equals(event.chain())) {
                return true;
            }
        }
        return event.pairedEscrowId() != null;
    }

    private void onSourceCreated(EscrowEvent event, Order existing) {
        Instant now = clock.instant();
        Order order = mergeSourceLeg(existing, event, now);
        orders.put(order.getOrderId(), order);
        if (order.canTransitionTo(OrderStatus.AUCTION_ACTIVE)) {
            order.transitionTo(OrderStatus.AUCTION_ACTIVE, now);
        }

        CrossChainSwap swap = swaps.computeIfAbsent(event.orderId(), id -> CrossChainSwap.initiated(id, now));
        if (swap.getSecretHash() != null && !swap.getSecretHash().equalsIgnoreCase(event.secretHash())) {
            failOnHashMismatch(swap, order, event, now);
            return;
        }
        swap.recordSourceLeg(event.chain(), event.escrowId(), event.sender(), event.secretHash(), event.timelock(), now);
        if (swap.canTransitionTo(SwapStatus.SOURCE_LOCKED)) {
            swap.transitionTo(SwapStatus.SOURCE_LOCKED, now);
        }
        log.info("event=coordinator.source_locked escrowId={} orderStatus={} swapStatus={}",
                event.escrowId(), order.getStatus(), swap.getStatus());
    }

    // The on-chain lock is authoritative for the source terms; an earlier intent only contributes the destination side.
    private Order mergeSourceLeg(Order existing, EscrowEvent event, Instant now) {
        Order.OrderBuilder builder = existing == null
                ? Order.builder().orderId(event.orderId()).status(OrderStatus.PENDING).createdAt(now)
                : existing.toBuilder();
        if (existing != null && existing.getSecretHash() != null
                && !existing.getSecretHash().equalsIgnoreCase(event.secretHash())) {
            log.warn("event=coordinator.intent_mismatch escrowId={} field=secretHash", event.escrowId());
            errorLog.warn("source lock secret hash differs from registered intent", event.orderId(), event.chain());
        }
        return builder
                .maker(event.sender())
                .receiver(existing != null && existing.getReceiver() != null ? existing.getReceiver() : event.receiver())
                .srcChain(event.chain())
                .srcAsset(event.asset())
                .srcAmount(event.amount())
                .secretHash(event.secretHash())
                .timelock(event.timelock())
                .auctionStart(event.auctionStart())
                .auctionEnd(event.auctionEnd())
                .startRate(event.startRate())
                .endRate(event.endRate())
                .srcEscrowId(event.escrowId())
                .updatedAt(now)
                .build();
    }

    private void onDestinationCreated(EscrowEvent event, Order existing) {
        Instant now = clock.instant();
        Order order = existing;
        if (order == null) {
            order = Order.builder()
                    .orderId(event.orderId())
                    .secretHash(event.secretHash())
                    .status(OrderStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            orders.put(order.getOrderId(), order);
        }
        order.recordDestinationEscrow(event.chain(), event.escrowId(), event.asset(), event.amount(), now);
        if (order.canTransitionTo(OrderStatus.ACCEPTED)) {
            order.transitionTo(OrderStatus.ACCEPTED, now);
        }

        CrossChainSwap swap = swaps.computeIfAbsent(event.orderId(), id -> CrossChainSwap.initiated(id, now));
        if (swap.getSecretHash() != null && !swap.getSecretHash().equalsIgnoreCase(event.secretHash())) {
            failOnHashMismatch(swap, order, event, now);
            return;
        }
        if (event.pairedEscrowId() != null) {
            swap.linkSourceEscrow(event.pairedEscrowId());
        }
        swap.recordDestinationLeg(event.chain(), event.escrowId(), event.sender(), event.secretHash(), event.timelock(), now);
        if (swap.canTransitionTo(SwapStatus.DEST_LOCKED)) {
            swap.transitionTo(SwapStatus.DEST_LOCKED, now);
        }
        log.info("event=coordinator.dest_locked escrowId={} resolver={} deadline={} swapStatus={}",
                event.escrowId(), event.sender(), swap.getExecutionDeadline(), swap.getStatus());
    }

    private void failOnHashMismatch(CrossChainSwap swap, Order order, EscrowEvent event, Instant now) {
        String reason = "escrow " + event.escrowId() + " is locked to a different secret hash";
        log.error("event=coordinator.protocol_violation escrowId={} reason=hash_mismatch", event.escrowId());
        errorLog.error(reason, event.orderId(), event.chain());
        failSwap(swap, order, reason, now);
    }

    // ---- Withdrawn

    private void onWithdrawn(EscrowEvent event) {
        CrossChainSwap swap = swaps.get(event.orderId());
        Order order = orders.get(event.orderId());
        if (swap == null) {
            log.warn("event=coordinator.withdrawal_for_unknown_swap escrowId={}", event.escrowId());
            errorLog.warn("withdrawal observed for unknown swap", event.orderId(), event.chain());
            return;
        }
        boolean destination = swap.isDestinationLeg(event.chain(), event.escrowId());
        boolean source = !destination && swap.isSourceLeg(event.chain(), event.escrowId());
        if (!destination && !source) {
            log.warn("event=coordinator.withdrawal_for_unknown_leg escrowId={}", event.escrowId());
            errorLog.warn("withdrawal of escrow " + event.escrowId() + " not linked to this swap", event.orderId(), event.chain());
            return;
        }
        if (source && order != null && order.getExecutionRate() == null
                && event.executionRate() != null && event.executionRate().signum() > 0) {
            order.recordExecutionRate(event.executionRate());
        }
        if (swap.getStatus().isTerminal()) {
            log.debug("event=coordinator.withdrawal_replayed escrowId={} swapStatus={}", event.escrowId(), swap.getStatus());
            return;
        }

        Instant now = clock.instant();
        if (!EscrowIds.secretMatches(event.secret(), swap.getSecretHash())) {
            String reason = "revealed secret does not hash to " + swap.getSecretHash();
            log.error("event=coordinator.protocol_violation escrowId={} reason=secret_mismatch", event.escrowId());
            errorLog.error(reason, event.orderId(), event.chain());
            failSwap(swap, order, reason, now);
            return;
        }

        if (swap.getSecret() == null) {
            swap.revealSecret(event.secret(), now);
        }
        if (swap.canTransitionTo(SwapStatus.SECRET_REVEALED)) {
            swap.transitionTo(SwapStatus.SECRET_REVEALED, now);
        }
        if (order != null && order.canTransitionTo(OrderStatus.EXECUTING)) {
            order.transitionTo(OrderStatus.EXECUTING, now);
        }
        log.info("event=coordinator.secret_revealed escrowId={} leg={}", event.escrowId(), destination ? "destination" : "source");

        if (source) {
            if (pendingConfirmations.containsKey(swap.getOrderId())) {
                pendingConfirmations.put(swap.getOrderId(), Boolean.TRUE);
                log.info("event=coordinator.source_withdrawal_observed escrowId={} awaiting=confirmation", event.escrowId());
                return;
            }
            complete(swap, order, now);
            return;
        }
        counterWithdraw(swap, order);
    }

    private void counterWithdraw(CrossChainSwap swap, Order order) {
        if (swap.isCounterWithdrawalSubmitted()) {
            log.debug("event=coordinator.counter_withdraw_skipped reason=already_submitted");
            return;
        }
        if (shuttingDown) {
            log.warn("event=coordinator.counter_withdraw_skipped reason=shutdown");
            errorLog.warn("counter-withdrawal skipped during shutdown", swap.getOrderId(), swap.getSourceChain());
            return;
        }
        String sourceChain = swap.getSourceChain() != null ? swap.getSourceChain() : order == null ? null : order.getSrcChain();
        Optional<LedgerAdapter> adapterOpt = router.find(sourceChain);
        if (swap.getSourceEscrowId() == null || adapterOpt.isEmpty()) {
            log.warn("event=coordinator.counter_withdraw_skipped reason=source_leg_unknown sourceChain={}", sourceChain);
            errorLog.warn("secret revealed but the source leg is unknown", swap.getOrderId(), sourceChain);
            return;
        }
        LedgerAdapter adapter = adapterOpt.get();
        String account = adapter.getAccountAddress();
        Optional<String> receiver = lookupReceiver(adapter, swap.getSourceEscrowId());
        if (receiver.isPresent() && !receiver.get().equalsIgnoreCase(account)) {
            log.info("event=coordinator.counter_withdraw_skipped reason=foreign_receiver receiver={}", receiver.get());
            errorLog.info("secret revealed; source receiver " + receiver.get() + " must withdraw", swap.getOrderId(), sourceChain);
            return;
        }

        Instant now = clock.instant();
        swap.markCounterWithdrawalSubmitted(now);
        String orderId = swap.getOrderId();
        LedgerAdapter.PendingTx pending;
        try {
            pending = adapter.submitWithdraw(swap.getSourceEscrowId(), swap.getSecret());
        } catch (TransactionRevertedException e) {
            onCounterWithdrawReverted(swap, order, sourceChain, e);
            return;
        } catch (TransientLedgerException e) {
            onCounterWithdrawUnconfirmed(swap, sourceChain, e);
            return;
        }
        pendingConfirmations.put(orderId, Boolean.FALSE);
        log.info("event=coordinator.counter_withdraw_submitted sourceEscrowId={} txHash={}",
                swap.getSourceEscrowId(), pending.txHash());
        try {
            confirmations.watch(adapter, pending, outcome -> enqueue(orderId, () -> applyCounterWithdrawal(orderId, sourceChain, outcome)));
        } catch (RejectedExecutionException e) {
            pendingConfirmations.remove(orderId);
            onCounterWithdrawUnconfirmed(swap, sourceChain, e);
        }
    }

    // Runs in the order's serial chain once the source withdrawal has a final outcome.
    private void applyCounterWithdrawal(String orderId, String sourceChain, ConfirmationWatcher.Outcome outcome) {
        boolean observed = Boolean.TRUE.equals(pendingConfirmations.remove(orderId));
        CrossChainSwap swap = swaps.get(orderId);
        Order order = orders.get(orderId);
        if (swap == null) {
            return;
        }
        if (outcome.confirmed()) {
            LedgerAdapter.Confirmation confirmation = outcome.confirmation();
            log.info("event=coordinator.counter_withdraw_confirmed sourceEscrowId={} txHash={} block={} confirmations={}",
                    swap.getSourceEscrowId(), confirmation.txHash(), confirmation.blockNumber(), confirmation.confirmations());
            complete(swap, order, clock.instant());
        } else if (outcome.failure() instanceof TransactionRevertedException reverted) {
            onCounterWithdrawReverted(swap, order, sourceChain, reverted);
        } else if (observed) {
            log.warn("event=coordinator.counter_withdraw_unconfirmed_but_observed sourceEscrowId={} reason={}",
                    swap.getSourceEscrowId(), outcome.failure().getMessage());
            complete(swap, order, clock.instant());
        } else {
            onCounterWithdrawUnconfirmed(swap, sourceChain, outcome.failure());
        }
    }

    private void onCounterWithdrawReverted(CrossChainSwap swap, Order order, String sourceChain, TransactionRevertedException e) {
        if (e.getErrorCode() == EscrowErrorCode.ALREADY_WITHDRAWN) {
            log.info("event=coordinator.counter_withdraw_already_done sourceEscrowId={}", swap.getSourceEscrowId());
            complete(swap, order, clock.instant());
            return;
        }
        log.error("event=coordinator.counter_withdraw_reverted sourceEscrowId={} code={}",
                swap.getSourceEscrowId(), e.getErrorCode());
        errorLog.error("counter-withdrawal reverted: " + e.getErrorCode(), swap.getOrderId(), sourceChain);
        failSwap(swap, order, "counter-withdrawal reverted: " + e.getErrorCode(), clock.instant());
    }

    private void onCounterWithdrawUnconfirmed(CrossChainSwap swap, String sourceChain, RuntimeException e) {
        log.error("event=coordinator.counter_withdraw_unconfirmed sourceEscrowId={} reason={}",
                swap.getSourceEscrowId(), e.getMessage());
        errorLog.error("counter-withdrawal not confirmed, needs operator attention: " + e.getMessage(),
                swap.getOrderId(), sourceChain);
    }

    private Optional<String> lookupReceiver(LedgerAdapter adapter, String escrowId) {
        try {
            return adapter.findEscrow(escrowId).map(Escrow::getReceiver);
        } catch (TransientLedgerException e) {
            return Optional.empty();
        }
    }

    // ---- Cancelled

    private void onCancelled(EscrowEvent event) {
        CrossChainSwap swap = swaps.get(event.orderId());
        Order order = orders.get(event.orderId());
        Instant now = clock.instant();
        if (swap != null && !swap.getStatus().isTerminal()) {
            swap.fail("escrow " + event.escrowId() + " cancelled on " + event.chain(), now);
        }
        if (order != null && order.canTransitionTo(OrderStatus.CANCELLED)) {
            order.transitionTo(OrderStatus.CANCELLED, now);
        }
        log.info("event=coordinator.cancelled escrowId={} refund={} swapStatus={} orderStatus={}",
                event.escrowId(), event.refundAmount(),
                swap == null ? null : swap.getStatus(), order == null ? null : order.getStatus());
    }

    // ---- shared transitions

    private void complete(CrossChainSwap swap, Order order, Instant now) {
        if (swap.canTransitionTo(SwapStatus.COMPLETED)) {
            swap.transitionTo(SwapStatus.COMPLETED, now);
        }
        if (order != null && order.canTransitionTo(OrderStatus.COMPLETED)) {
            order.transitionTo(OrderStatus.COMPLETED, now);
        }
        log.info("event=coordinator.swap_completed sourceEscrowId={} destEscrowId={}",
                swap.getSourceEscrowId(), swap.getDestEscrowId());
        notificationFeed.publish(new RelayerNotification(
                RelayerNotification.Type.SWAP_COMPLETED, swap.getOrderId(), swap.getSourceChain(), now, swap.snapshot()));
    }

    private void failSwap(CrossChainSwap swap, Order order, String reason, Instant now) {
        if (swap.canTransitionTo(SwapStatus.FAILED)) {
            swap.fail(reason, now);
        }
        if (order != null && order.canTransitionTo(OrderStatus.FAILED)) {
            order.transitionTo(OrderStatus.FAILED, now);
        }
    }

    // ---- order intake

    /**
     * Records a maker intent as a {@code PENDING} order. Re-submitting identical terms returns the
     * existing order; different terms under the same id are rejected.
     */
    public Order registerOrder(OrderIntent intent) {
        router.resolve(intent.srcChain());
        router.resolve(intent.destChain());
        if (intent.srcChain().equals(intent.destChain())) {
            throw new IllegalArgumentException("source and destination chain must differ");
        }
        if (intent.startRate().compareTo(intent.endRate()) < 0) {
            throw new IllegalArgumentException("startRate must not be below endRate");
        }
        LedgerAdapter.ChainSettings settings = router.resolve(intent.srcChain()).getSettings();
        Duration timelock = Duration.ofSeconds(intent.timelockSeconds());
        if (timelock.compareTo(settings.minTimelock()) < 0 || timelock.compareTo(settings.maxTimelock()) > 0) {
            throw new IllegalArgumentException("timelockSeconds must be within " + settings.minTimelock().getSeconds()
                    + ".." + settings.maxTimelock().getSeconds() + " on " + intent.srcChain());
        }
        if (intent.auctionDurationSeconds() > intent.timelockSeconds()) {
            throw new IllegalArgumentException("auctionDurationSeconds must not exceed timelockSeconds");
        }
        try {
            return executor.call(intent.orderId(), () -> doRegister(intent)).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private Order doRegister(OrderIntent intent) {
        Order existing = orders.get(intent.orderId());
        if (existing != null) {
            ensureSameTerms(existing, intent);
            log.info("event=coordinator.order_intent_replayed orderId={} status={}", intent.orderId(), existing.getStatus());
            return existing.snapshot();
        }
        Instant now = clock.instant();
        Order order = Order.builder()
                .orderId(intent.orderId())
                .maker(intent.maker().toLowerCase(Locale.ROOT))
                .receiver(intent.receiver().toLowerCase(Locale.ROOT))
                .srcChain(intent.srcChain())
                .destChain(intent.destChain())
                .srcAsset(intent.srcAsset().toLowerCase(Locale.ROOT))
                .destAsset(intent.destAsset().toLowerCase(Locale.ROOT))
                .srcAmount(intent.srcAmount())
                .destAmount(intent.destAmount())
                .secretHash(intent.secretHash().toLowerCase(Locale.ROOT))
                .timelock(now.plusSeconds(intent.timelockSeconds()))
                .auctionStart(now)
                .auctionEnd(now.plusSeconds(intent.auctionDurationSeconds()))
                .startRate(intent.startRate())
                .endRate(intent.endRate())
                .status(OrderStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        orders.put(order.getOrderId(), order);
        publishViews(order.getOrderId());
        log.info("event=coordinator.order_registered orderId={} srcChain={} destChain={} srcAmount={}",
                order.getOrderId(), order.getSrcChain(), order.getDestChain(), order.getSrcAmount());
        return order.snapshot();
    }

    private void ensureSameTerms(Order existing, OrderIntent intent) {
        List<String> mismatches = new ArrayList<>();
        if (!sameIgnoreCase(existing.getMaker(), intent.maker())) {
            mismatches.add("maker");
        }
        if (!sameIgnoreCase(existing.getSecretHash(), intent.secretHash())) {
            mismatches.add("secretHash");
        }
        if (existing.getSrcChain() != null && !existing.getSrcChain().equals(intent.srcChain())) {
            mismatches.add("srcChain");
        }
        if (existing.getDestChain() != null && !existing.getDestChain().equals(intent.destChain())) {
            mismatches.add("destChain");
        }
        if (existing.getSrcAmount() != null && existing.getSrcAmount().compareTo(intent.srcAmount()) != 0) {
            mismatches.add("srcAmount");
        }
        if (!mismatches.isEmpty()) {
            throw new OrderConflictException(intent.orderId(), String.join(",", mismatches));
        }
    }

    private static boolean sameIgnoreCase(String existing, String incoming) {
        return existing == null || existing.equalsIgnoreCase(incoming);
    }

    // ---- periodic work, enqueued per order

    public void checkHealth() {
        for (LedgerAdapter adapter : router.all()) {
            String chain = adapter.getChainName();
            boolean healthy;
            try {
                healthy = adapter.isHealthy();
            } catch (RuntimeException e) {
                healthy = false;
            }
            if (!healthy) {
                log.warn("event=coordinator.chain_unhealthy chain={}", chain);
                errorLog.warn("chain " + chain + " failed its health check", null, chain);
                unsubscribe(chain);
            } else if (running && !shuttingDown && !subscriptions.containsKey(chain)) {
                long fromBlock = checkpoints.safeCheckpoint(chain);
                log.info("event=coordinator.chain_reconnected chain={} fromBlock={}", chain, fromBlock);
                errorLog.info("chain " + chain + " reconnected from block " + fromBlock, null, chain);
                subscribe(adapter, fromBlock);
            }
        }
        checkpoints.persistAll();
    }

    public void refreshAuctions() {
        for (Order order : orderViews.values()) {
            if (order.getStatus() != OrderStatus.AUCTION_ACTIVE || !order.hasAuction()) {
                continue;
            }
            enqueue(order.getOrderId(), () -> getAuction(order.getOrderId()).ifPresent(snapshot ->
                    notificationFeed.publish(new RelayerNotification(
                            RelayerNotification.Type.AUCTION_UPDATE, order.getOrderId(), order.getSrcChain(),
                            snapshot.observedAt(), snapshot))));
        }
    }

    public void runRecovery() {
        Set<String> orderIds = new HashSet<>(orderViews.keySet());
        orderIds.addAll(swapViews.keySet());
        orderIds.removeAll(settledSwaps);
        for (String orderId : orderIds) {
            Order order = orderViews.get(orderId);
            CrossChainSwap swap = swapViews.get(orderId);
            boolean orderOpen = order != null && !order.getStatus().isTerminal();
            boolean swapOpen = swap != null && swap.getStatus() != SwapStatus.COMPLETED;
            if (!orderOpen && !swapOpen) {
                continue;
            }
            enqueue(orderId, () -> {
                Instant now = clock.instant();
                recoveryService.expireIfStale(orders.get(orderId), now);
                if (recoveryService.recover(swaps.get(orderId), orders.get(orderId), now, !shuttingDown)) {
                    settledSwaps.add(orderId);
                    log.info("event=coordinator.swap_settled swapStatus={}", swaps.get(orderId).getStatus());
                }
            });
        }
    }

    private void enqueue(String orderId, Runnable task) {
        try {
            executor.submit(orderId, () -> {
                MDC.put(MDC_ORDER_ID_KEY, orderId);
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("event=coordinator.task_failed reason={}", e.getMessage(), e);
                    errorLog.error("background task failed: " + e.getMessage(), orderId, null);
                } finally {
                    publishViews(orderId);
                    MDC.remove(MDC_ORDER_ID_KEY);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("event=coordinator.task_rejected orderId={} reason=shutdown", orderId);
        }
    }

    private void subscribe(LedgerAdapter adapter, long fromBlock) {
        try {
            subscriptions.put(adapter.getChainName(), adapter.subscribe(fromBlock, this::onEvent));
        } catch (RuntimeException e) {
            log.error("event=coordinator.subscribe_failed chain={} reason={}", adapter.getChainName(), e.getMessage());
            errorLog.error("subscription failed: " + e.getMessage(), null, adapter.getChainName());
        }
    }

    private void unsubscribe(String chain) {
        LedgerAdapter.Subscription subscription = subscriptions.remove(chain);
        if (subscription != null) {
            subscription.close();
        }
    }

    // Called at the end of every task that may have touched the order; always from its serial chain.
    private void publishViews(String orderId) {
        if (orderId == null) {
            return;
        }
        Order order = orders.get(orderId);
        if (order != null) {
            orderViews.put(orderId, order.snapshot());
        }
        CrossChainSwap swap = swaps.get(orderId);
        if (swap != null) {
            swapViews.put(orderId, swap.snapshot());
        }
    }

    // ---- read side

    public Optional<Order> getOrder(String orderId) {
        return Optional.ofNullable(orderViews.get(orderId)).map(Order::snapshot);
    }

    public Optional<CrossChainSwap> getSwap(String orderId) {
        return Optional.ofNullable(swapViews.get(orderId)).map(CrossChainSwap::snapshot);
    }

    public Optional<AuctionSnapshot> getAuction(String orderId) {
        Order order = orderViews.get(orderId);
        if (order == null || !order.hasAuction()) {
            return Optional.empty();
        }
        return Optional.of(AuctionPricer.snapshot(orderId, order.getStartRate(), order.getEndRate(),
                order.getAuctionStart(), order.getAuctionEnd(), clock.instant()));
    }

    public RelayerState getState() {
        List<String> connected = router.all().stream()
                .map(LedgerAdapter::getChainName)
                .filter(subscriptions::containsKey)
                .sorted()
                .toList();
        List<CrossChainSwap> pendingSwaps = swapViews.values().stream()
                .filter(swap -> !swap.getStatus().isTerminal())
                .map(CrossChainSwap::snapshot)
                .sorted(Comparator.comparing(CrossChainSwap::getCreatedAt))
                .toList();
        List<Order> activeOrders = orderViews.values().stream()
                .filter(order -> !order.getStatus().isTerminal())
                .map(Order::snapshot)
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .toList();
        long completed = orderViews.values().stream().filter(o -> o.getStatus() == OrderStatus.COMPLETED).count();
        long failed = orderViews.values().stream()
                .filter(o -> o.getStatus().isTerminal() && o.getStatus() != OrderStatus.COMPLETED)
                .count();
        return new RelayerState(
                running && !shuttingDown,
                connected,
                new TreeMap<>(lastBlockProcessed),
                pendingSwaps,
                activeOrders,
                new RelayerState.Metrics(orderViews.size(), completed, failed),
                errorLog.recent(STATE_ERROR_LIMIT)
        );
    }
}
