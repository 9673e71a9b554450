package lab.relayer.adapter;

import lab.relayer.domain.escrow.Escrow;
import lab.relayer.ledger.EscrowLedger;
import lab.relayer.ledger.SimulatedChain;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link LedgerAdapter} backed by an in-process {@link SimulatedChain}.
 * <p>
 * Submissions run against the ledger immediately and are mined into their own block. A ledger rejection
 * becomes a reverted receipt that {@link #waitConfirmed} reports. While the chain is in outage, submissions
 * fail transiently and subscriptions stall until it recovers.
 */
@Slf4j
public class SimulatedLedgerAdapter implements LedgerAdapter {

    private static final Duration DISPATCH_POLL = Duration.ofMillis(100);

    private final SimulatedChain chain;
    private final String account;
    private final ChainSettings settings;
    private final int submitRetries;
    private final Duration retryBackoff;
    private final AtomicInteger subscriptionSeq = new AtomicInteger();

    public SimulatedLedgerAdapter(
            SimulatedChain chain,
            String account,
            ChainSettings settings,
            int submitRetries,
            Duration retryBackoff
    ) {
        this.chain = chain;
        this.account = account.toLowerCase(Locale.ROOT);
        this.settings = settings;
        this.submitRetries = Math.max(1, submitRetries);
        this.retryBackoff = retryBackoff;
    }

    @Override
    public String getChainName() {
        return chain.getName();
    }

    @Override
    public String getAccountAddress() {
        return account;
    }

    @Override
    public ChainSettings getSettings() {
        return settings;
    }

    @Override
    public Subscription subscribe(long fromBlock, Consumer<EscrowEvent> onEvent) {
        SimulatedSubscription subscription = new SimulatedSubscription(fromBlock, onEvent);
        subscription.start();
        log.info("event=adapter.subscribe chain={} fromBlock={}", getChainName(), fromBlock);
        return subscription;
    }

    @Override
    public PendingTx submitLock(LockCommand command) {
        return submit("lock", () -> chain.execute(account, "lock", (ledger, block) -> {
            Escrow escrow = ledger.lock(
                    account,
                    command.secretHash(),
                    command.timelockSeconds(),
                    command.receiver(),
                    command.resolver(),
                    command.orderId(),
                    command.auctionDurationSeconds(),
                    command.startRate(),
                    command.endRate(),
                    command.amount(),
                    command.asset()
            );
            return List.of(EscrowEvent.created(block.chain(), block.blockNumber(), block.txHash(), block.timestamp(), escrow));
        }));
    }

    @Override
    public PendingTx submitLockAsResolver(ResolverLockCommand command) {
        return submit("lockAsResolver", () -> chain.execute(account, "lockAsResolver", (ledger, block) -> {
            Escrow escrow = ledger.lockAsResolver(
                    account,
                    command.secretHash(),
                    command.timelockSeconds(),
                    command.receiver(),
                    command.orderId(),
                    command.sourceEscrowId(),
                    command.amount(),
                    command.asset()
            );
            return List.of(EscrowEvent.created(block.chain(), block.blockNumber(), block.txHash(), block.timestamp(), escrow));
        }));
    }

    @Override
    public PendingTx submitWithdraw(String escrowId, String secret) {
        return submit("withdraw", () -> chain.execute(account, "withdraw:" + escrowId, (ledger, block) -> {
            BigInteger rate = ledger.withdraw(account, escrowId, secret);
            Escrow escrow = requireEscrow(ledger, escrowId);
            return List.of(EscrowEvent.withdrawn(block.chain(), block.blockNumber(), block.txHash(), block.timestamp(), escrow, secret, rate));
        }));
    }

    @Override
    public PendingTx submitCancel(String escrowId) {
        return submit("cancel", () -> chain.execute(account, "cancel:" + escrowId, (ledger, block) -> {
            ledger.cancel(account, escrowId);
            Escrow escrow = requireEscrow(ledger, escrowId);
            return List.of(EscrowEvent.cancelled(block.chain(), block.blockNumber(), block.txHash(), block.timestamp(), escrow));
        }));
    }

    @Override
    public Confirmation waitConfirmed(PendingTx pending, int requiredConfirmations) {
        int required = Math.max(1, requiredConfirmations);
        long deadline = System.nanoTime() + settings.confirmationTimeout().toNanos();
        long pollMillis = Math.max(10L, Math.min(settings.blockTime().toMillis() / 2, 250L));
        try {
            while (System.nanoTime() < deadline) {
                if (!chain.isInOutage()) {
                    Optional<SimulatedChain.TxReceipt> receipt = chain.receipt(pending.txHash());
                    if (receipt.isPresent()) {
                        SimulatedChain.TxReceipt r = receipt.get();
                        if (!r.success()) {
                            throw new TransactionRevertedException(getChainName(), r.txHash(), r.errorCode(), r.revertReason());
                        }
                        long depth = chain.head() - r.blockNumber() + 1;
                        if (depth >= required) {
                            log.debug("event=adapter.confirmed chain={} txHash={} depth={}", getChainName(), r.txHash(), depth);
                            return new Confirmation(r.txHash(), r.blockNumber(), (int) depth);
                        }
                    }
                }
                TimeUnit.MILLISECONDS.sleep(pollMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientLedgerException(getChainName(), "interrupted while waiting for " + pending.txHash(), e);
        }
        throw new TransientLedgerException(getChainName(),
                "confirmation timeout after " + settings.confirmationTimeout() + " for " + pending.txHash());
    }

    @Override
    public BigInteger currentRate(String orderId) {
        ensureReachable();
        return chain.getLedger().currentRate(orderId);
    }

    @Override
    public Optional<Escrow> findEscrow(String escrowId) {
        ensureReachable();
        return chain.getLedger().getEscrow(escrowId);
    }

    @Override
    public long latestBlock() {
        ensureReachable();
        return chain.head();
    }

    @Override
    public boolean isHealthy() {
        return !chain.isInOutage();
    }

    public SimulatedChain getChain() {
        return chain;
    }

    @Override
    public void close() {
        chain.close();
        log.info("event=adapter.closed chain={}", getChainName());
    }

    private PendingTx submit(String kind, Supplier<SimulatedChain.TxReceipt> send) {
        TransientLedgerException last = null;
        for (int attempt = 1; attempt <= submitRetries; attempt++) {
            try {
                ensureReachable();
                SimulatedChain.TxReceipt receipt = send.get();
                log.info("event=adapter.submit chain={} kind={} txHash={} block={} attempt={}",
                        getChainName(), kind, receipt.txHash(), receipt.blockNumber(), attempt);
                return new PendingTx(getChainName(), receipt.txHash(), receipt.blockNumber());
            } catch (TransientLedgerException e) {
                last = e;
                log.warn("event=adapter.submit.retry chain={} kind={} attempt={} reason={}",
                        getChainName(), kind, attempt, e.getMessage());
                if (attempt < submitRetries) {
                    backoff(attempt);
                }
            }
        }
        throw last;
    }

    private void backoff(int attempt) {
        try {
            TimeUnit.MILLISECONDS.sleep(retryBackoff.toMillis() << (attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientLedgerException(getChainName(), "interrupted during retry backoff", e);
        }
    }

    private void ensureReachable() {
        if (chain.isInOutage()) {
            throw new TransientLedgerException(getChainName(), "chain " + getChainName() + " unreachable");
        }
    }

    private static Escrow requireEscrow(EscrowLedger ledger, String escrowId) {
        return ledger.getEscrow(escrowId)
                .orElseThrow(() -> new IllegalStateException("escrow vanished after mutation: " + escrowId));
    }

    private final class SimulatedSubscription implements Subscription {

        private final Consumer<EscrowEvent> onEvent;
        private final Thread dispatcher;
        private volatile boolean active = true;
        private volatile long lastDeliveredBlock;
        private int cursor;

        private SimulatedSubscription(long fromBlock, Consumer<EscrowEvent> onEvent) {
            this.onEvent = onEvent;
            this.cursor = chain.indexOfBlock(fromBlock);
            this.lastDeliveredBlock = Math.max(0L, fromBlock - 1);
            this.dispatcher = new Thread(this::dispatch,
                    "chain-" + getChainName() + "-events-" + subscriptionSeq.incrementAndGet());
            this.dispatcher.setDaemon(true);
        }

        private void start() {
            dispatcher.start();
        }

        private void dispatch() {
            while (active) {
                try {
                    if (chain.isInOutage()) {
                        TimeUnit.MILLISECONDS.sleep(DISPATCH_POLL.toMillis());
                        continue;
                    }
                    for (EscrowEvent event : chain.awaitEvents(cursor, DISPATCH_POLL)) {
                        if (!active) {
                            return;
                        }
                        deliver(event);
                        cursor++;
                        lastDeliveredBlock = event.blockNumber();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }

        private void deliver(EscrowEvent event) {
            try {
                onEvent.accept(event);
            } catch (RuntimeException e) {
                log.error("event=adapter.dispatch.failed chain={} escrowId={} block={} reason={}",
                        getChainName(), event.escrowId(), event.blockNumber(), e.getMessage(), e);
            }
        }

        @Override
        public long lastDeliveredBlock() {
            return lastDeliveredBlock;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            dispatcher.interrupt();
            log.info("event=adapter.unsubscribe chain={} lastDeliveredBlock={}", getChainName(), lastDeliveredBlock);
        }
    }
}
