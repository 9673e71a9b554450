package lab.relayer.ledger;

import lab.relayer.adapter.EscrowEvent;
import lab.relayer.domain.escrow.EscrowErrorCode;
import lab.relayer.domain.escrow.EscrowException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process chain around one {@link EscrowLedger}: a block counter, transaction receipts and an
 * append-only event log. Each submitted transaction is mined in its own block; an optional producer
 * mines empty blocks at the configured block time so confirmations accrue.
 */
@Slf4j
public class SimulatedChain implements AutoCloseable {

    @FunctionalInterface
    public interface Transaction {
        List<EscrowEvent> apply(EscrowLedger ledger, BlockContext block);
    }

    public record BlockContext(String chain, long blockNumber, String txHash, Instant timestamp) {}

    public record TxReceipt(
            String txHash,
            long blockNumber,
            boolean success,
            EscrowErrorCode errorCode,
            String revertReason
    ) {}

    private final String name;
    private final EscrowLedger ledger;
    private final Clock clock;

    private final Object monitor = new Object();
    private final List<EscrowEvent> eventLog = new ArrayList<>();
    private final Map<String, TxReceipt> receipts = new HashMap<>();
    private long head;
    private volatile boolean outage;

    private ScheduledExecutorService blockProducer;

    public SimulatedChain(String name, EscrowLedger ledger, Clock clock) {
        this.name = name;
        this.ledger = ledger;
        this.clock = clock;
    }

    public TxReceipt execute(String caller, String kind, Transaction transaction) {
        synchronized (monitor) {
            long blockNumber = ++head;
            String txHash = Hash.sha3String(name + ":" + blockNumber + ":" + kind + ":" + caller);
            BlockContext block = new BlockContext(name, blockNumber, txHash, clock.instant().truncatedTo(ChronoUnit.SECONDS));
            TxReceipt receipt;
            try {
                List<EscrowEvent> events = transaction.apply(ledger, block);
                eventLog.addAll(events);
                receipt = new TxReceipt(txHash, blockNumber, true, null, null);
            } catch (EscrowException e) {
                receipt = new TxReceipt(txHash, blockNumber, false, e.getCode(), e.getMessage());
                log.debug("event=chain.tx_reverted chain={} kind={} txHash={} code={}", name, kind, txHash, e.getCode());
            }
            receipts.put(txHash, receipt);
            monitor.notifyAll();
            return receipt;
        }
    }

    public long mineBlock() {
        synchronized (monitor) {
            head++;
            monitor.notifyAll();
            return head;
        }
    }

    public long head() {
        synchronized (monitor) {
            return head;
        }
    }

    public Optional<TxReceipt> receipt(String txHash) {
        synchronized (monitor) {
            return Optional.ofNullable(receipts.get(txHash));
        }
    }

    /** Index of the first logged event at or after {@code fromBlock}. */
    public int indexOfBlock(long fromBlock) {
        synchronized (monitor) {
            for (int i = 0; i < eventLog.size(); i++) {
                if (eventLog.get(i).blockNumber() >= fromBlock) {
                    return i;
                }
            }
            return eventLog.size();
        }
    }

    /**
     * Returns the events logged at or after {@code fromIndex}, waiting up to {@code timeout} for at least one.
     */
    public List<EscrowEvent> awaitEvents(int fromIndex, Duration timeout) throws InterruptedException {
        synchronized (monitor) {
            if (eventLog.size() <= fromIndex) {
                monitor.wait(Math.max(1L, timeout.toMillis()));
            }
            if (eventLog.size() <= fromIndex) {
                return List.of();
            }
            return List.copyOf(eventLog.subList(fromIndex, eventLog.size()));
        }
    }

    public List<EscrowEvent> events() {
        synchronized (monitor) {
            return List.copyOf(eventLog);
        }
    }

    public void startBlockProducer(Duration blockTime) {
        if (blockTime.isZero() || blockTime.isNegative() || blockProducer != null) {
            return;
        }
        blockProducer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chain-" + name + "-blocks");
            t.setDaemon(true);
            return t;
        });
        blockProducer.scheduleAtFixedRate(this::mineBlock, blockTime.toMillis(), blockTime.toMillis(), TimeUnit.MILLISECONDS);
        log.info("event=chain.block_producer_started chain={} blockTimeMs={}", name, blockTime.toMillis());
    }

    public void setOutage(boolean outage) {
        this.outage = outage;
        log.info("event=chain.outage chain={} outage={}", name, outage);
    }

    public boolean isInOutage() {
        return outage;
    }

    public String getName() {
        return name;
    }

    public EscrowLedger getLedger() {
        return ledger;
    }

    @Override
    public void close() {
        if (blockProducer != null) {
            blockProducer.shutdownNow();
        }
    }
}
