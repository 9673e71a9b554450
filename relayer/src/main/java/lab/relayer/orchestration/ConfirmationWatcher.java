package lab.relayer.orchestration;

import jakarta.annotation.PreDestroy;
import lab.relayer.adapter.LedgerAdapter;
import lab.relayer.adapter.LedgerAdapterException;
import lab.relayer.adapter.TransientLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Waits for transaction confirmations on its own threads so order workers stay free.
 * <p>
 * The outcome callback runs on a watcher thread; callers that touch order state hand it back to
 * the order's serial chain.
 */
@Component
@Slf4j
public class ConfirmationWatcher {

    public record Outcome(
            LedgerAdapter.PendingTx pending,
            LedgerAdapter.Confirmation confirmation,
            LedgerAdapterException failure
    ) {

        public boolean confirmed() {
            return confirmation != null;
        }
    }

    private final ExecutorService watchers;
    private final Object monitor = new Object();
    private int inFlight;

    public ConfirmationWatcher(@Value("${relayer.confirmation-threads:16}") int threads) {
        AtomicInteger seq = new AtomicInteger();
        this.watchers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "confirmation-watcher-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Waits for {@code pending} to reach the chain's confirmation depth, then hands the outcome to {@code onDone}.
     * The watch counts as in flight until {@code onDone} has returned.
     */
    public void watch(LedgerAdapter adapter, LedgerAdapter.PendingTx pending, Consumer<Outcome> onDone) {
        synchronized (monitor) {
            inFlight++;
        }
        try {
            watchers.execute(() -> {
                try {
                    onDone.accept(await(adapter, pending));
                } catch (RuntimeException e) {
                    log.error("event=confirmation.callback_failed chain={} txHash={} reason={}",
                            pending.chain(), pending.txHash(), e.getMessage(), e);
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            release();
            throw e;
        }
    }

    private Outcome await(LedgerAdapter adapter, LedgerAdapter.PendingTx pending) {
        try {
            LedgerAdapter.Confirmation confirmation = adapter.waitConfirmed(pending, adapter.getSettings().confirmations());
            return new Outcome(pending, confirmation, null);
        } catch (LedgerAdapterException e) {
            return new Outcome(pending, null, e);
        } catch (RuntimeException e) {
            return new Outcome(pending, null,
                    new TransientLedgerException(pending.chain(), "confirmation wait failed: " + e.getMessage(), e));
        }
    }

    private void release() {
        synchronized (monitor) {
            inFlight--;
            monitor.notifyAll();
        }
    }

    public int inFlightCount() {
        synchronized (monitor) {
            return inFlight;
        }
    }

    /**
     * Blocks until every watch has delivered its outcome, or {@code timeout} passes.
     *
     * @return true if nothing is left in flight
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (inFlight > 0) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0) {
                    log.warn("event=confirmation.await_idle_timeout inFlight={}", inFlight);
                    return false;
                }
                try {
                    monitor.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    @PreDestroy
    public void shutdown() {
        watchers.shutdownNow();
    }
}
