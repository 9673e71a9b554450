package lab.relayer.orchestration;

import jakarta.annotation.PreDestroy;
import lab.relayer.common.RelayerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs tasks on a shared worker pool while keeping tasks with the same key strictly ordered.
 * <p>
 * Each key keeps the tail future of its chain; a new task is appended to that tail, so at most one
 * task per key runs at a time and tasks for different keys run in parallel.
 */
@Component
@Slf4j
public class OrderSerialExecutor {

    private final ExecutorService workers;
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    @Autowired
    public OrderSerialExecutor(RelayerProperties properties) {
        this(properties.getWorkerThreads());
    }

    OrderSerialExecutor(int workerThreads) {
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "order-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Void> submit(String key, Runnable task) {
        return call(key, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Appends {@code task} to the chain for {@code key}. A failing task completes its own future
     * exceptionally but never blocks the tasks queued after it.
     */
    public <T> CompletableFuture<T> call(String key, Supplier<T> task) {
        if (!accepting) {
            throw new RejectedExecutionException("executor is shutting down, rejected task for " + key);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<?> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous.handle((ignored, error) -> null).thenRunAsync(() -> {
                try {
                    result.complete(task.get());
                } catch (RuntimeException e) {
                    log.debug("event=order_executor.task_failed key={} reason={}", k, e.getMessage());
                    result.completeExceptionally(e);
                }
            }, workers);
        });
        next.whenComplete((ignored, error) -> tails.remove(key, next));
        return result;
    }

    public int inFlightKeys() {
        return tails.size();
    }

    /**
     * Stops accepting tasks and waits for queued ones up to {@code timeout}.
     *
     * @return true if everything finished in time
     */
    public boolean drain(Duration timeout) {
        accepting = false;
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!tails.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("event=order_executor.drain_timeout pendingKeys={}", tails.size());
                return false;
            }
            try {
                CompletableFuture.allOf(tails.values().toArray(new CompletableFuture<?>[0]))
                        .get(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException | TimeoutException e) {
                log.debug("event=order_executor.drain_wait reason={}", e.getMessage());
            }
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        workers.shutdownNow();
    }
}
