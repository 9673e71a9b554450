package lab.relayer.orchestration;

import lab.relayer.domain.checkpoint.ChainCheckpoint;
import lab.relayer.domain.checkpoint.ChainCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tracks, per chain, which blocks still have events being handled.
 * <p>
 * The safe checkpoint is the lowest block with an in-flight event, or the last dispatched block when
 * nothing is in flight. Resubscribing from it never skips an unhandled event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckpointTracker {

    private final ChainCheckpointRepository repository;
    private final Clock ledgerClock;

    private final Map<String, NavigableMap<Long, Integer>> inFlight = new HashMap<>();
    private final Map<String, Long> lastDispatched = new HashMap<>();

    public synchronized void begin(String chain, long block) {
        inFlight.computeIfAbsent(chain, k -> new TreeMap<>()).merge(block, 1, Integer::sum);
        lastDispatched.merge(chain, block, Math::max);
    }

    public synchronized void complete(String chain, long block) {
        NavigableMap<Long, Integer> pending = inFlight.get(chain);
        if (pending == null) {
            return;
        }
        pending.computeIfPresent(block, (k, count) -> count <= 1 ? null : count - 1);
    }

    public synchronized long safeCheckpoint(String chain) {
        NavigableMap<Long, Integer> pending = inFlight.get(chain);
        if (pending != null && !pending.isEmpty()) {
            return pending.firstKey();
        }
        return lastDispatched.getOrDefault(chain, 0L);
    }

    public synchronized int inFlightCount(String chain) {
        NavigableMap<Long, Integer> pending = inFlight.get(chain);
        return pending == null ? 0 : pending.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Optional<Long> loadPersisted(String chain) {
        return repository.findById(chain).map(ChainCheckpoint::getSafeBlock);
    }

    public void persist(String chain) {
        long safeBlock = safeCheckpoint(chain);
        ChainCheckpoint checkpoint = repository.findById(chain)
                .orElseGet(() -> ChainCheckpoint.builder()
                        .chain(chain)
                        .safeBlock(safeBlock)
                        .updatedAt(ledgerClock.instant())
                        .build());
        checkpoint.advanceTo(safeBlock, ledgerClock.instant());
        repository.save(checkpoint);
        log.debug("event=checkpoint.persisted chain={} safeBlock={}", chain, checkpoint.getSafeBlock());
    }

    public void persistAll() {
        for (String chain : trackedChains()) {
            persist(chain);
        }
    }

    private synchronized Iterable<String> trackedChains() {
        return Map.copyOf(lastDispatched).keySet();
    }
}
