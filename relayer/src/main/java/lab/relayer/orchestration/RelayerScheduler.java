package lab.relayer.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic loops of the coordinator. Each tick only enqueues per-order work, so a slow chain never
 * blocks the scheduler threads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "relayer.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RelayerScheduler {

    private final SwapCoordinator coordinator;

    @Scheduled(fixedDelayString = "${relayer.health-interval-ms:30000}", initialDelayString = "${relayer.health-interval-ms:30000}")
    public void healthCheck() {
        if (!coordinator.isRunning()) {
            return;
        }
        try {
            coordinator.checkHealth();
        } catch (RuntimeException e) {
            log.warn("event=scheduler.health_failed reason={}", e.getMessage());
        }
    }

    @Scheduled(fixedRateString = "${relayer.auction-refresh-interval-ms:1000}")
    public void refreshAuctions() {
        if (coordinator.isRunning()) {
            coordinator.refreshAuctions();
        }
    }

    @Scheduled(fixedDelayString = "${relayer.recovery-interval-ms:5000}")
    public void recover() {
        if (!coordinator.isRunning()) {
            return;
        }
        try {
            coordinator.runRecovery();
        } catch (RuntimeException e) {
            log.warn("event=scheduler.recovery_failed reason={}", e.getMessage());
        }
    }
}
