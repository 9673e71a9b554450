package lab.relayer.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Push feed for observers. A failing listener is logged and skipped.
 */
@Component
@Slf4j
public class NotificationFeed {

    private final List<Consumer<RelayerNotification>> listeners = new CopyOnWriteArrayList<>();

    public AutoCloseable subscribe(Consumer<RelayerNotification> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(RelayerNotification notification) {
        for (Consumer<RelayerNotification> listener : listeners) {
            try {
                listener.accept(notification);
            } catch (RuntimeException e) {
                log.warn("event=notification.listener_failed type={} orderId={} reason={}",
                        notification.type(), notification.orderId(), e.getMessage());
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
