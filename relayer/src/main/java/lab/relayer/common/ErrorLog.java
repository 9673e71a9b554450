package lab.relayer.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory record of operator-visible errors and warnings. Oldest entries are evicted first.
 */
@Component
@Slf4j
public class ErrorLog {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Clock clock;
    private final Deque<ErrorRecord> records = new ArrayDeque<>();

    public ErrorLog(@Value("${relayer.error-log.capacity:1000}") int capacity, Clock ledgerClock) {
        this.capacity = capacity;
        this.clock = ledgerClock;
    }

    public void error(String message, String orderId, String chain) {
        append(ErrorRecord.Level.ERROR, message, orderId, chain);
    }

    public void warn(String message, String orderId, String chain) {
        append(ErrorRecord.Level.WARNING, message, orderId, chain);
    }

    public void info(String message, String orderId, String chain) {
        append(ErrorRecord.Level.INFO, message, orderId, chain);
    }

    /** Newest {@code limit} records, oldest first. */
    public synchronized List<ErrorRecord> recent(int limit) {
        List<ErrorRecord> all = new ArrayList<>(records);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return records.size();
    }

    public int getCapacity() {
        return capacity;
    }

    private synchronized void append(ErrorRecord.Level level, String message, String orderId, String chain) {
        records.addLast(new ErrorRecord(clock.instant(), level, message, orderId, chain));
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }
}
