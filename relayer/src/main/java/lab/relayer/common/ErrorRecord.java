package lab.relayer.common;

import java.time.Instant;

public record ErrorRecord(
        Instant timestamp,
        Level level,
        String message,
        String orderId,
        String chain
) {

    public enum Level {
        ERROR,
        WARNING,
        INFO
    }
}
