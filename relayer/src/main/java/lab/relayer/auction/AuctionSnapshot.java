package lab.relayer.auction;

import java.math.BigInteger;
import java.time.Instant;

public record AuctionSnapshot(
        String orderId,
        BigInteger currentRate,
        long elapsedSeconds,
        long totalDurationSeconds,
        int percentComplete,
        boolean active,
        Instant observedAt
) {}
