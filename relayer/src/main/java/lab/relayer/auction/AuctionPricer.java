package lab.relayer.auction;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Dutch auction pricing shared by the escrow ledger and the coordinator feed.
 * <p>
 * Rates are fixed-point integers with six decimals ({@code 1_000_000} is a rate of 1.0). All arithmetic is
 * integer-only with floor division so every caller derives the same value for the same inputs.
 */
public final class AuctionPricer {

    private AuctionPricer() {
    }

    public static BigInteger currentRate(
            BigInteger startRate,
            BigInteger endRate,
            Instant startTime,
            Instant endTime,
            Instant now
    ) {
        if (!now.isAfter(startTime)) {
            return startRate;
        }
        if (!now.isBefore(endTime)) {
            return endRate;
        }
        BigInteger elapsed = BigInteger.valueOf(Duration.between(startTime, now).getSeconds());
        BigInteger duration = BigInteger.valueOf(Duration.between(startTime, endTime).getSeconds());
        if (duration.signum() <= 0) {
            return endRate;
        }
        BigInteger decay = startRate.subtract(endRate).multiply(elapsed).divide(duration);
        return startRate.subtract(decay);
    }

    public static AuctionSnapshot snapshot(
            String orderId,
            BigInteger startRate,
            BigInteger endRate,
            Instant startTime,
            Instant endTime,
            Instant now
    ) {
        long total = Math.max(0L, Duration.between(startTime, endTime).getSeconds());
        long elapsed = Math.min(total, Math.max(0L, Duration.between(startTime, now).getSeconds()));
        int percent = total == 0 ? 100 : (int) (elapsed * 100 / total);
        boolean active = !now.isBefore(startTime) && now.isBefore(endTime);
        return new AuctionSnapshot(
                orderId,
                currentRate(startRate, endRate, startTime, endTime, now),
                elapsed,
                total,
                percent,
                active,
                now
        );
    }
}
