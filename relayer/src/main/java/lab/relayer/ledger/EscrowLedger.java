package lab.relayer.ledger;

import lab.relayer.auction.AuctionPricer;
import lab.relayer.domain.escrow.Escrow;
import lab.relayer.domain.escrow.EscrowErrorCode;
import lab.relayer.domain.escrow.EscrowException;
import lab.relayer.domain.escrow.EscrowIds;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative escrow state for one chain.
 * <p>
 * Every mutating operation validates first and mutates last, under a single instance lock,
 * so a rejected call leaves no trace. The caller identity is passed explicitly as the first argument.
 */
@Slf4j
public class EscrowLedger {

    public static final Duration DEFAULT_MIN_TIMELOCK = Duration.ofHours(1);
    public static final Duration DEFAULT_MAX_TIMELOCK = Duration.ofDays(7);

    /** Rate reported for escrows without an auction window. */
    public static final BigInteger NO_AUCTION = BigInteger.ZERO;

    private final String owner;
    private final Duration minTimelock;
    private final Duration maxTimelock;
    private final Clock clock;

    private final Map<String, Escrow> escrows = new HashMap<>();
    private final Map<String, String> escrowIdByOrder = new HashMap<>();
    private final Map<String, String> pairedEscrows = new HashMap<>();
    private final Set<String> authorizedResolvers = new HashSet<>();
    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();

    public EscrowLedger(String owner, Duration minTimelock, Duration maxTimelock, Clock clock) {
        if (!EscrowIds.isValidAddress(owner)) {
            throw new IllegalArgumentException("invalid ledger owner: " + owner);
        }
        if (minTimelock.isNegative() || maxTimelock.compareTo(minTimelock) < 0) {
            throw new IllegalArgumentException("invalid timelock bounds: " + minTimelock + ".." + maxTimelock);
        }
        this.owner = normalize(owner);
        this.minTimelock = minTimelock;
        this.maxTimelock = maxTimelock;
        this.clock = clock;
    }

    public EscrowLedger(String owner, Clock clock) {
        this(owner, DEFAULT_MIN_TIMELOCK, DEFAULT_MAX_TIMELOCK, clock);
    }

    public synchronized Escrow lock(
            String caller,
            String secretHash,
            long timelockSeconds,
            String receiver,
            String resolver,
            String orderId,
            long auctionDurationSeconds,
            BigInteger startRate,
            BigInteger endRate,
            BigInteger amount,
            String asset
    ) {
        requireAmount(amount);
        requireAddress(caller, "sender");
        requireAddress(receiver, "receiver");
        requireAddress(asset, "asset");
        if (resolver != null) {
            requireAddress(resolver, "resolver");
        }
        if (EscrowIds.isZeroAddress(receiver)) {
            throw new EscrowException(EscrowErrorCode.INVALID_ADDRESS, "receiver must not be the zero address");
        }
        requireSecretHash(secretHash);
        requireOrderId(orderId);
        requireTimelock(timelockSeconds);
        if (auctionDurationSeconds <= 0
                || startRate == null || endRate == null
                || startRate.signum() <= 0 || endRate.signum() <= 0
                || startRate.compareTo(endRate) < 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_AUCTION_PARAMETERS,
                    "duration=" + auctionDurationSeconds + " startRate=" + startRate + " endRate=" + endRate);
        }

        Instant now = now();
        Instant timelock = now.plusSeconds(timelockSeconds);
        String sender = normalize(caller);
        String escrowId = EscrowIds.derive(sender, normalize(receiver), normalize(asset), amount, secretHash, timelock, orderId);
        requireUnused(escrowId, orderId);
        debit(sender, normalize(asset), amount);

        Escrow escrow = Escrow.builder()
                .escrowId(escrowId)
                .sender(sender)
                .receiver(normalize(receiver))
                .resolver(resolver == null ? null : normalize(resolver))
                .amount(amount)
                .asset(normalize(asset))
                .secretHash(secretHash.toLowerCase(Locale.ROOT))
                .timelock(timelock)
                .orderId(orderId)
                .createdAt(now)
                .auctionStart(now)
                .auctionEnd(now.plusSeconds(auctionDurationSeconds))
                .startRate(startRate)
                .endRate(endRate)
                .resolverLeg(false)
                .build();
        store(escrow);
        log.debug("event=ledger.lock escrowId={} orderId={} amount={}", escrowId, orderId, amount);
        return escrow.snapshot();
    }

    public synchronized Escrow lockAsResolver(
            String caller,
            String secretHash,
            long timelockSeconds,
            String receiver,
            String orderId,
            String sourceEscrowId,
            BigInteger amount,
            String asset
    ) {
        requireAddress(caller, "resolver");
        if (!authorizedResolvers.contains(normalize(caller))) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED, "resolver not authorized: " + caller);
        }
        requireAmount(amount);
        requireAddress(receiver, "receiver");
        requireAddress(asset, "asset");
        if (EscrowIds.isZeroAddress(receiver)) {
            throw new EscrowException(EscrowErrorCode.INVALID_ADDRESS, "receiver must not be the zero address");
        }
        requireSecretHash(secretHash);
        requireOrderId(orderId);
        if (!EscrowIds.isValidHash(sourceEscrowId)) {
            throw new EscrowException(EscrowErrorCode.NOT_FOUND, "malformed source escrow id: " + sourceEscrowId);
        }
        requireTimelock(timelockSeconds);

        Instant now = now();
        Instant timelock = now.plusSeconds(timelockSeconds);
        String sender = normalize(caller);
        String escrowId = EscrowIds.derive(sender, normalize(receiver), normalize(asset), amount, secretHash, timelock, orderId);
        requireUnused(escrowId, orderId);
        debit(sender, normalize(asset), amount);

        String source = sourceEscrowId.toLowerCase(Locale.ROOT);
        Escrow escrow = Escrow.builder()
                .escrowId(escrowId)
                .sender(sender)
                .receiver(normalize(receiver))
                .resolver(sender)
                .amount(amount)
                .asset(normalize(asset))
                .secretHash(secretHash.toLowerCase(Locale.ROOT))
                .timelock(timelock)
                .orderId(orderId)
                .createdAt(now)
                .auctionStart(now)
                .auctionEnd(now)
                .startRate(NO_AUCTION)
                .endRate(NO_AUCTION)
                .resolverLeg(true)
                .pairedEscrowId(source)
                .build();
        store(escrow);
        pairedEscrows.put(escrowId, source);
        pairedEscrows.put(source, escrowId);
        log.debug("event=ledger.lock_as_resolver escrowId={} orderId={} sourceEscrowId={}", escrowId, orderId, source);
        return escrow.snapshot();
    }

    /**
     * Releases the locked value to the receiver.
     *
     * @return the auction rate at the time of withdrawal, or {@link #NO_AUCTION} for resolver legs
     */
    public synchronized BigInteger withdraw(String caller, String escrowId, String secret) {
        Escrow escrow = require(escrowId);
        ensureNotTerminal(escrow);
        if (!escrow.getReceiver().equalsIgnoreCase(caller)) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED, "only the receiver may withdraw " + escrow.getEscrowId());
        }
        if (!EscrowIds.secretMatches(secret, escrow.getSecretHash())) {
            throw new EscrowException(EscrowErrorCode.INVALID_SECRET, "secret does not match hash of " + escrow.getEscrowId());
        }
        BigInteger rate = rateOf(escrow, now());
        escrow.markWithdrawn();
        credit(escrow.getReceiver(), escrow.getAsset(), escrow.getAmount());
        log.debug("event=ledger.withdraw escrowId={} rate={}", escrow.getEscrowId(), rate);
        return rate;
    }

    public synchronized void cancel(String caller, String escrowId) {
        Escrow escrow = require(escrowId);
        ensureNotTerminal(escrow);
        if (!escrow.getSender().equalsIgnoreCase(caller)) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED, "only the sender may cancel " + escrow.getEscrowId());
        }
        Instant now = now();
        if (now.isBefore(escrow.getTimelock())) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_NOT_EXPIRED,
                    "timelock " + escrow.getTimelock() + " not reached at " + now);
        }
        escrow.markCancelled();
        credit(escrow.getSender(), escrow.getAsset(), escrow.getAmount());
        log.debug("event=ledger.cancel escrowId={}", escrow.getEscrowId());
    }

    public synchronized BigInteger currentRate(String orderId) {
        String escrowId = escrowIdByOrder.get(orderId);
        if (escrowId == null) {
            throw new EscrowException(EscrowErrorCode.NOT_FOUND, "no escrow for order " + orderId);
        }
        return rateOf(escrows.get(escrowId), now());
    }

    public synchronized void setResolverAuthorization(String caller, String resolver, boolean authorized) {
        if (caller == null || !owner.equalsIgnoreCase(caller)) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED, "only the owner may manage resolvers");
        }
        requireAddress(resolver, "resolver");
        if (authorized) {
            authorizedResolvers.add(normalize(resolver));
        } else {
            authorizedResolvers.remove(normalize(resolver));
        }
        log.info("event=ledger.resolver_authorization resolver={} authorized={}", resolver, authorized);
    }

    public synchronized boolean isAuthorizedResolver(String resolver) {
        return resolver != null && authorizedResolvers.contains(normalize(resolver));
    }

    public synchronized Optional<Escrow> getEscrow(String escrowId) {
        if (escrowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(escrows.get(escrowId.toLowerCase(Locale.ROOT))).map(Escrow::snapshot);
    }

    public synchronized Optional<String> findEscrowIdByOrder(String orderId) {
        return Optional.ofNullable(escrowIdByOrder.get(orderId));
    }

    public synchronized Optional<String> pairedEscrowId(String escrowId) {
        if (escrowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pairedEscrows.get(escrowId.toLowerCase(Locale.ROOT)));
    }

    public synchronized BigInteger balanceOf(String account, String asset) {
        return balances.getOrDefault(normalize(account), Map.of()).getOrDefault(normalize(asset), BigInteger.ZERO);
    }

    /** Mints value to an account. Used to seed simulated chains. */
    public synchronized void fund(String account, String asset, BigInteger amount) {
        requireAddress(account, "account");
        requireAddress(asset, "asset");
        requireAmount(amount);
        credit(normalize(account), normalize(asset), amount);
    }

    public String getOwner() {
        return owner;
    }

    public Duration getMinTimelock() {
        return minTimelock;
    }

    public Duration getMaxTimelock() {
        return maxTimelock;
    }

    private BigInteger rateOf(Escrow escrow, Instant now) {
        if (!escrow.hasAuction()) {
            return NO_AUCTION;
        }
        return AuctionPricer.currentRate(
                escrow.getStartRate(), escrow.getEndRate(), escrow.getAuctionStart(), escrow.getAuctionEnd(), now);
    }

    private void store(Escrow escrow) {
        escrows.put(escrow.getEscrowId(), escrow);
        escrowIdByOrder.put(escrow.getOrderId(), escrow.getEscrowId());
    }

    private Escrow require(String escrowId) {
        Escrow escrow = escrowId == null ? null : escrows.get(escrowId.toLowerCase(Locale.ROOT));
        if (escrow == null) {
            throw new EscrowException(EscrowErrorCode.NOT_FOUND, "escrow not found: " + escrowId);
        }
        return escrow;
    }

    private void ensureNotTerminal(Escrow escrow) {
        if (escrow.isWithdrawn()) {
            throw new EscrowException(EscrowErrorCode.ALREADY_WITHDRAWN, "escrow already withdrawn: " + escrow.getEscrowId());
        }
        if (escrow.isCancelled()) {
            throw new EscrowException(EscrowErrorCode.ALREADY_CANCELLED, "escrow already cancelled: " + escrow.getEscrowId());
        }
    }

    private void requireUnused(String escrowId, String orderId) {
        if (escrows.containsKey(escrowId)) {
            throw new EscrowException(EscrowErrorCode.ALREADY_EXISTS, "escrow already exists: " + escrowId);
        }
        if (escrowIdByOrder.containsKey(orderId)) {
            throw new EscrowException(EscrowErrorCode.ALREADY_EXISTS, "order already has an escrow: " + orderId);
        }
    }

    private void requireTimelock(long timelockSeconds) {
        if (timelockSeconds < minTimelock.getSeconds() || timelockSeconds > maxTimelock.getSeconds()) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_OUT_OF_RANGE,
                    "timelock " + timelockSeconds + "s outside [" + minTimelock.getSeconds() + ", " + maxTimelock.getSeconds() + "]");
        }
    }

    private void debit(String account, String asset, BigInteger amount) {
        BigInteger balance = balanceOf(account, asset);
        if (balance.compareTo(amount) < 0) {
            throw new EscrowException(EscrowErrorCode.INSUFFICIENT_FUNDS,
                    "balance " + balance + " below " + amount + " for " + account);
        }
        balances.computeIfAbsent(account, k -> new HashMap<>()).put(asset, balance.subtract(amount));
    }

    private void credit(String account, String asset, BigInteger amount) {
        balances.computeIfAbsent(account, k -> new HashMap<>()).merge(asset, amount, BigInteger::add);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_AMOUNT, "amount must be positive: " + amount);
        }
    }

    private static void requireAddress(String address, String field) {
        if (!EscrowIds.isValidAddress(address)) {
            throw new EscrowException(EscrowErrorCode.INVALID_ADDRESS, "invalid " + field + " address: " + address);
        }
    }

    private static void requireSecretHash(String secretHash) {
        if (!EscrowIds.isValidHash(secretHash)) {
            throw new EscrowException(EscrowErrorCode.INVALID_SECRET_HASH, "secret hash must be 32 bytes of hex");
        }
    }

    private static void requireOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            throw new EscrowException(EscrowErrorCode.INVALID_ORDER_ID, "order id must not be blank");
        }
    }

    private static String normalize(String address) {
        return address.toLowerCase(Locale.ROOT);
    }
}
