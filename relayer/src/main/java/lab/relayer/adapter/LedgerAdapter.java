package lab.relayer.adapter;

import lab.relayer.domain.escrow.Escrow;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Chain-specific access to one escrow ledger. The coordinator only talks to chains through this contract.
 */
public interface LedgerAdapter extends AutoCloseable {

    String getChainName();

    /** Account the relayer signs with on this chain. */
    String getAccountAddress();

    ChainSettings getSettings();

    /**
     * Delivers every escrow event from {@code fromBlock} onwards, in ledger order, on a dedicated thread.
     */
    Subscription subscribe(long fromBlock, Consumer<EscrowEvent> onEvent);

    PendingTx submitLock(LockCommand command);

    PendingTx submitLockAsResolver(ResolverLockCommand command);

    PendingTx submitWithdraw(String escrowId, String secret);

    PendingTx submitCancel(String escrowId);

    /**
     * Blocks until the transaction has {@code requiredConfirmations} blocks on top of and including its own.
     *
     * @throws TransientLedgerException on timeout or connectivity loss
     * @throws TransactionRevertedException when the ledger rejected the transaction
     */
    Confirmation waitConfirmed(PendingTx pending, int requiredConfirmations);

    BigInteger currentRate(String orderId);

    Optional<Escrow> findEscrow(String escrowId);

    long latestBlock();

    boolean isHealthy();

    @Override
    void close();

    interface Subscription extends AutoCloseable {

        long lastDeliveredBlock();

        boolean isActive();

        @Override
        void close();
    }

    record ChainSettings(
            int confirmations,
            Duration blockTime,
            Duration confirmationTimeout,
            Duration minTimelock,
            Duration maxTimelock
    ) {}

    record LockCommand(
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
    ) {}

    record ResolverLockCommand(
            String secretHash,
            long timelockSeconds,
            String receiver,
            String orderId,
            String sourceEscrowId,
            BigInteger amount,
            String asset
    ) {}

    record PendingTx(
            String chain,
            String txHash,
            long blockNumber
    ) {}

    record Confirmation(
            String txHash,
            long blockNumber,
            int confirmations
    ) {}
}
