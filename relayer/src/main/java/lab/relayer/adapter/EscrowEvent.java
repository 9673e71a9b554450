package lab.relayer.adapter;

import lab.relayer.domain.escrow.Escrow;
import lombok.Builder;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledger event as delivered to subscribers. Fields not carried by a given type are null.
 */
@Builder(toBuilder = true)
public record EscrowEvent(
        EscrowEventType type,
        String chain,
        String escrowId,
        String orderId,
        long blockNumber,
        String txHash,
        Instant timestamp,
        String sender,
        String receiver,
        String resolver,
        BigInteger amount,
        String secretHash,
        Instant timelock,
        String asset,
        BigInteger startRate,
        BigInteger endRate,
        Instant auctionStart,
        Instant auctionEnd,
        String pairedEscrowId,
        String secret,
        BigInteger executionRate,
        BigInteger refundAmount
) {

    public static EscrowEvent created(String chain, long blockNumber, String txHash, Instant timestamp, Escrow escrow) {
        return EscrowEvent.builder()
                .type(EscrowEventType.ESCROW_CREATED)
                .chain(chain)
                .escrowId(escrow.getEscrowId())
                .orderId(escrow.getOrderId())
                .blockNumber(blockNumber)
                .txHash(txHash)
                .timestamp(timestamp)
                .sender(escrow.getSender())
                .receiver(escrow.getReceiver())
                .resolver(escrow.getResolver())
                .amount(escrow.getAmount())
                .secretHash(escrow.getSecretHash())
                .timelock(escrow.getTimelock())
                .asset(escrow.getAsset())
                .startRate(escrow.getStartRate())
                .endRate(escrow.getEndRate())
                .auctionStart(escrow.getAuctionStart())
                .auctionEnd(escrow.getAuctionEnd())
                .pairedEscrowId(escrow.getPairedEscrowId())
                .build();
    }

    public static EscrowEvent withdrawn(String chain, long blockNumber, String txHash, Instant timestamp,
                                        Escrow escrow, String secret, BigInteger executionRate) {
        return EscrowEvent.builder()
                .type(EscrowEventType.ESCROW_WITHDRAWN)
                .chain(chain)
                .escrowId(escrow.getEscrowId())
                .orderId(escrow.getOrderId())
                .blockNumber(blockNumber)
                .txHash(txHash)
                .timestamp(timestamp)
                .receiver(escrow.getReceiver())
                .secret(secret)
                .executionRate(executionRate)
                .build();
    }

    public static EscrowEvent cancelled(String chain, long blockNumber, String txHash, Instant timestamp, Escrow escrow) {
        return EscrowEvent.builder()
                .type(EscrowEventType.ESCROW_CANCELLED)
                .chain(chain)
                .escrowId(escrow.getEscrowId())
                .orderId(escrow.getOrderId())
                .blockNumber(blockNumber)
                .txHash(txHash)
                .timestamp(timestamp)
                .sender(escrow.getSender())
                .refundAmount(escrow.getAmount())
                .build();
    }
}
