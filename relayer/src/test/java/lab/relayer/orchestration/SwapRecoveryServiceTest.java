package lab.relayer.orchestration;

import lab.relayer.MutableClock;
import lab.relayer.adapter.LedgerAdapter;
import lab.relayer.adapter.LedgerAdapterRouter;
import lab.relayer.adapter.TransactionRevertedException;
import lab.relayer.adapter.TransientLedgerException;
import lab.relayer.common.ErrorLog;
import lab.relayer.common.ErrorRecord;
import lab.relayer.common.NotificationFeed;
import lab.relayer.common.RelayerNotification;
import lab.relayer.domain.escrow.Escrow;
import lab.relayer.domain.escrow.EscrowErrorCode;
import lab.relayer.domain.escrow.EscrowIds;
import lab.relayer.domain.order.Order;
import lab.relayer.domain.order.OrderStatus;
import lab.relayer.domain.swap.CrossChainSwap;
import lab.relayer.domain.swap.SwapStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SwapRecoveryServiceTest {

    private static final String RELAYER = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";
    private static final String MAKER = "0x6813eb9362372eef6200f3b1dbc3f819671cba69";
    private static final String SRC_ESCROW = EscrowIds.hashSecret("source-leg");
    private static final String DST_ESCROW = EscrowIds.hashSecret("destination-leg");
    private static final Instant T = Instant.parse("2026-01-01T00:00:00Z");

    @Mock LedgerAdapter source;
    @Mock LedgerAdapter destination;

    private final MutableClock clock = new MutableClock(T);
    private final NotificationFeed feed = new NotificationFeed();
    private final List<RelayerNotification> notifications = new CopyOnWriteArrayList<>();
    private final ConfirmationWatcher watcher = new ConfirmationWatcher(2);
    private ErrorLog errorLog;
    private SwapRecoveryService service;

    @BeforeEach
    void setUp() {
        lenient().when(source.getChainName()).thenReturn("etherlink");
        lenient().when(destination.getChainName()).thenReturn("monad");
        lenient().when(source.getAccountAddress()).thenReturn(RELAYER);
        lenient().when(destination.getAccountAddress()).thenReturn(RELAYER);
        lenient().when(destination.getSettings()).thenReturn(new LedgerAdapter.ChainSettings(
                1, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofHours(1), Duration.ofDays(7)));
        errorLog = new ErrorLog(ErrorLog.DEFAULT_CAPACITY, clock);
        feed.subscribe(notifications::add);
        service = new SwapRecoveryService(new LedgerAdapterRouter(List.of(source, destination)), watcher, errorLog, feed);
    }

    @AfterEach
    void tearDown() {
        watcher.shutdown();
    }

    private void awaitConfirmations() {
        assertThat(watcher.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    private CrossChainSwap lockedSwap() {
        CrossChainSwap swap = CrossChainSwap.initiated("X", T);
        swap.recordSourceLeg("etherlink", SRC_ESCROW, MAKER, EscrowIds.hashSecret("abc"), T.plusSeconds(7200), T);
        swap.transitionTo(SwapStatus.SOURCE_LOCKED, T);
        swap.recordDestinationLeg("monad", DST_ESCROW, RELAYER, EscrowIds.hashSecret("abc"), T.plusSeconds(3600), T);
        swap.transitionTo(SwapStatus.DEST_LOCKED, T);
        return swap;
    }

    private static Escrow escrow(String id, String sender, Instant timelock) {
        return Escrow.builder()
                .escrowId(id)
                .sender(sender)
                .receiver(MAKER)
                .amount(BigInteger.TEN)
                .timelock(timelock)
                .auctionStart(T)
                .auctionEnd(T)
                .build();
    }

    @Test
    void expireIfStale_expiresWaitingOrderPastTimelock() {
        Order order = Order.builder()
                .orderId("X")
                .status(OrderStatus.AUCTION_ACTIVE)
                .timelock(T.plusSeconds(60))
                .createdAt(T)
                .updatedAt(T)
                .build();

        assertThat(service.expireIfStale(order, T.plusSeconds(59))).isFalse();
        assertThat(service.expireIfStale(order, T.plusSeconds(60))).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.EXPIRED);
        assertThat(service.expireIfStale(order, T.plusSeconds(61))).isFalse();
    }

    @Test
    void expireIfStale_leavesAcceptedOrderToSwapRecovery() {
        Order order = Order.builder()
                .orderId("X")
                .status(OrderStatus.ACCEPTED)
                .timelock(T)
                .createdAt(T)
                .updatedAt(T)
                .build();

        assertThat(service.expireIfStale(order, T.plusSeconds(3600))).isFalse();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.ACCEPTED);
    }

    @Test
    void recover_beforeDeadline_doesNothing() {
        CrossChainSwap swap = lockedSwap();

        service.recover(swap, null, T.plusSeconds(3599), true);

        assertThat(swap.getStatus()).isEqualTo(SwapStatus.DEST_LOCKED);
        assertThat(notifications).isEmpty();
    }

    @Test
    void recover_cancelsOwnLegAndAnnouncesForeignLeg() {
        CrossChainSwap swap = lockedSwap();
        Instant now = T.plusSeconds(7200);
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(escrow(SRC_ESCROW, MAKER, T.plusSeconds(7200))));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600))));
        LedgerAdapter.PendingTx pending = new LedgerAdapter.PendingTx("monad", "0xbb", 40);
        when(destination.submitCancel(DST_ESCROW)).thenReturn(pending);
        when(destination.waitConfirmed(pending, 1)).thenReturn(new LedgerAdapter.Confirmation("0xbb", 40, 1));

        service.recover(swap, null, now, true);
        awaitConfirmations();
        service.recover(swap, null, now.plusSeconds(5), true);
        awaitConfirmations();

        assertThat(swap.getStatus()).isEqualTo(SwapStatus.RECOVERING);
        assertThat(swap.getRecoveryStartedAt()).isEqualTo(now);
        verify(source, never()).submitCancel(anyString());
        assertThat(notifications).extracting(RelayerNotification::type)
                .containsExactly(RelayerNotification.Type.RECOVERY_STARTED, RelayerNotification.Type.CANCEL_AVAILABLE);
    }

    @Test
    void recover_withoutSubmissions_onlyAnnounces() {
        CrossChainSwap swap = lockedSwap();
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(escrow(SRC_ESCROW, MAKER, T.plusSeconds(7200))));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600))));

        service.recover(swap, null, T.plusSeconds(3600), false);

        assertThat(swap.getStatus()).isEqualTo(SwapStatus.RECOVERING);
        verify(destination, never()).submitCancel(anyString());
    }

    @Test
    void recover_transientCancel_isRetriedOnNextPass() {
        CrossChainSwap swap = lockedSwap();
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(escrow(SRC_ESCROW, MAKER, T.plusSeconds(7200))));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600))));
        when(destination.submitCancel(DST_ESCROW))
                .thenThrow(new TransientLedgerException("monad", "unreachable"))
                .thenReturn(new LedgerAdapter.PendingTx("monad", "0xcc", 41));
        when(destination.waitConfirmed(new LedgerAdapter.PendingTx("monad", "0xcc", 41), 1))
                .thenReturn(new LedgerAdapter.Confirmation("0xcc", 41, 1));

        service.recover(swap, null, T.plusSeconds(3600), true);
        service.recover(swap, null, T.plusSeconds(3610), true);
        awaitConfirmations();

        verify(destination).waitConfirmed(new LedgerAdapter.PendingTx("monad", "0xcc", 41), 1);
        assertThat(errorLog.recent(10)).anySatisfy(record -> assertThat(record.message()).contains("not confirmed yet"));
    }

    @Test
    void recover_completedSwap_isIgnored() {
        CrossChainSwap swap = lockedSwap();
        swap.transitionTo(SwapStatus.COMPLETED, T);

        service.recover(swap, null, T.plusSeconds(10_000), true);

        assertThat(swap.getStatus()).isEqualTo(SwapStatus.COMPLETED);
        assertThat(notifications).isEmpty();
    }

    @Test
    void recover_pendingCancel_isNotSubmittedTwice() throws Exception {
        CrossChainSwap swap = lockedSwap();
        CountDownLatch confirm = new CountDownLatch(1);
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(escrow(SRC_ESCROW, MAKER, T.plusSeconds(7200))));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600))));
        LedgerAdapter.PendingTx pending = new LedgerAdapter.PendingTx("monad", "0xbb", 40);
        when(destination.submitCancel(DST_ESCROW)).thenReturn(pending);
        when(destination.waitConfirmed(pending, 1)).thenAnswer(inv -> {
            confirm.await(10, TimeUnit.SECONDS);
            return new LedgerAdapter.Confirmation("0xbb", 40, 1);
        });

        service.recover(swap, null, T.plusSeconds(3600), true);
        service.recover(swap, null, T.plusSeconds(3605), true);
        confirm.countDown();
        awaitConfirmations();

        verify(destination, times(1)).submitCancel(DST_ESCROW);
    }

    @Test
    void recover_revertedCancelConfirmation_isRecordedAsError() {
        CrossChainSwap swap = lockedSwap();
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.empty());
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600))));
        LedgerAdapter.PendingTx pending = new LedgerAdapter.PendingTx("monad", "0xbb", 40);
        when(destination.submitCancel(DST_ESCROW)).thenReturn(pending);
        when(destination.waitConfirmed(pending, 1)).thenThrow(
                new TransactionRevertedException("monad", "0xbb", EscrowErrorCode.ALREADY_WITHDRAWN, "withdrawn"));

        service.recover(swap, null, T.plusSeconds(3600), true);
        awaitConfirmations();

        assertThat(errorLog.recent(10)).anySatisfy(record -> {
            assertThat(record.level()).isEqualTo(ErrorRecord.Level.ERROR);
            assertThat(record.message()).contains("ALREADY_WITHDRAWN");
        });
    }

    @Test
    void recover_failedSwapIsSettledOnceNoLegIsLocked() {
        CrossChainSwap swap = lockedSwap();
        swap.fail("escrow cancelled", T);
        Order order = Order.builder()
                .orderId("X")
                .status(OrderStatus.CANCELLED)
                .createdAt(T)
                .updatedAt(T)
                .build();
        Escrow sourceLeg = escrow(SRC_ESCROW, MAKER, T.plusSeconds(7200));
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(sourceLeg));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.of(
                escrow(DST_ESCROW, RELAYER, T.plusSeconds(3600)).toBuilder().cancelled(true).build()));

        assertThat(service.recover(swap, order, T.plusSeconds(600), true)).isFalse();
        assertThat(service.recover(swap, order, T.plusSeconds(7200), true)).isFalse();
        assertThat(service.announcedLegCount()).isEqualTo(1);

        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.of(sourceLeg.toBuilder().cancelled(true).build()));

        assertThat(service.recover(swap, order, T.plusSeconds(7300), true)).isTrue();
        assertThat(service.announcedLegCount()).isZero();
        assertThat(swap.getStatus()).isEqualTo(SwapStatus.FAILED);
        verify(destination, never()).submitCancel(anyString());
    }

    @Test
    void recover_failedSwapWithOpenOrder_isNotSettled() {
        CrossChainSwap swap = lockedSwap();
        swap.fail("hash mismatch", T);
        Order order = Order.builder()
                .orderId("X")
                .status(OrderStatus.AUCTION_ACTIVE)
                .createdAt(T)
                .updatedAt(T)
                .build();
        when(source.findEscrow(SRC_ESCROW)).thenReturn(Optional.empty());
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.empty());

        assertThat(service.recover(swap, order, T.plusSeconds(10), true)).isFalse();
    }

    @Test
    void recover_transientLookup_isNotSettled() {
        CrossChainSwap swap = lockedSwap();
        swap.fail("escrow cancelled", T);
        when(source.findEscrow(SRC_ESCROW)).thenThrow(new TransientLedgerException("etherlink", "unreachable"));
        when(destination.findEscrow(DST_ESCROW)).thenReturn(Optional.empty());

        assertThat(service.recover(swap, null, T.plusSeconds(10), true)).isFalse();
    }
}
