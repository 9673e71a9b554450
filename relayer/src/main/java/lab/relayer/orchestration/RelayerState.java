package lab.relayer.orchestration;

import lab.relayer.common.ErrorRecord;
import lab.relayer.domain.order.Order;
import lab.relayer.domain.swap.CrossChainSwap;

import java.util.List;
import java.util.Map;

public record RelayerState(
        boolean running,
        List<String> connectedChains,
        Map<String, Long> lastBlockProcessed,
        List<CrossChainSwap> pendingSwaps,
        List<Order> activeOrders,
        Metrics metrics,
        List<ErrorRecord> errors
) {

    public record Metrics(
            long totalOrders,
            long completedOrders,
            long failedOrders
    ) {}
}
