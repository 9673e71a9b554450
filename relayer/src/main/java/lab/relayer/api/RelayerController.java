package lab.relayer.api;

import jakarta.validation.Valid;
import lab.relayer.auction.AuctionSnapshot;
import lab.relayer.domain.order.Order;
import lab.relayer.domain.swap.CrossChainSwap;
import lab.relayer.orchestration.OrderIntent;
import lab.relayer.orchestration.RelayerState;
import lab.relayer.orchestration.SwapCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequiredArgsConstructor
@Slf4j
public class RelayerController {

    private final SwapCoordinator coordinator;

    @GetMapping("/health")
    public HealthResponse health() {
        RelayerState state = coordinator.getState();
        return new HealthResponse(
                state.running() ? "UP" : "DOWN",
                state.connectedChains(),
                state.activeOrders().size(),
                state.pendingSwaps().size()
        );
    }

    @GetMapping("/api/state")
    public RelayerState state() {
        return coordinator.getState();
    }

    @GetMapping("/api/orders/{orderId}")
    public Order order(@PathVariable String orderId) {
        return coordinator.getOrder(orderId)
                .orElseThrow(() -> new NoSuchElementException("order not found: " + orderId));
    }

    @GetMapping("/api/orders/{orderId}/auction")
    public AuctionSnapshot auction(@PathVariable String orderId) {
        return coordinator.getAuction(orderId)
                .orElseThrow(() -> new NoSuchElementException("no auction for order: " + orderId));
    }

    @GetMapping("/api/swaps/{orderId}")
    public CrossChainSwap swap(@PathVariable String orderId) {
        return coordinator.getSwap(orderId)
                .orElseThrow(() -> new NoSuchElementException("swap not found: " + orderId));
    }

    @PostMapping("/api/orders")
    public ResponseEntity<Order> register(@Valid @RequestBody OrderIntent intent) {
        log.info("event=api.order_intent orderId={} srcChain={} destChain={}", intent.orderId(), intent.srcChain(), intent.destChain());
        Order order = coordinator.registerOrder(intent);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(order);
    }

    public record HealthResponse(
            String status,
            List<String> connectedChains,
            int activeOrders,
            int pendingSwaps
    ) {}
}
