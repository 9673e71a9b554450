package lab.relayer.adapter;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
public class LedgerAdapterRouter {

    private final Map<String, LedgerAdapter> adaptersByChain;

    // Immutable routing table built once at startup. Two adapters claiming one chain name is a configuration error.
    public LedgerAdapterRouter(List<LedgerAdapter> adapters) {
        this.adaptersByChain = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        LedgerAdapter::getChainName,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple adapters found for chain: " + left.getChainName());
                        }
                ));
    }

    public LedgerAdapter resolve(String chain) {
        return find(chain)
                .orElseThrow(() -> new IllegalArgumentException("No adapter for chain: " + chain));
    }

    public Optional<LedgerAdapter> find(String chain) {
        return Optional.ofNullable(chain).map(adaptersByChain::get);
    }

    public Collection<LedgerAdapter> all() {
        return adaptersByChain.values();
    }

    public void closeAll() {
        for (LedgerAdapter adapter : adaptersByChain.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("event=adapter.close_failed chain={} reason={}", adapter.getChainName(), e.getMessage());
            }
        }
    }
}
