package lab.relayer.adapter;

import lab.relayer.common.RelayerProperties;
import lab.relayer.ledger.EscrowLedger;
import lab.relayer.ledger.SimulatedChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Builds one simulated chain and adapter per configured chain.
 */
@Configuration
@Slf4j
public class LedgerAdapterConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LedgerAdapterRouter ledgerAdapterRouter(RelayerProperties properties, Clock ledgerClock) {
        List<LedgerAdapter> adapters = properties.getChains().stream()
                .map(chain -> (LedgerAdapter) simulatedAdapter(chain, ledgerClock))
                .toList();
        return new LedgerAdapterRouter(adapters);
    }

    static SimulatedLedgerAdapter simulatedAdapter(RelayerProperties.Chain chain, Clock clock) {
        EscrowLedger ledger = new EscrowLedger(chain.getOwner(), chain.getMinTimelock(), chain.getMaxTimelock(), clock);
        ledger.setResolverAuthorization(chain.getOwner(), chain.getAccount(), true);
        for (String resolver : chain.getAuthorizedResolvers()) {
            ledger.setResolverAuthorization(chain.getOwner(), resolver, true);
        }
        for (RelayerProperties.Funding funding : chain.getFunding()) {
            if (funding.getAmount() != null && funding.getAmount().compareTo(BigInteger.ZERO) > 0) {
                ledger.fund(funding.getAccount(), funding.getAsset(), funding.getAmount());
            }
        }

        SimulatedChain simulatedChain = new SimulatedChain(chain.getName(), ledger, clock);
        simulatedChain.startBlockProducer(chain.getBlockTime());

        LedgerAdapter.ChainSettings settings = new LedgerAdapter.ChainSettings(
                chain.getConfirmations(),
                chain.getBlockTime(),
                chain.getConfirmationTimeout(),
                chain.getMinTimelock(),
                chain.getMaxTimelock()
        );
        log.info("event=adapter.configured chain={} account={} confirmations={} blockTimeMs={}",
                chain.getName(), chain.getAccount(), chain.getConfirmations(), chain.getBlockTime().toMillis());
        return new SimulatedLedgerAdapter(simulatedChain, chain.getAccount(), settings,
                chain.getSubmitRetries(), chain.getRetryBackoff());
    }
}
