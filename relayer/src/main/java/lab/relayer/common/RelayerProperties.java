package lab.relayer.common;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Chains the relayer monitors, bound from {@code relayer.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "relayer")
public class RelayerProperties {

    private static final String ADDRESS_REGEX = "^0x[a-fA-F0-9]{40}$";

    private boolean replayFromGenesis = true;

    @Min(1)
    private int workerThreads = 8;

    @Valid
    @NotEmpty
    private List<Chain> chains = new ArrayList<>();

    @Getter
    @Setter
    public static class Chain {

        @NotBlank
        private String name;

        @NotBlank
        @Pattern(regexp = ADDRESS_REGEX)
        private String account;

        @NotBlank
        @Pattern(regexp = ADDRESS_REGEX)
        private String owner;

        @Min(1)
        private int confirmations = 1;

        private Duration blockTime = Duration.ofSeconds(1);

        private Duration confirmationTimeout = Duration.ofSeconds(60);

        private Duration minTimelock = Duration.ofHours(1);

        private Duration maxTimelock = Duration.ofDays(7);

        @Min(1)
        private int submitRetries = 3;

        private Duration retryBackoff = Duration.ofMillis(200);

        // The relayer account is always authorized in addition to these.
        private List<@Pattern(regexp = ADDRESS_REGEX) String> authorizedResolvers = new ArrayList<>();

        @Valid
        private List<Funding> funding = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Funding {

        @NotBlank
        @Pattern(regexp = ADDRESS_REGEX)
        private String account;

        @Pattern(regexp = ADDRESS_REGEX)
        private String asset = "0x0000000000000000000000000000000000000000";

        private BigInteger amount = BigInteger.ZERO;
    }
}
